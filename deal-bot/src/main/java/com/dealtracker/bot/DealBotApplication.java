package com.dealtracker.bot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.EnableConfigurationProperties;

@SpringBootApplication
@EnableConfigurationProperties
public class DealBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(DealBotApplication.class, args);
    }
}
