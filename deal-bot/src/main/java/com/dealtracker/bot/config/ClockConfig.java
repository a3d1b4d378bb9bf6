package com.dealtracker.bot.config;

import com.dealtracker.bot.model.RunConfig;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

@Configuration
public class ClockConfig {

    @Bean
    public Clock clock(RunConfig runConfig) {
        return Clock.system(runConfig.getZone());
    }
}
