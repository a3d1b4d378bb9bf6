package com.dealtracker.bot.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Raw settings bound from application.yml / environment.
 * Only RunConfigFactory reads these; everything else receives the validated RunConfig.
 */
@Component
@ConfigurationProperties(prefix = "deal-bot")
@Data
public class DealBotProperties {

    private Telegram telegram = new Telegram();
    private Range price = new Range(new BigDecimal("150"), new BigDecimal("1000"));
    private Range megaDiscount = new Range(new BigDecimal("80"), new BigDecimal("95"));
    private Scheduling scheduling = new Scheduling();
    private Fetch fetch = new Fetch();

    private String affiliateTag = "yourtag-21";
    private int maxItemsPerCategory = 12;
    private String baseDomain = "https://www.amazon.in";

    /** Time zone for alert timestamps; blank means the system default */
    private String zone = "";

    /** Category name → listing URL, polled in declaration order */
    private Map<String, String> categories = new LinkedHashMap<>();

    @Data
    public static class Telegram {
        private String botToken = "";
        private String chatId = "";
        private String apiBaseUrl = "https://api.telegram.org";
        private Duration timeout = Duration.ofSeconds(20);
        private boolean disableLinkPreview = false;
    }

    @Data
    public static class Range {
        private BigDecimal min;
        private BigDecimal max;

        public Range() {
        }

        public Range(BigDecimal min, BigDecimal max) {
            this.min = min;
            this.max = max;
        }
    }

    @Data
    public static class Scheduling {
        private boolean enabled = true;
        private int pollIntervalMinutes = 3;
        private Duration tick = Duration.ofSeconds(2);
        private Duration dispatchPacing = Duration.ofMillis(600);
    }

    @Data
    public static class Fetch {
        private String userAgent = "Mozilla/5.0 (X11; Linux x86_64) AppleWebKit/537.36 "
                + "(KHTML, like Gecko) Chrome/117.0 Safari/537.36";
        private String acceptLanguage = "en-IN,en;q=0.9";
        private Duration timeout = Duration.ofSeconds(25);
    }
}
