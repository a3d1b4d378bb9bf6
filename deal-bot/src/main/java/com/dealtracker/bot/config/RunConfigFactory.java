package com.dealtracker.bot.config;

import com.dealtracker.bot.exception.ConfigInvalidException;
import com.dealtracker.bot.model.Band;
import com.dealtracker.bot.model.CategoryTarget;
import com.dealtracker.bot.model.FetchSettings;
import com.dealtracker.bot.model.RunConfig;
import com.dealtracker.bot.model.TelegramSettings;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.math.BigDecimal;
import java.net.URI;
import java.net.URISyntaxException;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Validates the bound properties once at startup and freezes them into a RunConfig.
 *
 * Any error aborts context startup, so the polling loop is never created with a bad
 * configuration. All errors are logged together rather than one per restart.
 */
@Configuration
@Slf4j
public class RunConfigFactory {

    static final String DEFAULT_AFFILIATE_TAG = "yourtag-21";
    static final Set<String> PLACEHOLDERS = Set.of("changeme", "your_bot_token", "your_chat_id");

    private static final Pattern WHITESPACE = Pattern.compile("\\s");
    private static final Pattern TRAILING_SLASHES = Pattern.compile("/+$");

    @Bean
    public RunConfig runConfig(DealBotProperties properties) {
        return create(properties);
    }

    public static RunConfig create(DealBotProperties properties) {
        List<String> errors = new ArrayList<>();

        DealBotProperties.Telegram telegram = properties.getTelegram();
        if (isMissing(telegram.getBotToken())) {
            errors.add("Please set a valid TELEGRAM_BOT_TOKEN (deal-bot.telegram.bot-token).");
        } else if (WHITESPACE.matcher(telegram.getBotToken().trim()).find()) {
            errors.add("TELEGRAM_BOT_TOKEN (deal-bot.telegram.bot-token) must not contain whitespace.");
        }
        if (!isHttpUrl(telegram.getApiBaseUrl())) {
            errors.add("deal-bot.telegram.api-base-url must be an absolute http(s) URL.");
        }
        if (isNegativeOrZero(telegram.getTimeout())) {
            errors.add("deal-bot.telegram.timeout must be positive.");
        }
        if (isMissing(telegram.getChatId())) {
            errors.add("Please set TELEGRAM_CHAT_ID (deal-bot.telegram.chat-id) to your chat or channel.");
        }

        Map<String, String> categories = properties.getCategories();
        if (categories == null || categories.isEmpty()) {
            errors.add("No categories defined. Fill deal-bot.categories.");
        } else {
            categories.forEach((name, url) -> {
                if (url == null || url.isBlank()) {
                    errors.add("Category '" + name + "' has no URL.");
                } else if (!isHttpUrl(url)) {
                    errors.add("Category '" + name + "' URL is not an absolute http(s) URL: " + url.trim());
                }
            });
        }

        Band priceBand = band("price", properties.getPrice(), errors);
        Band megaBand = band("mega-discount", properties.getMegaDiscount(), errors);
        if (priceBand != null && priceBand.min().signum() < 0) {
            errors.add("deal-bot.price.min must not be negative.");
        }

        DealBotProperties.Scheduling scheduling = properties.getScheduling();
        if (scheduling.getPollIntervalMinutes() < 1) {
            errors.add("deal-bot.scheduling.poll-interval-minutes must be at least 1.");
        }
        if (properties.getMaxItemsPerCategory() < 1) {
            errors.add("deal-bot.max-items-per-category must be at least 1.");
        }
        if (isNegativeOrZero(scheduling.getTick())) {
            errors.add("deal-bot.scheduling.tick must be positive.");
        }
        if (scheduling.getDispatchPacing() == null || scheduling.getDispatchPacing().isNegative()) {
            errors.add("deal-bot.scheduling.dispatch-pacing must not be negative.");
        }
        if (!isHttpUrl(properties.getBaseDomain())) {
            errors.add("deal-bot.base-domain must be an absolute http(s) URL.");
        }

        ZoneId zone = ZoneId.systemDefault();
        if (properties.getZone() != null && !properties.getZone().isBlank()) {
            try {
                zone = ZoneId.of(properties.getZone().trim());
            } catch (DateTimeException e) {
                errors.add("deal-bot.zone is not a valid time zone: " + properties.getZone());
            }
        }

        DealBotProperties.Fetch fetch = properties.getFetch();
        if (fetch.getUserAgent() == null || fetch.getUserAgent().isBlank()) {
            errors.add("deal-bot.fetch.user-agent must not be blank.");
        }
        if (fetch.getAcceptLanguage() == null || fetch.getAcceptLanguage().isBlank()) {
            errors.add("deal-bot.fetch.accept-language must not be blank.");
        }
        if (isNegativeOrZero(fetch.getTimeout())) {
            errors.add("deal-bot.fetch.timeout must be positive.");
        }

        if (!errors.isEmpty()) {
            errors.forEach(log::error);
            throw new ConfigInvalidException(errors);
        }

        String affiliateTag = properties.getAffiliateTag() == null ? "" : properties.getAffiliateTag().trim();
        if (affiliateTag.isEmpty() || affiliateTag.equals(DEFAULT_AFFILIATE_TAG)) {
            log.warn("Using default affiliate tag. Replace with your own AMAZON_AFFILIATE_TAG.");
            affiliateTag = DEFAULT_AFFILIATE_TAG;
        }

        RunConfig.RunConfigBuilder builder = RunConfig.builder()
                .priceBand(priceBand)
                .megaDiscountBand(megaBand)
                .maxItemsPerCategory(properties.getMaxItemsPerCategory())
                .pollIntervalMinutes(scheduling.getPollIntervalMinutes())
                .tick(scheduling.getTick())
                .dispatchPacing(scheduling.getDispatchPacing())
                .affiliateTag(affiliateTag)
                .baseDomain(properties.getBaseDomain().trim())
                .schedulingEnabled(scheduling.isEnabled())
                .zone(zone)
                .recipient(telegram.getChatId().trim())
                .telegram(new TelegramSettings(
                        telegram.getBotToken().trim(),
                        TRAILING_SLASHES.matcher(telegram.getApiBaseUrl().trim()).replaceAll(""),
                        telegram.getTimeout(),
                        telegram.isDisableLinkPreview()))
                .fetch(new FetchSettings(
                        fetch.getUserAgent().trim(),
                        fetch.getAcceptLanguage().trim(),
                        fetch.getTimeout()));
        categories.forEach((name, url) -> builder.category(new CategoryTarget(name, url.trim())));

        RunConfig config = builder.build();
        log.info("Configuration OK: {} categories, price band {}, mega-discount band {}, every {} min",
                config.getCategories().size(), priceBand, megaBand, config.getPollIntervalMinutes());
        return config;
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private static Band band(String name, DealBotProperties.Range range, List<String> errors) {
        if (range == null || range.getMin() == null || range.getMax() == null) {
            errors.add("deal-bot." + name + ".min and .max are required.");
            return null;
        }
        BigDecimal min = range.getMin();
        BigDecimal max = range.getMax();
        if (min.compareTo(max) > 0) {
            errors.add("deal-bot." + name + ".min (" + min + ") is greater than max (" + max + ").");
            return null;
        }
        return new Band(min, max);
    }

    private static boolean isMissing(String value) {
        return value == null || value.isBlank() || PLACEHOLDERS.contains(value.trim().toLowerCase());
    }

    private static boolean isHttpUrl(String value) {
        if (value == null || value.isBlank()) return false;
        try {
            URI uri = new URI(value.trim());
            return uri.isAbsolute()
                    && ("http".equalsIgnoreCase(uri.getScheme()) || "https".equalsIgnoreCase(uri.getScheme()))
                    && uri.getHost() != null;
        } catch (URISyntaxException e) {
            return false;
        }
    }

    private static boolean isNegativeOrZero(Duration duration) {
        return duration == null || duration.isNegative() || duration.isZero();
    }
}
