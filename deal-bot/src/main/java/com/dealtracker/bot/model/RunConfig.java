package com.dealtracker.bot.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Singular;
import lombok.Value;

import java.time.Duration;
import java.time.ZoneId;
import java.util.List;

/**
 * Validated, immutable settings for the whole process lifetime.
 * Built once by RunConfigFactory and passed explicitly into every pipeline call.
 */
@Value
@Builder
public class RunConfig {

    // ── Classification ──────────────────────────────────────────────────────
    @NonNull Band priceBand;
    @NonNull Band megaDiscountBand;
    int maxItemsPerCategory;

    // ── Scheduling ──────────────────────────────────────────────────────────
    boolean schedulingEnabled;
    int pollIntervalMinutes;
    @NonNull Duration tick;
    @NonNull Duration dispatchPacing;

    /** Zone for alert timestamps */
    @NonNull ZoneId zone;

    // ── Links & delivery ────────────────────────────────────────────────────
    @NonNull String affiliateTag;
    @NonNull String baseDomain;
    @NonNull String recipient;
    @NonNull TelegramSettings telegram;

    // ── Fetching ────────────────────────────────────────────────────────────
    @NonNull FetchSettings fetch;

    /** In configured order; passes visit categories in exactly this order */
    @Singular List<CategoryTarget> categories;

    public Duration getPollInterval() {
        return Duration.ofMinutes(pollIntervalMinutes);
    }
}
