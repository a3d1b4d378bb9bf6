package com.dealtracker.bot.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * One product card as read from a category page.
 *
 * Invariants:
 *  - price is always present and non-negative
 *  - link is absolute (relative hrefs are resolved against the base domain during extraction)
 */
@Value
@Builder
public class ListingCandidate {

    @NonNull String title;
    @NonNull String link;
    @NonNull BigDecimal price;

    /** Strike-through list price; null when the card shows none */
    BigDecimal mrp;

    public Optional<BigDecimal> getMrp() {
        return Optional.ofNullable(mrp);
    }
}
