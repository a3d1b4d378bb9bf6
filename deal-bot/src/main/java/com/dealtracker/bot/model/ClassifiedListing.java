package com.dealtracker.bot.model;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;

import java.math.BigDecimal;
import java.util.Optional;

/**
 * A candidate plus the outcome of the price-band and discount-band rules.
 * discountPercent is set if and only if the candidate has a positive MRP.
 */
@Value
@Builder
public class ClassifiedListing {

    @NonNull ListingCandidate candidate;
    boolean megaDeal;
    BigDecimal discountPercent;
    boolean qualifies;

    public Optional<BigDecimal> getDiscountPercent() {
        return Optional.ofNullable(discountPercent);
    }

    public String getTitle() {
        return candidate.getTitle();
    }

    public String getLink() {
        return candidate.getLink();
    }

    public BigDecimal getPrice() {
        return candidate.getPrice();
    }

    public Optional<BigDecimal> getMrp() {
        return candidate.getMrp();
    }
}
