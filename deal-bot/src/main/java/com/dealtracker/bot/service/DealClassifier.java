package com.dealtracker.bot.service;

import com.dealtracker.bot.model.ClassifiedListing;
import com.dealtracker.bot.model.ListingCandidate;
import com.dealtracker.bot.model.RunConfig;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.MathContext;

/**
 * Applies the price-band and mega-discount rules to a candidate.
 *
 * A listing qualifies if its price is inside the price band OR it is a mega deal;
 * mega-deal status ignores the price band entirely.
 */
@Component
public class DealClassifier {

    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    public ClassifiedListing classify(ListingCandidate candidate, RunConfig config) {
        BigDecimal price = candidate.getPrice();

        BigDecimal discount = candidate.getMrp()
                .filter(mrp -> mrp.signum() > 0)
                .map(mrp -> discountPercent(mrp, price))
                .orElse(null);

        boolean megaDeal = discount != null && config.getMegaDiscountBand().contains(discount);
        boolean qualifies = config.getPriceBand().contains(price) || megaDeal;

        return ClassifiedListing.builder()
                .candidate(candidate)
                .discountPercent(discount)
                .megaDeal(megaDeal)
                .qualifies(qualifies)
                .build();
    }

    static BigDecimal discountPercent(BigDecimal mrp, BigDecimal price) {
        return mrp.subtract(price)
                .multiply(HUNDRED)
                .divide(mrp, MathContext.DECIMAL64);
    }
}
