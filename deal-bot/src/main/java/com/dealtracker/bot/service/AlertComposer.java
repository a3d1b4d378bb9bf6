package com.dealtracker.bot.service;

import com.dealtracker.bot.model.ClassifiedListing;
import com.dealtracker.bot.model.RunConfig;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Renders a qualifying listing as a plain-text chat message.
 *
 * Mega deals get the loud template with MRP and discount; everything else gets the
 * per-category template. Every link carries the affiliate tag.
 */
@Component
@RequiredArgsConstructor
public class AlertComposer {

    static final String MEGA_HEADER = "🚨🚨 MEGA DEAL ALERT 🚨🚨";
    static final String MEGA_CTA = "CTA: Hurry! Limited stock!";
    static final String STANDARD_CTA = "CTA: Grab it before it’s gone!";

    private static final DateTimeFormatter TIMESTAMP =
            DateTimeFormatter.ofPattern("dd-MMM-yyyy HH:mm", Locale.ENGLISH);

    private final Clock clock;

    public String compose(ClassifiedListing listing, String categoryName, RunConfig config) {
        String timestamp = LocalDateTime.now(clock).format(TIMESTAMP);
        String link = affiliate(listing.getLink(), config.getAffiliateTag());
        Optional<BigDecimal> mrp = listing.getMrp();

        if (listing.isMegaDeal() && mrp.isPresent()) {
            BigDecimal discount = listing.getDiscountPercent().orElse(BigDecimal.ZERO);
            return String.join("\n", List.of(
                    MEGA_HEADER,
                    "Category: " + categoryName,
                    "Title: " + listing.getTitle(),
                    "MRP: ₹" + wholeRupees(mrp.get()),
                    "Offer Price: ₹" + roundedRupees(listing.getPrice()),
                    "Discount: " + discount.setScale(1, RoundingMode.HALF_EVEN).toPlainString() + "% OFF",
                    "Time: " + timestamp,
                    MEGA_CTA,
                    "Link: " + link));
        }

        String mrpSuffix = mrp.map(m -> " (MRP: ₹" + wholeRupees(m) + ")").orElse("");
        return String.join("\n", List.of(
                "📢 " + categoryName.toUpperCase(Locale.ROOT) + " Deal (" + timestamp + ")",
                "Title: " + listing.getTitle(),
                "Price: ₹" + roundedRupees(listing.getPrice()) + mrpSuffix,
                STANDARD_CTA,
                "Link: " + link));
    }

    /**
     * Append {@code tag=<affiliateTag>} to a product link.
     *
     * affiliate("https://x.test/p", "tagA")       → "https://x.test/p?tag=tagA"
     * affiliate("https://x.test/p?ref=1", "tagA") → "https://x.test/p?ref=1&tag=tagA"
     */
    public static String affiliate(String url, String affiliateTag) {
        String separator = url.contains("?") ? "&" : "?";
        return url + separator + "tag=" + affiliateTag;
    }

    // MRP is shown truncated, prices and the discount are rounded half-to-even
    private static String wholeRupees(BigDecimal value) {
        return value.setScale(0, RoundingMode.DOWN).toPlainString();
    }

    private static String roundedRupees(BigDecimal value) {
        return value.setScale(0, RoundingMode.HALF_EVEN).toPlainString();
    }
}
