package com.dealtracker.bot.service;

import org.springframework.stereotype.Component;

import java.math.BigDecimal;
import java.util.Optional;
import java.util.regex.Pattern;

/**
 * Converts localised price text to a number.
 *
 * Examples:
 *  "₹1,234.00" → 1234.00
 *  "1,29,900"  → 129900
 *  "₹1.299.00" → 1299.00   (repeated points: only the last one is the decimal point)
 *  "Free"      → empty
 *  "1E+5", "-5" → empty      (only plain digits with an optional decimal point)
 */
@Component
public class PriceNormalizer {

    private static final Pattern CURRENCY_SYMBOLS = Pattern.compile("\\p{Sc}");
    private static final Pattern SEPARATORS_AND_SPACE = Pattern.compile("[,\\s\\u00A0\\u202F]");
    private static final Pattern PLAIN_DECIMAL = Pattern.compile("\\d+(\\.\\d*)?|\\.\\d+");

    public Optional<BigDecimal> normalize(String text) {
        if (text == null || text.isBlank()) return Optional.empty();

        String cleaned = CURRENCY_SYMBOLS.matcher(text).replaceAll("");
        cleaned = SEPARATORS_AND_SPACE.matcher(cleaned).replaceAll("");

        int lastPoint = cleaned.lastIndexOf('.');
        if (lastPoint != cleaned.indexOf('.')) {
            String integerPart = cleaned.substring(0, lastPoint).replace(".", "");
            cleaned = integerPart + "." + cleaned.substring(lastPoint + 1);
        }

        if (!PLAIN_DECIMAL.matcher(cleaned).matches()) return Optional.empty();

        return Optional.of(new BigDecimal(cleaned));
    }
}
