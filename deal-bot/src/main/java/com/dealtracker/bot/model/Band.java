package com.dealtracker.bot.model;

import java.math.BigDecimal;
import java.util.Objects;

/**
 * Inclusive numeric range used for the price band and the mega-discount band.
 */
public record Band(BigDecimal min, BigDecimal max) {

    public Band {
        Objects.requireNonNull(min, "min");
        Objects.requireNonNull(max, "max");
        if (min.compareTo(max) > 0) {
            throw new IllegalArgumentException("Band min " + min + " is greater than max " + max);
        }
    }

    public static Band of(double min, double max) {
        return new Band(BigDecimal.valueOf(min), BigDecimal.valueOf(max));
    }

    public boolean contains(BigDecimal value) {
        return value != null && value.compareTo(min) >= 0 && value.compareTo(max) <= 0;
    }

    @Override
    public String toString() {
        return "[" + min.toPlainString() + ", " + max.toPlainString() + "]";
    }
}
