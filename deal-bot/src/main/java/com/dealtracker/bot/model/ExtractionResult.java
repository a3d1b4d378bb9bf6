package com.dealtracker.bot.model;

/**
 * Per-card extraction outcome: exactly one of candidate or skipReason is set.
 */
public record ExtractionResult(ListingCandidate candidate, SkipReason skipReason) {

    public static ExtractionResult accepted(ListingCandidate candidate) {
        return new ExtractionResult(candidate, null);
    }

    public static ExtractionResult skipped(SkipReason reason) {
        return new ExtractionResult(null, reason);
    }

    public boolean isAccepted() {
        return candidate != null;
    }
}
