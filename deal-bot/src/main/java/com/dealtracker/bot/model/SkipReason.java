package com.dealtracker.bot.model;

/**
 * Why a result card produced no listing.
 */
public enum SkipReason {
    MISSING_TITLE_LINK,
    MISSING_PRICE,
    MALFORMED_CARD
}
