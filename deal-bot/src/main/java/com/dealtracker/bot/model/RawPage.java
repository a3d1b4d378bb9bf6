package com.dealtracker.bot.model;

import java.time.Instant;

/**
 * Undecoded response body of one category fetch.
 * Lives only until extraction has run; never stored.
 */
public record RawPage(String sourceUrl, byte[] body, Instant fetchedAt) {}
