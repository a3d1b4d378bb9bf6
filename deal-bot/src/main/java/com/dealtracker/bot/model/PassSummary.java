package com.dealtracker.bot.model;

import java.time.Instant;

/**
 * Outcome of one sweep over all configured categories.
 */
public record PassSummary(
        Instant startedAt,
        Instant completedAt,
        int categoriesVisited,
        int categoriesFailed,
        int alertsComposed,
        int alertsSent,
        int alertsFailed) {}
