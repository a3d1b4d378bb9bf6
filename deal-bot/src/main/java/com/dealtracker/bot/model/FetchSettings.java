package com.dealtracker.bot.model;

import java.time.Duration;

/**
 * Request headers and timeout for category page fetches.
 */
public record FetchSettings(String userAgent, String acceptLanguage, Duration timeout) {}
