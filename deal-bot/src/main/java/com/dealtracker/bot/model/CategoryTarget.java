package com.dealtracker.bot.model;

/**
 * One category listing page to poll, e.g. {@code mobiles -> https://amzn.to/...}.
 * Loaded once at startup.
 */
public record CategoryTarget(String name, String sourceUrl) {}
