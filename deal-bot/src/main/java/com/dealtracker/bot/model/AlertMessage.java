package com.dealtracker.bot.model;

/**
 * Rendered alert text, held only between composition and dispatch.
 */
public record AlertMessage(String text, String categoryName, ClassifiedListing listing) {}
