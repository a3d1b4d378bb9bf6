package com.dealtracker.bot.model;

import java.time.Duration;

/**
 * Bot API endpoint and credentials.
 *
 * @param apiBaseUrl absolute http(s) URL without a trailing slash
 */
public record TelegramSettings(String botToken, String apiBaseUrl, Duration timeout, boolean disableLinkPreview) {

    // keeps the token out of logged RunConfig values
    @Override
    public String toString() {
        return "TelegramSettings[apiBaseUrl=" + apiBaseUrl + ", timeout=" + timeout
                + ", disableLinkPreview=" + disableLinkPreview + "]";
    }
}
