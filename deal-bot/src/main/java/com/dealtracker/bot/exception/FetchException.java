package com.dealtracker.bot.exception;

/**
 * A category page could not be fetched (network error, timeout or non-2xx status).
 */
public class FetchException extends Exception {

    public FetchException(String message) {
        super(message);
    }

    public FetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
