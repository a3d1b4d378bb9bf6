package com.dealtracker.bot.exception;

import java.util.List;

/**
 * Startup configuration is unusable. Thrown before the polling loop exists.
 */
public class ConfigInvalidException extends RuntimeException {

    private final List<String> errors;

    public ConfigInvalidException(List<String> errors) {
        super("Invalid configuration: " + String.join("; ", errors));
        this.errors = List.copyOf(errors);
    }

    public List<String> getErrors() {
        return errors;
    }
}
