package com.dealtracker.bot.exception;

public class MarkupException extends Exception {

    public MarkupException(String message, Throwable cause) {
        super(message, cause);
    }
}
