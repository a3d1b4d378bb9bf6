package com.dealtracker.bot.exception;

/**
 * The messaging sink rejected a message or did not answer in time.
 */
public class DispatchException extends Exception {

    public DispatchException(String message) {
        super(message);
    }

    public DispatchException(String message, Throwable cause) {
        super(message, cause);
    }
}
