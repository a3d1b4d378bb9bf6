package com.dealtracker.bot.output;

import com.dealtracker.bot.exception.DispatchException;

public interface MessageSink {

    /**
     * Deliver one plain-text message. Blocks until accepted, rejected or timed out.
     *
     * @param recipient chat or channel identifier
     * @throws DispatchException if the sink rejects the message or does not answer in time
     */
    void deliver(String recipient, String text) throws DispatchException;
}
