package com.dealtracker.bot.service;

import com.dealtracker.bot.exception.FetchException;
import com.dealtracker.bot.model.RawPage;

public interface PageFetcher {

    /**
     * Fetch one category page. Blocks until the response arrives or the request times out.
     *
     * @throws FetchException on network errors, timeouts and non-2xx responses
     */
    RawPage fetch(String url) throws FetchException;
}
