package com.dealtracker.bot.service;

import com.dealtracker.bot.exception.FetchException;
import com.dealtracker.bot.model.FetchSettings;
import com.dealtracker.bot.model.RawPage;
import com.dealtracker.bot.model.RunConfig;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Clock;
import java.time.Duration;

/**
 * Fetches category pages over HTTP(S) with browser-like headers.
 *
 * Redirects are always followed: configured category URLs are often short links
 * (amzn.to/...) that bounce to the real listing page.
 */
@Service
@Slf4j
public class HttpPageFetcher implements PageFetcher {

    private final FetchSettings settings;
    private final Clock clock;

    private final HttpClient httpClient;

    public HttpPageFetcher(RunConfig config, Clock clock) {
        this.settings = config.getFetch();
        this.clock = clock;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .followRedirects(HttpClient.Redirect.ALWAYS)
                .build();
    }

    @Override
    public RawPage fetch(String url) throws FetchException {
        log.debug("Fetching category page: {}", url);

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder()
                    .uri(URI.create(url))
                    .timeout(settings.timeout())
                    .header("User-Agent", settings.userAgent())
                    .header("Accept-Language", settings.acceptLanguage())
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new FetchException("Invalid category URL " + url + ": " + e.getMessage(), e);
        }

        try {
            HttpResponse<byte[]> response = httpClient.send(request, HttpResponse.BodyHandlers.ofByteArray());

            int status = response.statusCode();
            if (status < 200 || status >= 300) {
                throw new FetchException("GET " + url + " returned HTTP " + status);
            }

            log.debug("Fetched {} bytes from {}", response.body().length, response.uri());
            return new RawPage(response.uri().toString(), response.body(), clock.instant());

        } catch (IOException e) {
            throw new FetchException("GET " + url + " failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException("GET " + url + " interrupted", e);
        }
    }
}
