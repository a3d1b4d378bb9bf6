package com.dealtracker.bot.service;

import com.dealtracker.bot.exception.FetchException;
import com.dealtracker.bot.model.FetchSettings;
import com.dealtracker.bot.model.RawPage;
import com.dealtracker.bot.test.fixtures.RunConfigFixtures;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class HttpPageFetcherTest {

    private static final Instant NOW = Instant.parse("2026-03-05T09:30:00Z");
    private static final String PAGE = "<html><body><div data-component-type=\"s-search-result\"></div></body></html>";

    private final Map<String, String> receivedHeaders = new ConcurrentHashMap<>();
    private final CountDownLatch release = new CountDownLatch(1);
    private final ExecutorService executor = Executors.newCachedThreadPool();

    private HttpServer server;
    private String base;
    private HttpPageFetcher fetcher;

    @BeforeEach
    void setUp() throws IOException {
        server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
        server.createContext("/s", exchange -> {
            receivedHeaders.put("User-Agent", exchange.getRequestHeaders().getFirst("User-Agent"));
            receivedHeaders.put("Accept-Language", exchange.getRequestHeaders().getFirst("Accept-Language"));
            respond(exchange, 200, PAGE);
        });
        server.createContext("/short", exchange -> {
            exchange.getResponseHeaders().add("Location", base + "/s?k=mobiles");
            respond(exchange, 302, "");
        });
        server.createContext("/busy", exchange -> respond(exchange, 503, "Service Unavailable"));
        server.createContext("/slow", exchange -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            respond(exchange, 200, PAGE);
        });
        server.setExecutor(executor);
        server.start();

        base = "http://127.0.0.1:" + server.getAddress().getPort();
        fetcher = fetcherWithTimeout(Duration.ofSeconds(5));
    }

    @AfterEach
    void tearDown() {
        release.countDown();
        server.stop(0);
        executor.shutdownNow();
    }

    private static void respond(HttpExchange exchange, int status, String body) throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.sendResponseHeaders(status, bytes.length == 0 ? -1 : bytes.length);
        try (OutputStream out = exchange.getResponseBody()) {
            out.write(bytes);
        }
    }

    private HttpPageFetcher fetcherWithTimeout(Duration timeout) {
        FetchSettings settings = new FetchSettings(
                RunConfigFixtures.USER_AGENT, RunConfigFixtures.ACCEPT_LANGUAGE, timeout);
        return new HttpPageFetcher(RunConfigFixtures.builder().fetch(settings).build(),
                Clock.fixed(NOW, ZoneOffset.UTC));
    }

    @Test
    void fetch_ok_returnsBodyAndFetchTime() throws FetchException {
        RawPage page = fetcher.fetch(base + "/s?k=mobiles");

        assertThat(new String(page.body(), StandardCharsets.UTF_8)).isEqualTo(PAGE);
        assertThat(page.sourceUrl()).isEqualTo(base + "/s?k=mobiles");
        assertThat(page.fetchedAt()).isEqualTo(NOW);
    }

    @Test
    void fetch_sendsConfiguredHeaders() throws FetchException {
        fetcher.fetch(base + "/s?k=mobiles");

        assertThat(receivedHeaders)
                .containsEntry("User-Agent", RunConfigFixtures.USER_AGENT)
                .containsEntry("Accept-Language", RunConfigFixtures.ACCEPT_LANGUAGE);
    }

    @Test
    void fetch_followsRedirect_andReportsFinalUrl() throws FetchException {
        RawPage page = fetcher.fetch(base + "/short");

        assertThat(page.sourceUrl()).isEqualTo(base + "/s?k=mobiles");
        assertThat(new String(page.body(), StandardCharsets.UTF_8)).isEqualTo(PAGE);
    }

    @Test
    void fetch_serverError_throwsFetchException() {
        assertThatThrownBy(() -> fetcher.fetch(base + "/busy"))
                .isInstanceOf(FetchException.class)
                .hasMessageContaining("HTTP 503");
    }

    @Test
    void fetch_timeout_throwsFetchException() {
        HttpPageFetcher impatient = fetcherWithTimeout(Duration.ofMillis(200));

        assertThatThrownBy(() -> impatient.fetch(base + "/slow"))
                .isInstanceOf(FetchException.class);
    }

    @Test
    void fetch_unreachableHost_throwsFetchException() {
        assertThatThrownBy(() -> fetcher.fetch("http://127.0.0.1:1/s"))
                .isInstanceOf(FetchException.class);
    }
}
