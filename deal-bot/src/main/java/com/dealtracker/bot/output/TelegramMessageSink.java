package com.dealtracker.bot.output;

import com.dealtracker.bot.exception.DispatchException;
import com.dealtracker.bot.model.RunConfig;
import com.dealtracker.bot.model.TelegramSettings;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Sends plain-text messages through the Telegram Bot API.
 *
 * POST {apiBaseUrl}/bot{token}/sendMessage  {"chat_id": "...", "text": "..."}
 *
 * Telegram answers {"ok": true, "result": {...}} on success and
 * {"ok": false, "error_code": 429, "description": "..."} on rejection.
 * No retry here: a rejected message is dropped for this pass.
 */
@Component
@Slf4j
public class TelegramMessageSink implements MessageSink {

    private final ObjectMapper objectMapper;
    private final TelegramSettings settings;

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();

    public TelegramMessageSink(ObjectMapper objectMapper, RunConfig config) {
        this.objectMapper = objectMapper;
        this.settings = config.getTelegram();
    }

    @Override
    public void deliver(String recipient, String text) throws DispatchException {
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(sendMessageUrl()))
                .timeout(settings.timeout())
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(requestBody(recipient, text)))
                .build();

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            checkResponse(response.statusCode(), response.body());
            log.debug("Delivered message to {} ({} chars)", recipient, text.length());

        } catch (IOException e) {
            throw new DispatchException("Telegram sendMessage failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DispatchException("Telegram sendMessage interrupted", e);
        }
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    String sendMessageUrl() {
        return settings.apiBaseUrl() + "/bot" + settings.botToken() + "/sendMessage";
    }

    String requestBody(String recipient, String text) throws DispatchException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("chat_id", recipient);
        body.put("text", text);
        body.put("disable_web_page_preview", settings.disableLinkPreview());
        try {
            return objectMapper.writeValueAsString(body);
        } catch (JsonProcessingException e) {
            throw new DispatchException("Could not encode Telegram request: " + e.getMessage(), e);
        }
    }

    void checkResponse(int status, String body) throws DispatchException {
        JsonNode root = null;
        try {
            root = body == null || body.isBlank() ? null : objectMapper.readTree(body);
        } catch (JsonProcessingException e) {
            log.debug("Telegram returned a non-JSON body (HTTP {})", status);
        }

        boolean ok = root != null && root.path("ok").asBoolean(false);
        if (status >= 200 && status < 300 && ok) {
            return;
        }

        String description = root != null && root.hasNonNull("description")
                ? root.get("description").asText()
                : "no description";
        throw new DispatchException("Telegram rejected message (HTTP " + status + "): " + description);
    }
}
