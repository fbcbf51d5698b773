package com.mortalitysentinel.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mortalitysentinel.core.format.AlertJson;
import com.mortalitysentinel.core.format.ChatMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Objects;

/**
 * Posts chat messages to a Google Chat incoming webhook.
 *
 * <p>
 * The payload is the JSON form of {@link ChatMessage}, {@code {"text": ...}}.
 * Any non-2xx response is a delivery failure.
 * </p>
 *
 * @since 1.0.0
 */
public class GoogleChatNotifier {

    private static final Logger LOG = LoggerFactory.getLogger(GoogleChatNotifier.class);

    private final String webhookUrl;
    private final Duration timeout;
    private final HttpClient client;
    private final ObjectMapper mapper = AlertJson.newObjectMapper();

    /**
     * @param webhookUrl webhook URL; {@code null} or blank disables delivery
     * @param timeout    connect and request timeout; must not be {@code null}
     */
    public GoogleChatNotifier(String webhookUrl, Duration timeout) {
        this.webhookUrl = webhookUrl == null ? "" : webhookUrl.trim();
        this.timeout = Objects.requireNonNull(timeout, "timeout must not be null");
        this.client = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    /**
     * @return {@code true} if a webhook URL is configured
     */
    public boolean isConfigured() {
        return !webhookUrl.isEmpty();
    }

    /**
     * Deliver one message.
     *
     * @param message the message; must not be {@code null}
     * @throws AlertDeliveryException if no webhook is configured, the request
     *                                fails or the webhook answers non-2xx
     */
    public void send(ChatMessage message) throws AlertDeliveryException {
        Objects.requireNonNull(message, "message must not be null");
        if (!isConfigured()) {
            throw new AlertDeliveryException("Google Chat webhook URL is not configured");
        }

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(webhookUrl))
                    .timeout(timeout)
                    .header("Content-Type", "application/json; charset=UTF-8")
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(message),
                            StandardCharsets.UTF_8))
                    .build();
        } catch (JsonProcessingException | IllegalArgumentException e) {
            throw new AlertDeliveryException("Cannot build webhook request: " + e.getMessage(), e);
        }

        HttpResponse<String> response;
        try {
            response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new AlertDeliveryException("Webhook request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new AlertDeliveryException("Webhook request interrupted", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new AlertDeliveryException("Webhook responded with HTTP " + status + ": " + response.body());
        }
        LOG.info("Chat message delivered ({} chars)", message.getText().length());
    }
}
