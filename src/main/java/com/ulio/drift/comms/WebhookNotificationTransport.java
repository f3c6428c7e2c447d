package com.ulio.drift.comms;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.ulio.drift.exception.NotificationException;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * POSTs each notification as a JSON embed message to a chat webhook.
 */
public class WebhookNotificationTransport implements NotificationTransport {
    private final URI webhookEndpoint;
    private final int timeoutMs;
    private final HttpClient httpClient;
    private final EmbedRenderer renderer;

    public WebhookNotificationTransport(String webhookUrl, int timeoutMs) {
        this.webhookEndpoint = URI.create(normalizeWebhookUrl(webhookUrl));
        this.timeoutMs = Math.max(1, timeoutMs);
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofMillis(this.timeoutMs))
                .build();
        this.renderer = new EmbedRenderer(new ObjectMapper());
    }

    @Override
    public void send(NotificationPayload payload) throws NotificationException {
        String body;
        try {
            body = renderer.render(payload);
        } catch (JsonProcessingException e) {
            throw new NotificationException("Could not render notification for " + payload.getMetric(), e);
        }

        HttpRequest request = HttpRequest.newBuilder(webhookEndpoint)
                .timeout(Duration.ofMillis(timeoutMs))
                .header("Content-Type", "application/json")
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .build();

        HttpResponse<Void> response;
        try {
            response = httpClient.send(request, HttpResponse.BodyHandlers.discarding());
        } catch (IOException e) {
            throw new NotificationException("Webhook request failed: " + safeMessage(e), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException("Interrupted while sending webhook", e);
        }

        int status = response.statusCode();
        if (status < 200 || status >= 300) {
            throw new NotificationException("Webhook returned HTTP " + status);
        }
    }

    private static String normalizeWebhookUrl(String webhookUrl) {
        if (webhookUrl == null) {
            throw new IllegalArgumentException("webhookUrl is null");
        }

        String trimmed = webhookUrl.trim();
        if (trimmed.isEmpty()) {
            throw new IllegalArgumentException("webhookUrl is empty");
        }

        return trimmed;
    }

    private static String safeMessage(Throwable throwable) {
        String message = throwable.getMessage();
        if (message == null || message.isBlank()) {
            return throwable.getClass().getSimpleName();
        }

        String compact = message.replace('\n', ' ').replace('\r', ' ');
        return compact.length() > 240 ? compact.substring(0, 240) : compact;
    }
}
