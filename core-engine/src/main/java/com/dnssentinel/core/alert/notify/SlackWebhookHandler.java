package com.dnssentinel.core.alert.notify;

import com.dnssentinel.core.alert.Alert;
import com.dnssentinel.core.alert.AlertSeverity;
import com.dnssentinel.core.alert.NotificationChannel;
import com.dnssentinel.core.config.SlackConfig;
import com.dnssentinel.core.model.Anomaly;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;

/**
 * Posts alerts to a Slack-compatible incoming webhook.
 *
 * <h3>Payload</h3>
 * <p>
 * One attachment per alert, coloured by severity, with severity, type,
 * source and time fields, plus client, domain and anomaly score fields when
 * present. Any response other than HTTP 200 is a failure.
 * </p>
 *
 * @since 1.0.0
 */
public class SlackWebhookHandler implements NotificationHandler {

    private static final Logger LOG = LoggerFactory.getLogger(SlackWebhookHandler.class);

    private final SlackConfig config;
    private final Duration timeout;
    private final HttpClient httpClient;
    private final ObjectMapper mapper = new ObjectMapper();

    public SlackWebhookHandler(SlackConfig config) {
        this.config = Objects.requireNonNull(config, "SlackConfig must not be null");
        this.timeout = config.timeoutDuration();
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(timeout)
                .build();
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.SLACK;
    }

    @Override
    public void send(Alert alert) throws NotificationException {
        String url = config.getWebhookUrl();
        if (url == null || url.isBlank()) {
            throw new NotificationException(channel(), "webhook URL is not configured");
        }

        String payload;
        try {
            payload = mapper.writeValueAsString(buildPayload(alert));
        } catch (JsonProcessingException e) {
            throw new NotificationException(channel(), "failed to serialize payload", e);
        }

        HttpRequest request;
        try {
            request = HttpRequest.newBuilder(URI.create(url))
                    .timeout(timeout)
                    .header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.ofString(payload, StandardCharsets.UTF_8))
                    .build();
        } catch (IllegalArgumentException e) {
            throw new NotificationException(channel(), "invalid webhook URL: " + url, e);
        }

        try {
            HttpResponse<String> response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
            if (response.statusCode() != 200) {
                throw new NotificationException(channel(),
                        "webhook returned HTTP " + response.statusCode() + ": " + response.body());
            }
            LOG.debug("Slack notification sent for alert {}", alert.getId());
        } catch (IOException e) {
            throw new NotificationException(channel(), "webhook request failed: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new NotificationException(channel(), "interrupted while sending", e);
        }
    }

    ObjectNode buildPayload(Alert alert) {
        ObjectNode root = mapper.createObjectNode();
        root.put("username", config.getUsername());
        root.put("channel", config.getChannel());
        root.put("icon_emoji", config.getIconEmoji());
        root.put("text", "DNS Sentinel alert: " + alert.getTitle());

        ObjectNode attachment = root.putArray("attachments").addObject();
        attachment.put("color", color(alert.getSeverity()));
        attachment.put("title", alert.getTitle());
        attachment.put("text", alert.getDescription());
        attachment.put("ts", alert.getTimestamp().getEpochSecond());

        ArrayNode fields = attachment.putArray("fields");
        field(fields, "Severity", alert.getSeverity().code().toUpperCase(Locale.ROOT), true);
        field(fields, "Type", alert.getType().code(), true);
        field(fields, "Source", alert.getSource(), true);
        field(fields, "Time", alert.getTimestamp().toString(), true);
        if (alert.getClient() != null) {
            field(fields, "Client", alert.getClient(), true);
        }
        if (alert.getDomain() != null) {
            field(fields, "Domain", alert.getDomain(), true);
        }
        Anomaly anomaly = alert.getAnomaly();
        if (anomaly != null) {
            field(fields, "Anomaly Type", anomaly.getType().code(), true);
            field(fields, "Score", String.format(Locale.ROOT, "%.2f", anomaly.getScore()), true);
            field(fields, "Confidence", String.format(Locale.ROOT, "%.0f%%", anomaly.getConfidence() * 100), true);
        }
        return root;
    }

    static String color(AlertSeverity severity) {
        return switch (severity) {
            case INFO -> "#36a64f";
            case WARNING -> "#ffaa00";
            case ERROR -> "#ff0000";
            case CRITICAL -> "#800080";
        };
    }

    private static void field(ArrayNode fields, String title, String value, boolean isShort) {
        ObjectNode node = fields.addObject();
        node.put("title", title);
        node.put("value", value);
        node.put("short", isShort);
    }
}
