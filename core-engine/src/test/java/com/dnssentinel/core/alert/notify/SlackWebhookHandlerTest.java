package com.dnssentinel.core.alert.notify;

import com.dnssentinel.core.alert.Alert;
import com.dnssentinel.core.alert.AlertSeverity;
import com.dnssentinel.core.alert.AlertType;
import com.dnssentinel.core.alert.NotificationChannel;
import com.dnssentinel.core.config.SlackConfig;
import com.dnssentinel.core.model.Anomaly;
import com.dnssentinel.core.model.AnomalySeverity;
import com.dnssentinel.core.model.AnomalyType;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.sun.net.httpserver.HttpServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link SlackWebhookHandler}.
 */
class SlackWebhookHandlerTest {

    private HttpServer server;
    private final AtomicReference<String> received = new AtomicReference<>();

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.stop(0);
        }
    }

    @Test
    @DisplayName("Should post the payload and succeed on HTTP 200")
    void shouldPostToWebhook() throws Exception {
        SlackWebhookHandler handler = new SlackWebhookHandler(config(startServer(200)));

        handler.send(alert(null));

        JsonNode body = new ObjectMapper().readTree(received.get());
        assertThat(body.get("username").asText()).isEqualTo("DNS-Sentinel");
        assertThat(body.get("channel").asText()).isEqualTo("#alerts");
        assertThat(body.at("/attachments/0/color").asText()).isEqualTo("#ff0000");
        assertThat(body.at("/attachments/0/title").asText()).isEqualTo("Unusual Domain");
    }

    @Test
    @DisplayName("Should fail on a non-200 response")
    void shouldFailOnErrorStatus() throws IOException {
        SlackWebhookHandler handler = new SlackWebhookHandler(config(startServer(500)));

        assertThatThrownBy(() -> handler.send(alert(null)))
                .hasMessageContaining("HTTP 500")
                .isInstanceOfSatisfying(NotificationException.class,
                        e -> assertThat(e.getChannel()).isEqualTo(NotificationChannel.SLACK));
    }

    @Test
    @DisplayName("Should fail without a webhook URL")
    void shouldFailWithoutUrl() {
        SlackWebhookHandler handler = new SlackWebhookHandler(config(" "));

        assertThatThrownBy(() -> handler.send(alert(null)))
                .isInstanceOf(NotificationException.class)
                .hasMessageContaining("webhook URL is not configured");
    }

    @Test
    @DisplayName("Should add client, domain and anomaly fields when present")
    void shouldIncludeOptionalFields() {
        SlackWebhookHandler handler = new SlackWebhookHandler(config("http://localhost/hook"));
        Anomaly anomaly = Anomaly.builder()
                .id("unusual_domain-1")
                .type(AnomalyType.UNUSUAL_DOMAIN)
                .severity(AnomalySeverity.HIGH)
                .score(3.456)
                .confidence(0.82)
                .timestamp(Instant.parse("2024-05-01T00:00:00Z"))
                .description("new domain")
                .build();

        JsonNode fields = handler.buildPayload(alert(anomaly)).at("/attachments/0/fields");

        List<String> titles = new ArrayList<>();
        fields.forEach(f -> titles.add(f.get("title").asText()));
        assertThat(titles).containsExactly("Severity", "Type", "Source", "Time", "Client", "Domain",
                        "Anomaly Type", "Score", "Confidence");
        assertThat(fields.get(7).get("value").asText()).isEqualTo("3.46");
        assertThat(fields.get(8).get("value").asText()).isEqualTo("82%");
    }

    @Test
    @DisplayName("Should color attachments by severity")
    void shouldColorBySeverity() {
        assertThat(SlackWebhookHandler.color(AlertSeverity.INFO)).isEqualTo("#36a64f");
        assertThat(SlackWebhookHandler.color(AlertSeverity.WARNING)).isEqualTo("#ffaa00");
        assertThat(SlackWebhookHandler.color(AlertSeverity.CRITICAL)).isEqualTo("#800080");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private String startServer(int status) throws IOException {
        server = HttpServer.create(new InetSocketAddress("localhost", 0), 0);
        server.createContext("/hook", exchange -> {
            received.set(new String(exchange.getRequestBody().readAllBytes(), StandardCharsets.UTF_8));
            byte[] body = (status == 200 ? "ok" : "error").getBytes(StandardCharsets.UTF_8);
            exchange.sendResponseHeaders(status, body.length);
            try (OutputStream os = exchange.getResponseBody()) {
                os.write(body);
            }
        });
        server.start();
        return "http://localhost:" + server.getAddress().getPort() + "/hook";
    }

    private static SlackConfig config(String url) {
        SlackConfig config = new SlackConfig();
        config.setEnabled(true);
        config.setWebhookUrl(url);
        config.setTimeout("5s");
        return config;
    }

    private static Alert alert(Anomaly anomaly) {
        return Alert.builder()
                .id("alert_1")
                .type(AlertType.ANOMALY)
                .severity(AlertSeverity.ERROR)
                .title("Unusual Domain")
                .description("First time seen")
                .timestamp(Instant.parse("2024-05-01T00:00:00Z"))
                .source("ml-engine")
                .client("10.0.0.5")
                .domain("odd.example")
                .anomaly(anomaly)
                .build();
    }
}
