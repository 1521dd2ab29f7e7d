package com.dnssentinel.core.alert.notify;

import com.dnssentinel.core.alert.Alert;
import com.dnssentinel.core.alert.AlertSeverity;
import com.dnssentinel.core.alert.AlertType;
import com.dnssentinel.core.alert.NotificationChannel;
import com.dnssentinel.core.config.NotificationConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the channel registry from configuration: one handler per enabled
 * channel plus the always-on log channel.
 *
 * @since 1.0.0
 */
public final class NotificationHandlers {

    private static final Logger LOG = LoggerFactory.getLogger(NotificationHandlers.class);

    private NotificationHandlers() {
    }

    public static Map<NotificationChannel, NotificationHandler> createAll(NotificationConfig config) {
        Objects.requireNonNull(config, "NotificationConfig must not be null");
        Map<NotificationChannel, NotificationHandler> handlers = new EnumMap<>(NotificationChannel.class);
        handlers.put(NotificationChannel.LOG, new LogNotificationHandler());
        if (config.getSlack().isEnabled()) {
            handlers.put(NotificationChannel.SLACK, new SlackWebhookHandler(config.getSlack()));
        }
        if (config.getEmail().isEnabled()) {
            handlers.put(NotificationChannel.EMAIL, new EmailNotificationHandler(config.getEmail()));
        }
        LOG.info("Notification channels: {}", handlers.keySet());
        return handlers;
    }

    /**
     * Synthetic alert used by {@link NotificationHandler#testConnectivity()}.
     */
    public static Alert testAlert(NotificationChannel channel) {
        Instant now = Instant.now();
        return Alert.builder()
                .id("test_" + now.toEpochMilli())
                .type(AlertType.CONFIGURATION)
                .severity(AlertSeverity.INFO)
                .title("Test Notification")
                .description("Connectivity test for the " + channel.code() + " channel")
                .timestamp(now)
                .source("test")
                .tag("test")
                .build();
    }
}
