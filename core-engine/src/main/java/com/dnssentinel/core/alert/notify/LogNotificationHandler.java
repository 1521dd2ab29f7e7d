package com.dnssentinel.core.alert.notify;

import com.dnssentinel.core.alert.Alert;
import com.dnssentinel.core.alert.NotificationChannel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Always-on channel that writes alerts to the application log. Info goes to
 * INFO, warning to WARN, error and critical to ERROR.
 *
 * @since 1.0.0
 */
public class LogNotificationHandler implements NotificationHandler {

    static final String LOGGER_NAME = "com.dnssentinel.alerts";

    private static final Logger ALERTS = LoggerFactory.getLogger(LOGGER_NAME);

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.LOG;
    }

    @Override
    public void send(Alert alert) {
        String format = "ALERT [{}] {} - {} (id={}, source={})";
        Object[] args = { alert.getSeverity().code(), alert.getTitle(), alert.getDescription(),
                alert.getId(), alert.getSource() };
        switch (alert.getSeverity()) {
            case INFO -> ALERTS.info(format, args);
            case WARNING -> ALERTS.warn(format, args);
            default -> ALERTS.error(format, args);
        }
    }
}
