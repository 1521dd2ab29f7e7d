package com.dnssentinel.core.alert.notify;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.dnssentinel.core.alert.Alert;
import com.dnssentinel.core.alert.AlertSeverity;
import com.dnssentinel.core.alert.AlertType;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for {@link LogNotificationHandler}.
 */
class LogNotificationHandlerTest {

    private final LogNotificationHandler handler = new LogNotificationHandler();
    private Logger alertsLogger;
    private ListAppender<ILoggingEvent> appender;

    @BeforeEach
    void setUp() {
        alertsLogger = (Logger) LoggerFactory.getLogger(LogNotificationHandler.LOGGER_NAME);
        appender = new ListAppender<>();
        appender.start();
        alertsLogger.addAppender(appender);
    }

    @AfterEach
    void tearDown() {
        alertsLogger.detachAppender(appender);
    }

    @Test
    @DisplayName("Should log each severity at its matching level")
    void shouldMapSeverityToLevel() {
        handler.send(alert(AlertSeverity.INFO));
        handler.send(alert(AlertSeverity.WARNING));
        handler.send(alert(AlertSeverity.ERROR));
        handler.send(alert(AlertSeverity.CRITICAL));

        assertThat(appender.list).extracting(ILoggingEvent::getLevel)
                .containsExactly(Level.INFO, Level.WARN, Level.ERROR, Level.ERROR);
    }

    @Test
    @DisplayName("Should include severity, title, ID and source in the message")
    void shouldFormatMessage() {
        handler.send(alert(AlertSeverity.WARNING));

        assertThat(appender.list).singleElement()
                .extracting(ILoggingEvent::getFormattedMessage)
                .isEqualTo("ALERT [warning] Query Volume - Too many queries (id=alert_1, source=rule:volume)");
    }

    // ------------------------------------------------------------------
    // Helpers
    // ------------------------------------------------------------------

    private static Alert alert(AlertSeverity severity) {
        return Alert.builder()
                .id("alert_1")
                .type(AlertType.THRESHOLD)
                .severity(severity)
                .title("Query Volume")
                .description("Too many queries")
                .timestamp(Instant.parse("2024-05-01T00:00:00Z"))
                .source("rule:volume")
                .build();
    }
}
