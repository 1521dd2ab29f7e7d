package com.dnssentinel.core.alert.notify;

import com.dnssentinel.core.alert.Alert;
import com.dnssentinel.core.alert.NotificationChannel;
import com.dnssentinel.core.config.EmailConfig;
import com.dnssentinel.core.model.Anomaly;
import jakarta.mail.Message;
import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Transport;
import jakarta.mail.internet.AddressException;
import jakarta.mail.internet.InternetAddress;
import jakarta.mail.internet.MimeMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.charset.StandardCharsets;
import java.util.Date;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Properties;

/**
 * Sends alerts as plain-text mail over SMTP.
 *
 * <p>
 * Subject format: {@code [DNS Sentinel Alert] SEVERITY - title}. The host,
 * sender and at least one recipient must be configured; otherwise every send
 * fails without touching the network.
 * </p>
 *
 * @since 1.0.0
 */
public class EmailNotificationHandler implements NotificationHandler {

    private static final Logger LOG = LoggerFactory.getLogger(EmailNotificationHandler.class);

    static final String SUBJECT_PREFIX = "[DNS Sentinel Alert]";

    private final EmailConfig config;

    public EmailNotificationHandler(EmailConfig config) {
        this.config = Objects.requireNonNull(config, "EmailConfig must not be null");
    }

    @Override
    public NotificationChannel channel() {
        return NotificationChannel.EMAIL;
    }

    @Override
    public void send(Alert alert) throws NotificationException {
        validate();
        try {
            MimeMessage message = new MimeMessage(session());
            message.setFrom(new InternetAddress(config.getFrom()));
            for (String recipient : config.getRecipients()) {
                message.addRecipient(Message.RecipientType.TO, new InternetAddress(recipient));
            }
            message.setSubject(subject(alert), StandardCharsets.UTF_8.name());
            message.setText(formatBody(alert), StandardCharsets.UTF_8.name());
            message.setSentDate(Date.from(alert.getTimestamp()));

            if (config.getUsername() != null && !config.getUsername().isBlank()) {
                Transport.send(message, config.getUsername(), config.getPassword());
            } else {
                Transport.send(message);
            }
            LOG.debug("Email notification sent for alert {} to {} recipient(s)",
                    alert.getId(), config.getRecipients().size());
        } catch (AddressException e) {
            throw new NotificationException(channel(), "invalid address: " + e.getMessage(), e);
        } catch (MessagingException e) {
            throw new NotificationException(channel(), "SMTP delivery failed: " + e.getMessage(), e);
        }
    }

    private void validate() throws NotificationException {
        if (config.getSmtpHost() == null || config.getSmtpHost().isBlank()) {
            throw new NotificationException(channel(), "SMTP host is not configured");
        }
        if (config.getFrom() == null || config.getFrom().isBlank()) {
            throw new NotificationException(channel(), "sender address is not configured");
        }
        if (config.getRecipients().isEmpty()) {
            throw new NotificationException(channel(), "no recipients configured");
        }
    }

    private Session session() {
        String timeoutMillis = Long.toString(config.timeoutDuration().toMillis());
        Properties props = new Properties();
        props.put("mail.smtp.host", config.getSmtpHost());
        props.put("mail.smtp.port", Integer.toString(config.getSmtpPort()));
        props.put("mail.smtp.auth", Boolean.toString(config.getUsername() != null && !config.getUsername().isBlank()));
        props.put("mail.smtp.starttls.enable", Boolean.toString(config.isUseTls()));
        props.put("mail.smtp.connectiontimeout", timeoutMillis);
        props.put("mail.smtp.timeout", timeoutMillis);
        props.put("mail.smtp.writetimeout", timeoutMillis);
        return Session.getInstance(props);
    }

    static String subject(Alert alert) {
        return SUBJECT_PREFIX + " " + alert.getSeverity().code().toUpperCase(Locale.ROOT) + " - " + alert.getTitle();
    }

    static String formatBody(Alert alert) {
        StringBuilder body = new StringBuilder();
        body.append("DNS Sentinel Alert\n")
                .append("==================\n\n")
                .append("Title:       ").append(alert.getTitle()).append('\n')
                .append("Severity:    ").append(alert.getSeverity().code().toUpperCase(Locale.ROOT)).append('\n')
                .append("Type:        ").append(alert.getType().code()).append('\n')
                .append("Source:      ").append(alert.getSource()).append('\n')
                .append("Time:        ").append(alert.getTimestamp()).append('\n')
                .append("Alert ID:    ").append(alert.getId()).append('\n');
        if (alert.getClient() != null) {
            body.append("Client:      ").append(alert.getClient()).append('\n');
        }
        if (alert.getDomain() != null) {
            body.append("Domain:      ").append(alert.getDomain()).append('\n');
        }
        body.append("\nDescription:\n").append(alert.getDescription()).append('\n');

        Anomaly anomaly = alert.getAnomaly();
        if (anomaly != null) {
            body.append("\nAnomaly Details:\n")
                    .append("  Type:       ").append(anomaly.getType().code()).append('\n')
                    .append("  Score:      ").append(String.format(Locale.ROOT, "%.2f", anomaly.getScore())).append('\n')
                    .append("  Confidence: ")
                    .append(String.format(Locale.ROOT, "%.0f%%", anomaly.getConfidence() * 100)).append('\n');
        }
        if (!alert.getMetadata().isEmpty()) {
            body.append("\nMetadata:\n");
            for (Map.Entry<String, Object> entry : alert.getMetadata().entrySet()) {
                body.append("  ").append(entry.getKey()).append(": ").append(entry.getValue()).append('\n');
            }
        }
        if (!alert.getTags().isEmpty()) {
            body.append("\nTags: ").append(String.join(", ", alert.getTags())).append('\n');
        }
        return body.toString();
    }
}
