package com.dnssentinel.core.config;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * SMTP channel settings ({@code alerts.notifications.email}).
 *
 * @since 1.0.0
 */
public class EmailConfig {

    private boolean enabled;
    private String smtpHost;
    private int smtpPort = 587;
    private String username;
    private String password;
    private String from;
    private List<String> recipients = new ArrayList<>();
    private boolean useTls = true;
    private String timeout = "30s";

    void collectErrors(List<String> errors) {
        if (enabled) {
            if (smtpHost == null || smtpHost.isBlank()) {
                errors.add("notifications.email.smtpHost is required when email is enabled");
            }
            if (from == null || from.isBlank()) {
                errors.add("notifications.email.from is required when email is enabled");
            }
            if (recipients.isEmpty()) {
                errors.add("notifications.email.recipients must not be empty when email is enabled");
            }
        }
        if (smtpPort < 1 || smtpPort > 65535) {
            errors.add("notifications.email.smtpPort out of range: " + smtpPort);
        }
        if (!Durations.isValid(timeout)) {
            errors.add("notifications.email.timeout is not a valid duration: '" + timeout + "'");
        }
    }

    public Duration timeoutDuration() {
        return Durations.parse(timeout);
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getSmtpHost() {
        return smtpHost;
    }

    public void setSmtpHost(String smtpHost) {
        this.smtpHost = smtpHost;
    }

    public int getSmtpPort() {
        return smtpPort;
    }

    public void setSmtpPort(int smtpPort) {
        this.smtpPort = smtpPort;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getPassword() {
        return password;
    }

    public void setPassword(String password) {
        this.password = password;
    }

    public String getFrom() {
        return from;
    }

    public void setFrom(String from) {
        this.from = from;
    }

    public List<String> getRecipients() {
        return recipients;
    }

    public void setRecipients(List<String> recipients) {
        this.recipients = recipients != null ? new ArrayList<>(recipients) : new ArrayList<>();
    }

    public boolean isUseTls() {
        return useTls;
    }

    public void setUseTls(boolean useTls) {
        this.useTls = useTls;
    }

    public String getTimeout() {
        return timeout;
    }

    public void setTimeout(String timeout) {
        this.timeout = timeout;
    }

    @Override
    public String toString() {
        return "EmailConfig{enabled=" + enabled + ", smtpHost='" + smtpHost + "', smtpPort=" + smtpPort
                + ", from='" + from + "', recipients=" + recipients + ", useTls=" + useTls + '}';
    }
}
