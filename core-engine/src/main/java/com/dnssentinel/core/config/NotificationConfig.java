package com.dnssentinel.core.config;

import java.util.List;

/**
 * Per-channel notification settings ({@code alerts.notifications}). The log
 * channel needs no settings and is always on.
 *
 * @since 1.0.0
 */
public class NotificationConfig {

    private SlackConfig slack = new SlackConfig();
    private EmailConfig email = new EmailConfig();

    void collectErrors(List<String> errors) {
        slack.collectErrors(errors);
        email.collectErrors(errors);
    }

    public SlackConfig getSlack() {
        return slack;
    }

    public void setSlack(SlackConfig slack) {
        this.slack = slack != null ? slack : new SlackConfig();
    }

    public EmailConfig getEmail() {
        return email;
    }

    public void setEmail(EmailConfig email) {
        this.email = email != null ? email : new EmailConfig();
    }
}
