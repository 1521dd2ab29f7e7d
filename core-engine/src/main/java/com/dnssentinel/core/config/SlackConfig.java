package com.dnssentinel.core.config;

import java.time.Duration;
import java.util.List;

/**
 * Chat-webhook channel settings ({@code alerts.notifications.slack}).
 *
 * @since 1.0.0
 */
public class SlackConfig {

    private boolean enabled;
    private String webhookUrl;
    private String channel = "#alerts";
    private String username = "DNS-Sentinel";
    private String iconEmoji = ":warning:";
    private String timeout = "30s";

    void collectErrors(List<String> errors) {
        if (enabled && (webhookUrl == null || webhookUrl.isBlank())) {
            errors.add("notifications.slack.webhookUrl is required when slack is enabled");
        }
        if (!Durations.isValid(timeout)) {
            errors.add("notifications.slack.timeout is not a valid duration: '" + timeout + "'");
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

    public String getWebhookUrl() {
        return webhookUrl;
    }

    public void setWebhookUrl(String webhookUrl) {
        this.webhookUrl = webhookUrl;
    }

    public String getChannel() {
        return channel;
    }

    public void setChannel(String channel) {
        this.channel = channel;
    }

    public String getUsername() {
        return username;
    }

    public void setUsername(String username) {
        this.username = username;
    }

    public String getIconEmoji() {
        return iconEmoji;
    }

    public void setIconEmoji(String iconEmoji) {
        this.iconEmoji = iconEmoji;
    }

    public String getTimeout() {
        return timeout;
    }

    public void setTimeout(String timeout) {
        this.timeout = timeout;
    }
}
