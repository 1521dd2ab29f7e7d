package com.dnssentinel.core.alert;

import java.io.Serializable;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * An alerting rule: when every condition holds, an alert of the rule's type
 * and severity fires on the rule's channels.
 *
 * <h3>Identity</h3>
 * <p>
 * Rules are identified by {@link #getId()}; updating a rule with an existing
 * ID replaces it.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertRule implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String id;
    private final String name;
    private final String description;
    private final boolean enabled;
    private final AlertType type;
    private final AlertSeverity severity;
    private final List<AlertCondition> conditions;
    private final Duration cooldown;
    private final List<NotificationChannel> channels;
    private final List<String> tags;

    private AlertRule(Builder b) {
        this.id = Objects.requireNonNull(b.id, "id must not be null");
        this.name = b.name != null ? b.name : b.id;
        this.description = b.description != null ? b.description : "";
        this.enabled = b.enabled;
        this.type = Objects.requireNonNull(b.type, "type must not be null");
        this.severity = Objects.requireNonNull(b.severity, "severity must not be null");
        this.conditions = List.copyOf(b.conditions);
        this.cooldown = b.cooldown != null ? b.cooldown : Duration.ZERO;
        this.channels = List.copyOf(b.channels);
        this.tags = List.copyOf(b.tags);
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return a builder pre-populated with this rule's values
     */
    public Builder toBuilder() {
        return new Builder()
                .id(id)
                .name(name)
                .description(description)
                .enabled(enabled)
                .type(type)
                .severity(severity)
                .conditions(conditions)
                .cooldown(cooldown)
                .channels(channels)
                .tags(tags);
    }

    // ---------------------------------------------------------------
    // Getters
    // ---------------------------------------------------------------

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public String getDescription() {
        return description;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public AlertType getType() {
        return type;
    }

    public AlertSeverity getSeverity() {
        return severity;
    }

    /** AND-combined conditions. */
    public List<AlertCondition> getConditions() {
        return conditions;
    }

    /** Zero when the rule has no cooldown. */
    public Duration getCooldown() {
        return cooldown;
    }

    /** Delivery channels in dispatch order; empty means log only. */
    public List<NotificationChannel> getChannels() {
        return channels;
    }

    public List<String> getTags() {
        return tags;
    }

    // ---------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------

    /**
     * Fluent builder for {@link AlertRule}. {@code id}, {@code type} and
     * {@code severity} are required; {@code enabled} defaults to
     * {@code true}.
     */
    public static class Builder {
        private String id;
        private String name;
        private String description;
        private boolean enabled = true;
        private AlertType type;
        private AlertSeverity severity;
        private List<AlertCondition> conditions = new ArrayList<>();
        private Duration cooldown;
        private List<NotificationChannel> channels = new ArrayList<>();
        private List<String> tags = new ArrayList<>();

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder type(AlertType type) {
            this.type = type;
            return this;
        }

        public Builder severity(AlertSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder conditions(List<AlertCondition> conditions) {
            this.conditions = new ArrayList<>(conditions);
            return this;
        }

        public Builder condition(AlertCondition condition) {
            this.conditions.add(condition);
            return this;
        }

        public Builder cooldown(Duration cooldown) {
            this.cooldown = cooldown;
            return this;
        }

        public Builder channels(List<NotificationChannel> channels) {
            this.channels = new ArrayList<>(channels);
            return this;
        }

        public Builder tags(List<String> tags) {
            this.tags = new ArrayList<>(tags);
            return this;
        }

        public AlertRule build() {
            return new AlertRule(this);
        }
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertRule that))
            return false;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return id.hashCode();
    }

    @Override
    public String toString() {
        return "AlertRule{" +
                "id='" + id + '\'' +
                ", name='" + name + '\'' +
                ", enabled=" + enabled +
                ", type=" + type +
                ", severity=" + severity +
                ", conditions=" + conditions +
                ", cooldown=" + cooldown +
                ", channels=" + channels +
                '}';
    }
}
