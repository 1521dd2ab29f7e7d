package com.dnssentinel.core.config;

import com.dnssentinel.core.alert.AlertRule;
import com.dnssentinel.core.alert.AlertSeverity;
import com.dnssentinel.core.alert.AlertType;
import com.dnssentinel.core.alert.NotificationChannel;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * YAML form of an {@link AlertRule}.
 *
 * <pre>
 * - id: query-volume
 *   name: Query Volume Threshold
 *   type: threshold
 *   severity: warning
 *   cooldown: 10m
 *   channels: [log, slack]
 *   conditions:
 *     - field: total_queries
 *       operator: gt
 *       value: 1000
 * </pre>
 *
 * <p>
 * {@code severity} and {@code cooldown} may be omitted; {@link #toRule}
 * then applies the section defaults.
 * </p>
 *
 * @since 1.0.0
 */
public class RuleDefinition {

    private String id;
    private String name;
    private String description;
    private boolean enabled = true;
    private String type;
    private String severity;
    private List<ConditionDefinition> conditions = new ArrayList<>();
    private String cooldown;
    private List<String> channels = new ArrayList<>();
    private List<String> tags = new ArrayList<>();

    /**
     * Validate this rule, throwing on the first batch of problems.
     *
     * @throws IllegalStateException if the rule is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        collectErrors(errors);
        if (!errors.isEmpty()) {
            throw new IllegalStateException("Invalid rule '" + id + "':\n  - " + String.join("\n  - ", errors));
        }
    }

    void collectErrors(List<String> errors) {
        String prefix = "rule '" + id + "'";
        if (id == null || id.isBlank()) {
            errors.add("rule id is required");
        }
        if (name == null || name.isBlank()) {
            errors.add(prefix + ": name is required");
        }
        try {
            AlertType.fromCode(type);
        } catch (IllegalArgumentException e) {
            errors.add(prefix + ": " + e.getMessage());
        }
        if (severity != null) {
            try {
                AlertSeverity.fromCode(severity);
            } catch (IllegalArgumentException e) {
                errors.add(prefix + ": " + e.getMessage());
            }
        }
        if (conditions.isEmpty()) {
            errors.add(prefix + ": at least one condition is required");
        }
        for (int i = 0; i < conditions.size(); i++) {
            conditions.get(i).collectErrors(prefix + " condition[" + i + "]", errors);
        }
        if (cooldown != null && !Durations.isValid(cooldown)) {
            errors.add(prefix + ": cooldown is not a valid duration: '" + cooldown + "'");
        }
        for (String channel : channels) {
            try {
                NotificationChannel.fromCode(channel);
            } catch (IllegalArgumentException e) {
                errors.add(prefix + ": " + e.getMessage());
            }
        }
    }

    /**
     * Convert to the runtime rule.
     *
     * @param defaultSeverity used when no severity is given
     * @param defaultCooldown used when no cooldown is given
     */
    public AlertRule toRule(AlertSeverity defaultSeverity, Duration defaultCooldown) {
        List<NotificationChannel> resolvedChannels = new ArrayList<>();
        channels.forEach(c -> resolvedChannels.add(NotificationChannel.fromCode(c)));
        AlertRule.Builder builder = AlertRule.builder()
                .id(id)
                .name(name)
                .description(description)
                .enabled(enabled)
                .type(AlertType.fromCode(type))
                .severity(severity != null ? AlertSeverity.fromCode(severity) : defaultSeverity)
                .cooldown(cooldown != null ? Durations.parse(cooldown) : defaultCooldown)
                .channels(resolvedChannels)
                .tags(tags);
        conditions.forEach(c -> builder.condition(c.toCondition()));
        return builder.build();
    }

    public String getId() {
        return id;
    }

    public void setId(String id) {
        this.id = id;
    }

    public String getName() {
        return name;
    }

    public void setName(String name) {
        this.name = name;
    }

    public String getDescription() {
        return description;
    }

    public void setDescription(String description) {
        this.description = description;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getType() {
        return type;
    }

    public void setType(String type) {
        this.type = type;
    }

    public String getSeverity() {
        return severity;
    }

    public void setSeverity(String severity) {
        this.severity = severity;
    }

    public List<ConditionDefinition> getConditions() {
        return conditions;
    }

    public void setConditions(List<ConditionDefinition> conditions) {
        this.conditions = conditions != null ? new ArrayList<>(conditions) : new ArrayList<>();
    }

    public String getCooldown() {
        return cooldown;
    }

    public void setCooldown(String cooldown) {
        this.cooldown = cooldown;
    }

    public List<String> getChannels() {
        return channels;
    }

    public void setChannels(List<String> channels) {
        this.channels = channels != null ? new ArrayList<>(channels) : new ArrayList<>();
    }

    public List<String> getTags() {
        return tags;
    }

    public void setTags(List<String> tags) {
        this.tags = tags != null ? new ArrayList<>(tags) : new ArrayList<>();
    }
}
