package com.dnssentinel.core.config;

import com.dnssentinel.core.alert.AlertRule;
import com.dnssentinel.core.alert.AlertSeverity;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Alert manager settings ({@code alerts:} section of the YAML).
 *
 * <h3>Defaults</h3>
 * <p>
 * Rules without a severity or cooldown inherit {@code defaultSeverity} and
 * {@code defaultCooldown}. {@code alertRetention} is an alias for
 * {@code storage.retention}.
 * </p>
 *
 * <h3>Cooldown</h3>
 * <p>
 * With {@code cooldownEnforced} a rule that fired does not fire again until
 * its cooldown has elapsed. Turning it off only records
 * {@code suppressUntil} on each alert.
 * </p>
 *
 * @since 1.0.0
 */
public class AlertConfig {

    private boolean enabled = true;
    private List<RuleDefinition> rules = new ArrayList<>();
    private StorageConfig storage = new StorageConfig();
    private NotificationConfig notifications = new NotificationConfig();
    private PerformanceConfig performance = new PerformanceConfig();
    private String defaultSeverity = "warning";
    private String defaultCooldown = "5m";
    private int maxActiveAlerts = 100;
    private boolean cooldownEnforced = true;

    /**
     * A config carrying the built-in rule set.
     */
    public static AlertConfig defaults() {
        AlertConfig config = new AlertConfig();
        config.setRules(List.of(
                rule("high-anomaly-count", "High Anomaly Count", "anomaly", "warning", "10m",
                        "Many anomalies detected in one analysis run",
                        new ConditionDefinition("anomaly_count", "gt", 10)),
                rule("critical-health", "Critical Network Health", "security", "critical", "15m",
                        "Network health score dropped below 30",
                        new ConditionDefinition("health_score", "lt", 30)),
                rule("query-volume", "Query Volume Threshold", "threshold", "warning", "10m",
                        "DNS query volume above the expected level",
                        new ConditionDefinition("total_queries", "gt", 10000)),
                rule("unusual-domain-activity", "Unusual Domain Activity", "anomaly", "warning", "15m",
                        "Several unusual domains queried",
                        new ConditionDefinition("anomaly_unusual_domain", "gte", 3)),
                rule("high-severity-anomalies", "High Severity Anomalies", "anomaly", "error", "5m",
                        "High or critical severity anomalies present",
                        new ConditionDefinition("high_severity_anomalies", "gt", 0))));
        return config;
    }

    private static RuleDefinition rule(String id, String name, String type, String severity, String cooldown,
            String description, ConditionDefinition condition) {
        RuleDefinition rule = new RuleDefinition();
        rule.setId(id);
        rule.setName(name);
        rule.setType(type);
        rule.setSeverity(severity);
        rule.setCooldown(cooldown);
        rule.setDescription(description);
        rule.setConditions(List.of(condition));
        rule.setChannels(List.of("log"));
        rule.setTags(List.of(type));
        return rule;
    }

    /**
     * Validate the section, collecting every problem.
     *
     * @throws IllegalStateException if anything is invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        collectErrors(errors);
        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Alert configuration validation failed:\n  - " + String.join("\n  - ", errors));
        }
    }

    void collectErrors(List<String> errors) {
        try {
            AlertSeverity.fromCode(defaultSeverity);
        } catch (IllegalArgumentException e) {
            errors.add("defaultSeverity: " + e.getMessage());
        }
        if (!Durations.isValid(defaultCooldown)) {
            errors.add("defaultCooldown is not a valid duration: '" + defaultCooldown + "'");
        }
        if (maxActiveAlerts < 1) {
            errors.add("maxActiveAlerts must be >= 1, got: " + maxActiveAlerts);
        }
        Set<String> ids = new HashSet<>();
        for (int i = 0; i < rules.size(); i++) {
            RuleDefinition rule = rules.get(i);
            if (rule == null) {
                errors.add("rule at index " + i + " is null");
                continue;
            }
            rule.collectErrors(errors);
            if (rule.getId() != null && !ids.add(rule.getId())) {
                errors.add("duplicate rule id '" + rule.getId() + "'");
            }
        }
        storage.collectErrors(errors);
        notifications.collectErrors(errors);
        performance.collectErrors(errors);
    }

    /**
     * Build runtime rules. Call after {@link #validate()}.
     */
    public List<AlertRule> toRules() {
        AlertSeverity severity = AlertSeverity.fromCode(defaultSeverity);
        Duration cooldown = Durations.parse(defaultCooldown);
        List<AlertRule> result = new ArrayList<>(rules.size());
        rules.forEach(r -> result.add(r.toRule(severity, cooldown)));
        return result;
    }

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public List<RuleDefinition> getRules() {
        return rules;
    }

    public void setRules(List<RuleDefinition> rules) {
        this.rules = rules != null ? new ArrayList<>(rules) : new ArrayList<>();
    }

    public StorageConfig getStorage() {
        return storage;
    }

    public void setStorage(StorageConfig storage) {
        this.storage = storage != null ? storage : new StorageConfig();
    }

    public NotificationConfig getNotifications() {
        return notifications;
    }

    public void setNotifications(NotificationConfig notifications) {
        this.notifications = notifications != null ? notifications : new NotificationConfig();
    }

    public PerformanceConfig getPerformance() {
        return performance;
    }

    public void setPerformance(PerformanceConfig performance) {
        this.performance = performance != null ? performance : new PerformanceConfig();
    }

    public String getDefaultSeverity() {
        return defaultSeverity;
    }

    public void setDefaultSeverity(String defaultSeverity) {
        this.defaultSeverity = defaultSeverity;
    }

    public String getDefaultCooldown() {
        return defaultCooldown;
    }

    public void setDefaultCooldown(String defaultCooldown) {
        this.defaultCooldown = defaultCooldown;
    }

    public int getMaxActiveAlerts() {
        return maxActiveAlerts;
    }

    public void setMaxActiveAlerts(int maxActiveAlerts) {
        this.maxActiveAlerts = maxActiveAlerts;
    }

    public String getAlertRetention() {
        return storage.getRetention();
    }

    public void setAlertRetention(String alertRetention) {
        storage.setRetention(alertRetention);
    }

    public boolean isCooldownEnforced() {
        return cooldownEnforced;
    }

    public void setCooldownEnforced(boolean cooldownEnforced) {
        this.cooldownEnforced = cooldownEnforced;
    }
}
