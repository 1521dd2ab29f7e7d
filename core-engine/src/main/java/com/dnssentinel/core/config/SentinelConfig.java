package com.dnssentinel.core.config;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the YAML configuration.
 *
 * <pre>
 * analytics:
 *   ...
 * alerts:
 *   ...
 * </pre>
 *
 * @since 1.0.0
 */
public class SentinelConfig {

    private AnalyticsConfig analytics = new AnalyticsConfig();
    private AlertConfig alerts = new AlertConfig();

    /**
     * @throws IllegalStateException listing every invalid value in both sections
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        try {
            analytics.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
        try {
            alerts.validate();
        } catch (IllegalStateException e) {
            errors.add(e.getMessage());
        }
        if (!errors.isEmpty()) {
            throw new IllegalStateException(String.join("\n", errors));
        }
    }

    public AnalyticsConfig getAnalytics() {
        return analytics;
    }

    public void setAnalytics(AnalyticsConfig analytics) {
        this.analytics = analytics != null ? analytics : new AnalyticsConfig();
    }

    public AlertConfig getAlerts() {
        return alerts;
    }

    public void setAlerts(AlertConfig alerts) {
        this.alerts = alerts != null ? alerts : new AlertConfig();
    }
}
