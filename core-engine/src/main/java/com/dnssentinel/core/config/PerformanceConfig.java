package com.dnssentinel.core.config;

import java.time.Duration;
import java.util.List;

/**
 * Throughput knobs ({@code alerts.performance}).
 *
 * <p>
 * Notifications for one alert are dispatched sequentially, so
 * {@code maxConcurrentNotifications} and {@code batchSize} are validated and
 * carried but do not change dispatch.
 * </p>
 *
 * @since 1.0.0
 */
public class PerformanceConfig {

    private int maxConcurrentNotifications = 5;
    private String notificationTimeout = "30s";
    private int batchSize = 10;
    private String evaluationInterval = "30s";

    void collectErrors(List<String> errors) {
        if (maxConcurrentNotifications < 1) {
            errors.add("performance.maxConcurrentNotifications must be >= 1");
        }
        if (batchSize < 1) {
            errors.add("performance.batchSize must be >= 1");
        }
        if (!Durations.isValid(notificationTimeout)) {
            errors.add("performance.notificationTimeout is not a valid duration: '" + notificationTimeout + "'");
        }
        if (!Durations.isValid(evaluationInterval) || Durations.parse(evaluationInterval).isZero()) {
            errors.add("performance.evaluationInterval must be a positive duration, got: '"
                    + evaluationInterval + "'");
        }
    }

    public Duration notificationTimeoutDuration() {
        return Durations.parse(notificationTimeout);
    }

    public Duration evaluationIntervalDuration() {
        return Durations.parse(evaluationInterval);
    }

    public int getMaxConcurrentNotifications() {
        return maxConcurrentNotifications;
    }

    public void setMaxConcurrentNotifications(int maxConcurrentNotifications) {
        this.maxConcurrentNotifications = maxConcurrentNotifications;
    }

    public String getNotificationTimeout() {
        return notificationTimeout;
    }

    public void setNotificationTimeout(String notificationTimeout) {
        this.notificationTimeout = notificationTimeout;
    }

    public int getBatchSize() {
        return batchSize;
    }

    public void setBatchSize(int batchSize) {
        this.batchSize = batchSize;
    }

    public String getEvaluationInterval() {
        return evaluationInterval;
    }

    public void setEvaluationInterval(String evaluationInterval) {
        this.evaluationInterval = evaluationInterval;
    }
}
