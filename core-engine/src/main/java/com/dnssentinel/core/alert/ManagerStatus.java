package com.dnssentinel.core.alert;

import java.time.Instant;

/**
 * Live view of {@link AlertManager} state. Recomputed on every request.
 *
 * @since 1.0.0
 */
public final class ManagerStatus {

    private final boolean running;
    private final int activeAlerts;
    private final int totalAlerts;
    private final int rulesCount;
    private final Instant lastEvaluation;
    private final long errorCount;
    private final ManagerHealth health;

    public ManagerStatus(boolean running, int activeAlerts, int totalAlerts, int rulesCount,
                         Instant lastEvaluation, long errorCount, ManagerHealth health) {
        this.running = running;
        this.activeAlerts = activeAlerts;
        this.totalAlerts = totalAlerts;
        this.rulesCount = rulesCount;
        this.lastEvaluation = lastEvaluation;
        this.errorCount = errorCount;
        this.health = health;
    }

    public boolean isRunning() {
        return running;
    }

    public int getActiveAlerts() {
        return activeAlerts;
    }

    public int getTotalAlerts() {
        return totalAlerts;
    }

    public int getRulesCount() {
        return rulesCount;
    }

    /** @return time of the last processing call, or {@code null} */
    public Instant getLastEvaluation() {
        return lastEvaluation;
    }

    public long getErrorCount() {
        return errorCount;
    }

    public ManagerHealth getHealth() {
        return health;
    }

    @Override
    public String toString() {
        return "ManagerStatus{" +
                "running=" + running +
                ", activeAlerts=" + activeAlerts +
                ", totalAlerts=" + totalAlerts +
                ", rulesCount=" + rulesCount +
                ", lastEvaluation=" + lastEvaluation +
                ", errorCount=" + errorCount +
                ", health=" + health +
                '}';
    }
}
