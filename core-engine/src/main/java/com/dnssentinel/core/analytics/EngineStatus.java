package com.dnssentinel.core.analytics;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of {@link AnalyticsEngine} state, computed on demand.
 *
 * @since 1.0.0
 */
public final class EngineStatus {

    private final boolean trained;
    private final Instant lastTraining;
    private final Instant lastAnalysis;
    private final String status;
    private final List<String> errors;

    EngineStatus(boolean trained, Instant lastTraining, Instant lastAnalysis, String status, List<String> errors) {
        this.trained = trained;
        this.lastTraining = lastTraining;
        this.lastAnalysis = lastAnalysis;
        this.status = status;
        this.errors = List.copyOf(errors);
    }

    public boolean isTrained() {
        return trained;
    }

    /** @return last successful training time, or {@code null} */
    public Instant getLastTraining() {
        return lastTraining;
    }

    /** @return last processing time, or {@code null} */
    public Instant getLastAnalysis() {
        return lastAnalysis;
    }

    /** One of {@code ready}, {@code untrained} or {@code degraded}. */
    public String getStatus() {
        return status;
    }

    /** Most recent processing errors, oldest first. */
    public List<String> getErrors() {
        return errors;
    }

    @Override
    public String toString() {
        return "EngineStatus{status='" + status + "', trained=" + trained + ", lastTraining=" + lastTraining
                + ", lastAnalysis=" + lastAnalysis + ", errors=" + errors.size() + '}';
    }
}
