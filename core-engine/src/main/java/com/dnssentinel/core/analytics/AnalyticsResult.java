package com.dnssentinel.core.analytics;

import com.dnssentinel.core.model.Anomaly;

import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Output of one {@link AnalyticsEngine#process(List)} call, consumed by the
 * alert manager.
 *
 * @since 1.0.0
 */
public final class AnalyticsResult {

    private final List<Anomaly> anomalies;
    private final TrendAnalysis trendAnalysis;
    private final TrendPrediction prediction;
    private final Instant processedAt;
    private final AnalyticsSummary summary;

    public AnalyticsResult(List<Anomaly> anomalies, TrendAnalysis trendAnalysis, TrendPrediction prediction,
                           Instant processedAt, AnalyticsSummary summary) {
        this.anomalies = List.copyOf(anomalies);
        this.trendAnalysis = trendAnalysis;
        this.prediction = prediction;
        this.processedAt = Objects.requireNonNull(processedAt, "processedAt must not be null");
        this.summary = Objects.requireNonNull(summary, "summary must not be null");
    }

    /**
     * Result carrying only anomalies, with the summary derived from them.
     */
    public static AnalyticsResult ofAnomalies(List<Anomaly> anomalies, Instant processedAt) {
        return new AnalyticsResult(anomalies, null, null, processedAt, AnalyticsSummary.of(anomalies, null));
    }

    public List<Anomaly> getAnomalies() {
        return anomalies;
    }

    public Optional<TrendAnalysis> getTrendAnalysis() {
        return Optional.ofNullable(trendAnalysis);
    }

    public Optional<TrendPrediction> getPrediction() {
        return Optional.ofNullable(prediction);
    }

    public Instant getProcessedAt() {
        return processedAt;
    }

    public AnalyticsSummary getSummary() {
        return summary;
    }

    @Override
    public String toString() {
        return "AnalyticsResult{anomalies=" + anomalies.size() + ", summary=" + summary
                + ", processedAt=" + processedAt + '}';
    }
}
