package com.dnssentinel.core.analytics;

import java.time.Instant;

/**
 * One forecast interval: predicted query count with a confidence band.
 *
 * @since 1.0.0
 */
public final class QueryForecast {

    private final Instant timestamp;
    private final long predictedCount;
    private final double lowerBound;
    private final double upperBound;

    public QueryForecast(Instant timestamp, long predictedCount, double lowerBound, double upperBound) {
        this.timestamp = timestamp;
        this.predictedCount = predictedCount;
        this.lowerBound = lowerBound;
        this.upperBound = upperBound;
    }

    public Instant getTimestamp() {
        return timestamp;
    }

    public long getPredictedCount() {
        return predictedCount;
    }

    public double getLowerBound() {
        return lowerBound;
    }

    public double getUpperBound() {
        return upperBound;
    }

    @Override
    public String toString() {
        return String.format("QueryForecast{%s, %d [%.1f, %.1f]}", timestamp, predictedCount, lowerBound, upperBound);
    }
}
