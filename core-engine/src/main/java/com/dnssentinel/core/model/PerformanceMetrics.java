package com.dnssentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

/**
 * Optional resolver performance sub-record of a {@link MetricsSnapshot}.
 *
 * @since 1.0.0
 */
public final class PerformanceMetrics implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Mean response time in milliseconds. */
    private final double averageResponseTime;
    private final double queriesPerSecond;
    private final long slowQueries;

    @JsonCreator
    public PerformanceMetrics(@JsonProperty("averageResponseTime") double averageResponseTime,
                              @JsonProperty("queriesPerSecond") double queriesPerSecond,
                              @JsonProperty("slowQueries") long slowQueries) {
        this.averageResponseTime = averageResponseTime;
        this.queriesPerSecond = queriesPerSecond;
        this.slowQueries = slowQueries;
    }

    public double getAverageResponseTime() {
        return averageResponseTime;
    }

    public double getQueriesPerSecond() {
        return queriesPerSecond;
    }

    public long getSlowQueries() {
        return slowQueries;
    }

    @Override
    public String toString() {
        return "PerformanceMetrics{" +
                "averageResponseTime=" + averageResponseTime +
                ", queriesPerSecond=" + queriesPerSecond +
                ", slowQueries=" + slowQueries +
                '}';
    }
}
