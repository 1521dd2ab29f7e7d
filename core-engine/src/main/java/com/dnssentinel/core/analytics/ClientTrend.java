package com.dnssentinel.core.analytics;

/**
 * Trend of a single client within a {@link TrendAnalysis}.
 *
 * @since 1.0.0
 */
public final class ClientTrend {

    private final String client;
    private final TrendDirection direction;
    private final double changePercent;
    private final long queries;

    public ClientTrend(String client, TrendDirection direction, double changePercent, long queries) {
        this.client = client;
        this.direction = direction;
        this.changePercent = changePercent;
        this.queries = queries;
    }

    public String getClient() {
        return client;
    }

    public TrendDirection getDirection() {
        return direction;
    }

    public double getChangePercent() {
        return changePercent;
    }

    public long getQueries() {
        return queries;
    }

    @Override
    public String toString() {
        return String.format("ClientTrend{%s, %s, %.1f%%, queries=%d}", client, direction, changePercent, queries);
    }
}
