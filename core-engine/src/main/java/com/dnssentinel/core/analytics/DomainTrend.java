package com.dnssentinel.core.analytics;

/**
 * Trend of a single domain within a {@link TrendAnalysis}.
 *
 * @since 1.0.0
 */
public final class DomainTrend {

    private final String domain;
    private final TrendDirection direction;
    private final double changePercent;
    private final long queries;
    private final boolean blocked;

    public DomainTrend(String domain, TrendDirection direction, double changePercent, long queries,
                       boolean blocked) {
        this.domain = domain;
        this.direction = direction;
        this.changePercent = changePercent;
        this.queries = queries;
        this.blocked = blocked;
    }

    public String getDomain() {
        return domain;
    }

    public TrendDirection getDirection() {
        return direction;
    }

    /** Endpoint slope relative to the per-bucket mean, in percent. */
    public double getChangePercent() {
        return changePercent;
    }

    public long getQueries() {
        return queries;
    }

    /** {@code true} if any query for the domain was blocked. */
    public boolean isBlocked() {
        return blocked;
    }

    @Override
    public String toString() {
        return String.format("DomainTrend{%s, %s, %.1f%%, queries=%d, blocked=%s}",
                domain, direction, changePercent, queries, blocked);
    }
}
