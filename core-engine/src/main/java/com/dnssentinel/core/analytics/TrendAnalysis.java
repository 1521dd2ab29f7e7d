package com.dnssentinel.core.analytics;

import java.time.DayOfWeek;
import java.time.Duration;
import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Result of {@link TrendAnalyzer#analyzeTrends}. Produced fresh on every call.
 *
 * <p>
 * {@link #getHourlyPattern()} always has 24 keys (0..23) and
 * {@link #getDailyPattern()} all seven days; each distribution sums to ~1.
 * </p>
 *
 * @since 1.0.0
 */
public final class TrendAnalysis {

    private final Duration timeWindow;
    private final long totalQueries;
    private final TrendDirection queryTrend;
    private final List<DomainTrend> domainTrends;
    private final List<ClientTrend> clientTrends;
    private final Map<Integer, Double> hourlyPattern;
    private final Map<DayOfWeek, Double> dailyPattern;
    private final List<TrendInsight> insights;
    private final Instant analyzedAt;

    public TrendAnalysis(Duration timeWindow, long totalQueries, TrendDirection queryTrend,
                         List<DomainTrend> domainTrends, List<ClientTrend> clientTrends,
                         Map<Integer, Double> hourlyPattern, Map<DayOfWeek, Double> dailyPattern,
                         List<TrendInsight> insights, Instant analyzedAt) {
        this.timeWindow = timeWindow;
        this.totalQueries = totalQueries;
        this.queryTrend = queryTrend;
        this.domainTrends = List.copyOf(domainTrends);
        this.clientTrends = List.copyOf(clientTrends);
        this.hourlyPattern = Collections.unmodifiableMap(new TreeMap<>(hourlyPattern));
        this.dailyPattern = Collections.unmodifiableMap(dailyPattern.isEmpty()
                ? new EnumMap<>(DayOfWeek.class) : new EnumMap<>(dailyPattern));
        this.insights = List.copyOf(insights);
        this.analyzedAt = analyzedAt;
    }

    public Duration getTimeWindow() {
        return timeWindow;
    }

    public long getTotalQueries() {
        return totalQueries;
    }

    public TrendDirection getQueryTrend() {
        return queryTrend;
    }

    /** At most 20 entries, by query count descending. */
    public List<DomainTrend> getDomainTrends() {
        return domainTrends;
    }

    /** At most 15 entries, by query count descending. */
    public List<ClientTrend> getClientTrends() {
        return clientTrends;
    }

    public Map<Integer, Double> getHourlyPattern() {
        return hourlyPattern;
    }

    public Map<DayOfWeek, Double> getDailyPattern() {
        return dailyPattern;
    }

    public List<TrendInsight> getInsights() {
        return insights;
    }

    public Instant getAnalyzedAt() {
        return analyzedAt;
    }

    @Override
    public String toString() {
        return "TrendAnalysis{" +
                "timeWindow=" + timeWindow +
                ", totalQueries=" + totalQueries +
                ", queryTrend=" + queryTrend +
                ", domainTrends=" + domainTrends.size() +
                ", clientTrends=" + clientTrends.size() +
                ", insights=" + insights.size() +
                '}';
    }
}
