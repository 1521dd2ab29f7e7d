package com.dnssentinel.core.analytics;

import com.dnssentinel.core.model.Anomaly;

import java.util.ArrayList;
import java.util.List;

/**
 * Derived overview of one {@link AnalyticsResult}: counts, overall direction,
 * a 0-100 health score and recommendations.
 *
 * @since 1.0.0
 */
public final class AnalyticsSummary {

    static final String RECOMMEND_INVESTIGATE = "Investigate detected anomalies";
    static final String RECOMMEND_HIGH_SEVERITY = "Address high-severity anomalies immediately";
    static final String RECOMMEND_CONCERNING = "Network health is concerning - review security settings";
    static final String RECOMMEND_HEALTHY = "Network appears healthy";

    private final int totalAnomalies;
    private final int highSeverityCount;
    private final TrendDirection trendDirection;
    private final double healthScore;
    private final List<String> recommendations;

    public AnalyticsSummary(int totalAnomalies, int highSeverityCount, TrendDirection trendDirection,
                            double healthScore, List<String> recommendations) {
        this.totalAnomalies = totalAnomalies;
        this.highSeverityCount = highSeverityCount;
        this.trendDirection = trendDirection;
        this.healthScore = healthScore;
        this.recommendations = List.copyOf(recommendations);
    }

    /**
     * Summarize detector and analyzer output.
     *
     * @param anomalies detected anomalies
     * @param trend     trend analysis, or {@code null} when it was not computed
     */
    public static AnalyticsSummary of(List<Anomaly> anomalies, TrendAnalysis trend) {
        int total = anomalies.size();
        int high = (int) anomalies.stream().filter(a -> a.getSeverity().isHighOrAbove()).count();
        double score = healthScore(total, high);

        List<String> recommendations = new ArrayList<>();
        if (total > 0) {
            recommendations.add(RECOMMEND_INVESTIGATE);
        }
        if (high > 0) {
            recommendations.add(RECOMMEND_HIGH_SEVERITY);
        }
        if (score < 50) {
            recommendations.add(RECOMMEND_CONCERNING);
        }
        if (recommendations.isEmpty()) {
            recommendations.add(RECOMMEND_HEALTHY);
        }

        TrendDirection direction = trend != null ? trend.getQueryTrend() : TrendDirection.STABLE;
        return new AnalyticsSummary(total, high, direction, score, recommendations);
    }

    /**
     * {@code 100 - 2 * total - 10 * high}, clamped to [0, 100].
     */
    static double healthScore(int totalAnomalies, int highSeverity) {
        return Math.max(0, Math.min(100, 100.0 - 2.0 * totalAnomalies - 10.0 * highSeverity));
    }

    public int getTotalAnomalies() {
        return totalAnomalies;
    }

    public int getHighSeverityCount() {
        return highSeverityCount;
    }

    public TrendDirection getTrendDirection() {
        return trendDirection;
    }

    public double getHealthScore() {
        return healthScore;
    }

    public List<String> getRecommendations() {
        return recommendations;
    }

    @Override
    public String toString() {
        return "AnalyticsSummary{" +
                "totalAnomalies=" + totalAnomalies +
                ", highSeverityCount=" + highSeverityCount +
                ", trendDirection=" + trendDirection +
                ", healthScore=" + healthScore +
                '}';
    }
}
