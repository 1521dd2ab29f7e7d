package com.dnssentinel.core.analytics;

import java.util.Objects;

/**
 * Human-readable observation derived from a {@link TrendAnalysis}.
 *
 * @since 1.0.0
 */
public final class TrendInsight {

    private final InsightType type;
    private final String description;
    private final InsightImpact impact;
    private final double confidence;

    public TrendInsight(InsightType type, String description, InsightImpact impact, double confidence) {
        this.type = Objects.requireNonNull(type, "type must not be null");
        this.description = description;
        this.impact = Objects.requireNonNull(impact, "impact must not be null");
        this.confidence = confidence;
    }

    public InsightType getType() {
        return type;
    }

    public String getDescription() {
        return description;
    }

    public InsightImpact getImpact() {
        return impact;
    }

    public double getConfidence() {
        return confidence;
    }

    @Override
    public String toString() {
        return "TrendInsight{" + type + ", impact=" + impact + ", '" + description + "'}";
    }
}
