package com.dnssentinel.core.analytics;

/**
 * Kinds of {@link TrendInsight}. {@link #SEASONAL_PATTERN} is reserved and not
 * produced yet.
 */
public enum InsightType {
    PEAK_USAGE,
    OFF_PEAK_USAGE,
    WEEKEND_PATTERN,
    SEASONAL_PATTERN,
    ANOMALOUS_CLIENT,
    EMERGING_THREAT
}
