package com.dnssentinel.core.analytics;

/**
 * Qualitative impact label of a {@link TrendInsight}.
 */
public enum InsightImpact {
    LOW,
    MEDIUM,
    HIGH
}
