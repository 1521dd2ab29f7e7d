package com.dnssentinel.core.analytics;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Overall direction of a query-volume series.
 *
 * @since 1.0.0
 */
public enum TrendDirection {

    INCREASING,
    DECREASING,
    STABLE,
    /** Variance dominates any slope. */
    VOLATILE;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
