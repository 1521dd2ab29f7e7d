package com.dnssentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;
import java.util.Optional;

/**
 * Severity tiers of an {@link Anomaly}, ordered from least to most severe.
 *
 * <h3>Z-score breakpoints</h3>
 * <table>
 * <caption>minimum z-score per tier</caption>
 * <tr><td>{@link #CRITICAL}</td><td>5</td></tr>
 * <tr><td>{@link #HIGH}</td><td>3</td></tr>
 * <tr><td>{@link #MEDIUM}</td><td>2</td></tr>
 * <tr><td>{@link #LOW}</td><td>1</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public enum AnomalySeverity {

    LOW("low", 1.0),
    MEDIUM("medium", 2.0),
    HIGH("high", 3.0),
    CRITICAL("critical", 5.0);

    private final String code;
    private final double minZScore;

    AnomalySeverity(String code, double minZScore) {
        this.code = code;
        this.minZScore = minZScore;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * @return {@code true} for {@link #HIGH} and {@link #CRITICAL}
     */
    public boolean isHighOrAbove() {
        return compareTo(HIGH) >= 0;
    }

    /**
     * Classify a z-score.
     *
     * @param zScore standardized deviation
     * @return the highest tier whose breakpoint is reached, or empty when
     *         {@code zScore < 1} (not reportable)
     */
    public static Optional<AnomalySeverity> fromZScore(double zScore) {
        AnomalySeverity[] tiers = values();
        for (int i = tiers.length - 1; i >= 0; i--) {
            if (zScore >= tiers[i].minZScore) {
                return Optional.of(tiers[i]);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static AnomalySeverity fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (AnomalySeverity severity : values()) {
                if (severity.code.equals(normalized)) {
                    return severity;
                }
            }
        }
        throw new IllegalArgumentException("Unknown anomaly severity: '" + code + "'");
    }
}
