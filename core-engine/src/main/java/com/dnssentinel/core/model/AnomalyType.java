package com.dnssentinel.core.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Kinds of anomaly the statistical detector can report.
 *
 * @since 1.0.0
 */
public enum AnomalyType {

    VOLUME_SPIKE("volume_spike"),
    UNUSUAL_DOMAIN("unusual_domain"),
    UNUSUAL_CLIENT("unusual_client"),
    /** Hour-of-day distribution shift. */
    TIME_PATTERN("time_pattern");

    private final String code;

    AnomalyType(String code) {
        this.code = code;
    }

    /**
     * @return the lowercase wire/config code, e.g. {@code volume_spike}
     */
    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Resolve a type from its code (case-insensitive).
     *
     * @throws IllegalArgumentException if the code is unknown
     */
    @JsonCreator
    public static AnomalyType fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (AnomalyType type : values()) {
                if (type.code.equals(normalized)) {
                    return type;
                }
            }
        }
        throw new IllegalArgumentException("Unknown anomaly type: '" + code
                + "'. Supported: volume_spike, unusual_domain, unusual_client, time_pattern");
    }
}
