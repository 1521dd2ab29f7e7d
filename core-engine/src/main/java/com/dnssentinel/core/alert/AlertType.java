package com.dnssentinel.core.alert;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Category of an {@link Alert}.
 *
 * @since 1.0.0
 */
public enum AlertType {

    ANOMALY("anomaly"),
    THRESHOLD("threshold"),
    CONNECTIVITY("connectivity"),
    PERFORMANCE("performance"),
    SECURITY("security"),
    CONFIGURATION("configuration");

    private final String code;

    AlertType(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * @throws IllegalArgumentException if {@code code} is unknown
     */
    @JsonCreator
    public static AlertType fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (AlertType value : values()) {
                if (value.code.equals(normalized)) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Unknown alert type: '" + code + "'");
    }
}
