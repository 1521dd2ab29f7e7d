package com.dnssentinel.core.alert;

import com.dnssentinel.core.model.AnomalySeverity;
import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Severity of an {@link Alert}, from least to most severe.
 *
 * @since 1.0.0
 */
public enum AlertSeverity {

    INFO("info"),
    WARNING("warning"),
    ERROR("error"),
    CRITICAL("critical");

    private final String code;

    AlertSeverity(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * Map an anomaly's severity: low to info, medium to warning, high to
     * error, critical to critical.
     */
    public static AlertSeverity fromAnomalySeverity(AnomalySeverity severity) {
        return switch (severity) {
            case LOW -> INFO;
            case MEDIUM -> WARNING;
            case HIGH -> ERROR;
            case CRITICAL -> CRITICAL;
        };
    }

    @JsonCreator
    public static AlertSeverity fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (AlertSeverity value : values()) {
                if (value.code.equals(normalized)) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Unknown alert severity: '" + code
                + "'. Supported: info, warning, error, critical");
    }
}
