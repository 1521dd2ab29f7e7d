package com.dnssentinel.core.alert;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Lifecycle state of an {@link Alert}. {@code RESOLVED} and {@code SUPPRESSED} are terminal.
 *
 * @since 1.0.0
 */
public enum AlertStatus {

    PENDING("pending"),
    FIRED("fired"),
    RESOLVED("resolved"),
    SUPPRESSED("suppressed");

    private final String code;

    AlertStatus(String code) {
        this.code = code;
    }

    @JsonValue
    public String code() {
        return code;
    }

    /**
     * @return {@code true} for {@link #FIRED} and {@link #PENDING}
     */
    public boolean isActive() {
        return this == FIRED || this == PENDING;
    }

    /**
     * @throws IllegalArgumentException if {@code code} is unknown
     */
    @JsonCreator
    public static AlertStatus fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (AlertStatus value : values()) {
                if (value.code.equals(normalized)) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Unknown alert status: '" + code + "'");
    }
}
