package com.dnssentinel.core.alert;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Coarse health label reported by {@link AlertManager#getStatus()}.
 */
public enum ManagerHealth {
    HEALTHY,
    /** At least one processing error has been counted. */
    ERRORS,
    STOPPED;

    @JsonValue
    public String code() {
        return name().toLowerCase(Locale.ROOT);
    }
}
