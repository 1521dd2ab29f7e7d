package com.dnssentinel.core.alert;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Delivery channels an alert rule can route to.
 *
 * @since 1.0.0
 */
public enum NotificationChannel {

    SLACK("slack"),
    EMAIL("email"),
    LOG("log");

    private final String code;

    NotificationChannel(String code) {
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
    public static NotificationChannel fromCode(String code) {
        if (code != null) {
            String normalized = code.trim().toLowerCase(Locale.ROOT);
            for (NotificationChannel value : values()) {
                if (value.code.equals(normalized)) {
                    return value;
                }
            }
        }
        throw new IllegalArgumentException("Unknown notification channel: '" + code + "'");
    }
}
