package com.dnssentinel.core.alert;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Outcome of one delivery attempt of an alert on one channel.
 *
 * @since 1.0.0
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class NotificationRecord implements Serializable {

    private static final long serialVersionUID = 1L;

    private final NotificationChannel channel;
    private final Instant sentAt;
    private final boolean success;
    private final String error;

    @JsonCreator
    public NotificationRecord(@JsonProperty("channel") NotificationChannel channel,
                              @JsonProperty("sentAt") Instant sentAt,
                              @JsonProperty("success") boolean success,
                              @JsonProperty("error") String error) {
        this.channel = Objects.requireNonNull(channel, "channel must not be null");
        this.sentAt = Objects.requireNonNull(sentAt, "sentAt must not be null");
        this.success = success;
        this.error = error;
    }

    public static NotificationRecord delivered(NotificationChannel channel, Instant sentAt) {
        return new NotificationRecord(channel, sentAt, true, null);
    }

    public static NotificationRecord failed(NotificationChannel channel, Instant sentAt, String error) {
        return new NotificationRecord(channel, sentAt, false, error);
    }

    public NotificationChannel getChannel() {
        return channel;
    }

    public Instant getSentAt() {
        return sentAt;
    }

    public boolean isSuccess() {
        return success;
    }

    /** @return failure message, or {@code null} on success */
    public String getError() {
        return error;
    }

    @Override
    public String toString() {
        return "NotificationRecord{" + channel + ", success=" + success
                + (error != null ? ", error='" + error + '\'' : "") + '}';
    }
}
