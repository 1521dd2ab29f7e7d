package com.dnssentinel.core.alert.notify;

import com.dnssentinel.core.alert.NotificationChannel;

/**
 * A notification could not be delivered on a channel.
 *
 * @since 1.0.0
 */
public class NotificationException extends Exception {

    private static final long serialVersionUID = 1L;

    private final NotificationChannel channel;

    public NotificationException(NotificationChannel channel, String message) {
        super(channel.code() + ": " + message);
        this.channel = channel;
    }

    public NotificationException(NotificationChannel channel, String message, Throwable cause) {
        super(channel.code() + ": " + message, cause);
        this.channel = channel;
    }

    public NotificationChannel getChannel() {
        return channel;
    }
}
