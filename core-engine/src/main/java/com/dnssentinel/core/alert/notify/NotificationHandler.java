package com.dnssentinel.core.alert.notify;

import com.dnssentinel.core.alert.Alert;
import com.dnssentinel.core.alert.NotificationChannel;

/**
 * Delivers alerts on one {@link NotificationChannel}.
 *
 * <p>
 * Implementations carry their own channel settings, including a send
 * timeout, and must report every delivery failure by throwing.
 * </p>
 *
 * @since 1.0.0
 */
public interface NotificationHandler {

    NotificationChannel channel();

    /**
     * @throws NotificationException if the alert was not delivered
     */
    void send(Alert alert) throws NotificationException;

    /**
     * Send a synthetic test alert through this channel.
     *
     * @throws NotificationException if the test alert was not delivered
     */
    default void testConnectivity() throws NotificationException {
        send(NotificationHandlers.testAlert(channel()));
    }
}
