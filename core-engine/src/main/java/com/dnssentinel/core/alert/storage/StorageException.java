package com.dnssentinel.core.alert.storage;

/**
 * Failure of an {@link AlertStorage} backend to read or persist alerts.
 *
 * @since 1.0.0
 */
public class StorageException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public StorageException(String message) {
        super(message);
    }

    public StorageException(String message, Throwable cause) {
        super(message, cause);
    }
}
