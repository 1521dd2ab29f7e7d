package com.dnssentinel.core.alert;

import java.util.NoSuchElementException;

/**
 * Thrown when an alert or rule ID is unknown.
 *
 * @since 1.0.0
 */
public class NotFoundException extends NoSuchElementException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String kind, String id) {
        super(kind + " not found: " + id);
    }
}
