package com.dnssentinel.core.analytics;

/**
 * Thrown when a batch is too small for training or trend analysis to produce
 * meaningful statistics.
 *
 * @since 1.0.0
 */
public class InsufficientDataException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    private final int required;
    private final int actual;

    public InsufficientDataException(String operation, int required, int actual) {
        super(operation + " requires at least " + required + " records, got " + actual);
        this.required = required;
        this.actual = actual;
    }

    public int getRequired() {
        return required;
    }

    public int getActual() {
        return actual;
    }
}
