package com.dnssentinel.core.analytics;

/**
 * Thrown when detection is requested from a detector that has no model.
 *
 * @since 1.0.0
 */
public class ModelNotTrainedException extends IllegalStateException {

    private static final long serialVersionUID = 1L;

    public ModelNotTrainedException(String message) {
        super(message);
    }
}
