package com.dnssentinel.core.alert;

/**
 * Thrown when a condition value cannot be converted to the type required for
 * comparison.
 */
public class TypeCoercionException extends ConditionEvaluationException {

    private static final long serialVersionUID = 1L;

    public TypeCoercionException(String message) {
        super(message);
    }
}
