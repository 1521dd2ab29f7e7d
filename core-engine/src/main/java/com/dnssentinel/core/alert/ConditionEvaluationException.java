package com.dnssentinel.core.alert;

/**
 * Base type for failures while evaluating an {@link AlertCondition}. Such a
 * failure aborts evaluation of the affected rule only.
 *
 * @since 1.0.0
 */
public class ConditionEvaluationException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public ConditionEvaluationException(String message) {
        super(message);
    }

    public ConditionEvaluationException(String message, Throwable cause) {
        super(message, cause);
    }
}
