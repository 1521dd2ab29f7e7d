package com.dnssentinel.core.alert;

/**
 * Thrown when a {@code regex} condition value does not compile.
 */
public class InvalidPatternException extends ConditionEvaluationException {

    private static final long serialVersionUID = 1L;

    public InvalidPatternException(String pattern, Throwable cause) {
        super("Invalid regex pattern: '" + pattern + "'", cause);
    }
}
