package com.dnssentinel.core.alert;

/**
 * Thrown for a condition operator outside the supported set.
 */
public class UnsupportedOperatorException extends ConditionEvaluationException {

    private static final long serialVersionUID = 1L;

    private final String operator;

    public UnsupportedOperatorException(String operator) {
        super("Unsupported operator: '" + operator + "'");
        this.operator = operator;
    }

    public String getOperator() {
        return operator;
    }
}
