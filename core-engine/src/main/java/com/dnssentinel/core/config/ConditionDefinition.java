package com.dnssentinel.core.config;

import com.dnssentinel.core.alert.AlertCondition;
import com.dnssentinel.core.alert.ConditionOperator;
import com.dnssentinel.core.alert.ConditionValue;

import java.time.Duration;
import java.util.Collection;
import java.util.List;

/**
 * YAML form of one rule condition.
 *
 * <pre>
 * - field: total_queries
 *   operator: gt
 *   value: 500
 *   timeWindow: 5m
 * </pre>
 *
 * <p>
 * The untyped {@code value} is converted once into a {@link ConditionValue}
 * by {@link #toCondition()}.
 * </p>
 *
 * @since 1.0.0
 */
public class ConditionDefinition {

    private String field;
    private String operator;
    private Object value;
    private String timeWindow;

    public ConditionDefinition() {
    }

    public ConditionDefinition(String field, String operator, Object value) {
        this.field = field;
        this.operator = operator;
        this.value = value;
    }

    void collectErrors(String prefix, List<String> errors) {
        if (field == null || field.isBlank()) {
            errors.add(prefix + ": field is required");
        }
        if (operator == null || !ConditionOperator.isSupported(operator)) {
            errors.add(prefix + ": unsupported operator '" + operator + "'");
        } else {
            ConditionOperator op = ConditionOperator.fromCode(operator);
            if ((op == ConditionOperator.IN || op == ConditionOperator.NOT_IN)
                    && !(value instanceof Collection)) {
                errors.add(prefix + ": operator '" + operator + "' requires a list value");
            }
        }
        if (value == null) {
            errors.add(prefix + ": value is required");
        }
        if (timeWindow != null && !Durations.isValid(timeWindow)) {
            errors.add(prefix + ": timeWindow is not a valid duration: '" + timeWindow + "'");
        }
    }

    /**
     * @throws IllegalArgumentException if the value is missing or the time
     *                                  window is malformed
     */
    public AlertCondition toCondition() {
        Duration window = timeWindow != null ? Durations.parse(timeWindow) : null;
        return new AlertCondition(field, operator, ConditionValue.of(value), window);
    }

    public String getField() {
        return field;
    }

    public void setField(String field) {
        this.field = field;
    }

    public String getOperator() {
        return operator;
    }

    public void setOperator(String operator) {
        this.operator = operator;
    }

    public Object getValue() {
        return value;
    }

    public void setValue(Object value) {
        this.value = value;
    }

    public String getTimeWindow() {
        return timeWindow;
    }

    public void setTimeWindow(String timeWindow) {
        this.timeWindow = timeWindow;
    }
}
