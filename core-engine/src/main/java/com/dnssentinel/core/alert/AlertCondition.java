package com.dnssentinel.core.alert;

import java.io.Serializable;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;

/**
 * One comparison of a snapshot field against a typed value.
 *
 * <p>
 * The operator is kept as written so an unknown operator surfaces as
 * {@link UnsupportedOperatorException} during evaluation of its rule only.
 * The optional time window is parsed but not aggregated over; evaluation
 * uses the current field value.
 * </p>
 *
 * @since 1.0.0
 */
public final class AlertCondition implements Serializable {

    private static final long serialVersionUID = 1L;

    private final String field;
    private final String operator;
    private final ConditionValue value;
    private final Duration timeWindow;

    public AlertCondition(String field, String operator, ConditionValue value, Duration timeWindow) {
        this.field = Objects.requireNonNull(field, "field must not be null");
        this.operator = Objects.requireNonNull(operator, "operator must not be null");
        this.value = Objects.requireNonNull(value, "value must not be null");
        this.timeWindow = timeWindow;
    }

    /**
     * Condition without a time window; {@code value} is wrapped with
     * {@link ConditionValue#of(Object)}.
     */
    public static AlertCondition of(String field, String operator, Object value) {
        return new AlertCondition(field, operator, ConditionValue.of(value), null);
    }

    public String getField() {
        return field;
    }

    public String getOperator() {
        return operator;
    }

    public ConditionValue getValue() {
        return value;
    }

    public Optional<Duration> getTimeWindow() {
        return Optional.ofNullable(timeWindow);
    }

    /**
     * @return {@code "field operator value"}, as recorded on triggered alerts
     */
    public String describe() {
        return field + " " + operator + " " + value.stringForm();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof AlertCondition that))
            return false;
        return field.equals(that.field) && operator.equals(that.operator)
                && value.equals(that.value) && Objects.equals(timeWindow, that.timeWindow);
    }

    @Override
    public int hashCode() {
        return Objects.hash(field, operator, value, timeWindow);
    }

    @Override
    public String toString() {
        return "AlertCondition{" + describe() + (timeWindow != null ? ", timeWindow=" + timeWindow : "") + '}';
    }
}
