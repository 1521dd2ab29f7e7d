package com.dnssentinel.core.alert;

import com.dnssentinel.core.alert.ConditionValue.Kind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;

/**
 * Evaluates {@link AlertCondition}s against a flattened metric snapshot.
 *
 * <h3>Semantics</h3>
 * <ul>
 * <li>A list of conditions is an AND; an <strong>empty list is
 * false</strong>.</li>
 * <li>A field missing from the snapshot (or mapped to {@code null}) makes the
 * condition false.</li>
 * <li>Before comparing, the condition value is coerced to the field's kind
 * (see {@link ConditionValue#coerceTo(Kind)}); {@code in}/{@code not_in} skip
 * coercion and {@code contains}/{@code not_contains}/{@code regex} compare
 * text. Coercion failures propagate.</li>
 * <li>{@code gt/gte/lt/lte} compare numerically; {@code eq/ne} try direct,
 * then string-form, then numeric equality.</li>
 * <li>{@code contains} is a case-insensitive substring test; on a list field
 * it holds when any element contains the text.</li>
 * </ul>
 *
 * <p>
 * Stateless and thread-safe.
 * </p>
 *
 * @since 1.0.0
 */
public class ConditionEvaluator {

    private static final Logger LOG = LoggerFactory.getLogger(ConditionEvaluator.class);

    /**
     * @return {@code true} only if the list is non-empty and every condition
     *         holds
     * @throws ConditionEvaluationException if any evaluated condition fails
     */
    public boolean evaluateConditions(List<AlertCondition> conditions, Map<String, ?> snapshot) {
        Objects.requireNonNull(conditions, "Conditions must not be null");
        if (conditions.isEmpty()) {
            return false;
        }
        for (AlertCondition condition : conditions) {
            if (!evaluateCondition(condition, snapshot)) {
                return false;
            }
        }
        return true;
    }

    /**
     * @throws UnsupportedOperatorException for an unknown operator
     * @throws InvalidPatternException      for a {@code regex} value that does
     *                                      not compile
     * @throws TypeCoercionException        if a value cannot be converted for
     *                                      comparison
     */
    public boolean evaluateCondition(AlertCondition condition, Map<String, ?> snapshot) {
        Objects.requireNonNull(condition, "Condition must not be null");
        Objects.requireNonNull(snapshot, "Snapshot must not be null");

        Object raw = snapshot.get(condition.getField());
        if (raw == null) {
            LOG.trace("Field '{}' not present in snapshot - condition is false", condition.getField());
            return false;
        }
        ConditionOperator operator = ConditionOperator.fromCode(condition.getOperator());
        ConditionValue field = ConditionValue.of(raw);
        ConditionValue expected = condition.getValue();

        if (operator.isTextual()) {
            expected = expected.coerceTo(Kind.TEXT);
        } else if (!operator.isMembership()) {
            expected = expected.coerceTo(field.kind());
        }
        condition.getTimeWindow().ifPresent(window -> LOG.trace(
                "Condition '{}' has time window {}; using current value", condition.describe(), window));

        return switch (operator) {
            case GT -> compareNumbers(field, expected) > 0;
            case GTE -> compareNumbers(field, expected) >= 0;
            case LT -> compareNumbers(field, expected) < 0;
            case LTE -> compareNumbers(field, expected) <= 0;
            case EQ -> valuesEqual(field, expected);
            case NE -> !valuesEqual(field, expected);
            case CONTAINS -> contains(field, expected);
            case NOT_CONTAINS -> !contains(field, expected);
            case REGEX -> matches(field, expected);
            case IN -> isMember(field, expected, operator);
            case NOT_IN -> !isMember(field, expected, operator);
        };
    }

    // ---------------------------------------------------------------
    // Operators
    // ---------------------------------------------------------------

    private static int compareNumbers(ConditionValue left, ConditionValue right) {
        double l = left.coerceTo(Kind.NUMBER).asNumber().orElseThrow();
        double r = right.coerceTo(Kind.NUMBER).asNumber().orElseThrow();
        return Double.compare(l, r);
    }

    private static boolean valuesEqual(ConditionValue field, ConditionValue expected) {
        if (field.equals(expected)) {
            return true;
        }
        if (field.stringForm().equals(expected.stringForm())) {
            return true;
        }
        OptionalDouble l = field.asNumber();
        OptionalDouble r = expected.asNumber();
        return l.isPresent() && r.isPresent() && Double.compare(l.getAsDouble(), r.getAsDouble()) == 0;
    }

    private static boolean contains(ConditionValue field, ConditionValue expected) {
        String needle = expected.stringForm().toLowerCase(Locale.ROOT);
        if (field.kind() == Kind.LIST) {
            return field.elements().stream()
                    .anyMatch(e -> e.stringForm().toLowerCase(Locale.ROOT).contains(needle));
        }
        return field.stringForm().toLowerCase(Locale.ROOT).contains(needle);
    }

    private static boolean matches(ConditionValue field, ConditionValue expected) {
        String regex = expected.stringForm();
        Pattern pattern;
        try {
            pattern = Pattern.compile(regex);
        } catch (PatternSyntaxException e) {
            throw new InvalidPatternException(regex, e);
        }
        return pattern.matcher(field.stringForm()).find();
    }

    private static boolean isMember(ConditionValue field, ConditionValue expected, ConditionOperator operator) {
        if (expected.kind() != Kind.LIST) {
            throw new TypeCoercionException("Operator '" + operator.code()
                    + "' requires a list value, got '" + expected.stringForm() + "'");
        }
        String needle = field.stringForm();
        return expected.elements().stream().anyMatch(e -> e.stringForm().equals(needle));
    }
}
