package com.dnssentinel.core.alert;

import java.io.Serializable;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.OptionalDouble;
import java.util.stream.Collectors;

/**
 * Tagged value compared by alert conditions: a number, text, a boolean or a
 * list of values.
 *
 * <p>
 * Condition values are built once, when rules are parsed; snapshot field
 * values are wrapped on demand with {@link #of(Object)}.
 * </p>
 *
 * <h3>Coercion table</h3>
 * <p>
 * {@link #coerceTo(Kind)} is total over (source, target):
 * </p>
 * <table>
 * <caption>source kind (rows) to target kind (columns)</caption>
 * <tr><th></th><th>NUMBER</th><th>TEXT</th><th>BOOLEAN</th><th>LIST</th></tr>
 * <tr><td>NUMBER</td><td>same</td><td>string form</td><td>!= 0</td><td>singleton</td></tr>
 * <tr><td>TEXT</td><td>parse or fail</td><td>same</td><td>"true"/"false" or fail</td><td>singleton</td></tr>
 * <tr><td>BOOLEAN</td><td>1 / 0</td><td>string form</td><td>same</td><td>singleton</td></tr>
 * <tr><td>LIST</td><td>fail</td><td>string form</td><td>fail</td><td>same</td></tr>
 * </table>
 *
 * @since 1.0.0
 */
public final class ConditionValue implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Value tag. */
    public enum Kind {
        NUMBER,
        TEXT,
        BOOLEAN,
        LIST
    }

    private final Kind kind;
    private final double number;
    private final String text;
    private final boolean bool;
    private final List<ConditionValue> list;

    private ConditionValue(Kind kind, double number, String text, boolean bool, List<ConditionValue> list) {
        this.kind = kind;
        this.number = number;
        this.text = text;
        this.bool = bool;
        this.list = list;
    }

    // ---------------------------------------------------------------
    // Factories
    // ---------------------------------------------------------------

    public static ConditionValue ofNumber(double value) {
        return new ConditionValue(Kind.NUMBER, value, null, false, null);
    }

    public static ConditionValue ofText(String value) {
        return new ConditionValue(Kind.TEXT, 0, Objects.requireNonNull(value, "text must not be null"), false, null);
    }

    public static ConditionValue ofBoolean(boolean value) {
        return new ConditionValue(Kind.BOOLEAN, 0, null, value, null);
    }

    public static ConditionValue ofList(List<ConditionValue> values) {
        return new ConditionValue(Kind.LIST, 0, null, false, List.copyOf(values));
    }

    /**
     * Wrap an untyped value as parsed from YAML or held in a metric snapshot.
     * Numbers, booleans and collections map to their tags; anything else is
     * text via {@code toString()}.
     *
     * @throws IllegalArgumentException if {@code raw} is {@code null}
     */
    public static ConditionValue of(Object raw) {
        if (raw == null) {
            throw new IllegalArgumentException("Condition value must not be null");
        }
        if (raw instanceof ConditionValue value) {
            return value;
        }
        if (raw instanceof Number n) {
            return ofNumber(n.doubleValue());
        }
        if (raw instanceof Boolean b) {
            return ofBoolean(b);
        }
        if (raw instanceof Collection<?> items) {
            List<ConditionValue> values = new ArrayList<>(items.size());
            for (Object item : items) {
                values.add(of(item));
            }
            return ofList(values);
        }
        return ofText(raw.toString());
    }

    // ---------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------

    public Kind kind() {
        return kind;
    }

    /**
     * @return list elements; empty for non-list values
     */
    public List<ConditionValue> elements() {
        return kind == Kind.LIST ? list : List.of();
    }

    /**
     * Numeric view without failing: numbers, booleans (1/0) and numeric text.
     */
    public OptionalDouble asNumber() {
        return switch (kind) {
            case NUMBER -> OptionalDouble.of(number);
            case BOOLEAN -> OptionalDouble.of(bool ? 1 : 0);
            case TEXT -> parseNumber(text);
            case LIST -> OptionalDouble.empty();
        };
    }

    /**
     * Canonical string form. Integral numbers print without a fraction
     * ({@code 1000}, not {@code 1000.0}); lists print as {@code [a, b]}.
     */
    public String stringForm() {
        return switch (kind) {
            case NUMBER -> formatNumber(number);
            case TEXT -> text;
            case BOOLEAN -> Boolean.toString(bool);
            case LIST -> list.stream().map(ConditionValue::stringForm)
                    .collect(Collectors.joining(", ", "[", "]"));
        };
    }

    // ---------------------------------------------------------------
    // Coercion
    // ---------------------------------------------------------------

    /**
     * Convert this value to {@code target}.
     *
     * @throws TypeCoercionException where the table says "fail"
     */
    public ConditionValue coerceTo(Kind target) {
        if (kind == target) {
            return this;
        }
        return switch (target) {
            case NUMBER -> {
                OptionalDouble n = asNumber();
                if (n.isEmpty()) {
                    throw new TypeCoercionException("Cannot convert " + describe() + " to a number");
                }
                yield ofNumber(n.getAsDouble());
            }
            case TEXT -> ofText(stringForm());
            case BOOLEAN -> switch (kind) {
                case NUMBER -> ofBoolean(number != 0);
                case TEXT -> ofBoolean(parseBoolean(text));
                default -> throw new TypeCoercionException("Cannot convert " + describe() + " to a boolean");
            };
            case LIST -> ofList(List.of(this));
        };
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    private String describe() {
        return kind.name().toLowerCase(Locale.ROOT) + " '" + stringForm() + "'";
    }

    private static OptionalDouble parseNumber(String text) {
        try {
            return OptionalDouble.of(Double.parseDouble(text.trim()));
        } catch (NumberFormatException e) {
            return OptionalDouble.empty();
        }
    }

    private boolean parseBoolean(String value) {
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        if ("true".equals(normalized)) {
            return true;
        }
        if ("false".equals(normalized)) {
            return false;
        }
        throw new TypeCoercionException("Cannot convert " + describe() + " to a boolean");
    }

    static String formatNumber(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return Double.toString(value);
        }
        if (value == Math.rint(value) && Math.abs(value) < 1e15) {
            return Long.toString((long) value);
        }
        return BigDecimal.valueOf(value).stripTrailingZeros().toPlainString();
    }

    // ---------------------------------------------------------------
    // equals / hashCode / toString
    // ---------------------------------------------------------------

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof ConditionValue that))
            return false;
        if (kind != that.kind)
            return false;
        return switch (kind) {
            case NUMBER -> Double.compare(number, that.number) == 0;
            case TEXT -> text.equals(that.text);
            case BOOLEAN -> bool == that.bool;
            case LIST -> list.equals(that.list);
        };
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, stringForm());
    }

    @Override
    public String toString() {
        return stringForm();
    }
}
