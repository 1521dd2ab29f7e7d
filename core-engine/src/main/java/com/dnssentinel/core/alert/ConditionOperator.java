package com.dnssentinel.core.alert;

import java.util.List;
import java.util.Locale;

/**
 * The closed set of comparison operators a condition may use. Symbolic
 * aliases ({@code >}, {@code >=}, {@code <}, {@code <=}, {@code ==},
 * {@code =}, {@code !=}) are accepted alongside the names.
 *
 * @since 1.0.0
 */
public enum ConditionOperator {

    GT("gt", ">"),
    GTE("gte", ">="),
    LT("lt", "<"),
    LTE("lte", "<="),
    EQ("eq", "==", "="),
    NE("ne", "!="),
    CONTAINS("contains"),
    NOT_CONTAINS("not_contains"),
    REGEX("regex"),
    IN("in"),
    NOT_IN("not_in");

    private final String code;
    private final List<String> aliases;

    ConditionOperator(String code, String... aliases) {
        this.code = code;
        this.aliases = List.of(aliases);
    }

    public String code() {
        return code;
    }

    boolean isTextual() {
        return this == CONTAINS || this == NOT_CONTAINS || this == REGEX;
    }

    boolean isMembership() {
        return this == IN || this == NOT_IN;
    }

    /**
     * Resolve an operator by name or alias (case-insensitive).
     *
     * @throws UnsupportedOperatorException if nothing matches
     */
    public static ConditionOperator fromCode(String operator) {
        ConditionOperator op = lookup(operator);
        if (op == null) {
            throw new UnsupportedOperatorException(operator);
        }
        return op;
    }

    public static boolean isSupported(String operator) {
        return lookup(operator) != null;
    }

    private static ConditionOperator lookup(String operator) {
        if (operator == null) {
            return null;
        }
        String normalized = operator.trim().toLowerCase(Locale.ROOT);
        for (ConditionOperator op : values()) {
            if (op.code.equals(normalized) || op.aliases.contains(normalized)) {
                return op;
            }
        }
        return null;
    }
}
