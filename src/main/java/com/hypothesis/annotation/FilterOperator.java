package com.hypothesis.annotation;

import java.util.Arrays;
import java.util.Collection;
import java.util.Locale;
import java.util.Optional;

/**
 * Comparison operators available in annotation filters.
 */
public enum FilterOperator {
    EQ("eq"),
    NE("ne"),
    IN("in"),
    CONTAINS("contains"),
    STARTS_WITH("startsWith");

    private final String token;

    FilterOperator(String token) {
        this.token = token;
    }

    public String getToken() {
        return token;
    }

    public static Optional<FilterOperator> fromToken(String token) {
        if (token == null) {
            return Optional.empty();
        }
        return Arrays.stream(values())
            .filter(op -> op.token.equalsIgnoreCase(token.trim()))
            .findFirst();
    }

    /**
     * @param cell     table value, never null
     * @param operand  normalized operand: a String, or a Collection of Strings for {@link #IN}
     */
    public boolean test(String cell, Object operand, boolean ignoreCase) {
        String value = ignoreCase ? cell.toLowerCase(Locale.ROOT) : cell;
        return switch (this) {
            case EQ -> value.equals(operand);
            case NE -> !value.equals(operand);
            case IN -> ((Collection<?>) operand).contains(value);
            case CONTAINS -> value.contains((String) operand);
            case STARTS_WITH -> value.startsWith((String) operand);
        };
    }
}
