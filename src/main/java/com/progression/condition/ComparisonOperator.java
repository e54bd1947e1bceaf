package com.progression.condition;

import java.util.Locale;

/**
 * Operators for comparing two derived numeric values.
 */
public enum ComparisonOperator {
    EQUALS("=="),
    GREATER_THAN(">"),
    LESS_THAN("<"),
    GREATER_THAN_OR_EQUAL(">="),
    LESS_THAN_OR_EQUAL("<=");

    private final String symbol;

    ComparisonOperator(String symbol) {
        this.symbol = symbol;
    }

    public String symbol() {
        return symbol;
    }

    public boolean apply(int left, int right) {
        return switch (this) {
            case EQUALS -> left == right;
            case GREATER_THAN -> left > right;
            case LESS_THAN -> left < right;
            case GREATER_THAN_OR_EQUAL -> left >= right;
            case LESS_THAN_OR_EQUAL -> left <= right;
        };
    }

    /**
     * Parse camelCase ("greaterThanOrEqual"), snake or upper case names, or a symbol.
     *
     * @throws IllegalArgumentException for unknown operators
     */
    public static ComparisonOperator fromName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Comparison operator is required");
        }
        String trimmed = name.trim();
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equals(trimmed)) {
                return operator;
            }
        }
        String normalized = trimmed.replaceAll("([a-z])([A-Z])", "$1_$2")
                .replace('-', '_')
                .toUpperCase(Locale.ROOT);
        return valueOf(normalized);
    }
}
