package com.boundsmith.model;

import java.util.Optional;

/**
 * The ordering and equality comparisons a boundary predicate can use.
 */
public enum ComparisonOperator {

    LESS("<", "boundary-lt", "less than"),
    LESS_EQUALS("<=", "boundary-le", "less than or equal"),
    GREATER(">", "boundary-gt", "greater than"),
    GREATER_EQUALS(">=", "boundary-ge", "greater than or equal"),
    EQUALS("==", "boundary-eq", "equal"),
    NOT_EQUALS("!=", "boundary-ne", "not equal");

    private final String symbol;
    private final String ruleId;
    private final String displayName;

    ComparisonOperator(String symbol, String ruleId, String displayName) {
        this.symbol = symbol;
        this.ruleId = ruleId;
        this.displayName = displayName;
    }

    /**
     * Looks up an operator by its source symbol.
     * Membership and identity operators ({@code in}, {@code is}, ...) have no counterpart.
     */
    public static Optional<ComparisonOperator> fromSymbol(String symbol) {
        for (ComparisonOperator operator : values()) {
            if (operator.symbol.equals(symbol)) {
                return Optional.of(operator);
            }
        }
        return Optional.empty();
    }

    /**
     * The operator that keeps the comparison true when both operands swap sides.
     */
    public ComparisonOperator mirror() {
        return switch (this) {
            case LESS -> GREATER;
            case LESS_EQUALS -> GREATER_EQUALS;
            case GREATER -> LESS;
            case GREATER_EQUALS -> LESS_EQUALS;
            case EQUALS -> EQUALS;
            case NOT_EQUALS -> NOT_EQUALS;
        };
    }

    /**
     * True for {@code subject > v} and {@code subject >= v}.
     */
    public boolean isLowerBound() {
        return this == GREATER || this == GREATER_EQUALS;
    }

    /**
     * True for {@code subject < v} and {@code subject <= v}.
     */
    public boolean isUpperBound() {
        return this == LESS || this == LESS_EQUALS;
    }

    public boolean isStrict() {
        return this == LESS || this == GREATER;
    }

    public String getSymbol() {
        return symbol;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getDisplayName() {
        return displayName;
    }

    @Override
    public String toString() {
        return symbol;
    }
}
