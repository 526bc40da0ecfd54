package com.boundsmith.model;

import java.util.Objects;

/**
 * Two single-sided predicates on the same subject that together bound an interval,
 * {@code lo OP1 subject OP2 hi}.
 */
public final class RangePredicate implements BoundaryPredicate {

    private final Predicate lower;
    private final Predicate upper;

    private RangePredicate(Predicate lower, Predicate upper) {
        this.lower = lower;
        this.upper = upper;
    }

    /**
     * Fuses a lower and an upper bound.
     *
     * @param lower Predicate of the form {@code subject > lo} or {@code subject >= lo}
     * @param upper Predicate of the form {@code subject < hi} or {@code subject <= hi}
     * @return The range
     * @throws IllegalArgumentException if the pair does not describe a bounded interval
     */
    public static RangePredicate of(Predicate lower, Predicate upper) {
        if (!canFuse(lower, upper)) {
            throw new IllegalArgumentException("Not a bounded range: " + lower.describe() + " and " + upper.describe());
        }
        return new RangePredicate(lower, upper);
    }

    /**
     * Checks every precondition of {@link #of(Predicate, Predicate)}: matching subjects,
     * a lower and an upper operator, the same literal type and {@code lo < hi}.
     */
    public static boolean canFuse(Predicate lower, Predicate upper) {
        return lower.getOperator().isLowerBound()
                && upper.getOperator().isUpperBound()
                && lower.getSubject().equals(upper.getSubject())
                && lower.isLengthSubject() == upper.isLengthSubject()
                && lower.getLiteral().getType() == upper.getLiteral().getType()
                && lower.getLiteral().compareTo(upper.getLiteral()) < 0;
    }

    public Predicate getLower() {
        return lower;
    }

    public Predicate getUpper() {
        return upper;
    }

    @Override
    public String getFile() {
        return lower.getFile();
    }

    /**
     * The line of whichever side appears first in the source.
     */
    @Override
    public int getLine() {
        return Math.min(lower.getLine(), upper.getLine());
    }

    @Override
    public int getColumn() {
        if (lower.getLine() == upper.getLine()) {
            return Math.min(lower.getColumn(), upper.getColumn());
        }
        return lower.getLine() < upper.getLine() ? lower.getColumn() : upper.getColumn();
    }

    @Override
    public String getSubject() {
        return lower.getSubject();
    }

    @Override
    public ComparandType getComparandType() {
        return lower.getComparandType();
    }

    @Override
    public String getOperatorDescriptor() {
        return lower.getOperator().mirror().getSymbol() + ".." + upper.getOperator().getSymbol();
    }

    @Override
    public String describe() {
        return lower.getLiteral() + " " + lower.getOperator().mirror().getSymbol() + " " + getSubject()
                + " " + upper.getOperator().getSymbol() + " " + upper.getLiteral();
    }

    /**
     * The shared chained comparison, or both comparisons joined by {@code and}.
     */
    @Override
    public String getExpression() {
        if (lower.getExpression().equals(upper.getExpression())) {
            return lower.getExpression();
        }
        boolean lowerFirst = lower.getLine() < upper.getLine()
                || (lower.getLine() == upper.getLine() && lower.getColumn() <= upper.getColumn());
        Predicate first = lowerFirst ? lower : upper;
        Predicate second = lowerFirst ? upper : lower;
        return first.getExpression() + " and " + second.getExpression();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RangePredicate)) {
            return false;
        }
        RangePredicate that = (RangePredicate) o;
        return lower.equals(that.lower) && upper.equals(that.upper);
    }

    @Override
    public int hashCode() {
        return Objects.hash(lower, upper);
    }

    @Override
    public String toString() {
        return getFile() + ":" + getLine() + " " + describe();
    }
}
