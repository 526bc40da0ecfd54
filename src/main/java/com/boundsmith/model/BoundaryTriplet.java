package com.boundsmith.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The concrete values a test suite should exercise around one comparison threshold:
 * below/at/above for a single-sided predicate, or both endpoints of a fused range.
 */
public final class BoundaryTriplet {

    private final BoundaryPredicate predicate;
    private final List<NumericValue> literals;
    private final List<BoundaryValue> values;

    public BoundaryTriplet(BoundaryPredicate predicate, List<NumericValue> literals, List<BoundaryValue> values) {
        this.predicate = Objects.requireNonNull(predicate, "predicate");
        this.literals = Collections.unmodifiableList(new ArrayList<>(literals));
        this.values = Collections.unmodifiableList(new ArrayList<>(values));
    }

    public BoundaryPredicate getPredicate() {
        return predicate;
    }

    public boolean isRange() {
        return predicate instanceof RangePredicate;
    }

    public String getFile() {
        return predicate.getFile();
    }

    public int getLine() {
        return predicate.getLine();
    }

    public int getColumn() {
        return predicate.getColumn();
    }

    public String getSubject() {
        return predicate.getSubject();
    }

    public String getOperatorDescriptor() {
        return predicate.getOperatorDescriptor();
    }

    public ComparandType getComparandType() {
        return predicate.getComparandType();
    }

    /**
     * The threshold literal, or the lower and upper literal of a range.
     */
    public List<NumericValue> getLiterals() {
        return literals;
    }

    public List<BoundaryValue> getValues() {
        return values;
    }

    public List<BoundaryValue> getTestableValues() {
        return values.stream().filter(BoundaryValue::isTestable).collect(Collectors.toList());
    }

    public String getDescription() {
        return predicate.describe();
    }

    /**
     * Identity used to collapse duplicate findings: two predicates on the same line with
     * the same subject, operator and literal are one boundary.
     */
    public String getDeduplicationKey() {
        return getFile() + "\u0000" + getLine() + "\u0000" + getSubject() + "\u0000" + getOperatorDescriptor()
                + "\u0000" + literals.stream().map(v -> v.getType() + ":" + v).collect(Collectors.joining(","));
    }

    /**
     * Tuple rendering such as {@code (2, 3, 4)} or {@code (untestable, 0, 1)}.
     */
    public String formatValues() {
        return values.stream().map(BoundaryValue::toString).collect(Collectors.joining(", ", "(", ")"));
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BoundaryTriplet)) {
            return false;
        }
        BoundaryTriplet that = (BoundaryTriplet) o;
        return predicate.equals(that.predicate) && literals.equals(that.literals) && values.equals(that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(predicate, literals, values);
    }

    @Override
    public String toString() {
        return getDescription() + " -> " + formatValues();
    }
}
