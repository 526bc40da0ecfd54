package com.boundsmith.analysis;

import com.boundsmith.model.BoundaryPredicate;
import com.boundsmith.model.BoundaryTriplet;
import com.boundsmith.model.BoundaryValue;
import com.boundsmith.model.NumericValue;
import com.boundsmith.model.Predicate;
import com.boundsmith.model.RangePredicate;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Maps predicates to the values a test suite should use around them.
 * <p>
 * A single-sided predicate with literal {@code v} yields {@code (v - step, v, v + step)} for every
 * operator, with a step of 1 for integers and lengths and the configured epsilon for floats.
 * A range yields its two endpoints. Negative lengths stay in the triplet but are untestable.
 */
public class BoundaryCalculator {

    public static final BigDecimal DEFAULT_EPSILON = new BigDecimal("0.0001");

    private final BigDecimal epsilon;

    public BoundaryCalculator() {
        this(DEFAULT_EPSILON);
    }

    public BoundaryCalculator(BigDecimal epsilon) {
        Objects.requireNonNull(epsilon, "epsilon");
        if (epsilon.signum() <= 0) {
            throw new IllegalArgumentException("Float epsilon must be positive: " + epsilon);
        }
        this.epsilon = epsilon;
    }

    public BigDecimal getEpsilon() {
        return epsilon;
    }

    public List<BoundaryTriplet> calculateAll(List<? extends BoundaryPredicate> predicates) {
        List<BoundaryTriplet> triplets = new ArrayList<>(predicates.size());
        for (BoundaryPredicate predicate : predicates) {
            triplets.add(calculate(predicate));
        }
        return triplets;
    }

    public BoundaryTriplet calculate(BoundaryPredicate predicate) {
        if (predicate instanceof RangePredicate) {
            return calculateRange((RangePredicate) predicate);
        }
        if (predicate instanceof Predicate) {
            return calculateSingle((Predicate) predicate);
        }
        throw new IllegalArgumentException("Unknown predicate type: " + predicate.getClass().getName());
    }

    private BoundaryTriplet calculateSingle(Predicate predicate) {
        NumericValue literal = predicate.getLiteral();
        BigDecimal step = literal.isInteger() ? BigDecimal.ONE : epsilon;
        NumericValue below = literal.subtract(step);

        List<BoundaryValue> values = new ArrayList<>(3);
        if (predicate.isLengthSubject() && below.signum() < 0) {
            values.add(BoundaryValue.untestable(BoundaryValue.BELOW, below));
        } else {
            values.add(BoundaryValue.testable(BoundaryValue.BELOW, below));
        }
        values.add(BoundaryValue.testable(BoundaryValue.AT, literal));
        values.add(BoundaryValue.testable(BoundaryValue.ABOVE, literal.add(step)));
        return new BoundaryTriplet(predicate, List.of(literal), values);
    }

    private BoundaryTriplet calculateRange(RangePredicate range) {
        NumericValue lower = range.getLower().getLiteral();
        NumericValue upper = range.getUpper().getLiteral();
        List<BoundaryValue> values = List.of(
                BoundaryValue.testable(BoundaryValue.AT_LOWER, lower),
                BoundaryValue.testable(BoundaryValue.AT_UPPER, upper));
        return new BoundaryTriplet(range, List.of(lower, upper), values);
    }
}
