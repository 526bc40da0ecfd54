package com.boundsmith.model;

import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class RangePredicateTest {

    private static Predicate predicate(ComparisonOperator operator, NumericValue literal, int column) {
        return new Predicate(operator, literal, "x", false, "app.py", 4, column, "expr", 0);
    }

    @Test
    void test_describe_and_descriptor() {
        RangePredicate range = RangePredicate.of(
                predicate(ComparisonOperator.GREATER, NumericValue.ofInteger(0), 4),
                predicate(ComparisonOperator.LESS_EQUALS, NumericValue.ofInteger(100), 12));

        assertEquals("0 < x <= 100", range.describe());
        assertEquals("<..<=", range.getOperatorDescriptor());
        assertEquals(4, range.getColumn());
        assertEquals(ComparandType.INTEGER, range.getComparandType());
    }

    @Test
    void test_rejects_inverted_bounds() {
        Predicate lower = predicate(ComparisonOperator.GREATER, NumericValue.ofInteger(10), 4);
        Predicate upper = predicate(ComparisonOperator.LESS, NumericValue.ofInteger(5), 12);

        assertFalse(RangePredicate.canFuse(lower, upper));
        assertThrows(IllegalArgumentException.class, () -> RangePredicate.of(lower, upper));
    }

    @Test
    void test_rejects_mixed_literal_types() {
        Predicate lower = predicate(ComparisonOperator.GREATER, NumericValue.ofInteger(0), 4);
        Predicate upper = predicate(ComparisonOperator.LESS, NumericValue.ofFloat("100.0"), 12);

        assertFalse(RangePredicate.canFuse(lower, upper));
    }

    @Test
    void test_rejects_equal_bounds() {
        Predicate lower = predicate(ComparisonOperator.GREATER_EQUALS, NumericValue.ofInteger(5), 4);
        Predicate upper = predicate(ComparisonOperator.LESS_EQUALS, NumericValue.ofInteger(5), 12);

        assertFalse(RangePredicate.canFuse(lower, upper));
    }
}
