package com.boundsmith.analysis;

import com.boundsmith.model.BoundaryTriplet;
import com.boundsmith.model.BoundaryValue;
import com.boundsmith.model.ComparisonOperator;
import com.boundsmith.model.NumericValue;
import com.boundsmith.model.Predicate;
import com.boundsmith.model.RangePredicate;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class BoundaryCalculatorTest {

    private BoundaryCalculator calculator;

    @BeforeEach
    void setUp() {
        calculator = new BoundaryCalculator();
    }

    private static Predicate predicate(ComparisonOperator operator, NumericValue literal, String subject, boolean length) {
        return new Predicate(operator, literal, subject, length, "app.py", 3, 4, subject + " " + operator + " " + literal,
                Predicate.NO_CONJUNCTION);
    }

    private static List<NumericValue> values(BoundaryTriplet triplet) {
        return triplet.getValues().stream().map(BoundaryValue::getValue).collect(Collectors.toList());
    }

    @Test
    void test_integer_triplet() {
        BoundaryTriplet triplet = calculator.calculate(
                predicate(ComparisonOperator.GREATER, NumericValue.ofInteger(3), "retry_count", false));

        assertEquals(List.of(NumericValue.ofInteger(2), NumericValue.ofInteger(3), NumericValue.ofInteger(4)),
                values(triplet));
        assertEquals("(2, 3, 4)", triplet.formatValues());
        assertEquals(List.of(BoundaryValue.BELOW, BoundaryValue.AT, BoundaryValue.ABOVE),
                triplet.getValues().stream().map(BoundaryValue::getLabel).collect(Collectors.toList()));
    }

    @Test
    void test_same_triplet_for_every_operator() {
        for (ComparisonOperator operator : ComparisonOperator.values()) {
            BoundaryTriplet triplet = calculator.calculate(
                    predicate(operator, NumericValue.ofInteger(-10), "t", false));
            assertEquals("(-11, -10, -9)", triplet.formatValues(), operator.getSymbol());
        }
    }

    @Test
    void test_float_triplet_is_exact() {
        BoundaryTriplet triplet = calculator.calculate(
                predicate(ComparisonOperator.LESS_EQUALS, NumericValue.ofFloat("0.5"), "ratio", false));

        assertEquals(List.of(NumericValue.ofFloat("0.4999"), NumericValue.ofFloat("0.5"), NumericValue.ofFloat("0.5001")),
                values(triplet));
        assertFalse(values(triplet).get(1).isInteger());
    }

    @Test
    void test_custom_epsilon() {
        BoundaryTriplet triplet = new BoundaryCalculator(new BigDecimal("0.01")).calculate(
                predicate(ComparisonOperator.GREATER, NumericValue.ofFloat("3.0"), "x", false));

        assertEquals("(2.99, 3.0, 3.01)", triplet.formatValues());
    }

    @Test
    void test_non_positive_epsilon_is_rejected() {
        assertThrows(IllegalArgumentException.class, () -> new BoundaryCalculator(BigDecimal.ZERO));
        assertThrows(IllegalArgumentException.class, () -> new BoundaryCalculator(new BigDecimal("-0.1")));
    }

    @Test
    void test_negative_length_is_untestable() {
        BoundaryTriplet triplet = calculator.calculate(
                predicate(ComparisonOperator.EQUALS, NumericValue.ofInteger(0), "len(items)", true));

        assertEquals("(untestable, 0, 1)", triplet.formatValues());
        assertFalse(triplet.getValues().get(0).isTestable());
        assertEquals(2, triplet.getTestableValues().size());
    }

    @Test
    void test_positive_length_keeps_all_values() {
        BoundaryTriplet triplet = calculator.calculate(
                predicate(ComparisonOperator.GREATER, NumericValue.ofInteger(1), "len(items)", true));

        assertEquals("(0, 1, 2)", triplet.formatValues());
        assertEquals(3, triplet.getTestableValues().size());
    }

    @Test
    void test_range_yields_endpoints() {
        Predicate lower = new Predicate(ComparisonOperator.GREATER, NumericValue.ofInteger(0), "x", false,
                "app.py", 7, 5, "0 < x < 100", 0);
        Predicate upper = new Predicate(ComparisonOperator.LESS, NumericValue.ofInteger(100), "x", false,
                "app.py", 7, 5, "0 < x < 100", 0);

        BoundaryTriplet triplet = calculator.calculate(RangePredicate.of(lower, upper));

        assertTrue(triplet.isRange());
        assertEquals("(0, 100)", triplet.formatValues());
        assertEquals(List.of(NumericValue.ofInteger(0), NumericValue.ofInteger(100)), triplet.getLiterals());
        assertEquals(BoundaryValue.AT_LOWER, triplet.getValues().get(0).getLabel());
    }
}
