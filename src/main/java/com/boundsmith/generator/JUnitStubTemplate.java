package com.boundsmith.generator;

import com.boundsmith.model.BoundaryTriplet;
import com.boundsmith.model.CoverageResult;
import com.boundsmith.model.NumericValue;
import com.boundsmith.model.Predicate;
import com.boundsmith.model.RangePredicate;

import java.math.BigInteger;
import java.util.stream.Collectors;

/**
 * JUnit 5 stubs: one {@code @ParameterizedTest} with a {@code @ValueSource} per boundary,
 * in a class named after the output file.
 */
public class JUnitStubTemplate implements StubTemplate {

    private static final BigInteger INT_MIN = BigInteger.valueOf(Integer.MIN_VALUE);
    private static final BigInteger INT_MAX = BigInteger.valueOf(Integer.MAX_VALUE);

    @Override
    public String getExtension() {
        return ".java";
    }

    @Override
    public String testName(CoverageResult result) {
        BoundaryTriplet triplet = result.getTriplet();
        return "boundary_" + StubTestGenerator.identifier(StubTestGenerator.sourceFileStem(triplet))
                + "_L" + triplet.getLine() + "_" + StubTestGenerator.identifier(triplet.getSubject());
    }

    @Override
    public String header(String fileStem) {
        String className = StubTestGenerator.identifier(fileStem);
        if (Character.isDigit(className.charAt(0))) {
            className = "_" + className;
        }
        return "import static org.junit.jupiter.api.Assertions.assertInstanceOf;\n"
                + "\n"
                + "import org.junit.jupiter.params.ParameterizedTest;\n"
                + "import org.junit.jupiter.params.provider.ValueSource;\n"
                + "\n"
                + "class " + className + " {\n";
    }

    @Override
    public String stub(String testName, CoverageResult result) {
        BoundaryTriplet triplet = result.getTriplet();
        boolean integer = triplet.getLiterals().get(0).isInteger();
        String values = triplet.getTestableValues().stream()
                .map(value -> literal(value.getValue()))
                .collect(Collectors.joining(", "));
        return "\n"
                + "    /** Boundary: " + escapeComment(triplet.getDescription()) + " at "
                + escapeComment(triplet.getFile()) + ":" + triplet.getLine() + " */\n"
                + "    @ParameterizedTest\n"
                + "    @ValueSource(" + (integer ? "longs" : "doubles") + " = {" + values + "})\n"
                + "    void " + testName + "(" + (integer ? "long" : "double") + " val) {\n"
                + "        Object result = " + condition(triplet) + ";\n"
                + "        assertInstanceOf(Boolean.class, result);\n"
                + "    }\n";
    }

    @Override
    public String footer() {
        return "}\n";
    }

    static String condition(BoundaryTriplet triplet) {
        if (triplet.getPredicate() instanceof RangePredicate) {
            RangePredicate range = (RangePredicate) triplet.getPredicate();
            return literal(range.getLower().getLiteral()) + " " + range.getLower().getOperator().mirror().getSymbol()
                    + " val && val " + range.getUpper().getOperator().getSymbol() + " "
                    + literal(range.getUpper().getLiteral());
        }
        Predicate predicate = (Predicate) triplet.getPredicate();
        return "val " + predicate.getOperator().getSymbol() + " " + literal(predicate.getLiteral());
    }

    /**
     * Java source form of a value; integers outside the int range get an {@code L} suffix.
     */
    static String literal(NumericValue value) {
        if (!value.isInteger()) {
            return value.toString();
        }
        BigInteger integer = value.toBigInteger();
        boolean fitsInt = integer.compareTo(INT_MIN) >= 0 && integer.compareTo(INT_MAX) <= 0;
        return fitsInt ? integer.toString() : integer + "L";
    }

    private static String escapeComment(String text) {
        return text.replace("*/", "* /");
    }
}
