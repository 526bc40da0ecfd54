package com.boundsmith.generator;

import com.boundsmith.model.BoundaryTriplet;
import com.boundsmith.model.BoundaryValue;
import com.boundsmith.model.CoverageResult;
import com.boundsmith.model.Predicate;
import com.boundsmith.model.RangePredicate;

import java.util.stream.Collectors;

/**
 * pytest stubs: one {@code @pytest.mark.parametrize} test per boundary.
 */
public class PytestStubTemplate implements StubTemplate {

    @Override
    public String getExtension() {
        return ".py";
    }

    @Override
    public String testName(CoverageResult result) {
        BoundaryTriplet triplet = result.getTriplet();
        return "test_boundary_" + StubTestGenerator.identifier(StubTestGenerator.sourceFileStem(triplet))
                + "_l" + triplet.getLine() + "_" + StubTestGenerator.identifier(triplet.getSubject());
    }

    @Override
    public String header(String fileStem) {
        return "import pytest\n";
    }

    @Override
    public String stub(String testName, CoverageResult result) {
        BoundaryTriplet triplet = result.getTriplet();
        String values = triplet.getTestableValues().stream()
                .map(BoundaryValue::toString)
                .collect(Collectors.joining(", "));
        return "\n\n"
                + "@pytest.mark.parametrize(\"val\", [" + values + "])\n"
                + "def " + testName + "(val):\n"
                + "    \"\"\"Boundary: " + escapeDocstring(triplet.getDescription()) + " at "
                + escapeDocstring(triplet.getFile()) + ":" + triplet.getLine() + "\"\"\"\n"
                + "    result = " + condition(triplet) + "\n"
                + "    assert isinstance(result, bool)\n";
    }

    @Override
    public String footer() {
        return "";
    }

    static String condition(BoundaryTriplet triplet) {
        if (triplet.getPredicate() instanceof RangePredicate) {
            RangePredicate range = (RangePredicate) triplet.getPredicate();
            return range.getLower().getLiteral() + " " + range.getLower().getOperator().mirror().getSymbol()
                    + " val " + range.getUpper().getOperator().getSymbol() + " " + range.getUpper().getLiteral();
        }
        Predicate predicate = (Predicate) triplet.getPredicate();
        return "val " + predicate.getOperator().getSymbol() + " " + predicate.getLiteral();
    }

    private static String escapeDocstring(String text) {
        return text.replace("\\", "\\\\").replace("\"\"\"", "\\\"\\\"\\\"");
    }
}
