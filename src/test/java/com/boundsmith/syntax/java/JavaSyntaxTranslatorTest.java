package com.boundsmith.syntax.java;

import com.boundsmith.model.NumericValue;
import com.boundsmith.syntax.BooleanOperationNode;
import com.boundsmith.syntax.ComparisonNode;
import com.boundsmith.syntax.LiteralNode;
import com.boundsmith.syntax.NodeKind;
import com.boundsmith.syntax.SourceParseException;
import com.boundsmith.syntax.SyntaxNode;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class JavaSyntaxTranslatorTest {

    private JavaSyntaxTranslator translator;

    @BeforeEach
    void setUp() {
        translator = new JavaSyntaxTranslator();
    }

    private static List<SyntaxNode> findAll(SyntaxNode node, NodeKind kind) {
        List<SyntaxNode> found = new ArrayList<>();
        if (node.getKind() == kind) {
            found.add(node);
        }
        for (SyntaxNode child : node.getChildren()) {
            found.addAll(findAll(child, kind));
        }
        return found;
    }

    private static String wrap(String body) {
        return "class Sample {\n"
                + "    boolean check(int x, java.util.List<String> items, int[] values, double ratio) {\n"
                + body
                + "    }\n"
                + "}\n";
    }

    @Test
    void test_comparison_with_location() throws SourceParseException {
        SyntaxNode tree = translator.parse(wrap("        return x > 3;\n"), "Sample.java");

        List<SyntaxNode> comparisons = findAll(tree, NodeKind.COMPARISON);
        assertEquals(1, comparisons.size());
        ComparisonNode comparison = (ComparisonNode) comparisons.get(0);
        assertEquals("x > 3", comparison.getText());
        assertEquals(List.of(">"), comparison.getOperators());
        assertEquals(3, comparison.getLine());
        assertEquals(16, comparison.getColumn());
        assertEquals(NodeKind.NAME, comparison.getOperands().get(0).getKind());
    }

    @Test
    void test_long_operand_chain_renders_each_node() throws SourceParseException {
        List<String> terms = new ArrayList<>();
        for (int i = 0; i < 2_000; i++) {
            terms.add("v" + i);
        }
        String sum = String.join(" + ", terms);
        SyntaxNode tree = translator.parse(wrap("        return " + sum + " > 3;\n"), "Sample.java");

        ComparisonNode comparison = (ComparisonNode) findAll(tree, NodeKind.COMPARISON).get(0);
        assertEquals(sum + " > 3", comparison.getText());
        assertEquals(NodeKind.OTHER, comparison.getOperands().get(0).getKind());
        assertEquals(sum, comparison.getOperands().get(0).getText());
    }

    @Test
    void test_parentheses_are_transparent() throws SourceParseException {
        SyntaxNode tree = translator.parse(wrap("        return (x) >= (10);\n"), "Sample.java");

        ComparisonNode comparison = (ComparisonNode) findAll(tree, NodeKind.COMPARISON).get(0);
        assertEquals(NodeKind.NAME, comparison.getOperands().get(0).getKind());
        assertEquals(NodeKind.NUMBER_LITERAL, comparison.getOperands().get(1).getKind());
    }

    @Test
    void test_conditional_and_is_flattened() throws SourceParseException {
        SyntaxNode tree = translator.parse(wrap("        return x > 0 && x < 100 && ratio != 0.5;\n"), "Sample.java");

        BooleanOperationNode and = (BooleanOperationNode) findAll(tree, NodeKind.BOOLEAN_AND).get(0);
        assertEquals(3, and.getOperands().size());
        assertTrue(findAll(tree, NodeKind.BOOLEAN_OR).isEmpty());
    }

    @Test
    void test_length_forms() throws SourceParseException {
        SyntaxNode tree = translator.parse(wrap(
                "        return items.size() > 10 || values.length == 0 || items.get(0).length() < 5;\n"),
                "Sample.java");

        List<String> lengths = new ArrayList<>();
        for (SyntaxNode node : findAll(tree, NodeKind.LENGTH_CALL)) {
            lengths.add(node.getText());
        }
        assertEquals(List.of("items.size()", "values.length", "items.get(0).length()"), lengths);
    }

    @Test
    void test_literal_forms() throws SourceParseException {
        SyntaxNode tree = translator.parse(wrap("        return x > -5 && x < 10_000L && ratio <= 2.5f;\n"), "Sample.java");

        List<NumericValue> literals = new ArrayList<>();
        for (SyntaxNode node : findAll(tree, NodeKind.NUMBER_LITERAL)) {
            literals.add(((LiteralNode) node).getValue());
        }
        assertEquals(List.of(NumericValue.ofInteger(-5), NumericValue.ofInteger(10000), NumericValue.ofFloat("2.5")),
                literals);
    }

    @Test
    void test_field_initializers_and_lambdas_are_roots() throws SourceParseException {
        String source = "class Limits {\n"
                + "    static final int MAX = 42;\n"
                + "    java.util.function.IntPredicate big = v -> v >= 1000;\n"
                + "}\n";

        SyntaxNode tree = translator.parse(source, "Limits.java");

        assertEquals(1, findAll(tree, NodeKind.COMPARISON).size());
        List<NumericValue> literals = new ArrayList<>();
        for (SyntaxNode node : findAll(tree, NodeKind.NUMBER_LITERAL)) {
            literals.add(((LiteralNode) node).getValue());
        }
        assertTrue(literals.contains(NumericValue.ofInteger(42)));
        assertTrue(literals.contains(NumericValue.ofInteger(1000)));
    }

    @Test
    void test_invalid_source() {
        SourceParseException e = assertThrows(SourceParseException.class,
                () -> translator.parse("class Broken { void f() { int x = ; } }", "Broken.java"));

        assertEquals("Broken.java", e.getFile());
        assertEquals(1, e.getLine());
    }

    @Test
    void test_records_and_switch_expressions_parse() throws SourceParseException {
        String source = "record Range(int lo, int hi) {\n"
                + "    String label(int code) {\n"
                + "        return switch (code) {\n"
                + "            case 1 -> \"one\";\n"
                + "            default -> code > 9 ? \"many\" : \"few\";\n"
                + "        };\n"
                + "    }\n"
                + "}\n";

        SyntaxNode tree = translator.parse(source, "Range.java");

        assertEquals(1, findAll(tree, NodeKind.COMPARISON).size());
    }
}
