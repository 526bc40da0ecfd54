package com.boundsmith.syntax;

import java.util.List;
import java.util.function.Supplier;

/**
 * Any node without kind-specific data: modules, names, attribute accesses, calls,
 * subscripts, non-numeric literals and unsupported expressions.
 */
public final class ExpressionNode extends SyntaxNode {

    public ExpressionNode(NodeKind kind, String text, int line, int column, List<SyntaxNode> children) {
        this(kind, () -> text, line, column, children);
    }

    public ExpressionNode(NodeKind kind, Supplier<String> text, int line, int column, List<SyntaxNode> children) {
        super(kind, text, line, column, children);
        if (kind == NodeKind.COMPARISON || kind == NodeKind.BOOLEAN_AND || kind == NodeKind.BOOLEAN_OR
                || kind == NodeKind.NUMBER_LITERAL || kind == NodeKind.LENGTH_CALL) {
            throw new IllegalArgumentException("Kind " + kind + " has a dedicated node class");
        }
    }

    public static ExpressionNode leaf(NodeKind kind, String text, int line, int column) {
        return new ExpressionNode(kind, text, line, column, List.of());
    }
}
