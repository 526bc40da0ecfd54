package com.boundsmith.syntax;

import java.util.List;
import java.util.function.Supplier;

/**
 * A flattened {@code and}/{@code or} ({@code &&}/{@code ||}) over two or more operands.
 */
public final class BooleanOperationNode extends SyntaxNode {

    public BooleanOperationNode(NodeKind kind, String text, int line, int column, List<SyntaxNode> operands) {
        this(kind, () -> text, line, column, operands);
    }

    public BooleanOperationNode(NodeKind kind, Supplier<String> text, int line, int column, List<SyntaxNode> operands) {
        super(kind, text, line, column, operands);
        if (kind != NodeKind.BOOLEAN_AND && kind != NodeKind.BOOLEAN_OR) {
            throw new IllegalArgumentException("Not a boolean operation kind: " + kind);
        }
        if (operands.size() < 2) {
            throw new IllegalArgumentException("A boolean operation needs at least two operands");
        }
    }

    public boolean isConjunction() {
        return getKind() == NodeKind.BOOLEAN_AND;
    }

    public List<SyntaxNode> getOperands() {
        return getChildren();
    }
}
