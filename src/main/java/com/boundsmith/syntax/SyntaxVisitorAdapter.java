package com.boundsmith.syntax;

/**
 * Base visitor over the neutral syntax tree. {@link #visit(SyntaxNode)} dispatches on the
 * node's {@link NodeKind}; every {@code visit*} method descends into the children unless
 * overridden.
 */
public abstract class SyntaxVisitorAdapter {

    public void visit(SyntaxNode node) {
        switch (node.getKind()) {
            case COMPARISON -> visitComparison((ComparisonNode) node);
            case BOOLEAN_AND, BOOLEAN_OR -> visitBooleanOperation((BooleanOperationNode) node);
            case LENGTH_CALL -> visitLengthCall((LengthCallNode) node);
            case NUMBER_LITERAL -> visitLiteral((LiteralNode) node);
            default -> visitExpression(node);
        }
    }

    protected void visitComparison(ComparisonNode node) {
        visitChildren(node);
    }

    protected void visitBooleanOperation(BooleanOperationNode node) {
        visitChildren(node);
    }

    protected void visitLengthCall(LengthCallNode node) {
        visitChildren(node);
    }

    protected void visitLiteral(LiteralNode node) {
        visitChildren(node);
    }

    protected void visitExpression(SyntaxNode node) {
        visitChildren(node);
    }

    protected final void visitChildren(SyntaxNode node) {
        for (SyntaxNode child : node.getChildren()) {
            visit(child);
        }
    }
}
