package com.boundsmith.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Supplier;

/**
 * A comparison, possibly chained: {@code a < b <= c} has operands {@code [a, b, c]}
 * and operators {@code ["<", "<="]}. Operators are kept as written, so membership and
 * identity tests ({@code in}, {@code not in}, {@code is}, {@code is not}) appear too.
 */
public final class ComparisonNode extends SyntaxNode {

    private final List<String> operators;

    public ComparisonNode(String text, int line, int column, List<SyntaxNode> operands, List<String> operators) {
        this(() -> text, line, column, operands, operators);
    }

    public ComparisonNode(Supplier<String> text, int line, int column, List<SyntaxNode> operands, List<String> operators) {
        super(NodeKind.COMPARISON, text, line, column, operands);
        if (operands.size() != operators.size() + 1 || operators.isEmpty()) {
            throw new IllegalArgumentException("A comparison needs n operators and n + 1 operands");
        }
        this.operators = Collections.unmodifiableList(new ArrayList<>(operators));
    }

    public List<SyntaxNode> getOperands() {
        return getChildren();
    }

    public List<String> getOperators() {
        return operators;
    }

    public boolean isChained() {
        return operators.size() > 1;
    }
}
