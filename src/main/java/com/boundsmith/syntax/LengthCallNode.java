package com.boundsmith.syntax;

import java.util.List;
import java.util.function.Supplier;

/**
 * A length-of-collection expression: {@code len(items)} in Python,
 * {@code items.size()}, {@code text.length()} or {@code array.length} in Java.
 */
public final class LengthCallNode extends SyntaxNode {

    public LengthCallNode(String text, int line, int column, SyntaxNode argument) {
        this(() -> text, line, column, argument);
    }

    public LengthCallNode(Supplier<String> text, int line, int column, SyntaxNode argument) {
        super(NodeKind.LENGTH_CALL, text, line, column, List.of(argument));
    }

    /**
     * The expression whose length is taken.
     */
    public SyntaxNode getArgument() {
        return getChildren().get(0);
    }
}
