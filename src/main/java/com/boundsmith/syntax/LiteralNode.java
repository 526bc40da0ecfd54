package com.boundsmith.syntax;

import com.boundsmith.model.NumericValue;

import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * A numeric literal, including a negated one such as {@code -10}.
 */
public final class LiteralNode extends SyntaxNode {

    private final NumericValue value;

    public LiteralNode(NumericValue value, String text, int line, int column) {
        this(value, () -> text, line, column);
    }

    public LiteralNode(NumericValue value, Supplier<String> text, int line, int column) {
        super(NodeKind.NUMBER_LITERAL, text, line, column, List.of());
        this.value = Objects.requireNonNull(value, "value");
    }

    public NumericValue getValue() {
        return value;
    }
}
