package com.boundsmith.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Language-neutral syntax tree node. The concrete subclass is determined by {@link #getKind()},
 * and {@link SyntaxVisitorAdapter} dispatches on that tag.
 */
public abstract class SyntaxNode {

    private final NodeKind kind;
    private final Supplier<String> textSource;
    private String text;
    private final int line;
    private final int column;
    private final List<SyntaxNode> children;

    protected SyntaxNode(NodeKind kind, String text, int line, int column, List<SyntaxNode> children) {
        this(kind, constant(text), line, column, children);
    }

    /**
     * @param text Renders the node's text; called at most once, on the first {@link #getText()}
     */
    protected SyntaxNode(NodeKind kind, Supplier<String> text, int line, int column, List<SyntaxNode> children) {
        this.kind = Objects.requireNonNull(kind, "kind");
        this.textSource = Objects.requireNonNull(text, "text");
        this.line = line;
        this.column = column;
        this.children = Collections.unmodifiableList(new ArrayList<>(children));
    }

    public NodeKind getKind() {
        return kind;
    }

    /**
     * Normalized source text of the node.
     */
    public String getText() {
        if (text == null) {
            text = Objects.requireNonNull(textSource.get(), "text");
        }
        return text;
    }

    /**
     * 1-based line of the first token.
     */
    public int getLine() {
        return line;
    }

    /**
     * 1-based column of the first token.
     */
    public int getColumn() {
        return column;
    }

    public List<SyntaxNode> getChildren() {
        return children;
    }

    private static Supplier<String> constant(String text) {
        Objects.requireNonNull(text, "text");
        return () -> text;
    }

    @Override
    public String toString() {
        return kind + "[" + getText() + "]@" + line + ":" + column;
    }
}
