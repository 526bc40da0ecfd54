package com.boundsmith.syntax;

/**
 * The closed set of node kinds the analysis distinguishes. Everything else is {@link #OTHER}.
 */
public enum NodeKind {
    /** Root of one source file; children are the file's top-level expressions. */
    MODULE,
    /** A binary or chained comparison. */
    COMPARISON,
    BOOLEAN_AND,
    BOOLEAN_OR,
    /** {@code len(x)}, {@code x.size()}, {@code x.length} ... */
    LENGTH_CALL,
    NUMBER_LITERAL,
    /** String, boolean, null or imaginary literal. */
    OTHER_LITERAL,
    NAME,
    ATTRIBUTE,
    CALL,
    SUBSCRIPT,
    OTHER;

    /**
     * Whether an expression of this kind can be the compared subject of a predicate.
     */
    public boolean isSubject() {
        return this == NAME || this == ATTRIBUTE || this == CALL || this == SUBSCRIPT || this == LENGTH_CALL;
    }
}
