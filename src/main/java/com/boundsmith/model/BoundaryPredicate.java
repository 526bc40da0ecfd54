package com.boundsmith.model;

/**
 * A single-sided or fused range comparison that a boundary triplet can be computed for.
 */
public interface BoundaryPredicate {

    String getFile();

    int getLine();

    int getColumn();

    /**
     * Normalized source text of the compared expression, e.g. {@code len(items)}.
     */
    String getSubject();

    ComparandType getComparandType();

    /**
     * Operator descriptor used for reporting and deduplication:
     * the operator symbol, or {@code <lower-op>..<upper-op>} for a range.
     */
    String getOperatorDescriptor();

    /**
     * Human readable form, e.g. {@code retry_count > 3} or {@code 0 < x < 100}.
     */
    String describe();

    /**
     * Source text of the comparison (or comparisons) the predicate was extracted from.
     */
    String getExpression();
}
