package com.boundsmith.model;

/**
 * How much of a boundary triplet the test literals exercise.
 */
public enum CoverageStatus {
    COVERED("covered"),
    PARTIAL("partial"),
    UNCOVERED("uncovered");

    private final String label;

    CoverageStatus(String label) {
        this.label = label;
    }

    public String getLabel() {
        return label;
    }

    /**
     * Whether the boundary still has at least one value no test uses.
     */
    public boolean hasGaps() {
        return this != COVERED;
    }
}
