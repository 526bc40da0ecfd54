package com.boundsmith.model;

import java.util.Objects;

/**
 * One labelled value of a boundary triplet.
 */
public final class BoundaryValue {

    public static final String BELOW = "below";
    public static final String AT = "at";
    public static final String ABOVE = "above";
    public static final String AT_LOWER = "at-lower";
    public static final String AT_UPPER = "at-upper";

    private final String label;
    private final NumericValue value;
    private final boolean testable;

    public BoundaryValue(String label, NumericValue value, boolean testable) {
        this.label = Objects.requireNonNull(label, "label");
        this.value = Objects.requireNonNull(value, "value");
        this.testable = testable;
    }

    public static BoundaryValue testable(String label, NumericValue value) {
        return new BoundaryValue(label, value, true);
    }

    /**
     * A value that cannot be produced by any input, such as a negative length.
     */
    public static BoundaryValue untestable(String label, NumericValue value) {
        return new BoundaryValue(label, value, false);
    }

    public String getLabel() {
        return label;
    }

    public NumericValue getValue() {
        return value;
    }

    public boolean isTestable() {
        return testable;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof BoundaryValue)) {
            return false;
        }
        BoundaryValue that = (BoundaryValue) o;
        return testable == that.testable && label.equals(that.label) && value.equals(that.value);
    }

    @Override
    public int hashCode() {
        return Objects.hash(label, value, testable);
    }

    /**
     * The value, or {@code untestable} when no input can reach it.
     */
    @Override
    public String toString() {
        return testable ? value.toString() : "untestable";
    }
}
