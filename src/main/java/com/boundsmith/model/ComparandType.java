package com.boundsmith.model;

/**
 * What kind of quantity a predicate compares, which decides the boundary step.
 */
public enum ComparandType {
    INTEGER,
    FLOAT,
    /** The length of a collection or string; never negative. */
    LENGTH
}
