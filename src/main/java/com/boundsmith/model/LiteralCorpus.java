package com.boundsmith.model;

import java.util.Collection;
import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

/**
 * Every numeric literal found in the test sources, without positions.
 * Matching against it is value based, not call-site based.
 */
public final class LiteralCorpus {

    private final Set<NumericValue> values = new HashSet<>();

    public LiteralCorpus() {
    }

    public LiteralCorpus(Collection<NumericValue> values) {
        this.values.addAll(values);
    }

    public void add(NumericValue value) {
        values.add(value);
    }

    public void addAll(LiteralCorpus other) {
        values.addAll(other.values);
    }

    /**
     * Type-strict lookup: an integer literal never matches a float one.
     */
    public boolean contains(NumericValue value) {
        return values.contains(value);
    }

    public boolean isEmpty() {
        return values.isEmpty();
    }

    public int size() {
        return values.size();
    }

    public Set<NumericValue> getValues() {
        return Collections.unmodifiableSet(values);
    }
}
