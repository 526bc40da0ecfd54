package com.boundsmith.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * A boundary triplet matched against the test literal corpus.
 */
public final class CoverageResult {

    private final BoundaryTriplet triplet;
    private final Map<BoundaryValue, Boolean> coverage;
    private final CoverageStatus status;

    public CoverageResult(BoundaryTriplet triplet, Map<BoundaryValue, Boolean> coverage, CoverageStatus status) {
        this.triplet = Objects.requireNonNull(triplet, "triplet");
        this.coverage = Collections.unmodifiableMap(new LinkedHashMap<>(coverage));
        this.status = Objects.requireNonNull(status, "status");
    }

    public BoundaryTriplet getTriplet() {
        return triplet;
    }

    /**
     * Covered flag per testable value, in triplet order.
     */
    public Map<BoundaryValue, Boolean> getCoverage() {
        return coverage;
    }

    public CoverageStatus getStatus() {
        return status;
    }

    public boolean isCovered(BoundaryValue value) {
        return coverage.getOrDefault(value, Boolean.FALSE);
    }

    /**
     * Testable values no test literal matches, in triplet order.
     */
    public List<BoundaryValue> getMissingValues() {
        List<BoundaryValue> missing = new ArrayList<>();
        for (Map.Entry<BoundaryValue, Boolean> entry : coverage.entrySet()) {
            if (!entry.getValue()) {
                missing.add(entry.getKey());
            }
        }
        return missing;
    }

    @Override
    public String toString() {
        return triplet + " [" + status.getLabel() + "]";
    }
}
