package com.boundsmith.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Outcome of one run: every unique boundary with its coverage, plus the files that were skipped.
 */
public final class AnalysisReport {

    private final List<CoverageResult> results;
    private final List<ScanWarning> warnings;
    private final int sourceFiles;
    private final int testFiles;
    private final boolean coverageChecked;

    public AnalysisReport(List<CoverageResult> results, List<ScanWarning> warnings,
                          int sourceFiles, int testFiles, boolean coverageChecked) {
        this.results = Collections.unmodifiableList(new ArrayList<>(results));
        this.warnings = Collections.unmodifiableList(new ArrayList<>(warnings));
        this.sourceFiles = sourceFiles;
        this.testFiles = testFiles;
        this.coverageChecked = coverageChecked;
    }

    /**
     * All unique boundaries, ordered by file, line and column.
     */
    public List<CoverageResult> getResults() {
        return results;
    }

    /**
     * Boundaries worth reporting: those with untested values, or all of them when
     * coverage was not checked.
     */
    public List<CoverageResult> getFindings() {
        if (!coverageChecked) {
            return results;
        }
        return results.stream().filter(r -> r.getStatus().hasGaps()).collect(Collectors.toList());
    }

    public List<ScanWarning> getWarnings() {
        return warnings;
    }

    /**
     * Number of source files that were analyzed successfully.
     */
    public int getSourceFiles() {
        return sourceFiles;
    }

    public int getTestFiles() {
        return testFiles;
    }

    public int getSkippedFiles() {
        return warnings.size();
    }

    public boolean isCoverageChecked() {
        return coverageChecked;
    }

    public int getTotalBoundaries() {
        return results.size();
    }

    public int count(CoverageStatus status) {
        return (int) results.stream().filter(r -> r.getStatus() == status).count();
    }

    public int getCoveredCount() {
        return count(CoverageStatus.COVERED);
    }

    public int getPartialCount() {
        return count(CoverageStatus.PARTIAL);
    }

    public int getUncoveredCount() {
        return count(CoverageStatus.UNCOVERED);
    }
}
