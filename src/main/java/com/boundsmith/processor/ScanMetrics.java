package com.boundsmith.processor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Counters and timing for one scan, logged as a summary when the scan ends.
 */
public class ScanMetrics {

    private static final Logger logger = LoggerFactory.getLogger(ScanMetrics.class);

    private Instant startTime;
    private long totalAnalysisTimeMs = 0;

    private int sourceFiles = 0;
    private int testFiles = 0;
    private int skippedFiles = 0;
    private int predicates = 0;
    private int ranges = 0;
    private int testLiterals = 0;

    /**
     * Start timing the scan.
     */
    public void startAnalysis() {
        this.startTime = Instant.now();
    }

    /**
     * End timing the scan.
     */
    public void endAnalysis() {
        if (startTime != null) {
            totalAnalysisTimeMs = Duration.between(startTime, Instant.now()).toMillis();
        }
    }

    public void recordSourceFile(int predicateCount, int rangeCount) {
        sourceFiles++;
        predicates += predicateCount;
        ranges += rangeCount;
    }

    public void recordTestFile() {
        testFiles++;
    }

    public void recordSkippedFile() {
        skippedFiles++;
    }

    public void recordCorpusSize(int literals) {
        testLiterals = literals;
    }

    public int getSourceFiles() {
        return sourceFiles;
    }

    public int getTestFiles() {
        return testFiles;
    }

    public int getSkippedFiles() {
        return skippedFiles;
    }

    public int getPredicates() {
        return predicates;
    }

    public int getRanges() {
        return ranges;
    }

    public int getTestLiterals() {
        return testLiterals;
    }

    public long getTotalAnalysisTimeMs() {
        return totalAnalysisTimeMs;
    }

    /**
     * Log a one-line summary of the scan.
     */
    public void logSummary() {
        logger.info("Scanned {} source files and {} test files ({} skipped) in {}ms: "
                        + "{} predicates, {} fused ranges, {} distinct test literals",
                sourceFiles, testFiles, skippedFiles, totalAnalysisTimeMs, predicates, ranges, testLiterals);
    }
}
