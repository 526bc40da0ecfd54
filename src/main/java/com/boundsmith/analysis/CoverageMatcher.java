package com.boundsmith.analysis;

import com.boundsmith.model.BoundaryTriplet;
import com.boundsmith.model.BoundaryValue;
import com.boundsmith.model.CoverageResult;
import com.boundsmith.model.CoverageStatus;
import com.boundsmith.model.LiteralCorpus;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Matches boundary values against the test literal corpus.
 */
public class CoverageMatcher {

    private static final Logger logger = LoggerFactory.getLogger(CoverageMatcher.class);

    /** Report order: file path, then line, then column. */
    public static final Comparator<BoundaryTriplet> REPORT_ORDER = Comparator
            .comparing(BoundaryTriplet::getFile)
            .thenComparingInt(BoundaryTriplet::getLine)
            .thenComparingInt(BoundaryTriplet::getColumn);

    /**
     * Deduplicates, orders and matches all triplets of a run.
     *
     * @param triplets Triplets from every source file
     * @param corpus Literals of every test file
     * @return One result per unique boundary, in report order
     */
    public List<CoverageResult> matchAll(List<BoundaryTriplet> triplets, LiteralCorpus corpus) {
        List<BoundaryTriplet> unique = deduplicate(triplets);
        unique.sort(REPORT_ORDER);
        List<CoverageResult> results = new ArrayList<>(unique.size());
        for (BoundaryTriplet triplet : unique) {
            results.add(match(triplet, corpus));
        }
        logger.debug("Matched {} unique boundaries ({} before deduplication) against {} literals",
                unique.size(), triplets.size(), corpus.size());
        return results;
    }

    /**
     * Matches one triplet. Untestable values are not part of the result.
     */
    public CoverageResult match(BoundaryTriplet triplet, LiteralCorpus corpus) {
        Map<BoundaryValue, Boolean> coverage = new LinkedHashMap<>();
        int covered = 0;
        for (BoundaryValue value : triplet.getTestableValues()) {
            boolean hit = corpus.contains(value.getValue());
            coverage.put(value, hit);
            if (hit) {
                covered++;
            }
        }
        CoverageStatus status;
        if (covered == coverage.size()) {
            status = CoverageStatus.COVERED;
        } else if (covered == 0) {
            status = CoverageStatus.UNCOVERED;
        } else {
            status = CoverageStatus.PARTIAL;
        }
        return new CoverageResult(triplet, coverage, status);
    }

    /**
     * Keeps the first triplet for every (file, line, subject, operator, literal) identity.
     */
    public List<BoundaryTriplet> deduplicate(List<BoundaryTriplet> triplets) {
        Map<String, BoundaryTriplet> unique = new LinkedHashMap<>();
        for (BoundaryTriplet triplet : triplets) {
            unique.putIfAbsent(triplet.getDeduplicationKey(), triplet);
        }
        return new ArrayList<>(unique.values());
    }
}
