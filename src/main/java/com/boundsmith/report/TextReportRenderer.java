package com.boundsmith.report;

import com.boundsmith.model.AnalysisReport;
import com.boundsmith.model.BoundaryTriplet;
import com.boundsmith.model.BoundaryValue;
import com.boundsmith.model.CoverageResult;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Plain text report: a summary line followed by one line per finding, e.g.
 * <pre>
 * BoundSmith: 1 boundaries, 0 uncovered, 1 partial
 *   app.py:4  retry_count > 3  -> test with (2, 3, 4)  [partial, missing 2]
 * </pre>
 */
public class TextReportRenderer implements ReportRenderer {

    @Override
    public void render(AnalysisReport report, Writer out) throws IOException {
        if (report.isCoverageChecked()) {
            out.write(String.format("BoundSmith: %d boundaries, %d uncovered, %d partial%n",
                    report.getTotalBoundaries(), report.getUncoveredCount(), report.getPartialCount()));
        } else {
            out.write(String.format("BoundSmith: %d boundaries (coverage not checked)%n", report.getTotalBoundaries()));
        }
        for (CoverageResult result : report.getFindings()) {
            out.write(formatFinding(result, report.isCoverageChecked()));
            out.write(System.lineSeparator());
        }
        out.flush();
    }

    static String formatFinding(CoverageResult result, boolean coverageChecked) {
        BoundaryTriplet triplet = result.getTriplet();
        StringBuilder line = new StringBuilder()
                .append("  ").append(triplet.getFile()).append(':').append(triplet.getLine())
                .append("  ").append(triplet.getDescription())
                .append("  -> test with ").append(triplet.formatValues());
        if (coverageChecked) {
            List<BoundaryValue> missing = result.getMissingValues();
            line.append("  [").append(result.getStatus().getLabel());
            if (!missing.isEmpty()) {
                line.append(", missing ")
                        .append(missing.stream().map(BoundaryValue::toString).collect(Collectors.joining(", ")));
            }
            line.append(']');
        }
        return line.toString();
    }
}
