package com.boundsmith.report;

import com.boundsmith.model.AnalysisReport;

import java.io.IOException;
import java.io.Writer;

/**
 * Writes an {@link AnalysisReport} in one output format.
 */
public interface ReportRenderer {

    String TOOL_NAME = "boundsmith";

    String TOOL_VERSION = "0.1.0";

    void render(AnalysisReport report, Writer out) throws IOException;

    static ReportRenderer forFormat(ReportFormat format) {
        return switch (format) {
            case TEXT -> new TextReportRenderer();
            case JSON -> new JsonReportRenderer();
            case SARIF -> new SarifReportRenderer();
        };
    }
}
