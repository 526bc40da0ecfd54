package com.boundsmith.report;

import java.util.Locale;
import java.util.Optional;

/**
 * Output formats of the analysis report.
 */
public enum ReportFormat {
    TEXT("text"),
    JSON("json"),
    SARIF("sarif");

    private final String id;

    ReportFormat(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static Optional<ReportFormat> fromId(String id) {
        String normalized = id.trim().toLowerCase(Locale.ROOT);
        for (ReportFormat format : values()) {
            if (format.id.equals(normalized)) {
                return Optional.of(format);
            }
        }
        return Optional.empty();
    }
}
