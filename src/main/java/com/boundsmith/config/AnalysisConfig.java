package com.boundsmith.config;

import com.boundsmith.analysis.BoundaryCalculator;
import com.boundsmith.report.ReportFormat;

import java.math.BigDecimal;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Settings of one analysis run. Instances are immutable; the {@code with*} methods
 * return modified copies so command-line flags can override file settings.
 */
public final class AnalysisConfig {

    public static final Set<String> DEFAULT_EXCLUDED_DIRECTORIES = Set.of(
            ".git", ".hg", ".svn", ".tox", ".venv", "venv", "__pycache__", "node_modules", "target", "build");

    private final BigDecimal floatEpsilon;
    private final boolean failOnPartial;
    private final Set<String> excludedDirectories;
    private final ReportFormat defaultFormat;

    public AnalysisConfig(BigDecimal floatEpsilon, boolean failOnPartial, Set<String> excludedDirectories,
                          ReportFormat defaultFormat) {
        this.floatEpsilon = Objects.requireNonNull(floatEpsilon, "floatEpsilon");
        if (floatEpsilon.signum() <= 0) {
            throw new IllegalArgumentException("floatEpsilon must be positive: " + floatEpsilon);
        }
        this.failOnPartial = failOnPartial;
        this.excludedDirectories = Collections.unmodifiableSet(new LinkedHashSet<>(excludedDirectories));
        this.defaultFormat = Objects.requireNonNull(defaultFormat, "defaultFormat");
    }

    /**
     * Built-in settings, used when no properties are available at all.
     */
    public static AnalysisConfig defaults() {
        return new AnalysisConfig(BoundaryCalculator.DEFAULT_EPSILON, true, DEFAULT_EXCLUDED_DIRECTORIES, ReportFormat.TEXT);
    }

    /**
     * Step used around float literals.
     */
    public BigDecimal getFloatEpsilon() {
        return floatEpsilon;
    }

    /**
     * Whether partially covered boundaries fail the run like uncovered ones.
     */
    public boolean isFailOnPartial() {
        return failOnPartial;
    }

    /**
     * Directory names never descended into while discovering files.
     */
    public Set<String> getExcludedDirectories() {
        return excludedDirectories;
    }

    public ReportFormat getDefaultFormat() {
        return defaultFormat;
    }

    public AnalysisConfig withFloatEpsilon(BigDecimal epsilon) {
        return new AnalysisConfig(epsilon, failOnPartial, excludedDirectories, defaultFormat);
    }

    public AnalysisConfig withDefaultFormat(ReportFormat format) {
        return new AnalysisConfig(floatEpsilon, failOnPartial, excludedDirectories, format);
    }

    @Override
    public String toString() {
        return "AnalysisConfig{floatEpsilon=" + floatEpsilon.toPlainString()
                + ", failOnPartial=" + failOnPartial
                + ", excludedDirectories=" + excludedDirectories
                + ", defaultFormat=" + defaultFormat.getId() + "}";
    }
}
