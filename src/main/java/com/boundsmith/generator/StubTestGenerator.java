package com.boundsmith.generator;

import com.boundsmith.model.AnalysisReport;
import com.boundsmith.model.BoundaryTriplet;
import com.boundsmith.model.CoverageResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Writes one parameterized stub test per reported boundary. The template follows the
 * extension of the output file: pytest for {@code .py}, JUnit 5 for {@code .java}.
 */
public class StubTestGenerator {

    private static final Logger logger = LoggerFactory.getLogger(StubTestGenerator.class);

    /**
     * Selects the template for an output file.
     *
     * @return The template, or empty if the extension is not supported
     */
    public static Optional<StubTemplate> templateFor(Path output) {
        Path fileName = output.getFileName();
        String name = fileName == null ? "" : fileName.toString().toLowerCase(Locale.ROOT);
        for (StubTemplate template : List.of(new PytestStubTemplate(), new JUnitStubTemplate())) {
            if (name.endsWith(template.getExtension())) {
                return Optional.of(template);
            }
        }
        return Optional.empty();
    }

    /**
     * Writes stubs for the report's findings.
     *
     * @param report Analysis report
     * @param output File to write; its extension selects the template
     * @return Number of stubs written; nothing is written when there are no findings
     * @throws IOException If the file cannot be written
     */
    public int write(AnalysisReport report, Path output) throws IOException {
        StubTemplate template = templateFor(output)
                .orElseThrow(() -> new IllegalArgumentException("Unsupported stub file type: " + output));
        List<CoverageResult> findings = report.getFindings();
        if (findings.isEmpty()) {
            logger.info("No boundaries to generate stubs for");
            return 0;
        }
        Files.writeString(output, generate(findings, template, fileStem(output)), StandardCharsets.UTF_8);
        logger.info("Generated {} stub tests in {}", findings.size(), output);
        return findings.size();
    }

    /**
     * Renders the stub file for the given findings.
     */
    public String generate(List<CoverageResult> findings, StubTemplate template, String fileStem) {
        StringBuilder source = new StringBuilder(template.header(fileStem));
        Set<String> usedNames = new HashSet<>();
        for (CoverageResult result : findings) {
            String name = uniqueName(template.testName(result), usedNames);
            source.append(template.stub(name, result));
        }
        source.append(template.footer());
        return source.toString();
    }

    private static String uniqueName(String base, Set<String> usedNames) {
        String name = base;
        int suffix = 2;
        while (!usedNames.add(name)) {
            name = base + "_" + suffix++;
        }
        return name;
    }

    /**
     * Turns arbitrary text into an identifier fragment: runs of other characters become one
     * underscore, e.g. {@code len(items)} becomes {@code len_items}.
     */
    static String identifier(String text) {
        String cleaned = text.replaceAll("[^A-Za-z0-9_]+", "_").replaceAll("_+", "_");
        cleaned = cleaned.replaceAll("^_|_$", "");
        return cleaned.isEmpty() ? "value" : cleaned;
    }

    static String sourceFileStem(BoundaryTriplet triplet) {
        return fileStem(Path.of(triplet.getFile()));
    }

    static String fileStem(Path file) {
        Path fileName = file.getFileName();
        String name = fileName == null ? "" : fileName.toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
