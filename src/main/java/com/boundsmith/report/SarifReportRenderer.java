package com.boundsmith.report;

import com.boundsmith.model.AnalysisReport;
import com.boundsmith.model.BoundaryTriplet;
import com.boundsmith.model.BoundaryValue;
import com.boundsmith.model.ComparisonOperator;
import com.boundsmith.model.CoverageResult;
import com.boundsmith.model.CoverageStatus;
import com.boundsmith.model.Predicate;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.Writer;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * SARIF 2.1.0 log with one run. Every reported boundary becomes a {@code result} whose
 * {@code ruleId} names the operator kind and whose physical location points at the comparison.
 */
public class SarifReportRenderer implements ReportRenderer {

    static final String SCHEMA = "https://json.schemastore.org/sarif-2.1.0.json";
    static final String SARIF_VERSION = "2.1.0";
    static final String RANGE_RULE_ID = "boundary-range";

    private final ObjectMapper objectMapper;

    public SarifReportRenderer() {
        this.objectMapper = JsonReportRenderer.createObjectMapper();
    }

    @Override
    public void render(AnalysisReport report, Writer out) throws IOException {
        objectMapper.writeValue(out, toSarif(report));
        out.write(System.lineSeparator());
        out.flush();
    }

    /**
     * Builds the SARIF log.
     *
     * @throws SarifSchemaException If a finding has no file or no valid line
     */
    ObjectNode toSarif(AnalysisReport report) {
        List<String> ruleIds = ruleIds();

        ObjectNode root = objectMapper.createObjectNode();
        root.put("$schema", SCHEMA);
        root.put("version", SARIF_VERSION);
        ObjectNode run = root.putArray("runs").addObject();

        ObjectNode driver = run.putObject("tool").putObject("driver");
        driver.put("name", TOOL_NAME);
        driver.put("version", TOOL_VERSION);
        ArrayNode rules = driver.putArray("rules");
        for (String ruleId : ruleIds) {
            ObjectNode rule = rules.addObject();
            rule.put("id", ruleId);
            rule.putObject("shortDescription").put("text", ruleDescription(ruleId));
            rule.putObject("defaultConfiguration").put("level", "warning");
        }

        ArrayNode results = run.putArray("results");
        for (CoverageResult finding : report.getFindings()) {
            results.add(toResult(finding, report.isCoverageChecked(), ruleIds));
        }
        return root;
    }

    private ObjectNode toResult(CoverageResult finding, boolean coverageChecked, List<String> ruleIds) {
        BoundaryTriplet triplet = finding.getTriplet();
        if (triplet.getFile() == null || triplet.getFile().isBlank()) {
            throw new SarifSchemaException("Finding '" + triplet.getDescription() + "' has no file");
        }
        if (triplet.getLine() < 1) {
            throw new SarifSchemaException("Finding '" + triplet.getDescription() + "' in " + triplet.getFile()
                    + " has no source line");
        }

        String ruleId = ruleId(triplet);
        ObjectNode result = objectMapper.createObjectNode();
        result.put("ruleId", ruleId);
        result.put("ruleIndex", ruleIds.indexOf(ruleId));
        boolean warning = coverageChecked && finding.getStatus() == CoverageStatus.UNCOVERED;
        result.put("level", warning ? "warning" : "note");
        result.putObject("message").put("text", message(finding, coverageChecked));

        ObjectNode physicalLocation = result.putArray("locations").addObject().putObject("physicalLocation");
        physicalLocation.putObject("artifactLocation").put("uri", toUri(triplet.getFile()));
        ObjectNode region = physicalLocation.putObject("region");
        region.put("startLine", triplet.getLine());
        if (triplet.getColumn() >= 1) {
            region.put("startColumn", triplet.getColumn());
        }
        return result;
    }

    /**
     * Rule id of a triplet: one per comparison operator, plus one for fused ranges.
     */
    static String ruleId(BoundaryTriplet triplet) {
        if (triplet.isRange()) {
            return RANGE_RULE_ID;
        }
        return ((Predicate) triplet.getPredicate()).getOperator().getRuleId();
    }

    static List<String> ruleIds() {
        List<String> ids = new ArrayList<>();
        for (ComparisonOperator operator : ComparisonOperator.values()) {
            ids.add(operator.getRuleId());
        }
        ids.add(RANGE_RULE_ID);
        return ids;
    }

    private static String ruleDescription(String ruleId) {
        if (ruleId.equals(RANGE_RULE_ID)) {
            return "Range endpoints not exercised by tests";
        }
        for (ComparisonOperator operator : ComparisonOperator.values()) {
            if (operator.getRuleId().equals(ruleId)) {
                return "Boundary of a '" + operator.getDisplayName() + "' comparison not exercised by tests";
            }
        }
        return ruleId;
    }

    private static String message(CoverageResult finding, boolean coverageChecked) {
        BoundaryTriplet triplet = finding.getTriplet();
        String text = triplet.getDescription() + ": test with " + triplet.formatValues();
        if (!coverageChecked) {
            return text;
        }
        List<BoundaryValue> missing = finding.getMissingValues();
        return text + " (" + finding.getStatus().getLabel() + ", missing "
                + missing.stream().map(BoundaryValue::toString).collect(Collectors.joining(", ")) + ")";
    }

    private static String toUri(String file) {
        Path path = Path.of(file);
        if (path.isAbsolute()) {
            return path.toUri().toString();
        }
        return file.replace('\\', '/').replace(" ", "%20");
    }
}
