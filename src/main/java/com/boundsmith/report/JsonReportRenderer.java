package com.boundsmith.report;

import com.boundsmith.model.AnalysisReport;
import com.boundsmith.model.BoundaryTriplet;
import com.boundsmith.model.BoundaryValue;
import com.boundsmith.model.CoverageResult;
import com.boundsmith.model.NumericValue;
import com.boundsmith.model.ScanWarning;
import com.fasterxml.jackson.core.StreamWriteFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.BigIntegerNode;
import com.fasterxml.jackson.databind.node.DecimalNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.Writer;
import java.util.List;
import java.util.Locale;

/**
 * Machine-readable report with stable field names:
 * {@code tool}, {@code summary}, {@code findings} and {@code warnings}.
 * Integer values are written as integers and float values always with a fraction, so
 * {@code 3} and {@code 3.0} stay distinguishable.
 */
public class JsonReportRenderer implements ReportRenderer {

    static final String UNCHECKED = "unchecked";

    private final ObjectMapper objectMapper;

    public JsonReportRenderer() {
        this.objectMapper = createObjectMapper();
    }

    static ObjectMapper createObjectMapper() {
        return JsonMapper.builder()
                .enable(SerializationFeature.INDENT_OUTPUT)
                .enable(StreamWriteFeature.WRITE_BIGDECIMAL_AS_PLAIN)
                .disable(StreamWriteFeature.AUTO_CLOSE_TARGET)
                .build();
    }

    @Override
    public void render(AnalysisReport report, Writer out) throws IOException {
        objectMapper.writeValue(out, toJson(report));
        out.write(System.lineSeparator());
        out.flush();
    }

    ObjectNode toJson(AnalysisReport report) {
        ObjectNode root = objectMapper.createObjectNode();
        root.put("tool", TOOL_NAME);

        ObjectNode summary = root.putObject("summary");
        summary.put("files", report.getSourceFiles());
        summary.put("testFiles", report.getTestFiles());
        summary.put("skippedFiles", report.getSkippedFiles());
        summary.put("boundaries", report.getTotalBoundaries());
        summary.put("covered", report.getCoveredCount());
        summary.put("partial", report.getPartialCount());
        summary.put("uncovered", report.getUncoveredCount());
        summary.put("coverageChecked", report.isCoverageChecked());

        ArrayNode findings = root.putArray("findings");
        for (CoverageResult result : report.getFindings()) {
            findings.add(toJson(result, report.isCoverageChecked()));
        }

        ArrayNode warnings = root.putArray("warnings");
        for (ScanWarning warning : report.getWarnings()) {
            ObjectNode node = warnings.addObject();
            node.put("file", warning.getFile());
            node.put("line", warning.getLine());
            node.put("message", warning.getMessage());
        }
        return root;
    }

    private ObjectNode toJson(CoverageResult result, boolean coverageChecked) {
        BoundaryTriplet triplet = result.getTriplet();
        ObjectNode finding = objectMapper.createObjectNode();
        finding.put("file", triplet.getFile());
        finding.put("line", triplet.getLine());
        finding.put("column", triplet.getColumn());
        finding.put("subject", triplet.getSubject());
        finding.put("operator", triplet.getOperatorDescriptor());

        List<NumericValue> literals = triplet.getLiterals();
        if (triplet.isRange()) {
            ArrayNode literal = finding.putArray("literal");
            literals.forEach(value -> literal.add(numberNode(value)));
        } else {
            finding.set("literal", numberNode(literals.get(0)));
        }

        ArrayNode values = finding.putArray("triplet");
        for (BoundaryValue value : triplet.getValues()) {
            if (value.isTestable()) {
                values.add(numberNode(value.getValue()));
            } else {
                values.addNull();
            }
        }

        if (coverageChecked) {
            ArrayNode missing = finding.putArray("missing");
            result.getMissingValues().forEach(value -> missing.add(numberNode(value.getValue())));
            finding.put("status", result.getStatus().getLabel());
        } else {
            finding.putNull("missing");
            finding.put("status", UNCHECKED);
        }
        finding.put("kind", triplet.isRange() ? "range" : "single");
        finding.put("type", triplet.getComparandType().name().toLowerCase(Locale.ROOT));
        finding.put("expression", triplet.getPredicate().getExpression());
        return finding;
    }

    static JsonNode numberNode(NumericValue value) {
        if (value.isInteger()) {
            return BigIntegerNode.valueOf(value.toBigInteger());
        }
        return DecimalNode.valueOf(value.toFloatDecimal());
    }
}
