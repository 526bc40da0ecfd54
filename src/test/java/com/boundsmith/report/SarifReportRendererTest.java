package com.boundsmith.report;

import com.boundsmith.model.AnalysisReport;
import com.boundsmith.model.ComparisonOperator;
import com.boundsmith.model.LiteralCorpus;
import com.boundsmith.model.NumericValue;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.StringWriter;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class SarifReportRendererTest {

    private static JsonNode render(AnalysisReport report) throws IOException {
        StringWriter out = new StringWriter();
        new SarifReportRenderer().render(report, out);
        return new ObjectMapper().readTree(out.toString());
    }

    @Test
    void test_single_uncovered_boundary() throws IOException {
        AnalysisReport report = ReportFixtures.report(List.of(
                        ReportFixtures.predicate("src/app.py", 4, ComparisonOperator.GREATER, NumericValue.ofInteger(3), "retry_count")),
                new LiteralCorpus(), true, List.of());

        JsonNode root = render(report);

        assertEquals("2.1.0", root.get("version").asText());
        assertEquals(SarifReportRenderer.SCHEMA, root.get("$schema").asText());
        JsonNode run = root.get("runs").get(0);
        assertEquals("boundsmith", run.get("tool").get("driver").get("name").asText());
        assertEquals(7, run.get("tool").get("driver").get("rules").size());

        JsonNode results = run.get("results");
        assertEquals(1, results.size());
        JsonNode result = results.get(0);
        assertEquals("boundary-gt", result.get("ruleId").asText());
        assertEquals("warning", result.get("level").asText());
        int ruleIndex = result.get("ruleIndex").asInt();
        assertEquals("boundary-gt", run.get("tool").get("driver").get("rules").get(ruleIndex).get("id").asText());
        JsonNode location = result.get("locations").get(0).get("physicalLocation");
        assertEquals("src/app.py", location.get("artifactLocation").get("uri").asText());
        assertEquals(4, location.get("region").get("startLine").asInt());
        assertEquals(12, location.get("region").get("startColumn").asInt());
        assertTrue(result.get("message").get("text").asText().startsWith("retry_count > 3: test with (2, 3, 4)"));
    }

    @Test
    void test_levels_and_range_rule() throws IOException {
        JsonNode results = render(ReportFixtures.mixedReport()).get("runs").get(0).get("results");

        assertEquals(2, results.size());
        assertEquals("note", results.get(0).get("level").asText());
        assertEquals(SarifReportRenderer.RANGE_RULE_ID, results.get(1).get("ruleId").asText());
        assertEquals("warning", results.get(1).get("level").asText());
    }

    @Test
    void test_missing_line_is_a_schema_error() {
        AnalysisReport report = ReportFixtures.report(List.of(
                        ReportFixtures.predicate("app.py", 0, ComparisonOperator.LESS, NumericValue.ofInteger(1), "x")),
                new LiteralCorpus(), false, List.of());

        assertThrows(SarifSchemaException.class, () -> new SarifReportRenderer().render(report, new StringWriter()));
    }

    @Test
    void test_rule_ids_are_unique() {
        List<String> ids = SarifReportRenderer.ruleIds();

        assertEquals(ids.size(), ids.stream().distinct().count());
        assertTrue(ids.contains("boundary-eq"));
    }
}
