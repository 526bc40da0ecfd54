package com.boundsmith;

import com.boundsmith.config.AnalysisConfigLoader;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class BoundsmithAppTest {

    @TempDir
    Path workspace;

    private BoundsmithApp app;
    private ByteArrayOutputStream out;
    private ByteArrayOutputStream err;
    private Path src;
    private Path tests;

    @BeforeEach
    void setUp() throws IOException {
        app = new BoundsmithApp(new AnalysisConfigLoader(workspace));
        out = new ByteArrayOutputStream();
        err = new ByteArrayOutputStream();
        src = Files.createDirectories(workspace.resolve("src"));
        tests = Files.createDirectories(workspace.resolve("tests"));
        Files.writeString(src.resolve("app.py"), "def should_retry(retry_count):\n    return retry_count > 3\n");
    }

    private int run(String... args) {
        return app.run(args, new PrintStream(out, true, StandardCharsets.UTF_8),
                new PrintStream(err, true, StandardCharsets.UTF_8));
    }

    private String stdout() {
        return out.toString(StandardCharsets.UTF_8);
    }

    private String stderr() {
        return err.toString(StandardCharsets.UTF_8);
    }

    @Test
    void test_uncovered_boundary_fails() throws IOException {
        Files.writeString(tests.resolve("test_app.py"), "def test_nothing():\n    assert True\n");

        assertEquals(BoundsmithApp.EXIT_UNCOVERED, run(src.toString(), "-t", tests.toString()));
        assertTrue(stdout().contains("BoundSmith: 1 boundaries, 1 uncovered, 0 partial"));
    }

    @Test
    void test_partial_coverage_fails_by_default() throws IOException {
        Files.writeString(tests.resolve("test_app.py"), "def test_retry():\n    assert should_retry(4)\n");

        assertEquals(BoundsmithApp.EXIT_UNCOVERED, run(src.toString(), "-t", tests.toString()));
    }

    @Test
    void test_partial_coverage_passes_when_configured() throws IOException {
        Files.writeString(tests.resolve("test_app.py"), "def test_retry():\n    assert should_retry(4)\n");
        Files.writeString(workspace.resolve(AnalysisConfigLoader.LOCAL_FILE), "boundsmith.failOnPartial=false\n");

        assertEquals(BoundsmithApp.EXIT_OK, run(src.toString(), "-t", tests.toString()));
    }

    @Test
    void test_full_coverage_passes() throws IOException {
        Files.writeString(tests.resolve("test_app.py"),
                "import pytest\n\n@pytest.mark.parametrize('n', [2, 3, 4])\ndef test_retry(n):\n    should_retry(n)\n");

        assertEquals(BoundsmithApp.EXIT_OK, run(src.toString(), "--tests", tests.toString()));
        assertTrue(stdout().contains("0 uncovered, 0 partial"));
    }

    @Test
    void test_without_tests_exit_is_zero() {
        assertEquals(BoundsmithApp.EXIT_OK, run(src.toString()));
        assertTrue(stdout().contains("(coverage not checked)"));
        assertTrue(stdout().contains("retry_count > 3  -> test with (2, 3, 4)"));
    }

    @Test
    void test_json_report_to_file() throws IOException {
        Path report = workspace.resolve("report.json");

        assertEquals(BoundsmithApp.EXIT_OK, run(src.toString(), "--json", "-o", report.toString()));

        assertEquals("", stdout());
        JsonNode root = new ObjectMapper().readTree(report.toFile());
        assertEquals(1, root.get("summary").get("boundaries").asInt());
        assertEquals(3, root.get("findings").get(0).get("literal").asInt());
    }

    @Test
    void test_sarif_report() throws IOException {
        assertEquals(BoundsmithApp.EXIT_OK, run(src.toString(), "--format=sarif"));

        JsonNode root = new ObjectMapper().readTree(stdout());
        assertEquals("boundary-gt", root.get("runs").get(0).get("results").get(0).get("ruleId").asText());
    }

    @Test
    void test_stub_generation() throws IOException {
        Path stubs = workspace.resolve("test_generated.py");

        assertEquals(BoundsmithApp.EXIT_OK, run(src.toString(), "-g", stubs.toString()));

        String source = Files.readString(stubs);
        assertTrue(source.contains("@pytest.mark.parametrize(\"val\", [2, 3, 4])"));
    }

    @Test
    void test_unsupported_stub_extension() {
        assertEquals(BoundsmithApp.EXIT_ERROR, run(src.toString(), "-g", "stubs.rb"));
        assertTrue(stderr().contains(".py or .java"));
    }

    @Test
    void test_usage_error() {
        assertEquals(BoundsmithApp.EXIT_ERROR, run("--bogus", src.toString()));
        assertTrue(stderr().contains("Unknown option"));
        assertTrue(stderr().contains("Usage:"));
    }

    @Test
    void test_help() {
        assertEquals(BoundsmithApp.EXIT_OK, run("--help"));
        assertTrue(stdout().contains("Usage:"));
    }

    @Test
    void test_missing_path() {
        assertEquals(BoundsmithApp.EXIT_ERROR, run(workspace.resolve("missing").toString()));
        assertTrue(stderr().contains("Path does not exist"));
    }

    @Test
    void test_no_parseable_sources() throws IOException {
        Files.writeString(src.resolve("app.py"), "def broken(:\n");

        assertEquals(BoundsmithApp.EXIT_ERROR, run(src.toString()));
    }

    @Test
    void test_invalid_configuration() throws IOException {
        Files.writeString(workspace.resolve(AnalysisConfigLoader.LOCAL_FILE), "boundsmith.floatEpsilon=-3\n");

        assertEquals(BoundsmithApp.EXIT_ERROR, run(src.toString()));
        assertTrue(stderr().contains("epsilon"));
    }
}
