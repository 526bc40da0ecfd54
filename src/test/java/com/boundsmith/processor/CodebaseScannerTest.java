package com.boundsmith.processor;

import com.boundsmith.config.AnalysisConfig;
import com.boundsmith.model.AnalysisReport;
import com.boundsmith.model.CoverageResult;
import com.boundsmith.model.CoverageStatus;
import com.boundsmith.model.ScanWarning;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class CodebaseScannerTest {

    @TempDir
    Path workspace;

    private Path src;
    private Path tests;
    private CodebaseScanner scanner;

    @BeforeEach
    void setUp() throws IOException {
        src = Files.createDirectories(workspace.resolve("src"));
        tests = Files.createDirectories(workspace.resolve("tests"));
        scanner = new CodebaseScanner(AnalysisConfig.defaults());
    }

    private static Path write(Path file, String content) throws IOException {
        Files.createDirectories(file.getParent());
        return Files.writeString(file, content, StandardCharsets.UTF_8);
    }

    @Test
    void test_partial_coverage_end_to_end() throws Exception {
        write(src.resolve("app.py"), "def should_retry(retry_count):\n    return retry_count > 3\n");
        write(tests.resolve("test_app.py"), "def test_retry():\n    assert should_retry(3) is False\n");

        AnalysisReport report = scanner.scan(List.of(src), List.of(tests));

        assertTrue(report.isCoverageChecked());
        assertEquals(1, report.getSourceFiles());
        assertEquals(1, report.getTestFiles());
        assertEquals(1, report.getTotalBoundaries());
        CoverageResult result = report.getResults().get(0);
        assertEquals(CoverageStatus.PARTIAL, result.getStatus());
        assertEquals("retry_count > 3", result.getTriplet().getDescription());
        assertEquals(2, result.getTriplet().getLine());
        assertEquals("(2, 3, 4)", result.getTriplet().formatValues());
        assertEquals(2, result.getMissingValues().size());
    }

    @Test
    void test_range_is_covered_by_both_endpoints() throws Exception {
        write(src.resolve("bounds.py"), "def valid(x):\n    return 0 < x < 100\n");
        write(tests.resolve("test_bounds.py"), "def test_valid():\n    assert not valid(0)\n    assert not valid(100)\n");

        AnalysisReport report = scanner.scan(List.of(src), List.of(tests));

        assertEquals(1, report.getTotalBoundaries());
        assertTrue(report.getResults().get(0).getTriplet().isRange());
        assertEquals(CoverageStatus.COVERED, report.getResults().get(0).getStatus());
        assertTrue(report.getFindings().isEmpty());
    }

    @Test
    void test_without_tests_coverage_is_not_checked() throws Exception {
        write(src.resolve("app.py"), "LIMIT_OK = size <= 10\n");

        AnalysisReport report = scanner.scan(List.of(src), List.of());

        assertFalse(report.isCoverageChecked());
        assertEquals(1, report.getFindings().size());
        assertEquals(CoverageStatus.UNCOVERED, report.getResults().get(0).getStatus());
    }

    @Test
    void test_broken_file_is_skipped_with_warning() throws Exception {
        write(src.resolve("good.py"), "ok = x == 1\n");
        write(src.resolve("bad.py"), "if x > :\n    pass\n");

        AnalysisReport report = scanner.scan(List.of(src), List.of());

        assertEquals(1, report.getSourceFiles());
        assertEquals(1, report.getTotalBoundaries());
        assertEquals(1, report.getWarnings().size());
        ScanWarning warning = report.getWarnings().get(0);
        assertTrue(warning.getFile().endsWith("bad.py"));
        assertEquals(1, warning.getLine());
    }

    @Test
    void test_pathologically_nested_file_does_not_abort_the_scan() throws Exception {
        int depth = 50_000;
        write(src.resolve("a.py"), "if x > 3:\n    pass\n");
        write(src.resolve("b.py"), "y = " + "(".repeat(depth) + "x" + ")".repeat(depth) + " > 1\n");

        AnalysisReport report = scanner.scan(List.of(src), List.of());

        assertEquals(1, report.getSourceFiles());
        assertEquals(1, report.getTotalBoundaries());
        assertEquals("x > 3", report.getResults().get(0).getTriplet().getDescription());
        assertEquals(1, report.getWarnings().size());
        assertTrue(report.getWarnings().get(0).getFile().endsWith("b.py"));
    }

    @Test
    void test_no_parseable_sources() throws IOException {
        write(src.resolve("bad.py"), "def (:\n");

        NoParseableSourcesException e = assertThrows(NoParseableSourcesException.class,
                () -> scanner.scan(List.of(src), List.of()));
        assertEquals(1, e.getAttemptedFiles());
    }

    @Test
    void test_empty_source_tree_is_not_an_error() throws Exception {
        AnalysisReport report = scanner.scan(List.of(src), List.of());

        assertEquals(0, report.getTotalBoundaries());
        assertEquals(0, report.getSourceFiles());
    }

    @Test
    void test_missing_root() {
        assertThrows(IOException.class, () -> scanner.scan(List.of(workspace.resolve("nope")), List.of()));
    }

    @Test
    void test_discovery_skips_tests_and_excluded_directories() throws Exception {
        write(src.resolve("b.py"), "");
        write(src.resolve("a/a.py"), "");
        write(src.resolve("Main.java"), "class Main {}");
        write(src.resolve("test_b.py"), "");
        write(src.resolve("MainTest.java"), "class MainTest {}");
        write(src.resolve("notes.txt"), "");
        write(src.resolve("venv/lib.py"), "");
        write(src.resolve("__pycache__/c.py"), "");

        List<String> sources = scanner.discover(List.of(src), false).stream()
                .map(path -> src.relativize(path).toString().replace('\\', '/'))
                .collect(Collectors.toList());
        List<String> testFiles = scanner.discover(List.of(src), true).stream()
                .map(path -> src.relativize(path).getFileName().toString())
                .collect(Collectors.toList());

        assertEquals(List.of("Main.java", "a/a.py", "b.py"), sources);
        assertEquals(List.of("MainTest.java", "test_b.py"), testFiles);
    }

    @Test
    void test_explicit_file_is_taken_as_given() throws Exception {
        Path file = write(tests.resolve("helpers.py"), "VALUES = [2, 3, 4]\n");
        write(src.resolve("app.py"), "ok = n > 3\n");

        AnalysisReport report = scanner.scan(List.of(src), List.of(file));

        assertEquals(1, report.getTestFiles());
        assertEquals(CoverageStatus.COVERED, report.getResults().get(0).getStatus());
    }

    @Test
    void test_java_sources_and_tests() throws Exception {
        write(src.resolve("main/java/Cart.java"),
                "class Cart {\n    boolean full(java.util.List<String> items) {\n        return items.size() >= 20;\n    }\n}\n");
        write(tests.resolve("CartTest.java"),
                "class CartTest {\n    void full() {\n        check(19);\n        check(20);\n        check(21);\n    }\n}\n");

        AnalysisReport report = scanner.scan(List.of(src), List.of(tests));

        assertEquals(1, report.getTotalBoundaries());
        assertEquals(CoverageStatus.COVERED, report.getResults().get(0).getStatus());
        assertEquals("items.size()", report.getResults().get(0).getTriplet().getSubject());
    }

    @Test
    void test_duplicate_predicates_on_one_line_are_reported_once() throws Exception {
        write(src.resolve("dup.py"), "ok = f(x > 3) or g(x > 3)\n");

        AnalysisReport report = scanner.scan(List.of(src), List.of());

        assertEquals(1, report.getTotalBoundaries());
    }
}
