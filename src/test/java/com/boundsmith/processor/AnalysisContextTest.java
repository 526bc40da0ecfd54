package com.boundsmith.processor;

import com.boundsmith.config.AnalysisConfig;
import com.boundsmith.syntax.SyntaxNode;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class AnalysisContextTest {

    @TempDir
    Path workspace;

    @Test
    void test_tree_is_parsed_once() throws Exception {
        Path file = Files.writeString(workspace.resolve("app.py"), "ok = x > 1\n");
        AnalysisContext context = new AnalysisContext(AnalysisConfig.defaults());

        Optional<SyntaxNode> first = context.parse(file);
        Optional<SyntaxNode> second = context.parse(workspace.resolve("./app.py"));

        assertTrue(first.isPresent());
        assertSame(first.get(), second.get());
    }

    @Test
    void test_failure_is_recorded_once() throws Exception {
        Path file = Files.writeString(workspace.resolve("bad.py"), "x = (\n");
        AnalysisContext context = new AnalysisContext(AnalysisConfig.defaults());

        assertTrue(context.parse(file).isEmpty());
        assertTrue(context.parse(file).isEmpty());

        assertEquals(1, context.getWarnings().size());
        assertEquals(1, context.getMetrics().getSkippedFiles());
    }

    @Test
    void test_unexpected_failure_is_recorded_as_warning() throws Exception {
        Path file = Files.writeString(workspace.resolve("deep.py"), "ok = x > 1\n");
        AnalysisContext context = new AnalysisContext(AnalysisConfig.defaults());
        assertTrue(context.parse(file).isPresent());

        context.recordFailure(file, new StackOverflowError());
        context.recordFailure(file, new IllegalStateException("again"));

        assertEquals(1, context.getWarnings().size());
        assertEquals("expression nesting too deep to analyze", context.getWarnings().get(0).getMessage());
        assertEquals(1, context.getMetrics().getSkippedFiles());
        assertTrue(context.parse(file).isEmpty());
    }

    @Test
    void test_display_path_is_normalized() {
        assertEquals("src/app.py", AnalysisContext.displayPath(Path.of("src", ".", "pkg", "..", "app.py")));
    }
}
