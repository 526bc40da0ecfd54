package com.boundsmith;

import com.boundsmith.report.ReportFormat;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@Tag("unit")
public class CommandLineOptionsTest {

    @Test
    void test_full_command_line() throws UsageException {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{
                "src", "-t", "tests", "--tests=more_tests", "--format", "json", "-o", "report.json",
                "--epsilon=0.01", "-g", "test_stubs.py", "-c", "ci.properties", "lib"});

        assertEquals(List.of(Path.of("src"), Path.of("lib")), options.getSourcePaths());
        assertEquals(List.of(Path.of("tests"), Path.of("more_tests")), options.getTestPaths());
        assertEquals(ReportFormat.JSON, options.getFormat());
        assertEquals(Path.of("report.json"), options.getOutputFile());
        assertEquals(new BigDecimal("0.01"), options.getEpsilon());
        assertEquals(Path.of("test_stubs.py"), options.getGenerateFile());
        assertEquals(Path.of("ci.properties"), options.getConfigFile());
        assertFalse(options.isHelp());
    }

    @Test
    void test_defaults_are_left_to_configuration() throws UsageException {
        CommandLineOptions options = CommandLineOptions.parse(new String[]{"app.py"});

        assertNull(options.getFormat());
        assertNull(options.getEpsilon());
        assertNull(options.getOutputFile());
        assertTrue(options.getTestPaths().isEmpty());
    }

    @Test
    void test_format_shortcuts() throws UsageException {
        assertEquals(ReportFormat.SARIF, CommandLineOptions.parse(new String[]{"--sarif", "src"}).getFormat());
        assertEquals(ReportFormat.JSON, CommandLineOptions.parse(new String[]{"src", "--json"}).getFormat());
    }

    @Test
    void test_help_needs_no_source() throws UsageException {
        assertTrue(CommandLineOptions.parse(new String[]{"-h"}).isHelp());
    }

    @Test
    void test_usage_errors() {
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[]{}));
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[]{"src", "--verbose"}));
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[]{"src", "--tests"}));
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[]{"src", "-f", "xml"}));
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[]{"src", "-e", "0"}));
        assertThrows(UsageException.class, () -> CommandLineOptions.parse(new String[]{"src", "-e", "tiny"}));
    }
}
