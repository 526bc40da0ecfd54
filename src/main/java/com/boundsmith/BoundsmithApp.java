package com.boundsmith;

import com.boundsmith.config.AnalysisConfig;
import com.boundsmith.config.AnalysisConfigLoader;
import com.boundsmith.config.ConfigurationException;
import com.boundsmith.generator.StubTestGenerator;
import com.boundsmith.model.AnalysisReport;
import com.boundsmith.processor.CodebaseScanner;
import com.boundsmith.processor.NoParseableSourcesException;
import com.boundsmith.report.ReportFormat;
import com.boundsmith.report.ReportRenderer;
import com.boundsmith.report.SarifSchemaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.PrintStream;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Main application entry point for BoundSmith.
 * Finds numeric comparison thresholds in source code and reports the boundary values
 * that no test literal exercises.
 */
public class BoundsmithApp {

    private static final Logger logger = LoggerFactory.getLogger(BoundsmithApp.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_UNCOVERED = 1;
    public static final int EXIT_ERROR = 2;

    private final AnalysisConfigLoader configLoader;

    public BoundsmithApp() {
        this(new AnalysisConfigLoader());
    }

    public BoundsmithApp(AnalysisConfigLoader configLoader) {
        this.configLoader = configLoader;
    }

    public static void main(String[] args) {
        int exitCode = new BoundsmithApp().run(args, System.out, System.err);
        System.exit(exitCode);
    }

    /**
     * Runs one analysis.
     *
     * @param args Command line arguments
     * @param out Receives the report unless an output file is given
     * @param err Receives usage and error messages
     * @return {@link #EXIT_OK}, {@link #EXIT_UNCOVERED} or {@link #EXIT_ERROR}
     */
    public int run(String[] args, PrintStream out, PrintStream err) {
        CommandLineOptions options;
        try {
            options = CommandLineOptions.parse(args);
        } catch (UsageException e) {
            err.println("Error: " + e.getMessage());
            err.println(CommandLineOptions.USAGE);
            return EXIT_ERROR;
        }
        if (options.isHelp()) {
            out.println(CommandLineOptions.USAGE);
            return EXIT_OK;
        }

        AnalysisConfig config;
        try {
            config = configLoader.load(options.getConfigFile());
        } catch (ConfigurationException e) {
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }
        if (options.getEpsilon() != null) {
            config = config.withFloatEpsilon(options.getEpsilon());
        }
        if (options.getFormat() != null) {
            config = config.withDefaultFormat(options.getFormat());
        }
        Path generateFile = options.getGenerateFile();
        if (generateFile != null && StubTestGenerator.templateFor(generateFile).isEmpty()) {
            err.println("Error: stub file must end in .py or .java: " + generateFile);
            return EXIT_ERROR;
        }

        logger.info("Starting BoundSmith");
        logger.info("Sources: {}, tests: {}", options.getSourcePaths(), options.getTestPaths());
        logger.debug("Effective configuration: {}", config);

        AnalysisReport report;
        try {
            report = new CodebaseScanner(config).scan(options.getSourcePaths(), options.getTestPaths());
        } catch (NoParseableSourcesException e) {
            logger.error("Nothing to analyze", e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("Error scanning codebase", e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        }

        try {
            writeReport(report, config.getDefaultFormat(), options.getOutputFile(), out);
        } catch (SarifSchemaException e) {
            logger.error("Cannot produce a valid SARIF log", e);
            err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("Error writing report", e);
            err.println("Error: cannot write report: " + e.getMessage());
            return EXIT_ERROR;
        }

        if (generateFile != null) {
            try {
                new StubTestGenerator().write(report, generateFile);
            } catch (IOException e) {
                logger.error("Error writing stub tests", e);
                err.println("Error: cannot write " + generateFile + ": " + e.getMessage());
                return EXIT_ERROR;
            }
        }
        return exitCode(report, config);
    }

    private static void writeReport(AnalysisReport report, ReportFormat format, Path outputFile, PrintStream out)
            throws IOException {
        StringWriter rendered = new StringWriter();
        ReportRenderer.forFormat(format).render(report, rendered);
        if (outputFile != null) {
            Files.writeString(outputFile, rendered.toString(), StandardCharsets.UTF_8);
            logger.info("Report written to {}", outputFile);
        } else {
            out.print(rendered);
            out.flush();
        }
    }

    /**
     * Exit status for CI gating: non-zero only when coverage was requested and a boundary
     * has untested values. Partial coverage counts unless {@code failOnPartial} is off.
     */
    static int exitCode(AnalysisReport report, AnalysisConfig config) {
        if (!report.isCoverageChecked()) {
            return EXIT_OK;
        }
        if (report.getUncoveredCount() > 0) {
            return EXIT_UNCOVERED;
        }
        if (config.isFailOnPartial() && report.getPartialCount() > 0) {
            return EXIT_UNCOVERED;
        }
        return EXIT_OK;
    }
}
