package com.boundsmith;

import com.boundsmith.report.ReportFormat;

import java.math.BigDecimal;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Parsed command line. Options take their value as the next argument or after {@code =}
 * ({@code --format json}, {@code --format=json}); everything else is a source path.
 */
public class CommandLineOptions {

    static final String USAGE = String.join(System.lineSeparator(),
            "Usage: boundsmith [options] <source-path>...",
            "  -t, --tests <path>       test sources to cross-check (repeatable)",
            "  -g, --generate <file>    write stub tests for uncovered boundaries (.py: pytest, .java: JUnit 5)",
            "  -f, --format <fmt>       text (default), json or sarif",
            "      --json               same as --format json",
            "      --sarif              same as --format sarif",
            "  -o, --output <file>      write the report to a file instead of stdout",
            "  -e, --epsilon <value>    float step (default 0.0001)",
            "  -c, --config <file>      properties file with defaults",
            "  -h, --help               show this help");

    private final List<Path> sourcePaths = new ArrayList<>();
    private final List<Path> testPaths = new ArrayList<>();
    private Path generateFile;
    private ReportFormat format;
    private Path outputFile;
    private BigDecimal epsilon;
    private Path configFile;
    private boolean help;

    /**
     * Parses the arguments.
     *
     * @param args Command line arguments
     * @return The options
     * @throws UsageException On an unknown option, a missing or invalid value, or no source path
     */
    public static CommandLineOptions parse(String[] args) throws UsageException {
        CommandLineOptions options = new CommandLineOptions();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String inlineValue = null;
            if (arg.startsWith("--") && arg.contains("=")) {
                inlineValue = arg.substring(arg.indexOf('=') + 1);
                arg = arg.substring(0, arg.indexOf('='));
            }
            switch (arg) {
                case "-h", "--help" -> options.help = true;
                case "--json" -> options.format = ReportFormat.JSON;
                case "--sarif" -> options.format = ReportFormat.SARIF;
                case "-t", "--tests" -> {
                    options.testPaths.add(Path.of(inlineValue != null ? inlineValue : value(args, ++i, arg)));
                }
                case "-g", "--generate" -> {
                    options.generateFile = Path.of(inlineValue != null ? inlineValue : value(args, ++i, arg));
                }
                case "-o", "--output" -> {
                    options.outputFile = Path.of(inlineValue != null ? inlineValue : value(args, ++i, arg));
                }
                case "-c", "--config" -> {
                    options.configFile = Path.of(inlineValue != null ? inlineValue : value(args, ++i, arg));
                }
                case "-f", "--format" -> {
                    String id = inlineValue != null ? inlineValue : value(args, ++i, arg);
                    options.format = ReportFormat.fromId(id)
                            .orElseThrow(() -> new UsageException("Unknown format '" + id + "' (expected text, json or sarif)"));
                }
                case "-e", "--epsilon" -> {
                    options.epsilon = parseEpsilon(inlineValue != null ? inlineValue : value(args, ++i, arg));
                }
                default -> {
                    if (arg.startsWith("-") && arg.length() > 1) {
                        throw new UsageException("Unknown option: " + args[i]);
                    }
                    options.sourcePaths.add(Path.of(arg));
                }
            }
        }
        if (!options.help && options.sourcePaths.isEmpty()) {
            throw new UsageException("No source path given");
        }
        return options;
    }

    private static String value(String[] args, int index, String option) throws UsageException {
        if (index >= args.length) {
            throw new UsageException("Option " + option + " needs a value");
        }
        return args[index];
    }

    private static BigDecimal parseEpsilon(String value) throws UsageException {
        BigDecimal epsilon;
        try {
            epsilon = new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new UsageException("Epsilon is not a number: " + value);
        }
        if (epsilon.signum() <= 0) {
            throw new UsageException("Epsilon must be positive: " + value);
        }
        return epsilon;
    }

    public List<Path> getSourcePaths() {
        return Collections.unmodifiableList(sourcePaths);
    }

    public List<Path> getTestPaths() {
        return Collections.unmodifiableList(testPaths);
    }

    /**
     * Stub test file to write, or null.
     */
    public Path getGenerateFile() {
        return generateFile;
    }

    /**
     * Explicitly requested format, or null to use the configured default.
     */
    public ReportFormat getFormat() {
        return format;
    }

    public Path getOutputFile() {
        return outputFile;
    }

    /**
     * Float step from the command line, or null to use the configured one.
     */
    public BigDecimal getEpsilon() {
        return epsilon;
    }

    public Path getConfigFile() {
        return configFile;
    }

    public boolean isHelp() {
        return help;
    }
}
