package com.boundsmith.config;

import com.boundsmith.report.ReportFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Loads {@link AnalysisConfig} from properties. The classpath resource
 * {@value #DEFAULTS_RESOURCE} supplies defaults; an explicit file, or else
 * {@value #LOCAL_FILE} in the working directory, overrides them.
 */
public class AnalysisConfigLoader {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisConfigLoader.class);

    public static final String DEFAULTS_RESOURCE = "boundsmith-defaults.properties";
    public static final String LOCAL_FILE = "boundsmith.properties";

    static final String FLOAT_EPSILON = "boundsmith.floatEpsilon";
    static final String FAIL_ON_PARTIAL = "boundsmith.failOnPartial";
    static final String EXCLUDED_DIRECTORIES = "boundsmith.excludedDirectories";
    static final String DEFAULT_FORMAT = "boundsmith.defaultFormat";

    private final Path workingDirectory;

    public AnalysisConfigLoader() {
        this(Path.of("").toAbsolutePath());
    }

    public AnalysisConfigLoader(Path workingDirectory) {
        this.workingDirectory = workingDirectory;
    }

    /**
     * Loads the effective configuration.
     *
     * @param explicitFile File named on the command line, or null
     * @return The merged configuration
     * @throws ConfigurationException If a file cannot be read or a value is invalid
     */
    public AnalysisConfig load(Path explicitFile) throws ConfigurationException {
        Properties properties = new Properties();
        try (InputStream defaults = AnalysisConfigLoader.class.getClassLoader().getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (defaults != null) {
                properties.load(defaults);
            } else {
                logger.debug("No {} on the classpath, using built-in defaults", DEFAULTS_RESOURCE);
            }
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read " + DEFAULTS_RESOURCE, e);
        }

        if (explicitFile != null) {
            if (!Files.isRegularFile(explicitFile)) {
                throw new ConfigurationException("Configuration file does not exist: " + explicitFile);
            }
            loadFile(explicitFile, properties);
        } else {
            Path local = workingDirectory.resolve(LOCAL_FILE);
            if (Files.isRegularFile(local)) {
                loadFile(local, properties);
            }
        }
        return fromProperties(properties);
    }

    private static void loadFile(Path file, Properties properties) throws ConfigurationException {
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            properties.load(reader);
            logger.info("Loaded configuration from {}", file);
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read configuration file " + file + ": " + e.getMessage(), e);
        }
    }

    /**
     * Builds a configuration from properties; missing keys take the built-in defaults.
     */
    public static AnalysisConfig fromProperties(Properties properties) throws ConfigurationException {
        AnalysisConfig defaults = AnalysisConfig.defaults();

        BigDecimal epsilon = defaults.getFloatEpsilon();
        String epsilonValue = properties.getProperty(FLOAT_EPSILON);
        if (epsilonValue != null) {
            epsilon = parseEpsilon(epsilonValue);
        }

        boolean failOnPartial = defaults.isFailOnPartial();
        String failValue = properties.getProperty(FAIL_ON_PARTIAL);
        if (failValue != null) {
            String normalized = failValue.trim().toLowerCase(Locale.ROOT);
            if (!normalized.equals("true") && !normalized.equals("false")) {
                throw new ConfigurationException(FAIL_ON_PARTIAL + " must be true or false: " + failValue);
            }
            failOnPartial = Boolean.parseBoolean(normalized);
        }

        Set<String> excluded = defaults.getExcludedDirectories();
        String excludedValue = properties.getProperty(EXCLUDED_DIRECTORIES);
        if (excludedValue != null) {
            excluded = new LinkedHashSet<>();
            for (String name : excludedValue.split(",")) {
                if (!name.isBlank()) {
                    excluded.add(name.trim());
                }
            }
        }

        ReportFormat format = defaults.getDefaultFormat();
        String formatValue = properties.getProperty(DEFAULT_FORMAT);
        if (formatValue != null) {
            format = ReportFormat.fromId(formatValue)
                    .orElseThrow(() -> new ConfigurationException("Unknown report format: " + formatValue));
        }
        return new AnalysisConfig(epsilon, failOnPartial, excluded, format);
    }

    /**
     * Parses a float step; it must be a positive decimal.
     */
    public static BigDecimal parseEpsilon(String value) throws ConfigurationException {
        BigDecimal epsilon;
        try {
            epsilon = new BigDecimal(value.trim());
        } catch (NumberFormatException e) {
            throw new ConfigurationException("Float epsilon is not a number: " + value, e);
        }
        if (epsilon.signum() <= 0) {
            throw new ConfigurationException("Float epsilon must be positive: " + value);
        }
        return epsilon;
    }
}
