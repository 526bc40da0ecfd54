package com.boundsmith.processor;

import com.boundsmith.config.AnalysisConfig;
import com.boundsmith.model.ScanWarning;
import com.boundsmith.syntax.SourceLanguage;
import com.boundsmith.syntax.SourceParseException;
import com.boundsmith.syntax.SourceTreeParser;
import com.boundsmith.syntax.SyntaxNode;
import com.boundsmith.syntax.java.JavaSyntaxTranslator;
import com.boundsmith.syntax.python.PythonSyntaxTranslator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * State of one run: the parsers, parsed trees keyed by normalized path and the warnings of
 * files that could not be read or parsed. A file reachable from both the source and the test
 * roots is parsed once.
 */
public class AnalysisContext {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisContext.class);

    private final AnalysisConfig config;
    private final ScanMetrics metrics;
    private final Map<SourceLanguage, SourceTreeParser> parsers = new EnumMap<>(SourceLanguage.class);
    private final Map<Path, SyntaxNode> trees = new HashMap<>();
    private final Set<Path> failed = new HashSet<>();
    private final List<ScanWarning> warnings = new ArrayList<>();

    public AnalysisContext(AnalysisConfig config) {
        this(config, new ScanMetrics());
    }

    public AnalysisContext(AnalysisConfig config, ScanMetrics metrics) {
        this.config = config;
        this.metrics = metrics;
        parsers.put(SourceLanguage.PYTHON, new PythonSyntaxTranslator());
        parsers.put(SourceLanguage.JAVA, new JavaSyntaxTranslator());
    }

    public AnalysisConfig getConfig() {
        return config;
    }

    public ScanMetrics getMetrics() {
        return metrics;
    }

    /**
     * Returns the syntax tree of a file, parsing it on first use.
     *
     * @param file File to parse
     * @return The tree, or empty if the file could not be read or parsed (a warning is recorded once)
     */
    public Optional<SyntaxNode> parse(Path file) {
        Path key = file.toAbsolutePath().normalize();
        SyntaxNode cached = trees.get(key);
        if (cached != null) {
            return Optional.of(cached);
        }
        if (failed.contains(key)) {
            return Optional.empty();
        }

        String displayPath = displayPath(file);
        Optional<SourceLanguage> language = SourceLanguage.forPath(file);
        if (language.isEmpty()) {
            return fail(key, new ScanWarning(displayPath, 0, 0, "unsupported file type"));
        }
        try {
            String source = Files.readString(file, StandardCharsets.UTF_8);
            SyntaxNode tree = parsers.get(language.get()).parse(source, displayPath);
            trees.put(key, tree);
            return Optional.of(tree);
        } catch (SourceParseException e) {
            logger.warn("Skipping {}: {}", displayPath, e.toString());
            return fail(key, new ScanWarning(displayPath, e.getLine(), e.getColumn(), e.getMessage()));
        } catch (IOException e) {
            logger.warn("Cannot read {}: {}", displayPath, e.toString());
            return fail(key, new ScanWarning(displayPath, 0, 0, "cannot read file: " + e));
        } catch (RuntimeException | StackOverflowError e) {
            return recordFailure(file, e);
        }
    }

    /**
     * Records a file whose parsing or analysis failed with an unexpected error. The file is
     * skipped from then on.
     *
     * @param file The failed file
     * @param error What went wrong
     * @return Always empty
     */
    public Optional<SyntaxNode> recordFailure(Path file, Throwable error) {
        Path key = file.toAbsolutePath().normalize();
        String displayPath = displayPath(file);
        trees.remove(key);
        if (failed.contains(key)) {
            return Optional.empty();
        }
        String message = error instanceof StackOverflowError
                ? "expression nesting too deep to analyze"
                : "analysis failed: " + error;
        logger.error("Error analyzing {}: {}", displayPath, error.toString());
        logger.debug("Failure details for {}", displayPath, error);
        return fail(key, new ScanWarning(displayPath, 0, 0, message));
    }

    private Optional<SyntaxNode> fail(Path key, ScanWarning warning) {
        failed.add(key);
        warnings.add(warning);
        metrics.recordSkippedFile();
        return Optional.empty();
    }

    public List<ScanWarning> getWarnings() {
        return Collections.unmodifiableList(warnings);
    }

    /**
     * Path as reported in findings: normalized, with forward slashes.
     */
    public static String displayPath(Path file) {
        return file.normalize().toString().replace('\\', '/');
    }
}
