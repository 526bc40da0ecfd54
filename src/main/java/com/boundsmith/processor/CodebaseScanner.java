package com.boundsmith.processor;

import com.boundsmith.analysis.BoundaryCalculator;
import com.boundsmith.analysis.CoverageMatcher;
import com.boundsmith.analysis.RangeFuser;
import com.boundsmith.config.AnalysisConfig;
import com.boundsmith.model.AnalysisReport;
import com.boundsmith.model.BoundaryPredicate;
import com.boundsmith.model.BoundaryTriplet;
import com.boundsmith.model.CoverageResult;
import com.boundsmith.model.LiteralCorpus;
import com.boundsmith.model.Predicate;
import com.boundsmith.model.RangePredicate;
import com.boundsmith.syntax.SourceLanguage;
import com.boundsmith.syntax.SyntaxNode;
import com.boundsmith.visitor.LiteralCollector;
import com.boundsmith.visitor.PredicateExtractor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Runs the analysis over a codebase: discovers source and test files, extracts and fuses
 * predicates, computes boundary triplets, builds the test literal corpus and matches the two.
 * A file that cannot be parsed is skipped with a warning; the rest of the batch continues.
 */
public class CodebaseScanner {

    private static final Logger logger = LoggerFactory.getLogger(CodebaseScanner.class);

    private final AnalysisConfig config;
    private final RangeFuser rangeFuser;
    private final BoundaryCalculator boundaryCalculator;
    private final CoverageMatcher coverageMatcher;

    public CodebaseScanner(AnalysisConfig config) {
        this.config = config;
        this.rangeFuser = new RangeFuser();
        this.boundaryCalculator = new BoundaryCalculator(config.getFloatEpsilon());
        this.coverageMatcher = new CoverageMatcher();
    }

    /**
     * Scans the given roots.
     *
     * @param sourcePaths Source directories or files
     * @param testPaths Test directories or files; empty when coverage is not requested
     * @return The report of the run
     * @throws IOException If a root does not exist or a directory cannot be walked
     * @throws NoParseableSourcesException If source files exist but none of them parses
     */
    public AnalysisReport scan(List<Path> sourcePaths, List<Path> testPaths)
            throws IOException, NoParseableSourcesException {
        AnalysisContext context = new AnalysisContext(config);
        ScanMetrics metrics = context.getMetrics();
        metrics.startAnalysis();

        List<Path> sourceFiles = discover(sourcePaths, false);
        List<Path> testFiles = discover(testPaths, true);
        logger.info("Found {} source files and {} test files", sourceFiles.size(), testFiles.size());

        List<BoundaryTriplet> triplets = new ArrayList<>();
        for (Path sourceFile : sourceFiles) {
            Optional<SyntaxNode> tree = context.parse(sourceFile);
            if (tree.isEmpty()) {
                continue;
            }
            String displayPath = AnalysisContext.displayPath(sourceFile);
            List<Predicate> predicates;
            List<BoundaryPredicate> fused;
            List<BoundaryTriplet> fileTriplets;
            try {
                predicates = PredicateExtractor.extract(tree.get(), displayPath);
                fused = rangeFuser.fuse(predicates);
                fileTriplets = boundaryCalculator.calculateAll(fused);
            } catch (RuntimeException | StackOverflowError e) {
                context.recordFailure(sourceFile, e);
                continue;
            }
            int ranges = (int) fused.stream().filter(p -> p instanceof RangePredicate).count();
            metrics.recordSourceFile(predicates.size(), ranges);
            triplets.addAll(fileTriplets);
            logger.debug("{}: {} predicates, {} ranges", displayPath, predicates.size(), ranges);
        }
        if (!sourceFiles.isEmpty() && metrics.getSourceFiles() == 0) {
            throw new NoParseableSourcesException(sourceFiles.size());
        }

        LiteralCorpus corpus = new LiteralCorpus();
        for (Path testFile : testFiles) {
            Optional<SyntaxNode> tree = context.parse(testFile);
            if (tree.isEmpty()) {
                continue;
            }
            try {
                corpus.addAll(LiteralCollector.collect(tree.get()));
                metrics.recordTestFile();
            } catch (RuntimeException | StackOverflowError e) {
                context.recordFailure(testFile, e);
            }
        }
        metrics.recordCorpusSize(corpus.size());

        List<CoverageResult> results = coverageMatcher.matchAll(triplets, corpus);
        metrics.endAnalysis();
        metrics.logSummary();
        return new AnalysisReport(results, context.getWarnings(), metrics.getSourceFiles(),
                metrics.getTestFiles(), !testPaths.isEmpty());
    }

    /**
     * Lists the supported files under the given roots in lexicographic path order.
     * A root that is a file is taken as given; inside directories, test files are kept only
     * when {@code tests} is set and skipped otherwise.
     *
     * @param roots Directories or files
     * @param tests Whether test files or non-test files are wanted
     * @return Unique files, sorted by path
     * @throws IOException If a root does not exist or cannot be walked
     */
    public List<Path> discover(List<Path> roots, boolean tests) throws IOException {
        Map<String, Path> files = new TreeMap<>();
        for (Path root : roots) {
            if (!Files.exists(root)) {
                throw new IOException("Path does not exist: " + root);
            }
            if (Files.isRegularFile(root)) {
                if (SourceLanguage.forPath(root).isPresent()) {
                    files.putIfAbsent(AnalysisContext.displayPath(root), root);
                } else {
                    logger.warn("Ignoring unsupported file {}", root);
                }
                continue;
            }
            try (Stream<Path> paths = Files.walk(root)) {
                List<Path> found = paths
                        .filter(Files::isRegularFile)
                        .filter(path -> !isExcluded(root, path))
                        .filter(path -> SourceLanguage.forPath(path)
                                .map(language -> language.isTestFile(path) == tests)
                                .orElse(false))
                        .collect(Collectors.toList());
                for (Path path : found) {
                    files.putIfAbsent(AnalysisContext.displayPath(path), path);
                }
            }
        }
        return new ArrayList<>(files.values());
    }

    private boolean isExcluded(Path root, Path file) {
        Path relative = root.relativize(file);
        for (int i = 0; i < relative.getNameCount() - 1; i++) {
            if (config.getExcludedDirectories().contains(relative.getName(i).toString())) {
                return true;
            }
        }
        return false;
    }
}
