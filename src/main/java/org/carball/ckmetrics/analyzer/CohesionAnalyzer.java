package org.carball.ckmetrics.analyzer;

import lombok.extern.slf4j.Slf4j;
import org.carball.ckmetrics.config.CohesionAnalyzerConfig;
import org.carball.ckmetrics.fileproc.FileProcessor;
import org.carball.ckmetrics.fileproc.ProcessingError;
import org.carball.ckmetrics.fileproc.TestFiles;
import org.carball.ckmetrics.graph.InheritanceGraph;
import org.carball.ckmetrics.graph.InheritanceGraphBuilder;
import org.carball.ckmetrics.language.CapabilityTable;
import org.carball.ckmetrics.language.LanguageCapabilities;
import org.carball.ckmetrics.model.ClassMetrics;
import org.carball.ckmetrics.model.CohesionAnalysis;
import org.carball.ckmetrics.model.FileDiagnostic;
import org.carball.ckmetrics.parser.ClassNode;
import org.carball.ckmetrics.parser.Language;
import org.carball.ckmetrics.parser.ParseResult;
import org.carball.ckmetrics.parser.SourceParseException;
import org.carball.ckmetrics.parser.SourceParser;
import org.carball.ckmetrics.parser.SyntaxTrees;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes CK metrics for every class in a set of files.
 *
 * <p>Runs in two passes over a shared worker pool. The first pass builds the project-wide
 * {@link InheritanceGraph}; the second starts only after it has finished and extracts
 * per-class metrics, reading DIT and NOC from that graph. Files in languages without a
 * class system are ignored, as are test files unless the configuration includes them.
 * A file that cannot be read or parsed is reported as a {@link FileDiagnostic} and never
 * fails the run.</p>
 */
@Slf4j
public class CohesionAnalyzer implements AutoCloseable {

    private final CohesionAnalyzerConfig config;
    private final FileProcessor fileProcessor;

    public CohesionAnalyzer() {
        this(CohesionAnalyzerConfig.defaults());
    }

    public CohesionAnalyzer(CohesionAnalyzerConfig config) {
        config.validate();
        this.config = config;
        this.fileProcessor = new FileProcessor(config.getWorkerThreads());
    }

    public CohesionAnalyzerConfig getConfig() {
        return config;
    }

    public CohesionAnalysis analyzeProject(List<Path> files) {
        return analyzeProjectWithProgress(files, null);
    }

    /**
     * @param onProgress invoked once per input file, whether or not the file could be processed;
     *                   may be {@code null}. Ignored files tick up front on the calling thread,
     *                   analyzed files tick from worker threads during the metrics pass.
     */
    public CohesionAnalysis analyzeProjectWithProgress(List<Path> files, Runnable onProgress) {
        List<Path> candidates = selectFiles(files);
        log.info("Analyzing {} of {} files", candidates.size(), files.size());

        if (onProgress != null) {
            for (int i = candidates.size(); i < files.size(); i++) {
                onProgress.run();
            }
        }

        if (candidates.isEmpty()) {
            return CohesionAnalysis.empty();
        }

        InheritanceGraphBuilder.Result inheritance = new InheritanceGraphBuilder(fileProcessor)
                .build(candidates, config.isSizeLimitAppliesToInheritance() ? config.getMaxFileSize() : 0);
        InheritanceGraph graph = inheritance.graph();

        ClassMetricsExtractor extractor = new ClassMetricsExtractor(graph);
        FileProcessor.MapResult<List<ClassMetrics>> metrics = fileProcessor.mapFilesWithSizeLimit(
                candidates,
                config.getMaxFileSize(),
                (parser, file) -> analyzeFile(parser, file, extractor),
                onProgress);

        List<ClassMetrics> classes = new ArrayList<>();
        metrics.results().forEach(classes::addAll);

        List<FileDiagnostic> diagnostics = mergeDiagnostics(inheritance.mapResult().errors(), metrics.errors());
        CohesionAnalysis analysis = CohesionAnalysis.of(classes, diagnostics).sortByLcom();

        log.info("Computed metrics for {} classes in {} files ({} files skipped)",
                analysis.summary().totalClasses(), analysis.summary().totalFiles(), diagnostics.size());
        return analysis;
    }

    private List<ClassMetrics> analyzeFile(SourceParser parser, Path file, ClassMetricsExtractor extractor)
            throws SourceParseException {
        ParseResult parsed = parser.parseFile(file);
        LanguageCapabilities capabilities = CapabilityTable.forLanguage(parsed.language());

        List<ClassMetrics> classes = new ArrayList<>();
        for (ClassNode classNode : SyntaxTrees.findClasses(parsed, capabilities::isClassDeclaration)) {
            classes.add(extractor.extract(classNode, parsed));
        }
        log.debug("{}: {} classes", file, classes.size());
        return classes;
    }

    // Object-oriented sources, minus tests unless they were asked for. Applies to both passes.
    private List<Path> selectFiles(List<Path> files) {
        List<Path> candidates = new ArrayList<>();
        for (Path file : files) {
            if (!CapabilityTable.isApplicable(Language.detect(file))) {
                continue;
            }
            if (config.isSkipTestFiles() && TestFiles.isTestFile(file)) {
                log.debug("Skipping test file {}", file);
                continue;
            }
            candidates.add(file);
        }
        return candidates;
    }

    // One entry per file; the earlier pass wins
    private static List<FileDiagnostic> mergeDiagnostics(List<ProcessingError> inheritanceErrors,
                                                         List<ProcessingError> metricsErrors) {
        Map<Path, FileDiagnostic> byPath = new LinkedHashMap<>();
        for (ProcessingError error : inheritanceErrors) {
            byPath.putIfAbsent(error.path(),
                    new FileDiagnostic(error.path(), FileDiagnostic.Phase.INHERITANCE, error.message()));
        }
        for (ProcessingError error : metricsErrors) {
            byPath.putIfAbsent(error.path(),
                    new FileDiagnostic(error.path(), FileDiagnostic.Phase.METRICS, error.message()));
        }
        return new ArrayList<>(byPath.values());
    }

    @Override
    public void close() {
        fileProcessor.close();
    }
}
