package org.carball.ckmetrics.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import lombok.Data;
import lombok.extern.slf4j.Slf4j;
import org.carball.ckmetrics.analyzer.CohesionAnalyzer;
import org.carball.ckmetrics.config.CohesionAnalyzerConfig;
import org.carball.ckmetrics.config.ConfigurationLoader;
import org.carball.ckmetrics.config.MetricThresholds;
import org.carball.ckmetrics.config.OutputFormat;
import org.carball.ckmetrics.model.ClassMetrics;
import org.carball.ckmetrics.model.CohesionAnalysis;
import org.carball.ckmetrics.model.CohesionSummary;
import org.carball.ckmetrics.output.CohesionReport;
import org.carball.ckmetrics.scanner.SourceScanner;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

@Slf4j
public class CkAnalyzerCLI {

    private static final String VERSION = CohesionReport.VERSION;
    private static final String BANNER = """
        ╔═══════════════════════════════════════════════════════════════╗
        ║            CK Object-Oriented Metrics Analyzer v%s            ║
        ╚═══════════════════════════════════════════════════════════════╝
        """;
    private static final int DEFAULT_TOP = 20;

    public static void main(String[] args) {
        int exitCode = run(args);
        if (exitCode != 0) {
            System.exit(exitCode);
        }
    }

    /**
     * Runs the analyzer and returns the process exit code.
     */
    static int run(String[] args) {
        System.out.printf((BANNER) + "%n", VERSION);

        if (args.length < 1 || isHelpRequested(args)) {
            printUsage();
            return args.length < 1 ? 1 : 0;
        }

        try {
            CliOptions options = parseArgs(args);
            if (options.isVerbose()) {
                enableVerboseLogging();
            }
            CohesionAnalyzerConfig config = new ConfigurationLoader().loadConfiguration(args);
            MetricThresholds thresholds = new ConfigurationLoader().loadThresholds(options.getThresholdsFile());

            System.out.println("\n🔍 Starting analysis...");
            System.out.println("   Paths: " + options.getPaths());
            System.out.println("   " + config.getConfigurationSummary());
            System.out.println("   Output: " + describeOutput(options));
            System.out.println();

            System.out.print("📂 Scanning source files... ");
            List<Path> files = new SourceScanner().scan(options.getPaths());
            System.out.println("✓ " + files.size() + " files");

            if (files.isEmpty()) {
                System.out.println("\n💡 No source files found.");
                return 0;
            }

            CohesionAnalysis analysis;
            try (CohesionAnalyzer analyzer = new CohesionAnalyzer(config)) {
                ProgressPrinter progress = new ProgressPrinter("📊 Computing CK metrics");
                analysis = analyzer.analyzeProjectWithProgress(files, progress::tick);
                progress.finish();
            }
            analysis = analysis.sortBy(options.getSortKey());

            CohesionReport report = new CohesionReport(analysis, thresholds, options.getTopN());
            System.out.print("📝 Writing results... ");
            writeReport(report, options);
            System.out.println("✓");

            printSummary(analysis, thresholds, options);

            System.out.println("\n✅ Analysis complete!");
            System.out.println("   " + describeOutput(options));
            return 0;

        } catch (IllegalArgumentException e) {
            System.err.println("\n❌ Configuration error: " + e.getMessage());
            System.err.println("\nRun with --help for usage information.");
            log.debug("Configuration error details", e);
            return 1;
        } catch (IOException e) {
            System.err.println("\n❌ IO error: " + e.getMessage());
            log.debug("IO error details", e);
            return 1;
        } catch (RuntimeException e) {
            System.err.println("\n❌ Unexpected error: " + e.getMessage());
            log.error("Unexpected error", e);
            return 1;
        }
    }

    private static boolean isHelpRequested(String[] args) {
        return Arrays.asList(args).contains("--help") ||
                Arrays.asList(args).contains("-h") ||
                Arrays.asList(args).contains("help");
    }

    private static void printUsage() {
        System.out.println("\nUsage: java -jar ck-analyzer.jar <path...> [options]");
        System.out.println();
        System.out.println("Arguments:");
        System.out.println("  path                One or more source directories or files");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --top <n>           Classes to list (default: " + DEFAULT_TOP + ", 0 = all)");
        System.out.println("  --sort <metric>     Order by: lcom|wmc|cbo|dit (default: lcom)");
        System.out.println("  --output, -o        Report file (default: ck-metrics.json)");
        System.out.println("  --format, -f        Output format: json|markdown|both (default: json)");
        System.out.println("  --thresholds        YAML file with custom highlighting thresholds (optional)");
        System.out.println("  --verbose, -v       Enable verbose output");
        System.out.println("  --help, -h          Show this help message");
        System.out.println();
        System.out.print(ConfigurationLoader.getConfigurationHelp());
        System.out.println();
        System.out.println("Examples:");
        System.out.println("  # Least cohesive classes first");
        System.out.println("  java -jar ck-analyzer.jar ./src");
        System.out.println();
        System.out.println("  # Most complex classes, Markdown report");
        System.out.println("  java -jar ck-analyzer.jar ./src --sort wmc --format markdown -o ck-report");
    }

    static CliOptions parseArgs(String[] args) {
        CliOptions options = new CliOptions();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--top":
                    options.setTopN(parseInt(args, ++i, "--top"));
                    break;

                case "--sort":
                    requireValue(args, i, "Sort metric not specified");
                    options.setSortKey(CohesionAnalysis.SortKey.fromString(args[++i]));
                    break;

                case "--output":
                case "-o":
                    requireValue(args, i, "Output file not specified");
                    options.setOutputFile(args[++i]);
                    break;

                case "--format":
                case "-f":
                    requireValue(args, i, "Output format not specified");
                    options.setOutputFormat(OutputFormat.fromString(args[++i]));
                    break;

                case "--thresholds":
                    requireValue(args, i, "Threshold file not specified");
                    options.setThresholdsFile(Paths.get(args[++i]));
                    break;

                case "--max-file-size":
                case "--workers":
                    // validated here, applied by ConfigurationLoader
                    String option = args[i];
                    parseLong(args, ++i, option);
                    break;

                case "--include-tests":
                    break;

                case "--verbose":
                case "-v":
                    options.setVerbose(true);
                    break;

                default:
                    if (args[i].startsWith("-")) {
                        throw new IllegalArgumentException("Unknown option: " + args[i]);
                    }
                    options.getPaths().add(Paths.get(args[i]));
                    break;
            }
        }

        if (options.getPaths().isEmpty()) {
            throw new IllegalArgumentException("At least one source path is required");
        }
        for (Path path : options.getPaths()) {
            if (!Files.exists(path)) {
                throw new IllegalArgumentException("Source path not found: " + path);
            }
        }

        String baseFileName = removeFileExtension(options.getOutputFile());
        options.setOutputFile(baseFileName + (options.getOutputFormat() == OutputFormat.MARKDOWN ? ".md" : ".json"));

        Path outputDir = Paths.get(options.getOutputFile()).toAbsolutePath().getParent();
        if (outputDir != null && !Files.exists(outputDir)) {
            throw new IllegalArgumentException("Output directory does not exist: " + outputDir);
        }
        return options;
    }

    private static void requireValue(String[] args, int i, String message) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException(message);
        }
    }

    private static int parseInt(String[] args, int i, String option) {
        long value = parseLong(args, i, option);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw new IllegalArgumentException("Number out of range for " + option + ": " + args[i]);
        }
        return (int) value;
    }

    private static long parseLong(String[] args, int i, String option) {
        if (i >= args.length) {
            throw new IllegalArgumentException("Value not specified for " + option);
        }
        try {
            return Long.parseLong(args[i]);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid number for " + option + ": " + args[i], e);
        }
    }

    private static String removeFileExtension(String filename) {
        int lastDotIndex = filename.lastIndexOf('.');
        int lastSeparatorIndex = Math.max(filename.lastIndexOf('/'), filename.lastIndexOf('\\'));
        if (lastDotIndex > 0 && lastDotIndex > lastSeparatorIndex + 1 && lastDotIndex < filename.length() - 1) {
            return filename.substring(0, lastDotIndex);
        }
        return filename;
    }

    private static String describeOutput(CliOptions options) {
        if (options.getOutputFormat() == OutputFormat.BOTH) {
            String baseFileName = removeFileExtension(options.getOutputFile());
            return baseFileName + ".json, " + baseFileName + ".md";
        }
        return options.getOutputFile();
    }

    private static void writeReport(CohesionReport report, CliOptions options) throws IOException {
        String baseFileName = removeFileExtension(options.getOutputFile());
        OutputFormat format = options.getOutputFormat();

        if (format == OutputFormat.JSON || format == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".json"), report.toJson());
        }
        if (format == OutputFormat.MARKDOWN || format == OutputFormat.BOTH) {
            Files.writeString(Paths.get(baseFileName + ".md"), report.toMarkdown());
        }
    }

    private static void printSummary(CohesionAnalysis analysis, MetricThresholds thresholds, CliOptions options) {
        CohesionSummary summary = analysis.summary();

        System.out.println("\n" + "=".repeat(60));
        System.out.println("📊 CK METRICS SUMMARY");
        System.out.println("=".repeat(60));

        if (summary.totalClasses() == 0) {
            System.out.println("\n💡 No OO classes found (CK metrics apply to Java, C#, C++, Python, JS/TS, Ruby and PHP).");
            printSkipped(analysis);
            return;
        }

        System.out.println("\nClasses analyzed: " + summary.totalClasses() + " in " + summary.totalFiles() + " files");
        System.out.println("Low cohesion (LCOM > 1): " + summary.lowCohesionCount());
        System.out.printf("Avg WMC: %.1f | Avg CBO: %.1f | Avg RFC: %.1f | Avg LCOM: %.1f%n",
                summary.avgWmc(), summary.avgCbo(), summary.avgRfc(), summary.avgLcom());
        System.out.printf("Max WMC: %d | Max CBO: %d | Max RFC: %d | Max LCOM: %d | Max DIT: %d%n",
                summary.maxWmc(), summary.maxCbo(), summary.maxRfc(), summary.maxLcom(), summary.maxDit());

        int shown = options.getTopN() > 0 ? options.getTopN() : summary.totalClasses();
        System.out.println("\n🎯 Top " + Math.min(shown, summary.totalClasses()) + " classes by "
                + options.getSortKey().name() + ":");
        System.out.println("-".repeat(60));
        System.out.printf("%-28s %6s %6s %6s %6s %4s %4s%n", "Class", "LCOM", "WMC", "CBO", "RFC", "DIT", "NOC");
        for (ClassMetrics cls : analysis.top(options.getTopN())) {
            System.out.printf("%-28s %6s %6s %6d %6d %4s %4s%n",
                    truncate(cls.getClassName(), 28),
                    flag(cls.getLcom(), thresholds.lcomSeverity(cls.getLcom())),
                    flag(cls.getWmc(), thresholds.wmcSeverity(cls.getWmc())),
                    cls.getCbo(),
                    cls.getRfc(),
                    flag(cls.getDit(), thresholds.ditSeverity(cls.getDit())),
                    flag(cls.getNoc(), thresholds.nocSeverity(cls.getNoc())));
        }

        printSkipped(analysis);
        System.out.println("\nNote: CBO and RFC are syntactic upper bounds (names are not resolved).");
    }

    private static void printSkipped(CohesionAnalysis analysis) {
        if (!analysis.diagnostics().isEmpty()) {
            System.out.println("\n⚠️  " + analysis.diagnostics().size() + " files skipped (see report for details)");
        }
    }

    private static String flag(int value, MetricThresholds.Severity severity) {
        switch (severity) {
            case CRITICAL:
                return value + "!!";
            case WARNING:
                return value + "!";
            default:
                return String.valueOf(value);
        }
    }

    private static String truncate(String value, int width) {
        return value.length() <= width ? value : value.substring(0, width - 1) + "…";
    }

    private static void enableVerboseLogging() {
        Logger logger = (Logger) LoggerFactory.getLogger("org.carball.ckmetrics");
        logger.setLevel(Level.DEBUG);
    }

    @Data
    static class CliOptions {
        private List<Path> paths = new ArrayList<>();
        private int topN = DEFAULT_TOP;
        private CohesionAnalysis.SortKey sortKey = CohesionAnalysis.SortKey.LCOM;
        private String outputFile = "ck-metrics.json";
        private OutputFormat outputFormat = OutputFormat.JSON;
        private Path thresholdsFile;
        private boolean verbose;
    }

    /**
     * Single-line console progress, ticked from worker threads.
     */
    private static class ProgressPrinter {
        private final String label;
        private final AtomicInteger done = new AtomicInteger();

        ProgressPrinter(String label) {
            this.label = label;
            System.out.print(label + "... ");
        }

        void tick() {
            int count = done.incrementAndGet();
            if (count % 50 == 0) {
                synchronized (System.out) {
                    System.out.print("\r" + label + "... " + count + " files");
                }
            }
        }

        void finish() {
            System.out.println("\r" + label + "... ✓ " + done.get() + " files");
        }
    }
}
