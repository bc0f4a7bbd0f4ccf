package org.carball.ckmetrics.output;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import lombok.extern.slf4j.Slf4j;
import org.carball.ckmetrics.config.MetricThresholds;
import org.carball.ckmetrics.model.ClassMetrics;
import org.carball.ckmetrics.model.CohesionAnalysis;
import org.carball.ckmetrics.model.CohesionSummary;
import org.carball.ckmetrics.model.FileDiagnostic;

import java.io.UncheckedIOException;
import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.List;
import java.util.Locale;

@Slf4j
public class CohesionReport {

    public static final String VERSION = "1.0.0";

    public static final String ACCURACY_NOTE =
            "CBO and RFC are computed from syntax alone, without resolving names or types. "
                    + "Treat them as upper bounds: same-named calls and identifiers that are not types "
                    + "are counted as references.";

    private final CohesionAnalysis analysis;
    private final MetricThresholds thresholds;
    private final int topN;
    private final ObjectMapper objectMapper;

    public CohesionReport(CohesionAnalysis analysis) {
        this(analysis, MetricThresholds.defaults(), 0);
    }

    /**
     * @param topN number of classes listed in the Markdown table; zero or less lists all
     */
    public CohesionReport(CohesionAnalysis analysis, MetricThresholds thresholds, int topN) {
        this.analysis = analysis;
        this.thresholds = thresholds;
        this.topN = topN;

        this.objectMapper = new ObjectMapper();
        this.objectMapper.registerModule(new JavaTimeModule());
        this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        this.objectMapper.enable(SerializationFeature.INDENT_OUTPUT);
        this.objectMapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
        this.objectMapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);
    }

    public String toJson() {
        try {
            return objectMapper.writeValueAsString(buildReportData());
        } catch (JsonProcessingException e) {
            log.error("Error generating JSON report", e);
            throw new UncheckedIOException("Failed to generate JSON report", e);
        }
    }

    public String toMarkdown() {
        StringBuilder md = new StringBuilder();
        CohesionSummary summary = analysis.summary();

        md.append("# CK Metrics Report\n\n");
        md.append("**Generated:** ").append(DateTimeFormatter.ISO_INSTANT.format(analysis.generatedAt())).append("  \n");
        md.append("**Analyzer Version:** ").append(VERSION).append("  \n\n");

        md.append("## Summary\n\n");
        md.append("| Metric | Value |\n");
        md.append("|--------|-------|\n");
        md.append("| Classes Analyzed | ").append(summary.totalClasses()).append(" |\n");
        md.append("| Files | ").append(summary.totalFiles()).append(" |\n");
        md.append("| Average WMC | ").append(format(summary.avgWmc())).append(" |\n");
        md.append("| Average CBO | ").append(format(summary.avgCbo())).append(" |\n");
        md.append("| Average RFC | ").append(format(summary.avgRfc())).append(" |\n");
        md.append("| Average LCOM | ").append(format(summary.avgLcom())).append(" |\n");
        md.append("| Max WMC | ").append(summary.maxWmc()).append(" |\n");
        md.append("| Max CBO | ").append(summary.maxCbo()).append(" |\n");
        md.append("| Max RFC | ").append(summary.maxRfc()).append(" |\n");
        md.append("| Max LCOM | ").append(summary.maxLcom()).append(" |\n");
        md.append("| Max DIT | ").append(summary.maxDit()).append(" |\n");
        md.append("| Low Cohesion Classes (LCOM > 1) | ").append(summary.lowCohesionCount()).append(" |\n\n");

        md.append("### Metric Guide\n\n");
        md.append("| Metric | Meaning | 🟡 Warning | 🔴 Critical |\n");
        md.append("|--------|---------|-----------|------------|\n");
        md.append("| WMC | Sum of method cyclomatic complexity | > ").append(thresholds.getWmcWarning())
                .append(" | > ").append(thresholds.getWmcCritical()).append(" |\n");
        md.append("| CBO | Distinct referenced types | - | - |\n");
        md.append("| RFC | Methods plus distinct called names | - | - |\n");
        md.append("| LCOM | Independent method groups (LCOM4) | > ").append(thresholds.getLcomWarning())
                .append(" | > ").append(thresholds.getLcomCritical()).append(" |\n");
        md.append("| DIT | Depth of inheritance tree | > ").append(thresholds.getDitWarning())
                .append(" | > ").append(thresholds.getDitCritical()).append(" |\n");
        md.append("| NOC | Direct subclasses | > ").append(thresholds.getNocWarning())
                .append(" | > ").append(thresholds.getNocCritical()).append(" |\n\n");

        md.append("## Classes\n\n");
        List<ClassMetrics> classes = analysis.top(topN);
        if (classes.isEmpty()) {
            md.append("**No object-oriented classes found.**\n\n");
        } else {
            if (classes.size() < analysis.classes().size()) {
                md.append("Showing ").append(classes.size()).append(" of ")
                        .append(analysis.classes().size()).append(" classes.\n\n");
            }
            md.append("| Class | File | Line | LCOM | WMC | CBO | RFC | DIT | NOC | NOM | NOF |\n");
            md.append("|-------|------|------|------|-----|-----|-----|-----|-----|-----|-----|\n");
            for (ClassMetrics cls : classes) {
                md.append("| ").append(cls.getClassName())
                        .append(" | ").append(cls.getPath())
                        .append(" | ").append(cls.getStartLine())
                        .append(" | ").append(mark(cls.getLcom(), thresholds.lcomSeverity(cls.getLcom())))
                        .append(" | ").append(mark(cls.getWmc(), thresholds.wmcSeverity(cls.getWmc())))
                        .append(" | ").append(cls.getCbo())
                        .append(" | ").append(cls.getRfc())
                        .append(" | ").append(mark(cls.getDit(), thresholds.ditSeverity(cls.getDit())))
                        .append(" | ").append(mark(cls.getNoc(), thresholds.nocSeverity(cls.getNoc())))
                        .append(" | ").append(cls.getNom())
                        .append(" | ").append(cls.getNof())
                        .append(" |\n");
            }
            md.append("\n");
        }

        if (!analysis.diagnostics().isEmpty()) {
            md.append("## Skipped Files\n\n");
            md.append("| File | Phase | Reason |\n");
            md.append("|------|-------|--------|\n");
            for (FileDiagnostic diagnostic : analysis.diagnostics()) {
                md.append("| ").append(diagnostic.path())
                        .append(" | ").append(diagnostic.phase().name().toLowerCase(Locale.ROOT))
                        .append(" | ").append(diagnostic.message())
                        .append(" |\n");
            }
            md.append("\n");
        }

        md.append("## Accuracy\n\n");
        md.append(ACCURACY_NOTE).append("\n\n");

        md.append("---\n\n");
        md.append("*Generated by CK Metrics Analyzer*\n");

        return md.toString();
    }

    private static String mark(int value, MetricThresholds.Severity severity) {
        switch (severity) {
            case CRITICAL:
                return "🔴 " + value;
            case WARNING:
                return "🟡 " + value;
            default:
                return String.valueOf(value);
        }
    }

    private static String format(double value) {
        return String.format(Locale.ROOT, "%.2f", value);
    }

    private ReportData buildReportData() {
        ReportData report = new ReportData();
        report.setMetadata(new ReportMetadata(analysis.generatedAt(), VERSION, ACCURACY_NOTE));
        report.setSummary(analysis.summary());
        report.setThresholds(thresholds);
        report.setClasses(analysis.top(topN));
        report.setSkippedFiles(analysis.diagnostics().isEmpty() ? null : analysis.diagnostics());
        return report;
    }

    // Inner classes for JSON structure
    @lombok.Data
    private static class ReportData {
        private ReportMetadata metadata;
        private CohesionSummary summary;
        private MetricThresholds thresholds;
        private List<ClassMetrics> classes;
        private List<FileDiagnostic> skippedFiles;
    }

    @lombok.Data
    @lombok.AllArgsConstructor
    private static class ReportMetadata {
        private Instant generatedAt;
        private String analyzerVersion;
        private String accuracyNote;
    }
}
