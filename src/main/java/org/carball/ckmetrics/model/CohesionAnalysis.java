package org.carball.ckmetrics.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.function.ToIntFunction;

/**
 * Result of one analysis run. Sorting returns a re-ordered copy; ties keep their
 * current relative order.
 */
public record CohesionAnalysis(
    Instant generatedAt,
    List<ClassMetrics> classes,
    CohesionSummary summary,
    List<FileDiagnostic> diagnostics
) {

    public CohesionAnalysis {
        classes = List.copyOf(classes);
        diagnostics = List.copyOf(diagnostics);
    }

    public static CohesionAnalysis of(List<ClassMetrics> classes, List<FileDiagnostic> diagnostics) {
        return new CohesionAnalysis(Instant.now(), classes, CohesionSummary.of(classes), diagnostics);
    }

    public static CohesionAnalysis empty() {
        return new CohesionAnalysis(Instant.now(), List.of(), CohesionSummary.empty(), List.of());
    }

    /**
     * Least cohesive first.
     */
    public CohesionAnalysis sortByLcom() {
        return sortedDescending(ClassMetrics::getLcom);
    }

    public CohesionAnalysis sortByWmc() {
        return sortedDescending(ClassMetrics::getWmc);
    }

    public CohesionAnalysis sortByCbo() {
        return sortedDescending(ClassMetrics::getCbo);
    }

    public CohesionAnalysis sortByDit() {
        return sortedDescending(ClassMetrics::getDit);
    }

    public CohesionAnalysis sortBy(SortKey key) {
        switch (key) {
            case WMC:
                return sortByWmc();
            case CBO:
                return sortByCbo();
            case DIT:
                return sortByDit();
            case LCOM:
            default:
                return sortByLcom();
        }
    }

    /**
     * The first {@code n} classes in current order.
     */
    public List<ClassMetrics> top(int n) {
        if (n <= 0 || n >= classes.size()) {
            return classes;
        }
        return classes.subList(0, n);
    }

    private CohesionAnalysis sortedDescending(ToIntFunction<ClassMetrics> metric) {
        List<ClassMetrics> sorted = new ArrayList<>(classes);
        // List.sort is stable
        sorted.sort(Comparator.comparingInt(metric).reversed());
        return new CohesionAnalysis(generatedAt, sorted, summary, diagnostics);
    }

    public enum SortKey {
        LCOM,
        WMC,
        CBO,
        DIT;

        public static SortKey fromString(String value) {
            try {
                return valueOf(value.trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException | NullPointerException e) {
                throw new IllegalArgumentException("Unknown sort key: " + value + " (expected lcom, wmc, cbo or dit)", e);
            }
        }
    }
}
