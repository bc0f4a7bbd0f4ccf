package org.carball.ckmetrics.model;

import org.carball.ckmetrics.parser.Language;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

public class CohesionAnalysisTest {

    @Test
    void shouldSummarizeClasses() {
        // Given
        List<ClassMetrics> classes = List.of(
                metrics("A", "a.java", 10, 4, 8, 1, 0),
                metrics("B", "a.java", 20, 2, 12, 3, 2),
                metrics("C", "c.java", 0, 0, 1, 2, 1));

        // When
        CohesionSummary summary = CohesionSummary.of(classes);

        // Then
        assertThat(summary.totalClasses()).isEqualTo(3);
        assertThat(summary.totalFiles()).isEqualTo(2);
        assertThat(summary.avgWmc()).isCloseTo(10.0, within(0.001));
        assertThat(summary.avgCbo()).isCloseTo(2.0, within(0.001));
        assertThat(summary.avgRfc()).isCloseTo(7.0, within(0.001));
        assertThat(summary.avgLcom()).isCloseTo(2.0, within(0.001));
        assertThat(summary.maxWmc()).isEqualTo(20);
        assertThat(summary.maxCbo()).isEqualTo(4);
        assertThat(summary.maxRfc()).isEqualTo(12);
        assertThat(summary.maxLcom()).isEqualTo(3);
        assertThat(summary.maxDit()).isEqualTo(2);
        assertThat(summary.lowCohesionCount()).isEqualTo(2);
    }

    @Test
    void shouldReportZerosForEmptyAnalysis() {
        CohesionAnalysis analysis = CohesionAnalysis.empty();

        assertThat(analysis.classes()).isEmpty();
        assertThat(analysis.diagnostics()).isEmpty();
        assertThat(analysis.summary()).isEqualTo(CohesionSummary.empty());
        assertThat(CohesionSummary.of(List.of())).isEqualTo(CohesionSummary.empty());
        assertThat(analysis.generatedAt()).isNotNull();
    }

    @Test
    void shouldSortDescendingAndKeepTiesInOrder() {
        // Given
        CohesionAnalysis analysis = CohesionAnalysis.of(List.of(
                metrics("First", "f.java", 5, 1, 1, 2, 0),
                metrics("Second", "s.java", 9, 3, 1, 1, 1),
                metrics("Third", "t.java", 5, 2, 1, 2, 3)), List.of());

        // Then
        assertThat(analysis.sortByLcom().classes()).extracting(ClassMetrics::getClassName)
                .containsExactly("First", "Third", "Second");
        assertThat(analysis.sortByWmc().classes()).extracting(ClassMetrics::getClassName)
                .containsExactly("Second", "First", "Third");
        assertThat(analysis.sortByCbo().classes()).extracting(ClassMetrics::getClassName)
                .containsExactly("Second", "Third", "First");
        assertThat(analysis.sortByDit().classes()).extracting(ClassMetrics::getClassName)
                .containsExactly("Third", "Second", "First");
    }

    @Test
    void shouldLeaveOriginalOrderUntouchedWhenSorting() {
        // Given
        CohesionAnalysis analysis = CohesionAnalysis.of(List.of(
                metrics("Low", "l.java", 1, 0, 1, 1, 0),
                metrics("High", "h.java", 1, 0, 1, 4, 0)), List.of());

        // When
        CohesionAnalysis sorted = analysis.sortBy(CohesionAnalysis.SortKey.LCOM);

        // Then
        assertThat(sorted.classes()).extracting(ClassMetrics::getClassName).containsExactly("High", "Low");
        assertThat(analysis.classes()).extracting(ClassMetrics::getClassName).containsExactly("Low", "High");
        assertThat(sorted.summary()).isEqualTo(analysis.summary());
    }

    @Test
    void shouldLimitToTopClasses() {
        CohesionAnalysis analysis = CohesionAnalysis.of(List.of(
                metrics("A", "a.java", 1, 0, 1, 1, 0),
                metrics("B", "b.java", 1, 0, 1, 1, 0),
                metrics("C", "c.java", 1, 0, 1, 1, 0)), List.of());

        assertThat(analysis.top(2)).extracting(ClassMetrics::getClassName).containsExactly("A", "B");
        assertThat(analysis.top(10)).hasSize(3);
        assertThat(analysis.top(0)).hasSize(3);
    }

    @Test
    void shouldParseSortKeys() {
        assertThat(CohesionAnalysis.SortKey.fromString("wmc")).isEqualTo(CohesionAnalysis.SortKey.WMC);
        assertThat(CohesionAnalysis.SortKey.fromString(" DIT ")).isEqualTo(CohesionAnalysis.SortKey.DIT);

        assertThatThrownBy(() -> CohesionAnalysis.SortKey.fromString("noc"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown sort key: noc");
    }

    @Test
    void shouldDeriveCountsFromLists() {
        ClassMetrics metrics = ClassMetrics.builder()
                .className("Box")
                .path(Paths.get("Box.java"))
                .language(Language.JAVA)
                .startLine(3)
                .endLine(12)
                .methods(List.of("open", "close"))
                .fields(List.of("lid"))
                .build();

        assertThat(metrics.getNom()).isEqualTo(2);
        assertThat(metrics.getNof()).isEqualTo(1);
        assertThat(metrics.getLoc()).isEqualTo(10);
        assertThat(metrics.getCoupledClasses()).isEmpty();
    }

    private static ClassMetrics metrics(String name, String file, int wmc, int cbo, int rfc, int lcom, int dit) {
        return ClassMetrics.builder()
                .className(name)
                .path(Paths.get(file))
                .language(Language.JAVA)
                .startLine(1)
                .endLine(10)
                .wmc(wmc)
                .cbo(cbo)
                .rfc(rfc)
                .lcom(lcom)
                .dit(dit)
                .build();
    }
}
