package org.carball.ckmetrics.cli;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.ckmetrics.config.OutputFormat;
import org.carball.ckmetrics.model.CohesionAnalysis;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class CkAnalyzerCLITest {

    @TempDir
    Path tempDir;

    @Test
    void shouldApplyDefaults() {
        // When
        CkAnalyzerCLI.CliOptions options = CkAnalyzerCLI.parseArgs(new String[]{tempDir.toString()});

        // Then
        assertThat(options.getPaths()).containsExactly(tempDir);
        assertThat(options.getTopN()).isEqualTo(20);
        assertThat(options.getSortKey()).isEqualTo(CohesionAnalysis.SortKey.LCOM);
        assertThat(options.getOutputFile()).isEqualTo("ck-metrics.json");
        assertThat(options.getOutputFormat()).isEqualTo(OutputFormat.JSON);
        assertThat(options.getThresholdsFile()).isNull();
        assertThat(options.isVerbose()).isFalse();
    }

    @Test
    void shouldParseOptions() {
        // Given
        String output = tempDir.resolve("report.txt").toString();
        String[] args = {tempDir.toString(), "--top", "5", "--sort", "wmc", "-o", output,
                "--format", "markdown", "--workers", "2", "--include-tests", "-v"};

        // When
        CkAnalyzerCLI.CliOptions options = CkAnalyzerCLI.parseArgs(args);

        // Then
        assertThat(options.getTopN()).isEqualTo(5);
        assertThat(options.getSortKey()).isEqualTo(CohesionAnalysis.SortKey.WMC);
        assertThat(options.getOutputFormat()).isEqualTo(OutputFormat.MARKDOWN);
        assertThat(options.getOutputFile()).isEqualTo(tempDir.resolve("report.md").toString());
        assertThat(options.isVerbose()).isTrue();
    }

    @Test
    void shouldRejectUnknownOption() {
        assertThatThrownBy(() -> CkAnalyzerCLI.parseArgs(new String[]{tempDir.toString(), "--fast"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown option: --fast");
    }

    @Test
    void shouldRequireSourcePath() {
        assertThatThrownBy(() -> CkAnalyzerCLI.parseArgs(new String[]{"--top", "5"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("At least one source path is required");
    }

    @Test
    void shouldRejectMissingSourcePath() {
        String missing = tempDir.resolve("nope").toString();

        assertThatThrownBy(() -> CkAnalyzerCLI.parseArgs(new String[]{missing}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Source path not found");
    }

    @Test
    void shouldRejectInvalidNumbersAndKeys() {
        String root = tempDir.toString();

        assertThatThrownBy(() -> CkAnalyzerCLI.parseArgs(new String[]{root, "--top", "ten"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid number for --top");
        assertThatThrownBy(() -> CkAnalyzerCLI.parseArgs(new String[]{root, "--workers", "x"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid number for --workers");
        assertThatThrownBy(() -> CkAnalyzerCLI.parseArgs(new String[]{root, "--sort", "size"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Unknown sort key");
        assertThatThrownBy(() -> CkAnalyzerCLI.parseArgs(new String[]{root, "--format", "xml"}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Invalid output format");
    }

    @Test
    void shouldRejectMissingOutputDirectory() {
        String output = tempDir.resolve("absent").resolve("report.json").toString();

        assertThatThrownBy(() -> CkAnalyzerCLI.parseArgs(new String[]{tempDir.toString(), "-o", output}))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Output directory does not exist");
    }

    @Test
    void shouldWriteJsonReport() throws Exception {
        // Given
        Path src = Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(src.resolve("Animal.java"), "public class Animal { }");
        Files.writeString(src.resolve("Dog.java"), """
            public class Dog extends Animal {
                private int barks;
                void bark() { this.barks++; }
                int count() { return this.barks; }
            }
            """);
        Path output = tempDir.resolve("metrics.json");

        // When
        int exitCode = CkAnalyzerCLI.run(new String[]{src.toString(), "-o", output.toString(), "--workers", "2"});

        // Then
        assertThat(exitCode).isZero();
        assertThat(output).exists();
        JsonNode root = new ObjectMapper().readTree(output.toFile());
        assertThat(root.path("summary").path("total_classes").asInt()).isEqualTo(2);
        assertThat(root.path("classes")).extracting(node -> node.path("class_name").asText())
                .containsExactlyInAnyOrder("Animal", "Dog");
    }

    @Test
    void shouldWriteBothFormats() throws Exception {
        // Given
        Path src = Files.createDirectories(tempDir.resolve("src"));
        Files.writeString(src.resolve("shape.py"), """
            class Shape:
                def area(self):
                    return 0
            """);
        Path base = tempDir.resolve("ck-report");

        // When
        int exitCode = CkAnalyzerCLI.run(new String[]{src.toString(), "-o", base.toString(), "-f", "both"});

        // Then
        assertThat(exitCode).isZero();
        assertThat(tempDir.resolve("ck-report.json")).exists();
        assertThat(tempDir.resolve("ck-report.md")).content().contains("# CK Metrics Report", "Shape");
    }

    @Test
    void shouldReturnErrorCodeForBadArguments() {
        assertThat(CkAnalyzerCLI.run(new String[]{})).isEqualTo(1);
        assertThat(CkAnalyzerCLI.run(new String[]{"--help"})).isZero();
        assertThat(CkAnalyzerCLI.run(new String[]{tempDir.resolve("missing").toString()})).isEqualTo(1);
    }
}
