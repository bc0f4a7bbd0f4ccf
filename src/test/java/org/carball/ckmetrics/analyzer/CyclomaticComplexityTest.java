package org.carball.ckmetrics.analyzer;

import org.carball.ckmetrics.parser.Language;
import org.carball.ckmetrics.parser.ParseResult;
import org.carball.ckmetrics.parser.SourceParser;
import org.carball.ckmetrics.parser.SyntaxTrees;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.treesitter.TSNode;

import java.nio.file.Paths;

import static org.assertj.core.api.Assertions.assertThat;

public class CyclomaticComplexityTest {

    private SourceParser parser;

    @BeforeEach
    void setUp() {
        parser = new SourceParser();
    }

    @AfterEach
    void tearDown() {
        parser.close();
    }

    @Test
    void shouldStartAtOneForStraightLineCode() throws Exception {
        int complexity = javaMethodComplexity("""
            int add(int a, int b) {
                int sum = a + b;
                return sum;
            }
            """);

        assertThat(complexity).isEqualTo(1);
    }

    @Test
    void shouldCountBranchAndShortCircuitOperator() throws Exception {
        // Given
        String method = """
            int check(int a, int b) {
                if (a > 0 && b > 0) {
                    return 1;
                }
                return 0;
            }
            """;

        // Then
        assertThat(javaMethodComplexity(method)).isEqualTo(3);
    }

    @Test
    void shouldCountLoopsHandlersAndTernaries() throws Exception {
        // Given
        String method = """
            int run(int[] values) {
                int total = 0;
                for (int i = 0; i < values.length; i++) {
                    while (total > 100) {
                        total -= 10;
                    }
                }
                try {
                    total = total / values.length;
                } catch (ArithmeticException e) {
                    total = 0;
                }
                return total > 0 ? total : -total;
            }
            """;

        // Then: for, while, catch, ternary
        assertThat(javaMethodComplexity(method)).isEqualTo(5);
    }

    @Test
    void shouldCountCaseLabelsButNotDefault() throws Exception {
        // Given
        String method = """
            String name(int code) {
                switch (code) {
                    case 1:
                        return "one";
                    case 2:
                        return "two";
                    default:
                        return "other";
                }
            }
            """;

        // Then: switch, case 1, case 2
        assertThat(javaMethodComplexity(method)).isEqualTo(4);
    }

    @Test
    void shouldCountPythonBooleanKeywords() throws Exception {
        // Given
        String source = """
            def classify(a, b):
                if a and b:
                    return 1
                elif a or b:
                    return 2
                return 3
            """;

        // When
        ParseResult parsed = parser.parse(source, Language.PYTHON, Paths.get("classify.py"));
        TSNode function = SyntaxTrees.firstDescendantOfType(parsed.root(), "function_definition");

        // Then: if, and, elif, or
        assertThat(CyclomaticComplexity.of(function)).isEqualTo(5);
    }

    private int javaMethodComplexity(String method) throws Exception {
        ParseResult parsed = parser.parse("class Holder {\n" + method + "}\n", Language.JAVA, Paths.get("Holder.java"));
        TSNode methodNode = SyntaxTrees.firstDescendantOfType(parsed.root(), "method_declaration");
        assertThat(methodNode).isNotNull();
        return CyclomaticComplexity.of(methodNode);
    }
}
