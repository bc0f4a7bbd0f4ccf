package org.carball.ckmetrics.analyzer;

import org.carball.ckmetrics.graph.ClassFact;
import org.carball.ckmetrics.graph.InheritanceGraph;
import org.carball.ckmetrics.language.CapabilityTable;
import org.carball.ckmetrics.model.ClassMetrics;
import org.carball.ckmetrics.parser.ClassNode;
import org.carball.ckmetrics.parser.Language;
import org.carball.ckmetrics.parser.ParseResult;
import org.carball.ckmetrics.parser.SourceParser;
import org.carball.ckmetrics.parser.SyntaxTrees;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

public class ClassMetricsExtractorTest {

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
    void shouldExtractJavaClassMetrics() throws Exception {
        // Given
        String source = """
            public class OrderService extends BaseService {
                private Repository repository;
                private int count;

                public Order find(String id) {
                    this.count++;
                    return this.repository.load(id);
                }

                public void reset() {
                    if (this.count > 0) {
                        this.count = 0;
                    }
                    log("reset");
                }
            }
            """;
        InheritanceGraph graph = InheritanceGraph.of(List.of(
                new ClassFact("OrderService", List.of("BaseService"), Paths.get("OrderService.java")),
                new ClassFact("BaseService", List.of(), Paths.get("BaseService.java"))));

        // When
        ClassMetrics metrics = extractFirst(source, Language.JAVA, "OrderService.java", graph);

        // Then
        assertThat(metrics.getClassName()).isEqualTo("OrderService");
        assertThat(metrics.getLanguage()).isEqualTo(Language.JAVA);
        assertThat(metrics.getStartLine()).isEqualTo(1);
        assertThat(metrics.getEndLine()).isEqualTo(16);
        assertThat(metrics.getLoc()).isEqualTo(16);
        assertThat(metrics.getMethods()).containsExactly("find", "reset");
        assertThat(metrics.getFields()).containsExactly("repository", "count");
        assertThat(metrics.getNom()).isEqualTo(2);
        assertThat(metrics.getNof()).isEqualTo(2);
        assertThat(metrics.getWmc()).isEqualTo(3);
        assertThat(metrics.getRfc()).isEqualTo(4);
        assertThat(metrics.getLcom()).isEqualTo(1);
        assertThat(metrics.getDit()).isEqualTo(1);
        assertThat(metrics.getNoc()).isZero();
        assertThat(metrics.getCoupledClasses())
                .contains("OrderService", "BaseService", "Repository", "Order")
                .doesNotContain("String", "int")
                .isSorted();
        assertThat(metrics.getCbo()).isEqualTo(metrics.getCoupledClasses().size());
    }

    @Test
    void shouldSplitUnrelatedResponsibilities() throws Exception {
        // Given
        String source = """
            class Profile {
                private String name;
                private int age;

                String getName() { return this.name; }
                void setName(String value) { this.name = value; }
                int getAge() { return this.age; }
                void setAge(int value) { this.age = value; }
            }
            """;

        // When
        ClassMetrics metrics = extractFirst(source, Language.JAVA, "Profile.java", InheritanceGraph.empty());

        // Then
        assertThat(metrics.getLcom()).isEqualTo(2);
        assertThat(metrics.getWmc()).isEqualTo(4);
        assertThat(metrics.getDit()).isZero();
    }

    @Test
    void shouldCountConstructorsAsMethods() throws Exception {
        // Given
        String source = """
            class Counter {
                private int value;

                Counter(int start) { this.value = start; }
                int next() { return ++this.value; }
            }
            """;

        // When
        ClassMetrics metrics = extractFirst(source, Language.JAVA, "Counter.java", InheritanceGraph.empty());

        // Then
        assertThat(metrics.getMethods()).containsExactly("Counter", "next");
        assertThat(metrics.getLcom()).isEqualTo(1);
    }

    @Test
    void shouldExtractPythonClassMetrics() throws Exception {
        // Given
        String source = """
            class Account(Base):
                def __init__(self, owner):
                    self.owner = owner
                    self.balance = 0

                def deposit(self, amount):
                    if amount > 0:
                        self.balance += amount
                    self.notify(amount)

                def describe(self):
                    return str(self.owner)
            """;
        InheritanceGraph graph = InheritanceGraph.of(List.of(
                new ClassFact("Account", List.of("Base"), Paths.get("account.py"))));

        // When
        ClassMetrics metrics = extractFirst(source, Language.PYTHON, "account.py", graph);

        // Then
        assertThat(metrics.getMethods()).containsExactly("__init__", "deposit", "describe");
        assertThat(metrics.getFields()).containsExactly("owner", "balance");
        assertThat(metrics.getWmc()).isEqualTo(4);
        assertThat(metrics.getLcom()).isEqualTo(1);
        assertThat(metrics.getDit()).isEqualTo(1);
        // 3 methods plus notify and str
        assertThat(metrics.getRfc()).isEqualTo(5);
    }

    @Test
    void shouldExtractTypeScriptCallsThroughMembers() throws Exception {
        // Given
        String source = """
            class Service {
              private count: number = 0;

              increment(): void {
                this.count++;
                this.logger.info("incremented");
              }

              reset(): void {
                this.count = 0;
              }
            }
            """;

        // When
        ClassMetrics metrics = extractFirst(source, Language.TYPESCRIPT, "service.ts", InheritanceGraph.empty());

        // Then
        assertThat(metrics.getMethods()).containsExactly("increment", "reset");
        assertThat(metrics.getFields()).containsExactly("count");
        assertThat(metrics.getLcom()).isEqualTo(1);
        assertThat(metrics.getRfc()).isEqualTo(3);
    }

    @Test
    void shouldNameCppMethodsFromDeclarators() throws Exception {
        // Given
        String source = """
            class Circle {
              double radius;
            public:
              double area() { return this->radius * this->radius; }
              double diameter() { return this->radius * 2; }
            };
            """;

        // When
        ClassMetrics metrics = extractFirst(source, Language.CPP, "circle.cpp", InheritanceGraph.empty());

        // Then
        assertThat(metrics.getMethods()).containsExactly("area", "diameter");
        assertThat(metrics.getFields()).containsExactly("radius");
        assertThat(metrics.getLcom()).isEqualTo(1);
    }

    @Test
    void shouldCountOwnNameAsCouplingForSelfReferencingClass() throws Exception {
        // Given
        String source = """
            class Node {
                Node next;

                Node link(Node other) {
                    this.next = other;
                    return this;
                }
            }
            """;

        // When
        ClassMetrics metrics = extractFirst(source, Language.JAVA, "Node.java", InheritanceGraph.empty());

        // Then
        assertThat(metrics.getCoupledClasses()).contains("Node");
        assertThat(metrics.getCbo()).isEqualTo(metrics.getCoupledClasses().size());
    }

    @Test
    void shouldReportZeroMethodsForEmptyClass() throws Exception {
        ClassMetrics metrics = extractFirst("class Marker {}", Language.JAVA, "Marker.java", InheritanceGraph.empty());

        assertThat(metrics.getNom()).isZero();
        assertThat(metrics.getWmc()).isZero();
        assertThat(metrics.getLcom()).isZero();
        assertThat(metrics.getRfc()).isZero();
    }

    private ClassMetrics extractFirst(String source, Language language, String fileName, InheritanceGraph graph)
            throws Exception {
        Path path = Paths.get(fileName);
        ParseResult parsed = parser.parse(source, language, path);
        List<ClassNode> classes = SyntaxTrees.findClasses(parsed, CapabilityTable.forLanguage(language)::isClassDeclaration);
        assertThat(classes).isNotEmpty();
        return new ClassMetricsExtractor(graph).extract(classes.get(0), parsed);
    }
}
