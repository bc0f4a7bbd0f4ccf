package org.carball.ckmetrics.analyzer;

import org.carball.ckmetrics.graph.InheritanceGraph;
import org.carball.ckmetrics.language.CapabilityTable;
import org.carball.ckmetrics.language.LanguageCapabilities;
import org.carball.ckmetrics.language.TypeNames;
import org.carball.ckmetrics.model.ClassMetrics;
import org.carball.ckmetrics.parser.ClassNode;
import org.carball.ckmetrics.parser.ParseResult;
import org.carball.ckmetrics.parser.SyntaxTrees;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.TreeSet;

import static org.carball.ckmetrics.parser.SyntaxTrees.field;
import static org.carball.ckmetrics.parser.SyntaxTrees.text;

/**
 * Second analysis pass for a single class: walks the class subtree and turns what it
 * finds into {@link ClassMetrics}.
 *
 * <p>CBO and RFC are read off the syntax alone. Names are never resolved, so a call to an
 * unrelated method that happens to share a name counts the same as a call to a sibling,
 * and any identifier may be taken for a type reference. Both figures are upper bounds.</p>
 */
public class ClassMetricsExtractor {

    private static final Set<String> CALL_NODES = Set.of(
            "call_expression", "method_invocation", "invocation_expression", "call",
            "method_call", "function_call_expression", "member_call_expression",
            "scoped_call_expression");

    // Child fields naming the callee, in lookup order
    private static final List<String> CALLEE_FIELDS = List.of("function", "method", "name");

    private static final Set<String> TYPE_REFERENCE_NODES = Set.of(
            "type_identifier", "class_type", "simple_type", "named_type", "type_name",
            "identifier", "constant");

    private static final Set<String> DECLARATOR_NAME_NODES = Set.of(
            "identifier", "field_identifier", "destructor_name", "operator_name", "qualified_identifier");

    private final InheritanceGraph graph;

    public ClassMetricsExtractor(InheritanceGraph graph) {
        this.graph = graph;
    }

    public ClassMetrics extract(ClassNode classNode, ParseResult parsed) {
        LanguageCapabilities capabilities = CapabilityTable.forLanguage(parsed.language());
        byte[] source = parsed.source();
        TSNode node = classNode.node();

        List<MethodFacts> methods = extractMethods(node, source, capabilities);
        List<String> fields = extractFields(node, source, capabilities);
        Set<String> calledNames = extractCalledNames(node, source);
        Set<String> coupled = extractCoupledClasses(node, source);

        int wmc = 0;
        List<String> methodNames = new ArrayList<>(methods.size());
        for (MethodFacts method : methods) {
            wmc += method.cyclomaticComplexity();
            methodNames.add(method.name());
        }

        return ClassMetrics.builder()
                .path(parsed.path())
                .className(classNode.name())
                .language(parsed.language())
                .startLine(classNode.startLine())
                .endLine(classNode.endLine())
                .methods(List.copyOf(methodNames))
                .fields(List.copyOf(fields))
                .coupledClasses(List.copyOf(coupled))
                .wmc(wmc)
                .cbo(coupled.size())
                .rfc(methods.size() + calledNames.size())
                .lcom(Lcom4Calculator.calculate(methods, fields))
                .dit(graph.dit(classNode.name()))
                .noc(graph.noc(classNode.name()))
                .build();
    }

    List<MethodFacts> extractMethods(TSNode classNode, byte[] source, LanguageCapabilities capabilities) {
        List<MethodFacts> methods = new ArrayList<>();
        SyntaxTrees.walk(classNode, node -> {
            if (!capabilities.isMethodNode(node.getType())) {
                return true;
            }
            String name = methodName(node, source);
            if (name != null) {
                methods.add(new MethodFacts(name, CyclomaticComplexity.of(node), usedFields(node, source, capabilities)));
            }
            // local functions belong to the method, not the class
            return false;
        });
        return methods;
    }

    private static Set<String> usedFields(TSNode methodNode, byte[] source, LanguageCapabilities capabilities) {
        Set<String> used = new HashSet<>();
        SyntaxTrees.walk(methodNode, node -> {
            String accessed = capabilities.fieldAccessRule().accessedField(node, source);
            if (accessed != null) {
                used.add(accessed);
            }
            return true;
        });
        return used;
    }

    /**
     * Method name from the {@code name} field, or for C-style definitions the innermost
     * name of the {@code declarator} chain.
     */
    static String methodName(TSNode methodNode, byte[] source) {
        TSNode name = field(methodNode, "name");
        if (name != null) {
            String text = text(name, source).trim();
            return text.isEmpty() ? null : text;
        }

        TSNode declarator = field(methodNode, "declarator");
        while (declarator != null) {
            if (DECLARATOR_NAME_NODES.contains(declarator.getType())) {
                TSNode qualifiedName = "qualified_identifier".equals(declarator.getType())
                        ? field(declarator, "name") : null;
                String text = text(qualifiedName != null ? qualifiedName : declarator, source).trim();
                return text.isEmpty() ? null : text;
            }
            declarator = field(declarator, "declarator");
        }
        return null;
    }

    List<String> extractFields(TSNode classNode, byte[] source, LanguageCapabilities capabilities) {
        List<String> fields = new ArrayList<>();
        SyntaxTrees.walk(classNode, node -> {
            if (capabilities.isFieldNode(node.getType())) {
                fields.addAll(capabilities.fieldNameRule().fieldNames(node, source));
            }
            return true;
        });
        return fields;
    }

    Set<String> extractCalledNames(TSNode classNode, byte[] source) {
        Set<String> called = new LinkedHashSet<>();
        SyntaxTrees.walk(classNode, node -> {
            if (CALL_NODES.contains(node.getType())) {
                String callee = calleeName(node, source);
                if (callee != null) {
                    called.add(callee);
                }
            }
            return true;
        });
        return called;
    }

    private static String calleeName(TSNode call, byte[] source) {
        for (String fieldName : CALLEE_FIELDS) {
            TSNode callee = field(call, fieldName);
            if (callee != null) {
                String text = text(memberName(callee), source).trim();
                return text.isEmpty() ? null : text;
            }
        }
        return null;
    }

    // obj.method(...) is a call to "method"
    private static TSNode memberName(TSNode callee) {
        TSNode member;
        switch (callee.getType()) {
            case "member_expression":
                member = field(callee, "property");
                break;
            case "attribute":
                member = field(callee, "attribute");
                break;
            case "field_expression":
                member = field(callee, "field");
                break;
            case "member_access_expression":
                member = field(callee, "name");
                break;
            default:
                member = null;
                break;
        }
        return member != null ? member : callee;
    }

    /**
     * Distinct type-like names in the class subtree, the class's own name included.
     * Primitives and one-character names (usually type parameters) are left out.
     */
    Set<String> extractCoupledClasses(TSNode classNode, byte[] source) {
        Set<String> coupled = new TreeSet<>();
        SyntaxTrees.walk(classNode, node -> {
            if (TYPE_REFERENCE_NODES.contains(node.getType())) {
                String name = text(node, source).trim();
                if (name.length() > 1 && !TypeNames.isPrimitive(name)) {
                    coupled.add(name);
                }
            }
            return true;
        });
        return coupled;
    }
}
