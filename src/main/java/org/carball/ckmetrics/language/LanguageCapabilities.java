package org.carball.ckmetrics.language;

import org.carball.ckmetrics.parser.Language;
import org.carball.ckmetrics.parser.SyntaxTrees;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.List;

/**
 * What a grammar calls a class, a method, a field and an inheritance clause, plus the
 * per-language rules that read names out of those nodes.
 *
 * <p>Node-type lists are ordered as declared; an empty list means the capability is not
 * applicable for the language. When {@code bodyRequired} is set, a class node counts as a
 * declaration only if it has a {@code body}, which rules out C++ forward declarations and
 * elaborated type uses such as {@code struct stat st;}.</p>
 */
public record LanguageCapabilities(
    Language language,
    List<String> classNodeTypes,
    List<String> methodNodeTypes,
    List<String> fieldNodeTypes,
    List<String> heritageNodeTypes,
    boolean bodyRequired,
    HeritageRule heritageRule,
    FieldNameRule fieldNameRule,
    FieldAccessRule fieldAccessRule
) {

    /**
     * Reads raw parent names from one heritage clause, a direct child of the class node
     * whose type is listed in {@link #heritageNodeTypes()}. Cleaning happens downstream.
     */
    @FunctionalInterface
    public interface HeritageRule {
        List<String> parents(TSNode classNode, byte[] source);
    }

    /**
     * Reads the field names declared by a node matching one of {@link #fieldNodeTypes()}.
     * A declaration may introduce several names ({@code int a, b;}) or none.
     */
    @FunctionalInterface
    public interface FieldNameRule {
        List<String> fieldNames(TSNode node, byte[] source);
    }

    /**
     * Returns the field accessed through self/this at this node, or {@code null}.
     */
    @FunctionalInterface
    public interface FieldAccessRule {
        String accessedField(TSNode node, byte[] source);
    }

    public LanguageCapabilities {
        classNodeTypes = List.copyOf(classNodeTypes);
        methodNodeTypes = List.copyOf(methodNodeTypes);
        fieldNodeTypes = List.copyOf(fieldNodeTypes);
        heritageNodeTypes = List.copyOf(heritageNodeTypes);
    }

    public static LanguageCapabilities none(Language language) {
        return new LanguageCapabilities(language, List.of(), List.of(), List.of(), List.of(), false,
                (node, source) -> List.of(),
                (node, source) -> List.of(),
                (node, source) -> null);
    }

    public boolean isApplicable() {
        return !classNodeTypes.isEmpty();
    }

    public boolean isClassNode(String nodeType) {
        return classNodeTypes.contains(nodeType);
    }

    /**
     * Whether {@code node} declares a class, as opposed to merely naming one.
     */
    public boolean isClassDeclaration(TSNode node) {
        if (!isClassNode(node.getType())) {
            return false;
        }
        return !bodyRequired || SyntaxTrees.field(node, "body") != null;
    }

    /**
     * Raw parent names of a class node, collected clause by clause in source order.
     */
    public List<String> parentsOf(TSNode classNode, byte[] source) {
        List<String> parents = new ArrayList<>();
        for (TSNode child : SyntaxTrees.children(classNode)) {
            if (heritageNodeTypes.contains(child.getType())) {
                parents.addAll(heritageRule.parents(child, source));
            }
        }
        return parents;
    }

    public boolean isMethodNode(String nodeType) {
        return methodNodeTypes.contains(nodeType);
    }

    public boolean isFieldNode(String nodeType) {
        return fieldNodeTypes.contains(nodeType);
    }
}
