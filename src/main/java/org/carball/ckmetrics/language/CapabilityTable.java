package org.carball.ckmetrics.language;

import org.carball.ckmetrics.parser.Language;
import org.carball.ckmetrics.parser.SyntaxTrees;
import org.treesitter.TSNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.carball.ckmetrics.parser.SyntaxTrees.field;
import static org.carball.ckmetrics.parser.SyntaxTrees.namedChildren;
import static org.carball.ckmetrics.parser.SyntaxTrees.text;

/**
 * Static mapping from a {@link Language} to the grammar vocabulary of its class system.
 *
 * <p>Extraction code asks the table for node types and rules instead of branching on the
 * language. Languages without a class system map to {@link LanguageCapabilities#none}.</p>
 */
public final class CapabilityTable {

    private static final Map<Language, LanguageCapabilities> TABLE = buildTable();

    private CapabilityTable() {
    }

    public static LanguageCapabilities forLanguage(Language language) {
        if (language == null) {
            return LanguageCapabilities.none(Language.UNKNOWN);
        }
        LanguageCapabilities capabilities = TABLE.get(language);
        return capabilities != null ? capabilities : LanguageCapabilities.none(language);
    }

    public static boolean isApplicable(Language language) {
        return forLanguage(language).isApplicable();
    }

    private static Map<Language, LanguageCapabilities> buildTable() {
        Map<Language, LanguageCapabilities> table = new EnumMap<>(Language.class);
        table.put(Language.JAVA, java());
        table.put(Language.CSHARP, csharp());
        table.put(Language.CPP, cpp());
        table.put(Language.PYTHON, python());
        table.put(Language.JAVASCRIPT, ecmascript(Language.JAVASCRIPT));
        table.put(Language.TYPESCRIPT, ecmascript(Language.TYPESCRIPT));
        table.put(Language.TSX, ecmascript(Language.TSX));
        table.put(Language.RUBY, ruby());
        table.put(Language.PHP, php());
        return Collections.unmodifiableMap(table);
    }

    // Java

    private static LanguageCapabilities java() {
        return new LanguageCapabilities(
                Language.JAVA,
                List.of("class_declaration", "interface_declaration", "enum_declaration", "record_declaration"),
                List.of("method_declaration", "constructor_declaration"),
                List.of("field_declaration"),
                List.of("superclass", "super_interfaces", "extends_interfaces"),
                false,
                CapabilityTable::javaParents,
                CapabilityTable::javaFieldNames,
                (node, source) -> thisAccess(node, source, "field_access", "object", "field", "this"));
    }

    // "superclass" holds the type directly; the interface clauses wrap a type_list
    private static List<String> javaParents(TSNode clause, byte[] source) {
        List<String> parents = new ArrayList<>();
        TSNode types = "superclass".equals(clause.getType())
                ? clause
                : SyntaxTrees.firstChildOfType(clause, "type_list");
        for (TSNode type : namedChildren(types)) {
            parents.add(text(type, source));
        }
        return parents;
    }

    private static List<String> javaFieldNames(TSNode fieldNode, byte[] source) {
        List<String> names = new ArrayList<>();
        for (TSNode child : namedChildren(fieldNode)) {
            if ("variable_declarator".equals(child.getType())) {
                addIfPresent(names, text(field(child, "name"), source));
            }
        }
        return names;
    }

    // C#

    private static LanguageCapabilities csharp() {
        return new LanguageCapabilities(
                Language.CSHARP,
                List.of("class_declaration", "interface_declaration", "struct_declaration", "record_declaration"),
                List.of("method_declaration", "constructor_declaration"),
                List.of("field_declaration", "property_declaration"),
                List.of("base_list"),
                false,
                CapabilityTable::csharpParents,
                CapabilityTable::csharpFieldNames,
                (node, source) -> thisAccess(node, source, "member_access_expression", "expression", "name", "this"));
    }

    private static List<String> csharpParents(TSNode baseList, byte[] source) {
        List<String> parents = new ArrayList<>();
        for (TSNode base : namedChildren(baseList)) {
            if ("argument_list".equals(base.getType())) {
                continue;
            }
            // record Foo(int X) : Base(X) wraps the base type
            if ("primary_constructor_base_type".equals(base.getType())) {
                TSNode type = field(base, "type");
                parents.add(text(type != null ? type : base, source));
                continue;
            }
            parents.add(text(base, source));
        }
        return parents;
    }

    private static List<String> csharpFieldNames(TSNode fieldNode, byte[] source) {
        List<String> names = new ArrayList<>();
        if ("property_declaration".equals(fieldNode.getType())) {
            addIfPresent(names, text(field(fieldNode, "name"), source));
            return names;
        }
        TSNode declaration = SyntaxTrees.firstChildOfType(fieldNode, "variable_declaration");
        for (TSNode child : namedChildren(declaration)) {
            if (!"variable_declarator".equals(child.getType())) {
                continue;
            }
            TSNode name = field(child, "name");
            if (name == null) {
                name = SyntaxTrees.firstChildOfType(child, "identifier");
            }
            addIfPresent(names, text(name, source));
        }
        return names;
    }

    // C++

    private static final Set<String> CPP_DECLARATOR_WRAPPERS = Set.of(
            "pointer_declarator", "reference_declarator", "array_declarator", "init_declarator");

    private static LanguageCapabilities cpp() {
        return new LanguageCapabilities(
                Language.CPP,
                List.of("class_specifier", "struct_specifier"),
                List.of("function_definition"),
                List.of("field_declaration"),
                List.of("base_class_clause"),
                true,
                CapabilityTable::cppParents,
                CapabilityTable::cppFieldNames,
                (node, source) -> thisAccess(node, source, "field_expression", "argument", "field", "this"));
    }

    private static List<String> cppParents(TSNode clause, byte[] source) {
        List<String> parents = new ArrayList<>();
        for (TSNode base : namedChildren(clause)) {
            String type = base.getType();
            if ("access_specifier".equals(type) || "virtual".equals(type)) {
                continue;
            }
            parents.add(text(base, source));
        }
        return parents;
    }

    private static List<String> cppFieldNames(TSNode fieldNode, byte[] source) {
        List<String> names = new ArrayList<>();
        for (TSNode child : namedChildren(fieldNode)) {
            if (!isCppDeclarator(child)) {
                continue;
            }
            TSNode declarator = child;
            while (declarator != null && CPP_DECLARATOR_WRAPPERS.contains(declarator.getType())) {
                declarator = innerDeclarator(declarator);
            }
            // member function prototypes are not fields
            if (declarator == null || "function_declarator".equals(declarator.getType())) {
                continue;
            }
            if ("field_identifier".equals(declarator.getType()) || "identifier".equals(declarator.getType())) {
                addIfPresent(names, text(declarator, source));
            }
        }
        return names;
    }

    private static boolean isCppDeclarator(TSNode child) {
        String type = child.getType();
        return "field_identifier".equals(type)
                || "function_declarator".equals(type)
                || CPP_DECLARATOR_WRAPPERS.contains(type);
    }

    // reference_declarator has no "declarator" field; its target is the last named child
    private static TSNode innerDeclarator(TSNode declarator) {
        TSNode inner = field(declarator, "declarator");
        if (inner != null) {
            return inner;
        }
        int count = declarator.getNamedChildCount();
        return count > 0 ? declarator.getNamedChild(count - 1) : null;
    }

    // Python

    private static LanguageCapabilities python() {
        return new LanguageCapabilities(
                Language.PYTHON,
                List.of("class_definition"),
                List.of("function_definition"),
                List.of("assignment"),
                List.of("argument_list"),
                false,
                CapabilityTable::pythonParents,
                CapabilityTable::pythonFieldNames,
                (node, source) -> thisAccess(node, source, "attribute", "object", "attribute", "self"));
    }

    private static List<String> pythonParents(TSNode bases, byte[] source) {
        List<String> parents = new ArrayList<>();
        for (TSNode base : namedChildren(bases)) {
            // keyword_argument (metaclass=...) is not a base
            if ("identifier".equals(base.getType()) || "attribute".equals(base.getType())) {
                parents.add(text(base, source));
            }
        }
        return parents;
    }

    private static List<String> pythonFieldNames(TSNode assignment, byte[] source) {
        String name = thisAccess(field(assignment, "left"), source, "attribute", "object", "attribute", "self");
        return name != null ? List.of(name) : List.of();
    }

    // JavaScript, TypeScript, TSX

    private static final Set<String> HERITAGE_NAME_TYPES = Set.of(
            "identifier", "type_identifier", "member_expression", "nested_type_identifier");

    private static LanguageCapabilities ecmascript(Language language) {
        return new LanguageCapabilities(
                language,
                List.of("class_declaration", "class", "abstract_class_declaration"),
                List.of("method_definition"),
                List.of("field_definition", "public_field_definition"),
                List.of("class_heritage"),
                false,
                CapabilityTable::ecmascriptParents,
                CapabilityTable::ecmascriptFieldNames,
                (node, source) -> thisAccess(node, source, "member_expression", "object", "property", "this"));
    }

    private static List<String> ecmascriptParents(TSNode heritage, byte[] source) {
        List<String> parents = new ArrayList<>();
        SyntaxTrees.walk(heritage, node -> {
            if ("type_arguments".equals(node.getType())) {
                return false;
            }
            if (HERITAGE_NAME_TYPES.contains(node.getType())) {
                parents.add(text(node, source));
                return false;
            }
            return true;
        });
        return parents;
    }

    private static List<String> ecmascriptFieldNames(TSNode fieldNode, byte[] source) {
        TSNode name = "field_definition".equals(fieldNode.getType())
                ? field(fieldNode, "property")
                : field(fieldNode, "name");
        List<String> names = new ArrayList<>();
        addIfPresent(names, text(name, source));
        return names;
    }

    // Ruby

    private static LanguageCapabilities ruby() {
        return new LanguageCapabilities(
                Language.RUBY,
                List.of("class", "module"),
                List.of("method", "singleton_method"),
                List.of("instance_variable"),
                List.of("superclass"),
                false,
                CapabilityTable::rubyParents,
                (node, source) -> List.of(text(node, source)),
                (node, source) -> "instance_variable".equals(node.getType()) ? text(node, source) : null);
    }

    private static List<String> rubyParents(TSNode superclass, byte[] source) {
        // the superclass node spans "< Base"; the named child is the expression
        TSNode expression = superclass.getNamedChildCount() > 0 ? superclass.getNamedChild(0) : superclass;
        return List.of(text(expression, source));
    }

    // PHP

    private static final Set<String> PHP_NAME_TYPES = Set.of("name", "qualified_name");

    private static LanguageCapabilities php() {
        return new LanguageCapabilities(
                Language.PHP,
                List.of("class_declaration", "interface_declaration", "trait_declaration"),
                List.of("method_declaration"),
                List.of("property_declaration"),
                List.of("base_clause", "class_interface_clause"),
                false,
                CapabilityTable::phpParents,
                CapabilityTable::phpFieldNames,
                (node, source) -> thisAccess(node, source, "member_access_expression", "object", "name", "$this"));
    }

    private static List<String> phpParents(TSNode clause, byte[] source) {
        List<String> parents = new ArrayList<>();
        for (TSNode child : namedChildren(clause)) {
            if (PHP_NAME_TYPES.contains(child.getType())) {
                parents.add(text(child, source));
            }
        }
        return parents;
    }

    private static List<String> phpFieldNames(TSNode propertyDeclaration, byte[] source) {
        List<String> names = new ArrayList<>();
        for (TSNode element : namedChildren(propertyDeclaration)) {
            if (!"property_element".equals(element.getType())) {
                continue;
            }
            TSNode variable = SyntaxTrees.firstChildOfType(element, "variable_name");
            String name = text(variable, source);
            addIfPresent(names, name.startsWith("$") ? name.substring(1) : name);
        }
        return names;
    }

    // shared

    /**
     * Matches {@code receiver.member} shapes where the receiver text equals {@code self}
     * and returns the member text.
     */
    private static String thisAccess(TSNode node, byte[] source, String nodeType,
                                     String receiverField, String memberField, String self) {
        if (node == null || !nodeType.equals(node.getType())) {
            return null;
        }
        TSNode receiver = field(node, receiverField);
        if (receiver == null || !self.equals(text(receiver, source))) {
            return null;
        }
        String member = text(field(node, memberField), source);
        return member.isEmpty() ? null : member;
    }

    private static void addIfPresent(List<String> names, String name) {
        if (name != null && !name.isBlank()) {
            names.add(name.strip());
        }
    }
}
