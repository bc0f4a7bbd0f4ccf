package org.carball.ckmetrics.parser;

import org.treesitter.TSNode;

import java.nio.charset.StandardCharsets;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.function.Predicate;

/**
 * Static helpers over tree-sitter nodes.
 */
public final class SyntaxTrees {

    private SyntaxTrees() {
    }

    /**
     * Visits a node before its children. Returning {@code false} skips the node's children.
     */
    @FunctionalInterface
    public interface NodeVisitor {
        boolean visit(TSNode node);
    }

    public static boolean isAbsent(TSNode node) {
        return node == null || node.isNull();
    }

    /**
     * Pre-order traversal over every child, named or anonymous. Iterative so deeply
     * nested trees cannot overflow the stack.
     */
    public static void walk(TSNode root, NodeVisitor visitor) {
        if (isAbsent(root)) {
            return;
        }
        Deque<TSNode> stack = new ArrayDeque<>();
        stack.push(root);
        while (!stack.isEmpty()) {
            TSNode node = stack.pop();
            if (!visitor.visit(node)) {
                continue;
            }
            for (int i = node.getChildCount() - 1; i >= 0; i--) {
                TSNode child = node.getChild(i);
                if (!isAbsent(child)) {
                    stack.push(child);
                }
            }
        }
    }

    public static String text(TSNode node, byte[] source) {
        if (isAbsent(node) || source == null) {
            return "";
        }
        int start = Math.max(0, node.getStartByte());
        int end = Math.min(source.length, node.getEndByte());
        if (end <= start) {
            return "";
        }
        return new String(source, start, end - start, StandardCharsets.UTF_8);
    }

    /**
     * Child by grammar field name, or {@code null} when the field is not present.
     */
    public static TSNode field(TSNode node, String fieldName) {
        if (isAbsent(node)) {
            return null;
        }
        TSNode child = node.getChildByFieldName(fieldName);
        return isAbsent(child) ? null : child;
    }

    public static List<TSNode> children(TSNode node) {
        List<TSNode> result = new ArrayList<>();
        if (isAbsent(node)) {
            return result;
        }
        for (int i = 0; i < node.getChildCount(); i++) {
            TSNode child = node.getChild(i);
            if (!isAbsent(child)) {
                result.add(child);
            }
        }
        return result;
    }

    public static List<TSNode> namedChildren(TSNode node) {
        List<TSNode> result = new ArrayList<>();
        if (isAbsent(node)) {
            return result;
        }
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            TSNode child = node.getNamedChild(i);
            if (!isAbsent(child)) {
                result.add(child);
            }
        }
        return result;
    }

    public static TSNode firstChildOfType(TSNode node, String type) {
        for (TSNode child : children(node)) {
            if (type.equals(child.getType())) {
                return child;
            }
        }
        return null;
    }

    public static TSNode firstDescendantOfType(TSNode node, String type) {
        TSNode[] found = new TSNode[1];
        walk(node, n -> {
            if (found[0] != null) {
                return false;
            }
            if (type.equals(n.getType())) {
                found[0] = n;
                return false;
            }
            return true;
        });
        return found[0];
    }

    public static int startLine(TSNode node) {
        return node.getStartPoint().getRow() + 1;
    }

    public static int endLine(TSNode node) {
        return node.getEndPoint().getRow() + 1;
    }

    public static List<ClassNode> findClasses(ParseResult result, Collection<String> classNodeTypes) {
        if (classNodeTypes.isEmpty()) {
            return new ArrayList<>();
        }
        return findClasses(result, node -> classNodeTypes.contains(node.getType()));
    }

    /**
     * Finds class-like declarations that are not nested inside another class-like
     * declaration. Declarations without a {@code name} field are skipped.
     */
    public static List<ClassNode> findClasses(ParseResult result, Predicate<TSNode> isClassDeclaration) {
        List<ClassNode> classes = new ArrayList<>();
        walk(result.root(), node -> {
            if (!isClassDeclaration.test(node)) {
                return true;
            }
            String name = result.text(field(node, "name")).trim();
            if (!name.isEmpty()) {
                classes.add(new ClassNode(name, startLine(node), endLine(node), node));
            }
            return false;
        });
        return classes;
    }
}
