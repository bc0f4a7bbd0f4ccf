package org.carball.ckmetrics.graph;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Project-wide parent/child relation between class names.
 *
 * <p>Built once by {@link InheritanceGraphBuilder} and never modified afterwards, so any
 * number of threads may query it. Classes are keyed by simple name; two declarations with
 * the same name share one entry.</p>
 */
public final class InheritanceGraph {

    private final Map<String, List<String>> parentsOf;
    private final Map<String, List<String>> childrenOf;

    private InheritanceGraph(Map<String, List<String>> parentsOf, Map<String, List<String>> childrenOf) {
        this.parentsOf = parentsOf;
        this.childrenOf = childrenOf;
    }

    public static InheritanceGraph empty() {
        return new InheritanceGraph(Map.of(), Map.of());
    }

    /**
     * Folds facts into a graph in iteration order. A class seen twice keeps the parents
     * of its last fact; a child is listed under a parent at most once.
     */
    public static InheritanceGraph of(Iterable<ClassFact> facts) {
        Map<String, List<String>> parents = new LinkedHashMap<>();
        Map<String, List<String>> children = new LinkedHashMap<>();

        for (ClassFact fact : facts) {
            parents.put(fact.className(), fact.parents());
            for (String parent : fact.parents()) {
                List<String> siblings = children.computeIfAbsent(parent, key -> new ArrayList<>());
                if (!siblings.contains(fact.className())) {
                    siblings.add(fact.className());
                }
            }
        }

        Map<String, List<String>> frozenChildren = new LinkedHashMap<>();
        children.forEach((parent, list) -> frozenChildren.put(parent, List.copyOf(list)));
        return new InheritanceGraph(
                Collections.unmodifiableMap(parents),
                Collections.unmodifiableMap(frozenChildren));
    }

    public List<String> parentsOf(String className) {
        return parentsOf.getOrDefault(className, List.of());
    }

    public List<String> childrenOf(String className) {
        return childrenOf.getOrDefault(className, List.of());
    }

    public Set<String> classNames() {
        return parentsOf.keySet();
    }

    public int size() {
        return parentsOf.size();
    }

    /**
     * Depth of inheritance tree: the longest parent chain from {@code className} to a
     * class with no known parents. Unknown classes and roots have depth 0. A parent that
     * already lies on the chain being explored counts as a root, so cycles terminate:
     * for {@code A extends B, B extends A} both depths are 2.
     */
    public int dit(String className) {
        return depth(className, new HashSet<>());
    }

    private int depth(String className, Set<String> path) {
        List<String> parents = parentsOf(className);
        if (parents.isEmpty()) {
            return 0;
        }
        path.add(className);
        int deepest = 0;
        for (String parent : parents) {
            int parentDepth = path.contains(parent) ? 0 : depth(parent, path);
            deepest = Math.max(deepest, parentDepth + 1);
        }
        path.remove(className);
        return deepest;
    }

    /**
     * Number of direct children.
     */
    public int noc(String className) {
        return childrenOf(className).size();
    }
}
