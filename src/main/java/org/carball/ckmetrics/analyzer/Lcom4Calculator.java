package org.carball.ckmetrics.analyzer;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.List;
import java.util.Set;

/**
 * LCOM4: the number of connected components in the graph whose nodes are methods and
 * whose edges join methods that use at least one common field.
 *
 * <p>1 means every method is reachable from every other through shared state. A higher
 * value suggests the class bundles that many independent responsibilities.</p>
 */
public final class Lcom4Calculator {

    private Lcom4Calculator() {
    }

    public static int calculate(List<MethodFacts> methods, Collection<String> fields) {
        if (methods.isEmpty()) {
            return 0;
        }
        // Without fields no two methods can be connected
        if (fields.isEmpty()) {
            return methods.size();
        }

        List<List<Integer>> adjacency = buildAdjacency(methods);
        boolean[] visited = new boolean[methods.size()];
        int components = 0;

        for (int start = 0; start < methods.size(); start++) {
            if (visited[start]) {
                continue;
            }
            components++;
            Deque<Integer> stack = new ArrayDeque<>();
            stack.push(start);
            visited[start] = true;
            while (!stack.isEmpty()) {
                int current = stack.pop();
                for (int neighbour : adjacency.get(current)) {
                    if (!visited[neighbour]) {
                        visited[neighbour] = true;
                        stack.push(neighbour);
                    }
                }
            }
        }
        return components;
    }

    private static List<List<Integer>> buildAdjacency(List<MethodFacts> methods) {
        int n = methods.size();
        List<List<Integer>> adjacency = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            adjacency.add(new ArrayList<>());
        }
        for (int i = 0; i < n; i++) {
            for (int j = i + 1; j < n; j++) {
                if (sharesField(methods.get(i).usedFields(), methods.get(j).usedFields())) {
                    adjacency.get(i).add(j);
                    adjacency.get(j).add(i);
                }
            }
        }
        return adjacency;
    }

    private static boolean sharesField(Set<String> a, Set<String> b) {
        Set<String> smaller = a.size() <= b.size() ? a : b;
        Set<String> larger = smaller == a ? b : a;
        for (String field : smaller) {
            if (larger.contains(field)) {
                return true;
            }
        }
        return false;
    }
}
