package org.carball.ckmetrics.analyzer;

import java.util.Set;

/**
 * What the cohesion and complexity metrics need to know about one method.
 */
public record MethodFacts(
    String name,
    int cyclomaticComplexity,
    Set<String> usedFields
) {

    public MethodFacts {
        usedFields = Set.copyOf(usedFields);
    }
}
