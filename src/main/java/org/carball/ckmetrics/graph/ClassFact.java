package org.carball.ckmetrics.graph;

import java.nio.file.Path;
import java.util.List;

/**
 * One class declaration and the cleaned names of its direct parents, as seen in one file.
 */
public record ClassFact(
    String className,
    List<String> parents,
    Path file
) {

    public ClassFact {
        parents = List.copyOf(parents);
    }
}
