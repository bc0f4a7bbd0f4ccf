package org.carball.ckmetrics.parser;

import org.treesitter.TSNode;
import org.treesitter.TSTree;

import java.nio.file.Path;

/**
 * A parsed file. The tree is kept so its nodes stay valid while the result is in use.
 */
public record ParseResult(
    Path path,
    Language language,
    byte[] source,
    TSTree tree
) {
    public TSNode root() {
        return tree.getRootNode();
    }

    public String text(TSNode node) {
        return SyntaxTrees.text(node, source);
    }
}
