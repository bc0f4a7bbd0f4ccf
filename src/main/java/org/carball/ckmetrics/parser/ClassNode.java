package org.carball.ckmetrics.parser;

import org.treesitter.TSNode;

/**
 * Coarse view of a class-like declaration: its name, 1-based line span and AST node.
 */
public record ClassNode(
    String name,
    int startLine,
    int endLine,
    TSNode node
) {}
