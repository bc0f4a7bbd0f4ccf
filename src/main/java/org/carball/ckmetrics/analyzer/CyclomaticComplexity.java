package org.carball.ckmetrics.analyzer;

import org.carball.ckmetrics.parser.SyntaxTrees;
import org.treesitter.TSNode;

import java.util.Set;

/**
 * McCabe complexity of a syntax subtree, counted by node type so one list serves every
 * grammar: 1 plus one per branch, loop, case, handler, conditional expression and
 * short-circuit operator.
 */
public final class CyclomaticComplexity {

    // Named nodes. Grammars reuse keywords like "if" as anonymous tokens, which are not counted.
    private static final Set<String> DECISION_NODES = Set.of(
            "if_statement", "if_expression", "if", "elif_clause", "else_if_clause", "elsif",
            "unless", "if_modifier", "unless_modifier",
            "for_statement", "enhanced_for_statement", "for_in_statement", "foreach_statement",
            "for_expression", "for",
            "while_statement", "while_expression", "while", "while_modifier", "until", "until_modifier",
            "do_statement",
            "switch_statement", "switch_expression", "match_expression",
            "case_clause", "case_statement", "switch_label", "switch_case", "switch_section", "when",
            "catch_clause", "except_clause", "rescue",
            "conditional_expression", "ternary_expression"
    );

    // Anonymous operator tokens
    private static final Set<String> DECISION_OPERATORS = Set.of("&&", "||", "and", "or");

    private CyclomaticComplexity() {
    }

    public static int of(TSNode node) {
        int[] complexity = {1};
        SyntaxTrees.walk(node, current -> {
            String type = current.getType();
            if (current.isNamed() ? isDecision(current, type) : DECISION_OPERATORS.contains(type)) {
                complexity[0]++;
            }
            return true;
        });
        return complexity[0];
    }

    // Java's switch_label covers "default" as well; only labels with a case value branch
    private static boolean isDecision(TSNode node, String type) {
        if ("switch_label".equals(type)) {
            return node.getNamedChildCount() > 0;
        }
        return DECISION_NODES.contains(type);
    }
}
