package com.pseudoconv.core.generator;

import com.pseudoconv.core.ast.Ast;

import java.util.Map;

/**
 * Builds the logical negation of a loop condition, for rendering
 * {@code do { } while (T)} as {@code until NOT(T)}.
 *
 * <p>Never mutates its input: comparisons are rebuilt with the opposite operator,
 * a leading {@code !} is stripped, anything else is wrapped in a new {@code !} node.
 */
final class ConditionInverter {

    private static final Map<String, String> OPPOSITES = Map.of(
        "<", ">=",
        ">=", "<",
        "<=", ">",
        ">", "<=",
        "==", "!=",
        "!=", "=="
    );

    private ConditionInverter() {
        // Utility class - no instantiation
    }

    static Ast.Node invert(Ast.Node condition) {
        if (condition instanceof Ast.Unary unary && "!".equals(unary.operator())) {
            return unary.operand();
        }
        if (condition instanceof Ast.Binary binary && OPPOSITES.containsKey(binary.operator())) {
            return new Ast.Binary(OPPOSITES.get(binary.operator()), binary.left(), binary.right());
        }
        return new Ast.Unary("!", condition);
    }
}
