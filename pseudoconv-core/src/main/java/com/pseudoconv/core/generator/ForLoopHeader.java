package com.pseudoconv.core.generator;

import com.pseudoconv.core.ast.Ast;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Reconstructs counting-loop headers from a Java {@code for} statement.
 *
 * <p>Loop form: {@code i from START to|downto END[ step K]}. START comes from the
 * init (default 0), the step and direction from the update, END from the test:
 * <pre>
 * i &lt; 5      to 4            i &lt; n      to n - 1
 * i &lt;= 5     to 5            i &gt; 0      downto 1
 * i &gt;= 0     downto 0        i &gt; m      downto m + 1
 * </pre>
 *
 * <p>Structured form: {@code INIT ; TEST ; UPDATE}.
 */
final class ForLoopHeader {

    private static final String UNIT_STEP = "1";

    private ForLoopHeader() {
        // Utility class - no instantiation
    }

    /** Step amount and direction of a counting loop. */
    private record Step(String amount, boolean descending) {
        static final Step UNIT_ASCENDING = new Step(UNIT_STEP, false);
    }

    static String loopForm(Ast.For loop, ExpressionFormatter formatter) {
        String variable = "";
        String start = "0";
        if (loop.init() instanceof Ast.Declaration declaration) {
            variable = declaration.name();
            if (declaration.initializer() != null) {
                start = formatter.format(declaration.initializer());
            }
        } else if (loop.init() instanceof Ast.Assignment assignment) {
            variable = formatter.format(assignment.target());
            start = formatter.format(assignment.value());
        }

        Step step = stepOf(loop.update(), formatter);
        boolean descending = step.descending();
        String end = "";
        if (loop.test() instanceof Ast.Binary test) {
            String bound = formatter.format(test.right());
            switch (test.operator()) {
                case "<" -> end = offsetBound(test.right(), bound, step.amount(), false);
                case "<=" -> end = bound;
                case ">" -> {
                    end = offsetBound(test.right(), bound, step.amount(), true);
                    descending = true;
                }
                case ">=" -> {
                    end = bound;
                    descending = true;
                }
                default -> {
                    // not a counting bound
                }
            }
        }

        List<String> parts = new ArrayList<>();
        if (!variable.isEmpty()) {
            parts.add(variable);
        }
        parts.add("from");
        parts.add(start);
        parts.add(descending ? "downto" : "to");
        if (!end.isEmpty()) {
            parts.add(end);
        }
        if (!UNIT_STEP.equals(step.amount())) {
            parts.add("step");
            parts.add(step.amount());
        }
        return String.join(" ", parts);
    }

    static String structuredForm(Ast.For loop, ExpressionFormatter formatter) {
        String init = "";
        if (loop.init() instanceof Ast.Declaration declaration) {
            init = declaration.name() + " = "
                + (declaration.initializer() != null ? formatter.format(declaration.initializer()) : "0");
        } else if (loop.init() instanceof Ast.Assignment assignment) {
            init = formatter.formatAssignment(assignment.target(), assignment.operator(), assignment.value());
        }
        String test = loop.test() != null ? formatter.format(loop.test()) : "";
        String update = loop.update() != null ? formatter.format(loop.update()) : "";
        return init + " ; " + test + " ; " + update;
    }

    private static Step stepOf(Ast.Node update, ExpressionFormatter formatter) {
        if (update instanceof Ast.Update increment) {
            return new Step(UNIT_STEP, "--".equals(increment.operator()));
        }
        if (update instanceof Ast.UnaryPostfix increment) {
            return new Step(UNIT_STEP, "--".equals(increment.operator()));
        }
        if (update instanceof Ast.AssignmentExpr assignment) {
            return stepOfAssignment(assignment.target(), assignment.operator(), assignment.value(), formatter);
        }
        if (update instanceof Ast.Assignment assignment) {
            return stepOfAssignment(assignment.target(), assignment.operator(), assignment.value(), formatter);
        }
        return Step.UNIT_ASCENDING;
    }

    private static Step stepOfAssignment(Ast.Node target, String operator, Ast.Node value,
                                         ExpressionFormatter formatter) {
        switch (operator) {
            case "+=":
                return new Step(formatter.format(value), false);
            case "-=":
                return new Step(formatter.format(value), true);
            case "=":
                // i = i + k, i = i - k
                if (value instanceof Ast.Binary binary
                    && ("+".equals(binary.operator()) || "-".equals(binary.operator()))
                    && formatter.format(binary.left()).equals(formatter.format(target))) {
                    return new Step(formatter.format(binary.right()), "-".equals(binary.operator()));
                }
                return Step.UNIT_ASCENDING;
            default:
                return Step.UNIT_ASCENDING;
        }
    }

    /**
     * Turns an exclusive bound into an inclusive one. Numeric literals are
     * folded; anything else is written out as {@code bound - step}.
     */
    private static String offsetBound(Ast.Node boundNode, String bound, String step, boolean add) {
        BigDecimal literal = numericLiteral(boundNode);
        BigDecimal amount = parseNumber(step);
        if (literal != null && amount != null && amount.signum() > 0) {
            BigDecimal result = add ? literal.add(amount) : literal.subtract(amount);
            return result.stripTrailingZeros().toPlainString();
        }
        return bound + (add ? " + " : " - ") + step;
    }

    private static BigDecimal numericLiteral(Ast.Node node) {
        if (node instanceof Ast.Literal literal && literal.literalKind() == Ast.LiteralKind.NUMBER) {
            return parseNumber(literal.text());
        }
        return null;
    }

    private static BigDecimal parseNumber(String text) {
        try {
            return new BigDecimal(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
