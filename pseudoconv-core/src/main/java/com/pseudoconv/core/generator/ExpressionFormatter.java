package com.pseudoconv.core.generator;

import com.pseudoconv.core.ast.Ast;
import com.pseudoconv.core.ast.AstVisitor;
import com.pseudoconv.core.error.ConvertException;
import com.pseudoconv.core.error.Stage;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Renders expression nodes as single-line pseudocode text.
 *
 * <p>Parentheses are reconstructed from operator precedence (or 1, and 2,
 * equality 3, relational 4, additive 5, multiplicative 6): a left operand is
 * wrapped when it binds looser than its parent, a right operand when it binds
 * looser or equally loose. Style toggles add further wrapping. A postfix
 * increment renders as a sum and binds like one; an assignment expression binds
 * loosest of all.
 *
 * <p>Statement nodes reaching this formatter are unsupported in expression
 * position; {@link Ast.Update} and {@link Ast.AssignmentExpr} are the exceptions
 * because they appear in for-loop headers.
 */
final class ExpressionFormatter implements AstVisitor<String> {

    static final String PLACEHOLDER = "<?>";

    private static final int ATOMIC = Integer.MAX_VALUE;

    private static final Set<String> LOGICAL_OPERATORS = Set.of("&&", "||");
    private static final Set<String> COMPARISON_OPERATORS = Set.of("<", ">", "<=", ">=", "==", "!=");
    private static final Set<String> MULTIPLICATIVE_OPERATORS = Set.of("*", "/", "%");

    private static final Map<String, String> COMPOUND_OPERATORS = Map.of(
        "+=", "+",
        "-=", "-",
        "*=", "*",
        "/=", "/",
        "%=", "%"
    );

    private final StyleConfig style;
    private final DeclaredTypes declaredTypes;
    private final UnsupportedNodePolicy policy;

    ExpressionFormatter(StyleConfig style, DeclaredTypes declaredTypes, UnsupportedNodePolicy policy) {
        this.style = style;
        this.declaredTypes = declaredTypes;
        this.policy = policy;
    }

    String format(Ast.Node node) {
        return node.accept(this);
    }

    /**
     * Right-hand side of a plain assignment or declaration.
     */
    String formatAssignedValue(Ast.Node value) {
        String text = format(value);
        return style.wrapRelationalInAssign() && isComparison(value) ? "(" + text + ")" : text;
    }

    /**
     * {@code t = v}, or {@code t = t op v} for compound operators.
     */
    String formatAssignment(Ast.Node target, String operator, Ast.Node value) {
        String targetText = format(target);
        String binaryOperator = COMPOUND_OPERATORS.get(operator);
        if (binaryOperator == null) {
            return targetText + " = " + formatAssignedValue(value);
        }
        return targetText + " = " + format(new Ast.Binary(binaryOperator, target, value));
    }

    String operator(String operator) {
        return switch (operator) {
            case "&&" -> style.andWord();
            case "||" -> style.orWord();
            case "==" -> "=";
            case "!=" -> style.notEqual();
            case "%" -> style.modulo();
            default -> operator;
        };
    }

    static int precedence(String operator) {
        return switch (operator) {
            case "||" -> 1;
            case "&&" -> 2;
            case "==", "!=" -> 3;
            case "<", ">", "<=", ">=" -> 4;
            case "+", "-" -> 5;
            case "*", "/", "%" -> 6;
            default -> 0;
        };
    }

    /**
     * Binding strength of a rendered node; operands such as names and calls never need wrapping.
     */
    static int precedence(Ast.Node node) {
        if (node instanceof Ast.Binary binary) {
            return precedence(binary.operator());
        }
        if (node instanceof Ast.UnaryPostfix) {
            return precedence("+");
        }
        if (node instanceof Ast.AssignmentExpr) {
            return 0;
        }
        return ATOMIC;
    }

    static boolean isCompound(Ast.Node node) {
        return precedence(node) < ATOMIC;
    }

    static boolean isComparison(Ast.Node node) {
        return node instanceof Ast.Binary binary && COMPARISON_OPERATORS.contains(binary.operator());
    }

    // ---------------------------------------------------------------------
    // Operators
    // ---------------------------------------------------------------------

    @Override
    public String visit(Ast.Binary node) {
        if (LOGICAL_OPERATORS.contains(node.operator())) {
            return formatLogicalChain(node);
        }
        String left = format(node.left());
        String right = format(node.right());
        if (needsParentheses(node.left(), node.operator(), false)) {
            left = "(" + left + ")";
        }
        if (needsParentheses(node.right(), node.operator(), true)) {
            right = "(" + right + ")";
        }
        return left + " " + operator(node.operator()) + " " + right;
    }

    private String formatLogicalChain(Ast.Binary node) {
        List<Ast.Node> operands = new ArrayList<>();
        flattenLogical(node.operator(), node, operands);
        boolean wrapComparisons = style.wrapRelationalInLogical()
            && ("&&".equals(node.operator()) || operands.size() == 2);
        int parentPrecedence = precedence(node.operator());

        List<String> rendered = new ArrayList<>(operands.size());
        for (Ast.Node operand : operands) {
            String text = format(operand);
            boolean wrap = isComparison(operand)
                ? wrapComparisons
                : precedence(operand) < parentPrecedence;
            rendered.add(wrap ? "(" + text + ")" : text);
        }
        return String.join(" " + operator(node.operator()) + " ", rendered);
    }

    private static void flattenLogical(String operator, Ast.Node node, List<Ast.Node> operands) {
        if (node instanceof Ast.Binary binary && operator.equals(binary.operator())) {
            flattenLogical(operator, binary.left(), operands);
            flattenLogical(operator, binary.right(), operands);
        } else {
            operands.add(node);
        }
    }

    private boolean needsParentheses(Ast.Node child, String parentOperator, boolean rightOperand) {
        if (!isCompound(child)) {
            return false;
        }
        if (child instanceof Ast.Binary binary) {
            if (style.wrapMulInSubtraction() && "-".equals(parentOperator)
                && MULTIPLICATIVE_OPERATORS.contains(binary.operator())) {
                return true;
            }
            if (COMPARISON_OPERATORS.contains(parentOperator) && "%".equals(binary.operator())) {
                return true;
            }
        }
        int childPrecedence = precedence(child);
        int parentPrecedence = precedence(parentOperator);
        return rightOperand ? childPrecedence <= parentPrecedence : childPrecedence < parentPrecedence;
    }

    @Override
    public String visit(Ast.Unary node) {
        String operand = format(node.operand());
        if (isCompound(node.operand()) || isNegation(node, node.operand())) {
            operand = "(" + operand + ")";
        }
        if ("!".equals(node.operator())) {
            return style.notWord() + " " + operand;
        }
        return node.operator() + operand;
    }

    /** {@code - -x} would otherwise read as a decrement. */
    private static boolean isNegation(Ast.Unary parent, Ast.Node operand) {
        return "-".equals(parent.operator())
            && operand instanceof Ast.Unary inner && "-".equals(inner.operator());
    }

    @Override
    public String visit(Ast.UnaryPostfix node) {
        return format(node.operand()) + ("++".equals(node.operator()) ? " + 1" : " - 1");
    }

    @Override
    public String visit(Ast.Update node) {
        String target = format(node.target());
        return target + " = " + target + ("++".equals(node.operator()) ? " + 1" : " - 1");
    }

    @Override
    public String visit(Ast.AssignmentExpr node) {
        return formatAssignment(node.target(), node.operator(), node.value());
    }

    // ---------------------------------------------------------------------
    // Operands
    // ---------------------------------------------------------------------

    @Override
    public String visit(Ast.Literal node) {
        if (node.literalKind() == Ast.LiteralKind.BOOLEAN) {
            return "true".equals(node.text()) ? style.trueLiteral() : style.falseLiteral();
        }
        return node.text();
    }

    @Override
    public String visit(Ast.Identifier node) {
        return node.name();
    }

    @Override
    public String visit(Ast.Property node) {
        return format(node.receiver()) + "." + node.name();
    }

    @Override
    public String visit(Ast.ArrayAccess node) {
        return node.name() + "[" + joinAll(node.indices(), "][") + "]";
    }

    @Override
    public String visit(Ast.Length node) {
        return "length(" + format(node.operand()) + ")";
    }

    @Override
    public String visit(Ast.Call node) {
        return node.name() + "(" + joinAll(node.args(), ", ") + ")";
    }

    @Override
    public String visit(Ast.NewArray node) {
        return "new array[" + joinAll(node.dimensions(), "][") + "]";
    }

    @Override
    public String visit(Ast.ArrayLiteral node) {
        return "[" + joinAll(node.elements(), ", ") + "]";
    }

    @Override
    public String visit(Ast.NewObject node) {
        return "new " + node.typeName() + "(" + joinAll(node.args(), ", ") + ")";
    }

    @Override
    public String visit(Ast.MethodCall node) {
        String receiver = format(node.receiver());
        List<String> args = node.args().stream().map(this::format).collect(Collectors.toList());
        MethodTranslation translation = style.translationFor(node.name(), args.size()).orElse(null);
        if (translation == null) {
            return receiver + "." + node.name() + "(" + String.join(", ", args) + ")";
        }
        return switch (translation.kind()) {
            case SUBSCRIPT_READ -> receiver + "[" + args.get(0) + "]";
            case SUBSCRIPT_WRITE -> receiver + "[" + args.get(0) + "] = " + args.get(1);
            case RENAME -> receiver + "." + translation.alias() + "(" + String.join(", ", args) + ")";
            case FUNCTION_FORM -> {
                List<String> functionArgs = new ArrayList<>();
                functionArgs.add(receiver);
                functionArgs.addAll(args);
                yield translation.alias() + "(" + String.join(", ", functionArgs) + ")";
            }
            case REMOVE -> isKeyedRemoval(node)
                ? "remove " + receiver + "[" + args.get(0) + "]"
                : receiver + ".removeItemAt(" + String.join(", ", args) + ")";
            case PASSTHROUGH -> receiver + "." + node.name() + "(" + String.join(", ", args) + ")";
        };
    }

    private boolean isKeyedRemoval(Ast.MethodCall node) {
        return node.args().size() == 1
            && node.receiver() instanceof Ast.Identifier receiver
            && declaredTypes.isKeyedCollection(receiver.name());
    }

    private String joinAll(List<Ast.Node> nodes, String separator) {
        return nodes.stream().map(this::format).collect(Collectors.joining(separator));
    }

    // ---------------------------------------------------------------------
    // Statements in expression position
    // ---------------------------------------------------------------------

    @Override
    public String visit(Ast.Program node) {
        return unsupported(node);
    }

    @Override
    public String visit(Ast.Block node) {
        return unsupported(node);
    }

    @Override
    public String visit(Ast.Declaration node) {
        return unsupported(node);
    }

    @Override
    public String visit(Ast.Assignment node) {
        return unsupported(node);
    }

    @Override
    public String visit(Ast.ExpressionStatement node) {
        return unsupported(node);
    }

    @Override
    public String visit(Ast.CallStatement node) {
        return unsupported(node);
    }

    @Override
    public String visit(Ast.If node) {
        return unsupported(node);
    }

    @Override
    public String visit(Ast.While node) {
        return unsupported(node);
    }

    @Override
    public String visit(Ast.DoWhile node) {
        return unsupported(node);
    }

    @Override
    public String visit(Ast.For node) {
        return unsupported(node);
    }

    private String unsupported(Ast.Node node) {
        if (policy == UnsupportedNodePolicy.FAIL) {
            throw new ConvertException(Stage.GENERATION,
                "Unsupported node " + node.kind() + " in expression position", 1, 1);
        }
        return PLACEHOLDER;
    }
}
