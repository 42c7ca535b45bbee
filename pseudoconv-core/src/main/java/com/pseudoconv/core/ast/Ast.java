package com.pseudoconv.core.ast;

import java.util.List;
import java.util.Objects;

/**
 * AST node types for the supported Java subset.
 *
 * <p>Each node is an immutable record carrying only the fields its grammar
 * rule needs. Child lists are defensively copied, so a node handed out by the
 * parser can never change afterwards. Optional children are {@code null}.
 *
 * <p>Statement nodes: {@link Program}, {@link Block}, {@link Declaration},
 * {@link Assignment}, {@link Update}, {@link ExpressionStatement},
 * {@link CallStatement}, {@link If}, {@link While}, {@link DoWhile},
 * {@link For}. Every other node is an expression.
 *
 * @see AstVisitor
 */
public final class Ast {

    private Ast() {
        // Utility class - no instantiation
    }

    /**
     * Common supertype of all nodes.
     */
    public interface Node {

        /**
         * Dispatches to the visitor method for this node type.
         *
         * @param visitor the visitor
         * @param <R> result type
         * @return visitor result
         */
        <R> R accept(AstVisitor<R> visitor);

        /**
         * Returns the node type name, e.g. "Binary".
         *
         * @return simple type name
         */
        default String kind() {
            return getClass().getSimpleName();
        }
    }

    /** Literal categories. */
    public enum LiteralKind {
        NUMBER,
        STRING,
        CHAR,
        BOOLEAN
    }

    /**
     * Root of a parsed program.
     *
     * @param statements top-level statements (or the entry method's body)
     */
    public record Program(List<Node> statements) implements Node {
        public Program {
            statements = List.copyOf(statements);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Braced statement list.
     *
     * @param statements statements in source order
     */
    public record Block(List<Node> statements) implements Node {
        public Block {
            statements = List.copyOf(statements);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Variable declaration, e.g. {@code int[] a = {1, 2};}.
     *
     * @param name variable name
     * @param declaredType declared type including array suffixes (e.g., "int[]", "HashMap")
     * @param initializer initial value, may be null
     */
    public record Declaration(String name, String declaredType, Node initializer) implements Node {
        public Declaration {
            Objects.requireNonNull(name, "name must not be null");
            Objects.requireNonNull(declaredType, "declaredType must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Assignment statement, e.g. {@code total += price;}.
     *
     * @param target Identifier or ArrayAccess
     * @param operator one of {@code = += -= *= /= %=}
     * @param value right-hand side
     */
    public record Assignment(Node target, String operator, Node value) implements Node {
        public Assignment {
            requireAssignable(target);
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Assignment used as an expression, e.g. the for-update {@code i += 2}
     * or {@code a = b = 0}.
     *
     * @param target Identifier or ArrayAccess
     * @param operator one of {@code = += -= *= /= %=}
     * @param value right-hand side
     */
    public record AssignmentExpr(Node target, String operator, Node value) implements Node {
        public AssignmentExpr {
            requireAssignable(target);
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(value, "value must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Increment or decrement statement, e.g. {@code count++;}.
     *
     * @param target Identifier or ArrayAccess
     * @param operator {@code ++} or {@code --}
     */
    public record Update(Node target, String operator) implements Node {
        public Update {
            requireAssignable(target);
            if (!"++".equals(operator) && !"--".equals(operator)) {
                throw new IllegalArgumentException("Update operator must be ++ or --: " + operator);
            }
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Expression evaluated for its effect.
     *
     * @param expression the expression
     */
    public record ExpressionStatement(Node expression) implements Node {
        public ExpressionStatement {
            Objects.requireNonNull(expression, "expression must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Statement that starts with a member access, e.g. {@code System.out.println(x);}.
     *
     * @param call the postfix chain
     */
    public record CallStatement(Node call) implements Node {
        public CallStatement {
            Objects.requireNonNull(call, "call must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Conditional. An else-if chain nests further If nodes as alternates.
     *
     * @param test condition
     * @param consequent then-branch
     * @param alternate else-branch (If, Block or single statement), may be null
     */
    public record If(Node test, Node consequent, Node alternate) implements Node {
        public If {
            Objects.requireNonNull(test, "test must not be null");
            Objects.requireNonNull(consequent, "consequent must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Pre-tested loop.
     *
     * @param test condition
     * @param body loop body
     */
    public record While(Node test, Node body) implements Node {
        public While {
            Objects.requireNonNull(test, "test must not be null");
            Objects.requireNonNull(body, "body must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Post-tested loop.
     *
     * @param body loop body
     * @param test continuation condition
     */
    public record DoWhile(Node body, Node test) implements Node {
        public DoWhile {
            Objects.requireNonNull(body, "body must not be null");
            Objects.requireNonNull(test, "test must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Counting loop.
     *
     * @param init Declaration or Assignment, may be null
     * @param test condition, may be null
     * @param update Update or expression, may be null
     * @param body loop body
     */
    public record For(Node init, Node test, Node update, Node body) implements Node {
        public For {
            Objects.requireNonNull(body, "body must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Variable reference.
     *
     * @param name identifier text
     */
    public record Identifier(String name) implements Node {
        public Identifier {
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Indexed access, e.g. {@code grid[r][c]}.
     *
     * @param name array name (dotted for property receivers)
     * @param indices one expression per bracket pair
     */
    public record ArrayAccess(String name, List<Node> indices) implements Node {
        public ArrayAccess {
            Objects.requireNonNull(name, "name must not be null");
            indices = List.copyOf(indices);
            if (indices.isEmpty()) {
                throw new IllegalArgumentException("ArrayAccess needs at least one index");
            }
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Literal value.
     *
     * @param literalKind category
     * @param text raw source text (quotes included for strings and chars)
     */
    public record Literal(LiteralKind literalKind, String text) implements Node {
        public Literal {
            Objects.requireNonNull(literalKind, "literalKind must not be null");
            Objects.requireNonNull(text, "text must not be null");
        }

        /**
         * Returns true for string and char literals.
         *
         * @return true if quoted
         */
        public boolean isText() {
            return literalKind == LiteralKind.STRING || literalKind == LiteralKind.CHAR;
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Call of a plain function name, e.g. {@code max(a, b)}.
     *
     * @param name function name
     * @param args arguments
     */
    public record Call(String name, List<Node> args) implements Node {
        public Call {
            Objects.requireNonNull(name, "name must not be null");
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Method call on a receiver, e.g. {@code list.add(x)}.
     *
     * @param receiver receiver expression
     * @param name method name
     * @param args arguments
     */
    public record MethodCall(Node receiver, String name, List<Node> args) implements Node {
        public MethodCall {
            Objects.requireNonNull(receiver, "receiver must not be null");
            Objects.requireNonNull(name, "name must not be null");
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Field access, e.g. {@code System.out}.
     *
     * @param receiver receiver expression
     * @param name field name
     */
    public record Property(Node receiver, String name) implements Node {
        public Property {
            Objects.requireNonNull(receiver, "receiver must not be null");
            Objects.requireNonNull(name, "name must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Array length, {@code a.length}.
     *
     * @param operand the array expression
     */
    public record Length(Node operand) implements Node {
        public Length {
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Sized array creation, e.g. {@code new int[n][2]}.
     *
     * @param elementType element type name
     * @param dimensions one size expression per dimension
     */
    public record NewArray(String elementType, List<Node> dimensions) implements Node {
        public NewArray {
            Objects.requireNonNull(elementType, "elementType must not be null");
            dimensions = List.copyOf(dimensions);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Object creation, e.g. {@code new Scanner(System.in)}.
     *
     * @param typeName class name
     * @param args constructor arguments
     */
    public record NewObject(String typeName, List<Node> args) implements Node {
        public NewObject {
            Objects.requireNonNull(typeName, "typeName must not be null");
            args = List.copyOf(args);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Array initializer, from {@code new int[]{1, 2}} or {@code {1, 2}}.
     *
     * @param elements element expressions
     */
    public record ArrayLiteral(List<Node> elements) implements Node {
        public ArrayLiteral {
            elements = List.copyOf(elements);
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Prefix operator, {@code !} or unary {@code -}.
     *
     * @param operator operator text
     * @param operand operand
     */
    public record Unary(String operator, Node operand) implements Node {
        public Unary {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Binary operator.
     *
     * @param operator operator text (e.g., "+", "&&", "<=")
     * @param left left operand
     * @param right right operand
     */
    public record Binary(String operator, Node left, Node right) implements Node {
        public Binary {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(left, "left must not be null");
            Objects.requireNonNull(right, "right must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Postfix increment or decrement inside an expression, e.g. {@code a[i++]}.
     *
     * @param operator {@code ++} or {@code --}
     * @param operand operand
     */
    public record UnaryPostfix(String operator, Node operand) implements Node {
        public UnaryPostfix {
            Objects.requireNonNull(operator, "operator must not be null");
            Objects.requireNonNull(operand, "operand must not be null");
        }

        @Override
        public <R> R accept(AstVisitor<R> visitor) {
            return visitor.visit(this);
        }
    }

    /**
     * Returns true if the node may appear on the left of an assignment.
     *
     * @param node candidate target
     * @return true for Identifier and ArrayAccess
     */
    public static boolean isAssignable(Node node) {
        return node instanceof Identifier || node instanceof ArrayAccess;
    }

    private static void requireAssignable(Node target) {
        Objects.requireNonNull(target, "target must not be null");
        if (!isAssignable(target)) {
            throw new IllegalArgumentException("Assignment target must be Identifier or ArrayAccess: " + target.kind());
        }
    }
}
