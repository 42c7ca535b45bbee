package com.pseudoconv.core.generator;

import com.pseudoconv.core.ast.Ast;
import com.pseudoconv.core.ast.AstVisitor;
import com.pseudoconv.core.error.ConvertException;
import com.pseudoconv.core.error.Stage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * Renders a parsed program as pseudocode in a configurable style.
 *
 * <p>Walks the AST pre-order, one output line per simple statement, indenting
 * nested bodies by the style's indent unit. Lines are joined with {@code \n}
 * and the result has no trailing newline.
 *
 * <p>Beyond one-to-one rendering the generator reconstructs a few constructs:
 * <ul>
 *   <li>counting {@code for} loops become {@code loop i from a to b} (loop-form styles)</li>
 *   <li>{@code do ... while (T)} becomes {@code until} with the negated condition</li>
 *   <li>else-if chains collapse into one {@code if ... end if} block</li>
 *   <li>{@code System.out.print/println} becomes {@code output}, splitting string concatenation</li>
 *   <li>console reads through a {@code Scanner} become {@code input}</li>
 * </ul>
 *
 * <p>Instances are immutable; every {@link #generate(Ast.Program)} call uses its own
 * line buffer, so one generator may serve concurrent callers.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * PseudocodeGenerator generator = new PseudocodeGenerator(Styles.resolve(StyleId.SC_03));
 * String pseudocode = generator.generate(program);
 * }</pre>
 */
public final class PseudocodeGenerator {

    private static final Logger log = LoggerFactory.getLogger(PseudocodeGenerator.class);

    private static final Set<String> OUTPUT_METHODS = Set.of("print", "println");
    private static final Set<String> INPUT_METHODS = Set.of(
        "nextLine", "nextInt", "nextDouble", "nextBoolean", "nextFloat", "nextLong", "next"
    );

    private final StyleConfig style;
    private final UnsupportedNodePolicy policy;

    public PseudocodeGenerator(StyleConfig style) {
        this(style, UnsupportedNodePolicy.PLACEHOLDER);
    }

    public PseudocodeGenerator(StyleConfig style, UnsupportedNodePolicy policy) {
        this.style = Objects.requireNonNull(style, "style must not be null");
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    /**
     * Renders a program with the default unsupported-node policy.
     *
     * @param program parsed program
     * @param style style configuration
     * @return pseudocode text
     */
    public static String generate(Ast.Program program, StyleConfig style) {
        return new PseudocodeGenerator(style).generate(program);
    }

    /**
     * Renders a program.
     *
     * @param program parsed program
     * @return pseudocode text, lines joined with {@code \n}
     * @throws ConvertException with stage {@code generation} if the policy is
     *                          {@link UnsupportedNodePolicy#FAIL} and a node cannot be rendered
     */
    public String generate(Ast.Program program) {
        Objects.requireNonNull(program, "program must not be null");
        ExpressionFormatter formatter = new ExpressionFormatter(style, DeclaredTypes.collect(program), policy);
        StatementEmitter emitter = new StatementEmitter(formatter);
        program.accept(emitter);
        log.debug("Generated {} lines in style {}", emitter.lines.size(), style.id());
        return String.join("\n", emitter.lines);
    }

    public StyleConfig getStyle() {
        return style;
    }

    // ---------------------------------------------------------------------
    // Console I/O recognition
    // ---------------------------------------------------------------------

    /**
     * {@code sc.nextInt()} and friends on a plain variable, or {@code charAt} on such a call.
     */
    static boolean isConsoleRead(Ast.Node node) {
        if (!(node instanceof Ast.MethodCall call)) {
            return false;
        }
        if (INPUT_METHODS.contains(call.name()) && call.receiver() instanceof Ast.Identifier) {
            return true;
        }
        return "charAt".equals(call.name()) && isConsoleRead(call.receiver());
    }

    /** {@code new Scanner(System.in)} */
    static boolean isConsoleReaderCreation(Ast.Node node) {
        return node instanceof Ast.NewObject creation
            && "Scanner".equals(creation.typeName())
            && creation.args().size() == 1
            && "System.in".equals(qualifiedName(creation.args().get(0)));
    }

    private static String qualifiedName(Ast.Node node) {
        if (node instanceof Ast.Identifier identifier) {
            return identifier.name();
        }
        if (node instanceof Ast.Property property) {
            String receiver = qualifiedName(property.receiver());
            return receiver != null ? receiver + "." + property.name() : null;
        }
        return null;
    }

    /**
     * Per-call statement walker holding the output buffer and nesting depth.
     */
    private final class StatementEmitter implements AstVisitor<Void> {

        private final ExpressionFormatter formatter;
        private final StyleKeywords keywords = style.keywords();
        private final String indent = style.indent();
        private final List<String> lines = new ArrayList<>();
        private int depth = 0;

        private StatementEmitter(ExpressionFormatter formatter) {
            this.formatter = formatter;
        }

        private void emit(String text) {
            lines.add(indent.repeat(depth) + text);
        }

        private void emitNested(Ast.Node body) {
            depth++;
            body.accept(this);
            depth--;
        }

        private void emitAll(List<Ast.Node> statements) {
            for (Ast.Node statement : statements) {
                statement.accept(this);
            }
        }

        @Override
        public Void visit(Ast.Program node) {
            emitAll(node.statements());
            return null;
        }

        @Override
        public Void visit(Ast.Block node) {
            emitAll(node.statements());
            return null;
        }

        @Override
        public Void visit(Ast.Declaration node) {
            Ast.Node initializer = node.initializer();
            if (initializer == null) {
                emit(node.name());
            } else if (isConsoleRead(initializer)) {
                emit(keywords.input() + " " + node.name());
            } else if (!isConsoleReaderCreation(initializer)) {
                emit(node.name() + " = " + formatter.formatAssignedValue(initializer));
            }
            return null;
        }

        @Override
        public Void visit(Ast.Assignment node) {
            emitAssignment(node.target(), node.operator(), node.value());
            return null;
        }

        @Override
        public Void visit(Ast.AssignmentExpr node) {
            emitAssignment(node.target(), node.operator(), node.value());
            return null;
        }

        private void emitAssignment(Ast.Node target, String operator, Ast.Node value) {
            if (isConsoleRead(value)) {
                emit(keywords.input() + " " + formatter.format(target));
            } else if (!isConsoleReaderCreation(value)) {
                emit(formatter.formatAssignment(target, operator, value));
            }
        }

        @Override
        public Void visit(Ast.Update node) {
            emit(formatter.format(node));
            return null;
        }

        @Override
        public Void visit(Ast.ExpressionStatement node) {
            emitExpressionStatement(node.expression());
            return null;
        }

        @Override
        public Void visit(Ast.CallStatement node) {
            emitExpressionStatement(node.call());
            return null;
        }

        private void emitExpressionStatement(Ast.Node expression) {
            String output = formatOutput(expression);
            emit(output != null ? output : formatter.format(expression));
        }

        @Override
        public Void visit(Ast.If node) {
            Ast.Node current = node;
            boolean first = true;
            while (current instanceof Ast.If branch) {
                String head = first ? keywords.ifKeyword() : keywords.elseIf();
                emit(head + " " + formatter.format(branch.test()) + " " + keywords.then());
                emitNested(branch.consequent());
                current = branch.alternate();
                first = false;
            }
            if (current != null) {
                emit(keywords.elseKeyword());
                emitNested(current);
            }
            emit(keywords.endIf());
            return null;
        }

        @Override
        public Void visit(Ast.While node) {
            String test = formatter.format(node.test());
            if (style.loopForm() == LoopForm.LOOP) {
                emit(keywords.loopWhile() + " " + test);
                emitNested(node.body());
                emit(keywords.endLoop());
            } else {
                emit(keywords.whileKeyword() + " " + test + " " + keywords.doKeyword());
                emitNested(node.body());
                emit(keywords.endWhile());
            }
            return null;
        }

        @Override
        public Void visit(Ast.DoWhile node) {
            emit(style.loopForm() == LoopForm.LOOP ? keywords.loop() : keywords.repeat());
            emitNested(node.body());
            emit(keywords.until() + " " + formatter.format(ConditionInverter.invert(node.test())));
            return null;
        }

        @Override
        public Void visit(Ast.For node) {
            if (style.loopForm() == LoopForm.LOOP) {
                emit(keywords.loop() + " " + ForLoopHeader.loopForm(node, formatter));
                emitNested(node.body());
                emit(keywords.endLoop());
            } else {
                emit(keywords.forKeyword() + " " + ForLoopHeader.structuredForm(node, formatter));
                emitNested(node.body());
                emit(keywords.endFor());
            }
            return null;
        }

        // -----------------------------------------------------------------
        // Output statements
        // -----------------------------------------------------------------

        /**
         * Returns the output line for {@code System.out.print/println}, or null for any other expression.
         */
        private String formatOutput(Ast.Node expression) {
            if (!(expression instanceof Ast.MethodCall call)
                || !OUTPUT_METHODS.contains(call.name())
                || !"System.out".equals(qualifiedName(call.receiver()))) {
                return null;
            }
            List<String> parts = new ArrayList<>();
            if (call.args().size() == 1) {
                parts.addAll(outputParts(call.args().get(0)));
            } else {
                for (Ast.Node arg : call.args()) {
                    parts.add(outputPart(arg));
                }
            }
            return parts.isEmpty() ? keywords.output() : keywords.output() + " " + String.join(", ", parts);
        }

        /** Splits {@code "a" + x + "b"} into {@code "a", x, "b"}. */
        private List<String> outputParts(Ast.Node argument) {
            List<Ast.Node> operands = new ArrayList<>();
            flattenConcatenation(argument, operands);
            if (operands.size() < 2 || operands.stream().noneMatch(PseudocodeGenerator::isStringLiteral)) {
                return List.of(outputPart(argument));
            }
            List<String> parts = new ArrayList<>(operands.size());
            for (Ast.Node operand : operands) {
                parts.add(isStringLiteral(operand) ? ((Ast.Literal) operand).text() : outputPart(operand));
            }
            return parts;
        }

        private String outputPart(Ast.Node node) {
            String text = formatter.format(node);
            return ExpressionFormatter.isCompound(node) ? "(" + text + ")" : text;
        }

        // -----------------------------------------------------------------
        // Expressions in statement position
        // -----------------------------------------------------------------

        @Override
        public Void visit(Ast.Identifier node) {
            return unsupported(node);
        }

        @Override
        public Void visit(Ast.ArrayAccess node) {
            return unsupported(node);
        }

        @Override
        public Void visit(Ast.Literal node) {
            return unsupported(node);
        }

        @Override
        public Void visit(Ast.Call node) {
            return unsupported(node);
        }

        @Override
        public Void visit(Ast.MethodCall node) {
            return unsupported(node);
        }

        @Override
        public Void visit(Ast.Property node) {
            return unsupported(node);
        }

        @Override
        public Void visit(Ast.Length node) {
            return unsupported(node);
        }

        @Override
        public Void visit(Ast.NewArray node) {
            return unsupported(node);
        }

        @Override
        public Void visit(Ast.NewObject node) {
            return unsupported(node);
        }

        @Override
        public Void visit(Ast.ArrayLiteral node) {
            return unsupported(node);
        }

        @Override
        public Void visit(Ast.Unary node) {
            return unsupported(node);
        }

        @Override
        public Void visit(Ast.Binary node) {
            return unsupported(node);
        }

        @Override
        public Void visit(Ast.UnaryPostfix node) {
            return unsupported(node);
        }

        private Void unsupported(Ast.Node node) {
            if (policy == UnsupportedNodePolicy.FAIL) {
                throw new ConvertException(Stage.GENERATION,
                    "Unsupported node " + node.kind() + " in statement position", 1, 1);
            }
            log.debug("Emitting placeholder for {} in statement position", node.kind());
            emit("/* unsupported node " + node.kind() + " */");
            return null;
        }
    }

    /** Left-leaning {@code +} chain; parenthesized right operands stay whole. */
    private static void flattenConcatenation(Ast.Node node, List<Ast.Node> operands) {
        if (node instanceof Ast.Binary binary && "+".equals(binary.operator())) {
            flattenConcatenation(binary.left(), operands);
            operands.add(binary.right());
        } else {
            operands.add(node);
        }
    }

    private static boolean isStringLiteral(Ast.Node node) {
        return node instanceof Ast.Literal literal && literal.literalKind() == Ast.LiteralKind.STRING;
    }
}
