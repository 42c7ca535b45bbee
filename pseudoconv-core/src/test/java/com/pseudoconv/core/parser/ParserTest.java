package com.pseudoconv.core.parser;

import com.pseudoconv.core.ast.Ast;
import com.pseudoconv.core.ast.Ast.LiteralKind;
import com.pseudoconv.core.error.ConvertError;
import com.pseudoconv.core.error.Stage;
import com.pseudoconv.core.error.StageResult;
import com.pseudoconv.core.lexer.Tokenizer;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Tests for {@link Parser}.
 */
class ParserTest {

    private static StageResult<Ast.Program> parse(String source) {
        return Parser.parse(Tokenizer.tokenize(source).value());
    }

    private static List<Ast.Node> statements(String source) {
        StageResult<Ast.Program> result = parse(source);
        assertThat(result.error()).as("parse error for %s", source).isNull();
        return result.value().statements();
    }

    private static Ast.Node single(String source) {
        List<Ast.Node> statements = statements(source);
        assertThat(statements).hasSize(1);
        return statements.get(0);
    }

    private static Ast.Identifier id(String name) {
        return new Ast.Identifier(name);
    }

    private static Ast.Literal num(String text) {
        return new Ast.Literal(LiteralKind.NUMBER, text);
    }

    @Nested
    class ProgramWrapper {

        @Test
        void parse_emptyInput_emptyProgram() {
            assertThat(statements("")).isEmpty();
        }

        @Test
        void parse_classWithMain_unwrapsMethodBody() {
            List<Ast.Node> statements = statements("""
                public class Main {
                    public static void main(String[] args) {
                        int x = 1;
                        x++;
                    }
                }
                """);

            assertThat(statements).containsExactly(
                new Ast.Declaration("x", "int", num("1")),
                new Ast.Update(id("x"), "++"));
        }

        @Test
        void parse_bareMethod_unwrapsBody() {
            assertThat(statements("static void main(String[] args) { y = 2; }"))
                .containsExactly(new Ast.Assignment(id("y"), "=", num("2")));
        }

        @Test
        void parse_classWithoutMethod_parsesStatementsUntilClosingBrace() {
            assertThat(statements("class Demo { int a = 1; int b = 2; }")).hasSize(2);
        }

        @Test
        void parse_secondMethodInClass_missingClassClose() {
            StageResult<Ast.Program> result = parse("class A {\n  void main() { }\n  void other() { }\n}");

            assertThat(result.error()).isEqualTo(
                new ConvertError(Stage.PARSE, "Expected '}' to close class", 3, 3));
        }
    }

    @Nested
    class Statements {

        @Test
        void parse_arrayDeclarationWithInitializer_keepsTypeSuffix() {
            Ast.Node node = single("int[] a = {1, 2, 3};");

            assertThat(node).isEqualTo(new Ast.Declaration("a", "int[]",
                new Ast.ArrayLiteral(List.of(num("1"), num("2"), num("3")))));
        }

        @Test
        void parse_suffixAfterName_appendedToType() {
            Ast.Declaration declaration = (Ast.Declaration) single("int a[] = new int[5];");

            assertThat(declaration.declaredType()).isEqualTo("int[]");
            assertThat(declaration.initializer()).isEqualTo(new Ast.NewArray("int", List.of(num("5"))));
        }

        @Test
        void parse_classTypedDeclaration_recognised() {
            Ast.Declaration declaration = (Ast.Declaration) single("ArrayList names = new ArrayList();");

            assertThat(declaration.declaredType()).isEqualTo("ArrayList");
            assertThat(declaration.initializer()).isEqualTo(new Ast.NewObject("ArrayList", List.of()));
        }

        @Test
        void parse_declarationWithoutInitializer_nullInitializer() {
            assertThat(single("double d;")).isEqualTo(new Ast.Declaration("d", "double", null));
        }

        @Test
        void parse_compoundAssignmentToElement_assignmentWithArrayTarget() {
            Ast.Node node = single("a[i + 1] += 2;");

            assertThat(node).isEqualTo(new Ast.Assignment(
                new Ast.ArrayAccess("a", List.of(new Ast.Binary("+", id("i"), num("1")))), "+=", num("2")));
        }

        @Test
        void parse_elementUpdate_update() {
            assertThat(single("grid[r][c]--;")).isEqualTo(
                new Ast.Update(new Ast.ArrayAccess("grid", List.of(id("r"), id("c"))), "--"));
        }

        @Test
        void parse_printCall_callStatementWithMethodCall() {
            Ast.CallStatement statement = (Ast.CallStatement) single("System.out.println(\"hi\");");

            assertThat(statement.call()).isEqualTo(new Ast.MethodCall(
                new Ast.Property(id("System"), "out"), "println",
                List.of(new Ast.Literal(LiteralKind.STRING, "\"hi\""))));
        }

        @Test
        void parse_plainCall_expressionStatement() {
            assertThat(single("run(1);")).isEqualTo(
                new Ast.ExpressionStatement(new Ast.Call("run", List.of(num("1")))));
        }

        @Test
        void parse_ifElseIfElse_nestedIfInAlternate() {
            Ast.If node = (Ast.If) single("if (a) { x = 1; } else if (b) { x = 2; } else { x = 3; }");

            assertThat(node.test()).isEqualTo(id("a"));
            assertThat(node.alternate()).isInstanceOf(Ast.If.class);
            assertThat(((Ast.If) node.alternate()).alternate()).isInstanceOf(Ast.Block.class);
        }

        @Test
        void parse_ifWithoutBraces_singleStatementBody() {
            Ast.If node = (Ast.If) single("if (a) x = 1;");

            assertThat(node.consequent()).isEqualTo(new Ast.Assignment(id("x"), "=", num("1")));
            assertThat(node.alternate()).isNull();
        }

        @Test
        void parse_forLoop_allParts() {
            Ast.For node = (Ast.For) single("for (int i = 0; i < n; i++) { s += i; }");

            assertThat(node.init()).isEqualTo(new Ast.Declaration("i", "int", num("0")));
            assertThat(node.test()).isEqualTo(new Ast.Binary("<", id("i"), id("n")));
            assertThat(node.update()).isEqualTo(new Ast.Update(id("i"), "++"));
            assertThat(node.body()).isInstanceOf(Ast.Block.class);
        }

        @Test
        void parse_forLoopWithEmptyParts_nullParts() {
            Ast.For node = (Ast.For) single("for (;;) { }");

            assertThat(node.init()).isNull();
            assertThat(node.test()).isNull();
            assertThat(node.update()).isNull();
        }

        @Test
        void parse_forLoopCompoundUpdate_assignmentExpression() {
            Ast.For node = (Ast.For) single("for (i = 10; i > 0; i -= 2) { }");

            assertThat(node.init()).isEqualTo(new Ast.Assignment(id("i"), "=", num("10")));
            assertThat(node.update()).isEqualTo(new Ast.AssignmentExpr(id("i"), "-=", num("2")));
        }

        @Test
        void parse_doWhile_bodyThenTest() {
            Ast.DoWhile node = (Ast.DoWhile) single("do { x--; } while (x > 0);");

            assertThat(node.body()).isEqualTo(new Ast.Block(List.of(new Ast.Update(id("x"), "--"))));
            assertThat(node.test()).isEqualTo(new Ast.Binary(">", id("x"), num("0")));
        }
    }

    @Nested
    class Expressions {

        private Ast.Node valueOf(String expression) {
            Ast.Declaration declaration = (Ast.Declaration) single("int v = " + expression + ";");
            return declaration.initializer();
        }

        @Test
        void parse_multiplicationBindsTighterThanAddition() {
            assertThat(valueOf("a + b * c")).isEqualTo(
                new Ast.Binary("+", id("a"), new Ast.Binary("*", id("b"), id("c"))));
        }

        @Test
        void parse_subtraction_leftAssociative() {
            assertThat(valueOf("a - b - c")).isEqualTo(
                new Ast.Binary("-", new Ast.Binary("-", id("a"), id("b")), id("c")));
        }

        @Test
        void parse_logicalOperators_andBindsTighterThanOr() {
            assertThat(valueOf("a || b && c")).isEqualTo(
                new Ast.Binary("||", id("a"), new Ast.Binary("&&", id("b"), id("c"))));
        }

        @Test
        void parse_parentheses_overridePrecedence() {
            assertThat(valueOf("(a + b) * c")).isEqualTo(
                new Ast.Binary("*", new Ast.Binary("+", id("a"), id("b")), id("c")));
        }

        @Test
        void parse_prefixOperators_nest() {
            assertThat(valueOf("!-x")).isEqualTo(new Ast.Unary("!", new Ast.Unary("-", id("x"))));
        }

        @Test
        void parse_assignmentExpression_rightAssociative() {
            assertThat(valueOf("a = b = 3")).isEqualTo(
                new Ast.AssignmentExpr(id("a"), "=", new Ast.AssignmentExpr(id("b"), "=", num("3"))));
        }

        @Test
        void parse_literals_classified() {
            assertThat(valueOf("'c'")).isEqualTo(new Ast.Literal(LiteralKind.CHAR, "'c'"));
            assertThat(valueOf("true")).isEqualTo(new Ast.Literal(LiteralKind.BOOLEAN, "true"));
            assertThat(valueOf("2.5")).isEqualTo(num("2.5"));
        }

        @Test
        void parse_lengthProperty_lengthNode() {
            assertThat(valueOf("arr.length")).isEqualTo(new Ast.Length(id("arr")));
        }

        @Test
        void parse_methodCallOnString_methodCall() {
            assertThat(valueOf("s.charAt(0)")).isEqualTo(
                new Ast.MethodCall(id("s"), "charAt", List.of(num("0"))));
        }

        @Test
        void parse_postfixIncrementInExpression_unaryPostfix() {
            assertThat(valueOf("i++")).isEqualTo(new Ast.UnaryPostfix("++", id("i")));
        }

        @Test
        void parse_twoDimensionalCreation_twoDimensions() {
            assertThat(valueOf("new int[r][c]")).isEqualTo(
                new Ast.NewArray("int", List.of(id("r"), id("c"))));
        }

        @Test
        void parse_creationWithInitializer_arrayLiteral() {
            assertThat(valueOf("new int[]{4, 5}")).isEqualTo(
                new Ast.ArrayLiteral(List.of(num("4"), num("5"))));
        }
    }

    @Nested
    class Errors {

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', quoteCharacter = '"', textBlock = """
            x = ;                    | 1 | 5  | Unexpected token ';'
            return x;                | 1 | 1  | Unsupported keyword 'return'
            foo() = 3;               | 1 | 7  | Invalid assignment target
            int[] a = new int[];     | 1 | 15 | Expected array initializer
            int x = 1; }             | 1 | 12 | Unexpected token '}'
            if (x > 0 { }            | 1 | 11 | Expected ')' after condition
            while x > 0 { }          | 1 | 7  | Expected '(' after while
            int = 4;                 | 1 | 5  | Expected identifier in declaration
            x++                      | 1 | 4  | Expected ';' after update
            do { x--; } (x > 0);     | 1 | 13 | Expected 'while' after do-body
            { x = 1;                 | 1 | 9  | Expected '}' to close block
            int y = new 5;           | 1 | 13 | Expected type after new
            int y = new int;         | 1 | 13 | Expected '[' after array type
            int y = f()(2);          | 1 | 12 | Unsupported call target
            int y = (a + b;          | 1 | 15 | Expected ')' after expression
            """)
        void parse_invalidInput_firstErrorWithPosition(String source, int line, int column, String message) {
            StageResult<Ast.Program> result = parse(source);

            assertThat(result.error()).isEqualTo(new ConvertError(Stage.PARSE, message, line, column));
        }

        @Test
        void parse_missingSemicolon_reportedAtNextLine() {
            StageResult<Ast.Program> result = parse("int x = 1\nint y = 2;");

            assertThat(result.error()).isEqualTo(
                new ConvertError(Stage.PARSE, "Expected ';' after declaration", 2, 1));
        }

        @Test
        void parse_nestingWithinLimit_parses() {
            Ast.Assignment node = (Ast.Assignment) single("x = " + "(".repeat(100) + "1" + ")".repeat(100) + ";");

            assertThat(node.value()).isEqualTo(num("1"));
        }

        @ParameterizedTest(name = "{0}")
        @CsvSource(delimiter = '|', textBlock = """
            parentheses     | x = (         | 1;
            blocks          | {             | x = 1;
            prefix operator | b = !         | true;
            array literal   | int[] a = {   | 1};
            """)
        void parse_deepNesting_nestingError(String shape, String repeated, String tail) {
            String opener = repeated.substring(repeated.length() - 1);
            String source = repeated + opener.repeat(5_000) + tail;

            StageResult<Ast.Program> result = parse(source);

            assertThat(result.error().stage()).isEqualTo(Stage.PARSE);
            assertThat(result.error().message()).isEqualTo("Nesting too deep");
        }

        @Test
        void parse_longOperatorChain_nestingError() {
            String source = "x = " + "a + ".repeat(Parser.MAX_NESTING_DEPTH) + "a;";

            assertThat(parse(source).error().message()).isEqualTo("Nesting too deep");
        }

        @Test
        void parse_moderateOperatorChain_parses() {
            assertThat(statements("x = " + "a + ".repeat(50) + "a;")).hasSize(1);
        }

        @Test
        void parse_unexpectedEndOfInput_describedAsEndOfInput() {
            StageResult<Ast.Program> result = parse("x = 1 +");

            assertThat(result.error().message()).isEqualTo("Unexpected token 'end of input'");
            assertThat(result.error().column()).isEqualTo(8);
        }
    }
}
