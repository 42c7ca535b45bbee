package com.pseudoconv.core.parser;

import com.pseudoconv.core.ast.Ast;
import com.pseudoconv.core.error.ConvertException;
import com.pseudoconv.core.error.Stage;
import com.pseudoconv.core.error.StageResult;
import com.pseudoconv.core.lexer.Token;
import com.pseudoconv.core.lexer.TokenKind;
import com.pseudoconv.core.lexer.TokenStream;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Recursive-descent parser for the supported Java subset.
 *
 * <p>Consumes an EOF-terminated token list through a {@link TokenStream}. Statement
 * forms that share a leading identifier are told apart with lookahead predicates
 * that only peek; the cursor never rewinds. The first mismatch ends parsing with a
 * {@code parse} error positioned at the offending token.
 *
 * <p>Blocks, statements, parenthesized expressions, prefix operators and operator
 * chains each count one level of nesting. Input nested deeper than
 * {@link #MAX_NESTING_DEPTH} is rejected before the recursion can exhaust the stack.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * StageResult<Ast.Program> result = Parser.parse(tokens);
 * if (result.isSuccess()) {
 *     Ast.Program program = result.value();
 * }
 * }</pre>
 */
public final class Parser {

    /** Deepest nesting accepted; the generator recurses over the same depth. */
    public static final int MAX_NESTING_DEPTH = 256;

    private static final Set<String> ASSIGNMENT_OPERATORS = Set.of("=", "+=", "-=", "*=", "/=", "%=");
    private static final Set<String> UPDATE_OPERATORS = Set.of("++", "--");
    private static final Set<String> DECLARATION_TYPES = Set.of("int", "double", "float", "boolean", "char", "String");
    private static final Set<String> WRAPPER_MODIFIERS = Set.of("public", "static");
    private static final Set<String> METHOD_START = Set.of("public", "static", "void");

    private static final Set<String> EQUALITY_OPERATORS = Set.of("==", "!=");
    private static final Set<String> RELATIONAL_OPERATORS = Set.of("<", ">", "<=", ">=");
    private static final Set<String> ADDITIVE_OPERATORS = Set.of("+", "-");
    private static final Set<String> MULTIPLICATIVE_OPERATORS = Set.of("*", "/", "%");
    private static final Set<String> PREFIX_OPERATORS = Set.of("!", "-");

    private final TokenStream tokens;
    private int depth;

    private Parser(TokenStream tokens) {
        this.tokens = tokens;
    }

    /**
     * Parses a token list into a program.
     *
     * @param tokens EOF-terminated tokens from the tokenizer
     * @return the program, or the first parse error
     */
    public static StageResult<Ast.Program> parse(List<Token> tokens) {
        Parser parser = new Parser(new TokenStream(tokens));
        try {
            return StageResult.ok(parser.parseProgram());
        } catch (ConvertException e) {
            return StageResult.failed(e.getError());
        }
    }

    // ---------------------------------------------------------------------
    // Program wrapper
    // ---------------------------------------------------------------------

    private Ast.Program parseProgram() {
        skipModifiers();

        boolean classWrapper = tokens.match(TokenKind.KEYWORD, "class");
        if (classWrapper) {
            while (!tokens.match(TokenKind.BRACE, "{")) {
                if (tokens.atEnd()) {
                    throw tokens.error("Expected '{' after class declaration");
                }
                tokens.advance();
            }
        }

        List<Ast.Node> statements;
        if (isMethodStart(tokens.peek())) {
            while (!tokens.peek().is(TokenKind.BRACE) && !tokens.atEnd()) {
                tokens.advance();
            }
            statements = parseBlock().statements();
        } else {
            statements = new ArrayList<>();
            while (!tokens.atEnd() && !(classWrapper && tokens.peek().is(TokenKind.BRACE, "}"))) {
                statements.add(parseStatement());
            }
        }

        if (classWrapper) {
            tokens.expect(TokenKind.BRACE, "}", "Expected '}' to close class");
        }
        if (!tokens.atEnd()) {
            throw unexpected(tokens.peek());
        }
        return new Ast.Program(statements);
    }

    /** Skips {@code public}/{@code static} only when they lead up to {@code class}. */
    private void skipModifiers() {
        int offset = 0;
        while (isWrapperModifier(tokens.lookahead(offset))) {
            offset++;
        }
        if (offset > 0 && tokens.lookahead(offset).is(TokenKind.KEYWORD, "class")) {
            for (int i = 0; i < offset; i++) {
                tokens.advance();
            }
        }
    }

    private static boolean isWrapperModifier(Token token) {
        return token.is(TokenKind.KEYWORD) && WRAPPER_MODIFIERS.contains(token.text());
    }

    private static boolean isMethodStart(Token token) {
        return token.is(TokenKind.KEYWORD) && METHOD_START.contains(token.text());
    }

    // ---------------------------------------------------------------------
    // Statements
    // ---------------------------------------------------------------------

    private Ast.Node parseStatement() {
        return nested(this::parseStatementBody);
    }

    private Ast.Node parseStatementBody() {
        Token current = tokens.peek();
        if (current.is(TokenKind.KEYWORD)) {
            return switch (current.text()) {
                case "if" -> parseIf();
                case "while" -> parseWhile();
                case "for" -> parseFor();
                case "do" -> parseDoWhile();
                case "int", "double", "float", "boolean", "char", "String" -> parseDeclaration();
                default -> throw tokens.error("Unsupported keyword '" + current.text() + "'");
            };
        }
        if (current.is(TokenKind.BRACE, "{")) {
            return parseBlock();
        }
        if (current.is(TokenKind.IDENTIFIER)) {
            if (isClassTypedDeclarationAhead()) {
                return parseDeclaration();
            }
            if (isUpdateAhead()) {
                Ast.Update update = parseUpdate();
                tokens.expect(TokenKind.SEMICOLON, ";", "Expected ';' after update");
                return update;
            }
            if (tokens.lookahead(1).is(TokenKind.DOT)) {
                return parseCallStatement();
            }
            if (isAssignmentAhead()) {
                return parseAssignment();
            }
            return parseExpressionStatement();
        }
        throw unexpected(current);
    }

    private Ast.Block parseBlock() {
        return nested(this::parseBlockBody);
    }

    private Ast.Block parseBlockBody() {
        tokens.expect(TokenKind.BRACE, "{", "Expected '{' to start block");
        List<Ast.Node> statements = new ArrayList<>();
        while (!tokens.peek().is(TokenKind.BRACE, "}") && !tokens.atEnd()) {
            statements.add(parseStatement());
        }
        tokens.expect(TokenKind.BRACE, "}", "Expected '}' to close block");
        return new Ast.Block(statements);
    }

    private Ast.Declaration parseDeclaration() {
        StringBuilder declaredType = new StringBuilder(tokens.advance().text());
        declaredType.append(parseDimensionSuffix());
        Token name = tokens.expect(TokenKind.IDENTIFIER, "Expected identifier in declaration");
        declaredType.append(parseDimensionSuffix());

        Ast.Node initializer = null;
        if (tokens.match(TokenKind.OPERATOR, "=")) {
            initializer = tokens.peek().is(TokenKind.BRACE, "{")
                ? parseArrayInitializer()
                : parseExpression();
        }
        tokens.expect(TokenKind.SEMICOLON, ";", "Expected ';' after declaration");
        return new Ast.Declaration(name.text(), declaredType.toString(), initializer);
    }

    private String parseDimensionSuffix() {
        StringBuilder suffix = new StringBuilder();
        while (tokens.match(TokenKind.BRACKET, "[")) {
            tokens.expect(TokenKind.BRACKET, "]", "Expected ']' after '[' in array declaration");
            suffix.append("[]");
        }
        return suffix.toString();
    }

    private Ast.Assignment parseAssignment() {
        Ast.Node target = parseTarget();
        Token operator = tokens.peek();
        if (!operator.is(TokenKind.OPERATOR) || !ASSIGNMENT_OPERATORS.contains(operator.text())) {
            throw tokens.error("Expected assignment operator");
        }
        tokens.advance();
        Ast.Node value = parseExpression();
        tokens.expect(TokenKind.SEMICOLON, ";", "Expected ';' after assignment");
        return new Ast.Assignment(target, operator.text(), value);
    }

    private Ast.Update parseUpdate() {
        Ast.Node target = parseTarget();
        Token operator = tokens.peek();
        if (!operator.is(TokenKind.OPERATOR) || !UPDATE_OPERATORS.contains(operator.text())) {
            throw tokens.error("Expected ++ or --");
        }
        tokens.advance();
        return new Ast.Update(target, operator.text());
    }

    /** Identifier with an optional index chain. */
    private Ast.Node parseTarget() {
        Token name = tokens.expect(TokenKind.IDENTIFIER, "Expected identifier");
        if (!tokens.peek().is(TokenKind.BRACKET, "[")) {
            return new Ast.Identifier(name.text());
        }
        return new Ast.ArrayAccess(name.text(), parseIndices());
    }

    private Ast.CallStatement parseCallStatement() {
        Token base = tokens.expect(TokenKind.IDENTIFIER, "Expected identifier");
        Ast.Node call = parsePostfix(new Ast.Identifier(base.text()));
        tokens.expect(TokenKind.SEMICOLON, ";", "Expected ';' after call");
        return new Ast.CallStatement(call);
    }

    private Ast.ExpressionStatement parseExpressionStatement() {
        Ast.Node expression = parseExpression();
        tokens.expect(TokenKind.SEMICOLON, ";", "Expected ';' after expression");
        return new Ast.ExpressionStatement(expression);
    }

    private Ast.If parseIf() {
        tokens.expect(TokenKind.KEYWORD, "if", "Expected 'if'");
        Ast.Node test = parseCondition("if");
        Ast.Node consequent = parseStatement();
        Ast.Node alternate = null;
        if (tokens.match(TokenKind.KEYWORD, "else")) {
            alternate = parseStatement();
        }
        return new Ast.If(test, consequent, alternate);
    }

    private Ast.While parseWhile() {
        tokens.expect(TokenKind.KEYWORD, "while", "Expected 'while'");
        Ast.Node test = parseCondition("while");
        return new Ast.While(test, parseStatement());
    }

    private Ast.DoWhile parseDoWhile() {
        tokens.expect(TokenKind.KEYWORD, "do", "Expected 'do'");
        Ast.Node body = parseStatement();
        tokens.expect(TokenKind.KEYWORD, "while", "Expected 'while' after do-body");
        Ast.Node test = parseCondition("while");
        tokens.expect(TokenKind.SEMICOLON, ";", "Expected ';' after do-while");
        return new Ast.DoWhile(body, test);
    }

    private Ast.Node parseCondition(String keyword) {
        tokens.expect(TokenKind.PAREN, "(", "Expected '(' after " + keyword);
        Ast.Node test = parseExpression();
        tokens.expect(TokenKind.PAREN, ")", "Expected ')' after condition");
        return test;
    }

    private Ast.For parseFor() {
        tokens.expect(TokenKind.KEYWORD, "for", "Expected 'for'");
        tokens.expect(TokenKind.PAREN, "(", "Expected '(' after for");

        // init consumes its own ';'
        Ast.Node init = null;
        if (!tokens.match(TokenKind.SEMICOLON, ";")) {
            init = tokens.peek().is(TokenKind.KEYWORD) || isClassTypedDeclarationAhead()
                ? parseDeclaration()
                : parseAssignment();
        }

        Ast.Node test = null;
        if (!tokens.match(TokenKind.SEMICOLON, ";")) {
            test = parseExpression();
            tokens.expect(TokenKind.SEMICOLON, ";", "Expected ';' after for-condition");
        }

        Ast.Node update = null;
        if (!tokens.match(TokenKind.PAREN, ")")) {
            update = tokens.peek().is(TokenKind.IDENTIFIER) && isUpdateAhead()
                ? parseUpdate()
                : parseExpression();
            tokens.expect(TokenKind.PAREN, ")", "Expected ')' after for-update");
        }
        return new Ast.For(init, test, update, parseStatement());
    }

    // ---------------------------------------------------------------------
    // Lookahead predicates
    // ---------------------------------------------------------------------

    /** {@code Type name} or {@code Type[] name}, with the cursor on {@code Type}. */
    private boolean isClassTypedDeclarationAhead() {
        if (!tokens.peek().is(TokenKind.IDENTIFIER)) {
            return false;
        }
        int offset = 1;
        while (tokens.lookahead(offset).is(TokenKind.BRACKET, "[")
            && tokens.lookahead(offset + 1).is(TokenKind.BRACKET, "]")) {
            offset += 2;
        }
        return tokens.lookahead(offset).is(TokenKind.IDENTIFIER);
    }

    private boolean isUpdateAhead() {
        Token after = tokens.lookahead(skipBracketChain(1));
        return after.is(TokenKind.OPERATOR) && UPDATE_OPERATORS.contains(after.text());
    }

    private boolean isAssignmentAhead() {
        Token after = tokens.lookahead(skipBracketChain(1));
        return after.is(TokenKind.OPERATOR) && ASSIGNMENT_OPERATORS.contains(after.text());
    }

    /**
     * Returns the offset just past a run of balanced {@code [...]} groups
     * starting at {@code offset}, or {@code offset} itself when there is none.
     */
    private int skipBracketChain(int offset) {
        int position = offset;
        while (tokens.lookahead(position).is(TokenKind.BRACKET, "[")) {
            int bracketDepth = 0;
            do {
                Token token = tokens.lookahead(position);
                if (token.is(TokenKind.EOF)) {
                    return position;
                }
                if (token.is(TokenKind.BRACKET, "[")) {
                    bracketDepth++;
                } else if (token.is(TokenKind.BRACKET, "]")) {
                    bracketDepth--;
                }
                position++;
            } while (bracketDepth > 0);
        }
        return position;
    }

    // ---------------------------------------------------------------------
    // Expressions
    // ---------------------------------------------------------------------

    private Ast.Node parseExpression() {
        return nested(this::parseExpressionBody);
    }

    private Ast.Node parseExpressionBody() {
        Ast.Node left = parseOr();
        Token operator = tokens.peek();
        if (operator.is(TokenKind.OPERATOR) && ASSIGNMENT_OPERATORS.contains(operator.text())) {
            if (!Ast.isAssignable(left)) {
                throw tokens.error("Invalid assignment target");
            }
            tokens.advance();
            Ast.Node value = parseExpression();
            return new Ast.AssignmentExpr(left, operator.text(), value);
        }
        return left;
    }

    private Ast.Node parseOr() {
        int chainStart = depth;
        Ast.Node expression = parseAnd();
        while (tokens.match(TokenKind.OPERATOR, "||")) {
            descend();
            expression = new Ast.Binary("||", expression, parseAnd());
        }
        depth = chainStart;
        return expression;
    }

    private Ast.Node parseAnd() {
        int chainStart = depth;
        Ast.Node expression = parseEquality();
        while (tokens.match(TokenKind.OPERATOR, "&&")) {
            descend();
            expression = new Ast.Binary("&&", expression, parseEquality());
        }
        depth = chainStart;
        return expression;
    }

    private Ast.Node parseEquality() {
        int chainStart = depth;
        Ast.Node expression = parseRelational();
        String operator;
        while ((operator = matchOperator(EQUALITY_OPERATORS)) != null) {
            descend();
            expression = new Ast.Binary(operator, expression, parseRelational());
        }
        depth = chainStart;
        return expression;
    }

    private Ast.Node parseRelational() {
        int chainStart = depth;
        Ast.Node expression = parseAdditive();
        String operator;
        while ((operator = matchOperator(RELATIONAL_OPERATORS)) != null) {
            descend();
            expression = new Ast.Binary(operator, expression, parseAdditive());
        }
        depth = chainStart;
        return expression;
    }

    private Ast.Node parseAdditive() {
        int chainStart = depth;
        Ast.Node expression = parseMultiplicative();
        String operator;
        while ((operator = matchOperator(ADDITIVE_OPERATORS)) != null) {
            descend();
            expression = new Ast.Binary(operator, expression, parseMultiplicative());
        }
        depth = chainStart;
        return expression;
    }

    private Ast.Node parseMultiplicative() {
        int chainStart = depth;
        Ast.Node expression = parseUnary();
        String operator;
        while ((operator = matchOperator(MULTIPLICATIVE_OPERATORS)) != null) {
            descend();
            expression = new Ast.Binary(operator, expression, parseUnary());
        }
        depth = chainStart;
        return expression;
    }

    private Ast.Node parseUnary() {
        String operator = matchOperator(PREFIX_OPERATORS);
        if (operator != null) {
            return new Ast.Unary(operator, nested(this::parseUnary));
        }
        return parsePrimary();
    }

    private String matchOperator(Set<String> candidates) {
        Token current = tokens.peek();
        if (current.is(TokenKind.OPERATOR) && candidates.contains(current.text())) {
            tokens.advance();
            return current.text();
        }
        return null;
    }

    private Ast.Node parsePrimary() {
        Token current = tokens.peek();
        if (tokens.match(TokenKind.KEYWORD, "new")) {
            return parseCreation();
        }
        if (tokens.match(TokenKind.NUMBER)) {
            return new Ast.Literal(Ast.LiteralKind.NUMBER, current.text());
        }
        if (tokens.match(TokenKind.STRING)) {
            Ast.LiteralKind kind = current.text().startsWith("'") ? Ast.LiteralKind.CHAR : Ast.LiteralKind.STRING;
            return new Ast.Literal(kind, current.text());
        }
        if (tokens.match(TokenKind.KEYWORD, "true") || tokens.match(TokenKind.KEYWORD, "false")) {
            return new Ast.Literal(Ast.LiteralKind.BOOLEAN, current.text());
        }
        if (tokens.match(TokenKind.IDENTIFIER)) {
            return parsePostfix(new Ast.Identifier(current.text()));
        }
        if (tokens.match(TokenKind.PAREN, "(")) {
            Ast.Node expression = parseExpression();
            tokens.expect(TokenKind.PAREN, ")", "Expected ')' after expression");
            return expression;
        }
        throw unexpected(current);
    }

    private Ast.Node parsePostfix(Ast.Node base) {
        Ast.Node node = base;
        while (true) {
            if (tokens.peek().is(TokenKind.PAREN, "(")) {
                if (!(node instanceof Ast.Identifier identifier)) {
                    throw tokens.error("Unsupported call target");
                }
                tokens.advance();
                node = new Ast.Call(identifier.name(), parseArguments());
            } else if (tokens.match(TokenKind.DOT)) {
                Token member = tokens.expect(TokenKind.IDENTIFIER, "Expected property name");
                if (tokens.match(TokenKind.PAREN, "(")) {
                    node = new Ast.MethodCall(node, member.text(), parseArguments());
                } else if ("length".equals(member.text())) {
                    node = new Ast.Length(node);
                } else {
                    node = new Ast.Property(node, member.text());
                }
            } else if (tokens.peek().is(TokenKind.BRACKET, "[")) {
                String name = qualifiedName(node);
                if (name == null) {
                    throw tokens.error("Unsupported array access target");
                }
                node = new Ast.ArrayAccess(name, parseIndices());
            } else {
                String operator = matchOperator(UPDATE_OPERATORS);
                if (operator != null) {
                    return new Ast.UnaryPostfix(operator, node);
                }
                return node;
            }
        }
    }

    /** Parses arguments after a consumed '('. */
    private List<Ast.Node> parseArguments() {
        List<Ast.Node> args = new ArrayList<>();
        if (tokens.match(TokenKind.PAREN, ")")) {
            return args;
        }
        do {
            args.add(parseExpression());
        } while (tokens.match(TokenKind.COMMA));
        tokens.expect(TokenKind.PAREN, ")", "Expected ')' after arguments");
        return args;
    }

    private List<Ast.Node> parseIndices() {
        List<Ast.Node> indices = new ArrayList<>();
        while (tokens.match(TokenKind.BRACKET, "[")) {
            indices.add(parseExpression());
            tokens.expect(TokenKind.BRACKET, "]", "Expected ']' in array access");
        }
        return indices;
    }

    /** {@code a} or {@code a.b.c}; null for any other receiver. */
    private static String qualifiedName(Ast.Node node) {
        if (node instanceof Ast.Identifier identifier) {
            return identifier.name();
        }
        if (node instanceof Ast.Property property) {
            String receiver = qualifiedName(property.receiver());
            return receiver == null ? null : receiver + "." + property.name();
        }
        return null;
    }

    /** Parses what follows {@code new}. */
    private Ast.Node parseCreation() {
        Token type = tokens.peek();
        boolean primitive = type.is(TokenKind.KEYWORD) && DECLARATION_TYPES.contains(type.text());
        if (!primitive && !type.is(TokenKind.IDENTIFIER)) {
            throw tokens.error("Expected type after new");
        }
        tokens.advance();

        if (!primitive && tokens.match(TokenKind.PAREN, "(")) {
            return new Ast.NewObject(type.text(), parseArguments());
        }

        List<Ast.Node> dimensions = new ArrayList<>();
        boolean unsized = false;
        while (tokens.match(TokenKind.BRACKET, "[")) {
            if (tokens.match(TokenKind.BRACKET, "]")) {
                unsized = true;
                dimensions.add(null);
            } else {
                dimensions.add(parseExpression());
                tokens.expect(TokenKind.BRACKET, "]", "Expected ']' after array size");
            }
        }
        if (dimensions.isEmpty()) {
            throw new ConvertException(Stage.PARSE,
                "Expected '[' after array type", type.line(), type.column());
        }
        if (dimensions.get(dimensions.size() - 1) == null && tokens.peek().is(TokenKind.BRACE, "{")) {
            return parseArrayInitializer();
        }
        if (unsized) {
            throw new ConvertException(Stage.PARSE,
                "Expected array initializer", type.line(), type.column());
        }
        return new Ast.NewArray(type.text(), dimensions);
    }

    /** {@code {a, b, ...}} with the cursor on '{'. */
    private Ast.ArrayLiteral parseArrayInitializer() {
        return nested(this::parseArrayInitializerBody);
    }

    private Ast.ArrayLiteral parseArrayInitializerBody() {
        tokens.expect(TokenKind.BRACE, "{", "Expected '{' to start array initializer");
        List<Ast.Node> elements = new ArrayList<>();
        if (!tokens.match(TokenKind.BRACE, "}")) {
            do {
                elements.add(tokens.peek().is(TokenKind.BRACE, "{") ? parseArrayInitializer() : parseExpression());
            } while (tokens.match(TokenKind.COMMA));
            tokens.expect(TokenKind.BRACE, "}", "Expected '}' after array literal");
        }
        return new Ast.ArrayLiteral(elements);
    }

    private <T> T nested(Supplier<T> parse) {
        descend();
        T node = parse.get();
        depth--;
        return node;
    }

    private void descend() {
        if (++depth > MAX_NESTING_DEPTH) {
            throw tokens.error("Nesting too deep");
        }
    }

    private ConvertException unexpected(Token token) {
        return tokens.error("Unexpected token '" + token.describe() + "'");
    }
}
