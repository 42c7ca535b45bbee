package com.pseudoconv.core.lexer;

import com.pseudoconv.core.error.ConvertError;
import com.pseudoconv.core.error.Stage;
import com.pseudoconv.core.error.StageResult;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

/**
 * Tests for {@link Tokenizer}.
 */
class TokenizerTest {

    private static List<Token> tokenize(String source) {
        StageResult<List<Token>> result = Tokenizer.tokenize(source);
        assertThat(result.isSuccess()).as("tokenize %s", source).isTrue();
        return result.value();
    }

    @Test
    void tokenize_declaration_producesKindsTextAndPositions() {
        List<Token> tokens = tokenize("int x = 42;");

        assertThat(tokens)
            .extracting(Token::kind, Token::text, Token::line, Token::column)
            .containsExactly(
                tuple(TokenKind.KEYWORD, "int", 1, 1),
                tuple(TokenKind.IDENTIFIER, "x", 1, 5),
                tuple(TokenKind.OPERATOR, "=", 1, 7),
                tuple(TokenKind.NUMBER, "42", 1, 9),
                tuple(TokenKind.SEMICOLON, ";", 1, 11),
                tuple(TokenKind.EOF, "", 1, 12)
            );
    }

    @Test
    void tokenize_twoCharOperators_preferredOverSingle() {
        List<Token> tokens = tokenize("a<=b!=c&&d||e++ f-- g+=1 h%=2 i==j");

        assertThat(tokens)
            .filteredOn(token -> token.is(TokenKind.OPERATOR))
            .extracting(Token::text)
            .containsExactly("<=", "!=", "&&", "||", "++", "--", "+=", "%=", "==");
    }

    @Test
    void tokenize_punctuation_classified() {
        List<Token> tokens = tokenize("a[0].b(c, d) { }");

        assertThat(tokens).extracting(Token::kind).containsExactly(
            TokenKind.IDENTIFIER, TokenKind.BRACKET, TokenKind.NUMBER, TokenKind.BRACKET, TokenKind.DOT,
            TokenKind.IDENTIFIER, TokenKind.PAREN, TokenKind.IDENTIFIER, TokenKind.COMMA,
            TokenKind.IDENTIFIER, TokenKind.PAREN, TokenKind.BRACE, TokenKind.BRACE, TokenKind.EOF);
    }

    @Test
    void tokenize_stringLiteral_keepsQuotesAndEscapes() {
        List<Token> tokens = tokenize("s = \"a \\\"b\\\"\" + 'c';");

        assertThat(tokens).filteredOn(token -> token.is(TokenKind.STRING))
            .extracting(Token::text)
            .containsExactly("\"a \\\"b\\\"\"", "'c'");
    }

    @Test
    void tokenize_decimalNumber_singleToken() {
        assertThat(tokenize("x = 3.25;")).extracting(Token::text).contains("3.25");
    }

    @Test
    void tokenize_keywordsAndIdentifiers_distinguished() {
        List<Token> tokens = tokenize("String name new Scanner returnValue return");

        assertThat(tokens).extracting(Token::kind).containsExactly(
            TokenKind.KEYWORD, TokenKind.IDENTIFIER, TokenKind.KEYWORD, TokenKind.IDENTIFIER,
            TokenKind.IDENTIFIER, TokenKind.KEYWORD, TokenKind.EOF);
    }

    @Test
    void tokenize_multipleLines_tracksLineAndColumn() {
        List<Token> tokens = tokenize("x = 1;\n  y = 2;\n");

        Token y = tokens.get(4);
        assertThat(y.text()).isEqualTo("y");
        assertThat(y.line()).isEqualTo(2);
        assertThat(y.column()).isEqualTo(3);
        assertThat(tokens.get(tokens.size() - 1)).isEqualTo(new Token(TokenKind.EOF, "", 3, 1));
    }

    @Test
    void tokenize_emptyText_onlyEof() {
        assertThat(tokenize("")).containsExactly(new Token(TokenKind.EOF, "", 1, 1));
    }

    @Test
    void tokenize_unterminatedString_errorAtOpeningQuote() {
        StageResult<List<Token>> result = Tokenizer.tokenize("x = 1;\nString s = \"abc;");

        assertThat(result.error()).isEqualTo(
            new ConvertError(Stage.TOKENIZATION, "Unterminated string literal", 2, 12));
    }

    @Test
    void tokenize_stringCrossingNewline_unterminated() {
        StageResult<List<Token>> result = Tokenizer.tokenize("s = \"abc\ndef\";");

        assertThat(result.error()).isEqualTo(
            new ConvertError(Stage.TOKENIZATION, "Unterminated string literal", 1, 5));
    }

    @ParameterizedTest
    @ValueSource(strings = {"#", "@", "$", "~", "?", ":", "&", "|", "^"})
    void tokenize_unsupportedCharacter_errorAtCharacter(String character) {
        StageResult<List<Token>> result = Tokenizer.tokenize("int x = 1 " + character + " 2;");

        assertThat(result.error()).isEqualTo(new ConvertError(
            Stage.TOKENIZATION, "Unsupported character '" + character + "'", 1, 11));
    }
}
