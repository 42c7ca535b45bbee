package com.pseudoconv.core.lexer;

import com.pseudoconv.core.error.ConvertError;
import com.pseudoconv.core.error.Stage;
import com.pseudoconv.core.error.StageResult;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Hand-written, single-pass lexer for the supported Java subset.
 *
 * <p>Scans normalized text left to right keeping running line/column counters.
 * Classification order: whitespace, identifier or keyword, number, string or
 * char literal, two-character operator, single-character operator or
 * punctuation. Anything else is a {@link Stage#TOKENIZATION} error. The token
 * list always ends with exactly one {@link TokenKind#EOF} token.
 *
 * <p>A tokenizer instance is single use; {@link #tokenize(String)} creates one
 * per call.
 */
public final class Tokenizer {

    /** Reserved words recognised as {@link TokenKind#KEYWORD}. */
    public static final Set<String> KEYWORDS = Set.of(
        "if", "else", "while", "for", "do",
        "int", "double", "float", "boolean", "char", "String", "void",
        "public", "static", "class", "return",
        "true", "false", "new"
    );

    private static final Set<String> TWO_CHAR_OPERATORS = Set.of(
        "==", "!=", "<=", ">=", "&&", "||", "++", "--", "+=", "-=", "*=", "/=", "%="
    );

    private static final Map<Character, TokenKind> SINGLE_CHAR_TOKENS = Map.ofEntries(
        Map.entry('+', TokenKind.OPERATOR),
        Map.entry('-', TokenKind.OPERATOR),
        Map.entry('*', TokenKind.OPERATOR),
        Map.entry('/', TokenKind.OPERATOR),
        Map.entry('%', TokenKind.OPERATOR),
        Map.entry('<', TokenKind.OPERATOR),
        Map.entry('>', TokenKind.OPERATOR),
        Map.entry('=', TokenKind.OPERATOR),
        Map.entry('!', TokenKind.OPERATOR),
        Map.entry('(', TokenKind.PAREN),
        Map.entry(')', TokenKind.PAREN),
        Map.entry('{', TokenKind.BRACE),
        Map.entry('}', TokenKind.BRACE),
        Map.entry('[', TokenKind.BRACKET),
        Map.entry(']', TokenKind.BRACKET),
        Map.entry('.', TokenKind.DOT),
        Map.entry(';', TokenKind.SEMICOLON),
        Map.entry(',', TokenKind.COMMA)
    );

    private final String source;
    private final List<Token> tokens = new ArrayList<>();
    private int pos = 0;
    private int line = 1;
    private int column = 1;

    private Tokenizer(String source) {
        this.source = source;
    }

    /**
     * Tokenizes normalized source text.
     *
     * @param normalized output of the normalizer
     * @return the token list (EOF-terminated) or a tokenization error
     */
    public static StageResult<List<Token>> tokenize(String normalized) {
        return new Tokenizer(normalized).run();
    }

    private StageResult<List<Token>> run() {
        while (pos < source.length()) {
            char ch = source.charAt(pos);

            if (ch == '\n') {
                pos++;
                line++;
                column = 1;
                continue;
            }
            if (ch == ' ' || ch == '\t' || ch == '\r' || ch == '\f') {
                advance(1);
                continue;
            }
            if (isIdentifierStart(ch)) {
                readWord();
                continue;
            }
            if (isDigit(ch)) {
                readNumber();
                continue;
            }
            if (ch == '"' || ch == '\'') {
                ConvertError error = readString(ch);
                if (error != null) {
                    return StageResult.failed(error);
                }
                continue;
            }

            if (pos + 1 < source.length()) {
                String twoChar = source.substring(pos, pos + 2);
                if (TWO_CHAR_OPERATORS.contains(twoChar)) {
                    emit(TokenKind.OPERATOR, twoChar);
                    continue;
                }
            }

            TokenKind single = SINGLE_CHAR_TOKENS.get(ch);
            if (single != null) {
                emit(single, String.valueOf(ch));
                continue;
            }

            return StageResult.failed(new ConvertError(
                Stage.TOKENIZATION, "Unsupported character '" + ch + "'", line, column));
        }

        tokens.add(new Token(TokenKind.EOF, "", line, column));
        return StageResult.ok(List.copyOf(tokens));
    }

    private void readWord() {
        int start = pos;
        int end = pos;
        while (end < source.length() && isIdentifierPart(source.charAt(end))) {
            end++;
        }
        String word = source.substring(start, end);
        emit(KEYWORDS.contains(word) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER, word);
    }

    private void readNumber() {
        int end = pos;
        while (end < source.length() && isDigit(source.charAt(end))) {
            end++;
        }
        if (end < source.length() && source.charAt(end) == '.') {
            end++;
            while (end < source.length() && isDigit(source.charAt(end))) {
                end++;
            }
        }
        emit(TokenKind.NUMBER, source.substring(pos, end));
    }

    /**
     * Reads a quoted literal; escapes are kept verbatim.
     *
     * @return an error positioned at the opening quote, or null on success
     */
    private ConvertError readString(char quote) {
        int end = pos + 1;
        while (end < source.length()) {
            char c = source.charAt(end);
            if (c == '\\' && end + 1 < source.length() && source.charAt(end + 1) != '\n') {
                end += 2;
                continue;
            }
            if (c == quote) {
                emit(TokenKind.STRING, source.substring(pos, end + 1));
                return null;
            }
            if (c == '\n' || c == '\\') {
                break;
            }
            end++;
        }
        return new ConvertError(Stage.TOKENIZATION, "Unterminated string literal", line, column);
    }

    /** Records a token at the current position and moves past it on the same line. */
    private void emit(TokenKind kind, String text) {
        tokens.add(new Token(kind, text, line, column));
        advance(text.length());
    }

    private void advance(int count) {
        pos += count;
        column += count;
    }

    private static boolean isIdentifierStart(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
    }

    private static boolean isIdentifierPart(char c) {
        return isIdentifierStart(c) || isDigit(c);
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }
}
