package com.pseudoconv.core.lexer;

import com.pseudoconv.core.error.ConvertException;
import com.pseudoconv.core.error.Stage;

import java.util.List;
import java.util.Objects;

/**
 * Forward-only cursor over an immutable, EOF-terminated token list.
 *
 * <p>Exposes only {@link #peek()}, bounded {@link #lookahead(int)},
 * {@link #advance()} and the {@code match}/{@code expect} helpers. There is no mark/reset:
 * once a token is consumed the cursor never moves back.
 */
public final class TokenStream {

    private final List<Token> tokens;
    private int index = 0;

    /**
     * Creates a cursor at the first token.
     *
     * @param tokens token list whose last element is the EOF token
     * @throws IllegalArgumentException if the list is empty or not EOF-terminated
     */
    public TokenStream(List<Token> tokens) {
        Objects.requireNonNull(tokens, "tokens must not be null");
        if (tokens.isEmpty() || !tokens.get(tokens.size() - 1).is(TokenKind.EOF)) {
            throw new IllegalArgumentException("Token list must end with EOF");
        }
        this.tokens = List.copyOf(tokens);
    }

    /**
     * Returns the current token without consuming it.
     *
     * @return current token (EOF once the stream is exhausted)
     */
    public Token peek() {
        return tokens.get(index);
    }

    /**
     * Returns the token {@code k} positions ahead of the current one, clamped to EOF.
     *
     * @param k non-negative offset, 0 is the current token
     * @return token at the offset
     */
    public Token lookahead(int k) {
        int target = index + Math.max(0, k);
        if (target >= tokens.size()) {
            target = tokens.size() - 1;
        }
        return tokens.get(target);
    }

    /**
     * Consumes and returns the current token. EOF is never consumed.
     *
     * @return the consumed token
     */
    public Token advance() {
        Token current = peek();
        if (!current.is(TokenKind.EOF)) {
            index++;
        }
        return current;
    }

    /**
     * Consumes the current token if it has the given kind.
     *
     * @param kind expected kind
     * @return true if consumed
     */
    public boolean match(TokenKind kind) {
        if (peek().is(kind)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * Consumes the current token if it has the given kind and text.
     *
     * @param kind expected kind
     * @param text expected text
     * @return true if consumed
     */
    public boolean match(TokenKind kind, String text) {
        if (peek().is(kind, text)) {
            advance();
            return true;
        }
        return false;
    }

    /**
     * Consumes the current token, which must have the given kind.
     *
     * @param kind required kind
     * @param message error message when the token does not match
     * @return the consumed token
     * @throws ConvertException parse error positioned at the current token
     */
    public Token expect(TokenKind kind, String message) {
        Token current = peek();
        if (!current.is(kind)) {
            throw error(message);
        }
        return advance();
    }

    /**
     * Consumes the current token, which must have the given kind and text.
     *
     * @param kind required kind
     * @param text required text
     * @param message error message when the token does not match
     * @return the consumed token
     * @throws ConvertException parse error positioned at the current token
     */
    public Token expect(TokenKind kind, String text, String message) {
        Token current = peek();
        if (!current.is(kind, text)) {
            throw error(message);
        }
        return advance();
    }

    /**
     * Builds a parse error positioned at the current token.
     *
     * @param message error message
     * @return exception to throw
     */
    public ConvertException error(String message) {
        Token current = peek();
        return new ConvertException(Stage.PARSE, message, current.line(), current.column());
    }

    /**
     * Returns true once only the EOF token remains.
     *
     * @return true at end of stream
     */
    public boolean atEnd() {
        return peek().is(TokenKind.EOF);
    }
}
