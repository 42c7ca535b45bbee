package com.pseudoconv.core.lexer;

import java.util.Objects;

/**
 * A position-tagged token.
 *
 * @param kind token category
 * @param text exact source text (string literals keep their quotes, EOF is empty)
 * @param line 1-based line of the first character
 * @param column 1-based column of the first character
 */
public record Token(TokenKind kind, String text, int line, int column) {

    /**
     * Compact constructor with validation.
     */
    public Token {
        Objects.requireNonNull(kind, "kind must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    /**
     * Returns true if this token has the given kind.
     *
     * @param expected kind to compare
     * @return true on match
     */
    public boolean is(TokenKind expected) {
        return kind == expected;
    }

    /**
     * Returns true if this token has the given kind and text.
     *
     * @param expected kind to compare
     * @param expectedText text to compare
     * @return true on match
     */
    public boolean is(TokenKind expected, String expectedText) {
        return kind == expected && text.equals(expectedText);
    }

    /**
     * Text used when quoting this token in error messages.
     *
     * @return the token text, or the kind name for EOF
     */
    public String describe() {
        return kind == TokenKind.EOF ? "end of input" : text;
    }
}
