package com.pseudoconv.core.lexer;

/**
 * Token categories produced by the {@link Tokenizer}.
 */
public enum TokenKind {
    IDENTIFIER,
    KEYWORD,
    NUMBER,
    STRING,
    OPERATOR,
    PAREN,
    BRACE,
    BRACKET,
    DOT,
    COMMA,
    SEMICOLON,
    /** End-of-stream marker, always the last token */
    EOF
}
