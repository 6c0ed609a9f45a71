package com.cinder.script.parser;

/**
 * A scanned token. {@code literal} is null, an {@link Integer} for NUMBER, or a
 * {@link Boolean} for TRUE/FALSE.
 */
public class Token {
    public final TokenType type;
    public final String lexeme;
    public final Object literal;
    public final Span span;

    Token(TokenType type, String lexeme, Object literal, Span span) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.span = span;
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "'";
    }
}
