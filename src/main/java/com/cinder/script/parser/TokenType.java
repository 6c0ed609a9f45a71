package com.cinder.script.parser;

public enum TokenType {
    // grouping
    LEFT_PAREN, RIGHT_PAREN, LEFT_BRACE, RIGHT_BRACE,

    // structure
    SEMICOLON, COMMA,

    // arithmetic
    PLUS, MINUS, STAR, SLASH,

    EQUAL,

    // comparison
    EQUAL_EQUAL, BANG_EQUAL, LESS, LESS_EQUAL, GREATER, GREATER_EQUAL, BANG,

    // logical
    AND_AND, OR_OR,

    // literals
    IDENTIFIER, NUMBER,

    // keywords
    LET, IF, ELSE, WHILE, BREAK, CONTINUE, RETURN, FN, TRUE, FALSE,

    EOF
}
