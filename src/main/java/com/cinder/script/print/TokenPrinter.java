package com.cinder.script.print;

import java.util.List;

import com.cinder.script.parser.Token;

public final class TokenPrinter {

    private TokenPrinter() {}

    /** One {@code TYPE 'lexeme'} line per token, EOF included. */
    public static String print(List<Token> tokens) {
        StringBuilder sb = new StringBuilder();
        for (Token t : tokens) {
            sb.append(t.type).append(" '").append(t.lexeme).append("'\n");
        }
        return sb.toString();
    }
}
