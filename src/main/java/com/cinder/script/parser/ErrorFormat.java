package com.cinder.script.parser;

/** The one diagnostic format shared by the lexer, parser and interpreter. */
public final class ErrorFormat {

    private ErrorFormat() {}

    public static String format(int line, int col, String message) {
        return "Line " + line + ", col " + col + ": " + message;
    }

    public static String format(Span span, String message) {
        return format(span.line, span.col, message);
    }
}
