package com.cinder.script.parser;

/** A script fault. Carries the span it is reported at; aborts the current run. */
public class RuntimeError extends RuntimeException {
    public final Span span;

    public RuntimeError(Span span, String message) {
        super(message);
        this.span = span;
    }

    public String formatted() {
        return ErrorFormat.format(span, getMessage());
    }
}
