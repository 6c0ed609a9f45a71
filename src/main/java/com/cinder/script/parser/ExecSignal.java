package com.cinder.script.parser;

/**
 * Outcome of executing one statement. Loops consume BREAK and CONTINUE, function
 * calls consume RETURN; anything else keeps propagating to the enclosing statement.
 */
public final class ExecSignal {
    public enum Kind { NORMAL, BREAK, CONTINUE, RETURN }

    public static final ExecSignal NORMAL = new ExecSignal(Kind.NORMAL, null);
    public static final ExecSignal BREAK = new ExecSignal(Kind.BREAK, null);
    public static final ExecSignal CONTINUE = new ExecSignal(Kind.CONTINUE, null);

    public final Kind kind;
    public final Value value; // only set for RETURN

    private ExecSignal(Kind kind, Value value) {
        this.kind = kind;
        this.value = value;
    }

    public static ExecSignal returning(Value value) {
        return new ExecSignal(Kind.RETURN, value == null ? Value.nil() : value);
    }

    public boolean isNormal() { return kind == Kind.NORMAL; }
}
