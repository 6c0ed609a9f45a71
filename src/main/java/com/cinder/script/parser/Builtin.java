package com.cinder.script.parser;

import java.util.List;

/**
 * A named native callable. Arity is checked by the interpreter before any argument is
 * evaluated; a variadic builtin accepts any count.
 */
public final class Builtin {
    public static final int VARIADIC = -1;

    public final String name;
    public final int arity;
    private final BuiltinFunction impl;

    public Builtin(String name, int arity, BuiltinFunction impl) {
        if (name == null || name.isEmpty()) throw new IllegalArgumentException("builtin name must not be empty");
        if (arity < VARIADIC) throw new IllegalArgumentException("invalid arity for " + name + ": " + arity);
        if (impl == null) throw new IllegalArgumentException("builtin " + name + " has no implementation");
        this.name = name;
        this.arity = arity;
        this.impl = impl;
    }

    public static Builtin variadic(String name, BuiltinFunction impl) {
        return new Builtin(name, VARIADIC, impl);
    }

    public boolean isVariadic() { return arity == VARIADIC; }

    public Value call(List<Value> args) {
        Value out = impl.call(args);
        return out == null ? Value.nil() : out;
    }
}
