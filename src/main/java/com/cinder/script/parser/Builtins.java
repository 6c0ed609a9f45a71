package com.cinder.script.parser;

import java.io.PrintStream;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/** Core builtins installed into every interpreter's global scope. */
public final class Builtins {

    public static final Set<String> CORE_NAMES = Set.of("print", "assert");

    private Builtins() {}

    public static Map<String, Builtin> core(PrintStream out) {
        Map<String, Builtin> map = new LinkedHashMap<>();
        map.put("print", Builtin.variadic("print", args -> print(out, args)));
        map.put("assert", new Builtin("assert", 1, Builtins::assertTrue));
        return map;
    }

    public static void registerAll(Environment globals, PrintStream out) {
        for (Builtin b : core(out).values()) {
            globals.define(b.name, Value.builtin(b));
        }
    }

    private static Value print(PrintStream out, List<Value> args) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < args.size(); i++) {
            if (i > 0) sb.append(' ');
            sb.append(args.get(i));
        }
        out.println(sb);
        return Value.nil();
    }

    private static Value assertTrue(List<Value> args) {
        Value cond = args.get(0);
        if (cond.getType() != Value.Type.BOOL) {
            throw new IllegalArgumentException("Expected boolean in assert, got " + cond.typeName() + ".");
        }
        if (!cond.asBool()) throw new IllegalArgumentException("Assertion failed.");
        return Value.nil();
    }
}
