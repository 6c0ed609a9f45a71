package com.cinder.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One lexical scope plus a link to the scope around it. The chain is only ever
 * walked outward; nothing in a scope points back at its children.
 */
public class Environment {
    public final Environment enclosing;
    private final Map<String, Value> values = new LinkedHashMap<>();

    /** Root (global) scope. */
    public Environment() {
        this.enclosing = null;
    }

    private Environment(Environment enclosing) {
        this.enclosing = enclosing;
    }

    public Environment childScope() {
        return new Environment(this);
    }

    // -------------------------
    // Vars API
    // -------------------------
    public void define(String name, Value value) {
        if (values.containsKey(name)) {
            throw new IllegalStateException("Variable already defined in this scope: " + name);
        }
        values.put(name, value);
    }

    public boolean existsInCurrentScope(String name) {
        return values.containsKey(name);
    }

    public boolean exists(String name) {
        for (Environment e = this; e != null; e = e.enclosing) {
            if (e.values.containsKey(name)) return true;
        }
        return false;
    }

    public Value get(String name) {
        for (Environment e = this; e != null; e = e.enclosing) {
            Value v = e.values.get(name);
            if (v != null) return v;
        }
        throw new IllegalStateException("Undefined variable: " + name);
    }

    /** Updates the nearest scope that defines {@code name}. Never creates a binding. */
    public void assign(String name, Value value) {
        for (Environment e = this; e != null; e = e.enclosing) {
            if (e.values.containsKey(name)) {
                e.values.put(name, value);
                return;
            }
        }
        throw new IllegalStateException("Undefined variable: " + name);
    }

    /** Bindings of this scope only, in declaration order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }
}
