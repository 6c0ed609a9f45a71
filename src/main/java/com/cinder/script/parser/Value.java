package com.cinder.script.parser;

/**
 * Runtime value: nil, a 32-bit integer, a boolean, a user function or a builtin.
 * Callables are shared by reference; equality on them is identity.
 */
public class Value {
    public enum Type { NIL, NUMBER, BOOL, FUNCTION, BUILTIN }

    private static final Value NIL = new Value(Type.NIL, null);
    private static final Value TRUE = new Value(Type.BOOL, Boolean.TRUE);
    private static final Value FALSE = new Value(Type.BOOL, Boolean.FALSE);

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value nil() { return NIL; }
    public static Value number(int n) { return new Value(Type.NUMBER, n); }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value function(UserFunction fn) { return new Value(Type.FUNCTION, fn); }
    public static Value builtin(Builtin fn) { return new Value(Type.BUILTIN, fn); }

    /** Token literal payload to runtime value: absent, Integer or Boolean. */
    public static Value fromLiteral(Object literal) {
        if (literal == null) return nil();
        if (literal instanceof Integer) return number((Integer) literal);
        if (literal instanceof Boolean) return bool((Boolean) literal);
        throw new IllegalArgumentException("Unsupported literal value: " + literal);
    }

    public Type getType() { return type; }

    public boolean isNil() { return type == Type.NIL; }

    public int asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + typeName());
        return (Integer) value;
    }

    public boolean asBool() {
        if (type != Type.BOOL) throw new IllegalStateException("Expected boolean, got " + typeName());
        return (Boolean) value;
    }

    public UserFunction asFunction() {
        if (type != Type.FUNCTION) throw new IllegalStateException("Expected function, got " + typeName());
        return (UserFunction) value;
    }

    public Builtin asBuiltin() {
        if (type != Type.BUILTIN) throw new IllegalStateException("Expected builtin, got " + typeName());
        return (Builtin) value;
    }

    /** Name used in type-mismatch diagnostics. */
    public String typeName() {
        switch (type) {
            case NIL: return "nil";
            case NUMBER: return "number";
            case BOOL: return "boolean";
            case FUNCTION: return "function";
            default: return "builtin";
        }
    }

    /** Strict equality: different kinds never match, callables compare by identity. */
    public boolean isEqual(Value other) {
        if (other == null || type != other.type) return false;
        switch (type) {
            case NIL: return true;
            case NUMBER:
            case BOOL:
                return value.equals(other.value);
            default:
                return value == other.value;
        }
    }

    /** String form used by print(). */
    @Override
    public String toString() {
        switch (type) {
            case NIL: return "nil";
            case NUMBER: return Integer.toString(asNumber());
            case BOOL: return asBool() ? "true" : "false";
            case FUNCTION: return "function";
            default: return "builtin";
        }
    }
}
