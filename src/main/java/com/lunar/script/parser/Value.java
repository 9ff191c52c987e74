package com.lunar.script.parser;

import java.math.BigDecimal;
import java.math.MathContext;

import com.lunar.script.LunarScript.BuiltinFunction;

/**
 * A runtime value: nil, boolean, number, string, table or function.
 *
 * Nil, booleans, numbers and strings compare by value. Tables and functions
 * compare by identity of the wrapped {@link LuaTable} / function object, so
 * a Value is usable as a table key.
 */
public final class Value {
    public enum Type { NIL, BOOLEAN, NUMBER, STRING, TABLE, FUNCTION }

    public static final Value NIL = new Value(Type.NIL, null);
    public static final Value TRUE = new Value(Type.BOOLEAN, Boolean.TRUE);
    public static final Value FALSE = new Value(Type.BOOLEAN, Boolean.FALSE);

    private static final MathContext PRINT_PRECISION = new MathContext(14);
    private static final double MAX_EXACT_INTEGER = 9007199254740992.0; // 2^53

    public final Type type;
    public final Object value;

    private Value(Type type, Object value) {
        this.type = type;
        this.value = value;
    }

    public static Value nil() { return NIL; }
    public static Value bool(boolean b) { return b ? TRUE : FALSE; }
    public static Value number(double d) { return new Value(Type.NUMBER, d); }
    public static Value table(LuaTable t) { return new Value(Type.TABLE, requireNonNull(t)); }
    public static Value function(BuiltinFunction fn) { return new Value(Type.FUNCTION, requireNonNull(fn)); }
    public static Value function(UserFunction fn) { return new Value(Type.FUNCTION, requireNonNull(fn)); }

    public static Value string(String s) {
        return new Value(Type.STRING, requireNonNull(s));
    }

    private static <T> T requireNonNull(T payload) {
        if (payload == null) throw new IllegalArgumentException("Value payload must not be null; use Value.nil()");
        return payload;
    }

    public Type getType() { return type; }

    public boolean isNil() { return type == Type.NIL; }
    public boolean isNumber() { return type == Type.NUMBER; }
    public boolean isString() { return type == Type.STRING; }
    public boolean isTable() { return type == Type.TABLE; }
    public boolean isFunction() { return type == Type.FUNCTION; }
    public boolean isBuiltin() { return value instanceof BuiltinFunction; }
    public boolean isUserFunction() { return value instanceof UserFunction; }

    /** Everything except nil and false. */
    public boolean isTruthy() {
        return type != Type.NIL && value != Boolean.FALSE;
    }

    public double asNumber() {
        if (type != Type.NUMBER) throw new IllegalStateException("Expected number, got " + typeName());
        return (Double) value;
    }

    public boolean asBool() {
        if (type != Type.BOOLEAN) throw new IllegalStateException("Expected boolean, got " + typeName());
        return (Boolean) value;
    }

    public String asString() {
        if (type != Type.STRING) throw new IllegalStateException("Expected string, got " + typeName());
        return (String) value;
    }

    public LuaTable asTable() {
        if (type != Type.TABLE) throw new IllegalStateException("Expected table, got " + typeName());
        return (LuaTable) value;
    }

    public BuiltinFunction asBuiltin() {
        if (!isBuiltin()) throw new IllegalStateException("Expected built-in function, got " + typeName());
        return (BuiltinFunction) value;
    }

    public UserFunction asUserFunction() {
        if (!isUserFunction()) throw new IllegalStateException("Expected user function, got " + typeName());
        return (UserFunction) value;
    }

    /** The type name scripts see: nil, boolean, number, string, table, function. */
    public String typeName() {
        switch (type) {
            case NIL: return "nil";
            case BOOLEAN: return "boolean";
            case NUMBER: return "number";
            case STRING: return "string";
            case TABLE: return "table";
            default: return "function";
        }
    }

    /** Numbers and strings take part in concatenation without metamethods. */
    public boolean isConcatenable() {
        return type == Type.NUMBER || type == Type.STRING;
    }

    /**
     * Canonical string form: integral numbers without a decimal point, strings
     * unquoted, tables and functions by identity.
     */
    @Override
    public String toString() {
        switch (type) {
            case NIL: return "nil";
            case BOOLEAN: return value.toString();
            case NUMBER: return numberToString((Double) value);
            case STRING: return (String) value;
            case TABLE: return "table: 0x" + identityHex();
            default: return "function: 0x" + identityHex();
        }
    }

    private String identityHex() {
        return String.format("%08x", System.identityHashCode(value));
    }

    public static String numberToString(double d) {
        if (Double.isNaN(d)) return "nan";
        if (Double.isInfinite(d)) return d > 0 ? "inf" : "-inf";
        if (d == Math.rint(d) && Math.abs(d) <= MAX_EXACT_INTEGER) {
            return Long.toString((long) d);
        }
        return new BigDecimal(d).round(PRINT_PRECISION).stripTrailingZeros().toPlainString();
    }

    /** Raw equality, no metamethods. */
    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Value)) return false;
        Value other = (Value) o;
        if (type != other.type) return false;
        switch (type) {
            case NIL:
                return true;
            case NUMBER:
                return ((Double) value).doubleValue() == ((Double) other.value).doubleValue();
            case BOOLEAN:
            case STRING:
                return value.equals(other.value);
            default:
                return value == other.value;
        }
    }

    @Override
    public int hashCode() {
        switch (type) {
            case NIL:
                return 0;
            case NUMBER: {
                double d = (Double) value;
                return d == 0.0 ? 0 : Double.hashCode(d);
            }
            case BOOLEAN:
            case STRING:
                return value.hashCode();
            default:
                return System.identityHashCode(value);
        }
    }
}
