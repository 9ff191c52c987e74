package com.lunar.script.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import com.lunar.script.LuaRuntimeException;
import com.lunar.script.LuaRuntimeException.Kind;
import com.lunar.script.parser.Expr.BinaryOp;

/**
 * Operator, index and call semantics with metatable dispatch.
 *
 * Plain operands (numbers for arithmetic, numbers and strings for
 * comparison and concatenation) are handled directly. Anything else looks
 * for an event handler ({@code __add}, {@code __index}, ...) in the first
 * operand's metatable, then in the second's, and calls it with the original
 * operands.
 */
public final class Operators {
    private final ExecutionState state;
    private final Interpreter interpreter;

    Operators(ExecutionState state, Interpreter interpreter) {
        this.state = state;
        this.interpreter = interpreter;
    }

    // -------------------------
    // Arithmetic
    // -------------------------

    public Value add(Value a, Value b) { return arithmetic(BinaryOp.ADD, a, b); }
    public Value sub(Value a, Value b) { return arithmetic(BinaryOp.SUB, a, b); }
    public Value mul(Value a, Value b) { return arithmetic(BinaryOp.MUL, a, b); }
    public Value div(Value a, Value b) { return arithmetic(BinaryOp.DIV, a, b); }
    public Value mod(Value a, Value b) { return arithmetic(BinaryOp.MOD, a, b); }
    public Value pow(Value a, Value b) { return arithmetic(BinaryOp.POW, a, b); }

    public Value arithmetic(BinaryOp op, Value a, Value b) {
        if (a.isNumber() && b.isNumber()) {
            double x = a.asNumber();
            double y = b.asNumber();
            switch (op) {
                case ADD: return Value.number(x + y);
                case SUB: return Value.number(x - y);
                case MUL: return Value.number(x * y);
                case DIV: return Value.number(x / y);
                case MOD: return Value.number(x - Math.floor(x / y) * y);
                case POW: return Value.number(Math.pow(x, y));
                default: throw new IllegalArgumentException("Not an arithmetic operator: " + op);
            }
        }
        return binaryEvent(a, b, eventName(op), operationName(op));
    }

    public Value unm(Value a) {
        if (a.isNumber()) return Value.number(-a.asNumber());
        Value h = state.handler(a, "__unm");
        if (h != null) return call1(h, a);
        throw new LuaRuntimeException(Kind.OPERATION_UNSUPPORTED, "cannot negate " + describe(a));
    }

    public Value concat(Value a, Value b) {
        if (a.isConcatenable() && b.isConcatenable()) {
            return Value.string(a.toString() + b.toString());
        }
        return binaryEvent(a, b, "__concat", "concatenate");
    }

    public Value len(Value a) {
        if (a.isString()) return Value.number(a.asString().length());
        Value h = state.handler(a, "__len");
        if (h != null) return call1(h, a);
        if (a.isTable()) return Value.number(a.asTable().length());
        throw new LuaRuntimeException(Kind.CANNOT_APPLY_LENGTH, "cannot apply length to " + describe(a));
    }

    // -------------------------
    // Comparison
    // -------------------------

    /**
     * Identical values are equal. Otherwise an {@code __eq} handler decides,
     * but only if both operands have the same type and resolve to the very
     * same handler.
     */
    public boolean eq(Value a, Value b) {
        // NaN is not equal to itself, even for the same Value instance
        if (a.isNumber() && b.isNumber()) return a.asNumber() == b.asNumber();
        if (a.equals(b)) return true;
        if (a.getType() != b.getType()) return false;
        Value h1 = state.handler(a, "__eq");
        Value h2 = state.handler(b, "__eq");
        if (h1 == null || !h1.equals(h2)) return false;
        return call1(h1, a, b).isTruthy();
    }

    public boolean lt(Value a, Value b) {
        if (a.isNumber() && b.isNumber()) return a.asNumber() < b.asNumber();
        if (a.isString() && b.isString()) return a.asString().compareTo(b.asString()) < 0;
        Value h = binaryHandler(a, b, "__lt");
        if (h != null) return call1(h, a, b).isTruthy();
        throw cannotCompare(a, "<", b);
    }

    /** Without {@code __le}, falls back to {@code not (b < a)} through {@code __lt}. */
    public boolean le(Value a, Value b) {
        if (a.isNumber() && b.isNumber()) return a.asNumber() <= b.asNumber();
        if (a.isString() && b.isString()) return a.asString().compareTo(b.asString()) <= 0;
        Value h = binaryHandler(a, b, "__le");
        if (h != null) return call1(h, a, b).isTruthy();
        h = binaryHandler(a, b, "__lt");
        if (h != null) return !call1(h, b, a).isTruthy();
        throw cannotCompare(a, "<=", b);
    }

    /**
     * {@code a > b} is {@code not (a <= b)}, so a NaN operand makes it true
     * and an {@code __le} handler decides it.
     */
    public boolean gt(Value a, Value b) {
        return !le(a, b);
    }

    /** {@code a >= b} is {@code not (a < b)}. */
    public boolean ge(Value a, Value b) {
        return !lt(a, b);
    }

    // -------------------------
    // Indexing
    // -------------------------

    /**
     * {@code t[k]}. A present table key wins; otherwise {@code __index} is
     * consulted: a function handler is called with {@code (t, k)}, any other
     * handler is indexed in turn. A table without a handler yields nil.
     */
    public Value index(Value table, Value key) {
        return index(table, key, 0);
    }

    private Value index(Value table, Value key, int depth) {
        checkChainDepth(depth, table, key);
        Value h;
        if (table.isTable()) {
            Value v = table.asTable().rawGet(key);
            if (!v.isNil()) return v;
            h = state.handler(table, "__index");
            if (h == null) return Value.NIL;
        } else {
            h = state.handler(table, "__index");
            if (h == null) {
                throw new LuaRuntimeException(Kind.CANNOT_INDEX,
                        "cannot index " + describe(table) + " with key " + describe(key));
            }
        }
        if (h.isFunction()) return call1(h, table, key);
        return index(h, key, depth + 1);
    }

    /** {@code t[k] = v}, routed through {@code __newindex} when the key is absent. */
    public void newIndex(Value table, Value key, Value value) {
        newIndex(table, key, value, 0);
    }

    private void newIndex(Value table, Value key, Value value, int depth) {
        checkChainDepth(depth, table, key);
        Value h;
        if (table.isTable()) {
            LuaTable t = table.asTable();
            if (t.containsKey(key)) {
                t.rawSet(key, value);
                return;
            }
            h = state.handler(table, "__newindex");
            if (h == null) {
                t.rawSet(key, value);
                return;
            }
        } else {
            h = state.handler(table, "__newindex");
            if (h == null) {
                throw new LuaRuntimeException(Kind.CANNOT_INDEX,
                        "cannot set " + describe(table) + " with key " + describe(key));
            }
        }
        if (h.isFunction()) {
            call(h, Arrays.asList(table, key, value));
            return;
        }
        newIndex(h, key, value, depth + 1);
    }

    private void checkChainDepth(int depth, Value table, Value key) {
        int max = state.getMaxIndexChainDepth();
        if (max > 0 && depth > max) {
            throw new LuaRuntimeException(Kind.INDEX_CHAIN_TOO_DEEP,
                    "metatable chain deeper than " + max + " while indexing "
                            + describe(table) + " with key " + describe(key));
        }
    }

    // -------------------------
    // Calls
    // -------------------------

    /**
     * Calls a built-in or user function. Any other value is called through its
     * {@code __call} handler, which receives the value as first argument.
     */
    public List<Value> call(Value fn, List<Value> args) {
        if (fn.isBuiltin()) {
            List<Value> results = fn.asBuiltin().call(args);
            return results == null ? Collections.emptyList() : results;
        }
        if (fn.isUserFunction()) {
            return interpreter.invoke(fn.asUserFunction(), args);
        }
        Value h = state.handler(fn, "__call");
        if (h != null && h.isFunction()) {
            List<Value> withSelf = new ArrayList<>(args.size() + 1);
            withSelf.add(fn);
            withSelf.addAll(args);
            return call(h, withSelf);
        }
        throw new LuaRuntimeException(Kind.NOT_CALLABLE, "cannot call " + describe(fn));
    }

    /** Calls {@code fn} and keeps only the first result, nil if there is none. */
    public Value call1(Value fn, Value... args) {
        return first(call(fn, Arrays.asList(args)));
    }

    public static Value first(List<Value> results) {
        return results.isEmpty() ? Value.NIL : results.get(0);
    }

    // -------------------------
    // Helpers
    // -------------------------

    private Value binaryEvent(Value a, Value b, String event, String operation) {
        Value h = binaryHandler(a, b, event);
        if (h != null) return call1(h, a, b);
        throw new LuaRuntimeException(Kind.OPERATION_UNSUPPORTED,
                "cannot " + operation + " " + describe(a) + " and " + describe(b));
    }

    /** The first operand's handler wins. */
    private Value binaryHandler(Value a, Value b, String event) {
        Value h = state.handler(a, event);
        return (h != null) ? h : state.handler(b, event);
    }

    private LuaRuntimeException cannotCompare(Value a, String op, Value b) {
        return new LuaRuntimeException(Kind.CANNOT_COMPARE,
                "cannot compute " + describe(a) + " " + op + " " + describe(b));
    }

    private static String eventName(BinaryOp op) {
        switch (op) {
            case ADD: return "__add";
            case SUB: return "__sub";
            case MUL: return "__mul";
            case DIV: return "__div";
            case MOD: return "__mod";
            case POW: return "__pow";
            default: throw new IllegalArgumentException("Not an arithmetic operator: " + op);
        }
    }

    private static String operationName(BinaryOp op) {
        switch (op) {
            case ADD: return "add";
            case SUB: return "subtract";
            case MUL: return "multiply";
            case DIV: return "divide";
            case MOD: return "apply modulo to";
            case POW: return "raise";
            default: throw new IllegalArgumentException("Not an arithmetic operator: " + op);
        }
    }

    /** "nil", "number 3", "string 'abc'", "table: 0x..." */
    static String describe(Value v) {
        switch (v.getType()) {
            case NUMBER: return "number " + v;
            case STRING: return "string '" + v + "'";
            case BOOLEAN: return "boolean " + v;
            default: return v.toString();
        }
    }
}
