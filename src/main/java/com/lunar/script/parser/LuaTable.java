package com.lunar.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.lunar.script.LuaRuntimeException;
import com.lunar.script.LuaRuntimeException.Kind;

/**
 * Associative array with an optional metatable.
 *
 * All accessors here are raw: they never consult the metatable. A key mapped
 * to nil is absent, so {@code rawSet(k, nil)} removes the entry.
 */
public final class LuaTable {
    private final LinkedHashMap<Value, Value> fields = new LinkedHashMap<>();
    private LuaTable metatable;

    public LuaTable() {}

    /** Builds a list-style table: the values land at keys 1..n. Nil values leave holes. */
    public static LuaTable of(List<Value> values) {
        LuaTable t = new LuaTable();
        for (int i = 0; i < values.size(); i++) {
            t.rawSet(Value.number(i + 1), values.get(i));
        }
        return t;
    }

    public Value rawGet(Value key) {
        Value v = fields.get(key);
        return v == null ? Value.NIL : v;
    }

    public Value rawGet(String key) { return rawGet(Value.string(key)); }
    public Value rawGet(double key) { return rawGet(Value.number(key)); }

    public void rawSet(Value key, Value value) {
        if (key.isNil()) {
            throw new LuaRuntimeException(Kind.INVALID_KEY, "table index is nil");
        }
        if (key.isNumber() && Double.isNaN(key.asNumber())) {
            throw new LuaRuntimeException(Kind.INVALID_KEY, "table index is NaN");
        }
        if (value.isNil()) {
            fields.remove(key);
        } else {
            fields.put(key, value);
        }
    }

    public void rawSet(String key, Value value) { rawSet(Value.string(key), value); }
    public void rawSet(double key, Value value) { rawSet(Value.number(key), value); }

    public boolean containsKey(Value key) {
        return fields.containsKey(key);
    }

    /** Number of present keys, array-style or not. */
    public int size() {
        return fields.size();
    }

    /**
     * The border: the largest n such that keys 1..n are all present, found by a
     * linear scan from 1. For sparse tables this is not the key count.
     */
    public int length() {
        int n = 0;
        while (fields.containsKey(Value.number(n + 1))) {
            n++;
        }
        return n;
    }

    /**
     * Iteration step in insertion order: the entry following {@code key}, the
     * first entry for nil, or null once the table is exhausted (or the key is absent).
     */
    public Map.Entry<Value, Value> next(Value key) {
        Iterator<Map.Entry<Value, Value>> it = fields.entrySet().iterator();
        if (!key.isNil()) {
            boolean found = false;
            while (it.hasNext()) {
                if (it.next().getKey().equals(key)) {
                    found = true;
                    break;
                }
            }
            if (!found) return null;
        }
        return it.hasNext() ? it.next() : null;
    }

    public List<Value> keys() {
        return new ArrayList<>(fields.keySet());
    }

    public Map<Value, Value> entries() {
        return Collections.unmodifiableMap(fields);
    }

    public LuaTable getMetatable() {
        return metatable;
    }

    public void setMetatable(LuaTable metatable) {
        this.metatable = metatable;
    }

    @Override
    public String toString() {
        return "table: 0x" + String.format("%08x", System.identityHashCode(this));
    }
}
