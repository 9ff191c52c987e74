package com.lunar.script.parser;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.lunar.script.LuaRuntimeException;
import com.lunar.script.LuaRuntimeException.Kind;

/**
 * One frame of variable bindings plus a link to the enclosing frame.
 *
 * Frames form a tree: a function activation, a loop iteration or a nested
 * block gets a child of the frame it runs in. Closures keep their defining
 * frame alive by reference, so a frame is shared, never copied.
 */
public class Environment {
    public final Environment parent;

    private final Map<String, Value> vars = new LinkedHashMap<>();

    /** A root frame, for the host to populate with globals. */
    public Environment() {
        this.parent = null;
    }

    public Environment(Environment parent) {
        this.parent = parent;
    }

    public Environment childScope() {
        return new Environment(this);
    }

    // -------------------------
    // Vars API
    // -------------------------

    /** Introduces (or overwrites) {@code name} in this frame, shadowing any outer binding. */
    public void bind(String name, Value value) {
        vars.put(name, value == null ? Value.NIL : value);
    }

    /** Overwrites {@code name} in the nearest frame that already binds it. */
    public void update(String name, Value value) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.vars.containsKey(name)) {
                e.vars.put(name, value == null ? Value.NIL : value);
                return;
            }
        }
        throw new LuaRuntimeException(Kind.UNBOUND_VARIABLE, "assignment to unknown variable " + name);
    }

    public Value lookup(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            Value v = e.vars.get(name);
            if (v != null) return v;
        }
        throw new LuaRuntimeException(Kind.UNBOUND_VARIABLE, "reference of unknown variable " + name);
    }

    public boolean exists(String name) {
        for (Environment e = this; e != null; e = e.parent) {
            if (e.vars.containsKey(name)) return true;
        }
        return false;
    }

    public boolean existsInCurrentScope(String name) {
        return vars.containsKey(name);
    }

    /** This frame's bindings, in binding order. */
    public Map<String, Value> snapshot() {
        return Collections.unmodifiableMap(vars);
    }

    public Environment root() {
        Environment e = this;
        while (e.parent != null) e = e.parent;
        return e;
    }
}
