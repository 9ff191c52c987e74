package com.lunar.script.parser;

/**
 * Per-engine runtime state threaded through evaluation.
 *
 * Holds the metatables shared by every value of a kind (all numbers share
 * one, all strings another, ...) and the engine limits. Nothing here is
 * static: two engines never see each other's metatables.
 */
public class ExecutionState {

    public static final int DEFAULT_MAX_CALL_DEPTH = 200;
    public static final int DEFAULT_MAX_INDEX_CHAIN_DEPTH = 100;

    private final LuaTable numberMetatable = new LuaTable();
    private final LuaTable booleanMetatable = new LuaTable();
    private final LuaTable stringMetatable = new LuaTable();
    private final LuaTable functionMetatable = new LuaTable();

    private int maxCallDepth = DEFAULT_MAX_CALL_DEPTH;
    private int maxIndexChainDepth = DEFAULT_MAX_INDEX_CHAIN_DEPTH;

    public LuaTable numberMetatable() { return numberMetatable; }
    public LuaTable booleanMetatable() { return booleanMetatable; }
    public LuaTable stringMetatable() { return stringMetatable; }
    public LuaTable functionMetatable() { return functionMetatable; }

    /** The metatable governing {@code v}, or null (nil, or a table without one). */
    public LuaTable metatableOf(Value v) {
        switch (v.getType()) {
            case NUMBER: return numberMetatable;
            case BOOLEAN: return booleanMetatable;
            case STRING: return stringMetatable;
            case FUNCTION: return functionMetatable;
            case TABLE: return v.asTable().getMetatable();
            default: return null;
        }
    }

    /** The handler registered for {@code event} in {@code v}'s metatable, or null. */
    public Value handler(Value v, String event) {
        LuaTable mt = metatableOf(v);
        if (mt == null) return null;
        Value h = mt.rawGet(event);
        return h.isNil() ? null : h;
    }

    public int getMaxCallDepth() { return maxCallDepth; }

    /** A value {@code <= 0} disables the check. */
    public void setMaxCallDepth(int maxCallDepth) { this.maxCallDepth = maxCallDepth; }

    public int getMaxIndexChainDepth() { return maxIndexChainDepth; }

    /** A value {@code <= 0} disables the check; a cyclic __index chain then recurses until the stack runs out. */
    public void setMaxIndexChainDepth(int maxIndexChainDepth) { this.maxIndexChainDepth = maxIndexChainDepth; }
}
