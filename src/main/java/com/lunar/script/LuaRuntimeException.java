package com.lunar.script;

/**
 * A runtime error raised while evaluating a script: an operator with no
 * applicable metamethod, a call of a non-callable value, an unbound name, ...
 *
 * Built-in functions may throw this too, to fail the running script with a
 * message of their own.
 */
public class LuaRuntimeException extends LuaException {

    private static final long serialVersionUID = 1L;

    public enum Kind {
        OPERATION_UNSUPPORTED,
        CANNOT_APPLY_LENGTH,
        CANNOT_INDEX,
        NOT_CALLABLE,
        CANNOT_COMPARE,
        FOR_BOUNDS_NOT_NUMBERS,
        UNBOUND_VARIABLE,
        INVALID_KEY,
        CALL_DEPTH_EXCEEDED,
        INDEX_CHAIN_TOO_DEEP,
        /** Raised by host built-ins. */
        HOST
    }

    private final Kind kind;

    public LuaRuntimeException(String message) {
        this(Kind.HOST, message);
    }

    public LuaRuntimeException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public Kind getKind() {
        return kind;
    }
}
