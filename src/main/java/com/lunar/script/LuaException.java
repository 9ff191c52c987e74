package com.lunar.script;

/**
 * An error raised while compiling or running a script.
 * {@link LuaSyntaxException} is raised by the scanner/parser,
 * {@link LuaRuntimeException} by the value model and the interpreter.
 * Both abort the current parse or run; the engine never retries.
 */
public class LuaException extends RuntimeException {

    private static final long serialVersionUID = 1L;

    public LuaException(String message) {
        super(message);
    }

    public LuaException(String message, Throwable cause) {
        super(message, cause);
    }
}
