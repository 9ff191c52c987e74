package com.lunar.script;

/**
 * A syntax error found while scanning or parsing source text.
 * Carries the 0-based source offset of the token the parser stopped at.
 */
public class LuaSyntaxException extends LuaException {

    private static final long serialVersionUID = 1L;

    private final int offset;

    public LuaSyntaxException(String detail, int offset) {
        super("syntax error: " + detail + " at " + offset);
        this.offset = offset;
    }

    public int getOffset() {
        return offset;
    }
}
