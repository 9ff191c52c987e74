package com.lunar.script.parser;

public class Token {
    public final TokenType type;
    public final String lexeme;
    /** Double for NUMBER, decoded text for STRING, the reason for ERROR, else null. */
    public final Object literal;
    /** 0-based character offset of the token's first character. */
    public final int offset;

    Token(TokenType type, String lexeme, Object literal, int offset) {
        this.type = type;
        this.lexeme = lexeme;
        this.literal = literal;
        this.offset = offset;
    }

    @Override
    public String toString() {
        return type + " '" + lexeme + "' @" + offset;
    }
}
