package com.lunar.script.parser;

public enum TokenType {
    // Single/multi-character punctuation
    LEFT_PAREN("("), RIGHT_PAREN(")"), LEFT_BRACE("{"), RIGHT_BRACE("}"),
    LEFT_BRACKET("["), RIGHT_BRACKET("]"), SEMICOLON(";"), COLON(":"), COMMA(","),
    DOT("."), CONCAT(".."), DOTS("..."),
    PLUS("+"), MINUS("-"), STAR("*"), SLASH("/"), PERCENT("%"), CARET("^"), HASH("#"),
    EQUAL("="), EQUAL_EQUAL("=="), TILDE_EQUAL("~="),
    LESS("<"), LESS_EQUAL("<="), GREATER(">"), GREATER_EQUAL(">="),

    // Keywords
    AND("and"), BREAK("break"), DO("do"), ELSE("else"), ELSEIF("elseif"), END("end"),
    FALSE("false"), FOR("for"), FUNCTION("function"), IF("if"), IN("in"), LOCAL("local"),
    NIL("nil"), NOT("not"), OR("or"), REPEAT("repeat"), RETURN("return"), THEN("then"),
    TRUE("true"), UNTIL("until"), WHILE("while"),

    // Literals and names
    NAME("<name>"), NUMBER("<number>"), STRING("<string>"),

    /** An unrecognized character or malformed literal; the literal holds the reason. */
    ERROR("<error>"),
    EOF("<eof>");

    public final String text;

    TokenType(String text) {
        this.text = text;
    }
}
