package com.lunar.script.parser;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import com.lunar.debug.Debug;

/**
 * Pull tokenizer. {@link #token()} is the current token; {@link #advance()}
 * moves to the next one. The stream ends with an EOF token, which repeats on
 * further advances. Bad input produces an ERROR token instead of an exception,
 * leaving the parser to report it.
 */
public class Scanner {
    private static final String TAG = "scanner";

    private static final Map<String, TokenType> keywords;
    static {
        Map<String, TokenType> map = new HashMap<>();
        for (TokenType t : TokenType.values()) {
            if (t.compareTo(TokenType.AND) >= 0 && t.compareTo(TokenType.WHILE) <= 0) {
                map.put(t.text, t);
            }
        }
        keywords = Collections.unmodifiableMap(map);
    }

    private final String source;
    private int start = 0;
    private int current = 0;
    private Token token;

    public Scanner(String source) {
        this.source = source;
        if (source.startsWith("#")) {
            // shebang line
            while (current < source.length() && source.charAt(current) != '\n') current++;
        }
        advance();
    }

    public Token token() {
        return token;
    }

    public void advance() {
        token = nextToken();
        if (token.type == TokenType.ERROR) {
            Debug.get().d(TAG, "error token at " + token.offset + ": " + token.literal);
        }
    }

    /** Drains the remaining tokens, EOF included. */
    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            tokens.add(token);
            if (token.type == TokenType.EOF) return tokens;
            advance();
        }
    }

    private Token nextToken() {
        Token skipped = skipWhitespaceAndComments();
        if (skipped != null) return skipped;

        start = current;
        if (isAtEnd()) return new Token(TokenType.EOF, "", null, current);

        char c = advanceChar();
        switch (c) {
            case '(': return make(TokenType.LEFT_PAREN);
            case ')': return make(TokenType.RIGHT_PAREN);
            case '{': return make(TokenType.LEFT_BRACE);
            case '}': return make(TokenType.RIGHT_BRACE);
            case ']': return make(TokenType.RIGHT_BRACKET);
            case ';': return make(TokenType.SEMICOLON);
            case ':': return make(TokenType.COLON);
            case ',': return make(TokenType.COMMA);
            case '+': return make(TokenType.PLUS);
            case '-': return make(TokenType.MINUS);
            case '*': return make(TokenType.STAR);
            case '/': return make(TokenType.SLASH);
            case '%': return make(TokenType.PERCENT);
            case '^': return make(TokenType.CARET);
            case '#': return make(TokenType.HASH);
            case '=': return make(match('=') ? TokenType.EQUAL_EQUAL : TokenType.EQUAL);
            case '<': return make(match('=') ? TokenType.LESS_EQUAL : TokenType.LESS);
            case '>': return make(match('=') ? TokenType.GREATER_EQUAL : TokenType.GREATER);
            case '~':
                if (match('=')) return make(TokenType.TILDE_EQUAL);
                return error("unexpected character '~'");
            case '.':
                if (match('.')) {
                    return make(match('.') ? TokenType.DOTS : TokenType.CONCAT);
                }
                return make(TokenType.DOT);
            case '[': {
                int level = longBracketLevel(current - 1);
                if (level < 0) return make(TokenType.LEFT_BRACKET);
                return longString(level);
            }
            case '"':
            case '\'':
                return quotedString(c);
            default:
                if (isDigit(c)) return number();
                if (isAlpha(c)) return identifier();
                return error("unexpected character '" + c + "'");
        }
    }

    /** Returns an ERROR token for an unterminated block comment, else null. */
    private Token skipWhitespaceAndComments() {
        while (!isAtEnd()) {
            char c = peek();
            if (c == ' ' || c == '\t' || c == '\r' || c == '\n' || c == '\f') {
                current++;
            } else if (c == '-' && peekNext() == '-') {
                start = current;
                current += 2;
                int level = (peek() == '[') ? longBracketLevel(current) : -1;
                if (level >= 0) {
                    current += level + 2;
                    if (!skipToLongBracketClose(level)) return error("unfinished long comment");
                } else {
                    while (!isAtEnd() && peek() != '\n') current++;
                }
            } else {
                return null;
            }
        }
        return null;
    }

    /**
     * If a long bracket {@code [[}, {@code [=[}, ... opens at {@code pos}, its
     * level (number of '='), otherwise -1. Does not move the cursor.
     */
    private int longBracketLevel(int pos) {
        if (pos >= source.length() || source.charAt(pos) != '[') return -1;
        int p = pos + 1;
        int level = 0;
        while (p < source.length() && source.charAt(p) == '=') {
            level++;
            p++;
        }
        return (p < source.length() && source.charAt(p) == '[') ? level : -1;
    }

    /** Moves past the matching close bracket; false if the source ends first. */
    private boolean skipToLongBracketClose(int level) {
        while (!isAtEnd()) {
            if (peek() == ']' && closesLongBracket(current, level)) {
                current += level + 2;
                return true;
            }
            current++;
        }
        return false;
    }

    private boolean closesLongBracket(int pos, int level) {
        int p = pos + 1;
        for (int i = 0; i < level; i++, p++) {
            if (p >= source.length() || source.charAt(p) != '=') return false;
        }
        return p < source.length() && source.charAt(p) == ']';
    }

    private Token longString(int level) {
        current = start + level + 2;
        // a newline directly after the opening bracket is not part of the string
        if (peek() == '\r' && peekNext() == '\n') current += 2;
        else if (peek() == '\n') current++;
        int contentStart = current;
        if (!skipToLongBracketClose(level)) return error("unfinished long string");
        String text = source.substring(contentStart, current - level - 2);
        return make(TokenType.STRING, text);
    }

    private Token quotedString(char quote) {
        StringBuilder sb = new StringBuilder();
        while (!isAtEnd() && peek() != quote) {
            char c = advanceChar();
            if (c != '\\') {
                sb.append(c);
                continue;
            }
            if (isAtEnd()) break;
            char e = advanceChar();
            switch (e) {
                case 'b': sb.append('\b'); break;
                case 'f': sb.append('\f'); break;
                case 'n': sb.append('\n'); break;
                case 'r': sb.append('\r'); break;
                case 't': sb.append('\t'); break;
                case 'u': {
                    if (current + 4 > source.length()) return error("malformed \\u escape");
                    String hex = source.substring(current, current + 4);
                    int cp = 0;
                    for (int i = 0; i < 4; i++) {
                        int digit = Character.digit(hex.charAt(i), 16);
                        if (digit < 0) return error("malformed \\u escape '\\u" + hex + "'");
                        cp = cp * 16 + digit;
                    }
                    current += 4;
                    sb.append((char) cp);
                    break;
                }
                default:
                    sb.append(e);
            }
        }
        if (isAtEnd()) return error("unfinished string");
        current++; // closing quote
        return make(TokenType.STRING, sb.toString());
    }

    private Token number() {
        while (isDigit(peek())) current++;
        if (peek() == '.' && isDigit(peekNext())) {
            current++;
            while (isDigit(peek())) current++;
        }
        return make(TokenType.NUMBER, Double.parseDouble(source.substring(start, current)));
    }

    private Token identifier() {
        while (isAlphaNumeric(peek())) current++;
        String text = source.substring(start, current);
        TokenType type = keywords.get(text);
        if (type == null) return make(TokenType.NAME, text);
        return make(type);
    }

    private boolean isAtEnd() { return current >= source.length(); }
    private char advanceChar() { return source.charAt(current++); }

    private boolean match(char expected) {
        if (isAtEnd()) return false;
        if (source.charAt(current) != expected) return false;
        current++;
        return true;
    }

    private char peek() { return isAtEnd() ? '\0' : source.charAt(current); }
    private char peekNext() { return (current + 1 >= source.length()) ? '\0' : source.charAt(current + 1); }

    private boolean isDigit(char c) { return c >= '0' && c <= '9'; }
    private boolean isAlpha(char c) {
        return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
    }
    private boolean isAlphaNumeric(char c) { return isAlpha(c) || isDigit(c); }

    private Token make(TokenType type) { return make(type, null); }
    private Token make(TokenType type, Object literal) {
        return new Token(type, source.substring(start, current), literal, start);
    }

    private Token error(String reason) {
        return new Token(TokenType.ERROR, source.substring(start, Math.min(current, source.length())), reason, start);
    }
}
