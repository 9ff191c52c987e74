import com.lunar.script.parser.Scanner;
import com.lunar.script.parser.Token;
import com.lunar.script.parser.TokenType;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ScannerTest {

    private static List<TokenType> types(String src) {
        List<TokenType> out = new ArrayList<>();
        for (Token t : new Scanner(src).tokenize()) out.add(t.type);
        return out;
    }

    @Test
    void punctuation_and_keywords() {
        assertEquals(
            List.of(TokenType.LOCAL, TokenType.NAME, TokenType.EQUAL, TokenType.NUMBER,
                    TokenType.TILDE_EQUAL, TokenType.NUMBER, TokenType.CONCAT, TokenType.DOTS,
                    TokenType.DOT, TokenType.LESS_EQUAL, TokenType.GREATER_EQUAL,
                    TokenType.EQUAL_EQUAL, TokenType.EOF),
            types("local x = 1 ~= 2 .. ... . <= >= =="));
    }

    @Test
    void offsets_are_zero_based() {
        List<Token> tokens = new Scanner("  foo  bar").tokenize();
        assertEquals(2, tokens.get(0).offset);
        assertEquals("foo", tokens.get(0).literal);
        assertEquals(7, tokens.get(1).offset);
        assertEquals(10, tokens.get(2).offset);
    }

    @Test
    void numbers_with_fraction() {
        List<Token> tokens = new Scanner("12 3.25 7.").tokenize();
        assertEquals(12.0, tokens.get(0).literal);
        assertEquals(3.25, tokens.get(1).literal);
        assertEquals(7.0, tokens.get(2).literal);
        assertEquals(TokenType.DOT, tokens.get(3).type);
    }

    @Test
    void quoted_string_escapes() {
        Token t = new Scanner("'a\\tb\\n\\u0041\\'\\q'").token();
        assertEquals(TokenType.STRING, t.type);
        assertEquals("a\tb\nA'q", t.literal);
    }

    @Test
    void long_strings_drop_first_newline_and_keep_escapes() {
        Token t = new Scanner("[[\nline\\n]]").token();
        assertEquals("line\\n", t.literal);

        Token leveled = new Scanner("[==[a]]b]=]c]==]").token();
        assertEquals("a]]b]=]c", leveled.literal);
    }

    @Test
    void comments_are_skipped() {
        assertEquals(
            List.of(TokenType.NAME, TokenType.NAME, TokenType.EOF),
            types("a -- line comment\n--[[ block\ncomment ]] b --[=[ x ]=]"));
    }

    @Test
    void shebang_line_is_skipped() {
        List<Token> tokens = new Scanner("#!/usr/bin/lua\nreturn").tokenize();
        assertEquals(TokenType.RETURN, tokens.get(0).type);
        assertEquals(15, tokens.get(0).offset);
    }

    @Test
    void bad_input_becomes_error_token() {
        Token unfinished = new Scanner("x = \"abc").tokenize().get(2);
        assertEquals(TokenType.ERROR, unfinished.type);
        assertEquals("unfinished string", unfinished.literal);
        assertEquals(4, unfinished.offset);

        assertEquals("unexpected character '@'", new Scanner("@").token().literal);
        assertEquals("unfinished long string", new Scanner("[[abc").token().literal);
        assertEquals("unfinished long comment", new Scanner("--[[abc").token().literal);
    }

    @Test
    void eof_repeats() {
        Scanner s = new Scanner("");
        assertEquals(TokenType.EOF, s.token().type);
        s.advance();
        assertEquals(TokenType.EOF, s.token().type);
    }

    @Test
    void unicode_escape_needs_four_hex_digits() {
        Token signed = new Scanner("'\\u-001'").token();
        assertEquals(TokenType.ERROR, signed.type);
        assertEquals("malformed \\u escape '\\u-001'", signed.literal);

        assertEquals(TokenType.ERROR, new Scanner("'\\u+0041'").token().type);
        assertEquals(TokenType.ERROR, new Scanner("'\\u12'").token().type);
        assertEquals("\u00e9", new Scanner("'\\u00E9'").token().literal);
    }
}
