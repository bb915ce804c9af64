package com.typstparser.syntax;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class LexerTest {

    private static List<SyntaxKind> kinds(String text, LexMode mode) {
        Lexer lexer = new Lexer(text, mode);
        List<SyntaxKind> kinds = new ArrayList<>();
        SyntaxNode token;
        do {
            token = lexer.next();
            kinds.add(token.kind());
        } while (token.kind() != SyntaxKind.END);
        return kinds;
    }

    @Test
    void testCodeTokens() {
        assertEquals(List.of(SyntaxKind.LET, SyntaxKind.SPACE, SyntaxKind.IDENT, SyntaxKind.SPACE,
                SyntaxKind.EQ, SyntaxKind.SPACE, SyntaxKind.INT, SyntaxKind.END),
            kinds("let x = 1", LexMode.CODE));
    }

    @Test
    void testCodeOperators() {
        List<SyntaxKind> operators = kinds("== => += .. <=", LexMode.CODE).stream()
            .filter(kind -> kind != SyntaxKind.SPACE)
            .toList();
        assertEquals(List.of(SyntaxKind.EQ_EQ, SyntaxKind.ARROW, SyntaxKind.PLUS_EQ, SyntaxKind.DOTS,
            SyntaxKind.LT_EQ, SyntaxKind.END), operators);
    }

    @Test
    void testInvalidCodeCharacter() {
        SyntaxNode token = new Lexer("#", LexMode.CODE).next();
        assertEquals(SyntaxKind.ERROR, token.kind());
        assertTrue(token.error().message().contains("not valid in code"));
    }

    @Test
    void testMathTokens() {
        assertEquals(SyntaxKind.MATH_IDENT, kinds("ab", LexMode.MATH).get(0));
        assertEquals(SyntaxKind.INT, kinds("12", LexMode.MATH).get(0));
        assertEquals(SyntaxKind.MATH_TEXT, kinds("12.5", LexMode.MATH).get(0));
        assertEquals(SyntaxKind.ROOT, kinds("√", LexMode.MATH).get(0));
        assertEquals(SyntaxKind.MATH_SHORTHAND, kinds("->", LexMode.MATH).get(0));
    }

    @Test
    void testTokenLengthsAreUtf8() {
        SyntaxNode token = new Lexer("√", LexMode.MATH).next();
        assertEquals(3, token.len());
    }

    @Test
    void testIdentifiers() {
        assertTrue(Lexer.isIdent("foo"));
        assertTrue(Lexer.isIdent("foo-bar_2"));
        assertFalse(Lexer.isIdent("2foo"));
        assertFalse(Lexer.isIdent(""));
    }
}
