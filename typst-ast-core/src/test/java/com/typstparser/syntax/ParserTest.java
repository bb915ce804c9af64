package com.typstparser.syntax;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    private static List<SyntaxKind> childKinds(SyntaxNode node) {
        return node.children().stream().map(SyntaxNode::kind).toList();
    }

    @Test
    void testHeadingShape() {
        SyntaxNode root = Parser.parseMarkup("= Title");
        assertEquals(SyntaxKind.MARKUP, root.kind());

        SyntaxNode heading = root.children().get(0);
        assertEquals(SyntaxKind.HEADING, heading.kind());
        assertEquals(List.of(SyntaxKind.HEADING_MARKER, SyntaxKind.SPACE, SyntaxKind.MARKUP), childKinds(heading));
    }

    @Test
    void testEquationShape() {
        SyntaxNode equation = Parser.parseMarkup("$ x $").children().get(0);
        assertEquals(List.of(SyntaxKind.DOLLAR, SyntaxKind.SPACE, SyntaxKind.MATH, SyntaxKind.SPACE, SyntaxKind.DOLLAR),
            childKinds(equation));
    }

    @Test
    void testBinaryPrecedence() {
        SyntaxNode code = Parser.parseCode("1 + 2 * 3");
        SyntaxNode sum = code.children().get(0);
        assertEquals(SyntaxKind.BINARY, sum.kind());

        SyntaxNode product = sum.children().get(sum.children().size() - 1);
        assertEquals(SyntaxKind.BINARY, product.kind());
        assertEquals("2 * 3", product.fullText());
    }

    @Test
    void testDestructuringVersusParentheses() {
        SyntaxNode parens = Parser.parseCode("let (a) = b").children().get(0);
        assertTrue(childKinds(parens).contains(SyntaxKind.PARENTHESIZED));

        SyntaxNode destructuring = Parser.parseCode("let (a,) = b").children().get(0);
        assertTrue(childKinds(destructuring).contains(SyntaxKind.DESTRUCTURING));
    }

    @Test
    void testErrorsAreEmbedded() {
        SyntaxNode root = Parser.parseMarkup("*open");
        assertTrue(root.erroneous());
        assertEquals(List.of("unclosed delimiter"),
            root.errors().stream().map(SyntaxError::message).toList());
        assertEquals("*open", root.fullText());
    }

    @Test
    void testLengthIsUtf8() {
        assertEquals(7, Parser.parseMarkup("Grüße").len());
    }
}
