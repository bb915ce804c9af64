package com.typstparser.diagnostics;

import com.typstparser.ast.ByteRange;
import com.typstparser.lower.RangeNormalizer;
import com.typstparser.syntax.SyntaxError;
import com.typstparser.syntax.SyntaxKind;
import com.typstparser.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DiagnosticsCollectorTest {

    @Test
    void testTreeWithoutErrors() {
        SyntaxNode root = SyntaxNode.inner(SyntaxKind.MARKUP, List.of(SyntaxNode.leaf(SyntaxKind.TEXT, "hi")));
        assertEquals(List.of(), DiagnosticsCollector.collect(root, new RangeNormalizer(root)));
    }

    @Test
    void testErrorsAreOrderedByStart() {
        // The zero-length error closing the strong shares its start with the next one
        SyntaxNode late = SyntaxNode.inner(SyntaxKind.STRONG, List.of(
            SyntaxNode.leaf(SyntaxKind.STAR, "*"),
            SyntaxNode.leaf(SyntaxKind.TEXT, "abc"),
            SyntaxNode.error(new SyntaxError("unclosed delimiter"), "")));
        SyntaxNode root = SyntaxNode.inner(SyntaxKind.MARKUP, List.of(
            SyntaxNode.error(new SyntaxError("first"), "x"),
            late,
            SyntaxNode.error(new SyntaxError("last"), "y")));

        List<ParseError> errors = DiagnosticsCollector.collect(root, new RangeNormalizer(root));

        assertEquals(List.of(
            new ParseError("first", new ByteRange(0, 1)),
            new ParseError("unclosed delimiter", new ByteRange(5, 5)),
            new ParseError("last", new ByteRange(5, 6))
        ), errors);
    }

    @Test
    void testMessageFormat() {
        ParseError error = new ParseError("expected expression", new ByteRange(3, 3));
        assertEquals("[3, 3]: expected expression", error.toString());
    }
}
