package com.typstparser;

import com.typstparser.ast.AstParseResult;
import com.typstparser.ast.ByteRange;
import com.typstparser.cst.CstNode;
import com.typstparser.cst.CstParseResult;
import com.typstparser.diagnostics.ParseError;
import com.typstparser.syntax.Utf8;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.Arguments;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Properties that hold for every input, well-formed or not.
 */
public class ParseInvariantsTest {

    static Stream<Arguments> sources() {
        return Stream.of(
            Arguments.of("markup", "= Hello\n\nSome *strong* and _emph_ text."),
            Arguments.of("markup", "- one\n- two\n  + nested\n/ Term: description"),
            Arguments.of("markup", "See @intro[chapter] and <label> at https://typst.app"),
            Arguments.of("markup", "```rust\nfn main() {}\n```"),
            Arguments.of("markup", "Quotes \"like\" 'these' -- and \\u{1F600} ~ ..."),
            Arguments.of("markup", "$ sum_(i=0)^n x_i' / 2 $ and $sqrt(x) + (a + b)$"),
            Arguments.of("markup", "#set text(size: 12pt, fill: red) if true\n#show heading: it => [*#it*]"),
            Arguments.of("markup", "#import \"mod.typ\": a, b as c\n#include \"other.typ\""),
            Arguments.of("markup", "Grüße, 世界! #(1 + 2)"),
            Arguments.of("markup", "[*"),
            Arguments.of("markup", "#show:"),
            Arguments.of("markup", "#for x in"),
            Arguments.of("markup", "`abc"),
            Arguments.of("markup", "*unclosed _nested"),
            Arguments.of("code", "let f(x, y: 2, ..rest) = x + y\nf(1, y: 3)"),
            Arguments.of("code", "if a not in b { 1 } else if c { 2 } else { 3 }"),
            Arguments.of("code", "for (k, v) in (a: 1, b: 2) { k; v }\nwhile x < 10 { x += 1; break }"),
            Arguments.of("code", "let (a, _, ..rest) = (1, 2, 3); (a, b) = (b, a)"),
            Arguments.of("code", "context { return none }; import \"@preview/pkg:0.1.0\" as pkg: *"),
            Arguments.of("code", "0x1F + 0b101 * 0o17 - 1e3 / 50% == auto"),
            Arguments.of("code", "not"),
            Arguments.of("code", "#let x = 1"),
            Arguments.of("code", "(a: 1, \"b\": 2, ..c"),
            Arguments.of("math", "x_1^2 + f(a, b; c) & = 1/2"),
            Arguments.of("math", "√"),
            Arguments.of("math", "x_"),
            Arguments.of("math", "lr(| x |) + a'' + ∛ 8")
        );
    }

    @ParameterizedTest
    @MethodSource("sources")
    void testTerminalsReproduceSource(String mode, String source) {
        CstParseResult result = TypstParser.parse(source, ParseOptions.of(mode));
        assertEquals(source, result.root().fullText());
    }

    @ParameterizedTest
    @MethodSource("sources")
    void testRangesNestAndTile(String mode, String source) {
        CstNode root = TypstParser.parse(source, ParseOptions.of(mode)).root();
        assertEquals(new ByteRange(0, Utf8.length(source)), root.range());
        checkRanges(root);
    }

    private static void checkRanges(CstNode node) {
        if (node.isTerminal()) {
            assertNotNull(node.text(), "terminal " + node.kind() + " has text");
            assertEquals(Utf8.length(node.text()), node.range().length());
            return;
        }
        assertNull(node.text(), "inner " + node.kind() + " has no text");
        int offset = node.range().start();
        for (CstNode child : node.children()) {
            assertEquals(offset, child.range().start(), "children of " + node.kind() + " are contiguous");
            assertTrue(node.range().contains(child.range()));
            checkRanges(child);
            offset = child.range().end();
        }
        assertEquals(node.range().end(), offset);
    }

    @ParameterizedTest
    @MethodSource("sources")
    void testBothEntryPointsReportTheSameErrors(String mode, String source) {
        CstParseResult cst = TypstParser.parse(source, ParseOptions.of(mode));
        AstParseResult ast = TypstParser.parseAst(source, ParseOptions.of(mode));
        assertEquals(cst.errors(), ast.errors());
    }

    @ParameterizedTest
    @MethodSource("sources")
    void testErrorsAreSortedAndInBounds(String mode, String source) {
        AstParseResult result = TypstParser.parseAst(source, ParseOptions.of(mode));
        int previous = 0;
        for (ParseError error : result.errors()) {
            assertFalse(error.message().isBlank());
            assertTrue(error.range().start() >= previous);
            assertTrue(error.range().end() <= Utf8.length(source));
            previous = error.range().start();
        }
    }

    @ParameterizedTest
    @MethodSource("sources")
    void testParsingIsDeterministic(String mode, String source) {
        ParseOptions options = ParseOptions.of(mode);
        assertEquals(TypstParser.parseAst(source, options), TypstParser.parseAst(source, options));
        assertEquals(TypstParser.parse(source, options), TypstParser.parse(source, options));
    }
}
