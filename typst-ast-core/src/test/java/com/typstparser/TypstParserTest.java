package com.typstparser;

import com.typstparser.ast.AstNode;
import com.typstparser.ast.AstParseResult;
import com.typstparser.ast.BinOp;
import com.typstparser.ast.Binary;
import com.typstparser.ast.ByteRange;
import com.typstparser.ast.DestructuringItem;
import com.typstparser.ast.Equation;
import com.typstparser.ast.Heading;
import com.typstparser.ast.Ident;
import com.typstparser.ast.IntLiteral;
import com.typstparser.ast.LetBinding;
import com.typstparser.ast.LetBindingKind;
import com.typstparser.ast.MathAttach;
import com.typstparser.ast.MathIdent;
import com.typstparser.ast.Pattern;
import com.typstparser.ast.Strong;
import com.typstparser.ast.Text;
import com.typstparser.cst.CstNode;
import com.typstparser.cst.CstParseResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TypstParserTest {

    @Test
    void testHeading() {
        AstParseResult result = TypstParser.parseAst("= Hello");

        assertFalse(result.hasErrors());
        assertEquals(1, result.root().size());
        Heading heading = assertInstanceOf(Heading.class, result.root().get(0));
        assertEquals(new ByteRange(0, 7), heading.range());
        assertEquals(1, heading.depth());
        assertEquals(List.of(new Text(new ByteRange(2, 7), "Hello")), heading.body());
    }

    @Test
    void testStrong() {
        AstParseResult result = TypstParser.parseAst("*b*");

        assertFalse(result.hasErrors());
        Strong strong = assertInstanceOf(Strong.class, result.root().get(0));
        assertEquals(new ByteRange(0, 3), strong.range());
        assertEquals(List.of(new Text(new ByteRange(1, 2), "b")), strong.body());
    }

    @Test
    void testLetBindingInCode() {
        AstParseResult result = TypstParser.parseAst("let x = 1 + 2", ParseOptions.of("code"));

        assertFalse(result.hasErrors());
        assertEquals(1, result.root().size());
        LetBinding let = assertInstanceOf(LetBinding.class, result.root().get(0));
        assertEquals(new ByteRange(0, 13), let.range());

        LetBindingKind.Normal kind = assertInstanceOf(LetBindingKind.Normal.class, let.bindingKind());
        assertEquals(new Pattern.Normal(new Ident(new ByteRange(4, 5), "x")), kind.pattern());

        Binary sum = assertInstanceOf(Binary.class, let.init());
        assertEquals(BinOp.ADD, sum.op());
        assertEquals(new IntLiteral(new ByteRange(8, 9), 1), sum.lhs());
        assertEquals(new IntLiteral(new ByteRange(12, 13), 2), sum.rhs());
    }

    @Test
    void testEmbeddedLetBinding() {
        AstParseResult result = TypstParser.parseAst("#let x = 1 + 2");

        assertFalse(result.hasErrors());
        assertEquals(1, result.root().size(), "the hash is not part of the body");
        LetBinding let = assertInstanceOf(LetBinding.class, result.root().get(0));
        assertEquals(new ByteRange(1, 14), let.range());
    }

    @Test
    void testHashInCodeModeIsAnError() {
        AstParseResult result = TypstParser.parseAst("#let x = 1", ParseOptions.of("code"));

        assertTrue(result.hasErrors());
        assertTrue(result.root().stream().anyMatch(node -> node instanceof LetBinding),
            "the binding after the stray hash is still lowered");
    }

    @Test
    void testInlineEquation() {
        AstParseResult result = TypstParser.parseAst("$a^2$");

        assertFalse(result.hasErrors());
        Equation equation = assertInstanceOf(Equation.class, result.root().get(0));
        assertFalse(equation.block());
        assertEquals(1, equation.body().size());

        MathAttach attach = assertInstanceOf(MathAttach.class, equation.body().get(0));
        assertEquals(new MathIdent(new ByteRange(1, 2), "a"), attach.base());
        assertEquals(new IntLiteral(new ByteRange(3, 4), 2), attach.top());
        assertNull(attach.bottom());
        assertNull(attach.primes());
    }

    @Test
    void testBlockEquation() {
        AstParseResult result = TypstParser.parseAst("$ x $");

        Equation equation = assertInstanceOf(Equation.class, result.root().get(0));
        assertTrue(equation.block());
    }

    @Test
    void testDestructuringLet() {
        AstParseResult result = TypstParser.parseAst("#let (a, ..rest) = arr");

        assertFalse(result.hasErrors());
        LetBinding let = assertInstanceOf(LetBinding.class, result.root().get(0));
        LetBindingKind.Normal kind = assertInstanceOf(LetBindingKind.Normal.class, let.bindingKind());
        Pattern.Destructuring destructuring = assertInstanceOf(Pattern.Destructuring.class, kind.pattern());

        assertEquals(List.of(
            new DestructuringItem.PatternItem(new Pattern.Normal(new Ident(new ByteRange(6, 7), "a"))),
            new DestructuringItem.Spread("rest")
        ), destructuring.items());
        assertEquals(new Ident(new ByteRange(19, 22), "arr"), let.init());
    }

    @Test
    void testMathMode() {
        AstParseResult result = TypstParser.parseAst("a^2", ParseOptions.of("math"));

        assertFalse(result.hasErrors());
        assertEquals(1, result.root().size());
        assertInstanceOf(MathAttach.class, result.root().get(0));
    }

    @Test
    void testPrimedAttachmentIsWrappedOnce() {
        AstParseResult markup = TypstParser.parseAst("$a''_b^c$");

        assertFalse(markup.hasErrors());
        Equation equation = assertInstanceOf(Equation.class, markup.root().get(0));
        assertEquals(List.of(new MathAttach(new ByteRange(1, 8),
            new MathIdent(new ByteRange(1, 2), "a"),
            new MathIdent(new ByteRange(5, 6), "b"),
            new MathIdent(new ByteRange(7, 8), "c"),
            2)), equation.body());

        AstParseResult math = TypstParser.parseAst("a''_b^c", ParseOptions.of("math"));
        assertEquals(List.of(new MathAttach(new ByteRange(0, 7),
            new MathIdent(new ByteRange(0, 1), "a"),
            new MathIdent(new ByteRange(4, 5), "b"),
            new MathIdent(new ByteRange(6, 7), "c"),
            2)), math.root());
    }

    @Test
    void testUnterminatedRaw() {
        String source = "`abc";
        CstParseResult cst = TypstParser.parse(source);
        AstParseResult ast = TypstParser.parseAst(source);

        assertTrue(cst.hasErrors());
        assertEquals(cst.errors(), ast.errors());
        assertEquals(source, cst.root().fullText());
    }

    @Test
    void testMultiByteOffsets() {
        AstParseResult result = TypstParser.parseAst("é");

        AstNode text = result.root().get(0);
        assertEquals(new ByteRange(0, 2), text.range(), "offsets count UTF-8 bytes");
    }

    @Test
    void testConcreteTree() {
        CstParseResult result = TypstParser.parse("*b*");

        CstNode root = result.root();
        assertEquals("Markup", root.kind());
        assertEquals(new ByteRange(0, 3), root.range());
        assertNull(root.text());

        CstNode strong = root.children().get(0);
        assertEquals("Strong", strong.kind());
        assertEquals(List.of("Star", "Markup", "Star"),
            strong.children().stream().map(CstNode::kind).toList());

        CstNode star = strong.children().get(0);
        assertTrue(star.isTerminal());
        assertEquals("*", star.text());
        assertEquals(new ByteRange(0, 1), star.range());
    }

    @Test
    void testEmptyInput() {
        assertEquals(List.of(), TypstParser.parseAst("").root());
        assertEquals(List.of(), TypstParser.parseAst("", ParseOptions.of("code")).root());
        assertEquals(List.of(), TypstParser.parseAst("", ParseOptions.of("math")).root());
        assertEquals(new ByteRange(0, 0), TypstParser.parse("").root().range());
    }

    @Test
    void testInvalidMode() {
        InvalidParseModeException e = assertThrows(InvalidParseModeException.class, () -> ParseOptions.of("latex"));
        assertEquals("latex", e.mode());
    }

    @Test
    void testDefaultMode() {
        assertEquals(ParseMode.MARKUP, ParseOptions.of(null).mode());
        assertEquals(ParseMode.MARKUP, new ParseOptions(null).mode());
        assertEquals(TypstParser.parseAst("= Hello"), TypstParser.parseAst("= Hello", null));
    }
}
