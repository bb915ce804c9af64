package com.typstparser.lower;

import com.typstparser.ParseOptions;
import com.typstparser.TypstParser;
import com.typstparser.ast.Arg;
import com.typstparser.ast.AstNode;
import com.typstparser.ast.AstParseResult;
import com.typstparser.ast.BinOp;
import com.typstparser.ast.Binary;
import com.typstparser.ast.ByteRange;
import com.typstparser.ast.Closure;
import com.typstparser.ast.ContentBlock;
import com.typstparser.ast.ForLoop;
import com.typstparser.ast.FuncCall;
import com.typstparser.ast.Ident;
import com.typstparser.ast.ImportItem;
import com.typstparser.ast.Imports;
import com.typstparser.ast.IntLiteral;
import com.typstparser.ast.LetBinding;
import com.typstparser.ast.LetBindingKind;
import com.typstparser.ast.MathAttach;
import com.typstparser.ast.MathIdent;
import com.typstparser.ast.MathRoot;
import com.typstparser.ast.ModuleImport;
import com.typstparser.ast.NoneLiteral;
import com.typstparser.ast.Param;
import com.typstparser.ast.Parenthesized;
import com.typstparser.ast.Pattern;
import com.typstparser.ast.ShowRule;
import com.typstparser.ast.StrLiteral;
import com.typstparser.ast.UnOp;
import com.typstparser.ast.Unary;
import com.typstparser.syntax.SyntaxError;
import com.typstparser.syntax.SyntaxKind;
import com.typstparser.syntax.SyntaxNode;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;

import java.util.Arrays;
import java.util.List;
import java.util.stream.Stream;

import static org.junit.jupiter.api.Assertions.*;

public class AstLoweringTest {

    private static final AstNode PLACEHOLDER = new NoneLiteral(null);

    private static AstNode single(String source, String mode) {
        AstParseResult result = TypstParser.parseAst(source, ParseOptions.of(mode));
        assertEquals(1, result.root().size(), "top-level nodes of " + source);
        return result.root().get(0);
    }

    // ==================== Roles ====================

    private static final String MARKUP_SAMPLE = String.join("\n\n",
        "= H",
        "- i",
        "+ e",
        "/ T: d",
        "Text \\ *b* _e_ \\# ~ \" `r` https://typst.app <l> @l $x$",
        "$ (x) + 1.5 -> & x' y^2 a/b \u221Az $");

    private static final String CODE_SAMPLE = String.join("\n",
        "let f(x) = x",
        "let (a, b) = (1, 2.5)",
        "(a, b) = (b, a)",
        "set text(size: 12pt) if true",
        "show heading: it => [*#it*]",
        "context none",
        "if auto { break } else { continue }",
        "while a.b { return -1 }",
        "for x in (a: \"s\") { x + 1 }",
        "import \"m.typ\": a",
        "include \"c.typ\"",
        "(1)");

    static Stream<SyntaxKind> expressionKinds() {
        return Arrays.stream(SyntaxKind.values())
            .filter(kind -> AstLowering.roleOf(kind) == AstLowering.Role.EXPRESSION);
    }

    private static SyntaxNode find(SyntaxNode node, SyntaxKind kind) {
        if (node.kind() == kind) {
            return node;
        }
        for (SyntaxNode child : node.children()) {
            SyntaxNode found = find(child, kind);
            if (found != null) {
                return found;
            }
        }
        return null;
    }

    /**
     * Every kind classified as an expression has a lowering rule, checked on a
     * real node of that kind.
     */
    @ParameterizedTest
    @MethodSource("expressionKinds")
    void testEveryExpressionKindLowers(SyntaxKind kind) {
        List<SyntaxNode> roots = List.of(
            TypstParser.parseSyntax(MARKUP_SAMPLE, ParseOptions.of("markup")),
            TypstParser.parseSyntax(CODE_SAMPLE, ParseOptions.of("code")));
        for (SyntaxNode root : roots) {
            SyntaxNode node = find(root, kind);
            if (node != null) {
                RangeNormalizer ranges = new RangeNormalizer(root);
                AstNode lowered = new AstLowering(ranges).lower(node);
                assertEquals(ranges.rangeOf(node), lowered.range(), "range of " + kind);
                return;
            }
        }
        fail("no sample contains " + kind);
    }

    @Test
    void testRoles() {
        assertEquals(AstLowering.Role.EXPRESSION, AstLowering.roleOf(SyntaxKind.HEADING));
        assertEquals(AstLowering.Role.STRUCTURE, AstLowering.roleOf(SyntaxKind.ARGS));
        assertEquals(AstLowering.Role.TOKEN, AstLowering.roleOf(SyntaxKind.COMMA));
        assertEquals(AstLowering.Role.TRIVIA, AstLowering.roleOf(SyntaxKind.LINE_COMMENT));
        assertEquals(AstLowering.Role.ERROR, AstLowering.roleOf(SyntaxKind.ERROR));
    }

    // ==================== Shape Mismatches ====================

    @Test
    void testLoweringATokenFails() {
        SyntaxNode comma = SyntaxNode.leaf(SyntaxKind.COMMA, ",");
        AstLowering lowering = new AstLowering(new RangeNormalizer(comma));

        LoweringException e = assertThrows(LoweringException.class, () -> lowering.lower(comma));
        assertEquals(SyntaxKind.COMMA, e.nodeKind());
        assertEquals(new ByteRange(0, 1), e.range());
    }

    @Test
    void testMissingChildWithoutErrorFails() {
        SyntaxNode parens = SyntaxNode.inner(SyntaxKind.PARENTHESIZED, List.of(
            SyntaxNode.leaf(SyntaxKind.LEFT_PAREN, "("),
            SyntaxNode.leaf(SyntaxKind.RIGHT_PAREN, ")")));
        AstLowering lowering = new AstLowering(new RangeNormalizer(parens));

        LoweringException e = assertThrows(LoweringException.class, () -> lowering.lower(parens));
        assertEquals(SyntaxKind.PARENTHESIZED, e.nodeKind());
        assertTrue(e.getMessage().contains("missing"), e.getMessage());
    }

    @Test
    void testMissingChildAfterErrorBecomesPlaceholder() {
        SyntaxNode parens = SyntaxNode.inner(SyntaxKind.PARENTHESIZED, List.of(
            SyntaxNode.leaf(SyntaxKind.LEFT_PAREN, "("),
            SyntaxNode.error(new SyntaxError("expected expression"), "")));
        AstLowering lowering = new AstLowering(new RangeNormalizer(parens));

        assertEquals(new Parenthesized(new ByteRange(0, 1), PLACEHOLDER), lowering.lower(parens));
    }

    // ==================== Error Recovery ====================

    @Test
    void testShowRuleWithoutTransform() {
        AstParseResult result = TypstParser.parseAst("#show:");

        assertEquals(1, result.errors().size());
        assertEquals("expected expression", result.errors().get(0).message());
        ShowRule show = assertInstanceOf(ShowRule.class, result.root().get(0));
        assertNull(show.selector());
        assertEquals(PLACEHOLDER, show.transform());
        assertNull(show.transform().range());
    }

    @Test
    void testForLoopWithoutIterable() {
        AstParseResult result = TypstParser.parseAst("#for x in");

        assertTrue(result.hasErrors());
        ForLoop loop = assertInstanceOf(ForLoop.class, result.root().get(0));
        assertEquals(new Pattern.Normal(new Ident(new ByteRange(5, 6), "x")), loop.pattern());
        assertEquals(PLACEHOLDER, loop.iterable());
        assertEquals(PLACEHOLDER, loop.body());
    }

    @Test
    void testUnaryWithoutOperand() {
        Unary not = assertInstanceOf(Unary.class, single("not", "code"));
        assertEquals(UnOp.NOT, not.op());
        assertEquals(PLACEHOLDER, not.expr());
    }

    @Test
    void testRootWithoutRadicand() {
        MathRoot root = assertInstanceOf(MathRoot.class, single("√", "math"));
        assertNull(root.index());
        assertEquals(PLACEHOLDER, root.radicand());
    }

    @Test
    void testAttachmentWithoutSubscript() {
        AstParseResult result = TypstParser.parseAst("x_", ParseOptions.of("math"));

        assertTrue(result.hasErrors());
        MathAttach attach = assertInstanceOf(MathAttach.class, result.root().get(0));
        assertEquals(new MathIdent(new ByteRange(0, 1), "x"), attach.base());
        assertNull(attach.bottom());
        assertNull(attach.top());
    }

    @Test
    void testUnclosedStrongInBrackets() {
        AstParseResult result = TypstParser.parseAst("[*");
        assertTrue(result.hasErrors());
        assertFalse(result.root().isEmpty());
    }

    // ==================== Well-formed Input ====================

    @Test
    void testCubeRoot() {
        MathRoot root = assertInstanceOf(MathRoot.class, single("∛x", "math"));
        assertEquals(3, root.index());
        assertEquals(new MathIdent(new ByteRange(3, 4), "x"), root.radicand());
    }

    @Test
    void testNotIn() {
        Binary binary = assertInstanceOf(Binary.class, single("a not in b", "code"));
        assertEquals(BinOp.NOT_IN, binary.op());
        assertEquals(new Ident(new ByteRange(0, 1), "a"), binary.lhs());
        assertEquals(new Ident(new ByteRange(9, 10), "b"), binary.rhs());
    }

    @Test
    void testShowRuleWithSelector() {
        ShowRule show = assertInstanceOf(ShowRule.class, single("#show heading: it => it", "markup"));
        assertEquals(new Ident(new ByteRange(6, 13), "heading"), show.selector());

        Closure closure = assertInstanceOf(Closure.class, show.transform());
        assertNull(closure.name());
        assertEquals(List.of(new Param.Pos(new Pattern.Normal(new Ident(new ByteRange(15, 17), "it")))),
            closure.params());
        assertEquals(new Ident(new ByteRange(21, 23), "it"), closure.body());
    }

    @Test
    void testClosureBinding() {
        LetBinding let = assertInstanceOf(LetBinding.class, single("let f(x, y: 2, ..rest) = x", "code"));
        assertEquals(new LetBindingKind.Closure("f"), let.bindingKind());

        Closure closure = assertInstanceOf(Closure.class, let.init());
        assertEquals("f", closure.name());
        assertEquals(3, closure.params().size());
        assertEquals(new Param.Pos(new Pattern.Normal(new Ident(new ByteRange(6, 7), "x"))), closure.params().get(0));
        assertEquals(new Param.Named("y", new IntLiteral(new ByteRange(12, 13), 2)), closure.params().get(1));
        Param.Spread sink = assertInstanceOf(Param.Spread.class, closure.params().get(2));
        assertEquals("rest", sink.sinkIdent());
        assertEquals(new Ident(new ByteRange(25, 26), "x"), closure.body());
    }

    @Test
    void testCallArguments() {
        FuncCall call = assertInstanceOf(FuncCall.class, single("f(1, y: 2, ..z)[body]", "code"));
        assertEquals(new Ident(new ByteRange(0, 1), "f"), call.callee());

        List<Arg> args = call.args();
        assertEquals(4, args.size());
        assertEquals(new Arg.Pos(new IntLiteral(new ByteRange(2, 3), 1)), args.get(0));
        assertEquals(new Arg.Named("y", new IntLiteral(new ByteRange(8, 9), 2)), args.get(1));
        assertEquals(new Arg.Spread(new Ident(new ByteRange(13, 14), "z"), "z"), args.get(2));
        Arg.Pos trailing = assertInstanceOf(Arg.Pos.class, args.get(3));
        assertInstanceOf(ContentBlock.class, trailing.expr());
    }

    @Test
    void testImportItems() {
        ModuleImport module = assertInstanceOf(ModuleImport.class, single("import \"m.typ\": a, b as c", "code"));
        assertEquals(new StrLiteral(new ByteRange(7, 14), "m.typ"), module.source());
        assertNull(module.newName());
        assertEquals(new Imports.Items(List.of(
            new ImportItem.Simple(List.of("a"), "a"),
            new ImportItem.Renamed(List.of("b"), "b", "c")
        )), module.imports());
    }

    @Test
    void testWildcardImport() {
        ModuleImport module = assertInstanceOf(ModuleImport.class, single("import \"m.typ\" as m: *", "code"));
        assertEquals("m", module.newName());
        assertEquals(new Imports.Wildcard(), module.imports());
    }

    @Test
    void testBareImport() {
        ModuleImport module = assertInstanceOf(ModuleImport.class, single("import \"m.typ\"", "code"));
        assertNull(module.newName());
        assertNull(module.imports());
    }
}
