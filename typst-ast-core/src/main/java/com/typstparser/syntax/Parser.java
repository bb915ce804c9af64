package com.typstparser.syntax;

import com.typstparser.lower.Literals;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumSet;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.function.BooleanSupplier;

/**
 * Error-recovering recursive descent parser producing a lossless
 * {@link SyntaxNode} tree.
 *
 * <p>The parser never throws on user input. Unexpected tokens are converted
 * into error leaves that keep their text, missing tokens are reported through
 * zero-length error leaves. Every character of the input ends up in exactly
 * one leaf of the returned tree.</p>
 */
public class Parser {
    // ========================================================================
    // Precedence Constants
    // ========================================================================
    // Higher precedence binds tighter
    private static final int PREC_NONE = 0;
    private static final int PREC_ASSIGN = 1;       // =, +=, -=, *=, /= - right-associative
    private static final int PREC_OR = 2;           // or
    private static final int PREC_AND = 3;          // and
    private static final int PREC_COMPARE = 4;      // ==, !=, <, <=, >, >=, in, not in, unary not
    private static final int PREC_ADD = 5;          // +, -
    private static final int PREC_MUL = 6;          // *, /
    private static final int PREC_UNARY = 7;        // unary + and -

    private static final int MATH_PREC_FRAC = 1;    // a/b - left-associative
    private static final int MATH_PREC_ATTACH = 2;  // a_b, a^b - right-associative
    private static final int MATH_PREC_ATOMIC = 3;

    // ========================================================================
    // Token Sets
    // ========================================================================
    private static final Set<SyntaxKind> UNARY_OP = EnumSet.of(
        SyntaxKind.PLUS, SyntaxKind.MINUS, SyntaxKind.NOT);

    private static final Set<SyntaxKind> BINARY_OP = EnumSet.of(
        SyntaxKind.PLUS, SyntaxKind.MINUS, SyntaxKind.STAR, SyntaxKind.SLASH,
        SyntaxKind.AND, SyntaxKind.OR, SyntaxKind.EQ_EQ, SyntaxKind.EXCL_EQ,
        SyntaxKind.LT, SyntaxKind.LT_EQ, SyntaxKind.GT, SyntaxKind.GT_EQ,
        SyntaxKind.EQ, SyntaxKind.IN, SyntaxKind.PLUS_EQ, SyntaxKind.HYPH_EQ,
        SyntaxKind.STAR_EQ, SyntaxKind.SLASH_EQ);

    private static final Set<SyntaxKind> ATOMIC_CODE_EXPR = EnumSet.of(
        SyntaxKind.IDENT, SyntaxKind.LEFT_BRACE, SyntaxKind.LEFT_BRACKET,
        SyntaxKind.LEFT_PAREN, SyntaxKind.DOLLAR, SyntaxKind.LET, SyntaxKind.SET,
        SyntaxKind.SHOW, SyntaxKind.CONTEXT, SyntaxKind.IF, SyntaxKind.WHILE,
        SyntaxKind.FOR, SyntaxKind.IMPORT, SyntaxKind.INCLUDE, SyntaxKind.BREAK,
        SyntaxKind.CONTINUE, SyntaxKind.RETURN, SyntaxKind.RAW, SyntaxKind.NONE,
        SyntaxKind.AUTO, SyntaxKind.INT, SyntaxKind.FLOAT, SyntaxKind.BOOL,
        SyntaxKind.NUMERIC, SyntaxKind.STR, SyntaxKind.LABEL);

    private static final Set<SyntaxKind> CODE_EXPR = union(ATOMIC_CODE_EXPR, UNARY_OP, EnumSet.of(SyntaxKind.UNDERSCORE));

    private static final Set<SyntaxKind> STMT = EnumSet.of(
        SyntaxKind.LET, SyntaxKind.SET, SyntaxKind.SHOW, SyntaxKind.IMPORT,
        SyntaxKind.INCLUDE, SyntaxKind.RETURN);

    private static final Set<SyntaxKind> WITH_DOTS = EnumSet.of(SyntaxKind.DOTS);
    private static final Set<SyntaxKind> ARG = union(CODE_EXPR, WITH_DOTS);
    private static final Set<SyntaxKind> ARRAY_OR_DICT_ITEM = ARG;
    private static final Set<SyntaxKind> PATTERN_LEAF = ATOMIC_CODE_EXPR;
    private static final Set<SyntaxKind> PATTERN = union(PATTERN_LEAF,
        EnumSet.of(SyntaxKind.LEFT_PAREN, SyntaxKind.UNDERSCORE));
    private static final Set<SyntaxKind> PARAM = union(PATTERN, WITH_DOTS);
    private static final Set<SyntaxKind> DESTRUCTURING_ITEM = PARAM;

    private static final Set<SyntaxKind> MATH_EXPR = EnumSet.of(
        SyntaxKind.HASH, SyntaxKind.MATH_IDENT, SyntaxKind.MATH_TEXT, SyntaxKind.INT,
        SyntaxKind.MATH_SHORTHAND, SyntaxKind.LINEBREAK, SyntaxKind.MATH_ALIGN_POINT,
        SyntaxKind.ESCAPE, SyntaxKind.STR, SyntaxKind.ROOT, SyntaxKind.PRIME);

    @SafeVarargs
    private static Set<SyntaxKind> union(Set<SyntaxKind>... sets) {
        EnumSet<SyntaxKind> result = EnumSet.noneOf(SyntaxKind.class);
        for (Set<SyntaxKind> set : sets) {
            result.addAll(set);
        }
        return result;
    }

    /**
     * How a line break inside embedded code is treated.
     */
    private enum NewlineMode {
        STOP,        // a newline ends the expression
        CONTEXTUAL,  // a newline ends the expression unless `else` or `.` follows
        CONTINUE     // newlines are plain whitespace
    }

    private record Checkpoint(int cursor, LexMode mode, int prevEnd, int currentStart,
                              SyntaxKind current, SyntaxNode currentNode, boolean currentNewline,
                              int nodeCount) {
    }

    private final String text;
    private final Lexer lexer;
    private final List<SyntaxNode> nodes = new ArrayList<>();
    private final Deque<LexMode> modes = new ArrayDeque<>();
    private final Deque<NewlineMode> newlineModes = new ArrayDeque<>();

    private int prevEnd = 0;
    private int currentStart = 0;
    private SyntaxKind current;
    private SyntaxNode currentNode;
    private boolean currentNewline;

    private Parser(String text, LexMode mode) {
        this.text = text;
        this.lexer = new Lexer(text, mode);
        lex();
    }

    // ========================================================================
    // Entry Points
    // ========================================================================

    /**
     * Parses a document in markup mode.
     */
    public static SyntaxNode parseMarkup(String text) {
        Parser p = new Parser(text, LexMode.MARKUP);
        p.markup(true, 0, () -> false);
        return p.finish(SyntaxKind.MARKUP);
    }

    /**
     * Parses a sequence of code expressions.
     */
    public static SyntaxNode parseCode(String text) {
        Parser p = new Parser(text, LexMode.CODE);
        int m = p.marker();
        p.skip();
        p.codeExprs(() -> false);
        p.wrapAll(m, SyntaxKind.CODE);
        return p.finish(SyntaxKind.CODE);
    }

    /**
     * Parses a math body.
     */
    public static SyntaxNode parseMath(String text) {
        Parser p = new Parser(text, LexMode.MATH);
        int m = p.marker();
        p.skip();
        p.mathExprs(() -> false);
        p.wrapAll(m, SyntaxKind.MATH);
        return p.finish(SyntaxKind.MATH);
    }

    public static SyntaxNode parse(String text, LexMode mode) {
        return switch (mode) {
            case MARKUP -> parseMarkup(text);
            case CODE -> parseCode(text);
            case MATH -> parseMath(text);
        };
    }

    private SyntaxNode finish(SyntaxKind rootKind) {
        if (nodes.size() == 1 && nodes.get(0).kind() == rootKind) {
            return nodes.get(0);
        }
        return SyntaxNode.inner(rootKind, nodes);
    }

    // ========================================================================
    // Markup
    // ========================================================================

    private void markup(boolean atStart, int minIndent, BooleanSupplier stop) {
        int m = marker();
        int nesting = 0;
        boolean start = atStart;
        while (!end()) {
            if (at(SyntaxKind.LEFT_BRACKET)) {
                nesting++;
            } else if (at(SyntaxKind.RIGHT_BRACKET) && nesting > 0) {
                nesting--;
            } else if (stop.getAsBoolean()) {
                break;
            }

            if (currentNewline) {
                start = true;
                if (minIndent > 0 && lexer.column(currentEnd()) < minIndent) {
                    break;
                }
                eat();
                continue;
            }

            int prev = prevEnd;
            start = markupExpr(start);
            if (!progress(prev)) {
                unexpected();
            }
        }
        wrap(m, SyntaxKind.MARKUP);
    }

    /**
     * Parses one markup element and returns whether the parser is still at the
     * start of a line.
     */
    private boolean markupExpr(boolean atStart) {
        switch (current) {
            case SPACE, PARBREAK, LINE_COMMENT, BLOCK_COMMENT, SHEBANG -> {
                eat();
                return atStart;
            }
            case TEXT, LINEBREAK, ESCAPE, SHORTHAND, SMART_QUOTE, LINK, LABEL, RAW -> eat();
            case HASH -> embeddedCodeExpr();
            case STAR -> strong();
            case UNDERSCORE -> emph();
            case HEADING_MARKER -> {
                if (atStart) {
                    heading();
                } else {
                    convert(SyntaxKind.TEXT);
                }
            }
            case LIST_MARKER -> {
                if (atStart) {
                    listItem();
                } else {
                    convert(SyntaxKind.TEXT);
                }
            }
            case ENUM_MARKER -> {
                if (atStart) {
                    enumItem();
                } else {
                    convert(SyntaxKind.TEXT);
                }
            }
            case TERM_MARKER -> {
                if (atStart) {
                    termItem();
                } else {
                    convert(SyntaxKind.TEXT);
                }
            }
            case REF_MARKER -> reference();
            case DOLLAR -> equation();
            case LEFT_BRACKET, RIGHT_BRACKET, COLON -> convert(SyntaxKind.TEXT);
            default -> {
            }
        }
        return false;
    }

    private void strong() {
        int m = marker();
        assertAt(SyntaxKind.STAR);
        markup(false, 0, () -> at(SyntaxKind.STAR) || at(SyntaxKind.PARBREAK) || at(SyntaxKind.RIGHT_BRACKET));
        expectClosingDelimiter(m, SyntaxKind.STAR);
        wrap(m, SyntaxKind.STRONG);
    }

    private void emph() {
        int m = marker();
        assertAt(SyntaxKind.UNDERSCORE);
        markup(false, 0, () -> at(SyntaxKind.UNDERSCORE) || at(SyntaxKind.PARBREAK) || at(SyntaxKind.RIGHT_BRACKET));
        expectClosingDelimiter(m, SyntaxKind.UNDERSCORE);
        wrap(m, SyntaxKind.EMPH);
    }

    private void heading() {
        int m = marker();
        assertAt(SyntaxKind.HEADING_MARKER);
        whitespaceLine();
        markup(false, Integer.MAX_VALUE, () -> at(SyntaxKind.LABEL) || at(SyntaxKind.RIGHT_BRACKET)
            || (at(SyntaxKind.SPACE) && peekKind() == SyntaxKind.LABEL));
        wrap(m, SyntaxKind.HEADING);
    }

    private void listItem() {
        int m = marker();
        int minIndent = lexer.column(currentStart) + 1;
        assertAt(SyntaxKind.LIST_MARKER);
        whitespaceLine();
        markup(false, minIndent, () -> at(SyntaxKind.RIGHT_BRACKET));
        wrap(m, SyntaxKind.LIST_ITEM);
    }

    private void enumItem() {
        int m = marker();
        int minIndent = lexer.column(currentStart) + 1;
        assertAt(SyntaxKind.ENUM_MARKER);
        whitespaceLine();
        markup(false, minIndent, () -> at(SyntaxKind.RIGHT_BRACKET));
        wrap(m, SyntaxKind.ENUM_ITEM);
    }

    private void termItem() {
        int m = marker();
        int minIndent = lexer.column(currentStart) + 1;
        assertAt(SyntaxKind.TERM_MARKER);
        whitespaceLine();
        markup(false, Integer.MAX_VALUE, () -> at(SyntaxKind.COLON) || at(SyntaxKind.RIGHT_BRACKET));
        expect(SyntaxKind.COLON);
        whitespaceLine();
        markup(false, minIndent, () -> at(SyntaxKind.RIGHT_BRACKET));
        wrap(m, SyntaxKind.TERM_ITEM);
    }

    private void reference() {
        int m = marker();
        assertAt(SyntaxKind.REF_MARKER);
        if (directlyAt(SyntaxKind.LEFT_BRACKET)) {
            contentBlock();
        }
        wrap(m, SyntaxKind.REF);
    }

    private void whitespaceLine() {
        while (!currentNewline && current.isTrivia()) {
            eat();
        }
    }

    private void equation() {
        int m = marker();
        enter(LexMode.MATH);
        assertAt(SyntaxKind.DOLLAR);
        math(() -> at(SyntaxKind.DOLLAR));
        expectClosingDelimiter(m, SyntaxKind.DOLLAR);
        exit();
        wrap(m, SyntaxKind.EQUATION);
    }

    // ========================================================================
    // Math
    // ========================================================================

    private void math(BooleanSupplier stop) {
        int m = marker();
        mathExprs(stop);
        wrap(m, SyntaxKind.MATH);
    }

    private void mathExprs(BooleanSupplier stop) {
        while (!end() && !stop.getAsBoolean()) {
            if (atSet(MATH_EXPR)) {
                mathExpr();
            } else {
                unexpected();
            }
        }
    }

    private void mathExpr() {
        mathExprPrec(PREC_NONE, SyntaxKind.END);
    }

    private void mathExprPrec(int minPrec, SyntaxKind stop) {
        int m = marker();
        boolean continuable = false;
        switch (current) {
            case HASH -> embeddedCodeExpr();
            case MATH_IDENT -> {
                continuable = true;
                boolean callable = currentText().codePointCount(0, currentText().length()) > 1;
                eat();
                while (callable && directlyAt(SyntaxKind.MATH_TEXT) && currentText().equals(".")
                    && peekKind() == SyntaxKind.MATH_IDENT) {
                    convert(SyntaxKind.DOT);
                    convert(SyntaxKind.IDENT);
                    wrap(m, SyntaxKind.FIELD_ACCESS);
                }
                if (callable && minPrec < MATH_PREC_ATOMIC && directlyAt(SyntaxKind.MATH_TEXT)
                    && currentText().equals("(")) {
                    mathArgs();
                    wrap(m, SyntaxKind.FUNC_CALL);
                    continuable = false;
                }
            }
            case MATH_TEXT, MATH_SHORTHAND, INT -> {
                continuable = current == SyntaxKind.INT || isAlphanumeric(currentText());
                if (!maybeDelimited()) {
                    eat();
                }
            }
            case LINEBREAK, MATH_ALIGN_POINT -> eat();
            case ESCAPE, STR -> {
                continuable = true;
                eat();
            }
            case ROOT -> {
                if (minPrec < MATH_PREC_ATOMIC) {
                    eat();
                    int m2 = marker();
                    mathExprPrec(MATH_PREC_ATTACH, stop);
                    mathUnparen(m2);
                    wrap(m, SyntaxKind.MATH_ROOT);
                }
            }
            case PRIME -> {
                continuable = true;
                while (at(SyntaxKind.PRIME)) {
                    int m2 = marker();
                    eat();
                    while (eatIfDirect(SyntaxKind.PRIME)) {
                        // consume the whole group
                    }
                    wrap(m2, SyntaxKind.MATH_PRIMES);
                }
            }
            default -> expected("expression");
        }

        if (continuable && minPrec < MATH_PREC_ATOMIC && prevEnd == currentStart && maybeDelimited()) {
            wrap(m, SyntaxKind.MATH);
        }

        boolean primed = false;
        while (!end() && !at(stop)) {
            if (directlyAt(SyntaxKind.MATH_TEXT) && currentText().equals("!")) {
                eat();
                wrap(m, SyntaxKind.MATH);
                continue;
            }

            int primeMarker = marker();
            if (eatIfDirect(SyntaxKind.PRIME)) {
                while (eatIfDirect(SyntaxKind.PRIME)) {
                    // consume the whole group
                }
                wrap(primeMarker, SyntaxKind.MATH_PRIMES);
                if (at(stop)) {
                    wrap(m, SyntaxKind.MATH_ATTACH);
                }
                primed = true;
                continue;
            }

            SyntaxKind kind;
            SyntaxKind innerStop;
            boolean leftAssoc;
            int prec;
            if (at(SyntaxKind.UNDERSCORE)) {
                kind = SyntaxKind.MATH_ATTACH;
                innerStop = SyntaxKind.HAT;
                leftAssoc = false;
                prec = MATH_PREC_ATTACH;
            } else if (at(SyntaxKind.HAT)) {
                kind = SyntaxKind.MATH_ATTACH;
                innerStop = SyntaxKind.UNDERSCORE;
                leftAssoc = false;
                prec = MATH_PREC_ATTACH;
            } else if (at(SyntaxKind.SLASH)) {
                kind = SyntaxKind.MATH_FRAC;
                innerStop = SyntaxKind.END;
                leftAssoc = true;
                prec = MATH_PREC_FRAC;
            } else {
                if (primed) {
                    wrap(m, SyntaxKind.MATH_ATTACH);
                }
                break;
            }

            if (primed && kind == SyntaxKind.MATH_FRAC) {
                wrap(m, SyntaxKind.MATH_ATTACH);
                primed = false;
            }
            if (prec < minPrec) {
                break;
            }
            if (leftAssoc) {
                prec++;
            }
            if (kind == SyntaxKind.MATH_FRAC) {
                mathUnparen(m);
            }

            eat();
            int m2 = marker();
            mathExprPrec(prec, innerStop);
            mathUnparen(m2);

            if (eatIf(SyntaxKind.UNDERSCORE) || eatIf(SyntaxKind.HAT)) {
                int m3 = marker();
                mathExprPrec(prec, SyntaxKind.END);
                mathUnparen(m3);
            }

            wrap(m, kind);
            // the primes now belong to this attachment
            primed = false;
        }
    }

    private boolean maybeDelimited() {
        boolean open = at(SyntaxKind.MATH_TEXT) && isOpeningDelimiter(currentText());
        if (open) {
            mathDelimited();
        }
        return open;
    }

    private void mathDelimited() {
        int m = marker();
        eat();
        int m2 = marker();
        while (!end() && !at(SyntaxKind.DOLLAR)) {
            if (at(SyntaxKind.MATH_TEXT) && isClosingDelimiter(currentText())) {
                wrap(m2, SyntaxKind.MATH);
                eat();
                wrap(m, SyntaxKind.MATH_DELIMITED);
                return;
            }
            if (atSet(MATH_EXPR)) {
                mathExpr();
            } else {
                unexpected();
            }
        }
        wrap(m, SyntaxKind.MATH);
    }

    /**
     * Strips plain parentheses from a delimited group that serves as the
     * operand of an attachment, fraction or root.
     */
    private void mathUnparen(int m) {
        if (m >= nodes.size()) {
            return;
        }
        SyntaxNode node = nodes.get(m);
        if (node.kind() != SyntaxKind.MATH_DELIMITED) {
            return;
        }
        List<SyntaxNode> children = new ArrayList<>(node.children());
        SyntaxNode first = children.get(0);
        SyntaxNode last = children.get(children.size() - 1);
        if (first.text().equals("(") && last.text().equals(")")) {
            children.set(0, first.withKind(SyntaxKind.LEFT_PAREN));
            children.set(children.size() - 1, last.withKind(SyntaxKind.RIGHT_PAREN));
            nodes.set(m, SyntaxNode.inner(SyntaxKind.MATH, children));
        }
    }

    private void mathArgs() {
        int m = marker();
        convert(SyntaxKind.LEFT_PAREN);

        boolean namable = true;
        int named = -1;
        boolean hasArrays = false;
        int array = marker();
        int arg = marker();

        while (!end() && !at(SyntaxKind.DOLLAR)) {
            if (namable && (at(SyntaxKind.MATH_IDENT) || at(SyntaxKind.MATH_TEXT))
                && text.startsWith(":", currentEnd()) && Lexer.isIdent(currentText())) {
                convert(SyntaxKind.IDENT);
                convert(SyntaxKind.COLON);
                named = arg;
                arg = marker();
                array = marker();
            }

            String t = currentText();
            if (at(SyntaxKind.MATH_TEXT) && t.equals(")")) {
                break;
            }
            if (at(SyntaxKind.MATH_TEXT) && t.equals(";")) {
                maybeWrapInMath(arg, named);
                wrap(array, SyntaxKind.ARRAY);
                convert(SyntaxKind.SEMICOLON);
                array = marker();
                arg = marker();
                namable = true;
                named = -1;
                hasArrays = true;
                continue;
            }
            if (at(SyntaxKind.MATH_TEXT) && t.equals(",")) {
                maybeWrapInMath(arg, named);
                convert(SyntaxKind.COMMA);
                arg = marker();
                namable = true;
                if (named >= 0) {
                    array = marker();
                    named = -1;
                }
                continue;
            }

            if (atSet(MATH_EXPR)) {
                mathExpr();
            } else {
                unexpected();
            }
            namable = false;
        }

        if (arg != marker()) {
            maybeWrapInMath(arg, named);
            if (named >= 0) {
                array = marker();
            }
        }
        if (hasArrays && array != marker()) {
            wrap(array, SyntaxKind.ARRAY);
        }

        if (at(SyntaxKind.MATH_TEXT) && currentText().equals(")")) {
            convert(SyntaxKind.RIGHT_PAREN);
        } else {
            expected("closing paren");
        }
        wrap(m, SyntaxKind.ARGS);
    }

    private void maybeWrapInMath(int arg, int named) {
        int exprs = 0;
        for (int i = arg; i < nodes.size(); i++) {
            SyntaxKind kind = nodes.get(i).kind();
            if (!kind.isTrivia() && !kind.isError()) {
                exprs++;
            }
        }
        if (exprs != 1) {
            wrap(arg, SyntaxKind.MATH);
        }
        if (named >= 0) {
            wrap(named, SyntaxKind.NAMED);
        }
    }

    private static boolean isAlphanumeric(String text) {
        return !text.isEmpty() && Character.isLetterOrDigit(text.codePointAt(0));
    }

    private static boolean isOpeningDelimiter(String text) {
        return switch (text) {
            case "(", "[", "{", "⟨", "⌈", "⌊", "⎰", "⟦", "⦃", "⦇", "⦉" -> true;
            default -> false;
        };
    }

    private static boolean isClosingDelimiter(String text) {
        return switch (text) {
            case ")", "]", "}", "⟩", "⌉", "⌋", "⎱", "⟧", "⦄", "⦈", "⦊" -> true;
            default -> false;
        };
    }

    // ========================================================================
    // Code
    // ========================================================================

    private void code(BooleanSupplier stop) {
        int m = marker();
        codeExprs(stop);
        wrap(m, SyntaxKind.CODE);
    }

    private void codeExprs(BooleanSupplier stop) {
        while (!end() && !stop.getAsBoolean()) {
            enterNewlineMode(NewlineMode.CONTEXTUAL);
            boolean atExpr = atSet(CODE_EXPR);
            if (atExpr) {
                codeExpr();
                if (!end() && !stop.getAsBoolean() && !eatIf(SyntaxKind.SEMICOLON)) {
                    expected("semicolon or line break");
                }
            }
            exitNewlineMode();
            if (!atExpr && !end()) {
                unexpected();
            }
        }
    }

    private void embeddedCodeExpr() {
        enterNewlineMode(NewlineMode.STOP);
        enter(LexMode.CODE);
        assertAt(SyntaxKind.HASH);
        unskip();

        boolean stmt = atSet(STMT);
        boolean atomic = atSet(ATOMIC_CODE_EXPR);
        codeExprPrec(true, PREC_NONE);

        // Trailing junk such as `#12p` or `#"abc\"`
        if (!atomic && !current.isTrivia() && !end()) {
            unexpected();
        }

        boolean semi = (stmt || directlyAt(SyntaxKind.SEMICOLON)) && eatIf(SyntaxKind.SEMICOLON);
        if (stmt && !semi && !end() && !at(SyntaxKind.RIGHT_BRACKET)) {
            expected("semicolon or line break");
        }

        exit();
        exitNewlineMode();
    }

    private void codeExpr() {
        codeExprPrec(false, PREC_NONE);
    }

    private void codeExprPrec(boolean atomic, int minPrec) {
        int m = marker();
        if (!atomic && atSet(UNARY_OP)) {
            int prec = at(SyntaxKind.NOT) ? PREC_COMPARE : PREC_UNARY;
            eat();
            codeExprPrec(atomic, prec);
            wrap(m, SyntaxKind.UNARY);
        } else {
            codePrimary(atomic);
        }

        while (true) {
            if (directlyAt(SyntaxKind.LEFT_PAREN) || directlyAt(SyntaxKind.LEFT_BRACKET)) {
                args();
                wrap(m, SyntaxKind.FUNC_CALL);
                continue;
            }

            boolean atFieldOrMethod = directlyAt(SyntaxKind.DOT) && peekKind() == SyntaxKind.IDENT;
            if (atomic && !atFieldOrMethod) {
                break;
            }

            if (eatIf(SyntaxKind.DOT)) {
                expect(SyntaxKind.IDENT);
                wrap(m, SyntaxKind.FIELD_ACCESS);
                continue;
            }

            int prec;
            boolean rightAssoc;
            if (atSet(BINARY_OP)) {
                prec = binaryPrecedence(current);
                rightAssoc = prec == PREC_ASSIGN;
            } else if (minPrec <= PREC_COMPARE && eatIf(SyntaxKind.NOT)) {
                if (at(SyntaxKind.IN)) {
                    prec = PREC_COMPARE;
                    rightAssoc = false;
                } else {
                    expected("keyword `in`");
                    break;
                }
            } else {
                break;
            }

            if (prec < minPrec) {
                break;
            }
            if (!rightAssoc) {
                prec++;
            }

            eat();
            codeExprPrec(false, prec);
            wrap(m, SyntaxKind.BINARY);
        }
    }

    private static int binaryPrecedence(SyntaxKind kind) {
        return switch (kind) {
            case STAR, SLASH -> PREC_MUL;
            case PLUS, MINUS -> PREC_ADD;
            case EQ_EQ, EXCL_EQ, LT, LT_EQ, GT, GT_EQ, IN -> PREC_COMPARE;
            case AND -> PREC_AND;
            case OR -> PREC_OR;
            case EQ, PLUS_EQ, HYPH_EQ, STAR_EQ, SLASH_EQ -> PREC_ASSIGN;
            default -> PREC_NONE;
        };
    }

    private void codePrimary(boolean atomic) {
        int m = marker();
        switch (current) {
            case IDENT -> {
                eat();
                if (!atomic && at(SyntaxKind.ARROW)) {
                    wrap(m, SyntaxKind.PARAMS);
                    assertAt(SyntaxKind.ARROW);
                    codeExpr();
                    wrap(m, SyntaxKind.CLOSURE);
                }
            }
            case UNDERSCORE -> {
                if (atomic) {
                    expected("expression");
                    return;
                }
                eat();
                if (at(SyntaxKind.ARROW)) {
                    wrap(m, SyntaxKind.PARAMS);
                    eat();
                    codeExpr();
                    wrap(m, SyntaxKind.CLOSURE);
                } else if (eatIf(SyntaxKind.EQ)) {
                    codeExpr();
                    wrap(m, SyntaxKind.DESTRUCT_ASSIGNMENT);
                } else {
                    nodes.set(m, nodes.get(m).expected("expression"));
                }
            }
            case LEFT_BRACE -> codeBlock();
            case LEFT_BRACKET -> contentBlock();
            case LEFT_PAREN -> exprWithParen(atomic);
            case DOLLAR -> equation();
            case LET -> letBinding();
            case SET -> setRule();
            case SHOW -> showRule();
            case CONTEXT -> contextual(atomic);
            case IF -> conditional();
            case WHILE -> whileLoop();
            case FOR -> forLoop();
            case IMPORT -> moduleImport();
            case INCLUDE -> moduleInclude();
            case BREAK -> keywordStatement(SyntaxKind.BREAK, SyntaxKind.LOOP_BREAK);
            case CONTINUE -> keywordStatement(SyntaxKind.CONTINUE, SyntaxKind.LOOP_CONTINUE);
            case RETURN -> returnStatement();
            case RAW, NONE, AUTO, INT, FLOAT, BOOL, NUMERIC, STR, LABEL -> eat();
            default -> expected("expression");
        }
    }

    private void block() {
        if (at(SyntaxKind.LEFT_BRACKET)) {
            contentBlock();
        } else if (at(SyntaxKind.LEFT_BRACE)) {
            codeBlock();
        } else {
            expected("block");
        }
    }

    private void codeBlock() {
        int m = marker();
        enter(LexMode.CODE);
        enterNewlineMode(NewlineMode.CONTINUE);
        assertAt(SyntaxKind.LEFT_BRACE);
        code(() -> at(SyntaxKind.RIGHT_BRACE) || at(SyntaxKind.RIGHT_BRACKET) || at(SyntaxKind.RIGHT_PAREN));
        expectClosingDelimiter(m, SyntaxKind.RIGHT_BRACE);
        exit();
        exitNewlineMode();
        wrap(m, SyntaxKind.CODE_BLOCK);
    }

    private void contentBlock() {
        int m = marker();
        enter(LexMode.MARKUP);
        assertAt(SyntaxKind.LEFT_BRACKET);
        markup(true, 0, () -> at(SyntaxKind.RIGHT_BRACKET));
        expectClosingDelimiter(m, SyntaxKind.RIGHT_BRACKET);
        exit();
        wrap(m, SyntaxKind.CONTENT_BLOCK);
    }

    private void letBinding() {
        int m = marker();
        assertAt(SyntaxKind.LET);

        int m2 = marker();
        boolean closure = false;
        boolean other = false;

        if (eatIf(SyntaxKind.IDENT)) {
            if (directlyAt(SyntaxKind.LEFT_PAREN)) {
                params();
                closure = true;
            }
        } else {
            pattern(false, new HashSet<>(), null);
            other = true;
        }

        boolean hasInit = (closure || other) ? expect(SyntaxKind.EQ) : eatIf(SyntaxKind.EQ);
        if (hasInit) {
            codeExpr();
        }

        if (closure) {
            wrap(m2, SyntaxKind.CLOSURE);
        }
        wrap(m, SyntaxKind.LET_BINDING);
    }

    private void setRule() {
        int m = marker();
        assertAt(SyntaxKind.SET);

        int m2 = marker();
        expect(SyntaxKind.IDENT);
        while (eatIf(SyntaxKind.DOT)) {
            expect(SyntaxKind.IDENT);
            wrap(m2, SyntaxKind.FIELD_ACCESS);
        }

        args();
        if (eatIf(SyntaxKind.IF)) {
            codeExpr();
        }
        wrap(m, SyntaxKind.SET_RULE);
    }

    private void showRule() {
        int m = marker();
        assertAt(SyntaxKind.SHOW);
        int m2 = beforeTrivia();

        if (!at(SyntaxKind.COLON)) {
            codeExpr();
        }

        if (eatIf(SyntaxKind.COLON)) {
            codeExpr();
        } else {
            expectedAt(m2, "colon");
        }
        wrap(m, SyntaxKind.SHOW_RULE);
    }

    private void contextual(boolean atomic) {
        int m = marker();
        assertAt(SyntaxKind.CONTEXT);
        codeExprPrec(atomic, PREC_NONE);
        wrap(m, SyntaxKind.CONTEXTUAL);
    }

    private void conditional() {
        int m = marker();
        assertAt(SyntaxKind.IF);
        codeExpr();
        block();
        if (eatIf(SyntaxKind.ELSE)) {
            if (at(SyntaxKind.IF)) {
                conditional();
            } else {
                block();
            }
        }
        wrap(m, SyntaxKind.CONDITIONAL);
    }

    private void whileLoop() {
        int m = marker();
        assertAt(SyntaxKind.WHILE);
        codeExpr();
        block();
        wrap(m, SyntaxKind.WHILE_LOOP);
    }

    private void forLoop() {
        int m = marker();
        assertAt(SyntaxKind.FOR);

        Set<String> seen = new HashSet<>();
        pattern(false, seen, null);

        if (at(SyntaxKind.COMMA)) {
            int comma = eatAndGet();
            nodes.set(comma, nodes.get(comma).unexpected()
                .hint("destructuring patterns must be wrapped in parentheses"));
            if (atSet(PATTERN)) {
                pattern(false, seen, null);
            }
        }

        expect(SyntaxKind.IN);
        codeExpr();
        block();
        wrap(m, SyntaxKind.FOR_LOOP);
    }

    private void moduleImport() {
        int m = marker();
        assertAt(SyntaxKind.IMPORT);
        codeExpr();

        if (eatIf(SyntaxKind.AS)) {
            expect(SyntaxKind.IDENT);
        }

        if (eatIf(SyntaxKind.COLON)) {
            if (at(SyntaxKind.LEFT_PAREN)) {
                int m1 = marker();
                enterNewlineMode(NewlineMode.CONTINUE);
                assertAt(SyntaxKind.LEFT_PAREN);
                importItems();
                expectClosingDelimiter(m1, SyntaxKind.RIGHT_PAREN);
                exitNewlineMode();
            } else if (!eatIf(SyntaxKind.STAR)) {
                importItems();
            }
        }
        wrap(m, SyntaxKind.MODULE_IMPORT);
    }

    private void importItems() {
        int m = marker();
        while (!current.isTerminator()) {
            int itemMarker = marker();
            if (!eatIf(SyntaxKind.IDENT)) {
                unexpected();
            }

            // Nested path: `a.b.c`
            while (eatIf(SyntaxKind.DOT)) {
                expect(SyntaxKind.IDENT);
            }
            wrap(itemMarker, SyntaxKind.IMPORT_ITEM_PATH);

            if (eatIf(SyntaxKind.AS)) {
                expect(SyntaxKind.IDENT);
                wrap(itemMarker, SyntaxKind.RENAMED_IMPORT_ITEM);
            }

            if (!current.isTerminator()) {
                expect(SyntaxKind.COMMA);
            }
        }
        wrap(m, SyntaxKind.IMPORT_ITEMS);
    }

    private void moduleInclude() {
        int m = marker();
        assertAt(SyntaxKind.INCLUDE);
        codeExpr();
        wrap(m, SyntaxKind.MODULE_INCLUDE);
    }

    private void keywordStatement(SyntaxKind keyword, SyntaxKind wrapper) {
        int m = marker();
        assertAt(keyword);
        wrap(m, wrapper);
    }

    private void returnStatement() {
        int m = marker();
        assertAt(SyntaxKind.RETURN);
        if (atSet(CODE_EXPR)) {
            codeExpr();
        }
        wrap(m, SyntaxKind.FUNC_RETURN);
    }

    // ========================================================================
    // Parenthesized Expressions, Arguments and Parameters
    // ========================================================================

    private void exprWithParen(boolean atomic) {
        if (atomic) {
            parenthesizedOrArrayOrDict();
            return;
        }

        Checkpoint checkpoint = checkpoint();
        SyntaxKind kind = parenthesizedOrArrayOrDict();

        if (at(SyntaxKind.ARROW)) {
            restore(checkpoint);
            int m = marker();
            params();
            if (!expect(SyntaxKind.ARROW)) {
                return;
            }
            codeExpr();
            wrap(m, SyntaxKind.CLOSURE);
        } else if (at(SyntaxKind.EQ) && kind != SyntaxKind.PARENTHESIZED) {
            restore(checkpoint);
            int m = marker();
            destructuringOrParenthesized(true, new HashSet<>());
            if (!expect(SyntaxKind.EQ)) {
                return;
            }
            codeExpr();
            wrap(m, SyntaxKind.DESTRUCT_ASSIGNMENT);
        }
    }

    private SyntaxKind parenthesizedOrArrayOrDict() {
        int m = marker();
        int count = 0;
        boolean maybeJustParens = true;
        SyntaxKind[] kind = {null};
        Set<String> seen = new HashSet<>();

        enterNewlineMode(NewlineMode.CONTINUE);
        assertAt(SyntaxKind.LEFT_PAREN);
        if (eatIf(SyntaxKind.COLON)) {
            kind[0] = SyntaxKind.DICT;
        }

        while (!current.isTerminator()) {
            if (!atSet(ARRAY_OR_DICT_ITEM)) {
                unexpected();
                continue;
            }
            if (!arrayOrDictItem(kind, seen)) {
                maybeJustParens = false;
            }
            count++;
            if (!current.isTerminator() && expect(SyntaxKind.COMMA)) {
                maybeJustParens = false;
            }
        }

        expectClosingDelimiter(m, SyntaxKind.RIGHT_PAREN);
        exitNewlineMode();

        SyntaxKind result;
        if (maybeJustParens && count == 1) {
            result = SyntaxKind.PARENTHESIZED;
        } else {
            result = kind[0] == null ? SyntaxKind.ARRAY : kind[0];
        }
        wrap(m, result);
        return result;
    }

    /**
     * Parses one item of an array or dictionary. {@code kind[0]} tracks which
     * of the two the group has turned out to be so far. Returns whether the
     * item could still be the content of plain parentheses.
     */
    private boolean arrayOrDictItem(SyntaxKind[] kind, Set<String> seen) {
        int m = marker();

        if (eatIf(SyntaxKind.DOTS)) {
            codeExpr();
            wrap(m, SyntaxKind.SPREAD);
            return false;
        }

        codeExpr();

        if (eatIf(SyntaxKind.COLON)) {
            codeExpr();
            SyntaxNode key = nodes.get(m);
            SyntaxKind pairKind = key.kind() == SyntaxKind.IDENT ? SyntaxKind.NAMED : SyntaxKind.KEYED;
            String name = switch (key.kind()) {
                case IDENT -> key.text();
                case STR -> Literals.unescapeString(key.text());
                default -> null;
            };
            if (name != null && !seen.add(name)) {
                nodes.set(m, key.toError("duplicate key: " + name));
            }
            wrap(m, pairKind);

            if (kind[0] == SyntaxKind.ARRAY) {
                nodes.set(m, nodes.get(m).expected("expression"));
            } else {
                kind[0] = SyntaxKind.DICT;
            }
            return false;
        }

        if (kind[0] == SyntaxKind.DICT) {
            nodes.set(m, nodes.get(m).expected("named or keyed pair"));
        } else {
            kind[0] = SyntaxKind.ARRAY;
        }
        return true;
    }

    private void args() {
        if (!at(SyntaxKind.LEFT_PAREN) && !at(SyntaxKind.LEFT_BRACKET)) {
            expected("argument list");
            if (at(SyntaxKind.LEFT_BRACE)) {
                hint("try using a `[]` block instead of a `{}` block");
            }
        }

        int m = marker();
        if (at(SyntaxKind.LEFT_PAREN)) {
            int m2 = marker();
            enterNewlineMode(NewlineMode.CONTINUE);
            assertAt(SyntaxKind.LEFT_PAREN);

            Set<String> seen = new HashSet<>();
            while (!current.isTerminator()) {
                if (!atSet(ARG)) {
                    unexpected();
                    continue;
                }
                arg(seen);
                if (!current.isTerminator()) {
                    expect(SyntaxKind.COMMA);
                }
            }

            expectClosingDelimiter(m2, SyntaxKind.RIGHT_PAREN);
            exitNewlineMode();
        }

        while (directlyAt(SyntaxKind.LEFT_BRACKET)) {
            contentBlock();
        }
        wrap(m, SyntaxKind.ARGS);
    }

    private void arg(Set<String> seen) {
        int m = marker();

        if (eatIf(SyntaxKind.DOTS)) {
            codeExpr();
            wrap(m, SyntaxKind.SPREAD);
            return;
        }

        String name = currentText();
        boolean wasAtExpr = atSet(CODE_EXPR);
        codeExpr();

        if (eatIf(SyntaxKind.COLON)) {
            if (wasAtExpr) {
                SyntaxNode key = nodes.get(m);
                if (key.kind() != SyntaxKind.IDENT) {
                    nodes.set(m, key.expected("identifier"));
                } else if (!seen.add(name)) {
                    nodes.set(m, key.toError("duplicate argument: " + name));
                }
            }
            codeExpr();
            wrap(m, SyntaxKind.NAMED);
        }
    }

    private void params() {
        int m = marker();
        enterNewlineMode(NewlineMode.CONTINUE);
        assertAt(SyntaxKind.LEFT_PAREN);

        Set<String> seen = new HashSet<>();
        boolean[] sink = {false};

        while (!current.isTerminator()) {
            if (!atSet(PARAM)) {
                unexpected();
                continue;
            }
            param(seen, sink);
            if (!current.isTerminator()) {
                expect(SyntaxKind.COMMA);
            }
        }

        expectClosingDelimiter(m, SyntaxKind.RIGHT_PAREN);
        exitNewlineMode();
        wrap(m, SyntaxKind.PARAMS);
    }

    private void param(Set<String> seen, boolean[] sink) {
        int m = marker();

        // Argument sink: `..rest`
        if (eatIf(SyntaxKind.DOTS)) {
            if (atSet(PATTERN_LEAF)) {
                patternLeaf(false, seen, "parameter");
            }
            wrap(m, SyntaxKind.SPREAD);
            if (sink[0]) {
                nodes.set(m, nodes.get(m).toError("only one argument sink is allowed"));
            }
            sink[0] = true;
            return;
        }

        boolean wasAtPattern = atSet(PATTERN);
        pattern(false, seen, "parameter");

        // Named parameter: `name: default`
        if (eatIf(SyntaxKind.COLON)) {
            if (wasAtPattern && nodes.get(m).kind() != SyntaxKind.IDENT) {
                nodes.set(m, nodes.get(m).expected("identifier"));
            }
            codeExpr();
            wrap(m, SyntaxKind.NAMED);
        }
    }

    // ========================================================================
    // Patterns
    // ========================================================================

    private void pattern(boolean reassignment, Set<String> seen, String dupe) {
        if (at(SyntaxKind.UNDERSCORE)) {
            eat();
        } else if (at(SyntaxKind.LEFT_PAREN)) {
            destructuringOrParenthesized(reassignment, seen);
        } else {
            patternLeaf(reassignment, seen, dupe);
        }
    }

    private void destructuringOrParenthesized(boolean reassignment, Set<String> seen) {
        boolean[] sink = {false};
        boolean[] maybeJustParens = {true};
        int count = 0;

        int m = marker();
        enterNewlineMode(NewlineMode.CONTINUE);
        assertAt(SyntaxKind.LEFT_PAREN);

        while (!current.isTerminator()) {
            if (!atSet(DESTRUCTURING_ITEM)) {
                unexpected();
                continue;
            }
            destructuringItem(reassignment, seen, maybeJustParens, sink);
            count++;
            if (!current.isTerminator() && expect(SyntaxKind.COMMA)) {
                maybeJustParens[0] = false;
            }
        }

        expectClosingDelimiter(m, SyntaxKind.RIGHT_PAREN);
        exitNewlineMode();

        if (maybeJustParens[0] && count == 1 && !sink[0]) {
            wrap(m, SyntaxKind.PARENTHESIZED);
        } else {
            wrap(m, SyntaxKind.DESTRUCTURING);
        }
    }

    private void destructuringItem(boolean reassignment, Set<String> seen,
                                   boolean[] maybeJustParens, boolean[] sink) {
        int m = marker();

        // Destructuring sink: `..rest`
        if (eatIf(SyntaxKind.DOTS)) {
            if (atSet(PATTERN_LEAF)) {
                patternLeaf(reassignment, seen, null);
            }
            wrap(m, SyntaxKind.SPREAD);
            if (sink[0]) {
                nodes.set(m, nodes.get(m).toError("only one destructuring sink is allowed"));
            }
            sink[0] = true;
            return;
        }

        boolean wasAtPattern = atSet(PATTERN);

        // Trivia may sit between the key and the colon, so a full checkpoint is needed
        Checkpoint checkpoint = checkpoint();
        if (!(eatIf(SyntaxKind.IDENT) && at(SyntaxKind.COLON))) {
            restore(checkpoint);
            pattern(reassignment, seen, null);
        }

        // Named item: `key: pattern`
        if (eatIf(SyntaxKind.COLON)) {
            if (wasAtPattern && nodes.get(m).kind() != SyntaxKind.IDENT) {
                nodes.set(m, nodes.get(m).expected("identifier"));
            }
            pattern(reassignment, seen, null);
            wrap(m, SyntaxKind.NAMED);
            maybeJustParens[0] = false;
        }
    }

    private void patternLeaf(boolean reassignment, Set<String> seen, String dupe) {
        if (current.isKeyword()) {
            int index = eatAndGet();
            nodes.set(index, nodes.get(index).expected("pattern"));
            return;
        } else if (!atSet(PATTERN_LEAF)) {
            expected("pattern");
            return;
        }

        int m = marker();
        String name = currentText();

        // An atomic expression is parsed so that the whole thing can be marked
        // as unexpected at once.
        codeExprPrec(true, PREC_NONE);

        if (!reassignment) {
            SyntaxNode node = nodes.get(m);
            if (node.kind() == SyntaxKind.IDENT) {
                if (!seen.add(name)) {
                    nodes.set(m, node.toError("duplicate " + (dupe == null ? "binding" : dupe) + ": " + name));
                }
            } else {
                nodes.set(m, node.expected("pattern"));
            }
        }
    }

    // ========================================================================
    // Token Stream
    // ========================================================================

    private boolean end() {
        return at(SyntaxKind.END);
    }

    private boolean at(SyntaxKind kind) {
        return current == kind;
    }

    private boolean atSet(Set<SyntaxKind> set) {
        return set.contains(current);
    }

    private boolean directlyAt(SyntaxKind kind) {
        return current == kind && prevEnd == currentStart;
    }

    private int currentEnd() {
        return lexer.cursor();
    }

    private String currentText() {
        return text.substring(currentStart, currentEnd());
    }

    private int marker() {
        return nodes.size();
    }

    private boolean progress(int offset) {
        return offset < prevEnd;
    }

    private void eat() {
        save();
        lex();
        skip();
    }

    /**
     * Eats the current token and returns the index of its node.
     */
    private int eatAndGet() {
        int index = nodes.size();
        eat();
        return index;
    }

    private boolean eatIf(SyntaxKind kind) {
        boolean at = at(kind);
        if (at) {
            eat();
        }
        return at;
    }

    private boolean eatIfDirect(SyntaxKind kind) {
        boolean at = directlyAt(kind);
        if (at) {
            eat();
        }
        return at;
    }

    private void assertAt(SyntaxKind kind) {
        if (current != kind) {
            throw new IllegalStateException("Expected " + kind + " but parser is at " + current);
        }
        eat();
    }

    private void convert(SyntaxKind kind) {
        current = kind;
        eat();
    }

    /**
     * The index in front of any trivia at the end of the node buffer. In markup
     * trivia are significant and never excluded.
     */
    private int beforeTrivia() {
        int i = nodes.size();
        if (lexer.mode() != LexMode.MARKUP && prevEnd != currentStart) {
            while (i > 0 && nodes.get(i - 1).kind().isTrivia()) {
                i--;
            }
        }
        return i;
    }

    private void wrap(int from, SyntaxKind kind) {
        int to = beforeTrivia();
        wrapRange(Math.min(from, to), to, kind);
    }

    private void wrapAll(int from, SyntaxKind kind) {
        wrapRange(Math.min(from, nodes.size()), nodes.size(), kind);
    }

    private void wrapRange(int from, int to, SyntaxKind kind) {
        List<SyntaxNode> range = nodes.subList(from, to);
        SyntaxNode node = SyntaxNode.inner(kind, range);
        range.clear();
        nodes.add(from, node);
    }

    private void enter(LexMode mode) {
        modes.push(lexer.mode());
        lexer.setMode(mode);
    }

    private void exit() {
        LexMode mode = modes.pop();
        if (mode != lexer.mode()) {
            unskip();
            lexer.setMode(mode);
            lexer.jump(currentStart);
            lex();
            skip();
        }
    }

    private void enterNewlineMode(NewlineMode mode) {
        newlineModes.push(mode);
    }

    private void exitNewlineMode() {
        unskip();
        newlineModes.pop();
        lexer.jump(prevEnd);
        lex();
        skip();
    }

    private Checkpoint checkpoint() {
        return new Checkpoint(lexer.cursor(), lexer.mode(), prevEnd, currentStart,
            current, currentNode, currentNewline, nodes.size());
    }

    private void restore(Checkpoint checkpoint) {
        lexer.jump(checkpoint.cursor());
        lexer.setMode(checkpoint.mode());
        prevEnd = checkpoint.prevEnd();
        currentStart = checkpoint.currentStart();
        current = checkpoint.current();
        currentNode = checkpoint.currentNode();
        currentNewline = checkpoint.currentNewline();
        nodes.subList(checkpoint.nodeCount(), nodes.size()).clear();
    }

    private void skip() {
        if (lexer.mode() != LexMode.MARKUP) {
            while (current.isTrivia()) {
                save();
                lex();
            }
        }
    }

    private void unskip() {
        if (lexer.mode() != LexMode.MARKUP && prevEnd != currentStart) {
            while (!nodes.isEmpty() && nodes.get(nodes.size() - 1).kind().isTrivia()) {
                nodes.remove(nodes.size() - 1);
            }
            lexer.jump(prevEnd);
            lex();
        }
    }

    private void save() {
        SyntaxNode node = current == currentNode.kind() ? currentNode : currentNode.withKind(current);
        nodes.add(node);
        if (lexer.mode() == LexMode.MARKUP || !current.isTrivia()) {
            prevEnd = currentEnd();
        }
    }

    private void lex() {
        currentStart = lexer.cursor();
        currentNode = lexer.next();
        current = currentNode.kind();
        currentNewline = lexer.newline();

        // Newlines end embedded code expressions unless the next token continues them
        if (lexer.mode() == LexMode.CODE && currentNewline && !newlineModes.isEmpty()) {
            boolean stop = switch (newlineModes.peek()) {
                case STOP -> true;
                case CONTEXTUAL -> {
                    SyntaxKind next = nextNonTrivia();
                    yield next != SyntaxKind.ELSE && next != SyntaxKind.DOT;
                }
                case CONTINUE -> false;
            };
            if (stop) {
                current = SyntaxKind.END;
            }
        }
    }

    /**
     * The kind of the token right after the current one, trivia included.
     */
    private SyntaxKind peekKind() {
        int saved = lexer.cursor();
        SyntaxKind kind = lexer.next().kind();
        lexer.jump(saved);
        return kind;
    }

    private SyntaxKind nextNonTrivia() {
        int saved = lexer.cursor();
        SyntaxKind kind;
        do {
            kind = lexer.next().kind();
        } while (kind.isTrivia());
        lexer.jump(saved);
        return kind;
    }

    // ========================================================================
    // Error Recovery
    // ========================================================================

    /**
     * Eats the token if it is there and reports it as missing otherwise.
     */
    private boolean expect(SyntaxKind kind) {
        boolean at = at(kind);
        if (at) {
            eat();
        } else if (kind == SyntaxKind.IDENT && current.isKeyword()) {
            trimErrors();
            int index = eatAndGet();
            nodes.set(index, nodes.get(index).expected(kind.description()));
        } else {
            expected(kind.description());
        }
        return at;
    }

    private void expectClosingDelimiter(int open, SyntaxKind kind) {
        if (!eatIf(kind)) {
            nodes.set(open, nodes.get(open).toError("unclosed delimiter"));
        }
    }

    /**
     * Inserts a zero-length error unless one was just reported.
     */
    private void expected(String thing) {
        if (!afterError()) {
            expectedAt(beforeTrivia(), thing);
        }
    }

    private boolean afterError() {
        int m = beforeTrivia();
        return m > 0 && nodes.get(m - 1).kind().isError();
    }

    private void expectedAt(int m, String thing) {
        nodes.add(m, SyntaxNode.error(new SyntaxError("expected " + thing), ""));
    }

    private void hint(String hint) {
        int m = beforeTrivia();
        if (m > 0) {
            nodes.set(m - 1, nodes.get(m - 1).hint(hint));
        }
    }

    /**
     * Converts the current token into an error and eats it.
     */
    private void unexpected() {
        trimErrors();
        int index = eatAndGet();
        nodes.set(index, nodes.get(index).unexpected());
    }

    /**
     * Removes zero-length errors right before the current token, they are
     * superseded by the error about the token itself.
     */
    private void trimErrors() {
        int end = beforeTrivia();
        int start = end;
        while (start > 0 && nodes.get(start - 1).kind().isError() && nodes.get(start - 1).len() == 0) {
            start--;
        }
        nodes.subList(start, end).clear();
    }
}
