package com.typstparser.lower;

import com.typstparser.ast.Arg;
import com.typstparser.ast.ArrayExpr;
import com.typstparser.ast.ArrayItem;
import com.typstparser.ast.AstNode;
import com.typstparser.ast.AutoLiteral;
import com.typstparser.ast.BinOp;
import com.typstparser.ast.Binary;
import com.typstparser.ast.BoolLiteral;
import com.typstparser.ast.ByteRange;
import com.typstparser.ast.Closure;
import com.typstparser.ast.CodeBlock;
import com.typstparser.ast.Conditional;
import com.typstparser.ast.ContentBlock;
import com.typstparser.ast.Contextual;
import com.typstparser.ast.DestructAssignment;
import com.typstparser.ast.DictExpr;
import com.typstparser.ast.DictItem;
import com.typstparser.ast.Emph;
import com.typstparser.ast.EnumItem;
import com.typstparser.ast.Equation;
import com.typstparser.ast.Escape;
import com.typstparser.ast.FieldAccess;
import com.typstparser.ast.FloatLiteral;
import com.typstparser.ast.ForLoop;
import com.typstparser.ast.FuncCall;
import com.typstparser.ast.FuncReturn;
import com.typstparser.ast.Heading;
import com.typstparser.ast.Ident;
import com.typstparser.ast.ImportItem;
import com.typstparser.ast.Imports;
import com.typstparser.ast.IntLiteral;
import com.typstparser.ast.Label;
import com.typstparser.ast.LetBinding;
import com.typstparser.ast.LetBindingKind;
import com.typstparser.ast.Linebreak;
import com.typstparser.ast.Link;
import com.typstparser.ast.ListItem;
import com.typstparser.ast.LoopBreak;
import com.typstparser.ast.LoopContinue;
import com.typstparser.ast.MathAlignPoint;
import com.typstparser.ast.MathAttach;
import com.typstparser.ast.MathContent;
import com.typstparser.ast.MathDelimited;
import com.typstparser.ast.MathFrac;
import com.typstparser.ast.MathIdent;
import com.typstparser.ast.MathPrimes;
import com.typstparser.ast.MathRoot;
import com.typstparser.ast.MathShorthand;
import com.typstparser.ast.MathText;
import com.typstparser.ast.MathTextKind;
import com.typstparser.ast.ModuleImport;
import com.typstparser.ast.ModuleInclude;
import com.typstparser.ast.NoneLiteral;
import com.typstparser.ast.NumericLiteral;
import com.typstparser.ast.Parbreak;
import com.typstparser.ast.Parenthesized;
import com.typstparser.ast.Pattern;
import com.typstparser.ast.Raw;
import com.typstparser.ast.Ref;
import com.typstparser.ast.SetRule;
import com.typstparser.ast.Shorthand;
import com.typstparser.ast.ShowRule;
import com.typstparser.ast.SmartQuote;
import com.typstparser.ast.Space;
import com.typstparser.ast.StrLiteral;
import com.typstparser.ast.Strong;
import com.typstparser.ast.TermItem;
import com.typstparser.ast.Text;
import com.typstparser.ast.UnOp;
import com.typstparser.ast.Unary;
import com.typstparser.ast.Unit;
import com.typstparser.ast.WhileLoop;
import com.typstparser.syntax.SyntaxKind;
import com.typstparser.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Lowers a concrete syntax tree into typed nodes.
 *
 * <p>Every {@link SyntaxKind} has a {@link Role}. Expression kinds lower to
 * exactly one typed node each; structural kinds (argument lists, parameters,
 * named pairs, ...) are consumed by the node that contains them; tokens and
 * trivia carry no content of their own. Error nodes are dropped from bodies,
 * the diagnostics already describe them.</p>
 *
 * <p>An instance is bound to one tree through its {@link RangeNormalizer} and
 * must not be shared between trees.</p>
 */
public final class AstLowering {

    /**
     * What a syntax kind contributes to the typed tree.
     */
    public enum Role {
        EXPRESSION,  // lowers to a typed node of its own
        STRUCTURE,   // inner node consumed by its parent
        TOKEN,       // keyword, punctuation or marker
        TRIVIA,      // comments and shebangs
        ERROR
    }

    private static final Set<SyntaxKind> IMPORT_SOURCE_STOPS = EnumSet.of(SyntaxKind.AS, SyntaxKind.COLON);

    private final RangeNormalizer ranges;
    private final PatternResolver patterns;

    public AstLowering(RangeNormalizer ranges) {
        this.ranges = ranges;
        this.patterns = new PatternResolver(this, ranges);
    }

    /**
     * Classifies a syntax kind. The switch has no default branch so that a new
     * kind cannot be added without deciding how it lowers.
     */
    public static Role roleOf(SyntaxKind kind) {
        return switch (kind) {
            case TEXT, SPACE, LINEBREAK, PARBREAK, ESCAPE, SHORTHAND, SMART_QUOTE, STRONG, EMPH,
                 RAW, LINK, LABEL, REF, HEADING, LIST_ITEM, ENUM_ITEM, TERM_ITEM, EQUATION,
                 MATH, MATH_TEXT, MATH_IDENT, MATH_SHORTHAND, MATH_ALIGN_POINT, MATH_DELIMITED,
                 MATH_ATTACH, MATH_PRIMES, MATH_FRAC, MATH_ROOT,
                 IDENT, NONE, AUTO, BOOL, INT, FLOAT, NUMERIC, STR,
                 CODE_BLOCK, CONTENT_BLOCK, PARENTHESIZED, ARRAY, DICT, UNARY, BINARY,
                 FIELD_ACCESS, FUNC_CALL, CLOSURE, LET_BINDING, DESTRUCT_ASSIGNMENT, SET_RULE,
                 SHOW_RULE, CONTEXTUAL, CONDITIONAL, WHILE_LOOP, FOR_LOOP, MODULE_IMPORT,
                 MODULE_INCLUDE, LOOP_BREAK, LOOP_CONTINUE, FUNC_RETURN -> Role.EXPRESSION;

            case MARKUP, CODE, NAMED, KEYED, ARGS, SPREAD, PARAMS, IMPORT_ITEMS, IMPORT_ITEM_PATH,
                 RENAMED_IMPORT_ITEM, DESTRUCTURING -> Role.STRUCTURE;

            case END, RAW_LANG, RAW_DELIM, RAW_TRIMMED, REF_MARKER, HEADING_MARKER, LIST_MARKER,
                 ENUM_MARKER, TERM_MARKER,
                 HASH, LEFT_BRACE, RIGHT_BRACE, LEFT_BRACKET, RIGHT_BRACKET, LEFT_PAREN, RIGHT_PAREN,
                 COMMA, SEMICOLON, COLON, STAR, UNDERSCORE, DOLLAR, PLUS, MINUS, SLASH, HAT, PRIME,
                 DOT, EQ, EQ_EQ, EXCL_EQ, LT, LT_EQ, GT, GT_EQ, PLUS_EQ, HYPH_EQ, STAR_EQ, SLASH_EQ,
                 DOTS, ARROW, ROOT,
                 NOT, AND, OR, LET, SET, SHOW, CONTEXT, IF, ELSE, FOR, IN, WHILE, BREAK, CONTINUE,
                 RETURN, IMPORT, INCLUDE, AS -> Role.TOKEN;

            case SHEBANG, LINE_COMMENT, BLOCK_COMMENT -> Role.TRIVIA;

            case ERROR -> Role.ERROR;
        };
    }

    // ========================================================================
    // Bodies
    // ========================================================================

    /**
     * Lowers the root of a parsed document into its top-level body.
     */
    public List<AstNode> lowerRoot(SyntaxNode root) {
        return switch (root.kind()) {
            case MARKUP, MATH -> body(root, true);
            case CODE -> body(root, false);
            default -> List.of(lower(root));
        };
    }

    /**
     * Lowers the expression children of a markup, math or code node. Spaces
     * and paragraph breaks are content in markup and math but not in code.
     */
    private List<AstNode> body(SyntaxNode node, boolean keepSpace) {
        List<AstNode> body = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (roleOf(child.kind()) != Role.EXPRESSION) {
                continue;
            }
            if (!keepSpace && child.kind().isTrivia()) {
                continue;
            }
            body.add(lower(child));
        }
        return body;
    }

    /**
     * The body of the first child of the given container kind. A container
     * that error recovery left out yields an empty body.
     */
    private List<AstNode> bodyOf(SyntaxNode node, SyntaxKind container) {
        SyntaxNode child = SyntaxNodes.child(node, container);
        if (child == null) {
            requireErroneous(node, container.description());
            return List.of();
        }
        return body(child, container != SyntaxKind.CODE);
    }

    // ========================================================================
    // Dispatch
    // ========================================================================

    /**
     * Lowers a single expression node.
     *
     * @throws LoweringException if the node is not an expression or lacks a
     *         child its kind requires
     */
    public AstNode lower(SyntaxNode node) {
        ByteRange range = ranges.rangeOf(node);
        String text = node.text();
        return switch (node.kind()) {
            // Markup
            case TEXT -> new Text(range, text);
            case SPACE -> new Space(range);
            case LINEBREAK -> new Linebreak(range);
            case PARBREAK -> new Parbreak(range);
            case ESCAPE -> new Escape(range, Literals.escapeCharacter(text));
            case SHORTHAND -> new Shorthand(range, Literals.shorthandCharacter(text));
            case SMART_QUOTE -> new SmartQuote(range, text.equals("\""));
            case STRONG -> new Strong(range, bodyOf(node, SyntaxKind.MARKUP));
            case EMPH -> new Emph(range, bodyOf(node, SyntaxKind.MARKUP));
            case RAW -> raw(node, range);
            case LINK -> new Link(range, text);
            case LABEL -> new Label(range, text.substring(1, text.length() - 1));
            case REF -> ref(node, range);
            case HEADING -> heading(node, range);
            case LIST_ITEM -> new ListItem(range, bodyOf(node, SyntaxKind.MARKUP));
            case ENUM_ITEM -> enumItem(node, range);
            case TERM_ITEM -> termItem(node, range);
            case EQUATION -> equation(node, range);

            // Math
            case MATH -> new MathContent(range, body(node, true));
            case MATH_TEXT -> new MathText(range, mathText(text));
            case MATH_IDENT -> new MathIdent(range, text);
            case MATH_SHORTHAND -> new MathShorthand(range, Literals.mathShorthandCharacter(text));
            case MATH_ALIGN_POINT -> new MathAlignPoint(range);
            case MATH_DELIMITED -> mathDelimited(node, range);
            case MATH_ATTACH -> mathAttach(node, range);
            case MATH_PRIMES -> new MathPrimes(range, SyntaxNodes.children(node, SyntaxKind.PRIME).size());
            case MATH_FRAC -> new MathFrac(range,
                required(node, SyntaxNodes.firstExpr(node), "numerator"),
                required(node, SyntaxNodes.exprAfter(node, SyntaxKind.SLASH), "denominator"));
            case MATH_ROOT -> mathRoot(node, range);

            // Literals
            case IDENT -> new Ident(range, text);
            case NONE -> new NoneLiteral(range);
            case AUTO -> new AutoLiteral(range);
            case BOOL -> new BoolLiteral(range, text.equals("true"));
            case INT -> new IntLiteral(range, Literals.intValue(text));
            case FLOAT -> new FloatLiteral(range, Literals.floatValue(text));
            case NUMERIC -> numeric(node, range);
            case STR -> new StrLiteral(range, Literals.unescapeString(text));

            // Code
            case CODE_BLOCK -> new CodeBlock(range, bodyOf(node, SyntaxKind.CODE));
            case CONTENT_BLOCK -> new ContentBlock(range, bodyOf(node, SyntaxKind.MARKUP));
            case PARENTHESIZED -> new Parenthesized(range, required(node, SyntaxNodes.firstExpr(node), "expression"));
            case ARRAY -> new ArrayExpr(range, arrayItems(node));
            case DICT -> new DictExpr(range, dictItems(node));
            case UNARY -> unary(node, range);
            case BINARY -> binary(node, range);
            case FIELD_ACCESS -> fieldAccess(node, range);
            case FUNC_CALL -> new FuncCall(range,
                required(node, SyntaxNodes.firstExpr(node), "callee"),
                args(node));
            case CLOSURE -> closure(node, range);
            case LET_BINDING -> letBinding(node, range);
            case DESTRUCT_ASSIGNMENT -> new DestructAssignment(range,
                patterns.requiredPattern(node, SyntaxNodes.patternBetween(node, null, SyntaxKind.EQ)),
                required(node, SyntaxNodes.exprAfter(node, SyntaxKind.EQ), "value"));
            case SET_RULE -> setRule(node, range);
            case SHOW_RULE -> showRule(node, range);
            case CONTEXTUAL -> new Contextual(range, required(node, SyntaxNodes.firstExpr(node), "body"));
            case CONDITIONAL -> conditional(node, range);
            case WHILE_LOOP -> whileLoop(node, range);
            case FOR_LOOP -> forLoop(node, range);
            case MODULE_IMPORT -> moduleImport(node, range);
            case MODULE_INCLUDE -> new ModuleInclude(range, required(node, SyntaxNodes.firstExpr(node), "source"));
            case LOOP_BREAK -> new LoopBreak(range);
            case LOOP_CONTINUE -> new LoopContinue(range);
            case FUNC_RETURN -> new FuncReturn(range, lowerOrNull(SyntaxNodes.firstExpr(node)));

            default -> throw new LoweringException(node.kind(), range,
                "not an expression (" + roleOf(node.kind()).name().toLowerCase() + ")");
        };
    }

    // ========================================================================
    // Required and Optional Children
    // ========================================================================

    /**
     * Lowers a required child. A child missing from an erroneous node becomes
     * a detached {@code none} placeholder; a child missing from a node without
     * errors means the tree and the lowering rules disagree.
     */
    AstNode required(SyntaxNode parent, SyntaxNode child, String what) {
        if (child != null) {
            return lower(child);
        }
        requireErroneous(parent, what);
        return placeholder();
    }

    AstNode lowerOrNull(SyntaxNode node) {
        return node == null ? null : lower(node);
    }

    AstNode lowerOrPlaceholder(SyntaxNode node) {
        return node == null ? placeholder() : lower(node);
    }

    private String requiredText(SyntaxNode parent, SyntaxNode child, String what) {
        if (child != null) {
            return child.text();
        }
        requireErroneous(parent, what);
        return null;
    }

    private void requireErroneous(SyntaxNode parent, String what) {
        if (!parent.erroneous()) {
            throw new LoweringException(parent.kind(), ranges.rangeOf(parent), "missing " + what);
        }
    }

    private static AstNode placeholder() {
        return new NoneLiteral(null);
    }

    // ========================================================================
    // Markup
    // ========================================================================

    private Raw raw(SyntaxNode node, ByteRange range) {
        List<String> lines = new ArrayList<>();
        String lang = null;
        int delimiter = 0;
        boolean spansLines = false;
        for (SyntaxNode child : node.children()) {
            switch (child.kind()) {
                case TEXT -> lines.add(child.text());
                case RAW_LANG -> lang = child.text();
                case RAW_DELIM -> delimiter = child.text().length();
                case RAW_TRIMMED -> spansLines |= child.text().chars().anyMatch(c -> c == '\n' || c == '\r');
                default -> {
                }
            }
        }
        return new Raw(range, lines, lang, delimiter >= 3 && spansLines);
    }

    private Ref ref(SyntaxNode node, ByteRange range) {
        SyntaxNode marker = SyntaxNodes.child(node, SyntaxKind.REF_MARKER);
        String target = requiredText(node, marker, "reference marker");
        if (target != null && target.startsWith("@")) {
            target = target.substring(1);
        }
        SyntaxNode supplement = SyntaxNodes.child(node, SyntaxKind.CONTENT_BLOCK);
        return new Ref(range, target, supplement == null ? null : bodyOf(supplement, SyntaxKind.MARKUP));
    }

    private Heading heading(SyntaxNode node, ByteRange range) {
        SyntaxNode marker = SyntaxNodes.child(node, SyntaxKind.HEADING_MARKER);
        int depth = marker == null ? 0 : marker.text().length();
        return new Heading(range, depth, bodyOf(node, SyntaxKind.MARKUP));
    }

    private EnumItem enumItem(SyntaxNode node, ByteRange range) {
        SyntaxNode marker = SyntaxNodes.child(node, SyntaxKind.ENUM_MARKER);
        Long number = null;
        if (marker != null && marker.text().endsWith(".")) {
            number = Literals.parseEnumNumber(marker.text().substring(0, marker.text().length() - 1));
        }
        return new EnumItem(range, number, bodyOf(node, SyntaxKind.MARKUP));
    }

    private TermItem termItem(SyntaxNode node, ByteRange range) {
        List<SyntaxNode> parts = SyntaxNodes.children(node, SyntaxKind.MARKUP);
        List<AstNode> term = parts.isEmpty() ? List.of() : body(parts.get(0), true);
        List<AstNode> description = parts.size() < 2 ? List.of() : body(parts.get(1), true);
        if (parts.size() < 2) {
            requireErroneous(node, "description");
        }
        return new TermItem(range, term, description);
    }

    private Equation equation(SyntaxNode node, ByteRange range) {
        List<SyntaxNode> children = node.children();
        int n = children.size();
        boolean block = n >= 4
            && children.get(1).kind() == SyntaxKind.SPACE
            && children.get(n - 2).kind() == SyntaxKind.SPACE;
        return new Equation(range, bodyOf(node, SyntaxKind.MATH), block);
    }

    // ========================================================================
    // Math
    // ========================================================================

    private static MathTextKind mathText(String text) {
        if (!text.isEmpty() && Character.isDigit(text.codePointAt(0))) {
            return new MathTextKind.Number(text);
        }
        return new MathTextKind.Character(text);
    }

    private MathDelimited mathDelimited(SyntaxNode node, ByteRange range) {
        List<SyntaxNode> children = node.children();
        if (children.size() < 2) {
            throw new LoweringException(node.kind(), range, "missing delimiters");
        }
        return new MathDelimited(range,
            lower(children.get(0)),
            bodyOf(node, SyntaxKind.MATH),
            lower(children.get(children.size() - 1)));
    }

    private MathAttach mathAttach(SyntaxNode node, ByteRange range) {
        SyntaxNode base = SyntaxNodes.firstExpr(node);
        Integer primes = null;
        if (base != null) {
            SyntaxNode next = SyntaxNodes.nextSibling(node, base);
            if (next != null && next.kind() == SyntaxKind.MATH_PRIMES) {
                primes = SyntaxNodes.children(next, SyntaxKind.PRIME).size();
            }
        }
        return new MathAttach(range,
            required(node, base, "base"),
            lowerOrNull(SyntaxNodes.exprAfter(node, SyntaxKind.UNDERSCORE)),
            lowerOrNull(SyntaxNodes.exprAfter(node, SyntaxKind.HAT)),
            primes);
    }

    private MathRoot mathRoot(SyntaxNode node, ByteRange range) {
        SyntaxNode sign = SyntaxNodes.child(node, SyntaxKind.ROOT);
        Integer index = null;
        if (sign != null) {
            index = switch (sign.text()) {
                case "∛" -> 3;
                case "∜" -> 4;
                default -> null;
            };
        }
        return new MathRoot(range, index, required(node, SyntaxNodes.firstExpr(node), "radicand"));
    }

    // ========================================================================
    // Literals
    // ========================================================================

    private NumericLiteral numeric(SyntaxNode node, ByteRange range) {
        Unit unit = Literals.numericUnit(node.text());
        if (unit == null) {
            throw new LoweringException(node.kind(), range, "unknown unit in " + node.text());
        }
        return new NumericLiteral(range, Literals.numericValue(node.text()), unit);
    }

    // ========================================================================
    // Collections and Calls
    // ========================================================================

    private List<ArrayItem> arrayItems(SyntaxNode node) {
        List<ArrayItem> items = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (child.kind() == SyntaxKind.SPREAD) {
                items.add(new ArrayItem.Spread(
                    required(child, SyntaxNodes.firstExpr(child), "spread expression"),
                    SyntaxNodes.sinkIdent(child)));
            } else if (SyntaxNodes.isExpr(child)) {
                items.add(new ArrayItem.Pos(lower(child)));
            }
        }
        return items;
    }

    private List<DictItem> dictItems(SyntaxNode node) {
        List<DictItem> items = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            switch (child.kind()) {
                case NAMED -> {
                    String name = SyntaxNodes.keyName(child);
                    if (name != null) {
                        items.add(new DictItem.Named(name,
                            required(child, SyntaxNodes.exprAfter(child, SyntaxKind.COLON), "value")));
                    }
                }
                case KEYED -> items.add(new DictItem.Keyed(
                    required(child, SyntaxNodes.exprBefore(child, Set.of(SyntaxKind.COLON)), "key"),
                    required(child, SyntaxNodes.exprAfter(child, SyntaxKind.COLON), "value")));
                case SPREAD -> items.add(new DictItem.Spread(
                    required(child, SyntaxNodes.firstExpr(child), "spread expression"),
                    SyntaxNodes.sinkIdent(child)));
                default -> {
                }
            }
        }
        return items;
    }

    /**
     * The arguments of a call or set rule, taken from its argument list child.
     * Trailing content blocks are positional arguments.
     */
    private List<Arg> args(SyntaxNode node) {
        SyntaxNode argList = SyntaxNodes.child(node, SyntaxKind.ARGS);
        if (argList == null) {
            requireErroneous(node, "arguments");
            return List.of();
        }
        List<Arg> args = new ArrayList<>();
        for (SyntaxNode child : argList.children()) {
            switch (child.kind()) {
                case NAMED -> {
                    String name = SyntaxNodes.keyName(child);
                    if (name != null) {
                        args.add(new Arg.Named(name,
                            required(child, SyntaxNodes.exprAfter(child, SyntaxKind.COLON), "value")));
                    }
                }
                case SPREAD -> args.add(new Arg.Spread(
                    required(child, SyntaxNodes.firstExpr(child), "spread expression"),
                    SyntaxNodes.sinkIdent(child)));
                default -> {
                    if (SyntaxNodes.isExpr(child)) {
                        args.add(new Arg.Pos(lower(child)));
                    }
                }
            }
        }
        return args;
    }

    // ========================================================================
    // Operations
    // ========================================================================

    private Unary unary(SyntaxNode node, ByteRange range) {
        UnOp op = null;
        for (SyntaxNode child : node.children()) {
            op = Operators.unOp(child.kind());
            if (op != null) {
                break;
            }
        }
        if (op == null) {
            throw new LoweringException(node.kind(), range, "missing operator");
        }
        return new Unary(range, op, required(node, SyntaxNodes.firstExpr(node), "operand"));
    }

    private Binary binary(SyntaxNode node, ByteRange range) {
        BinOp op = null;
        SyntaxKind operator = null;
        for (SyntaxNode child : node.children()) {
            if (child.kind() == SyntaxKind.NOT) {
                op = BinOp.NOT_IN;
                operator = SyntaxKind.IN;
                break;
            }
            op = Operators.binOp(child.kind());
            if (op != null) {
                operator = child.kind();
                break;
            }
        }
        if (op == null) {
            throw new LoweringException(node.kind(), range, "missing operator");
        }
        return new Binary(range, op,
            required(node, SyntaxNodes.firstExpr(node), "left operand"),
            required(node, SyntaxNodes.exprAfter(node, operator), "right operand"));
    }

    private FieldAccess fieldAccess(SyntaxNode node, ByteRange range) {
        SyntaxNode field = null;
        boolean afterDot = false;
        for (SyntaxNode child : node.children()) {
            if (child.kind() == SyntaxKind.DOT) {
                afterDot = true;
            } else if (afterDot && child.kind() == SyntaxKind.IDENT) {
                field = child;
                break;
            }
        }
        return new FieldAccess(range,
            required(node, SyntaxNodes.firstExpr(node), "target"),
            requiredText(node, field, "field name"));
    }

    // ========================================================================
    // Closures and Bindings
    // ========================================================================

    private Closure closure(SyntaxNode node, ByteRange range) {
        String name = null;
        SyntaxNode params = null;
        for (SyntaxNode child : node.children()) {
            if (child.kind() == SyntaxKind.PARAMS) {
                params = child;
                break;
            }
            if (child.kind() == SyntaxKind.IDENT) {
                name = child.text();
            }
        }
        if (params == null) {
            requireErroneous(node, "parameters");
        }
        SyntaxNode body = SyntaxNodes.child(node, SyntaxKind.ARROW) != null
            ? SyntaxNodes.exprAfter(node, SyntaxKind.ARROW)
            : SyntaxNodes.exprAfter(node, SyntaxKind.EQ);
        return new Closure(range, name,
            params == null ? List.of() : patterns.params(params),
            required(node, body, "body"));
    }

    private LetBinding letBinding(SyntaxNode node, ByteRange range) {
        SyntaxNode closure = SyntaxNodes.child(node, SyntaxKind.CLOSURE);
        if (closure != null) {
            SyntaxNode name = SyntaxNodes.child(closure, SyntaxKind.IDENT);
            return new LetBinding(range,
                new LetBindingKind.Closure(requiredText(closure, name, "closure name")),
                lower(closure));
        }
        Pattern pattern = patterns.requiredPattern(node,
            SyntaxNodes.patternBetween(node, SyntaxKind.LET, SyntaxKind.EQ));
        SyntaxNode init = SyntaxNodes.exprAfter(node, SyntaxKind.EQ);
        if (init == null && SyntaxNodes.child(node, SyntaxKind.EQ) != null) {
            requireErroneous(node, "initializer");
        }
        return new LetBinding(range, new LetBindingKind.Normal(pattern), lowerOrNull(init));
    }

    // ========================================================================
    // Rules
    // ========================================================================

    private SetRule setRule(SyntaxNode node, ByteRange range) {
        return new SetRule(range,
            required(node, SyntaxNodes.exprBefore(node, Set.of(SyntaxKind.ARGS, SyntaxKind.IF)), "target"),
            args(node),
            lowerOrNull(SyntaxNodes.exprAfter(node, SyntaxKind.IF)));
    }

    /**
     * {@code show selector: transform}. Without a colon the only expression
     * is taken as the transform.
     */
    private ShowRule showRule(SyntaxNode node, ByteRange range) {
        if (SyntaxNodes.child(node, SyntaxKind.COLON) == null) {
            List<SyntaxNode> exprs = SyntaxNodes.exprs(node);
            SyntaxNode transform = exprs.isEmpty() ? null : exprs.get(exprs.size() - 1);
            return new ShowRule(range, null, required(node, transform, "transform"));
        }
        return new ShowRule(range,
            lowerOrNull(SyntaxNodes.exprBefore(node, Set.of(SyntaxKind.COLON))),
            required(node, SyntaxNodes.exprAfter(node, SyntaxKind.COLON), "transform"));
    }

    // ========================================================================
    // Control Flow
    // ========================================================================

    private Conditional conditional(SyntaxNode node, ByteRange range) {
        List<SyntaxNode> exprs = SyntaxNodes.exprs(node);
        return new Conditional(range,
            required(node, exprs.isEmpty() ? null : exprs.get(0), "condition"),
            required(node, exprs.size() < 2 ? null : exprs.get(1), "body"),
            exprs.size() < 3 ? null : lower(exprs.get(2)));
    }

    private WhileLoop whileLoop(SyntaxNode node, ByteRange range) {
        List<SyntaxNode> exprs = SyntaxNodes.exprs(node);
        return new WhileLoop(range,
            required(node, exprs.isEmpty() ? null : exprs.get(0), "condition"),
            required(node, exprs.size() < 2 ? null : exprs.get(1), "body"));
    }

    private ForLoop forLoop(SyntaxNode node, ByteRange range) {
        Pattern pattern = patterns.requiredPattern(node,
            SyntaxNodes.patternBetween(node, SyntaxKind.FOR, SyntaxKind.IN));
        List<SyntaxNode> afterIn = SyntaxNodes.exprsAfter(node, SyntaxKind.IN);
        return new ForLoop(range, pattern,
            required(node, afterIn.isEmpty() ? null : afterIn.get(0), "iterable"),
            required(node, afterIn.size() < 2 ? null : afterIn.get(1), "body"));
    }

    // ========================================================================
    // Modules
    // ========================================================================

    private ModuleImport moduleImport(SyntaxNode node, ByteRange range) {
        AstNode source = required(node, SyntaxNodes.exprBefore(node, IMPORT_SOURCE_STOPS), "source");

        String newName = null;
        boolean afterAs = false;
        for (SyntaxNode child : node.children()) {
            if (child.kind() == SyntaxKind.AS) {
                afterAs = true;
            } else if (afterAs && child.kind() == SyntaxKind.IDENT) {
                newName = child.text();
                break;
            } else if (child.kind() == SyntaxKind.COLON) {
                break;
            }
        }

        Imports imports = null;
        if (SyntaxNodes.child(node, SyntaxKind.STAR) != null) {
            imports = new Imports.Wildcard();
        } else {
            SyntaxNode items = SyntaxNodes.child(node, SyntaxKind.IMPORT_ITEMS);
            if (items != null) {
                imports = new Imports.Items(importItems(items));
            }
        }
        return new ModuleImport(range, source, newName, imports);
    }

    private List<ImportItem> importItems(SyntaxNode items) {
        List<ImportItem> result = new ArrayList<>();
        for (SyntaxNode child : items.children()) {
            switch (child.kind()) {
                case IMPORT_ITEM_PATH -> {
                    List<String> path = importPath(child);
                    if (!path.isEmpty()) {
                        result.add(new ImportItem.Simple(path, path.get(path.size() - 1)));
                    }
                }
                case RENAMED_IMPORT_ITEM -> {
                    SyntaxNode pathNode = SyntaxNodes.child(child, SyntaxKind.IMPORT_ITEM_PATH);
                    List<String> path = pathNode == null ? List.of() : importPath(pathNode);
                    SyntaxNode newName = null;
                    boolean afterAs = false;
                    for (SyntaxNode part : child.children()) {
                        if (part.kind() == SyntaxKind.AS) {
                            afterAs = true;
                        } else if (afterAs && part.kind() == SyntaxKind.IDENT) {
                            newName = part;
                            break;
                        }
                    }
                    if (!path.isEmpty() && newName != null) {
                        result.add(new ImportItem.Renamed(path, path.get(path.size() - 1), newName.text()));
                    } else {
                        requireErroneous(child, "renamed import");
                    }
                }
                default -> {
                }
            }
        }
        return result;
    }

    private static List<String> importPath(SyntaxNode path) {
        List<String> segments = new ArrayList<>();
        for (SyntaxNode ident : SyntaxNodes.children(path, SyntaxKind.IDENT)) {
            segments.add(ident.text());
        }
        return segments;
    }
}
