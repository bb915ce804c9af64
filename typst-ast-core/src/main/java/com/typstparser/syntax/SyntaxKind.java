package com.typstparser.syntax;

/**
 * Every kind of node the concrete parser can produce.
 *
 * <p>The constants fall into four groups: tokens (leaves produced by the
 * lexer), trivia (whitespace and comments), inner nodes (produced by the
 * parser when it wraps a range of children) and {@link #ERROR}.</p>
 */
public enum SyntaxKind {
    // ========================================================================
    // Special
    // ========================================================================
    END("End", "end of tokens"),
    ERROR("Error", "syntax error"),

    // ========================================================================
    // Trivia
    // ========================================================================
    SHEBANG("Shebang", "shebang"),
    LINE_COMMENT("LineComment", "line comment"),
    BLOCK_COMMENT("BlockComment", "block comment"),

    // ========================================================================
    // Markup
    // ========================================================================
    MARKUP("Markup", "markup"),
    TEXT("Text", "text"),
    SPACE("Space", "space"),
    LINEBREAK("Linebreak", "line break"),
    PARBREAK("Parbreak", "paragraph break"),
    ESCAPE("Escape", "escape sequence"),
    SHORTHAND("Shorthand", "shorthand"),
    SMART_QUOTE("SmartQuote", "smart quote"),
    STRONG("Strong", "strong content"),
    EMPH("Emph", "emphasized content"),
    RAW("Raw", "raw block"),
    RAW_LANG("RawLang", "raw language tag"),
    RAW_DELIM("RawDelim", "raw delimiter"),
    RAW_TRIMMED("RawTrimmed", "raw trimmed"),
    LINK("Link", "link"),
    LABEL("Label", "label"),
    REF("Ref", "reference"),
    REF_MARKER("RefMarker", "reference marker"),
    HEADING("Heading", "heading"),
    HEADING_MARKER("HeadingMarker", "heading marker"),
    LIST_ITEM("ListItem", "list item"),
    LIST_MARKER("ListMarker", "list marker"),
    ENUM_ITEM("EnumItem", "enum item"),
    ENUM_MARKER("EnumMarker", "enum marker"),
    TERM_ITEM("TermItem", "term list item"),
    TERM_MARKER("TermMarker", "term marker"),
    EQUATION("Equation", "equation"),

    // ========================================================================
    // Math
    // ========================================================================
    MATH("Math", "math"),
    MATH_TEXT("MathText", "math text"),
    MATH_IDENT("MathIdent", "math identifier"),
    MATH_SHORTHAND("MathShorthand", "math shorthand"),
    MATH_ALIGN_POINT("MathAlignPoint", "math alignment point"),
    MATH_DELIMITED("MathDelimited", "delimited math"),
    MATH_ATTACH("MathAttach", "math attachments"),
    MATH_PRIMES("MathPrimes", "math primes"),
    MATH_FRAC("MathFrac", "math fraction"),
    MATH_ROOT("MathRoot", "math root"),

    // ========================================================================
    // Punctuation
    // ========================================================================
    HASH("Hash", "hash"),
    LEFT_BRACE("LeftBrace", "opening brace"),
    RIGHT_BRACE("RightBrace", "closing brace"),
    LEFT_BRACKET("LeftBracket", "opening bracket"),
    RIGHT_BRACKET("RightBracket", "closing bracket"),
    LEFT_PAREN("LeftParen", "opening paren"),
    RIGHT_PAREN("RightParen", "closing paren"),
    COMMA("Comma", "comma"),
    SEMICOLON("Semicolon", "semicolon"),
    COLON("Colon", "colon"),
    STAR("Star", "star"),
    UNDERSCORE("Underscore", "underscore"),
    DOLLAR("Dollar", "dollar sign"),
    PLUS("Plus", "plus"),
    MINUS("Minus", "minus"),
    SLASH("Slash", "slash"),
    HAT("Hat", "hat"),
    PRIME("Prime", "prime"),
    DOT("Dot", "dot"),
    EQ("Eq", "equals sign"),
    EQ_EQ("EqEq", "equality operator"),
    EXCL_EQ("ExclEq", "inequality operator"),
    LT("Lt", "less-than operator"),
    LT_EQ("LtEq", "less-than or equal operator"),
    GT("Gt", "greater-than operator"),
    GT_EQ("GtEq", "greater-than or equal operator"),
    PLUS_EQ("PlusEq", "add-assign operator"),
    HYPH_EQ("HyphEq", "subtract-assign operator"),
    STAR_EQ("StarEq", "multiply-assign operator"),
    SLASH_EQ("SlashEq", "divide-assign operator"),
    DOTS("Dots", "dots"),
    ARROW("Arrow", "arrow"),
    ROOT("Root", "root"),

    // ========================================================================
    // Keywords
    // ========================================================================
    NOT("Not", "operator `not`"),
    AND("And", "operator `and`"),
    OR("Or", "operator `or`"),
    NONE("None", "`none`"),
    AUTO("Auto", "`auto`"),
    LET("Let", "keyword `let`"),
    SET("Set", "keyword `set`"),
    SHOW("Show", "keyword `show`"),
    CONTEXT("Context", "keyword `context`"),
    IF("If", "keyword `if`"),
    ELSE("Else", "keyword `else`"),
    FOR("For", "keyword `for`"),
    IN("In", "keyword `in`"),
    WHILE("While", "keyword `while`"),
    BREAK("Break", "keyword `break`"),
    CONTINUE("Continue", "keyword `continue`"),
    RETURN("Return", "keyword `return`"),
    IMPORT("Import", "keyword `import`"),
    INCLUDE("Include", "keyword `include`"),
    AS("As", "keyword `as`"),

    // ========================================================================
    // Code
    // ========================================================================
    CODE("Code", "code"),
    IDENT("Ident", "identifier"),
    BOOL("Bool", "boolean"),
    INT("Int", "integer"),
    FLOAT("Float", "float"),
    NUMERIC("Numeric", "numeric value"),
    STR("Str", "string"),
    CODE_BLOCK("CodeBlock", "code block"),
    CONTENT_BLOCK("ContentBlock", "content block"),
    PARENTHESIZED("Parenthesized", "group"),
    ARRAY("Array", "array"),
    DICT("Dict", "dictionary"),
    NAMED("Named", "named pair"),
    KEYED("Keyed", "keyed pair"),
    UNARY("Unary", "unary expression"),
    BINARY("Binary", "binary expression"),
    FIELD_ACCESS("FieldAccess", "field access"),
    FUNC_CALL("FuncCall", "function call"),
    ARGS("Args", "call arguments"),
    SPREAD("Spread", "spread"),
    CLOSURE("Closure", "closure"),
    PARAMS("Params", "closure parameters"),
    LET_BINDING("LetBinding", "`let` expression"),
    SET_RULE("SetRule", "`set` expression"),
    SHOW_RULE("ShowRule", "`show` expression"),
    CONTEXTUAL("Contextual", "`context` expression"),
    CONDITIONAL("Conditional", "`if` expression"),
    WHILE_LOOP("WhileLoop", "while-loop expression"),
    FOR_LOOP("ForLoop", "for-loop expression"),
    MODULE_IMPORT("ModuleImport", "`import` expression"),
    IMPORT_ITEMS("ImportItems", "import items"),
    IMPORT_ITEM_PATH("ImportItemPath", "imported item path"),
    RENAMED_IMPORT_ITEM("RenamedImportItem", "renamed import item"),
    MODULE_INCLUDE("ModuleInclude", "`include` expression"),
    LOOP_BREAK("LoopBreak", "`break` expression"),
    LOOP_CONTINUE("LoopContinue", "`continue` expression"),
    FUNC_RETURN("FuncReturn", "`return` expression"),
    DESTRUCTURING("Destructuring", "destructuring pattern"),
    DESTRUCT_ASSIGNMENT("DestructAssignment", "destructuring assignment expression");

    private final String label;
    private final String description;

    SyntaxKind(String label, String description) {
        this.label = label;
        this.description = description;
    }

    /**
     * The grammar category identifier exposed in the CST ({@code "Heading"},
     * {@code "FuncCall"}, ...).
     */
    public String label() {
        return label;
    }

    /**
     * Human readable name used in diagnostics ({@code "expected closing paren"}).
     */
    public String description() {
        return description;
    }

    public boolean isTrivia() {
        return this == SHEBANG || this == LINE_COMMENT || this == BLOCK_COMMENT
            || this == SPACE || this == PARBREAK;
    }

    public boolean isError() {
        return this == ERROR;
    }

    /**
     * Brackets, braces and parentheses.
     */
    public boolean isGrouping() {
        return this == LEFT_BRACKET || this == LEFT_BRACE || this == LEFT_PAREN
            || this == RIGHT_BRACKET || this == RIGHT_BRACE || this == RIGHT_PAREN;
    }

    /**
     * Tokens that end a collection or block when encountered inside one.
     */
    public boolean isTerminator() {
        return this == END || this == SEMICOLON
            || this == RIGHT_BRACE || this == RIGHT_PAREN || this == RIGHT_BRACKET;
    }

    public boolean isKeyword() {
        return switch (this) {
            case NOT, AND, OR, NONE, AUTO, LET, SET, SHOW, CONTEXT, IF, ELSE, FOR, IN,
                 WHILE, BREAK, CONTINUE, RETURN, IMPORT, INCLUDE, AS -> true;
            default -> false;
        };
    }

    /**
     * Looks up a kind by its CST label.
     *
     * @throws IllegalArgumentException if no kind carries the label
     */
    public static SyntaxKind fromLabel(String label) {
        for (SyntaxKind kind : values()) {
            if (kind.label.equals(label)) {
                return kind;
            }
        }
        throw new IllegalArgumentException("Unknown syntax kind: " + label);
    }
}
