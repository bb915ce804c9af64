package com.typstparser.syntax;

import com.typstparser.lower.Literals;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits source text into tokens.
 *
 * <p>The lexer is driven by the {@link Parser}: it hands out one token at a
 * time and its {@link LexMode} is switched whenever the parser moves between
 * markup, code and math. Every character of the input ends up in exactly one
 * token; invalid input produces {@link SyntaxKind#ERROR} leaves instead of
 * exceptions.</p>
 */
public final class Lexer {

    private final Scanner s;
    private LexMode mode;
    private boolean newline;
    private SyntaxError error;

    public Lexer(String text, LexMode mode) {
        this.s = new Scanner(text);
        this.mode = mode;
    }

    public LexMode mode() {
        return mode;
    }

    public void setMode(LexMode mode) {
        this.mode = mode;
    }

    /**
     * The UTF-16 index of the next character to be lexed.
     */
    public int cursor() {
        return s.cursor();
    }

    public void jump(int index) {
        s.jump(index);
    }

    /**
     * Whether the last token contained a line break.
     */
    public boolean newline() {
        return newline;
    }

    /**
     * The column (in code points) of the given index within its line.
     */
    public int column(int index) {
        String text = s.text();
        int end = Math.min(index, text.length());
        int lineStart = end;
        while (lineStart > 0 && !isNewline(text.charAt(lineStart - 1))) {
            lineStart--;
        }
        return text.codePointCount(lineStart, end);
    }

    /**
     * Lexes the next token. At the end of the text an empty {@link SyntaxKind#END}
     * leaf is returned.
     */
    public SyntaxNode next() {
        newline = false;
        error = null;
        int start = s.cursor();
        int c = s.eat();

        SyntaxKind kind;
        if (c == Scanner.EOF) {
            return SyntaxNode.leaf(SyntaxKind.END, "");
        } else if (isSpace(c, mode)) {
            kind = whitespace(start, c);
        } else if (c == '#' && start == 0 && s.eatIf('!')) {
            s.eatUntil(Lexer::isNewline);
            kind = SyntaxKind.SHEBANG;
        } else if (c == '/' && s.eatIf('/')) {
            s.eatUntil(Lexer::isNewline);
            kind = SyntaxKind.LINE_COMMENT;
        } else if (c == '/' && s.eatIf('*')) {
            kind = blockComment();
        } else if (c == '*' && s.eatIf('/')) {
            kind = error("unexpected end of block comment",
                "consider escaping the `*` with a backslash or opening the block comment with `/*`");
        } else if (c == '`' && mode != LexMode.MATH) {
            return raw(start);
        } else {
            kind = switch (mode) {
                case MARKUP -> markup(start, c);
                case MATH -> math(start, c);
                case CODE -> code(start, c);
            };
        }

        String text = s.from(start);
        if (kind == SyntaxKind.ERROR) {
            return SyntaxNode.error(error, text);
        }
        return SyntaxNode.leaf(kind, text);
    }

    private SyntaxKind error(String message) {
        error = new SyntaxError(message);
        return SyntaxKind.ERROR;
    }

    private SyntaxKind error(String message, String hint) {
        error = new SyntaxError(message, List.of(hint));
        return SyntaxKind.ERROR;
    }

    // ========================================================================
    // Trivia
    // ========================================================================

    private SyntaxKind whitespace(int start, int c) {
        String more = s.eatWhile(ch -> isSpace(ch, mode));
        int newlines = (c == ' ' && more.isEmpty()) ? 0 : countNewlines(s.from(start));
        newline = newlines > 0;
        if (mode == LexMode.MARKUP && newlines >= 2) {
            return SyntaxKind.PARBREAK;
        }
        return SyntaxKind.SPACE;
    }

    private SyntaxKind blockComment() {
        int depth = 1;
        while (!s.done()) {
            if (s.eatIf("*/")) {
                depth--;
                if (depth == 0) {
                    break;
                }
            } else if (s.eatIf("/*")) {
                depth++;
            } else {
                s.eat();
            }
        }
        return SyntaxKind.BLOCK_COMMENT;
    }

    // ========================================================================
    // Markup
    // ========================================================================

    private SyntaxKind markup(int start, int c) {
        switch (c) {
            case '\\':
                return backslash();
            case 'h':
                if (s.eatIf("ttp://") || s.eatIf("ttps://")) {
                    return link();
                }
                return text();
            case '<':
                if (s.at(Lexer::isValidInLabelLiteral)) {
                    return label();
                }
                return text();
            case '@':
                if (s.at(Lexer::isValidInLabelLiteral)) {
                    return refMarker();
                }
                return text();
            case '.':
                if (s.eatIf("..")) {
                    return SyntaxKind.SHORTHAND;
                }
                return text();
            case '-':
                if (s.eatIf("--") || s.eatIf('-') || s.eatIf('?') || s.at(Character::isDigit)) {
                    return SyntaxKind.SHORTHAND;
                }
                if (spaceOrEnd()) {
                    return SyntaxKind.LIST_MARKER;
                }
                return text();
            case '*':
                return inWord() ? text() : SyntaxKind.STAR;
            case '_':
                return inWord() ? text() : SyntaxKind.UNDERSCORE;
            case '#':
                return SyntaxKind.HASH;
            case '[':
                return SyntaxKind.LEFT_BRACKET;
            case ']':
                return SyntaxKind.RIGHT_BRACKET;
            case '\'':
            case '"':
                return SyntaxKind.SMART_QUOTE;
            case '$':
                return SyntaxKind.DOLLAR;
            case '~':
                return SyntaxKind.SHORTHAND;
            case ':':
                return SyntaxKind.COLON;
            case '=':
                s.eatWhile(ch -> ch == '=');
                return spaceOrEnd() ? SyntaxKind.HEADING_MARKER : text();
            case '+':
                return spaceOrEnd() ? SyntaxKind.ENUM_MARKER : text();
            case '/':
                return spaceOrEnd() ? SyntaxKind.TERM_MARKER : text();
            default:
                if (c >= '0' && c <= '9') {
                    return numbering(start);
                }
                return text();
        }
    }

    private SyntaxKind backslash() {
        if (s.eatIf("u{")) {
            String hex = s.eatWhile(ch -> ch < 0x80 && Character.isLetterOrDigit(ch));
            if (!s.eatIf('}')) {
                return error("unclosed Unicode escape sequence");
            }
            if (Literals.parseCodePoint(hex) < 0) {
                return error("invalid Unicode codepoint: " + hex);
            }
            return SyntaxKind.ESCAPE;
        }
        if (s.done() || s.at(Character::isWhitespace)) {
            return SyntaxKind.LINEBREAK;
        }
        s.eat();
        return SyntaxKind.ESCAPE;
    }

    private SyntaxKind text() {
        while (true) {
            s.eatUntil(Lexer::endsMarkupText);
            int checkpoint = s.cursor();
            int c = s.eat();
            boolean keepGoing = switch (c) {
                case ' ' -> s.at(Character::isLetterOrDigit);
                case '/' -> !s.at('/') && !s.at('*');
                case '-' -> !s.at('-') && !s.at('?');
                case '.' -> !s.at("..");
                case 'h' -> !s.at("ttp://") && !s.at("ttps://");
                case '@' -> !s.at(Lexer::isValidInLabelLiteral);
                default -> false;
            };
            if (!keepGoing) {
                s.jump(checkpoint);
                break;
            }
        }
        return SyntaxKind.TEXT;
    }

    private static boolean endsMarkupText(int c) {
        return switch (c) {
            case '\\', '/', '[', ']', '~', '-', '.', '\'', '"', '*', '_', ':', 'h', '`', '$', '<', '>', '@', '#' -> true;
            default -> Character.isWhitespace(c);
        };
    }

    private boolean inWord() {
        int prev = s.scout(-2);
        int next = s.peek();
        return isWordy(prev) && isWordy(next);
    }

    private static boolean isWordy(int c) {
        if (c == Scanner.EOF || !Character.isLetterOrDigit(c)) {
            return false;
        }
        Character.UnicodeScript script = Character.UnicodeScript.of(c);
        return script != Character.UnicodeScript.HAN
            && script != Character.UnicodeScript.HIRAGANA
            && script != Character.UnicodeScript.KATAKANA
            && script != Character.UnicodeScript.HANGUL;
    }

    private boolean spaceOrEnd() {
        return s.done() || s.at(Character::isWhitespace) || s.at("//") || s.at("/*");
    }

    private SyntaxKind numbering(int start) {
        s.eatWhile(ch -> ch >= '0' && ch <= '9');
        String digits = s.from(start);
        if (s.eatIf('.') && spaceOrEnd() && Literals.parseEnumNumber(digits) != null) {
            return SyntaxKind.ENUM_MARKER;
        }
        return text();
    }

    private SyntaxKind link() {
        String rest = s.after();
        int end = 0;
        List<Character> brackets = new ArrayList<>();
        boolean stop = false;
        while (end < rest.length() && !stop) {
            char c = rest.charAt(end);
            if ((c >= '0' && c <= '9') || (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
                || "!#$%&*+,-./:;=?@_~'".indexOf(c) >= 0) {
                end++;
            } else if (c == '[' || c == '(') {
                brackets.add(c);
                end++;
            } else if (c == ']' || c == ')') {
                char open = c == ']' ? '[' : '(';
                if (!brackets.isEmpty() && brackets.get(brackets.size() - 1) == open) {
                    brackets.remove(brackets.size() - 1);
                    end++;
                } else {
                    stop = true;
                }
            } else {
                stop = true;
            }
        }
        while (end > 0 && "!,.:;?'".indexOf(rest.charAt(end - 1)) >= 0) {
            end--;
        }
        s.jump(s.cursor() + end);
        if (!brackets.isEmpty()) {
            return error("automatic links cannot contain unbalanced brackets");
        }
        return SyntaxKind.LINK;
    }

    private SyntaxKind label() {
        String label = s.eatWhile(Lexer::isValidInLabelLiteral);
        if (label.isEmpty()) {
            return error("label cannot be empty");
        }
        if (!s.eatIf('>')) {
            return error("unclosed label");
        }
        return SyntaxKind.LABEL;
    }

    private SyntaxKind refMarker() {
        s.eatWhile(Lexer::isValidInLabelLiteral);
        while (s.scout(-1) == '.' || s.scout(-1) == ':') {
            s.uneat();
        }
        return SyntaxKind.REF_MARKER;
    }

    // ========================================================================
    // Raw
    // ========================================================================

    private SyntaxNode raw(int start) {
        int backticks = 1;
        while (s.eatIf('`')) {
            backticks++;
        }

        if (backticks == 2) {
            return SyntaxNode.inner(SyntaxKind.RAW, List.of(
                SyntaxNode.leaf(SyntaxKind.RAW_DELIM, "`"),
                SyntaxNode.leaf(SyntaxKind.RAW_DELIM, "`")));
        }

        int found = 0;
        while (found < backticks) {
            int c = s.eat();
            if (c == '`') {
                found++;
            } else if (c == Scanner.EOF) {
                return SyntaxNode.error(new SyntaxError("unclosed raw text"), s.from(start));
            } else {
                found = 0;
            }
        }
        int end = s.cursor();

        RawBuilder builder = new RawBuilder(start);
        s.jump(start + backticks);
        builder.push(SyntaxKind.RAW_DELIM, false);
        if (backticks >= 3) {
            blockyRaw(end - backticks, builder);
        } else {
            inlineRaw(end - backticks, builder);
        }
        s.jump(end);
        builder.push(SyntaxKind.RAW_DELIM, false);
        return SyntaxNode.inner(SyntaxKind.RAW, builder.nodes);
    }

    /**
     * Collects the pieces of a raw node, each spanning from the end of the
     * previous piece to the scanner cursor.
     */
    private final class RawBuilder {
        private final List<SyntaxNode> nodes = new ArrayList<>();
        private int prevStart;

        RawBuilder(int start) {
            this.prevStart = start;
        }

        void push(SyntaxKind kind, boolean allowEmpty) {
            if (s.cursor() == prevStart && !allowEmpty) {
                return;
            }
            nodes.add(SyntaxNode.leaf(kind, s.get(prevStart, s.cursor())));
            prevStart = s.cursor();
        }
    }

    private void blockyRaw(int innerEnd, RawBuilder builder) {
        if (s.eatIf(Lexer::isIdStart)) {
            s.eatWhile(Lexer::isIdContinue);
            builder.push(SyntaxKind.RAW_LANG, false);
        }

        List<int[]> lines = splitLines(s.cursor(), innerEnd);
        int count = lines.size();
        boolean dropFirst = isBlank(lines.get(0));
        boolean dropLast = count > 1 && isBlank(lines.get(count - 1));

        int dedent = Integer.MAX_VALUE;
        for (int i = 1; i < count; i++) {
            int[] line = lines.get(i);
            if (!isBlank(line) || i == count - 1) {
                dedent = Math.min(dedent, leadingWhitespace(line));
            }
        }
        if (dedent == Integer.MAX_VALUE) {
            dedent = 0;
        }

        if (!dropFirst) {
            if (s.eatIf(' ')) {
                builder.push(SyntaxKind.RAW_TRIMMED, false);
            }
            s.jump(lines.get(0)[1]);
            builder.push(SyntaxKind.TEXT, true);
        }

        for (int i = 1; i < count; i++) {
            if (i == count - 1 && dropLast) {
                break;
            }
            int[] line = lines.get(i);
            s.jump(line[0]);
            int strip = Math.min(dedent, leadingWhitespace(line));
            for (int k = 0; k < strip; k++) {
                s.eat();
            }
            builder.push(SyntaxKind.RAW_TRIMMED, false);
            s.jump(line[1]);
            builder.push(SyntaxKind.TEXT, true);
        }

        s.jump(innerEnd);
        builder.push(SyntaxKind.RAW_TRIMMED, false);
    }

    private void inlineRaw(int innerEnd, RawBuilder builder) {
        while (s.cursor() < innerEnd) {
            if (s.at(Lexer::isNewline)) {
                s.eatNewline();
                builder.push(SyntaxKind.RAW_TRIMMED, false);
                continue;
            }
            while (s.cursor() < innerEnd && !s.at(Lexer::isNewline)) {
                s.eat();
            }
            builder.push(SyntaxKind.TEXT, false);
        }
    }

    /**
     * Line spans {@code [start, end)} between {@code from} and {@code to},
     * excluding the line terminators.
     */
    private List<int[]> splitLines(int from, int to) {
        String text = s.text();
        List<int[]> lines = new ArrayList<>();
        int lineStart = from;
        int i = from;
        while (i < to) {
            char c = text.charAt(i);
            if (isNewline(c)) {
                lines.add(new int[] {lineStart, i});
                i += (c == '\r' && i + 1 < to && text.charAt(i + 1) == '\n') ? 2 : 1;
                lineStart = i;
            } else {
                i++;
            }
        }
        lines.add(new int[] {lineStart, to});
        return lines;
    }

    private boolean isBlank(int[] line) {
        return s.get(line[0], line[1]).codePoints().allMatch(Character::isWhitespace);
    }

    private int leadingWhitespace(int[] line) {
        return (int) s.get(line[0], line[1]).codePoints().takeWhile(Character::isWhitespace).count();
    }

    // ========================================================================
    // Math
    // ========================================================================

    private SyntaxKind math(int start, int c) {
        if (c == '\\') {
            return backslash();
        }
        if (c == '"') {
            return string();
        }
        s.jump(start);
        for (String shorthand : Literals.MATH_SHORTHANDS.keySet()) {
            if (s.eatIf(shorthand)) {
                return SyntaxKind.MATH_SHORTHAND;
            }
        }
        s.eat();

        switch (c) {
            case '#':
                return SyntaxKind.HASH;
            case '_':
                return SyntaxKind.UNDERSCORE;
            case '$':
                return SyntaxKind.DOLLAR;
            case '/':
                return SyntaxKind.SLASH;
            case '^':
                return SyntaxKind.HAT;
            case '\'':
                return SyntaxKind.PRIME;
            case '&':
                return SyntaxKind.MATH_ALIGN_POINT;
            case '√':
            case '∛':
            case '∜':
                return SyntaxKind.ROOT;
            default:
                break;
        }

        if (isMathIdStart(c)) {
            s.eatWhile(Lexer::isMathIdContinue);
            return SyntaxKind.MATH_IDENT;
        }
        if (c >= '0' && c <= '9') {
            s.eatWhile(ch -> ch >= '0' && ch <= '9');
            if (s.at('.') && isAsciiDigit(s.scout(1))) {
                s.eat();
                s.eatWhile(ch -> ch >= '0' && ch <= '9');
                return SyntaxKind.MATH_TEXT;
            }
            return SyntaxKind.INT;
        }
        s.eatWhile(Lexer::isCombiningMark);
        return SyntaxKind.MATH_TEXT;
    }

    static boolean isMathIdStart(int c) {
        return Character.isLetter(c);
    }

    static boolean isMathIdContinue(int c) {
        return c != '_' && (Character.isLetterOrDigit(c) || isCombiningMark(c));
    }

    private static boolean isCombiningMark(int c) {
        int type = Character.getType(c);
        return type == Character.NON_SPACING_MARK || type == Character.ENCLOSING_MARK
            || type == Character.COMBINING_SPACING_MARK || c == 0x200D || (c >= 0xFE00 && c <= 0xFE0F);
    }

    // ========================================================================
    // Code
    // ========================================================================

    private SyntaxKind code(int start, int c) {
        if (c == '<' && s.at(Lexer::isValidInLabelLiteral)) {
            return label();
        }
        if ((c >= '0' && c <= '9') || (c == '.' && s.at(Lexer::isAsciiDigit))) {
            return number(start, c);
        }
        if (c == '"') {
            return string();
        }
        switch (c) {
            case '=':
                if (s.eatIf('=')) return SyntaxKind.EQ_EQ;
                if (s.eatIf('>')) return SyntaxKind.ARROW;
                return SyntaxKind.EQ;
            case '!':
                if (s.eatIf('=')) return SyntaxKind.EXCL_EQ;
                break;
            case '<':
                return s.eatIf('=') ? SyntaxKind.LT_EQ : SyntaxKind.LT;
            case '>':
                return s.eatIf('=') ? SyntaxKind.GT_EQ : SyntaxKind.GT;
            case '+':
                return s.eatIf('=') ? SyntaxKind.PLUS_EQ : SyntaxKind.PLUS;
            case '-':
            case '−':
                return s.eatIf('=') ? SyntaxKind.HYPH_EQ : SyntaxKind.MINUS;
            case '*':
                return s.eatIf('=') ? SyntaxKind.STAR_EQ : SyntaxKind.STAR;
            case '/':
                return s.eatIf('=') ? SyntaxKind.SLASH_EQ : SyntaxKind.SLASH;
            case '.':
                return s.eatIf('.') ? SyntaxKind.DOTS : SyntaxKind.DOT;
            case '{':
                return SyntaxKind.LEFT_BRACE;
            case '}':
                return SyntaxKind.RIGHT_BRACE;
            case '[':
                return SyntaxKind.LEFT_BRACKET;
            case ']':
                return SyntaxKind.RIGHT_BRACKET;
            case '(':
                return SyntaxKind.LEFT_PAREN;
            case ')':
                return SyntaxKind.RIGHT_PAREN;
            case '$':
                return SyntaxKind.DOLLAR;
            case ',':
                return SyntaxKind.COMMA;
            case ';':
                return SyntaxKind.SEMICOLON;
            case ':':
                return SyntaxKind.COLON;
            default:
                break;
        }
        if (isIdStart(c)) {
            return ident(start);
        }
        return error("the character `" + new String(Character.toChars(c)) + "` is not valid in code");
    }

    private SyntaxKind ident(int start) {
        s.eatWhile(Lexer::isIdContinue);
        String ident = s.from(start);
        String prev = s.get(0, start);
        if (!(prev.endsWith(".") || prev.endsWith("@")) || prev.endsWith("..")) {
            SyntaxKind keyword = keyword(ident);
            if (keyword != null) {
                return keyword;
            }
        }
        return ident.equals("_") ? SyntaxKind.UNDERSCORE : SyntaxKind.IDENT;
    }

    static SyntaxKind keyword(String ident) {
        return switch (ident) {
            case "none" -> SyntaxKind.NONE;
            case "auto" -> SyntaxKind.AUTO;
            case "true", "false" -> SyntaxKind.BOOL;
            case "not" -> SyntaxKind.NOT;
            case "and" -> SyntaxKind.AND;
            case "or" -> SyntaxKind.OR;
            case "let" -> SyntaxKind.LET;
            case "set" -> SyntaxKind.SET;
            case "show" -> SyntaxKind.SHOW;
            case "context" -> SyntaxKind.CONTEXT;
            case "if" -> SyntaxKind.IF;
            case "else" -> SyntaxKind.ELSE;
            case "for" -> SyntaxKind.FOR;
            case "in" -> SyntaxKind.IN;
            case "while" -> SyntaxKind.WHILE;
            case "break" -> SyntaxKind.BREAK;
            case "continue" -> SyntaxKind.CONTINUE;
            case "return" -> SyntaxKind.RETURN;
            case "import" -> SyntaxKind.IMPORT;
            case "include" -> SyntaxKind.INCLUDE;
            case "as" -> SyntaxKind.AS;
            default -> null;
        };
    }

    private SyntaxKind number(int start, int first) {
        int base = 10;
        int numberStart = start;
        if (first == '0') {
            if (s.eatIf('b')) {
                base = 2;
            } else if (s.eatIf('o')) {
                base = 8;
            } else if (s.eatIf('x')) {
                base = 16;
            }
            if (base != 10) {
                numberStart = s.cursor();
            }
        }

        if (base == 16) {
            s.eatWhile(ch -> ch < 0x80 && Character.isLetterOrDigit(ch));
        } else {
            s.eatWhile(Lexer::isAsciiDigit);
        }

        if (first != '.' && !s.at("..") && !isIdStartOrEof(s.scout(1)) && base == 10 && s.eatIf('.')) {
            s.eatWhile(Lexer::isAsciiDigit);
        }

        if (base == 10 && !s.at("em") && (s.at('e') || s.at('E'))) {
            int mark = s.cursor();
            s.eat();
            s.eatIf(ch -> ch == '+' || ch == '-');
            if (s.eatWhile(Lexer::isAsciiDigit).isEmpty()) {
                s.jump(mark);
            }
        }

        int suffixStart = s.cursor();
        if (!s.eatIf('%')) {
            s.eatWhile(ch -> ch < 0x80 && Character.isLetterOrDigit(ch));
        }
        String number = s.get(numberStart, suffixStart);
        String suffix = s.from(suffixStart);

        SyntaxKind kind;
        if (Literals.parseInt(number, base) != null) {
            kind = SyntaxKind.INT;
        } else if (base == 10 && Literals.parseFloat(number) != null) {
            kind = SyntaxKind.FLOAT;
        } else {
            return error(switch (base) {
                case 2 -> "invalid binary number: 0b" + number;
                case 8 -> "invalid octal number: 0o" + number;
                case 16 -> "invalid hexadecimal number: 0x" + number;
                default -> "invalid number: " + number;
            });
        }

        if (suffix.isEmpty()) {
            return kind;
        }
        if (Literals.unitOf(suffix) == null) {
            return error("invalid number suffix: " + suffix);
        }
        if (base != 10) {
            return error("cannot use suffix with non-decimal base");
        }
        return SyntaxKind.NUMERIC;
    }

    private static boolean isIdStartOrEof(int c) {
        return c != Scanner.EOF && isIdStart(c);
    }

    private SyntaxKind string() {
        boolean escaped = false;
        while (!s.done()) {
            int c = s.peek();
            if (c == '"' && !escaped) {
                break;
            }
            escaped = c == '\\' && !escaped;
            s.eat();
        }
        if (!s.eatIf('"')) {
            return error("unclosed string");
        }
        return SyntaxKind.STR;
    }

    // ========================================================================
    // Character classes
    // ========================================================================

    static boolean isNewline(int c) {
        return c == '\n' || c == '\u000B' || c == '\u000C' || c == '\r'
            || c == '\u0085' || c == '\u2028' || c == '\u2029';
    }

    private static boolean isSpace(int c, LexMode mode) {
        if (mode == LexMode.MARKUP) {
            return c == ' ' || c == '\t' || isNewline(c);
        }
        return Character.isWhitespace(c);
    }

    static int countNewlines(String text) {
        int newlines = 0;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (isNewline(c)) {
                if (c == '\r' && i + 1 < text.length() && text.charAt(i + 1) == '\n') {
                    i++;
                }
                newlines++;
            }
        }
        return newlines;
    }

    static boolean isIdStart(int c) {
        return c == '_' || Character.isUnicodeIdentifierStart(c);
    }

    static boolean isIdContinue(int c) {
        return c == '_' || c == '-' || (Character.isUnicodeIdentifierPart(c) && !Character.isIdentifierIgnorable(c));
    }

    static boolean isValidInLabelLiteral(int c) {
        return isIdContinue(c) || c == ':' || c == '.';
    }

    private static boolean isAsciiDigit(int c) {
        return c >= '0' && c <= '9';
    }

    /**
     * Whether {@code text} is a plain identifier in code.
     */
    public static boolean isIdent(String text) {
        if (text.isEmpty() || !isIdStart(text.codePointAt(0))) {
            return false;
        }
        return text.codePoints().skip(1).allMatch(Lexer::isIdContinue);
    }
}
