package com.typstparser.syntax;

import java.util.function.IntPredicate;

/**
 * A cursor over source text that steps in code points.
 *
 * <p>Positions are UTF-16 indices into the string; lengths of produced nodes
 * are converted to UTF-8 bytes by {@link SyntaxNode}.</p>
 */
final class Scanner {

    static final int EOF = -1;

    private final String text;
    private int cursor;

    Scanner(String text) {
        this.text = text;
    }

    String text() {
        return text;
    }

    int cursor() {
        return cursor;
    }

    void jump(int target) {
        cursor = Math.max(0, Math.min(target, text.length()));
    }

    boolean done() {
        return cursor >= text.length();
    }

    /**
     * The code point at the cursor, or {@link #EOF}.
     */
    int peek() {
        return cursor < text.length() ? text.codePointAt(cursor) : EOF;
    }

    /**
     * The code point {@code n} positions away from the cursor; negative values
     * look backwards ({@code -1} is the code point just before the cursor).
     */
    int scout(int n) {
        int index = cursor;
        if (n >= 0) {
            for (int i = 0; i < n; i++) {
                if (index >= text.length()) {
                    return EOF;
                }
                index += Character.charCount(text.codePointAt(index));
            }
            return index < text.length() ? text.codePointAt(index) : EOF;
        }
        for (int i = 0; i < -n; i++) {
            if (index <= 0) {
                return EOF;
            }
            index -= Character.charCount(text.codePointBefore(index));
        }
        return text.codePointAt(index);
    }

    int eat() {
        if (done()) {
            return EOF;
        }
        int c = text.codePointAt(cursor);
        cursor += Character.charCount(c);
        return c;
    }

    /**
     * Steps back by one code point.
     */
    void uneat() {
        if (cursor > 0) {
            cursor -= Character.charCount(text.codePointBefore(cursor));
        }
    }

    boolean at(int c) {
        return peek() == c;
    }

    boolean at(String s) {
        return text.startsWith(s, cursor);
    }

    boolean at(IntPredicate predicate) {
        int c = peek();
        return c != EOF && predicate.test(c);
    }

    boolean eatIf(int c) {
        if (at(c)) {
            eat();
            return true;
        }
        return false;
    }

    boolean eatIf(String s) {
        if (at(s)) {
            cursor += s.length();
            return true;
        }
        return false;
    }

    boolean eatIf(IntPredicate predicate) {
        if (at(predicate)) {
            eat();
            return true;
        }
        return false;
    }

    /**
     * Eats code points while they satisfy the predicate and returns the eaten
     * text.
     */
    String eatWhile(IntPredicate predicate) {
        int start = cursor;
        while (at(predicate)) {
            eat();
        }
        return text.substring(start, cursor);
    }

    String eatUntil(IntPredicate predicate) {
        return eatWhile(predicate.negate());
    }

    /**
     * Eats a single newline sequence ({@code \r\n} counts as one).
     */
    boolean eatNewline() {
        if (eatIf('\r')) {
            eatIf('\n');
            return true;
        }
        return eatIf(Lexer::isNewline);
    }

    String from(int start) {
        return text.substring(Math.min(start, cursor), cursor);
    }

    String to(int end) {
        return text.substring(cursor, Math.max(cursor, end));
    }

    String get(int start, int end) {
        return text.substring(start, end);
    }

    String after() {
        return text.substring(cursor);
    }
}
