package com.typstparser.lower;

import com.typstparser.ast.Unit;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Decoding of literal token text: numbers, units, strings, escapes and
 * shorthands. Shared by the lexer, which validates literals, and the lowering
 * engine, which extracts their values.
 */
public final class Literals {

    /**
     * Math shorthands and the symbols they stand for, longest sequences first.
     */
    public static final Map<String, String> MATH_SHORTHANDS;

    static {
        Map<String, String> shorthands = new LinkedHashMap<>();
        shorthands.put("<==>", "⟺");
        shorthands.put("<-->", "⟷");
        shorthands.put("->>", "↠");
        shorthands.put("-->", "⟶");
        shorthands.put("<--", "⟵");
        shorthands.put("<->", "↔");
        shorthands.put("<<-", "↞");
        shorthands.put("==>", "⟹");
        shorthands.put("<==", "⟸");
        shorthands.put("<=>", "⇔");
        shorthands.put("::=", "⩴");
        shorthands.put("<<<", "⋘");
        shorthands.put(">>>", "⋙");
        shorthands.put("|->", "↦");
        shorthands.put("|=>", "⤇");
        shorthands.put("...", "…");
        shorthands.put("->", "→");
        shorthands.put("<-", "←");
        shorthands.put("=>", "⇒");
        shorthands.put("<=", "≤");
        shorthands.put(">=", "≥");
        shorthands.put("!=", "≠");
        shorthands.put(":=", "≔");
        shorthands.put("=:", "≕");
        shorthands.put("<<", "≪");
        shorthands.put(">>", "≫");
        shorthands.put("||", "‖");
        shorthands.put("[|", "⟦");
        shorthands.put("|]", "⟧");
        shorthands.put("~~", "≈");
        shorthands.put("*", "∗");
        shorthands.put("-", "−");
        shorthands.put("~", "∼");
        MATH_SHORTHANDS = Collections.unmodifiableMap(shorthands);
    }

    private Literals() {
    }

    // ========================================================================
    // Numbers
    // ========================================================================

    /**
     * Parses digits in the given base as a signed 64-bit integer, or returns
     * {@code null} if they do not form one.
     */
    public static Long parseInt(String digits, int base) {
        if (digits.isEmpty()) {
            return null;
        }
        try {
            return Long.parseLong(digits, base);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parses a decimal float, or returns {@code null}. Only plain decimal
     * notation with an optional exponent is accepted.
     */
    public static Double parseFloat(String text) {
        if (text.isEmpty() || !text.matches("[0-9]*\\.?[0-9]*([eE][+-]?[0-9]+)?") || text.equals(".")) {
            return null;
        }
        try {
            return Double.parseDouble(text);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /**
     * Parses the number of an enum marker such as {@code 3.}.
     */
    public static Long parseEnumNumber(String digits) {
        Long number = parseInt(digits, 10);
        return number != null && number >= 0 ? number : null;
    }

    /**
     * The value of an integer literal, honouring {@code 0x}, {@code 0o} and
     * {@code 0b} prefixes. Out-of-range literals yield {@code 0}.
     */
    public static long intValue(String text) {
        int base = 10;
        String digits = text;
        if (text.startsWith("0x")) {
            base = 16;
            digits = text.substring(2);
        } else if (text.startsWith("0o")) {
            base = 8;
            digits = text.substring(2);
        } else if (text.startsWith("0b")) {
            base = 2;
            digits = text.substring(2);
        }
        Long value = parseInt(digits, base);
        return value == null ? 0 : value;
    }

    public static double floatValue(String text) {
        Double value = parseFloat(text);
        return value == null ? 0.0 : value;
    }

    /**
     * Looks up the unit for a numeric suffix.
     */
    public static Unit unitOf(String suffix) {
        for (Unit unit : Unit.values()) {
            if (unit.suffix().equals(suffix)) {
                return unit;
            }
        }
        return null;
    }

    /**
     * Splits a numeric literal such as {@code 12.5pt} into its unit, found by
     * the longest matching suffix.
     */
    public static Unit numericUnit(String text) {
        Unit best = null;
        for (Unit unit : Unit.values()) {
            if (text.endsWith(unit.suffix()) && (best == null || unit.suffix().length() > best.suffix().length())) {
                best = unit;
            }
        }
        return best;
    }

    public static double numericValue(String text) {
        Unit unit = numericUnit(text);
        String number = unit == null ? text : text.substring(0, text.length() - unit.suffix().length());
        return floatValue(number);
    }

    // ========================================================================
    // Characters
    // ========================================================================

    /**
     * Parses the hex digits of a Unicode escape; returns {@code -1} for
     * anything that is not a Unicode scalar value.
     */
    public static int parseCodePoint(String hex) {
        if (hex.isEmpty() || hex.length() > 6) {
            return -1;
        }
        try {
            int codePoint = Integer.parseInt(hex, 16);
            if (!Character.isValidCodePoint(codePoint)
                || (codePoint >= Character.MIN_SURROGATE && codePoint <= Character.MAX_SURROGATE)) {
                return -1;
            }
            return codePoint;
        } catch (NumberFormatException e) {
            return -1;
        }
    }

    /**
     * The character denoted by an escape token, either a backslash followed by
     * a single character or a Unicode escape with hex digits in braces.
     */
    public static String escapeCharacter(String text) {
        String inner = text.startsWith("\\") ? text.substring(1) : text;
        if (inner.startsWith("u{") && inner.endsWith("}")) {
            int codePoint = parseCodePoint(inner.substring(2, inner.length() - 1));
            return codePoint < 0 ? "\uFFFD" : new String(Character.toChars(codePoint));
        }
        if (inner.isEmpty()) {
            return "";
        }
        return new String(Character.toChars(inner.codePointAt(0)));
    }

    /**
     * The character denoted by a markup shorthand.
     */
    public static String shorthandCharacter(String text) {
        return switch (text) {
            case "~" -> "\u00A0";
            case "--" -> "\u2013";
            case "---" -> "\u2014";
            case "-?" -> "\u00AD";
            case "-" -> "\u2212";
            case "..." -> "\u2026";
            default -> MATH_SHORTHANDS.getOrDefault(text, "\uFFFD");
        };
    }

    /**
     * The symbol denoted by a math shorthand.
     */
    public static String mathShorthandCharacter(String text) {
        return MATH_SHORTHANDS.getOrDefault(text, "\uFFFD");
    }

    /**
     * Resolves the escapes of a quoted string literal.
     */
    public static String unescapeString(String quoted) {
        String body = quoted;
        if (body.length() >= 2 && body.startsWith("\"") && body.endsWith("\"")) {
            body = body.substring(1, body.length() - 1);
        }

        StringBuilder out = new StringBuilder(body.length());
        int i = 0;
        while (i < body.length()) {
            char c = body.charAt(i);
            if (c != '\\' || i + 1 >= body.length()) {
                out.append(c);
                i++;
                continue;
            }
            char next = body.charAt(i + 1);
            switch (next) {
                case '\\' -> out.append('\\');
                case '"' -> out.append('"');
                case 'n' -> out.append('\n');
                case 'r' -> out.append('\r');
                case 't' -> out.append('\t');
                case 'u' -> {
                    int close = body.indexOf('}', i);
                    if (i + 2 < body.length() && body.charAt(i + 2) == '{' && close > 0) {
                        int codePoint = parseCodePoint(body.substring(i + 3, close));
                        out.append(codePoint < 0 ? body.substring(i, close + 1)
                            : new String(Character.toChars(codePoint)));
                        i = close + 1;
                        continue;
                    }
                    out.append("\\u");
                }
                default -> out.append('\\').append(next);
            }
            i += 2;
        }
        return out.toString();
    }
}
