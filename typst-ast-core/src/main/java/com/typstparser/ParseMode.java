package com.typstparser;

import com.typstparser.syntax.LexMode;

/**
 * The grammar entry rule a text is parsed with.
 */
public enum ParseMode {
    MARKUP("markup", LexMode.MARKUP),
    CODE("code", LexMode.CODE),
    MATH("math", LexMode.MATH);

    private final String label;
    private final LexMode lexMode;

    ParseMode(String label, LexMode lexMode) {
        this.label = label;
        this.lexMode = lexMode;
    }

    public String label() {
        return label;
    }

    LexMode lexMode() {
        return lexMode;
    }

    /**
     * Looks up a mode by name. {@code null} selects markup.
     *
     * @throws InvalidParseModeException if the name is not one of
     *         {@code markup}, {@code code} or {@code math}
     */
    public static ParseMode fromLabel(String label) {
        if (label == null) {
            return MARKUP;
        }
        for (ParseMode mode : values()) {
            if (mode.label.equals(label)) {
                return mode;
            }
        }
        throw new InvalidParseModeException(label);
    }
}
