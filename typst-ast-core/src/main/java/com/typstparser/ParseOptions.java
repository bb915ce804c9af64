package com.typstparser;

/**
 * Per-call parser options.
 */
public record ParseOptions(ParseMode mode) {

    public static final ParseOptions DEFAULT = new ParseOptions(ParseMode.MARKUP);

    public ParseOptions {
        if (mode == null) {
            mode = ParseMode.MARKUP;
        }
    }

    /**
     * Options for a mode given by name, as callers outside Java pass it.
     *
     * @throws InvalidParseModeException for an unknown mode name
     */
    public static ParseOptions of(String mode) {
        return new ParseOptions(ParseMode.fromLabel(mode));
    }
}
