package com.typstparser;

/**
 * Thrown before parsing when a caller names a mode that does not exist.
 */
public class InvalidParseModeException extends IllegalArgumentException {

    private final String mode;

    public InvalidParseModeException(String mode) {
        super("Invalid parse mode '" + mode + "': expected one of markup, code, math");
        this.mode = mode;
    }

    public String mode() {
        return mode;
    }
}
