package com.typstparser.diagnostics;

import com.typstparser.ast.ByteRange;

/**
 * A syntax error reported by the parser.
 */
public record ParseError(
    String message,
    ByteRange range
) {
    @Override
    public String toString() {
        return range + ": " + message;
    }
}
