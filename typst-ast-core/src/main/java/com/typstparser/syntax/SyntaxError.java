package com.typstparser.syntax;

import java.util.List;

/**
 * A diagnostic attached to an {@link SyntaxKind#ERROR} node.
 */
public record SyntaxError(String message, List<String> hints) {

    public SyntaxError {
        hints = List.copyOf(hints);
    }

    public SyntaxError(String message) {
        this(message, List.of());
    }

    public SyntaxError withHint(String hint) {
        List<String> extended = new java.util.ArrayList<>(hints);
        extended.add(hint);
        return new SyntaxError(message, extended);
    }
}
