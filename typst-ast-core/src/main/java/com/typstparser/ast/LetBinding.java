package com.typstparser.ast;

/**
 * A let binding, either of a pattern or of a named closure.
 */
public record LetBinding(
    ByteRange range,
    LetBindingKind bindingKind,
    AstNode init  // Can be null
) implements CodeNode {
    @Override
    public String kind() {
        return "letBinding";
    }
}
