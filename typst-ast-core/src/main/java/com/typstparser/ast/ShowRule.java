package com.typstparser.ast;

/**
 * A show rule; the selector is absent for {@code show: transform}.
 */
public record ShowRule(
    ByteRange range,
    AstNode selector,  // Can be null
    AstNode transform
) implements CodeNode {
    @Override
    public String kind() {
        return "showRule";
    }
}
