package com.typstparser.ast;

/**
 * A root; {@code index} is 3 or 4 for the cube and fourth root signs.
 */
public record MathRoot(
    ByteRange range,
    Integer index,  // Can be null
    AstNode radicand
) implements MathNode {
    @Override
    public String kind() {
        return "mathRoot";
    }
}
