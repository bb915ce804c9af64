package com.typstparser.ast;

import java.util.List;

/**
 * A sequence of math expressions.
 */
public record MathContent(
    ByteRange range,
    List<AstNode> body
) implements MathNode {
    @Override
    public String kind() {
        return "math";
    }
}
