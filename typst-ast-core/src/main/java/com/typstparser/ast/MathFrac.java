package com.typstparser.ast;

public record MathFrac(
    ByteRange range,
    AstNode num,
    AstNode denom
) implements MathNode {
    @Override
    public String kind() {
        return "mathFrac";
    }
}
