package com.typstparser.ast;

public record MathIdent(
    ByteRange range,
    String name
) implements MathNode {
    @Override
    public String kind() {
        return "mathIdent";
    }
}
