package com.typstparser.ast;

public record MathShorthand(
    ByteRange range,
    String character
) implements MathNode {
    @Override
    public String kind() {
        return "mathShorthand";
    }
}
