package com.typstparser.ast;

public record MathText(
    ByteRange range,
    MathTextKind text
) implements MathNode {
    @Override
    public String kind() {
        return "mathText";
    }
}
