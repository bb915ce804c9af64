package com.typstparser.ast;

public record MathAlignPoint(ByteRange range) implements MathNode {
    @Override
    public String kind() {
        return "mathAlignPoint";
    }
}
