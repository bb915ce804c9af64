package com.typstparser.ast;

public record FloatLiteral(
    ByteRange range,
    double value
) implements LiteralNode {
    @Override
    public String kind() {
        return "float";
    }
}
