package com.typstparser.ast;

public record IntLiteral(
    ByteRange range,
    long value
) implements LiteralNode {
    public IntLiteral(long value) {
        this(null, value);
    }

    @Override
    public String kind() {
        return "int";
    }
}
