package com.typstparser.ast;

public record BoolLiteral(
    ByteRange range,
    boolean value
) implements LiteralNode {
    @Override
    public String kind() {
        return "bool";
    }
}
