package com.typstparser.ast;

public record StrLiteral(
    ByteRange range,
    String value
) implements LiteralNode {
    public StrLiteral(String value) {
        this(null, value);
    }

    @Override
    public String kind() {
        return "str";
    }
}
