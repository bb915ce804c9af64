package com.typstparser.ast;

public record Ident(
    ByteRange range,
    String name
) implements LiteralNode {
    public Ident(String name) {
        this(null, name);
    }

    @Override
    public String kind() {
        return "ident";
    }
}
