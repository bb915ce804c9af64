package com.typstparser.ast;

public record NoneLiteral(ByteRange range) implements LiteralNode {
    @Override
    public String kind() {
        return "none";
    }
}
