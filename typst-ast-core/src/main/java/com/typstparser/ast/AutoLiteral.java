package com.typstparser.ast;

public record AutoLiteral(ByteRange range) implements LiteralNode {
    @Override
    public String kind() {
        return "auto";
    }
}
