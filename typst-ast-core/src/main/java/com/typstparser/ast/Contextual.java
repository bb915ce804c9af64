package com.typstparser.ast;

public record Contextual(
    ByteRange range,
    AstNode body
) implements CodeNode {
    @Override
    public String kind() {
        return "contextual";
    }
}
