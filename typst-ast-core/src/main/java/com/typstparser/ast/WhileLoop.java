package com.typstparser.ast;

public record WhileLoop(
    ByteRange range,
    AstNode condition,
    AstNode body
) implements CodeNode {
    @Override
    public String kind() {
        return "whileLoop";
    }
}
