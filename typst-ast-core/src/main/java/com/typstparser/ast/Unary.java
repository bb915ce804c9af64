package com.typstparser.ast;

public record Unary(
    ByteRange range,
    UnOp op,
    AstNode expr
) implements CodeNode {
    @Override
    public String kind() {
        return "unary";
    }
}
