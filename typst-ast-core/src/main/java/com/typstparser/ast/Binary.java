package com.typstparser.ast;

public record Binary(
    ByteRange range,
    BinOp op,
    AstNode lhs,
    AstNode rhs
) implements CodeNode {
    @Override
    public String kind() {
        return "binary";
    }
}
