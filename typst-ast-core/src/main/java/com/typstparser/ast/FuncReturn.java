package com.typstparser.ast;

public record FuncReturn(
    ByteRange range,
    AstNode body  // Can be null
) implements CodeNode {
    @Override
    public String kind() {
        return "funcReturn";
    }
}
