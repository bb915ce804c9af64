package com.typstparser.ast;

public record Conditional(
    ByteRange range,
    AstNode condition,
    AstNode ifBody,
    AstNode elseBody  // Can be null
) implements CodeNode {
    @Override
    public String kind() {
        return "conditional";
    }
}
