package com.typstparser.ast;

public record DestructAssignment(
    ByteRange range,
    Pattern pattern,
    AstNode value
) implements CodeNode {
    @Override
    public String kind() {
        return "destructAssignment";
    }
}
