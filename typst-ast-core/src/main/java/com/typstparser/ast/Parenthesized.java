package com.typstparser.ast;

public record Parenthesized(
    ByteRange range,
    AstNode expr
) implements CodeNode {
    @Override
    public String kind() {
        return "parenthesized";
    }
}
