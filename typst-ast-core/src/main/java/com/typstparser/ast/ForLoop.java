package com.typstparser.ast;

public record ForLoop(
    ByteRange range,
    Pattern pattern,
    AstNode iterable,
    AstNode body
) implements CodeNode {
    @Override
    public String kind() {
        return "forLoop";
    }
}
