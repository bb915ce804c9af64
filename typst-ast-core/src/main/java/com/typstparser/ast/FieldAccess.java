package com.typstparser.ast;

public record FieldAccess(
    ByteRange range,
    AstNode target,
    String field
) implements CodeNode {
    @Override
    public String kind() {
        return "fieldAccess";
    }
}
