package com.typstparser.ast;

public record ModuleInclude(
    ByteRange range,
    AstNode source
) implements CodeNode {
    @Override
    public String kind() {
        return "moduleInclude";
    }
}
