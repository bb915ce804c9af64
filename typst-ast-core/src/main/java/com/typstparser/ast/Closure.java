package com.typstparser.ast;

import java.util.List;

public record Closure(
    ByteRange range,
    String name,  // Can be null
    List<Param> params,
    AstNode body
) implements CodeNode {
    @Override
    public String kind() {
        return "closure";
    }
}
