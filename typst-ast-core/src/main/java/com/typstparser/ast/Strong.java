package com.typstparser.ast;

import java.util.List;

public record Strong(
    ByteRange range,
    List<AstNode> body
) implements MarkupNode {
    @Override
    public String kind() {
        return "strong";
    }
}
