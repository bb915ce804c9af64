package com.typstparser.ast;

import java.util.List;

public record Heading(
    ByteRange range,
    int depth,
    List<AstNode> body
) implements MarkupNode {
    @Override
    public String kind() {
        return "heading";
    }
}
