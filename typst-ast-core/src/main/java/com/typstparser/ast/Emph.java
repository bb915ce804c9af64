package com.typstparser.ast;

import java.util.List;

public record Emph(
    ByteRange range,
    List<AstNode> body
) implements MarkupNode {
    @Override
    public String kind() {
        return "emph";
    }
}
