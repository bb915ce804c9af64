package com.typstparser.ast;

import java.util.List;

public record ListItem(
    ByteRange range,
    List<AstNode> body
) implements MarkupNode {
    @Override
    public String kind() {
        return "listItem";
    }
}
