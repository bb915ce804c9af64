package com.typstparser.ast;

import java.util.List;

public record EnumItem(
    ByteRange range,
    Long number,  // Can be null
    List<AstNode> body
) implements MarkupNode {
    @Override
    public String kind() {
        return "enumItem";
    }
}
