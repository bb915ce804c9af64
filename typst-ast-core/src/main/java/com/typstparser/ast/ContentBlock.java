package com.typstparser.ast;

import java.util.List;

public record ContentBlock(
    ByteRange range,
    List<AstNode> body
) implements CodeNode {
    @Override
    public String kind() {
        return "contentBlock";
    }
}
