package com.typstparser.ast;

import java.util.List;

public record TermItem(
    ByteRange range,
    List<AstNode> term,
    List<AstNode> description
) implements MarkupNode {
    @Override
    public String kind() {
        return "termItem";
    }
}
