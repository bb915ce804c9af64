package com.typstparser.ast;

import java.util.List;

/**
 * A reference such as {@code @intro}, optionally followed by a supplement in brackets.
 */
public record Ref(
    ByteRange range,
    String target,
    List<AstNode> supplement  // Can be null
) implements MarkupNode {
    @Override
    public String kind() {
        return "ref";
    }
}
