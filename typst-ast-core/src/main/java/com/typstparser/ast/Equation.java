package com.typstparser.ast;

import java.util.List;

/**
 * An equation delimited by dollar signs; {@code block} when the body is padded with whitespace.
 */
public record Equation(
    ByteRange range,
    List<AstNode> body,
    boolean block
) implements MarkupNode {
    @Override
    public String kind() {
        return "equation";
    }
}
