package com.typstparser.ast;

import java.util.List;

public record MathDelimited(
    ByteRange range,
    AstNode open,
    List<AstNode> body,
    AstNode close
) implements MathNode {
    @Override
    public String kind() {
        return "mathDelimited";
    }
}
