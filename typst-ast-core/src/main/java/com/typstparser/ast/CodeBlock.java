package com.typstparser.ast;

import java.util.List;

public record CodeBlock(
    ByteRange range,
    List<AstNode> body
) implements CodeNode {
    @Override
    public String kind() {
        return "codeBlock";
    }
}
