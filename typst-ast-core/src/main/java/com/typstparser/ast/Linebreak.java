package com.typstparser.ast;

public record Linebreak(ByteRange range) implements MarkupNode {
    @Override
    public String kind() {
        return "linebreak";
    }
}
