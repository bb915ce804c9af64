package com.typstparser.ast;

public record Escape(
    ByteRange range,
    String character
) implements MarkupNode {
    @Override
    public String kind() {
        return "escape";
    }
}
