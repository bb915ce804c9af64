package com.typstparser.ast;

public record Label(
    ByteRange range,
    String name
) implements MarkupNode {
    @Override
    public String kind() {
        return "label";
    }
}
