package com.typstparser.ast;

public record Link(
    ByteRange range,
    String url
) implements MarkupNode {
    @Override
    public String kind() {
        return "link";
    }
}
