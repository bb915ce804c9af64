package com.typstparser.ast;

public record Shorthand(
    ByteRange range,
    String character
) implements MarkupNode {
    @Override
    public String kind() {
        return "shorthand";
    }
}
