package com.typstparser.ast;

public record Text(
    ByteRange range,
    String text
) implements MarkupNode {
    public Text(String text) {
        this(null, text);
    }

    @Override
    public String kind() {
        return "text";
    }
}
