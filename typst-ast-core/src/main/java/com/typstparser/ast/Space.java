package com.typstparser.ast;

public record Space(ByteRange range) implements MarkupNode {
    @Override
    public String kind() {
        return "space";
    }
}
