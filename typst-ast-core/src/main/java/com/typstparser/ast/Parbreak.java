package com.typstparser.ast;

public record Parbreak(ByteRange range) implements MarkupNode {
    @Override
    public String kind() {
        return "parbreak";
    }
}
