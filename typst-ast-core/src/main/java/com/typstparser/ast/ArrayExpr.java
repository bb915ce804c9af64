package com.typstparser.ast;

import java.util.List;

public record ArrayExpr(
    ByteRange range,
    List<ArrayItem> items
) implements CodeNode {
    @Override
    public String kind() {
        return "array";
    }
}
