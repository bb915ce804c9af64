package com.typstparser.ast;

import java.util.List;

public record DictExpr(
    ByteRange range,
    List<DictItem> items
) implements CodeNode {
    @Override
    public String kind() {
        return "dict";
    }
}
