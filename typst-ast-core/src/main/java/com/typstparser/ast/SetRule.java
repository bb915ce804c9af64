package com.typstparser.ast;

import java.util.List;

public record SetRule(
    ByteRange range,
    AstNode target,
    List<Arg> args,
    AstNode condition  // Can be null
) implements CodeNode {
    @Override
    public String kind() {
        return "setRule";
    }
}
