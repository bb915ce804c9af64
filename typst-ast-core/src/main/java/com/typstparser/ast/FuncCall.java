package com.typstparser.ast;

import java.util.List;

public record FuncCall(
    ByteRange range,
    AstNode callee,
    List<Arg> args
) implements CodeNode {
    @Override
    public String kind() {
        return "funcCall";
    }
}
