package com.typstparser.ast;

public record LoopBreak(ByteRange range) implements CodeNode {
    @Override
    public String kind() {
        return "loopBreak";
    }
}
