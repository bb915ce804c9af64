package com.typstparser.ast;

public record LoopContinue(ByteRange range) implements CodeNode {
    @Override
    public String kind() {
        return "loopContinue";
    }
}
