package com.typstparser.ast;

public record MathPrimes(
    ByteRange range,
    int count
) implements MathNode {
    @Override
    public String kind() {
        return "mathPrimes";
    }
}
