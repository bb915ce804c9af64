package com.typstparser.ast;

/**
 * A straight quote that is typeset as a curly one; {@code doubleQuote} is serialized as {@code double}.
 */
public record SmartQuote(
    ByteRange range,
    boolean doubleQuote
) implements MarkupNode {
    @Override
    public String kind() {
        return "smartQuote";
    }
}
