package com.typstparser.ast;

/**
 * A number with a unit, such as {@code 12pt} or {@code 50%}.
 */
public record NumericLiteral(
    ByteRange range,
    double value,
    Unit unit
) implements LiteralNode {
    @Override
    public String kind() {
        return "numeric";
    }
}
