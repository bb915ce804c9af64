package com.typstparser.ast;

/**
 * The content of a math text node: a single character or a number.
 */
public sealed interface MathTextKind {

    String kind();

    String value();

    record Character(String value) implements MathTextKind {
        @Override
        public String kind() {
            return "character";
        }
    }

    /**
     * A number, kept as written so that {@code 1.50} is not normalized.
     */
    record Number(String value) implements MathTextKind {
        @Override
        public String kind() {
            return "number";
        }
    }
}
