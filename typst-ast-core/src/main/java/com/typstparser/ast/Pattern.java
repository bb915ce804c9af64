package com.typstparser.ast;

import java.util.List;

/**
 * The left-hand side of a binding: let bindings, for loops, closure
 * parameters and destructuring assignments all bind through a pattern.
 */
public sealed interface Pattern {

    String kind();

    /**
     * A single expression, usually an identifier.
     */
    record Normal(AstNode expr) implements Pattern {
        @Override
        public String kind() {
            return "normal";
        }
    }

    /**
     * The {@code _} pattern, which discards the value.
     */
    record Placeholder(ByteRange range) implements Pattern {
        @Override
        public String kind() {
            return "placeholder";
        }
    }

    record Parenthesized(AstNode expr) implements Pattern {
        @Override
        public String kind() {
            return "parenthesized";
        }
    }

    record Destructuring(ByteRange range, List<DestructuringItem> items) implements Pattern {
        @Override
        public String kind() {
            return "destructuring";
        }
    }
}
