package com.typstparser.ast;

public sealed interface DestructuringItem {

    String kind();

    record PatternItem(Pattern pattern) implements DestructuringItem {
        @Override
        public String kind() {
            return "pattern";
        }
    }

    /**
     * Binds the value stored under {@code name} to a sub-pattern.
     */
    record Named(String name, Pattern pattern) implements DestructuringItem {
        @Override
        public String kind() {
            return "named";
        }
    }

    /**
     * Collects the remaining values; without a sink identifier they are
     * discarded.
     */
    record Spread(String sinkIdent) implements DestructuringItem {
        @Override
        public String kind() {
            return "spread";
        }
    }
}
