package com.typstparser.ast;

/**
 * An entry of a dictionary literal. Identifier keys are {@link Named}, any
 * other key expression (usually a string) is {@link Keyed}.
 */
public sealed interface DictItem {

    String kind();

    record Named(String name, AstNode expr) implements DictItem {
        @Override
        public String kind() {
            return "named";
        }
    }

    record Keyed(AstNode key, AstNode expr) implements DictItem {
        @Override
        public String kind() {
            return "keyed";
        }
    }

    record Spread(AstNode expr, String sinkIdent) implements DictItem {
        @Override
        public String kind() {
            return "spread";
        }
    }
}
