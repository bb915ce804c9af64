package com.typstparser.ast;

public sealed interface ArrayItem {

    String kind();

    record Pos(AstNode expr) implements ArrayItem {
        @Override
        public String kind() {
            return "pos";
        }
    }

    record Spread(AstNode expr, String sinkIdent) implements ArrayItem {
        @Override
        public String kind() {
            return "spread";
        }
    }
}
