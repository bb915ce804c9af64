package com.typstparser.ast;

/**
 * An argument of a function call or set rule.
 */
public sealed interface Arg {

    String kind();

    record Pos(AstNode expr) implements Arg {
        @Override
        public String kind() {
            return "pos";
        }
    }

    record Named(String name, AstNode expr) implements Arg {
        @Override
        public String kind() {
            return "named";
        }
    }

    record Spread(AstNode expr, String sinkIdent) implements Arg {
        @Override
        public String kind() {
            return "spread";
        }
    }
}
