package com.typstparser.ast;

/**
 * A closure parameter.
 */
public sealed interface Param {

    String kind();

    record Pos(Pattern pattern) implements Param {
        @Override
        public String kind() {
            return "pos";
        }
    }

    /**
     * A named parameter with its default value.
     */
    record Named(String name, AstNode expr) implements Param {
        @Override
        public String kind() {
            return "named";
        }
    }

    /**
     * An argument sink such as {@code ..rest}. Both fields are absent for a
     * bare {@code ..}.
     */
    record Spread(String sinkIdent, AstNode sinkExpr) implements Param {
        @Override
        public String kind() {
            return "spread";
        }
    }
}
