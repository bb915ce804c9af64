package com.typstparser.ast;

public sealed interface LetBindingKind {

    String kind();

    record Normal(Pattern pattern) implements LetBindingKind {
        @Override
        public String kind() {
            return "normal";
        }
    }

    /**
     * The {@code let name(params) = body} shorthand; the closure itself is the
     * binding's initializer.
     */
    record Closure(String name) implements LetBindingKind {
        @Override
        public String kind() {
            return "closure";
        }
    }
}
