package com.typstparser.ast;

import java.util.List;

/**
 * What a module import brings into scope.
 */
public sealed interface Imports {

    String kind();

    record Wildcard() implements Imports {
        @Override
        public String kind() {
            return "wildcard";
        }
    }

    record Items(List<ImportItem> items) implements Imports {
        @Override
        public String kind() {
            return "items";
        }
    }
}
