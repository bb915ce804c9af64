package com.typstparser.ast;

import java.util.List;

/**
 * A single imported name. The path holds every segment, so for
 * {@code a.b.c} the path is {@code [a, b, c]} and the name is {@code c}.
 */
public sealed interface ImportItem {

    String kind();

    List<String> path();

    record Simple(List<String> path, String name) implements ImportItem {
        @Override
        public String kind() {
            return "simple";
        }
    }

    record Renamed(List<String> path, String originalName, String newName) implements ImportItem {
        @Override
        public String kind() {
            return "renamed";
        }
    }
}
