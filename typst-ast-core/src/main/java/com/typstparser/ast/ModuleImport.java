package com.typstparser.ast;

/**
 * A module import. {@code imports} is absent when the import has no colon.
 */
public record ModuleImport(
    ByteRange range,
    AstNode source,
    String newName,  // Can be null
    Imports imports  // Can be null
) implements CodeNode {
    @Override
    public String kind() {
        return "moduleImport";
    }
}
