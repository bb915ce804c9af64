package com.typstparser.ast;

import com.typstparser.diagnostics.ParseError;

import java.util.List;

/**
 * The typed tree of a document: the lowered top-level body plus the syntax
 * errors found while parsing it.
 */
public record AstParseResult(List<AstNode> root, List<ParseError> errors) {

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
