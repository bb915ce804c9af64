package com.typstparser.cst;

import com.typstparser.diagnostics.ParseError;

import java.util.List;

public record CstParseResult(CstNode root, List<ParseError> errors) {

    public boolean hasErrors() {
        return !errors.isEmpty();
    }
}
