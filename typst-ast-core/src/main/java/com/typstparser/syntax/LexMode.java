package com.typstparser.syntax;

/**
 * The grammar the lexer tokenizes with.
 */
public enum LexMode {
    MARKUP,
    MATH,
    CODE
}
