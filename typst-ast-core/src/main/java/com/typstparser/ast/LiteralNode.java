package com.typstparser.ast;

/**
 * Identifiers and literal values.
 */
public sealed interface LiteralNode extends AstNode permits
    Ident,
    NoneLiteral,
    AutoLiteral,
    BoolLiteral,
    IntLiteral,
    FloatLiteral,
    NumericLiteral,
    StrLiteral {
}
