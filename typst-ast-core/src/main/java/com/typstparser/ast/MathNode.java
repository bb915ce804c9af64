package com.typstparser.ast;

/**
 * Nodes that only occur in math mode.
 */
public sealed interface MathNode extends AstNode permits
    MathContent,
    MathText,
    MathIdent,
    MathShorthand,
    MathAlignPoint,
    MathDelimited,
    MathAttach,
    MathPrimes,
    MathFrac,
    MathRoot {
}
