package com.typstparser.ast;

/**
 * Base interface for all typed syntax tree nodes.
 *
 * <p>The hierarchy is closed: every node is a record in one of the four
 * groups below, and {@link #kind()} is the tag the node is serialized
 * under.</p>
 */
public sealed interface AstNode permits
    MarkupNode,
    MathNode,
    LiteralNode,
    CodeNode {

    String kind();

    /**
     * The source extent of the node, or {@code null} for nodes synthesized
     * while recovering from a syntax error.
     */
    ByteRange range();
}
