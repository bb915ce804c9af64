package com.typstparser.lower;

import com.typstparser.ast.ByteRange;
import com.typstparser.syntax.SyntaxKind;

/**
 * Thrown when a syntax node does not have the shape its typed counterpart
 * requires. This points at a mismatch between the parser and the lowering
 * rules, never at a problem with the user's input: syntax errors are reported
 * as data and never end up here.
 */
public class LoweringException extends RuntimeException {

    private final SyntaxKind nodeKind;
    private final ByteRange range;

    public LoweringException(SyntaxKind nodeKind, ByteRange range, String message) {
        super(nodeKind.label() + " at " + range + ": " + message);
        this.nodeKind = nodeKind;
        this.range = range;
    }

    public SyntaxKind nodeKind() {
        return nodeKind;
    }

    /**
     * Range of the offending node, or {@code null} if it is detached.
     */
    public ByteRange range() {
        return range;
    }
}
