package com.typstparser.cst;

import com.typstparser.ast.ByteRange;

import java.util.List;

/**
 * A generic, lossless mirror of a concrete syntax node.
 *
 * <p>{@code text} is present exactly for terminals, which have no
 * children. Concatenating the text of all terminals in tree order yields the
 * source.</p>
 */
public record CstNode(
    String kind,
    ByteRange range,
    String text,  // Can be null
    List<CstNode> children
) {
    public boolean isTerminal() {
        return children.isEmpty();
    }

    /**
     * The text of all terminals below this node.
     */
    public String fullText() {
        if (text != null) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        for (CstNode child : children) {
            sb.append(child.fullText());
        }
        return sb.toString();
    }
}
