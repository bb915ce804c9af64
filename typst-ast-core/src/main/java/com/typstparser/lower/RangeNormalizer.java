package com.typstparser.lower;

import com.typstparser.ast.ByteRange;
import com.typstparser.syntax.SyntaxNode;

import java.util.IdentityHashMap;
import java.util.Map;

/**
 * Maps the nodes of one syntax tree to their byte ranges.
 *
 * <p>Syntax nodes carry only their length, so the offsets are computed once
 * by walking the tree from the root. Nodes are looked up by identity: a node
 * that is not part of the walked tree, such as a placeholder synthesized
 * during error recovery, has no range.</p>
 */
public final class RangeNormalizer {

    private final Map<SyntaxNode, Integer> offsets = new IdentityHashMap<>();

    public RangeNormalizer(SyntaxNode root) {
        index(root, 0);
    }

    private void index(SyntaxNode node, int offset) {
        offsets.put(node, offset);
        int childOffset = offset;
        for (SyntaxNode child : node.children()) {
            index(child, childOffset);
            childOffset += child.len();
        }
    }

    /**
     * The byte range of a node, or {@code null} if the node is not part of
     * the tree.
     */
    public ByteRange rangeOf(SyntaxNode node) {
        Integer offset = offsets.get(node);
        if (offset == null) {
            return null;
        }
        return new ByteRange(offset, offset + node.len());
    }
}
