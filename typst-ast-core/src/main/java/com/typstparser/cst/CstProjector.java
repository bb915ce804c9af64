package com.typstparser.cst;

import com.typstparser.lower.RangeNormalizer;
import com.typstparser.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Mirrors a concrete syntax tree into {@link CstNode}s, keeping every token,
 * trivia included, in parser order.
 */
public final class CstProjector {

    private final RangeNormalizer ranges;

    public CstProjector(RangeNormalizer ranges) {
        this.ranges = ranges;
    }

    public CstNode project(SyntaxNode node) {
        if (node.children().isEmpty()) {
            return new CstNode(node.kind().label(), ranges.rangeOf(node), node.text(), List.of());
        }
        List<CstNode> children = new ArrayList<>(node.children().size());
        for (SyntaxNode child : node.children()) {
            children.add(project(child));
        }
        return new CstNode(node.kind().label(), ranges.rangeOf(node), null, List.copyOf(children));
    }
}
