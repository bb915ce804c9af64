package com.typstparser.diagnostics;

import com.typstparser.lower.RangeNormalizer;
import com.typstparser.syntax.SyntaxError;
import com.typstparser.syntax.SyntaxKind;
import com.typstparser.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Gathers the syntax errors embedded in a concrete tree.
 *
 * <p>The parser records errors as {@link SyntaxKind#ERROR} nodes, and every
 * ancestor of one is marked erroneous, so the walk only descends into
 * erroneous subtrees. The result is ordered by start offset; errors that
 * start at the same offset keep tree order.</p>
 */
public final class DiagnosticsCollector {

    private DiagnosticsCollector() {
    }

    public static List<ParseError> collect(SyntaxNode root, RangeNormalizer ranges) {
        List<ParseError> errors = new ArrayList<>();
        visit(root, ranges, errors);
        errors.sort(Comparator.comparingInt(error -> error.range().start()));
        return errors;
    }

    private static void visit(SyntaxNode node, RangeNormalizer ranges, List<ParseError> out) {
        if (!node.erroneous()) {
            return;
        }
        SyntaxError error = node.error();
        if (node.kind() == SyntaxKind.ERROR && error != null) {
            out.add(new ParseError(error.message(), ranges.rangeOf(node)));
        }
        for (SyntaxNode child : node.children()) {
            visit(child, ranges, out);
        }
    }
}
