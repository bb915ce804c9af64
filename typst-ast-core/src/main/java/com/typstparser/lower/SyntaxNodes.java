package com.typstparser.lower;

import com.typstparser.syntax.Lexer;
import com.typstparser.syntax.SyntaxKind;
import com.typstparser.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Child lookups shared by the lowering engine and the pattern resolver.
 *
 * <p>"Expression" here means a child that lowers to a node of its own. Spaces
 * are expressions only inside markup and math bodies, so they never count
 * as one in these lookups.</p>
 */
final class SyntaxNodes {

    private SyntaxNodes() {
    }

    static boolean isExpr(SyntaxNode node) {
        SyntaxKind kind = node.kind();
        return AstLowering.roleOf(kind) == AstLowering.Role.EXPRESSION && !kind.isTrivia();
    }

    /**
     * Whether a child can be lowered as a pattern: any expression plus the
     * placeholder and destructuring forms.
     */
    static boolean isPattern(SyntaxNode node) {
        return node.kind() == SyntaxKind.UNDERSCORE || node.kind() == SyntaxKind.DESTRUCTURING || isExpr(node);
    }

    static SyntaxNode child(SyntaxNode node, SyntaxKind kind) {
        for (SyntaxNode child : node.children()) {
            if (child.kind() == kind) {
                return child;
            }
        }
        return null;
    }

    static List<SyntaxNode> children(SyntaxNode node, SyntaxKind kind) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (child.kind() == kind) {
                result.add(child);
            }
        }
        return result;
    }

    static SyntaxNode firstExpr(SyntaxNode node) {
        for (SyntaxNode child : node.children()) {
            if (isExpr(child)) {
                return child;
            }
        }
        return null;
    }

    static List<SyntaxNode> exprs(SyntaxNode node) {
        List<SyntaxNode> result = new ArrayList<>();
        for (SyntaxNode child : node.children()) {
            if (isExpr(child)) {
                result.add(child);
            }
        }
        return result;
    }

    /**
     * The expressions that follow the first child of the given kind; empty
     * if there is no such child.
     */
    static List<SyntaxNode> exprsAfter(SyntaxNode node, SyntaxKind marker) {
        List<SyntaxNode> result = new ArrayList<>();
        boolean seen = false;
        for (SyntaxNode child : node.children()) {
            if (seen && isExpr(child)) {
                result.add(child);
            } else if (!seen && child.kind() == marker) {
                seen = true;
            }
        }
        return result;
    }

    static SyntaxNode exprAfter(SyntaxNode node, SyntaxKind marker) {
        List<SyntaxNode> after = exprsAfter(node, marker);
        return after.isEmpty() ? null : after.get(0);
    }

    /**
     * The first expression in front of any of the stop tokens.
     */
    static SyntaxNode exprBefore(SyntaxNode node, Set<SyntaxKind> stops) {
        for (SyntaxNode child : node.children()) {
            if (stops.contains(child.kind())) {
                return null;
            }
            if (isExpr(child)) {
                return child;
            }
        }
        return null;
    }

    /**
     * The first pattern after the {@code from} token and before the
     * {@code until} token. A {@code null} {@code from} starts at the first
     * child.
     */
    static SyntaxNode patternBetween(SyntaxNode node, SyntaxKind from, SyntaxKind until) {
        boolean started = from == null;
        for (SyntaxNode child : node.children()) {
            if (!started) {
                started = child.kind() == from;
                continue;
            }
            if (child.kind() == until) {
                return null;
            }
            if (isPattern(child)) {
                return child;
            }
        }
        return null;
    }

    /**
     * The child of {@code parent} right after {@code anchor}, or {@code null}.
     */
    static SyntaxNode nextSibling(SyntaxNode parent, SyntaxNode anchor) {
        List<SyntaxNode> children = parent.children();
        for (int i = 0; i < children.size() - 1; i++) {
            if (children.get(i) == anchor) {
                return children.get(i + 1);
            }
        }
        return null;
    }

    /**
     * The identifier of a spread or sink, such as {@code rest} in
     * {@code ..rest}.
     */
    static String sinkIdent(SyntaxNode spread) {
        SyntaxNode ident = child(spread, SyntaxKind.IDENT);
        return ident == null ? null : ident.text();
    }

    /**
     * The name of a named pair. Duplicate names are turned into error leaves
     * that keep the identifier's text, so those still yield their name.
     */
    static String keyName(SyntaxNode named) {
        if (named.children().isEmpty()) {
            return null;
        }
        SyntaxNode key = named.children().get(0);
        if (key.kind() == SyntaxKind.IDENT) {
            return key.text();
        }
        if (key.kind() == SyntaxKind.ERROR && Lexer.isIdent(key.text())) {
            return key.text();
        }
        return null;
    }
}
