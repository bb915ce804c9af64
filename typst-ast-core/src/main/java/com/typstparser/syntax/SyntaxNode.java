package com.typstparser.syntax;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An immutable node of the concrete syntax tree.
 *
 * <p>Leaves hold the exact source text they were lexed from, inner nodes hold
 * an ordered list of children. Lengths are measured in UTF-8 bytes so that
 * offsets computed from them address the source the same way a byte-oriented
 * consumer would. Nodes carry no absolute position; offsets are derived by
 * walking the tree from the root.</p>
 */
public final class SyntaxNode {

    private final SyntaxKind kind;
    private final String text;
    private final List<SyntaxNode> children;
    private final int len;
    private final boolean erroneous;
    private final SyntaxError error;

    private SyntaxNode(SyntaxKind kind, String text, List<SyntaxNode> children, int len,
                       boolean erroneous, SyntaxError error) {
        this.kind = kind;
        this.text = text;
        this.children = children;
        this.len = len;
        this.erroneous = erroneous;
        this.error = error;
    }

    /**
     * Creates a token or trivia leaf.
     */
    public static SyntaxNode leaf(SyntaxKind kind, String text) {
        if (kind == SyntaxKind.ERROR) {
            throw new IllegalArgumentException("Use SyntaxNode.error() for error leaves");
        }
        return new SyntaxNode(kind, text, List.of(), Utf8.length(text), false, null);
    }

    /**
     * Creates an inner node wrapping the given children in order.
     */
    public static SyntaxNode inner(SyntaxKind kind, List<SyntaxNode> children) {
        int len = 0;
        boolean erroneous = false;
        for (SyntaxNode child : children) {
            len += child.len;
            erroneous |= child.erroneous;
        }
        return new SyntaxNode(kind, "", Collections.unmodifiableList(new ArrayList<>(children)),
            len, erroneous, null);
    }

    /**
     * Creates an error leaf covering {@code text}.
     */
    public static SyntaxNode error(SyntaxError error, String text) {
        return new SyntaxNode(SyntaxKind.ERROR, text, List.of(), Utf8.length(text), true, error);
    }

    /**
     * Creates a detached, zero-length node of the given kind. Placeholders stand
     * in for children that error recovery left out; they are never part of a
     * parsed tree and therefore have no position.
     */
    public static SyntaxNode placeholder(SyntaxKind kind) {
        return new SyntaxNode(kind, "", List.of(), 0, false, null);
    }

    public SyntaxKind kind() {
        return kind;
    }

    /**
     * The text of a leaf, or the empty string for inner nodes.
     */
    public String text() {
        return text;
    }

    /**
     * The concatenated text of all leaves below this node.
     */
    public String fullText() {
        if (children.isEmpty()) {
            return text;
        }
        StringBuilder sb = new StringBuilder();
        appendText(sb);
        return sb.toString();
    }

    private void appendText(StringBuilder sb) {
        if (children.isEmpty()) {
            sb.append(text);
        } else {
            for (SyntaxNode child : children) {
                child.appendText(sb);
            }
        }
    }

    public List<SyntaxNode> children() {
        return children;
    }

    public boolean isLeaf() {
        return children.isEmpty();
    }

    /**
     * Length of the node in UTF-8 bytes.
     */
    public int len() {
        return len;
    }

    /**
     * Whether this node is an error or contains one.
     */
    public boolean erroneous() {
        return erroneous;
    }

    /**
     * The error carried by an error leaf, or {@code null}.
     */
    public SyntaxError error() {
        return error;
    }

    /**
     * All errors in this subtree, in tree order.
     */
    public List<SyntaxError> errors() {
        if (!erroneous) {
            return List.of();
        }
        List<SyntaxError> result = new ArrayList<>();
        collectErrors(result);
        return result;
    }

    private void collectErrors(List<SyntaxError> out) {
        if (error != null) {
            out.add(error);
        }
        for (SyntaxNode child : children) {
            if (child.erroneous) {
                child.collectErrors(out);
            }
        }
    }

    // ========================================================================
    // Conversions (used by the parser while it assembles the tree)
    // ========================================================================

    /**
     * A copy of this node with a different kind and the same content.
     */
    SyntaxNode withKind(SyntaxKind newKind) {
        if (children.isEmpty() && error == null) {
            return new SyntaxNode(newKind, text, List.of(), len, false, null);
        }
        if (error != null) {
            return this;
        }
        return new SyntaxNode(newKind, "", children, len, erroneous, null);
    }

    /**
     * Turns the node into an error leaf that keeps all of its text. Error
     * leaves keep their original message.
     */
    SyntaxNode toError(String message) {
        if (kind == SyntaxKind.ERROR) {
            return this;
        }
        return error(new SyntaxError(message), fullText());
    }

    /**
     * Converts the node into an error stating what was expected instead.
     */
    SyntaxNode expected(String expected) {
        SyntaxNode converted = toError("expected " + expected + ", found " + kind.description());
        if (kind.isKeyword() && (expected.equals("identifier") || expected.equals("pattern"))) {
            String keyword = fullText();
            converted = converted.hint("keyword `" + keyword + "` is not allowed as an identifier; try `"
                + keyword + "_` instead");
        }
        return converted;
    }

    /**
     * Converts the node into an error about it being unexpected.
     */
    SyntaxNode unexpected() {
        return toError("unexpected " + kind.description());
    }

    /**
     * Attaches a hint to an error leaf; other nodes are returned unchanged.
     */
    SyntaxNode hint(String hint) {
        if (error == null) {
            return this;
        }
        return error(error.withHint(hint), text);
    }

    @Override
    public String toString() {
        if (children.isEmpty()) {
            return kind.label() + ": " + len + " (" + text.replace("\n", "\\n") + ")";
        }
        return kind.label() + ": " + len + " " + children;
    }
}
