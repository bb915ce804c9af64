package com.typstparser.lower;

import com.typstparser.ast.AstNode;
import com.typstparser.ast.DestructuringItem;
import com.typstparser.ast.Param;
import com.typstparser.ast.Pattern;
import com.typstparser.syntax.SyntaxKind;
import com.typstparser.syntax.SyntaxNode;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowers binding patterns and closure parameters.
 *
 * <p>Patterns embed expressions (a field access can be assigned to) and
 * expressions embed patterns (closures, let bindings, loops), so the resolver
 * and the {@link AstLowering} it belongs to call into each other. Parts that
 * error recovery left out become absent fields or placeholders.</p>
 */
public final class PatternResolver {

    private final AstLowering lowering;
    private final RangeNormalizer ranges;

    PatternResolver(AstLowering lowering, RangeNormalizer ranges) {
        this.lowering = lowering;
        this.ranges = ranges;
    }

    /**
     * Lowers a pattern node: {@code _}, a parenthesized pattern, a
     * destructuring group or any other expression.
     */
    public Pattern pattern(SyntaxNode node) {
        return switch (node.kind()) {
            case UNDERSCORE -> new Pattern.Placeholder(ranges.rangeOf(node));
            case PARENTHESIZED -> new Pattern.Parenthesized(lowering.lowerOrPlaceholder(SyntaxNodes.firstExpr(node)));
            case DESTRUCTURING -> new Pattern.Destructuring(ranges.rangeOf(node), destructuringItems(node));
            default -> new Pattern.Normal(lowering.lower(node));
        };
    }

    /**
     * Lowers an optional pattern child. A missing pattern in an erroneous
     * parent becomes a placeholder.
     */
    Pattern requiredPattern(SyntaxNode parent, SyntaxNode node) {
        if (node != null) {
            return pattern(node);
        }
        return new Pattern.Normal(lowering.required(parent, null, "pattern"));
    }

    private List<DestructuringItem> destructuringItems(SyntaxNode destructuring) {
        List<DestructuringItem> items = new ArrayList<>();
        for (SyntaxNode child : destructuring.children()) {
            switch (child.kind()) {
                case SPREAD -> items.add(new DestructuringItem.Spread(SyntaxNodes.sinkIdent(child)));
                case NAMED -> {
                    String name = SyntaxNodes.keyName(child);
                    if (name != null) {
                        SyntaxNode sub = SyntaxNodes.patternBetween(child, SyntaxKind.COLON, null);
                        items.add(new DestructuringItem.Named(name, requiredPattern(child, sub)));
                    }
                }
                default -> {
                    if (SyntaxNodes.isPattern(child)) {
                        items.add(new DestructuringItem.PatternItem(pattern(child)));
                    }
                }
            }
        }
        return items;
    }

    /**
     * Lowers the parameter list of a closure.
     */
    public List<Param> params(SyntaxNode params) {
        List<Param> result = new ArrayList<>();
        for (SyntaxNode child : params.children()) {
            switch (child.kind()) {
                case SPREAD -> {
                    SyntaxNode sink = SyntaxNodes.firstExpr(child);
                    AstNode sinkExpr = sink == null ? null : lowering.lower(sink);
                    result.add(new Param.Spread(SyntaxNodes.sinkIdent(child), sinkExpr));
                }
                case NAMED -> {
                    String name = SyntaxNodes.keyName(child);
                    if (name != null) {
                        AstNode value = lowering.required(child, SyntaxNodes.exprAfter(child, SyntaxKind.COLON),
                            "default value");
                        result.add(new Param.Named(name, value));
                    }
                }
                default -> {
                    if (SyntaxNodes.isPattern(child)) {
                        result.add(new Param.Pos(pattern(child)));
                    }
                }
            }
        }
        return result;
    }
}
