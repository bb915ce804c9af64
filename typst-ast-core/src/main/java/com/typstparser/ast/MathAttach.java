package com.typstparser.ast;

/**
 * A base with sub- and superscript attachments.
 */
public record MathAttach(
    ByteRange range,
    AstNode base,
    AstNode bottom,  // Can be null
    AstNode top,  // Can be null
    Integer primes  // Can be null
) implements MathNode {
    @Override
    public String kind() {
        return "mathAttach";
    }
}
