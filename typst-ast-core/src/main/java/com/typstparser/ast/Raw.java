package com.typstparser.ast;

import java.util.List;

/**
 * Raw text or a raw block. The lines exclude the fences and the language tag;
 * block lines also lose their common indentation.
 */
public record Raw(
    ByteRange range,
    List<String> lines,
    String lang,  // Can be null
    boolean block
) implements MarkupNode {
    @Override
    public String kind() {
        return "raw";
    }
}
