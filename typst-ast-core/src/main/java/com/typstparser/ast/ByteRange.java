package com.typstparser.ast;

/**
 * A half-open span of UTF-8 byte offsets into the source text.
 *
 * <p>Nodes synthesized during error recovery have no source extent; such nodes
 * carry a {@code null} range rather than a sentinel value.</p>
 */
public record ByteRange(int start, int end) {

    public ByteRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException("Invalid byte range [" + start + ", " + end + "]");
        }
    }

    public int length() {
        return end - start;
    }

    public boolean contains(ByteRange other) {
        return other.start >= start && other.end <= end;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + end + "]";
    }
}
