package com.scicalc.mathfrontend.ast;

import java.util.Objects;

/**
 * Span of source text a token or node was built from, for caret-style error display.
 */
public final class SourcePosition {

    private final int offset;
    private final int length;

    public SourcePosition(int offset, int length) {
        this.offset = offset;
        this.length = length;
    }

    /** Span from the start of {@code first} to the end of {@code last}. */
    public static SourcePosition spanning(SourcePosition first, SourcePosition last) {
        return new SourcePosition(first.offset, last.end() - first.offset);
    }

    public int getOffset() { return offset; }
    public int getLength() { return length; }

    public int end() {
        return offset + length;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourcePosition other)) return false;
        return offset == other.offset && length == other.length;
    }

    @Override
    public int hashCode() {
        return Objects.hash(offset, length);
    }

    @Override
    public String toString() {
        return "[" + offset + "+" + length + "]";
    }
}
