package org.jrename.workspace;

import org.eclipse.lsp4j.Range;

/** A half-open range [start, end) of character offsets in a document's text. */
public final class TextSpan implements Comparable<TextSpan> {
    public final int start, length;

    public TextSpan(int start, int length) {
        if (start < 0 || length < 0) {
            throw new IllegalArgumentException(String.format("Span %d+%d is invalid", start, length));
        }
        this.start = start;
        this.length = length;
    }

    public static TextSpan fromBounds(int start, int end) {
        return new TextSpan(start, end - start);
    }

    public int end() {
        return start + length;
    }

    public boolean isEmpty() {
        return length == 0;
    }

    public boolean contains(int position) {
        return start <= position && position < end();
    }

    public boolean contains(TextSpan other) {
        return start <= other.start && other.end() <= end();
    }

    public boolean overlapsWith(TextSpan other) {
        return Math.max(start, other.start) < Math.min(end(), other.end());
    }

    public Range asRange(TextLines lines) {
        return new Range(lines.position(start), lines.position(end()));
    }

    @Override
    public int compareTo(TextSpan other) {
        if (start != other.start) return Integer.compare(start, other.start);
        return Integer.compare(length, other.length);
    }

    @Override
    public boolean equals(Object other) {
        if (!(other instanceof TextSpan)) return false;
        var that = (TextSpan) other;
        return this.start == that.start && this.length == that.length;
    }

    @Override
    public int hashCode() {
        return 31 * start + length;
    }

    @Override
    public String toString() {
        return String.format("[%d..%d)", start, end());
    }

    public static final TextSpan EMPTY = new TextSpan(0, 0);
}
