package org.dxworks.pyframe.model;

import java.util.Objects;

/**
 * Position range in a source unit.
 * Lines are 1-based, columns and offsets are 0-based character indices; the end is exclusive.
 */
public final class SourceSpan {
    public final int startLine;
    public final int startColumn;
    public final int endLine;
    public final int endColumn;
    public final int startOffset;
    public final int endOffset;

    public SourceSpan(int startLine, int startColumn, int endLine, int endColumn, int startOffset, int endOffset) {
        this.startLine = startLine;
        this.startColumn = startColumn;
        this.endLine = endLine;
        this.endColumn = endColumn;
        this.startOffset = startOffset;
        this.endOffset = endOffset;
    }

    /** Zero-width span positioned at the start of {@code other}. */
    public static SourceSpan at(SourceSpan other) {
        return new SourceSpan(other.startLine, other.startColumn, other.startLine, other.startColumn,
                other.startOffset, other.startOffset);
    }

    /** Span covering {@code first} through {@code last}. */
    public static SourceSpan between(SourceSpan first, SourceSpan last) {
        return new SourceSpan(first.startLine, first.startColumn, last.endLine, last.endColumn,
                first.startOffset, last.endOffset);
    }

    public int length() {
        return endOffset - startOffset;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SourceSpan)) return false;
        SourceSpan that = (SourceSpan) o;
        return startLine == that.startLine && startColumn == that.startColumn
                && endLine == that.endLine && endColumn == that.endColumn
                && startOffset == that.startOffset && endOffset == that.endOffset;
    }

    @Override
    public int hashCode() {
        return Objects.hash(startLine, startColumn, endLine, endColumn, startOffset, endOffset);
    }

    @Override
    public String toString() {
        return startLine + ":" + startColumn + "-" + endLine + ":" + endColumn;
    }
}
