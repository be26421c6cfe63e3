package com.raditha.pyrewrite.model;

/**
 * Represents a source code range (line and column positions plus character offsets).
 *
 * @param startLine   Starting line number (1-indexed)
 * @param endLine     Ending line number (1-indexed, inclusive)
 * @param startColumn Starting column number (1-indexed)
 * @param endColumn   Ending column number (1-indexed, exclusive)
 * @param startOffset Character offset of the first character in the file text
 * @param endOffset   Character offset just past the last character
 */
public record Range(
        int startLine,
        int endLine,
        int startColumn,
        int endColumn,
        int startOffset,
        int endOffset) {

    public Range {
        if (endOffset < startOffset) {
            throw new IllegalArgumentException("Range ends before it starts: " + startOffset + ".." + endOffset);
        }
    }

    /**
     * Get total number of lines in this range.
     */
    public int getLineCount() {
        return endLine - startLine + 1;
    }

    /**
     * Length of the range in characters.
     */
    public int length() {
        return endOffset - startOffset;
    }

    /**
     * True when the other range lies completely inside this one.
     */
    public boolean contains(Range other) {
        return startOffset <= other.startOffset && other.endOffset <= endOffset;
    }

    /**
     * Format as "L45-52" for display.
     */
    public String toDisplayString() {
        if (startLine == endLine) {
            return "L" + startLine;
        }
        return "L" + startLine + "-" + endLine;
    }

    @Override
    public String toString() {
        return toDisplayString();
    }
}
