package com.raditha.treediff.model;

/**
 * Line/column span of a node. All positions are 1-indexed.
 *
 * @param startLine   Starting line number
 * @param startColumn Starting column number
 * @param endLine     Ending line number (inclusive)
 * @param endColumn   Ending column number
 */
public record Span(
        int startLine,
        int startColumn,
        int endLine,
        int endColumn) {

    public Span {
        if (startLine < 1 || startColumn < 1 || endLine < startLine) {
            throw new IllegalArgumentException(
                    String.format("Invalid span %d:%d-%d:%d", startLine, startColumn, endLine, endColumn));
        }
    }

    public static Span unknown() {
        return new Span(1, 1, 1, 1);
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
