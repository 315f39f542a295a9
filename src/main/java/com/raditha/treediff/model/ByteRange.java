package com.raditha.treediff.model;

/**
 * Half-open byte range {@code [start, end)} of a node within its source.
 *
 * @param start first byte (inclusive)
 * @param end   last byte (exclusive)
 */
public record ByteRange(int start, int end) {

    public ByteRange {
        if (start < 0 || end < start) {
            throw new IllegalArgumentException(
                    String.format("Invalid byte range [%d, %d)", start, end));
        }
    }

    public int length() {
        return end - start;
    }

    public static ByteRange empty() {
        return new ByteRange(0, 0);
    }
}
