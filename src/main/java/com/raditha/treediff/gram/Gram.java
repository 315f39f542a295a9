package com.raditha.treediff.gram;

import java.util.List;
import java.util.Objects;

/**
 * Local structural fingerprint of one node.
 * <p>
 * The stem holds the labels of the nearest ancestors, nearest first; the
 * base holds the node's own label followed by its next right siblings.
 * Short contexts are padded with {@link #ABSENT}, so every gram extracted
 * with the same p and q has the same length.
 *
 * @param stem ancestor labels
 * @param base labels of the node and its right siblings
 */
public record Gram(List<String> stem, List<String> base) {

    /** Padding label for positions past the edge of the tree. */
    public static final String ABSENT = "*";

    public Gram {
        stem = List.copyOf(Objects.requireNonNull(stem, "stem"));
        base = List.copyOf(Objects.requireNonNull(base, "base"));
    }

    /**
     * Total number of labels (p + q).
     */
    public int length() {
        return stem.size() + base.size();
    }

    /**
     * Pinned to the {@link List#hashCode()} contract so feature vectors do not
     * depend on how the runtime hashes records.
     */
    @Override
    public int hashCode() {
        return 31 * stem.hashCode() + base.hashCode();
    }

    @Override
    public String toString() {
        return String.join(".", stem) + "|" + String.join(".", base);
    }
}
