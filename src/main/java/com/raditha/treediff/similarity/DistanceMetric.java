package com.raditha.treediff.similarity;

/**
 * Distance used to rank feature vectors. Both metrics return values in
 * [0, 1] for non-negative vectors; lower means more similar.
 */
public enum DistanceMetric {
    /** 1 - cosine similarity. Insensitive to subtree size. */
    COSINE,

    /** |a - b| / (|a| + |b|). Penalizes size differences. */
    EUCLIDEAN;

    public static DistanceMetric fromString(String value) {
        return switch (value.trim().toLowerCase()) {
            case "cosine" -> COSINE;
            case "euclidean" -> EUCLIDEAN;
            default -> throw new IllegalArgumentException("Unknown distance metric: " + value);
        };
    }
}
