package com.raditha.treediff.vector;

import java.util.Arrays;

/**
 * Fixed-dimension histogram of hashed grams.
 * Immutable; the backing array is never exposed.
 */
public final class FeatureVector {

    private final int[] counts;

    FeatureVector(int[] counts) {
        this.counts = counts;
    }

    /**
     * All-zero vector of the given dimension.
     */
    public static FeatureVector zero(int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive, got: " + dimension);
        }
        return new FeatureVector(new int[dimension]);
    }

    public static FeatureVector of(int... counts) {
        if (counts.length == 0) {
            throw new IllegalArgumentException("Dimension must be positive, got: 0");
        }
        for (int c : counts) {
            if (c < 0) {
                throw new IllegalArgumentException("Entries must be non-negative, got: " + c);
            }
        }
        return new FeatureVector(counts.clone());
    }

    public int dimension() {
        return counts.length;
    }

    public int get(int index) {
        return counts[index];
    }

    /**
     * Sum of all entries, i.e. the number of grams hashed into this vector.
     */
    public long total() {
        long sum = 0;
        for (int c : counts) {
            sum += c;
        }
        return sum;
    }

    /**
     * Squared Euclidean norm.
     */
    public double normSquared() {
        double sum = 0;
        for (int c : counts) {
            sum += (double) c * c;
        }
        return sum;
    }

    public boolean isZero() {
        for (int c : counts) {
            if (c != 0) {
                return false;
            }
        }
        return true;
    }

    /**
     * Entry-wise sum, used to accumulate subtree fingerprints bottom-up.
     */
    public FeatureVector plus(FeatureVector other) {
        requireSameDimension(other);
        int[] sum = counts.clone();
        for (int i = 0; i < sum.length; i++) {
            sum[i] += other.counts[i];
        }
        return new FeatureVector(sum);
    }

    public int[] toArray() {
        return counts.clone();
    }

    void requireSameDimension(FeatureVector other) {
        if (other.counts.length != counts.length) {
            throw new IllegalArgumentException(
                    String.format("Feature vectors must have the same dimension (%d vs %d)",
                            counts.length, other.counts.length));
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FeatureVector that)) return false;
        return Arrays.equals(counts, that.counts);
    }

    @Override
    public int hashCode() {
        return Arrays.hashCode(counts);
    }

    @Override
    public String toString() {
        return Arrays.toString(counts);
    }
}
