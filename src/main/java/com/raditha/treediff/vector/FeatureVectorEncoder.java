package com.raditha.treediff.vector;

import com.raditha.treediff.gram.Gram;

import java.util.Collection;

/**
 * Hashes a multiset of grams into a fixed-dimension histogram ("bag of grams").
 * <p>
 * Each gram lands in one bucket and adds one to it, so the entries always sum
 * to the number of grams. Distinct grams may collide in the same bucket; the
 * fingerprint is approximate and callers only use it to rank candidates.
 * The encoder holds no state, so vectors built from different trees never
 * influence each other.
 */
public final class FeatureVectorEncoder {

    private static final long SEED = 0x9e3779b97f4a7c15L; // Golden ratio constant

    private FeatureVectorEncoder() {
    }

    /**
     * Build the feature vector of a gram multiset.
     *
     * @param grams     grams, duplicates counted once per occurrence
     * @param dimension number of buckets, must be positive
     * @return vector with exactly {@code dimension} entries
     * @throws IllegalArgumentException if dimension is not positive
     */
    public static FeatureVector featureVector(Collection<Gram> grams, int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive, got: " + dimension);
        }
        int[] counts = new int[dimension];
        for (Gram gram : grams) {
            counts[bucket(gram, dimension)]++;
        }
        return new FeatureVector(counts);
    }

    /**
     * Vector of a single gram: one entry set to 1.
     */
    public static FeatureVector unit(Gram gram, int dimension) {
        if (dimension <= 0) {
            throw new IllegalArgumentException("Dimension must be positive, got: " + dimension);
        }
        int[] counts = new int[dimension];
        counts[bucket(gram, dimension)] = 1;
        return new FeatureVector(counts);
    }

    /**
     * Bucket index of a gram in {@code [0, dimension)}.
     * Gram hash codes derive from {@link String#hashCode()}, so buckets are
     * stable across runs and JVMs.
     */
    public static int bucket(Gram gram, int dimension) {
        return (int) Math.floorMod(mix(gram.hashCode()), (long) dimension);
    }

    private static long mix(int value) {
        long h = value ^ SEED;
        h ^= (h >>> 33);
        h *= 0xff51afd7ed558ccdL;
        h ^= (h >>> 33);
        h *= 0xc4ceb9fe1a85ec53L;
        h ^= (h >>> 33);
        return h;
    }
}
