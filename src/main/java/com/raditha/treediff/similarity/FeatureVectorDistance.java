package com.raditha.treediff.similarity;

import com.raditha.treediff.vector.FeatureVector;

/**
 * Distance between two feature vectors.
 * <p>
 * Only a ranking signal: hash collisions and small subtrees can give two
 * different subtrees a distance of 0.
 */
public class FeatureVectorDistance {

    private final DistanceMetric metric;

    public FeatureVectorDistance() {
        this(DistanceMetric.COSINE);
    }

    public FeatureVectorDistance(DistanceMetric metric) {
        this.metric = metric;
    }

    /**
     * Calculate the distance between two vectors.
     *
     * @param a first vector
     * @param b second vector
     * @return distance in [0, 1]
     * @throws IllegalArgumentException if the dimensions differ
     */
    public double distance(FeatureVector a, FeatureVector b) {
        if (a.dimension() != b.dimension()) {
            throw new IllegalArgumentException(
                    String.format("Feature vectors must have the same dimension (%d vs %d)",
                            a.dimension(), b.dimension()));
        }
        return switch (metric) {
            case COSINE -> cosine(a, b);
            case EUCLIDEAN -> euclidean(a, b);
        };
    }

    /**
     * Similarity in [0, 1], the complement of {@link #distance}.
     */
    public double similarity(FeatureVector a, FeatureVector b) {
        return 1.0 - distance(a, b);
    }

    private double cosine(FeatureVector a, FeatureVector b) {
        boolean aZero = a.isZero();
        boolean bZero = b.isZero();
        if (aZero && bZero) {
            return 0.0;
        }
        if (aZero || bZero) {
            return 1.0;
        }
        double dot = 0;
        for (int i = 0; i < a.dimension(); i++) {
            dot += (double) a.get(i) * b.get(i);
        }
        double cos = dot / Math.sqrt(a.normSquared() * b.normSquared());
        // Rounding can push identical vectors a hair past 1
        return clamp(1.0 - cos);
    }

    private double euclidean(FeatureVector a, FeatureVector b) {
        double normSum = Math.sqrt(a.normSquared()) + Math.sqrt(b.normSquared());
        if (normSum == 0) {
            return 0.0;
        }
        double sq = 0;
        for (int i = 0; i < a.dimension(); i++) {
            double d = (double) a.get(i) - b.get(i);
            sq += d * d;
        }
        return clamp(Math.sqrt(sq) / normSum);
    }

    private static double clamp(double value) {
        if (value < 1e-12) {
            return 0.0;
        }
        return Math.min(1.0, value);
    }
}
