package com.raditha.treediff.config;

import com.raditha.treediff.gram.LabelFunction;
import com.raditha.treediff.similarity.DistanceMetric;

/**
 * Configuration of one comparison run. Both trees of a comparison are
 * fingerprinted with the same values.
 *
 * @param p                 Ancestor labels per gram
 * @param q                 Sibling labels per gram (including the node itself)
 * @param dimension         Feature vector dimension
 * @param threshold         Maximum feature-vector distance (0.0-1.0) at which two nodes may be matched
 * @param metric            Distance metric
 * @param maxSizeDifference Maximum subtree size difference ratio (0.0-1.0) during candidate search
 * @param candidateLimit    Ranked candidates tried per node before giving up
 * @param smallNodeSize     Largest subtree the bottom-up pass matches by exact content
 * @param recoveryRatio     Share of mapped children (0.0-1.0) that must agree before an unmapped parent is recovered
 * @param labels            Label each node contributes to grams
 */
public record DiffConfig(
        int p,
        int q,
        int dimension,
        double threshold,
        DistanceMetric metric,
        double maxSizeDifference,
        int candidateLimit,
        int smallNodeSize,
        double recoveryRatio,
        LabelFunction labels) {
    /**
     * Validate configuration.
     */
    public DiffConfig {
        if (p < 1 || q < 1) {
            throw new IllegalArgumentException("p and q must be >= 1");
        }
        if (dimension < 1) {
            throw new IllegalArgumentException("dimension must be >= 1");
        }
        if (threshold < 0.0 || threshold > 1.0) {
            throw new IllegalArgumentException("threshold must be between 0.0 and 1.0");
        }
        if (metric == null) {
            throw new IllegalArgumentException("metric cannot be null");
        }
        if (maxSizeDifference < 0.0 || maxSizeDifference > 1.0) {
            throw new IllegalArgumentException("maxSizeDifference must be between 0.0 and 1.0");
        }
        if (candidateLimit < 1) {
            throw new IllegalArgumentException("candidateLimit must be >= 1");
        }
        if (smallNodeSize < 1) {
            throw new IllegalArgumentException("smallNodeSize must be >= 1");
        }
        if (recoveryRatio <= 0.0 || recoveryRatio > 1.0) {
            throw new IllegalArgumentException("recoveryRatio must be in (0.0, 1.0]");
        }
        if (labels == null) {
            labels = LabelFunction.CATEGORY;
        }
    }

    /**
     * Moderate preset: balanced matching (distance up to 0.30).
     * Good default for most files.
     */
    public static DiffConfig moderate() {
        return new DiffConfig(
                2, // p
                3, // q
                64, // dimension
                0.30, // threshold
                DistanceMetric.COSINE,
                0.50, // maxSizeDifference
                16, // candidateLimit
                3, // smallNodeSize
                0.50, // recoveryRatio
                LabelFunction.CATEGORY);
    }

    /**
     * Strict preset: only very similar subtrees are matched, the rest become
     * inserts and deletes.
     */
    public static DiffConfig strict() {
        return new DiffConfig(
                3,
                3,
                128,
                0.15,
                DistanceMetric.COSINE,
                0.30,
                8,
                1, // smallNodeSize - leaves only
                0.75,
                LabelFunction.KIND_AND_CATEGORY);
    }

    /**
     * Lenient preset: favours replace and move over delete + insert on
     * heavily restructured code.
     */
    public static DiffConfig lenient() {
        return new DiffConfig(
                2,
                2,
                64,
                0.50,
                DistanceMetric.COSINE,
                0.80,
                32,
                5,
                0.34,
                LabelFunction.CATEGORY);
    }

    public static DiffConfig forPreset(String preset) {
        return switch (preset) {
            case "strict" -> strict();
            case "lenient" -> lenient();
            case "moderate" -> moderate();
            default -> throw new IllegalArgumentException("Unknown preset: " + preset);
        };
    }

    public DiffConfig withThreshold(double threshold) {
        return new DiffConfig(p, q, dimension, threshold, metric, maxSizeDifference,
                candidateLimit, smallNodeSize, recoveryRatio, labels);
    }

    public DiffConfig withGramSizes(int p, int q) {
        return new DiffConfig(p, q, dimension, threshold, metric, maxSizeDifference,
                candidateLimit, smallNodeSize, recoveryRatio, labels);
    }

    public DiffConfig withDimension(int dimension) {
        return new DiffConfig(p, q, dimension, threshold, metric, maxSizeDifference,
                candidateLimit, smallNodeSize, recoveryRatio, labels);
    }
}
