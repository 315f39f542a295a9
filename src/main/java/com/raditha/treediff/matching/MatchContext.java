package com.raditha.treediff.matching;

import com.raditha.treediff.config.DiffConfig;
import com.raditha.treediff.filter.CandidateFilter;
import com.raditha.treediff.filter.PreFilterChain;
import com.raditha.treediff.index.TreeIndex;
import com.raditha.treediff.index.TreeNode;
import com.raditha.treediff.similarity.FeatureVectorDistance;

/**
 * State shared by the passes of one matching run.
 * Confined to the thread running the comparison.
 */
final class MatchContext {

    private static final double EPSILON = 1e-9;

    private final DiffConfig config;
    private final PreFilterChain filters;
    private final FeatureVectorDistance distance;
    private final Mapping mapping;

    int seeded;
    int topDown;
    int propagated;
    int bottomUp;
    int recovered;
    long comparisons;
    long filteredOut;

    MatchContext(DiffConfig config, PreFilterChain filters, FeatureVectorDistance distance,
                 TreeIndex oldTree, TreeIndex newTree) {
        this.config = config;
        this.filters = filters;
        this.distance = distance;
        this.mapping = new Mapping(oldTree, newTree);
    }

    DiffConfig config() {
        return config;
    }

    Mapping mapping() {
        return mapping;
    }

    PreFilterChain filters() {
        return filters;
    }

    CandidateFilter categoryFilter() {
        return filters.getCategoryFilter();
    }

    double distance(TreeNode oldNode, TreeNode newNode) {
        comparisons++;
        return distance.distance(oldNode.vector(), newNode.vector());
    }

    boolean withinThreshold(double d) {
        return d <= config.threshold() + EPSILON;
    }

    /**
     * Strictly smaller, beyond rounding noise.
     */
    static boolean strictlyBetter(double candidate, double incumbent) {
        return candidate < incumbent - EPSILON;
    }

    /**
     * Both nodes free and allowed to correspond.
     */
    boolean canPair(TreeNode oldNode, TreeNode newNode) {
        return mapping.isFree(oldNode, newNode) && categoryFilter().shouldCompare(oldNode, newNode);
    }

    /**
     * Free, allowed, and either identical or close enough.
     */
    boolean acceptable(TreeNode oldNode, TreeNode newNode) {
        if (!canPair(oldNode, newNode)) {
            return false;
        }
        return oldNode.sameSubtreeContent(newNode) || withinThreshold(distance(oldNode, newNode));
    }

    MatchStats stats() {
        return new MatchStats(seeded, topDown, propagated, bottomUp, recovered, comparisons, filteredOut);
    }
}
