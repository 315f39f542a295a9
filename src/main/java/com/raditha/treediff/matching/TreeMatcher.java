package com.raditha.treediff.matching;

import com.raditha.treediff.config.DiffConfig;
import com.raditha.treediff.filter.CandidateFilter;
import com.raditha.treediff.filter.CategoryFilter;
import com.raditha.treediff.filter.PreFilterChain;
import com.raditha.treediff.filter.SizeFilter;
import com.raditha.treediff.index.TreeIndex;
import com.raditha.treediff.similarity.FeatureVectorDistance;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes a mapping between two indexed trees.
 * <p>
 * Passes, in order:
 * <ol>
 *   <li>seed the roots when they may correspond</li>
 *   <li>top-down: largest subtrees first, best mutual candidate within the threshold</li>
 *   <li>bottom-up: small identical subtrees</li>
 *   <li>container recovery from mapped children</li>
 * </ol>
 * Accepted pairs are propagated to their children after every pass. An
 * empty mapping is a valid result: dissimilar trees never cause a failure.
 * <p>
 * Instances are immutable and may be shared between threads; all state of
 * a run lives in a per-call context.
 */
public class TreeMatcher {

    private static final Logger logger = LoggerFactory.getLogger(TreeMatcher.class);

    private final DiffConfig config;
    private final CandidateFilter categoryFilter;
    private final FeatureVectorDistance distance;

    /**
     * Create a matcher that only pairs nodes of the same category.
     */
    public TreeMatcher(DiffConfig config) {
        this(config, new CategoryFilter());
    }

    /**
     * Create a matcher with a custom pairing filter.
     *
     * @param config         matching configuration
     * @param categoryFilter filter every accepted pair must satisfy
     */
    public TreeMatcher(DiffConfig config, CandidateFilter categoryFilter) {
        if (config == null || categoryFilter == null) {
            throw new IllegalArgumentException("config and categoryFilter are required");
        }
        this.config = config;
        this.categoryFilter = categoryFilter;
        this.distance = new FeatureVectorDistance(config.metric());
    }

    /**
     * Match two trees indexed with the same gram sizes and dimension.
     *
     * @throws IllegalArgumentException if the indexes use different dimensions
     */
    public MatchResult match(TreeIndex oldTree, TreeIndex newTree) {
        if (oldTree.dimension() != newTree.dimension()) {
            throw new IllegalArgumentException(String.format(
                    "Trees indexed with different dimensions: %d vs %d",
                    oldTree.dimension(), newTree.dimension()));
        }
        PreFilterChain filters = new PreFilterChain(categoryFilter, new SizeFilter(config.maxSizeDifference()));
        MatchContext context = new MatchContext(config, filters, distance, oldTree, newTree);
        ChildProposer proposer = new ChildProposer(context);
        TopDownMatcher topDown = new TopDownMatcher(context, proposer);
        BottomUpMatcher bottomUp = new BottomUpMatcher(context, proposer);

        topDown.seedRoots();
        topDown.match();
        bottomUp.matchIdentical();
        bottomUp.recoverContainers();

        MatchStats stats = context.stats();
        if (logger.isDebugEnabled()) {
            logger.debug("Matched {} old / {} new nodes: {} [{}]",
                    oldTree.size(), newTree.size(), stats.getSummary(), filters.getStats());
        }
        return new MatchResult(context.mapping(), stats);
    }

    public DiffConfig getConfig() {
        return config;
    }
}
