package com.raditha.treediff.matching;

import com.raditha.treediff.index.TreeIndex;
import com.raditha.treediff.index.TreeNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Seeds the roots and then matches the largest subtrees first.
 * <p>
 * For every unmapped old node, unmapped new nodes that pass the pre-filter
 * chain are ranked by distance, then by closeness of relative position,
 * then by pre-order index. The first ranked candidate within the threshold
 * that no other unmapped old node beats is accepted and its children are
 * proposed through the {@link ChildProposer}.
 */
final class TopDownMatcher {

    private final MatchContext context;
    private final ChildProposer proposer;

    TopDownMatcher(MatchContext context, ChildProposer proposer) {
        this.context = context;
        this.proposer = proposer;
    }

    void seedRoots() {
        Mapping mapping = context.mapping();
        TreeNode oldRoot = mapping.oldTree().root();
        TreeNode newRoot = mapping.newTree().root();
        if (context.canPair(oldRoot, newRoot)) {
            mapping.put(oldRoot, newRoot);
            context.seeded++;
            proposer.propagate(oldRoot, newRoot);
        }
    }

    void match() {
        TreeIndex oldTree = context.mapping().oldTree();
        TreeIndex newTree = context.mapping().newTree();
        CategoryBuckets oldBuckets = CategoryBuckets.of(oldTree, context);
        CategoryBuckets newBuckets = CategoryBuckets.of(newTree, context);

        for (TreeNode oldNode : oldTree.bySizeDescending()) {
            if (context.mapping().isOldMapped(oldNode)) {
                continue;
            }
            List<Ranked> ranked = rank(oldNode, newBuckets.compatibleWith(oldNode));
            int tried = 0;
            for (Ranked candidate : ranked) {
                if (tried++ >= context.config().candidateLimit() || !context.withinThreshold(candidate.distance())) {
                    break;
                }
                if (isMutualBest(oldNode, candidate, oldBuckets.compatibleWith(candidate.node()))) {
                    context.mapping().put(oldNode, candidate.node());
                    context.topDown++;
                    proposer.propagate(oldNode, candidate.node());
                    break;
                }
            }
        }
    }

    private List<Ranked> rank(TreeNode oldNode, List<TreeNode> newNodes) {
        List<Ranked> ranked = new ArrayList<>();
        for (TreeNode newNode : newNodes) {
            if (context.mapping().isNewMapped(newNode)) {
                continue;
            }
            if (!context.filters().shouldCompare(oldNode, newNode)) {
                context.filteredOut++;
                continue;
            }
            double d = context.distance(oldNode, newNode);
            ranked.add(new Ranked(newNode, d,
                    Math.abs(oldNode.relativePosition() - newNode.relativePosition())));
        }
        ranked.sort(Comparator.comparingDouble(Ranked::distance)
                .thenComparingDouble(Ranked::positionGap)
                .thenComparingInt(r -> r.node().index()));
        return ranked;
    }

    /**
     * No other unmapped old node that could be paired with the candidate is
     * strictly closer to it.
     */
    private boolean isMutualBest(TreeNode oldNode, Ranked candidate, List<TreeNode> rivals) {
        for (TreeNode rival : rivals) {
            if (rival == oldNode || context.mapping().isOldMapped(rival)
                    || !context.filters().shouldCompare(rival, candidate.node())) {
                continue;
            }
            if (MatchContext.strictlyBetter(context.distance(rival, candidate.node()), candidate.distance())) {
                return false;
            }
        }
        return true;
    }

    private record Ranked(TreeNode node, double distance, double positionGap) {
    }
}
