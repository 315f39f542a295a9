package com.raditha.treediff.matching;

import com.github.difflib.DiffUtils;
import com.github.difflib.patch.AbstractDelta;
import com.github.difflib.patch.Patch;
import com.raditha.treediff.index.TreeNode;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Pairs the children of two matched variable-length sequences.
 * <p>
 * Identical subtrees are anchored first with a longest-common-subsequence
 * diff over the two child lists, which keeps unchanged statements in order
 * around insertions and deletions. The children left between the anchors
 * are paired greedily by feature-vector distance, closest first.
 */
final class SiblingAligner {

    private final MatchContext context;

    SiblingAligner(MatchContext context) {
        this.context = context;
    }

    /**
     * Align two child lists.
     *
     * @param olds children of the old node
     * @param news children of the new node
     * @return pairs ready to be added to the mapping; no node appears twice
     */
    List<Mapping.Pair> align(List<TreeNode> olds, List<TreeNode> news) {
        List<Mapping.Pair> pairs = new ArrayList<>();
        if (olds.isEmpty() || news.isEmpty()) {
            return pairs;
        }
        boolean[] oldUsed = new boolean[olds.size()];
        boolean[] newUsed = new boolean[news.size()];

        anchorIdentical(olds, news, oldUsed, newUsed, pairs);
        pairClosest(olds, news, oldUsed, newUsed, pairs);
        return pairs;
    }

    private void anchorIdentical(List<TreeNode> olds, List<TreeNode> news,
                                 boolean[] oldUsed, boolean[] newUsed, List<Mapping.Pair> pairs) {
        Patch<SubtreeKey> patch = DiffUtils.diff(keys(olds), keys(news));

        int i = 0;
        int j = 0;
        for (AbstractDelta<SubtreeKey> delta : patch.getDeltas()) {
            int sourcePosition = delta.getSource().getPosition();
            while (i < sourcePosition) {
                anchor(olds, news, i++, j++, oldUsed, newUsed, pairs);
            }
            i = sourcePosition + delta.getSource().size();
            j = delta.getTarget().getPosition() + delta.getTarget().size();
        }
        while (i < olds.size() && j < news.size()) {
            anchor(olds, news, i++, j++, oldUsed, newUsed, pairs);
        }
    }

    private void anchor(List<TreeNode> olds, List<TreeNode> news, int i, int j,
                        boolean[] oldUsed, boolean[] newUsed, List<Mapping.Pair> pairs) {
        TreeNode oldNode = olds.get(i);
        TreeNode newNode = news.get(j);
        if (context.canPair(oldNode, newNode)) {
            pairs.add(new Mapping.Pair(oldNode, newNode));
            oldUsed[i] = true;
            newUsed[j] = true;
        }
    }

    private void pairClosest(List<TreeNode> olds, List<TreeNode> news,
                             boolean[] oldUsed, boolean[] newUsed, List<Mapping.Pair> pairs) {
        List<Candidate> candidates = new ArrayList<>();
        for (int i = 0; i < olds.size(); i++) {
            if (oldUsed[i]) {
                continue;
            }
            for (int j = 0; j < news.size(); j++) {
                if (newUsed[j] || !context.canPair(olds.get(i), news.get(j))) {
                    continue;
                }
                double d = context.distance(olds.get(i), news.get(j));
                if (context.withinThreshold(d)) {
                    candidates.add(new Candidate(i, j, d));
                }
            }
        }
        candidates.sort(Comparator.comparingDouble(Candidate::distance)
                .thenComparingInt(c -> Math.abs(c.oldPosition() - c.newPosition()))
                .thenComparingInt(Candidate::oldPosition)
                .thenComparingInt(Candidate::newPosition));

        for (Candidate c : candidates) {
            if (oldUsed[c.oldPosition()] || newUsed[c.newPosition()]) {
                continue;
            }
            oldUsed[c.oldPosition()] = true;
            newUsed[c.newPosition()] = true;
            pairs.add(new Mapping.Pair(olds.get(c.oldPosition()), news.get(c.newPosition())));
        }
    }

    private static List<SubtreeKey> keys(List<TreeNode> nodes) {
        List<SubtreeKey> keys = new ArrayList<>(nodes.size());
        for (TreeNode node : nodes) {
            keys.add(new SubtreeKey(node));
        }
        return keys;
    }

    private record Candidate(int oldPosition, int newPosition, double distance) {
    }

    /**
     * Equality by subtree content, so the diff treats identical subtrees
     * from either tree as equal elements.
     */
    private record SubtreeKey(TreeNode node) {
        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SubtreeKey other)) return false;
            return node.sameSubtreeContent(other.node);
        }

        @Override
        public int hashCode() {
            return node.subtreeHash();
        }
    }
}
