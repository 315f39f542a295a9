package com.raditha.treediff.filter;

import com.raditha.treediff.index.TreeNode;

/**
 * Filters node pairs based on subtree size difference.
 * Used while searching for candidates; pairs proposed from an already
 * matched parent skip it.
 */
public class SizeFilter implements CandidateFilter {

    private final double maxDifferenceRatio;

    /**
     * Create filter with custom max difference ratio.
     *
     * @param maxDifferenceRatio Maximum allowed size difference (0.0 to 1.0)
     */
    public SizeFilter(double maxDifferenceRatio) {
        if (maxDifferenceRatio < 0.0 || maxDifferenceRatio > 1.0) {
            throw new IllegalArgumentException("Max difference ratio must be between 0.0 and 1.0");
        }
        this.maxDifferenceRatio = maxDifferenceRatio;
    }

    @Override
    public boolean shouldCompare(TreeNode oldNode, TreeNode newNode) {
        return shouldCompare(oldNode.size(), newNode.size());
    }

    /**
     * Check if two subtree sizes are close enough to compare.
     *
     * @param size1 Size of first subtree
     * @param size2 Size of second subtree
     * @return true if subtrees should be compared, false if should be skipped
     */
    public boolean shouldCompare(int size1, int size2) {
        if (size1 == size2) {
            return true;
        }

        int maxSize = Math.max(size1, size2);
        int minSize = Math.min(size1, size2);

        double differenceRatio = (double) (maxSize - minSize) / maxSize;

        return differenceRatio <= maxDifferenceRatio;
    }

    public double getMaxDifferenceRatio() {
        return maxDifferenceRatio;
    }
}
