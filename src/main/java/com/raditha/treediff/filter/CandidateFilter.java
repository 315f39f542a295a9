package com.raditha.treediff.filter;

import com.raditha.treediff.index.TreeNode;

/**
 * Cheap test applied before any feature-vector distance is computed.
 */
@FunctionalInterface
public interface CandidateFilter {

    /**
     * Check if an old node and a new node may be paired.
     *
     * @param oldNode node of the old tree
     * @param newNode node of the new tree
     * @return true if the pair should be considered, false if it should be skipped
     */
    boolean shouldCompare(TreeNode oldNode, TreeNode newNode);
}
