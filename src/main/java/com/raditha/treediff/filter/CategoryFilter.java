package com.raditha.treediff.filter;

import com.raditha.treediff.index.TreeNode;

/**
 * Only nodes of the same category may correspond.
 * Every pair the matcher accepts passes this filter.
 */
public class CategoryFilter implements CandidateFilter {

    @Override
    public boolean shouldCompare(TreeNode oldNode, TreeNode newNode) {
        return oldNode.category() == newNode.category();
    }
}
