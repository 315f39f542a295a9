package com.raditha.treediff.matching;

import com.raditha.treediff.filter.CategoryFilter;
import com.raditha.treediff.index.TreeIndex;
import com.raditha.treediff.index.TreeNode;
import com.raditha.treediff.model.Category;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Nodes of one tree grouped by category, in pre-order.
 * Only used to narrow the candidate scan when the category filter is the
 * plain same-category rule; any other filter sees every node.
 */
final class CategoryBuckets {

    private final Map<Category, List<TreeNode>> buckets;
    private final List<TreeNode> all;

    private CategoryBuckets(Map<Category, List<TreeNode>> buckets, List<TreeNode> all) {
        this.buckets = buckets;
        this.all = all;
    }

    static CategoryBuckets of(TreeIndex tree, MatchContext context) {
        if (!(context.categoryFilter() instanceof CategoryFilter)) {
            return new CategoryBuckets(null, tree.nodes());
        }
        Map<Category, List<TreeNode>> buckets = new EnumMap<>(Category.class);
        for (TreeNode node : tree.nodes()) {
            buckets.computeIfAbsent(node.category(), c -> new ArrayList<>()).add(node);
        }
        return new CategoryBuckets(buckets, tree.nodes());
    }

    /**
     * Nodes that may correspond to a node of the given category.
     */
    List<TreeNode> compatibleWith(TreeNode node) {
        if (buckets == null) {
            return all;
        }
        return buckets.getOrDefault(node.category(), List.of());
    }
}
