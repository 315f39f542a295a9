package com.raditha.treediff.filter;

import com.raditha.treediff.index.TreeNode;

/**
 * Combines category and size pre-filters.
 * Applies filters in order of cost: category first (one comparison), then
 * size.
 */
public class PreFilterChain implements CandidateFilter {

    private final CandidateFilter categoryFilter;
    private final SizeFilter sizeFilter;
    private final boolean useSizeFilter;

    /**
     * Create filter chain with a custom size threshold.
     *
     * @param maxSizeDiff Maximum size difference ratio (0.0 to 1.0)
     */
    public PreFilterChain(double maxSizeDiff) {
        this(new CategoryFilter(), new SizeFilter(maxSizeDiff));
    }

    /**
     * Create filter chain with a custom category filter and optional size filter.
     *
     * @param categoryFilter filter every accepted pairing must satisfy
     * @param sizeFilter     size filter, or null to disable it
     */
    public PreFilterChain(CandidateFilter categoryFilter, SizeFilter sizeFilter) {
        this.categoryFilter = categoryFilter;
        this.sizeFilter = sizeFilter;
        this.useSizeFilter = sizeFilter != null;
    }

    @Override
    public boolean shouldCompare(TreeNode oldNode, TreeNode newNode) {
        // Stage 1: Category filter
        if (!categoryFilter.shouldCompare(oldNode, newNode)) {
            return false;
        }

        // Stage 2: Size filter (if enabled)
        if (useSizeFilter && !sizeFilter.shouldCompare(oldNode, newNode)) {
            return false;
        }

        return true;
    }

    /**
     * The filter every accepted pairing must satisfy, without the size stage.
     */
    public CandidateFilter getCategoryFilter() {
        return categoryFilter;
    }

    /**
     * Get statistics about filter configuration.
     */
    public FilterStats getStats() {
        return new FilterStats(
                categoryFilter.getClass().getSimpleName(),
                useSizeFilter ? sizeFilter.getMaxDifferenceRatio() : null);
    }

    /**
     * Statistics record for filter configuration.
     */
    public record FilterStats(
            String categoryFilter,
            Double maxSizeDifference) {
        @Override
        public String toString() {
            if (maxSizeDifference != null) {
                return String.format("Category: %s, Size: %.0f%%",
                        categoryFilter, maxSizeDifference * 100);
            } else {
                return String.format("Category: %s (size filter disabled)", categoryFilter);
            }
        }
    }
}
