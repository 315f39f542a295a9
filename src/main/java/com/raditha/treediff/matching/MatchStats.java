package com.raditha.treediff.matching;

/**
 * Counters collected during one matching run.
 *
 * @param seeded      Root pairs seeded before the top-down pass (0 or 1)
 * @param topDown     Pairs accepted by the top-down candidate search
 * @param propagated  Pairs proposed from an already matched parent
 * @param bottomUp    Pairs found by exact content in the bottom-up pass
 * @param recovered   Unmapped parents recovered from their mapped children
 * @param comparisons Feature-vector distances computed
 * @param filteredOut Candidate pairs rejected by the pre-filters
 */
public record MatchStats(
        int seeded,
        int topDown,
        int propagated,
        int bottomUp,
        int recovered,
        long comparisons,
        long filteredOut) {

    public int totalPairs() {
        return seeded + topDown + propagated + bottomUp + recovered;
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format(
                "%d pairs (seeded %d, top-down %d, propagated %d, bottom-up %d, recovered %d); "
                        + "%d distances computed, %d candidates filtered out",
                totalPairs(), seeded, topDown, propagated, bottomUp, recovered, comparisons, filteredOut);
    }
}
