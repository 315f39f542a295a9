package com.raditha.treediff.matching;

/**
 * Outcome of matching two trees.
 *
 * @param mapping the node correspondence
 * @param stats   counters of the run
 */
public record MatchResult(Mapping mapping, MatchStats stats) {
}
