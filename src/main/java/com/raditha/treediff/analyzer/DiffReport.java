package com.raditha.treediff.analyzer;

import com.raditha.treediff.config.DiffConfig;
import com.raditha.treediff.index.TreeIndex;
import com.raditha.treediff.matching.Mapping;
import com.raditha.treediff.matching.MatchStats;
import com.raditha.treediff.script.Edit;
import com.raditha.treediff.script.EditScript;

/**
 * Result of comparing two trees.
 * The raw mapping is kept alongside the script for diagnostics.
 */
public record DiffReport(
        TreeIndex oldTree,
        TreeIndex newTree,
        Mapping mapping,
        EditScript script,
        MatchStats stats,
        DiffConfig config) {

    /**
     * Check if the new tree differs from the old one.
     */
    public boolean hasChanges() {
        return !script.isEmptyChange();
    }

    /**
     * Get summary statistics.
     */
    public String getSummary() {
        return String.format(
                "%d/%d old and %d/%d new nodes mapped: %d copied (%d moved), %d replaced, %d inserted, %d deleted "
                        + "(threshold: %.2f)",
                mapping.size(), oldTree.size(),
                mapping.size(), newTree.size(),
                script.countOf(Edit.Copy.class),
                script.flatten().stream().filter(e -> e instanceof Edit.Copy c && c.moved()).count(),
                script.countOf(Edit.Replace.class),
                script.countOf(Edit.Insert.class),
                script.countOf(Edit.Delete.class),
                config.threshold());
    }
}
