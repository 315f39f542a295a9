package com.raditha.treediff.analyzer;

import com.raditha.treediff.config.DiffConfig;
import com.raditha.treediff.filter.CandidateFilter;
import com.raditha.treediff.filter.CategoryFilter;
import com.raditha.treediff.gram.PqGramExtractor;
import com.raditha.treediff.index.TreeIndex;
import com.raditha.treediff.matching.MatchResult;
import com.raditha.treediff.matching.TreeMatcher;
import com.raditha.treediff.model.Term;
import com.raditha.treediff.script.EditScript;
import com.raditha.treediff.script.EditScriptBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Main entry point for comparing two syntax trees.
 * <p>
 * Both trees are indexed with the same gram extractor and dimension, matched,
 * and the mapping is turned into an edit script. A differ holds no state
 * between calls and can be shared by worker threads.
 */
public class TreeDiffer {

    private static final Logger logger = LoggerFactory.getLogger(TreeDiffer.class);

    private final DiffConfig config;
    private final PqGramExtractor extractor;
    private final TreeMatcher matcher;
    private final EditScriptBuilder scriptBuilder;

    /**
     * Create a differ with the default configuration.
     */
    public TreeDiffer() {
        this(DiffConfig.moderate());
    }

    public TreeDiffer(DiffConfig config) {
        this(config, new CategoryFilter());
    }

    /**
     * Create a differ with a custom pairing filter.
     *
     * @param config         comparison configuration
     * @param categoryFilter filter every matched pair must satisfy
     */
    public TreeDiffer(DiffConfig config, CandidateFilter categoryFilter) {
        this.config = config;
        this.extractor = new PqGramExtractor(config.p(), config.q(), config.labels());
        this.matcher = new TreeMatcher(config, categoryFilter);
        this.scriptBuilder = new EditScriptBuilder();
    }

    /**
     * Compare two trees.
     *
     * @param oldTerm tree before the change
     * @param newTerm tree after the change
     * @return mapping, edit script and counters
     */
    public DiffReport diff(Term oldTerm, Term newTerm) {
        TreeIndex oldTree = TreeIndex.build(oldTerm, extractor, config.dimension());
        TreeIndex newTree = TreeIndex.build(newTerm, extractor, config.dimension());

        MatchResult result = matcher.match(oldTree, newTree);
        EditScript script = scriptBuilder.build(result.mapping());

        DiffReport report = new DiffReport(oldTree, newTree, result.mapping(), script, result.stats(), config);
        logger.debug("{}", report.getSummary());
        return report;
    }

    public DiffConfig getConfig() {
        return config;
    }
}
