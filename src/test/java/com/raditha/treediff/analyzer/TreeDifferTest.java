package com.raditha.treediff.analyzer;

import com.raditha.treediff.Fixtures;
import com.raditha.treediff.config.DiffConfig;
import com.raditha.treediff.filter.CandidateFilter;
import com.raditha.treediff.model.Category;
import com.raditha.treediff.model.Term;
import com.raditha.treediff.script.Edit;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class TreeDifferTest {

    @Test
    void testUnchangedTreeHasNoChanges() {
        TreeDiffer differ = new TreeDiffer();
        DiffReport report = differ.diff(Fixtures.calls("f", "g"), Fixtures.calls("f", "g"));

        assertFalse(report.hasChanges());
        assertEquals(report.oldTree().size(), report.mapping().size());
        assertTrue(report.getSummary().startsWith("8/8 old and 8/8 new nodes mapped"));
        assertSame(differ.getConfig(), report.config());
    }

    @Test
    void testChangedOperandReported() {
        DiffReport report = new TreeDiffer().diff(Fixtures.sum("a", "b"), Fixtures.sum("a", "c"));

        assertTrue(report.hasChanges());
        assertEquals(1, report.script().countOf(Edit.Replace.class));
        assertTrue(report.getSummary().contains("1 replaced"));
        assertEquals(6, report.stats().totalPairs());
    }

    @Test
    void testGramSizesComeFromConfig() {
        DiffConfig config = DiffConfig.strict();
        DiffReport report = new TreeDiffer(config).diff(Fixtures.sum("a", "b"), Fixtures.sum("a", "b"));

        assertEquals(config.dimension(), report.oldTree().dimension());
        assertEquals(config.dimension(), report.newTree().dimension());
        assertFalse(report.hasChanges());
    }

    @Test
    void testCustomFilterIsHonoured() {
        CandidateFilter nothing = (a, b) -> false;
        DiffReport report = new TreeDiffer(DiffConfig.moderate(), nothing)
                .diff(Fixtures.sum("a", "b"), Fixtures.sum("a", "b"));

        assertTrue(report.mapping().isEmpty());
        assertEquals(1, report.script().countOf(Edit.Delete.class));
        assertEquals(1, report.script().countOf(Edit.Insert.class));
    }

    @Test
    void testRootCategoryChange() {
        Term oldTerm = Term.indexed(Category.CLASS, Term.leaf(Category.IDENTIFIER, "A"));
        Term newTerm = Term.indexed(Category.OBJECT, Term.leaf(Category.IDENTIFIER, "A"));
        DiffReport report = new TreeDiffer().diff(oldTerm, newTerm);

        assertTrue(report.hasChanges());
        assertEquals(1, report.script().countOf(Edit.Delete.class));
        assertEquals(1, report.script().countOf(Edit.Insert.class));
    }
}
