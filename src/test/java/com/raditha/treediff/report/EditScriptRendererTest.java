package com.raditha.treediff.report;

import com.raditha.treediff.Fixtures;
import com.raditha.treediff.analyzer.DiffReport;
import com.raditha.treediff.analyzer.TreeDiffer;
import com.raditha.treediff.model.Category;
import com.raditha.treediff.model.Term;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class EditScriptRendererTest {

    private final EditScriptRenderer renderer = new EditScriptRenderer();
    private final TreeDiffer differ = new TreeDiffer();

    @Test
    void testReplaceLine() {
        DiffReport report = differ.diff(Fixtures.sum("a", "b"), Fixtures.sum("a", "c"));
        String output = renderer.render(report);

        assertTrue(output.startsWith(report.getSummary()));
        assertTrue(output.contains("=  copy     PROGRAM:INDEXED L1"));
        assertTrue(output.contains("      ~  replace  IDENTIFIER:LEAF \"b\" L1 -> IDENTIFIER:LEAF \"c\" L1"));
        assertFalse(output.contains("+  insert"));
        assertTrue(output.contains("0 inserted"));
    }

    @Test
    void testInsertAndDeleteLines() {
        String inserted = renderer.render(differ.diff(Fixtures.calls("f"), Fixtures.calls("f", "g")));
        assertTrue(inserted.contains("+  insert   EXPRESSION_STATEMENT:INDEXED L1 (3 nodes)"));

        String deleted = renderer.render(differ.diff(Fixtures.calls("f", "g"), Fixtures.calls("f")));
        assertTrue(deleted.contains("-  delete   EXPRESSION_STATEMENT:INDEXED L1 (3 nodes)"));
    }

    @Test
    void testReorderedStatementRenderedAsMove() {
        DiffReport report = differ.diff(Fixtures.calls("f", "g", "h"), Fixtures.calls("g", "h", "f"));
        String output = renderer.render(report);

        assertTrue(report.hasChanges());
        assertTrue(output.contains("(1 moved)"));
        assertEquals(1, output.split(">  move", -1).length - 1);
        assertTrue(output.contains("    >  move     EXPRESSION_STATEMENT:INDEXED"));
    }

    @Test
    void testLongLeafTextTruncated() {
        String text = "x".repeat(60);
        Term tree = Term.indexed(Category.PROGRAM, Term.leaf(Category.STRING_LITERAL, text));
        String output = renderer.render(differ.diff(tree, tree));

        assertTrue(output.contains("\"" + "x".repeat(37) + "...\""));
        assertFalse(output.contains(text));
    }

    @Test
    void testRenderMapping() {
        DiffReport report = differ.diff(Fixtures.sum("a", "b"), Fixtures.sum("a", "c"));
        String[] lines = renderer.renderMapping(report.mapping()).split("\n");

        assertEquals(6, lines.length);
        assertEquals("PROGRAM:INDEXED L1  <->  PROGRAM:INDEXED L1", lines[0]);
        assertEquals("IDENTIFIER:LEAF \"b\" L1  <->  IDENTIFIER:LEAF \"c\" L1", lines[5]);
    }
}
