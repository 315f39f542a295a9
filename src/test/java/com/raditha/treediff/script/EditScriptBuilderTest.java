package com.raditha.treediff.script;

import com.raditha.treediff.Fixtures;
import com.raditha.treediff.RandomTrees;
import com.raditha.treediff.config.DiffConfig;
import com.raditha.treediff.gram.PqGramExtractor;
import com.raditha.treediff.index.TreeIndex;
import com.raditha.treediff.index.TreeNode;
import com.raditha.treediff.matching.Mapping;
import com.raditha.treediff.matching.TreeMatcher;
import com.raditha.treediff.model.Category;
import com.raditha.treediff.model.Syntax;
import com.raditha.treediff.model.Term;
import net.jqwik.api.ForAll;
import net.jqwik.api.Property;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class EditScriptBuilderTest {

    private static final DiffConfig CONFIG = DiffConfig.moderate();
    private static final PqGramExtractor EXTRACTOR = new PqGramExtractor(CONFIG.p(), CONFIG.q());

    private final EditScriptBuilder builder = new EditScriptBuilder();

    private static Mapping match(Term oldTerm, Term newTerm) {
        TreeIndex oldTree = TreeIndex.build(oldTerm, EXTRACTOR, CONFIG.dimension());
        TreeIndex newTree = TreeIndex.build(newTerm, EXTRACTOR, CONFIG.dimension());
        return new TreeMatcher(CONFIG).match(oldTree, newTree).mapping();
    }

    @Test
    void testIdenticalTreesCopyEverything() {
        Term tree = RandomTrees.tree(7);
        EditScript script = builder.build(match(tree, tree));

        assertTrue(script.isEmptyChange());
        assertEquals(tree.size(), script.countOf(Edit.Copy.class));
        assertEquals(tree.size(), script.flatten().size());
        assertEquals(1, script.edits().size());
    }

    @Test
    void testRenamedOperandIsOneReplace() {
        EditScript script = builder.build(match(Fixtures.sum("a", "b"), Fixtures.sum("a", "c")));

        assertFalse(script.isEmptyChange());
        assertEquals(1, script.countOf(Edit.Replace.class));
        assertEquals(5, script.countOf(Edit.Copy.class));
        assertEquals(0, script.countOf(Edit.Insert.class));
        assertEquals(0, script.countOf(Edit.Delete.class));

        Edit.Copy program = (Edit.Copy) script.edits().get(0);
        Edit.Copy statement = (Edit.Copy) program.children().get(0);
        Edit.Copy operator = (Edit.Copy) statement.children().get(0);
        assertEquals(Category.MATH_OPERATOR, operator.newNode().category());
        assertFalse(operator.moved());

        List<Edit> operands = operator.children();
        assertInstanceOf(Edit.Copy.class, operands.get(0));
        assertInstanceOf(Edit.Copy.class, operands.get(1));
        Edit.Replace replace = (Edit.Replace) operands.get(2);
        assertEquals("b", replace.oldNode().term().syntax().payload());
        assertEquals("c", replace.newNode().term().syntax().payload());
    }

    @Test
    void testTotallyDifferentTrees() {
        Term oldTerm = Term.indexed(Category.CLASS, Term.leaf(Category.IDENTIFIER, "x"));
        Term newTerm = Term.indexed(Category.ARRAY, Term.leaf(Category.STRING_LITERAL, "x"));
        EditScript script = builder.build(match(oldTerm, newTerm));

        assertEquals(2, script.edits().size());
        Edit.Delete delete = (Edit.Delete) script.edits().get(0);
        Edit.Insert insert = (Edit.Insert) script.edits().get(1);
        assertEquals(2, delete.covered().size());
        assertEquals(2, insert.covered().size());
        assertTrue(insert.children().isEmpty());
    }

    @Test
    void testInsertedStatementSitsBetweenNeighbours() {
        EditScript script = builder.build(match(Fixtures.calls("f", "g"), Fixtures.calls("f", "x", "g")));

        Edit block = script.edits().get(0).children().get(0);
        assertEquals(3, block.children().size());
        assertInstanceOf(Edit.Copy.class, block.children().get(0));
        Edit.Insert insert = (Edit.Insert) block.children().get(1);
        assertEquals(3, insert.covered().size());
        assertInstanceOf(Edit.Copy.class, block.children().get(2));
    }

    @Test
    void testDeletedStatementComesBeforeNextSibling() {
        EditScript script = builder.build(match(Fixtures.calls("f", "x", "g"), Fixtures.calls("f", "g")));

        Edit block = script.edits().get(0).children().get(0);
        assertEquals(3, block.children().size());
        assertInstanceOf(Edit.Copy.class, block.children().get(0));
        Edit.Delete delete = (Edit.Delete) block.children().get(1);
        assertEquals(Category.EXPRESSION_STATEMENT, delete.oldNode().category());
        assertEquals(3, delete.covered().size());
        assertInstanceOf(Edit.Copy.class, block.children().get(2));
    }

    @Test
    void testWrappedStatementIsMovedInsideInsert() {
        Term statement = Fixtures.calls("f").children().get(0).children().get(0);
        Term oldTerm = Term.indexed(Category.PROGRAM, statement);
        Term newTerm = Term.indexed(Category.PROGRAM, Term.of(Category.IF,
                new Syntax.If(Term.leaf(Category.IDENTIFIER, "c"), List.of(statement))));

        EditScript script = builder.build(match(oldTerm, newTerm));

        Edit.Copy program = (Edit.Copy) script.edits().get(0);
        Edit.Insert wrapper = (Edit.Insert) program.children().get(0);
        assertEquals(Category.IF, wrapper.newNode().category());
        assertEquals(2, wrapper.covered().size());
        Edit.Copy moved = (Edit.Copy) wrapper.children().get(0);
        assertTrue(moved.moved());
        assertEquals(Category.EXPRESSION_STATEMENT, moved.newNode().category());
    }

    @Test
    void testReorderedSiblingIsMoved() {
        EditScript script = builder.build(match(Fixtures.calls("f", "g", "h"), Fixtures.calls("g", "h", "f")));

        assertFalse(script.isEmptyChange());
        assertEquals(0, script.countOf(Edit.Insert.class));
        assertEquals(0, script.countOf(Edit.Delete.class));

        Edit block = script.edits().get(0).children().get(0);
        assertEquals(3, block.children().size());
        assertFalse(((Edit.Copy) block.children().get(0)).moved(), "g kept its place");
        assertFalse(((Edit.Copy) block.children().get(1)).moved(), "h kept its place");
        Edit.Copy f = (Edit.Copy) block.children().get(2);
        assertTrue(f.moved());
        assertEquals(0, f.oldNode().childIndex());

        long moved = script.flatten().stream().filter(e -> e instanceof Edit.Copy c && c.moved()).count();
        assertEquals(1, moved);
    }

    @Test
    void testUnchangedOrderIsNotMoved() {
        EditScript script = builder.build(match(Fixtures.calls("f", "g", "h"), Fixtures.calls("f", "h")));

        Edit block = script.edits().get(0).children().get(0);
        for (Edit edit : block.children()) {
            if (edit instanceof Edit.Copy copy) {
                assertFalse(copy.moved());
            }
        }
    }

    @Test
    void testDeeplyNestedTree() {
        Term chain = Term.leaf(Category.IDENTIFIER, "x");
        for (int i = 0; i < 20_000; i++) {
            chain = Term.indexed(Category.BLOCK, chain);
        }
        EditScript script = builder.build(match(chain, chain));

        assertTrue(script.isEmptyChange());
        assertEquals(20_001, script.countOf(Edit.Copy.class));
        assertEquals(20_001, script.flatten().size());
    }

    @Property(tries = 100)
    void everyNodeCoveredExactlyOnce(@ForAll long oldSeed, @ForAll long newSeed, @ForAll boolean mutateOnly) {
        Term oldTerm = RandomTrees.tree(oldSeed);
        Term newTerm = mutateOnly ? RandomTrees.mutate(oldTerm, newSeed) : RandomTrees.tree(newSeed);
        Mapping mapping = match(oldTerm, newTerm);
        EditScript script = builder.build(mapping);

        assertCoveredOnce(mapping.oldTree().nodes(), script.oldCoverage());
        assertCoveredOnce(mapping.newTree().nodes(), script.newCoverage());
    }

    private static void assertCoveredOnce(List<TreeNode> nodes, Map<TreeNode, Integer> coverage) {
        assertEquals(nodes.size(), coverage.size());
        for (TreeNode node : nodes) {
            assertEquals(1, coverage.getOrDefault(node, 0), "Coverage of " + node);
        }
    }
}
