package com.raditha.treediff.matching;

import com.raditha.treediff.Fixtures;
import com.raditha.treediff.gram.PqGramExtractor;
import com.raditha.treediff.index.TreeIndex;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class MappingTest {

    private TreeIndex oldTree;
    private TreeIndex newTree;
    private Mapping mapping;

    @BeforeEach
    void setUp() {
        PqGramExtractor extractor = new PqGramExtractor(2, 3);
        oldTree = TreeIndex.build(Fixtures.sum("a", "b"), extractor, 16);
        newTree = TreeIndex.build(Fixtures.sum("a", "c"), extractor, 16);
        mapping = new Mapping(oldTree, newTree);
    }

    @Test
    void testPutAndLookup() {
        assertTrue(mapping.isEmpty());
        mapping.put(oldTree.get(3), newTree.get(3));

        assertEquals(1, mapping.size());
        assertSame(newTree.get(3), mapping.newFor(oldTree.get(3)));
        assertSame(oldTree.get(3), mapping.oldFor(newTree.get(3)));
        assertTrue(mapping.contains(oldTree.get(3), newTree.get(3)));
        assertNull(mapping.newFor(oldTree.get(0)));
        assertFalse(mapping.isFree(oldTree.get(3), newTree.get(4)));
        assertTrue(mapping.isFree(oldTree.get(4), newTree.get(4)));
    }

    @Test
    void testPutTwiceFails() {
        mapping.put(oldTree.get(1), newTree.get(1));
        assertThrows(IllegalStateException.class, () -> mapping.put(oldTree.get(1), newTree.get(2)));
        assertThrows(IllegalStateException.class, () -> mapping.put(oldTree.get(2), newTree.get(1)));
        assertEquals(1, mapping.size());
    }

    @Test
    void testNodesFromWrongTreeRejected() {
        assertThrows(IllegalArgumentException.class, () -> mapping.put(newTree.get(0), oldTree.get(0)));
        assertThrows(IllegalArgumentException.class, () -> mapping.isOldMapped(newTree.get(0)));
    }

    @Test
    void testPairsInOldPreOrder() {
        mapping.put(oldTree.get(4), newTree.get(4));
        mapping.put(oldTree.get(0), newTree.get(0));
        assertEquals(2, mapping.pairs().size());
        assertSame(oldTree.get(0), mapping.pairs().get(0).oldNode());
        assertSame(oldTree.get(4), mapping.pairs().get(1).oldNode());
    }
}
