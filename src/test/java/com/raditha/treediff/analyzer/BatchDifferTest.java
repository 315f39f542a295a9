package com.raditha.treediff.analyzer;

import com.raditha.treediff.Fixtures;
import com.raditha.treediff.model.Term;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.Callable;

import static org.junit.jupiter.api.Assertions.*;

class BatchDifferTest {

    private final BatchDiffer batch = new BatchDiffer(new TreeDiffer(), 2);

    private static DiffJob job(String name, Callable<Term> oldTree, Callable<Term> newTree) {
        return new DiffJob(name, oldTree, newTree);
    }

    @Test
    void testResultsKeepJobOrder() throws InterruptedException {
        List<BatchResult> results = batch.diffAll(List.of(
                job("same", () -> Fixtures.sum("a", "b"), () -> Fixtures.sum("a", "b")),
                job("changed", () -> Fixtures.sum("a", "b"), () -> Fixtures.sum("a", "c"))),
                Duration.ofSeconds(30));

        assertEquals(2, results.size());
        assertEquals("same", results.get(0).name());
        assertTrue(results.get(0).isCompleted());
        assertFalse(results.get(0).report().hasChanges());
        assertEquals("changed", results.get(1).name());
        assertTrue(results.get(1).report().hasChanges());
    }

    @Test
    void testFailingJobDoesNotSinkTheBatch() throws InterruptedException {
        List<BatchResult> results = batch.diffAll(List.of(
                job("broken", () -> {
                    throw new IllegalStateException("cannot read");
                }, () -> Fixtures.sum("a", "b")),
                job("ok", () -> Fixtures.sum("a", "b"), () -> Fixtures.sum("a", "b"))),
                Duration.ofSeconds(30));

        assertEquals(BatchResult.Status.FAILED, results.get(0).status());
        assertEquals("cannot read", results.get(0).error());
        assertNull(results.get(0).report());
        assertTrue(results.get(1).isCompleted());
    }

    @Test
    void testSlowJobIsAbandonedAtDeadline() throws InterruptedException {
        BatchDiffer single = new BatchDiffer(new TreeDiffer(), 1);
        List<BatchResult> results = single.diffAll(List.of(
                job("slow", () -> {
                    Thread.sleep(10_000);
                    return Fixtures.sum("a", "b");
                }, () -> Fixtures.sum("a", "b"))),
                Duration.ofMillis(200));

        assertEquals(1, results.size());
        assertEquals(BatchResult.Status.ABANDONED, results.get(0).status());
        assertNull(results.get(0).report());
        assertNull(results.get(0).error());
    }

    @Test
    void testEmptyBatch() throws InterruptedException {
        assertTrue(batch.diffAll(List.of(), Duration.ofSeconds(1)).isEmpty());
    }

    @Test
    void testThreadCountValidated() {
        assertThrows(IllegalArgumentException.class, () -> new BatchDiffer(new TreeDiffer(), 0));
    }
}
