package com.raditha.treediff.analyzer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

/**
 * Compares independent tree pairs in parallel under an overall deadline.
 * <p>
 * Each job runs start to finish on one worker; jobs share nothing but the
 * differ, which is stateless. A job that has not finished when the deadline
 * passes is abandoned and its partial work discarded.
 */
public class BatchDiffer {

    private static final Logger logger = LoggerFactory.getLogger(BatchDiffer.class);

    private final TreeDiffer differ;
    private final int threads;

    /**
     * @param differ  differ shared by all workers
     * @param threads worker count, at least 1
     */
    public BatchDiffer(TreeDiffer differ, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("threads must be >= 1");
        }
        this.differ = differ;
        this.threads = threads;
    }

    /**
     * Run all jobs.
     *
     * @param jobs     tree pairs to compare
     * @param deadline time allowed for the whole batch
     * @return one result per job, in job order
     * @throws InterruptedException if the calling thread is interrupted while waiting
     */
    public List<BatchResult> diffAll(List<DiffJob> jobs, Duration deadline) throws InterruptedException {
        if (jobs.isEmpty()) {
            return List.of();
        }
        List<Callable<DiffReport>> tasks = new ArrayList<>(jobs.size());
        for (DiffJob job : jobs) {
            tasks.add(() -> differ.diff(job.oldTree().call(), job.newTree().call()));
        }

        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, jobs.size()));
        try {
            List<Future<DiffReport>> futures = executor.invokeAll(tasks, deadline.toMillis(), TimeUnit.MILLISECONDS);
            List<BatchResult> results = new ArrayList<>(jobs.size());
            for (int i = 0; i < jobs.size(); i++) {
                results.add(collect(jobs.get(i).name(), futures.get(i)));
            }
            return results;
        } finally {
            executor.shutdownNow();
        }
    }

    private static BatchResult collect(String name, Future<DiffReport> future) throws InterruptedException {
        if (future.isCancelled()) {
            logger.warn("Abandoned comparison of {}: deadline exceeded", name);
            return BatchResult.abandoned(name);
        }
        try {
            return BatchResult.completed(name, future.get());
        } catch (CancellationException e) {
            logger.warn("Abandoned comparison of {}: deadline exceeded", name);
            return BatchResult.abandoned(name);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            logger.warn("Comparison of {} failed: {}", name, cause.getMessage());
            return BatchResult.failed(name, String.valueOf(cause.getMessage()));
        }
    }
}
