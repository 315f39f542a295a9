package com.raditha.treediff.analyzer;

import org.jspecify.annotations.Nullable;

/**
 * Outcome of one job of a batch.
 *
 * @param name   the job's name
 * @param status how the job ended
 * @param report the comparison, only present when completed
 * @param error  failure message, only present when failed
 */
public record BatchResult(String name, Status status, @Nullable DiffReport report, @Nullable String error) {

    public enum Status {
        COMPLETED,
        /** Missed the deadline; nothing of the comparison is kept. */
        ABANDONED,
        FAILED
    }

    static BatchResult completed(String name, DiffReport report) {
        return new BatchResult(name, Status.COMPLETED, report, null);
    }

    static BatchResult abandoned(String name) {
        return new BatchResult(name, Status.ABANDONED, null, null);
    }

    static BatchResult failed(String name, String error) {
        return new BatchResult(name, Status.FAILED, null, error);
    }

    public boolean isCompleted() {
        return status == Status.COMPLETED;
    }
}
