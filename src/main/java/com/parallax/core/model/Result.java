package com.parallax.core.model;

/**
 * Outcome of one task that actually ran.
 *
 * @param taskId    submission index of the task
 * @param value     handler return value (null on failure, and may be null on success)
 * @param failure   failure descriptor, {@code null} on success
 * @param slot      index of the worker slot that ran the task
 * @param elapsedMs time spent in the handler
 */
public record Result<R>(
    int taskId,
    R value,
    TaskException failure,
    int slot,
    long elapsedMs
) {

    public static <R> Result<R> success(int taskId, R value, int slot, long elapsedMs) {
        return new Result<>(taskId, value, null, slot, elapsedMs);
    }

    public static <R> Result<R> failure(int taskId, TaskException failure, int slot, long elapsedMs) {
        return new Result<>(taskId, null, failure, slot, elapsedMs);
    }

    public boolean isSuccess() {
        return failure == null;
    }
}
