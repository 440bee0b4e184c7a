package com.parallax.core.pool;

/**
 * Raw outcome of one batch member as observed by the worker, before it is matched back to a task id.
 *
 * @param value     handler return value
 * @param error     exception or error thrown by the handler, {@code null} on success
 * @param elapsedMs time spent in the handler
 */
public record TaskOutcome<R>(R value, Throwable error, long elapsedMs) {

    public static <R> TaskOutcome<R> success(R value, long elapsedMs) {
        return new TaskOutcome<>(value, null, elapsedMs);
    }

    public static <R> TaskOutcome<R> failure(Throwable error, long elapsedMs) {
        return new TaskOutcome<>(null, error, elapsedMs);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
