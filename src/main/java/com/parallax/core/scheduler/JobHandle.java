package com.parallax.core.scheduler;

import com.parallax.core.model.JobResult;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Caller-side handle of a submitted job.
 */
public final class JobHandle<R> {

    private final JobCoordinator<?, R> coordinator;

    JobHandle(JobCoordinator<?, R> coordinator) {
        this.coordinator = coordinator;
    }

    public String jobId() {
        return coordinator.jobId();
    }

    /** Number of worker slots the job actually runs on. */
    public int poolSize() {
        return coordinator.poolSize();
    }

    /**
     * Blocks until the job reaches a terminal state.
     *
     * @throws IllegalStateException wrapping an internal coordinator failure
     */
    public JobResult<R> await() {
        try {
            return coordinator.future().join();
        } catch (CompletionException e) {
            throw unwrap(e.getCause());
        }
    }

    /**
     * Waits at most {@code timeout} for the job to finish.
     *
     * @return the result, or empty if the job is still running when the timeout expires
     */
    public Optional<JobResult<R>> await(Duration timeout) {
        try {
            return Optional.of(coordinator.future().get(timeout.toNanos(), TimeUnit.NANOSECONDS));
        } catch (TimeoutException e) {
            return Optional.empty();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return Optional.empty();
        } catch (ExecutionException e) {
            throw unwrap(e.getCause());
        }
    }

    /**
     * Stops dispatching new work. Batches already running finish and keep their results.
     * Idempotent; does nothing once the job is done.
     */
    public void cancel() {
        coordinator.cancel();
    }

    public boolean isDone() {
        return coordinator.future().isDone();
    }

    private static RuntimeException unwrap(Throwable cause) {
        if (cause instanceof RuntimeException re) {
            return re;
        }
        return new IllegalStateException("Job coordinator failed", cause);
    }
}
