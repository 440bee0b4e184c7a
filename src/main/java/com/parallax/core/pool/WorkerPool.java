package com.parallax.core.pool;

import com.parallax.core.model.Batch;
import com.parallax.core.model.TaskHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ThreadFactory;

/**
 * A fixed set of worker slots, each backed by one long-lived platform thread.
 * <p>
 * A slot runs at most one batch at a time. Batches go in through {@link #dispatch}; completions
 * come back asynchronously as {@link SlotCompletion} messages on the channel given at start-up,
 * which must be unbounded. The pool is owned by exactly one job and is not reused.
 */
public final class WorkerPool<P, R> implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(WorkerPool.class);

    private final String jobId;
    private final List<WorkerSlot<P, R>> slots;
    private final List<Thread> threads;
    private volatile boolean closed;

    private WorkerPool(String jobId, List<WorkerSlot<P, R>> slots, List<Thread> threads) {
        this.jobId = jobId;
        this.slots = slots;
        this.threads = threads;
    }

    /**
     * Spawns {@code min(requested, hardwareParallelism)} worker threads (at least one).
     *
     * @throws PoolStartupException if any thread cannot be created or started; threads already
     *                              started are stopped before the exception is thrown
     */
    public static <P, R> WorkerPool<P, R> start(String jobId, int requested, int hardwareParallelism,
                                                ThreadFactory threadFactory, TaskHandler<P, R> handler,
                                                BlockingQueue<CoordinatorMessage> channel) {
        int size = effectiveSize(requested, hardwareParallelism);
        var slots = new ArrayList<WorkerSlot<P, R>>(size);
        var threads = new ArrayList<Thread>(size);
        var pool = new WorkerPool<>(jobId, slots, threads);

        for (int i = 0; i < size; i++) {
            var slot = new WorkerSlot<>(jobId, i, handler, channel);
            try {
                Thread thread = threadFactory.newThread(slot);
                if (thread == null) {
                    throw new IllegalStateException("Thread factory refused to create worker " + i);
                }
                thread.start();
                slots.add(slot);
                threads.add(thread);
            } catch (RuntimeException | OutOfMemoryError e) {
                log.error("Job {}: could not start worker slot {} of {}: {}", jobId, i, size, e.toString());
                pool.shutdownNow();
                throw new PoolStartupException(jobId, size, i, e);
            }
        }
        log.info("Job {}: started worker pool with {} slot(s) (requested {}, hardware {})",
                jobId, size, requested, hardwareParallelism);
        return pool;
    }

    /** Number of slots a pool started with these arguments will have. */
    public static int effectiveSize(int requested, int hardwareParallelism) {
        return Math.max(1, Math.min(requested, hardwareParallelism));
    }

    public int size() {
        return slots.size();
    }

    public boolean isBusy(int slot) {
        return slots.get(slot).isBusy();
    }

    /** Number of slots currently running a batch. */
    public int activeCount() {
        int active = 0;
        for (var slot : slots) {
            if (slot.isBusy()) active++;
        }
        return active;
    }

    /**
     * Sends a batch to an idle slot.
     *
     * @throws IllegalStateException if the slot is still running its previous batch or the pool is closed
     */
    public void dispatch(int slot, Batch<P> batch) {
        if (closed) {
            throw new IllegalStateException("Worker pool of job " + jobId + " is closed");
        }
        slots.get(slot).assign(batch);
        log.debug("Job {}: dispatched batch {} ({} task(s)) to slot {}", jobId, batch.id(), batch.size(), slot);
    }

    /**
     * Stops accepting work and waits up to {@code timeout} for every slot to finish its in-flight
     * batch and exit.
     *
     * @return true if all worker threads exited within the timeout
     */
    public boolean shutdown(Duration timeout) {
        closed = true;
        for (var slot : slots) {
            slot.terminate(false);
        }
        long deadline = System.nanoTime() + timeout.toNanos();
        for (Thread thread : threads) {
            long remainingMs = Math.max(1, (deadline - System.nanoTime()) / 1_000_000);
            try {
                thread.join(remainingMs);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return false;
            }
            if (thread.isAlive()) {
                log.warn("Job {}: worker {} still running after shutdown timeout", jobId, thread.getName());
                return false;
            }
        }
        log.debug("Job {}: worker pool drained", jobId);
        return true;
    }

    /**
     * Stops accepting work without waiting. Batches already executing run to completion on their
     * daemon threads, but their completions are no longer awaited.
     */
    public void shutdownNow() {
        closed = true;
        for (var slot : slots) {
            slot.terminate(true);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    @Override
    public void close() {
        shutdownNow();
    }
}
