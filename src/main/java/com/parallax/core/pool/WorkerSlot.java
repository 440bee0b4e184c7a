package com.parallax.core.pool;

import com.parallax.core.logging.MdcContext;
import com.parallax.core.model.Batch;
import com.parallax.core.model.Task;
import com.parallax.core.model.TaskHandler;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One parallel execution context of a {@link WorkerPool}. Receives batches through a single-item
 * inbox, runs every member task in order, and reports a {@link SlotCompletion} on the
 * coordinator channel.
 */
final class WorkerSlot<P, R> implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(WorkerSlot.class);

    @SuppressWarnings("rawtypes")
    private static final Batch POISON = Batch.singleton(-1, new Task<>(0, null, null));

    private final String jobId;
    private final int index;
    private final TaskHandler<P, R> handler;
    private final BlockingQueue<CoordinatorMessage> channel;
    private final BlockingQueue<Batch<P>> inbox = new LinkedBlockingQueue<>();
    private final AtomicBoolean busy = new AtomicBoolean(false);

    WorkerSlot(String jobId, int index, TaskHandler<P, R> handler, BlockingQueue<CoordinatorMessage> channel) {
        this.jobId = jobId;
        this.index = index;
        this.handler = handler;
        this.channel = channel;
    }

    int index() {
        return index;
    }

    boolean isBusy() {
        return busy.get();
    }

    /** Hands a batch to this slot; fails if the slot has not reported its previous batch yet. */
    void assign(Batch<P> batch) {
        if (!busy.compareAndSet(false, true)) {
            throw new IllegalStateException("Slot " + index + " of job " + jobId
                    + " is still running a batch; cannot dispatch batch " + batch.id());
        }
        inbox.offer(batch);
    }

    /** Asks the slot thread to exit once its inbox is empty, or at once if pending work is discarded. */
    @SuppressWarnings("unchecked")
    void terminate(boolean discardPending) {
        if (discardPending) {
            inbox.clear();
        }
        inbox.offer((Batch<P>) POISON);
    }

    @Override
    public void run() {
        MdcContext.setSlot(jobId, index);
        try {
            while (true) {
                Batch<P> batch = inbox.take();
                if (batch == POISON) {
                    break;
                }
                MdcContext.setBatch(jobId, index, batch.id());
                long start = System.nanoTime();
                List<TaskOutcome<R>> outcomes;
                try {
                    outcomes = execute(batch);
                } catch (Throwable t) {
                    log.error("Slot {} could not finish batch {}: {}", index, batch.id(), t.toString(), t);
                    outcomes = failAll(batch, t, elapsedSince(start));
                }
                long elapsedMs = TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - start);
                if (Thread.interrupted()) {
                    log.debug("Cleared interrupt left by a handler on slot {}", index);
                }
                busy.set(false);
                channel.offer(new SlotCompletion<>(index, batch, outcomes, elapsedMs));
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.debug("Worker slot {} of job {} interrupted while idle", index, jobId);
        } finally {
            MdcContext.clear();
        }
    }

    private List<TaskOutcome<R>> execute(Batch<P> batch) {
        var outcomes = new ArrayList<TaskOutcome<R>>(batch.size());
        for (Task<P> task : batch.tasks()) {
            long start = System.nanoTime();
            try {
                R value = handler.execute(task.payload());
                outcomes.add(TaskOutcome.success(value, elapsedSince(start)));
            } catch (Exception e) {
                log.warn("Task {} failed on slot {}: {}", task.id(), index, e.toString());
                outcomes.add(TaskOutcome.failure(e, elapsedSince(start)));
            } catch (Error e) {
                // recorded like any other failure so the batch still reports back
                log.error("Task {} raised {} on slot {}", task.id(), e.getClass().getName(), index, e);
                outcomes.add(TaskOutcome.failure(e, elapsedSince(start)));
            }
        }
        return outcomes;
    }

    private List<TaskOutcome<R>> failAll(Batch<P> batch, Throwable cause, long elapsedMs) {
        var outcomes = new ArrayList<TaskOutcome<R>>(batch.size());
        for (int i = 0; i < batch.size(); i++) {
            outcomes.add(TaskOutcome.failure(cause, elapsedMs));
        }
        return outcomes;
    }

    private static long elapsedSince(long startNanos) {
        return TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - startNanos);
    }
}
