package com.parallax.core.scheduler;

import com.parallax.core.aggregate.ResultAggregator;
import com.parallax.core.events.EventBus;
import com.parallax.core.events.JobEvent;
import com.parallax.core.logging.MdcContext;
import com.parallax.core.metrics.ParallaxMetrics;
import com.parallax.core.model.Batch;
import com.parallax.core.model.JobConfig;
import com.parallax.core.model.JobResult;
import com.parallax.core.model.TaskException;
import com.parallax.core.pool.CoordinatorMessage;
import com.parallax.core.pool.SlotCompletion;
import com.parallax.core.pool.WorkerPool;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;

/**
 * Drives one job on its own thread: hands batches to idle slots, feeds completions to the
 * aggregator, and stops dispatching on cancellation or a fail-fast failure. All coordination
 * with the workers and the submitting thread goes through the mailbox.
 */
final class JobCoordinator<P, R> implements Runnable {

    private static final Logger log = LoggerFactory.getLogger(JobCoordinator.class);

    private final String jobId;
    private final JobConfig config;
    private final WorkerPool<P, R> pool;
    private final DispatchStrategy<P> strategy;
    private final ResultAggregator<P, R> aggregator;
    private final BlockingQueue<CoordinatorMessage> mailbox;
    private final EventBus eventBus;
    private final ParallaxMetrics metrics;
    private final Duration shutdownTimeout;
    private final Runnable onFinished;
    private final CompletableFuture<JobResult<R>> future = new CompletableFuture<>();

    private final boolean[] busy;
    private int inFlight;
    private volatile boolean cancelRequested;
    private volatile boolean stopping;

    JobCoordinator(String jobId, JobConfig config, WorkerPool<P, R> pool, DispatchStrategy<P> strategy,
                   ResultAggregator<P, R> aggregator, BlockingQueue<CoordinatorMessage> mailbox,
                   EventBus eventBus, ParallaxMetrics metrics, Duration shutdownTimeout, Runnable onFinished) {
        this.jobId = jobId;
        this.config = config;
        this.pool = pool;
        this.strategy = strategy;
        this.aggregator = aggregator;
        this.mailbox = mailbox;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.shutdownTimeout = shutdownTimeout;
        this.onFinished = onFinished;
        this.busy = new boolean[pool.size()];
    }

    String jobId() {
        return jobId;
    }

    int poolSize() {
        return pool.size();
    }

    CompletableFuture<JobResult<R>> future() {
        return future;
    }

    /** True once the coordinator will dispatch nothing more. */
    boolean isStopping() {
        return stopping || future.isDone();
    }

    void cancel() {
        if (future.isDone() || cancelRequested) {
            return;
        }
        cancelRequested = true;
        mailbox.offer(ControlSignal.CANCEL);
        log.info("Job {}: cancellation requested", jobId);
    }

    void signal(ControlSignal signal) {
        mailbox.offer(signal);
    }

    @Override
    public void run() {
        MdcContext.setJob(jobId);
        long startMs = System.currentTimeMillis();
        try {
            boolean cancelled = coordinate();
            finish(startMs, cancelled);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Job {}: coordinator interrupted, abandoning in-flight work", jobId);
            stopping = true;
            pool.shutdownNow();
            abandonUndispatched();
            future.complete(aggregator.finish(true));
        } catch (RuntimeException e) {
            log.error("Job {}: coordinator failed: {}", jobId, e.getMessage(), e);
            stopping = true;
            pool.shutdownNow();
            future.completeExceptionally(e);
        } finally {
            onFinished.run();
            MdcContext.clear();
        }
    }

    /** Runs the dispatch loop; returns whether the caller had cancelled by the time it ended. */
    private boolean coordinate() throws InterruptedException {
        while (true) {
            if (cancelRequested) {
                stopping = true;
            }
            if (!stopping) {
                dispatchToIdleSlots();
            }
            if (inFlight == 0 && (stopping || strategy.exhausted())) {
                break;
            }
            CoordinatorMessage message = mailbox.take();
            if (message instanceof SlotCompletion<?, ?> completion) {
                @SuppressWarnings("unchecked")
                var typed = (SlotCompletion<P, R>) completion;
                onCompletion(typed);
            } else if (message == ControlSignal.CANCEL) {
                if (!stopping) {
                    log.info("Job {}: stopping dispatch, {} batch(es) in flight", jobId, inFlight);
                }
                stopping = true;
            }
        }
        stopping = true;
        boolean cancelled = cancelRequested;
        abandonUndispatched();
        if (!pool.shutdown(shutdownTimeout)) {
            log.warn("Job {}: worker pool did not drain within {}", jobId, shutdownTimeout);
        }
        return cancelled;
    }

    private void dispatchToIdleSlots() {
        for (int slot = 0; slot < busy.length; slot++) {
            if (busy[slot]) {
                continue;
            }
            Batch<P> batch = strategy.next(slot);
            if (batch == null) {
                continue;
            }
            pool.dispatch(slot, batch);
            busy[slot] = true;
            inFlight++;
            eventBus.publish(JobEvent.of(JobEvent.BATCH_DISPATCHED, jobId,
                    Map.of("batchId", batch.id(), "slot", slot, "taskIds", batch.taskIds())));
        }
    }

    private void onCompletion(SlotCompletion<P, R> completion) {
        busy[completion.slot()] = false;
        inFlight--;

        var failures = aggregator.accept(completion);
        if (metrics != null) {
            metrics.recordBatchExecution(config.strategy().name(), completion.batch().size(), completion.elapsedMs());
        }
        eventBus.publish(JobEvent.of(JobEvent.BATCH_COMPLETED, jobId,
                Map.of("batchId", completion.batch().id(), "slot", completion.slot(),
                       "failures", failures.size(), "elapsedMs", completion.elapsedMs())));
        for (TaskException failure : failures) {
            if (metrics != null) {
                metrics.recordTaskFailure();
            }
            eventBus.publish(new JobEvent(JobEvent.TASK_FAILED, jobId, failure.getTaskId(),
                    Map.of("error", String.valueOf(failure.getMessage())), Instant.now()));
        }
        if (aggregator.isTripped() && !stopping) {
            log.info("Job {}: fail-fast triggered, {} batch(es) still in flight", jobId, inFlight);
            stopping = true;
        }
    }

    private void abandonUndispatched() {
        var remaining = strategy.undispatched();
        for (Batch<P> batch : remaining) {
            aggregator.abandon(batch);
        }
        if (!remaining.isEmpty()) {
            log.info("Job {}: {} batch(es) abandoned before dispatch", jobId, remaining.size());
        }
    }

    private void finish(long startMs, boolean cancelled) {
        JobResult<R> result = aggregator.finish(cancelled);
        long elapsedMs = System.currentTimeMillis() - startMs;
        if (metrics != null) {
            metrics.recordJobResult(result.status().name());
            metrics.recordJobDuration(config.strategy().name(), elapsedMs);
        }
        String eventType = cancelled ? JobEvent.JOB_CANCELLED : JobEvent.JOB_COMPLETED;
        eventBus.publish(JobEvent.of(eventType, jobId,
                Map.of("status", result.status().name(),
                       "succeeded", result.succeeded(),
                       "failed", result.failed(),
                       "notRun", result.notRun(),
                       "elapsedMs", elapsedMs)));
        future.complete(result);
    }
}
