package com.parallax.core.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.DistributionSummary;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.springframework.stereotype.Service;

import java.time.Duration;

/**
 * Centralised Micrometer metrics for job distribution.
 */
@Service
public class ParallaxMetrics {

    private final MeterRegistry registry;

    public ParallaxMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void recordJobResult(String status) {
        Counter.builder("parallax.jobs.total")
                .tag("status", status)
                .register(registry)
                .increment();
    }

    public void recordJobDuration(String strategy, long ms) {
        Timer.builder("parallax.job.duration")
                .tag("strategy", strategy)
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    /**
     * Records one batch run on a worker slot.
     *
     * @param strategy  distribution strategy of the owning job
     * @param taskCount number of tasks in the batch
     * @param ms        wall time the slot spent on the batch
     */
    public void recordBatchExecution(String strategy, int taskCount, long ms) {
        Timer.builder("parallax.batch.duration")
                .tag("strategy", strategy)
                .register(registry)
                .record(Duration.ofMillis(ms));

        DistributionSummary.builder("parallax.batch.size")
                .description("Tasks per dispatched batch")
                .register(registry)
                .record(taskCount);
    }

    public void recordTaskFailure() {
        Counter.builder("parallax.task.failures")
                .register(registry)
                .increment();
    }

    /**
     * Records how many dispatches the overhead guard saved for a job.
     *
     * @param taskCount  tasks submitted
     * @param batchCount dispatch units after merging
     */
    public void recordBatching(int taskCount, int batchCount) {
        Counter.builder("parallax.overhead.dispatches_saved")
                .description("Dispatches avoided by merging cheap tasks")
                .register(registry)
                .increment(taskCount - batchCount);
    }

    /**
     * Records time the submitting thread spent blocked on a full dispatch queue.
     */
    public void recordBackPressure(long ms) {
        Timer.builder("parallax.queue.backpressure")
                .description("Time submit() waited for queue capacity")
                .register(registry)
                .record(Duration.ofMillis(ms));
    }

    public void recordQueueRejection() {
        Counter.builder("parallax.queue.rejections")
                .description("Submissions that timed out waiting for queue capacity")
                .register(registry)
                .increment();
    }

    public void recordPoolStartupFailure() {
        Counter.builder("parallax.pool.startup_failures")
                .register(registry)
                .increment();
    }
}
