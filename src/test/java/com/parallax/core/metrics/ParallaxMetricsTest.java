package com.parallax.core.metrics;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ParallaxMetricsTest {

    private SimpleMeterRegistry registry;
    private ParallaxMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ParallaxMetrics(registry);
    }

    @Test
    @DisplayName("recordJobResult counts jobs by status")
    void recordJobResult() {
        metrics.recordJobResult("COMPLETED");
        metrics.recordJobResult("COMPLETED");
        metrics.recordJobResult("CANCELLED");

        assertEquals(2.0, registry.find("parallax.jobs.total").tag("status", "COMPLETED").counter().count());
        assertEquals(1.0, registry.find("parallax.jobs.total").tag("status", "CANCELLED").counter().count());
    }

    @Test
    @DisplayName("recordJobDuration records by strategy tag")
    void recordJobDuration() {
        metrics.recordJobDuration("STATIC_POOL", 120);
        var timer = registry.find("parallax.job.duration").tag("strategy", "STATIC_POOL").timer();
        assertNotNull(timer);
        assertEquals(1, timer.count());
    }

    @Test
    @DisplayName("recordBatchExecution records duration and batch size")
    void recordBatchExecution() {
        metrics.recordBatchExecution("DYNAMIC_QUEUE", 4, 30);
        metrics.recordBatchExecution("DYNAMIC_QUEUE", 2, 10);

        assertEquals(2, registry.find("parallax.batch.duration").timer().count());
        var size = registry.find("parallax.batch.size").summary();
        assertNotNull(size);
        assertEquals(6.0, size.totalAmount());
    }

    @Test
    @DisplayName("recordBatching counts dispatches saved by merging")
    void recordBatching() {
        metrics.recordBatching(100, 8);
        metrics.recordBatching(5, 5);
        assertEquals(92.0, registry.find("parallax.overhead.dispatches_saved").counter().count());
    }

    @Test
    @DisplayName("queue and pool failure counters increment")
    void failureCounters() {
        metrics.recordTaskFailure();
        metrics.recordQueueRejection();
        metrics.recordPoolStartupFailure();
        metrics.recordBackPressure(15);

        assertEquals(1.0, registry.find("parallax.task.failures").counter().count());
        assertEquals(1.0, registry.find("parallax.queue.rejections").counter().count());
        assertEquals(1.0, registry.find("parallax.pool.startup_failures").counter().count());
        assertEquals(1, registry.find("parallax.queue.backpressure").timer().count());
    }
}
