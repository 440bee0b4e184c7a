package com.parallax.core.scheduler;

import com.parallax.core.ParallaxException;
import com.parallax.core.model.JobResult;

import java.time.Duration;

/**
 * Thrown by {@code submit} when the dispatch queue stayed full for longer than the configured
 * submit timeout. The job has been cancelled; work that already ran is available through
 * {@link #getPartialResult()}. Submitting again later may succeed.
 */
public class QueueCapacityExceededException extends ParallaxException {

    private final int capacity;
    private final transient JobResult<?> partialResult;

    public QueueCapacityExceededException(String jobId, int capacity, Duration timeout, JobResult<?> partialResult) {
        super("Job " + jobId + ": dispatch queue (capacity " + capacity + ") stayed full for "
                + timeout.toMillis() + "ms");
        this.capacity = capacity;
        this.partialResult = partialResult;
    }

    public int getCapacity() {
        return capacity;
    }

    public JobResult<?> getPartialResult() {
        return partialResult;
    }
}
