package com.parallax.core.pool;

import com.parallax.core.ParallaxException;

/**
 * Thrown when the worker pool cannot spawn all of its execution contexts. The job never starts.
 */
public class PoolStartupException extends ParallaxException {

    private final int requestedSlots;
    private final int startedSlots;

    public PoolStartupException(String jobId, int requestedSlots, int startedSlots, Throwable cause) {
        super("Job " + jobId + ": failed to start worker pool (" + startedSlots + "/" + requestedSlots
                + " slots started)", cause);
        this.requestedSlots = requestedSlots;
        this.startedSlots = startedSlots;
    }

    public int getRequestedSlots() {
        return requestedSlots;
    }

    public int getStartedSlots() {
        return startedSlots;
    }
}
