package com.parallax.core.aggregate;

import com.parallax.core.ParallaxException;

/**
 * Marks a task that was abandoned before it started, so it is not mistaken for a failure.
 * Never leaves the aggregator.
 */
final class TaskCancelledException extends ParallaxException {

    private final int taskId;

    TaskCancelledException(int taskId, int batchId) {
        super("Task " + taskId + " (batch " + batchId + ") cancelled before start");
        this.taskId = taskId;
    }

    int getTaskId() {
        return taskId;
    }
}
