package com.parallax.core.model;

import com.parallax.core.ParallaxException;

/**
 * Failure of a single task, recorded in its {@link Result}. Never propagated out of the scheduler.
 */
public class TaskException extends ParallaxException {

    private final int taskId;

    public TaskException(int taskId, Throwable cause) {
        super("Task " + taskId + " failed: " + describe(cause), cause);
        this.taskId = taskId;
    }

    public int getTaskId() {
        return taskId;
    }

    private static String describe(Throwable cause) {
        if (cause == null) return "unknown error";
        return cause.getMessage() != null ? cause.getMessage() : cause.getClass().getSimpleName();
    }
}
