package com.parallax.core.events;

import java.io.Serializable;
import java.time.Instant;
import java.util.Map;
import java.util.Set;

/**
 * An event emitted during job execution, used for CLI watch mode and external observers.
 *
 * @param eventType event type (e.g. "job.submitted", "batch.dispatched", "task.failed")
 * @param jobId     the job this event belongs to
 * @param taskId    the task this event relates to (nullable for job- and batch-level events)
 * @param payload   arbitrary key-value data associated with the event
 * @param timestamp when the event occurred
 */
public record JobEvent(
    String eventType,
    String jobId,
    Integer taskId,
    Map<String, Object> payload,
    Instant timestamp
) implements Serializable {

    public static final String JOB_SUBMITTED = "job.submitted";
    public static final String BATCH_DISPATCHED = "batch.dispatched";
    public static final String BATCH_COMPLETED = "batch.completed";
    public static final String TASK_FAILED = "task.failed";
    public static final String JOB_CANCELLED = "job.cancelled";
    public static final String JOB_COMPLETED = "job.completed";

    /** Types after which a job publishes nothing more. */
    public static final Set<String> TERMINAL_TYPES = Set.of(JOB_COMPLETED, JOB_CANCELLED);

    public static JobEvent of(String eventType, String jobId, Map<String, Object> payload) {
        return new JobEvent(eventType, jobId, null, payload, Instant.now());
    }

    public boolean isTerminal() {
        return TERMINAL_TYPES.contains(eventType);
    }
}
