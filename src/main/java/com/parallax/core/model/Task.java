package com.parallax.core.model;

/**
 * An immutable, independently executable unit of work.
 *
 * @param id            submission index within the job, starting at 0
 * @param payload       opaque input handed to the job's {@link TaskHandler}
 * @param estimatedCost relative cost estimate; {@code null} when unknown
 */
public record Task<P>(
    int id,
    P payload,
    Double estimatedCost
) implements CostedUnit {

    public Task {
        if (id < 0) {
            throw new IllegalArgumentException("Task id must be >= 0, got " + id);
        }
        if (estimatedCost != null && (estimatedCost.isNaN() || estimatedCost < 0)) {
            throw new IllegalArgumentException("Task " + id + " has invalid estimated cost " + estimatedCost);
        }
    }

    @Override
    public int submissionIndex() {
        return id;
    }
}
