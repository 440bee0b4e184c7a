package com.parallax.core.model;

/**
 * Anything the load balancer can order or partition: a single task or a batch of tasks.
 */
public interface CostedUnit {

    /** Submission index used for stable ordering. */
    int submissionIndex();

    /** Relative estimated cost, or {@code null} when unknown. */
    Double estimatedCost();

    default boolean hasEstimatedCost() {
        return estimatedCost() != null;
    }
}
