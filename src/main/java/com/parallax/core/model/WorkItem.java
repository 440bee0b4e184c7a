package com.parallax.core.model;

/**
 * A payload and optional cost supplied by the caller before the scheduler assigns a task id.
 */
public record WorkItem<P>(P payload, Double estimatedCost) {

    public static <P> WorkItem<P> of(P payload) {
        return new WorkItem<>(payload, null);
    }

    public static <P> WorkItem<P> of(P payload, double estimatedCost) {
        return new WorkItem<>(payload, estimatedCost);
    }
}
