package com.parallax.core.model;

/**
 * Computes the result of one task. Called on a worker thread; must not rely on state shared
 * with other tasks of the same job.
 */
@FunctionalInterface
public interface TaskHandler<P, R> {

    R execute(P payload) throws Exception;
}
