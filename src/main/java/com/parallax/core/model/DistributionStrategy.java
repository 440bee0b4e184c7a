package com.parallax.core.model;

/**
 * How a job's dispatch units are handed to worker slots.
 * <p>
 * STATIC_POOL: units are partitioned once, up front, one group per slot (least coordination,
 * sensitive to imbalance).
 * DYNAMIC_QUEUE: units wait in a shared FIFO and an idle slot pulls the next one (small per-unit
 * coordination cost, near-optimal balance when costs are unknown).
 */
public enum DistributionStrategy {
    STATIC_POOL,
    DYNAMIC_QUEUE
}
