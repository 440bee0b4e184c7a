package com.parallax.core.model;

/**
 * Reordering rule applied to dispatch units before they are partitioned or enqueued.
 */
public enum BalancerPolicy {
    NONE,
    RANDOMIZE,
    SORT_DESCENDING_BY_COST
}
