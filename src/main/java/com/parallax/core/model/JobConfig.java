package com.parallax.core.model;

import java.time.Duration;

/**
 * Per-job distribution settings.
 *
 * @param poolSize          requested number of worker slots; capped at hardware parallelism
 * @param strategy          static partitioning or shared dynamic queue
 * @param balancerPolicy    ordering applied to dispatch units
 * @param seed              seed for {@link BalancerPolicy#RANDOMIZE}
 * @param failurePolicy     behaviour on the first task failure
 * @param dispatchOverhead  estimated cost of dispatching one unit, in task-cost units
 * @param overheadThreshold tasks with {@code cost / dispatchOverhead} below this are merged; 0 disables
 * @param batchingFactor    target batches per worker slot when merging
 * @param queueCapacity     bound of the shared queue (dynamic queue only)
 * @param submitTimeout     maximum time {@code submit} may block on a full queue; {@code null} waits forever
 */
public record JobConfig(
    int poolSize,
    DistributionStrategy strategy,
    BalancerPolicy balancerPolicy,
    long seed,
    FailurePolicy failurePolicy,
    double dispatchOverhead,
    double overheadThreshold,
    double batchingFactor,
    int queueCapacity,
    Duration submitTimeout
) {

    public static final double DEFAULT_DISPATCH_OVERHEAD = 1.0;
    public static final double DEFAULT_OVERHEAD_THRESHOLD = 1.0;
    /** Four batches per worker, the usual chunk-size heuristic for process pools. */
    public static final double DEFAULT_BATCHING_FACTOR = 4.0;
    public static final int DEFAULT_QUEUE_CAPACITY = 1024;

    public JobConfig {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be >= 1, got " + poolSize);
        }
        if (strategy == null || balancerPolicy == null || failurePolicy == null) {
            throw new IllegalArgumentException("strategy, balancerPolicy and failurePolicy are required");
        }
        if (!(dispatchOverhead > 0)) {
            throw new IllegalArgumentException("dispatchOverhead must be > 0, got " + dispatchOverhead);
        }
        if (overheadThreshold < 0 || Double.isNaN(overheadThreshold)) {
            throw new IllegalArgumentException("overheadThreshold must be >= 0, got " + overheadThreshold);
        }
        if (!(batchingFactor > 0)) {
            throw new IllegalArgumentException("batchingFactor must be > 0, got " + batchingFactor);
        }
        if (queueCapacity < 1) {
            throw new IllegalArgumentException("queueCapacity must be >= 1, got " + queueCapacity);
        }
        if (submitTimeout != null && submitTimeout.isNegative()) {
            throw new IllegalArgumentException("submitTimeout must not be negative");
        }
    }

    public static JobConfig defaults() {
        return builder().build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder()
                .poolSize(poolSize)
                .strategy(strategy)
                .balancerPolicy(balancerPolicy)
                .seed(seed)
                .failurePolicy(failurePolicy)
                .dispatchOverhead(dispatchOverhead)
                .overheadThreshold(overheadThreshold)
                .batchingFactor(batchingFactor)
                .queueCapacity(queueCapacity)
                .submitTimeout(submitTimeout);
    }

    public static final class Builder {
        private int poolSize = Runtime.getRuntime().availableProcessors();
        private DistributionStrategy strategy = DistributionStrategy.DYNAMIC_QUEUE;
        private BalancerPolicy balancerPolicy = BalancerPolicy.NONE;
        private long seed;
        private FailurePolicy failurePolicy = FailurePolicy.COLLECT_ALL;
        private double dispatchOverhead = DEFAULT_DISPATCH_OVERHEAD;
        private double overheadThreshold = DEFAULT_OVERHEAD_THRESHOLD;
        private double batchingFactor = DEFAULT_BATCHING_FACTOR;
        private int queueCapacity = DEFAULT_QUEUE_CAPACITY;
        private Duration submitTimeout;

        private Builder() {}

        public Builder poolSize(int poolSize) { this.poolSize = poolSize; return this; }
        public Builder strategy(DistributionStrategy strategy) { this.strategy = strategy; return this; }
        public Builder balancerPolicy(BalancerPolicy balancerPolicy) { this.balancerPolicy = balancerPolicy; return this; }
        public Builder seed(long seed) { this.seed = seed; return this; }
        public Builder failurePolicy(FailurePolicy failurePolicy) { this.failurePolicy = failurePolicy; return this; }
        public Builder dispatchOverhead(double dispatchOverhead) { this.dispatchOverhead = dispatchOverhead; return this; }
        public Builder overheadThreshold(double overheadThreshold) { this.overheadThreshold = overheadThreshold; return this; }
        public Builder batchingFactor(double batchingFactor) { this.batchingFactor = batchingFactor; return this; }
        public Builder queueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; return this; }
        public Builder submitTimeout(Duration submitTimeout) { this.submitTimeout = submitTimeout; return this; }

        /** Shorthand for {@code balancerPolicy(RANDOMIZE).seed(seed)}. */
        public Builder randomize(long seed) {
            this.balancerPolicy = BalancerPolicy.RANDOMIZE;
            this.seed = seed;
            return this;
        }

        public JobConfig build() {
            return new JobConfig(poolSize, strategy, balancerPolicy, seed, failurePolicy,
                    dispatchOverhead, overheadThreshold, batchingFactor, queueCapacity, submitTimeout);
        }
    }
}
