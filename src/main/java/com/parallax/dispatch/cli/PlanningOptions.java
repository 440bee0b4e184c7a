package com.parallax.dispatch.cli;

import com.parallax.core.model.BalancerPolicy;
import com.parallax.core.model.DistributionStrategy;
import com.parallax.core.model.FailurePolicy;
import com.parallax.core.model.JobConfig;
import com.parallax.core.model.WorkItem;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Workload and planning options shared by {@code run} and {@code plan}.
 * Options left unset fall back to the configured {@code parallax.scheduler.*} defaults.
 */
public class PlanningOptions {

    static final int DEFAULT_TASKS = 16;

    @Option(names = {"--tasks", "-n"},
            description = "Number of synthetic tasks (default: number of --costs, else " + DEFAULT_TASKS + ")")
    Integer tasks;

    @Option(names = {"--costs", "-c"}, split = ",",
            description = "Comma-separated task costs, repeated cyclically up to --tasks. Without it costs are unknown")
    List<Double> costs;

    @Option(names = {"--strategy", "-s"}, description = "STATIC_POOL or DYNAMIC_QUEUE")
    DistributionStrategy strategy;

    @Option(names = {"--policy"}, description = "NONE, RANDOMIZE or SORT_DESCENDING_BY_COST")
    BalancerPolicy policy;

    @Option(names = {"--seed"}, description = "Seed for the RANDOMIZE policy")
    Long seed;

    @Option(names = {"--failure-policy"}, description = "FAIL_FAST or COLLECT_ALL")
    FailurePolicy failurePolicy;

    @Option(names = {"--pool-size", "-p"}, description = "Requested worker slots (capped at available processors)")
    Integer poolSize;

    @Option(names = {"--dispatch-overhead"}, description = "Estimated cost of dispatching one unit")
    Double dispatchOverhead;

    @Option(names = {"--batching-factor"}, description = "Target batches per slot when merging cheap tasks")
    Double batchingFactor;

    /** Applies the options that were given on top of {@code defaults}. */
    JobConfig toJobConfig(JobConfig defaults) {
        var builder = defaults.toBuilder();
        if (poolSize != null) builder.poolSize(poolSize);
        if (strategy != null) builder.strategy(strategy);
        if (policy != null) builder.balancerPolicy(policy);
        if (seed != null) builder.seed(seed);
        if (failurePolicy != null) builder.failurePolicy(failurePolicy);
        if (dispatchOverhead != null) builder.dispatchOverhead(dispatchOverhead);
        if (batchingFactor != null) builder.batchingFactor(batchingFactor);
        return builder.build();
    }

    /** Builds the synthetic items; tasks whose index is in {@code failOn} throw. */
    List<WorkItem<SyntheticWorkload.Unit>> workItems(Set<Integer> failOn) {
        boolean hasCosts = costs != null && !costs.isEmpty();
        int count = tasks != null ? tasks : hasCosts ? costs.size() : DEFAULT_TASKS;
        if (count < 0) {
            throw new IllegalArgumentException("--tasks must be >= 0, got " + count);
        }
        var items = new ArrayList<WorkItem<SyntheticWorkload.Unit>>(count);
        for (int i = 0; i < count; i++) {
            boolean fail = failOn.contains(i);
            if (hasCosts) {
                double cost = costs.get(i % costs.size());
                items.add(WorkItem.of(new SyntheticWorkload.Unit(i, cost, fail), cost));
            } else {
                items.add(WorkItem.of(new SyntheticWorkload.Unit(i, 1.0, fail)));
            }
        }
        return items;
    }
}
