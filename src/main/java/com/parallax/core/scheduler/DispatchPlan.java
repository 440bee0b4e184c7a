package com.parallax.core.scheduler;

import com.parallax.core.balancer.LoadBalancer;
import com.parallax.core.model.Batch;
import com.parallax.core.model.DistributionStrategy;
import com.parallax.core.model.Task;

import java.util.List;

/**
 * Result of planning a job: its tasks, the dispatch units in dispatch order and, for
 * {@link DistributionStrategy#STATIC_POOL}, the fixed assignment of units to slots.
 *
 * @param tasks      tasks in submission order
 * @param units      batches after overhead merging and balancing, in dispatch order
 * @param slotGroups one group per slot for a static pool; empty for a dynamic queue
 * @param poolSize   number of worker slots the plan was made for
 * @param strategy   distribution strategy the plan was made for
 */
public record DispatchPlan<P>(
    List<Task<P>> tasks,
    List<Batch<P>> units,
    List<List<Batch<P>>> slotGroups,
    int poolSize,
    DistributionStrategy strategy
) {

    public DispatchPlan {
        tasks = List.copyOf(tasks);
        units = List.copyOf(units);
        slotGroups = slotGroups.stream().map(List::copyOf).toList();
    }

    /** Estimated load per slot of a static plan, unknown costs counted as one. */
    public List<Double> slotLoads() {
        return slotGroups.stream().map(LoadBalancer::loadOf).toList();
    }

    /** Task ids each slot will run under a static plan, in execution order. */
    public List<List<Integer>> slotTaskIds() {
        return slotGroups.stream()
                .map(group -> group.stream().flatMap(b -> b.taskIds().stream()).toList())
                .toList();
    }
}
