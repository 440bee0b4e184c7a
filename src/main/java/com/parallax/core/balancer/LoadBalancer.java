package com.parallax.core.balancer;

import com.parallax.core.model.BalancerPolicy;
import com.parallax.core.model.CostedUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Random;

/**
 * Orders and partitions dispatch units. Stateless and deterministic for a given policy and seed;
 * works the same on single tasks and on batches.
 */
@Component
public class LoadBalancer {

    private static final Logger log = LoggerFactory.getLogger(LoadBalancer.class);

    /** Load attributed to a unit whose cost is unknown. */
    static final double UNKNOWN_COST_WEIGHT = 1.0;

    private static final Comparator<CostedUnit> BY_COST_DESCENDING = Comparator
            .comparing((CostedUnit u) -> !u.hasEstimatedCost())
            .thenComparingDouble(u -> u.hasEstimatedCost() ? -u.estimatedCost() : 0.0)
            .thenComparingInt(CostedUnit::submissionIndex);

    /**
     * Returns a new list with the units reordered according to {@code policy}.
     * <p>
     * {@link BalancerPolicy#SORT_DESCENDING_BY_COST} puts the most expensive unit first; ties keep
     * submission order and units of unknown cost go last, in submission order.
     *
     * @param seed only used by {@link BalancerPolicy#RANDOMIZE}
     */
    public <U extends CostedUnit> List<U> order(List<U> units, BalancerPolicy policy, long seed) {
        var ordered = new ArrayList<>(units);
        switch (policy) {
            case NONE -> { }
            case RANDOMIZE -> Collections.shuffle(ordered, new Random(seed));
            case SORT_DESCENDING_BY_COST -> ordered.sort(BY_COST_DESCENDING);
        }
        log.debug("Ordered {} unit(s) with policy {}", ordered.size(), policy);
        return ordered;
    }

    /**
     * Splits already-ordered units into exactly {@code slots} groups, one per worker slot.
     * <p>
     * Under {@link BalancerPolicy#SORT_DESCENDING_BY_COST} each unit in turn goes to the slot with
     * the smallest load so far (longest-processing-time first; ties go to the lowest slot index).
     * Other policies cut the sequence into contiguous groups whose sizes differ by at most one.
     * Groups may be empty when there are fewer units than slots.
     */
    public <U extends CostedUnit> List<List<U>> partition(List<U> units, int slots, BalancerPolicy policy) {
        if (slots < 1) {
            throw new IllegalArgumentException("slots must be >= 1, got " + slots);
        }
        List<List<U>> groups = policy == BalancerPolicy.SORT_DESCENDING_BY_COST
                ? longestProcessingTimeFirst(units, slots)
                : contiguous(units, slots);
        if (log.isDebugEnabled()) {
            var loads = groups.stream().map(LoadBalancer::loadOf).toList();
            log.debug("Partitioned {} unit(s) over {} slot(s), loads {}", units.size(), slots, loads);
        }
        return groups;
    }

    /** Sum of estimated costs of a group, counting unknown costs as {@value #UNKNOWN_COST_WEIGHT}. */
    public static double loadOf(List<? extends CostedUnit> group) {
        double load = 0;
        for (var unit : group) {
            load += weight(unit);
        }
        return load;
    }

    static double weight(CostedUnit unit) {
        return unit.hasEstimatedCost() ? unit.estimatedCost() : UNKNOWN_COST_WEIGHT;
    }

    private static <U extends CostedUnit> List<List<U>> contiguous(List<U> units, int slots) {
        var groups = new ArrayList<List<U>>(slots);
        int base = units.size() / slots;
        int extra = units.size() % slots;
        int from = 0;
        for (int i = 0; i < slots; i++) {
            int to = from + base + (i < extra ? 1 : 0);
            groups.add(List.copyOf(units.subList(from, to)));
            from = to;
        }
        return groups;
    }

    private static <U extends CostedUnit> List<List<U>> longestProcessingTimeFirst(List<U> units, int slots) {
        var groups = new ArrayList<List<U>>(slots);
        var loads = new double[slots];
        for (int i = 0; i < slots; i++) {
            groups.add(new ArrayList<>());
        }
        for (U unit : units) {
            int target = 0;
            for (int i = 1; i < slots; i++) {
                if (loads[i] < loads[target]) target = i;
            }
            groups.get(target).add(unit);
            loads[target] += weight(unit);
        }
        return groups.stream().map(List::copyOf).toList();
    }
}
