package com.parallax.core.scheduler;

import com.parallax.core.model.Batch;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * Each slot works through the group it was given up front; slots never take work from each other.
 */
final class StaticPoolStrategy<P> implements DispatchStrategy<P> {

    private final List<Deque<Batch<P>>> queues = new ArrayList<>();

    StaticPoolStrategy(List<List<Batch<P>>> slotGroups) {
        for (var group : slotGroups) {
            queues.add(new ArrayDeque<>(group));
        }
    }

    @Override
    public Batch<P> next(int slot) {
        return queues.get(slot).poll();
    }

    @Override
    public boolean exhausted() {
        for (var queue : queues) {
            if (!queue.isEmpty()) return false;
        }
        return true;
    }

    @Override
    public List<Batch<P>> undispatched() {
        var remaining = new ArrayList<Batch<P>>();
        for (var queue : queues) {
            remaining.addAll(queue);
        }
        return remaining;
    }
}
