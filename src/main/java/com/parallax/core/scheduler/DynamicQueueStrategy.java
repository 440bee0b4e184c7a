package com.parallax.core.scheduler;

import com.parallax.core.model.Batch;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.TimeUnit;

/**
 * A single bounded FIFO shared by all slots. The submitting thread offers planned batches; the
 * coordinator hands the head of the queue to whichever slot becomes idle first.
 */
final class DynamicQueueStrategy<P> implements DispatchStrategy<P> {

    private final List<Batch<P>> planned;
    private final BlockingQueue<Batch<P>> queue;
    private final Set<Integer> dispatchedIds = new HashSet<>();

    DynamicQueueStrategy(List<Batch<P>> planned, int capacity) {
        this.planned = List.copyOf(planned);
        this.queue = new ArrayBlockingQueue<>(capacity);
    }

    List<Batch<P>> planned() {
        return planned;
    }

    int capacity() {
        return queue.size() + queue.remainingCapacity();
    }

    /** Called by the submitting thread; waits up to {@code timeout} for free capacity. */
    boolean offer(Batch<P> batch, long timeout, TimeUnit unit) throws InterruptedException {
        return queue.offer(batch, timeout, unit);
    }

    @Override
    public Batch<P> next(int slot) {
        Batch<P> batch = queue.poll();
        if (batch != null) {
            dispatchedIds.add(batch.id());
        }
        return batch;
    }

    @Override
    public boolean exhausted() {
        return dispatchedIds.size() == planned.size();
    }

    @Override
    public List<Batch<P>> undispatched() {
        var remaining = new ArrayList<Batch<P>>();
        for (var batch : planned) {
            if (!dispatchedIds.contains(batch.id())) {
                remaining.add(batch);
            }
        }
        return remaining;
    }
}
