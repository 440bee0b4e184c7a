package com.parallax.core.pool;

import com.parallax.core.model.Batch;

import java.util.List;

/**
 * Reported by a worker slot when it finishes a batch. {@code outcomes} is positionally aligned
 * with {@code batch.tasks()}.
 */
public record SlotCompletion<P, R>(
    int slot,
    Batch<P> batch,
    List<TaskOutcome<R>> outcomes,
    long elapsedMs
) implements CoordinatorMessage {

    public SlotCompletion {
        if (outcomes.size() != batch.size()) {
            throw new IllegalArgumentException("Batch " + batch.id() + " has " + batch.size()
                    + " tasks but " + outcomes.size() + " outcomes");
        }
        outcomes = List.copyOf(outcomes);
    }
}
