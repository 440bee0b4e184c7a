package com.parallax.core.model;

import java.util.List;

/**
 * One dispatch unit: one or more tasks merged so their dispatch overhead is paid once.
 * Member order is submission order; a batch always runs whole on a single worker slot.
 *
 * @param id    batch sequence number within the job
 * @param tasks member tasks, never empty
 */
public record Batch<P>(
    int id,
    List<Task<P>> tasks
) implements CostedUnit {

    public Batch {
        if (tasks == null || tasks.isEmpty()) {
            throw new IllegalArgumentException("Batch " + id + " must contain at least one task");
        }
        tasks = List.copyOf(tasks);
    }

    public static <P> Batch<P> singleton(int id, Task<P> task) {
        return new Batch<>(id, List.of(task));
    }

    public List<Integer> taskIds() {
        return tasks.stream().map(Task::id).toList();
    }

    public int size() {
        return tasks.size();
    }

    @Override
    public int submissionIndex() {
        return tasks.get(0).id();
    }

    /** Sum of member costs, or {@code null} if any member cost is unknown. */
    @Override
    public Double estimatedCost() {
        double total = 0;
        for (var task : tasks) {
            if (task.estimatedCost() == null) {
                return null;
            }
            total += task.estimatedCost();
        }
        return total;
    }
}
