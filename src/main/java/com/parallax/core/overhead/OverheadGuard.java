package com.parallax.core.overhead;

import com.parallax.core.model.Batch;
import com.parallax.core.model.JobConfig;
import com.parallax.core.model.Task;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Decides which tasks are too cheap to be worth a dispatch of their own and merges them into
 * batches.
 * <p>
 * A task is cheap when its estimated cost divided by the per-dispatch overhead falls below the
 * configured threshold. Contiguous cheap tasks are merged, in submission order, until a batch
 * reaches {@code totalEstimatedCost / (poolSize * batchingFactor)}. Tasks that are not cheap, or
 * whose cost is unknown, become singleton batches and close the batch being built.
 */
@Component
public class OverheadGuard {

    private static final Logger log = LoggerFactory.getLogger(OverheadGuard.class);

    public <P> List<Batch<P>> batch(List<Task<P>> tasks, int poolSize, JobConfig config) {
        return batch(tasks, poolSize, config.dispatchOverhead(), config.overheadThreshold(), config.batchingFactor());
    }

    public <P> List<Batch<P>> batch(List<Task<P>> tasks, int poolSize, double dispatchOverhead,
                                    double overheadThreshold, double batchingFactor) {
        if (poolSize < 1) {
            throw new IllegalArgumentException("poolSize must be >= 1, got " + poolSize);
        }
        double target = targetBatchCost(tasks, poolSize, batchingFactor);
        boolean merging = overheadThreshold > 0 && target > 0;

        var batches = new ArrayList<Batch<P>>();
        var run = new ArrayList<Task<P>>();
        double runCost = 0;

        for (Task<P> task : tasks) {
            if (merging && isCheap(task, dispatchOverhead, overheadThreshold)) {
                run.add(task);
                runCost += task.estimatedCost();
                if (runCost >= target) {
                    batches.add(new Batch<>(batches.size(), run));
                    run.clear();
                    runCost = 0;
                }
            } else {
                if (!run.isEmpty()) {
                    batches.add(new Batch<>(batches.size(), run));
                    run.clear();
                    runCost = 0;
                }
                batches.add(Batch.singleton(batches.size(), task));
            }
        }
        if (!run.isEmpty()) {
            batches.add(new Batch<>(batches.size(), run));
        }

        if (batches.size() < tasks.size()) {
            log.info("Merged {} task(s) into {} batch(es) (target batch cost {})",
                    tasks.size(), batches.size(), String.format("%.3f", target));
        } else {
            log.debug("No batching applied to {} task(s)", tasks.size());
        }
        return batches;
    }

    /** True when the task's cost is known and small relative to the dispatch overhead. */
    public static boolean isCheap(Task<?> task, double dispatchOverhead, double overheadThreshold) {
        if (!task.hasEstimatedCost()) {
            return false;
        }
        return task.estimatedCost() / dispatchOverhead < overheadThreshold;
    }

    static double targetBatchCost(List<? extends Task<?>> tasks, int poolSize, double batchingFactor) {
        double total = 0;
        for (var task : tasks) {
            if (task.hasEstimatedCost()) {
                total += task.estimatedCost();
            }
        }
        return total / (poolSize * batchingFactor);
    }
}
