package com.parallax.core.aggregate;

import com.parallax.core.model.Batch;
import com.parallax.core.model.FailurePolicy;
import com.parallax.core.model.JobResult;
import com.parallax.core.model.JobStatus;
import com.parallax.core.model.Result;
import com.parallax.core.model.Task;
import com.parallax.core.model.TaskException;
import com.parallax.core.pool.SlotCompletion;
import com.parallax.core.pool.TaskOutcome;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Collects batch completions in whatever order they arrive, splits each into per-task results
 * using the batch's member list, and assembles the job result in task id order.
 * <p>
 * Owned by a single coordinator thread; not thread-safe.
 */
public class ResultAggregator<P, R> {

    private static final Logger log = LoggerFactory.getLogger(ResultAggregator.class);

    private final String jobId;
    private final FailurePolicy failurePolicy;
    private final List<Result<R>> results;
    private final Map<Integer, TaskCancelledException> neverStarted = new HashMap<>();
    private int completed;
    private int failures;
    private boolean tripped;

    public ResultAggregator(String jobId, int taskCount, FailurePolicy failurePolicy) {
        this.jobId = jobId;
        this.failurePolicy = failurePolicy;
        this.results = new ArrayList<>(Collections.nCopies(taskCount, null));
    }

    /**
     * Records the outcomes of one finished batch.
     *
     * @return the failures contained in this completion, in member order
     * @throws IllegalStateException if a task already has a result
     */
    public List<TaskException> accept(SlotCompletion<P, R> completion) {
        Batch<P> batch = completion.batch();
        List<TaskOutcome<R>> outcomes = completion.outcomes();
        var batchFailures = new ArrayList<TaskException>();

        for (int i = 0; i < batch.size(); i++) {
            Task<P> task = batch.tasks().get(i);
            TaskOutcome<R> outcome = outcomes.get(i);
            int id = task.id();
            if (results.get(id) != null) {
                throw new IllegalStateException("Job " + jobId + ": task " + id + " reported twice");
            }
            if (neverStarted.containsKey(id)) {
                throw new IllegalStateException("Job " + jobId + ": task " + id + " ran after being abandoned");
            }

            Result<R> result;
            if (outcome.isSuccess()) {
                result = Result.success(id, outcome.value(), completion.slot(), outcome.elapsedMs());
            } else {
                var failure = new TaskException(id, outcome.error());
                result = Result.failure(id, failure, completion.slot(), outcome.elapsedMs());
                batchFailures.add(failure);
                failures++;
                if (failurePolicy == FailurePolicy.FAIL_FAST && !tripped) {
                    tripped = true;
                    log.warn("Job {}: task {} failed, failing fast", jobId, id);
                }
            }
            results.set(id, result);
            completed++;
        }
        return batchFailures;
    }

    /** Records every member of a batch that will never be dispatched. */
    public void abandon(Batch<P> batch) {
        for (Task<P> task : batch.tasks()) {
            neverStarted.put(task.id(), new TaskCancelledException(task.id(), batch.id()));
        }
    }

    /** True once a failure has occurred under {@link FailurePolicy#FAIL_FAST}. */
    public boolean isTripped() {
        return tripped;
    }

    public boolean wasAbandoned(int taskId) {
        return neverStarted.containsKey(taskId);
    }

    public int completedCount() {
        return completed;
    }

    public int failureCount() {
        return failures;
    }

    /**
     * Builds the final job result.
     *
     * @param cancelled whether the job was cancelled by its caller
     */
    public JobResult<R> finish(boolean cancelled) {
        JobStatus status;
        if (cancelled) {
            status = JobStatus.CANCELLED;
        } else if (failures > 0 || completed < results.size()) {
            status = JobStatus.PARTIALLY_FAILED;
        } else {
            status = JobStatus.COMPLETED;
        }
        int missing = results.size() - completed - neverStarted.size();
        if (missing > 0) {
            log.warn("Job {}: {} task(s) neither ran nor were abandoned", jobId, missing);
        }
        log.info("Job {} finished {}: {} of {} task(s) ran, {} failed, {} abandoned",
                jobId, status, completed, results.size(), failures, neverStarted.size());
        return new JobResult<>(jobId, status, results);
    }
}
