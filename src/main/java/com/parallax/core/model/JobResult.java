package com.parallax.core.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Final aggregate of a job. Entries are ordered by task id; an entry is absent when the task
 * never ran (cancelled or abandoned before start).
 */
public final class JobResult<R> {

    private final String jobId;
    private final JobStatus status;
    private final List<Result<R>> entries;

    public JobResult(String jobId, JobStatus status, List<Result<R>> entries) {
        this.jobId = Objects.requireNonNull(jobId, "jobId");
        this.status = Objects.requireNonNull(status, "status");
        this.entries = Collections.unmodifiableList(new ArrayList<>(entries));
        for (int i = 0; i < this.entries.size(); i++) {
            Result<R> r = this.entries.get(i);
            if (r != null && r.taskId() != i) {
                throw new IllegalArgumentException("Entry " + i + " holds result of task " + r.taskId());
            }
        }
    }

    public String jobId() {
        return jobId;
    }

    public JobStatus status() {
        return status;
    }

    /** Number of tasks submitted with the job. */
    public int taskCount() {
        return entries.size();
    }

    public Optional<Result<R>> result(int taskId) {
        if (taskId < 0 || taskId >= entries.size()) {
            throw new IndexOutOfBoundsException("No task " + taskId + " in job " + jobId);
        }
        return Optional.ofNullable(entries.get(taskId));
    }

    /** Results of every task that ran, in task id order. */
    public List<Result<R>> results() {
        return entries.stream().filter(Objects::nonNull).toList();
    }

    /** Success values in task id order; failed and never-run tasks are skipped. */
    public List<R> values() {
        var values = new ArrayList<R>();
        for (var r : entries) {
            if (r != null && r.isSuccess()) {
                values.add(r.value());
            }
        }
        return values;
    }

    public List<TaskException> failures() {
        return entries.stream()
                .filter(r -> r != null && !r.isSuccess())
                .map(Result::failure)
                .toList();
    }

    public int completed() {
        return (int) entries.stream().filter(Objects::nonNull).count();
    }

    public int succeeded() {
        return (int) entries.stream().filter(r -> r != null && r.isSuccess()).count();
    }

    public int failed() {
        return completed() - succeeded();
    }

    public int notRun() {
        return taskCount() - completed();
    }

    @Override
    public String toString() {
        return "JobResult[" + jobId + " " + status + ": " + succeeded() + " succeeded, "
                + failed() + " failed, " + notRun() + " not run]";
    }
}
