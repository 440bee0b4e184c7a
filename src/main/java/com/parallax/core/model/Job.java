package com.parallax.core.model;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A configured collection of work items submitted together. The item source is iterated exactly
 * once, at submission; task ids follow iteration order.
 */
public final class Job<P, R> {

    private final String name;
    private final Iterable<WorkItem<P>> items;
    private final TaskHandler<P, R> handler;
    private final JobConfig config;

    private Job(String name, Iterable<WorkItem<P>> items, TaskHandler<P, R> handler, JobConfig config) {
        this.name = name;
        this.items = Objects.requireNonNull(items, "items");
        this.handler = Objects.requireNonNull(handler, "handler");
        this.config = Objects.requireNonNull(config, "config");
    }

    public static <P, R> Builder<P, R> builder(TaskHandler<P, R> handler) {
        return new Builder<>(handler);
    }

    /** Optional human-readable label, used in logs only. */
    public String name() {
        return name;
    }

    public Iterable<WorkItem<P>> items() {
        return items;
    }

    public TaskHandler<P, R> handler() {
        return handler;
    }

    public JobConfig config() {
        return config;
    }

    public static final class Builder<P, R> {
        private final TaskHandler<P, R> handler;
        private final List<WorkItem<P>> added = new ArrayList<>();
        private Iterable<WorkItem<P>> source;
        private JobConfig config = JobConfig.defaults();
        private String name;

        private Builder(TaskHandler<P, R> handler) {
            this.handler = handler;
        }

        public Builder<P, R> name(String name) {
            this.name = name;
            return this;
        }

        public Builder<P, R> add(P payload) {
            added.add(WorkItem.of(payload));
            return this;
        }

        public Builder<P, R> add(P payload, double estimatedCost) {
            added.add(WorkItem.of(payload, estimatedCost));
            return this;
        }

        /** Lazily-consumed item source; replaces any items added one by one. */
        public Builder<P, R> items(Iterable<WorkItem<P>> source) {
            this.source = source;
            return this;
        }

        public Builder<P, R> config(JobConfig config) {
            this.config = config;
            return this;
        }

        public Job<P, R> build() {
            Iterable<WorkItem<P>> items = source != null ? source : List.copyOf(added);
            return new Job<>(name, items, handler, config);
        }
    }
}
