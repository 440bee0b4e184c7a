package com.parallax.core.events;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Delivers {@link JobEvent}s to listeners registered for one job or for every job, optionally
 * narrowed to a set of event types.
 * <p>
 * Listeners run on the publishing thread. A job's events are published by one thread at a time
 * (the submitter until its coordinator starts, then the coordinator), so each listener sees them
 * in publication order. Job listeners are dropped once the job's terminal event has been
 * delivered.
 */
@Service
public class EventBus {

    private static final Logger log = LoggerFactory.getLogger(EventBus.class);

    private final ConcurrentHashMap<String, List<Listener>> jobListeners = new ConcurrentHashMap<>();
    private final List<Listener> globalListeners = new CopyOnWriteArrayList<>();

    public void publish(JobEvent event) {
        List<Listener> forJob = event.isTerminal()
                ? jobListeners.remove(event.jobId())
                : jobListeners.get(event.jobId());
        log.debug("Event {} of job {}", event.eventType(), event.jobId());
        if (forJob != null) {
            forJob.forEach(listener -> listener.deliver(event));
        }
        globalListeners.forEach(listener -> listener.deliver(event));
    }

    /** Listens to every event of one job until it ends. */
    public Subscription subscribe(String jobId, Consumer<JobEvent> consumer) {
        return subscribe(jobId, Set.of(), consumer);
    }

    /** Listens to the given event types of one job; an empty set means every type. */
    public Subscription subscribe(String jobId, Set<String> eventTypes, Consumer<JobEvent> consumer) {
        var listener = new Listener(Set.copyOf(eventTypes), consumer);
        jobListeners.computeIfAbsent(jobId, id -> new CopyOnWriteArrayList<>()).add(listener);
        return () -> jobListeners.computeIfPresent(jobId, (id, listeners) -> {
            listeners.remove(listener);
            return listeners.isEmpty() ? null : listeners;
        });
    }

    /** Called once with the job's {@code job.completed} or {@code job.cancelled} event. */
    public Subscription onJobEnd(String jobId, Consumer<JobEvent> consumer) {
        return subscribe(jobId, JobEvent.TERMINAL_TYPES, consumer);
    }

    public Subscription subscribeAll(Consumer<JobEvent> consumer) {
        return subscribeAll(Set.of(), consumer);
    }

    public Subscription subscribeAll(Set<String> eventTypes, Consumer<JobEvent> consumer) {
        var listener = new Listener(Set.copyOf(eventTypes), consumer);
        globalListeners.add(listener);
        return () -> globalListeners.remove(listener);
    }

    /** Jobs that still have listeners registered. */
    public Set<String> watchedJobs() {
        return Set.copyOf(jobListeners.keySet());
    }

    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private record Listener(Set<String> eventTypes, Consumer<JobEvent> consumer) {

        void deliver(JobEvent event) {
            if (!eventTypes.isEmpty() && !eventTypes.contains(event.eventType())) {
                return;
            }
            try {
                consumer.accept(event);
            } catch (RuntimeException e) {
                log.warn("Listener failed on {} of job {}: {}", event.eventType(), event.jobId(), e.getMessage(), e);
            }
        }
    }
}
