package com.parallax.core.scheduler;

import com.parallax.core.events.EventBus;
import com.parallax.core.events.JobEvent;
import com.parallax.core.metrics.ParallaxMetrics;
import com.parallax.core.model.BalancerPolicy;
import com.parallax.core.model.DistributionStrategy;
import com.parallax.core.model.FailurePolicy;
import com.parallax.core.model.Job;
import com.parallax.core.model.JobConfig;
import com.parallax.core.model.JobResult;
import com.parallax.core.model.JobStatus;
import com.parallax.core.model.Result;
import com.parallax.core.model.TaskException;
import com.parallax.core.model.WorkItem;
import com.parallax.core.pool.PoolStartupException;
import com.parallax.core.pool.WorkerThreadFactory;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end tests for {@link Scheduler}, run against a fixed hardware parallelism of 8.
 */
class SchedulerTest {

    private static final int HARDWARE = 8;

    private SimpleMeterRegistry registry;
    private EventBus eventBus;
    private Scheduler scheduler;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        eventBus = new EventBus();
        scheduler = newScheduler(jobId -> new WorkerThreadFactory("test-" + jobId));
    }

    @AfterEach
    void tearDown() {
        scheduler.shutdown();
    }

    private Scheduler newScheduler(Function<String, ThreadFactory> threads) {
        return new Scheduler(new DispatchPlanner(), eventBus, new ParallaxMetrics(registry),
                threads, () -> HARDWARE, Duration.ofSeconds(10));
    }

    private static JobConfig.Builder config(int poolSize, DistributionStrategy strategy) {
        return JobConfig.builder().poolSize(poolSize).strategy(strategy);
    }

    private static Job<Integer, Integer> doubling(int tasks, JobConfig config) {
        var builder = Job.<Integer, Integer>builder(x -> x * 2).config(config);
        for (int i = 0; i < tasks; i++) {
            builder.add(i);
        }
        return builder.build();
    }

    @Nested
    @DisplayName("results")
    class ResultTests {

        @Test
        @DisplayName("collect-all returns exactly one entry per task, in submission order")
        void oneEntryPerTask() {
            for (var strategy : DistributionStrategy.values()) {
                var result = scheduler.submit(doubling(50, config(4, strategy).build())).await();

                assertEquals(JobStatus.COMPLETED, result.status());
                assertEquals(50, result.taskCount());
                assertEquals(IntStream.range(0, 50).map(i -> i * 2).boxed().toList(), result.values());
                for (int i = 0; i < 50; i++) {
                    assertEquals(i, result.result(i).orElseThrow().taskId());
                }
            }
        }

        @Test
        @DisplayName("k failing tasks yield k failure records in submission order")
        void failuresInOrder() {
            Set<Integer> failing = Set.of(3, 7, 11);
            var job = Job.<Integer, Integer>builder(x -> {
                        if (failing.contains(x)) throw new IllegalStateException("task " + x);
                        return x;
                    })
                    .items(IntStream.range(0, 20).mapToObj(WorkItem::of).toList())
                    .config(config(4, DistributionStrategy.DYNAMIC_QUEUE).build())
                    .build();

            var result = scheduler.submit(job).await();

            assertEquals(JobStatus.PARTIALLY_FAILED, result.status());
            assertEquals(List.of(3, 7, 11), result.failures().stream().map(TaskException::getTaskId).toList());
            assertEquals(17, result.succeeded());
            assertEquals(0, result.notRun());
            assertEquals("task 7", result.result(7).orElseThrow().failure().getCause().getMessage());
            assertEquals(3.0, registry.find("parallax.task.failures").counter().count());
        }

        @Test
        @DisplayName("merged batches still report one result per task")
        void batchedTasksDemultiplexed() {
            var builder = Job.<Integer, Integer>builder(x -> x + 1)
                    .config(config(2, DistributionStrategy.STATIC_POOL).build());
            for (int i = 0; i < 100; i++) {
                builder.add(i, 0.1);
            }

            var result = scheduler.submit(builder.build()).await();

            assertEquals(JobStatus.COMPLETED, result.status());
            assertEquals(IntStream.range(1, 101).boxed().toList(), result.values());
            assertTrue(registry.find("parallax.overhead.dispatches_saved").counter().count() > 0);
        }

        @Test
        @DisplayName("an empty job completes with no entries")
        void emptyJob() {
            var result = scheduler.submit(doubling(0, JobConfig.defaults())).await();
            assertEquals(JobStatus.COMPLETED, result.status());
            assertEquals(0, result.taskCount());
        }

        @Test
        @DisplayName("a null work item is rejected")
        void nullItemRejected() {
            var job = Job.<Integer, Integer>builder(x -> x)
                    .items(Arrays.asList(WorkItem.of(1), null))
                    .build();
            assertThrows(IllegalArgumentException.class, () -> scheduler.submit(job));
        }

        @Test
        @DisplayName("a task throwing an Error is recorded as a failure and the job still finishes")
        void errorRecordedAsFailure() {
            for (var strategy : DistributionStrategy.values()) {
                var job = Job.<Integer, Integer>builder(x -> {
                            if (x == 2) throw new AssertionError("boom");
                            return x;
                        })
                        .items(IntStream.range(0, 6).mapToObj(WorkItem::of).toList())
                        .config(config(2, strategy).build())
                        .build();

                var result = scheduler.submit(job).await(Duration.ofSeconds(5));

                assertTrue(result.isPresent(), strategy + " job did not finish");
                assertEquals(JobStatus.PARTIALLY_FAILED, result.get().status());
                assertEquals(List.of(2), result.get().failures().stream().map(TaskException::getTaskId).toList());
                assertInstanceOf(AssertionError.class, result.get().result(2).orElseThrow().failure().getCause());
                assertEquals(5, result.get().succeeded());
            }
        }

        @Test
        @DisplayName("a slot keeps serving batches after one of its tasks raised an Error")
        void slotSurvivesError() {
            var job = Job.<Integer, Integer>builder(x -> {
                        if (x % 3 == 0) throw new StackOverflowError();
                        return x;
                    })
                    .items(IntStream.range(0, 9).mapToObj(WorkItem::of).toList())
                    .config(config(1, DistributionStrategy.DYNAMIC_QUEUE).build())
                    .build();

            var result = scheduler.submit(job).await(Duration.ofSeconds(5)).orElseThrow();

            assertEquals(List.of(0, 3, 6), result.failures().stream().map(TaskException::getTaskId).toList());
            assertEquals(6, result.succeeded());
            assertEquals(0, result.notRun());
        }
    }

    @Nested
    @DisplayName("pool")
    class PoolTests {

        @Test
        @DisplayName("never runs more tasks at once than the pool size")
        void boundedConcurrency() {
            var current = new AtomicInteger();
            var peak = new AtomicInteger();
            var job = Job.<Integer, Integer>builder(x -> {
                        int now = current.incrementAndGet();
                        peak.accumulateAndGet(now, Math::max);
                        Thread.sleep(5);
                        current.decrementAndGet();
                        return x;
                    })
                    .items(IntStream.range(0, 40).mapToObj(WorkItem::of).toList())
                    .config(config(3, DistributionStrategy.DYNAMIC_QUEUE).build())
                    .build();

            var handle = scheduler.submit(job);
            handle.await();

            assertEquals(3, handle.poolSize());
            assertTrue(peak.get() <= 3, "peak concurrency " + peak.get());
        }

        @Test
        @DisplayName("requested pool size is capped at hardware parallelism")
        void cappedPoolSize() {
            var handle = scheduler.submit(doubling(4, config(64, DistributionStrategy.DYNAMIC_QUEUE).build()));
            assertEquals(HARDWARE, handle.poolSize());
            handle.await();
        }

        @Test
        @DisplayName("pool startup failure fails the submission and runs nothing")
        void startupFailure() {
            var ran = new AtomicInteger();
            var failing = newScheduler(jobId -> {
                var delegate = new WorkerThreadFactory("flaky-" + jobId);
                var count = new AtomicInteger();
                return r -> {
                    if (count.incrementAndGet() > 1) {
                        throw new IllegalStateException("cannot create thread");
                    }
                    return delegate.newThread(r);
                };
            });
            var job = Job.<Integer, Integer>builder(x -> ran.incrementAndGet())
                    .items(IntStream.range(0, 10).mapToObj(WorkItem::of).toList())
                    .config(config(4, DistributionStrategy.DYNAMIC_QUEUE).build())
                    .build();

            var e = assertThrows(PoolStartupException.class, () -> failing.submit(job));

            assertEquals(1, e.getStartedSlots());
            assertEquals(0, ran.get());
            assertTrue(failing.activeJobs().isEmpty());
            assertEquals(1.0, registry.find("parallax.pool.startup_failures").counter().count());
        }
    }

    @Nested
    @DisplayName("balancing")
    class BalancingTests {

        @Test
        @DisplayName("a randomized static pool with a fixed seed puts every task on the same slot each run")
        void seededStaticPoolIsDeterministic() {
            var config = config(4, DistributionStrategy.STATIC_POOL).randomize(1234L).build();

            var first = slots(scheduler.submit(doubling(30, config)).await());
            var second = slots(scheduler.submit(doubling(30, config)).await());

            assertEquals(first, second);
        }

        private List<Integer> slots(JobResult<Integer> result) {
            return result.results().stream().map(Result::slot).toList();
        }
    }

    @Nested
    @DisplayName("failure policy")
    class FailurePolicyTests {

        @Test
        @DisplayName("fail-fast stops dispatching after the first failure")
        void failFast() {
            var job = Job.<Integer, Integer>builder(x -> {
                        if (x == 2) throw new IllegalStateException("boom");
                        return x;
                    })
                    .items(IntStream.range(0, 10).mapToObj(WorkItem::of).toList())
                    .config(config(1, DistributionStrategy.DYNAMIC_QUEUE)
                            .failurePolicy(FailurePolicy.FAIL_FAST).build())
                    .build();

            var result = scheduler.submit(job).await();

            assertEquals(JobStatus.PARTIALLY_FAILED, result.status());
            assertEquals(2, result.succeeded());
            assertEquals(1, result.failed());
            assertEquals(7, result.notRun());
            assertTrue(result.result(5).isEmpty());
        }
    }

    @Nested
    @DisplayName("cancellation")
    class CancellationTests {

        @Test
        @DisplayName("cancel right after submit yields CANCELLED with no task reported twice")
        void cancelImmediately() {
            var job = Job.<Integer, Integer>builder(x -> {
                        Thread.sleep(10);
                        return x;
                    })
                    .items(IntStream.range(0, 100).mapToObj(WorkItem::of).toList())
                    .config(config(2, DistributionStrategy.DYNAMIC_QUEUE).build())
                    .build();

            var handle = scheduler.submit(job);
            handle.cancel();
            var result = handle.await();

            assertEquals(JobStatus.CANCELLED, result.status());
            assertTrue(result.completed() < 100);
            assertEquals(100, result.succeeded() + result.failed() + result.notRun());
            var ids = new HashSet<Integer>();
            for (var r : result.results()) {
                assertTrue(ids.add(r.taskId()), "task " + r.taskId() + " reported twice");
            }
        }

        @Test
        @DisplayName("cancel after completion is a no-op")
        void cancelAfterCompletion() {
            var handle = scheduler.submit(doubling(5, config(2, DistributionStrategy.STATIC_POOL).build()));
            var result = handle.await();
            handle.cancel();

            assertTrue(handle.isDone());
            assertEquals(JobStatus.COMPLETED, result.status());
            assertSame(result, handle.await());
        }

        @Test
        @DisplayName("await with a timeout returns empty while the job is still running")
        void awaitTimeout() {
            var job = Job.<Integer, Integer>builder(x -> {
                        Thread.sleep(200);
                        return x;
                    })
                    .add(1)
                    .config(config(1, DistributionStrategy.DYNAMIC_QUEUE).build())
                    .build();

            var handle = scheduler.submit(job);

            assertTrue(handle.await(Duration.ofMillis(10)).isEmpty());
            assertTrue(handle.await(Duration.ofSeconds(10)).isPresent());
        }

        @Test
        @DisplayName("scheduler shutdown cancels active jobs")
        void shutdownCancelsJobs() {
            var job = Job.<Integer, Integer>builder(x -> {
                        Thread.sleep(20);
                        return x;
                    })
                    .items(IntStream.range(0, 200).mapToObj(WorkItem::of).toList())
                    .config(config(2, DistributionStrategy.DYNAMIC_QUEUE).build())
                    .build();

            var handle = scheduler.submit(job);
            scheduler.shutdown();

            assertTrue(handle.isDone());
            assertEquals(JobStatus.CANCELLED, handle.await().status());
        }
    }

    @Nested
    @DisplayName("back-pressure")
    class BackPressureTests {

        @Test
        @DisplayName("a full queue past the submit timeout rejects the job with its partial result")
        void queueTimeout() {
            var job = Job.<Integer, Integer>builder(x -> {
                        Thread.sleep(300);
                        return x;
                    })
                    .items(IntStream.range(0, 6).mapToObj(WorkItem::of).toList())
                    .config(config(1, DistributionStrategy.DYNAMIC_QUEUE)
                            .queueCapacity(1)
                            .submitTimeout(Duration.ofMillis(50))
                            .build())
                    .build();

            var e = assertThrows(QueueCapacityExceededException.class, () -> scheduler.submit(job));

            assertEquals(1, e.getCapacity());
            var partial = e.getPartialResult();
            assertEquals(JobStatus.CANCELLED, partial.status());
            assertEquals(6, partial.taskCount());
            assertTrue(partial.notRun() >= 4, "not run: " + partial.notRun());
            assertEquals(1.0, registry.find("parallax.queue.rejections").counter().count());
        }

        @Test
        @DisplayName("without a submit timeout a small queue only slows submission down")
        void smallQueueBlocksButCompletes() {
            var config = config(2, DistributionStrategy.DYNAMIC_QUEUE).queueCapacity(1).build();
            var result = scheduler.submit(doubling(20, config)).await();

            assertEquals(JobStatus.COMPLETED, result.status());
            assertEquals(20, result.succeeded());
        }
    }

    @Test
    @DisplayName("publishes lifecycle events from submission to completion")
    void lifecycleEvents() {
        var types = new CopyOnWriteArrayList<String>();
        var subscription = eventBus.subscribeAll(e -> types.add(e.eventType()));

        scheduler.submit(doubling(6, config(2, DistributionStrategy.STATIC_POOL).build())).await();
        subscription.unsubscribe();

        assertEquals(JobEvent.JOB_SUBMITTED, types.get(0));
        assertEquals(JobEvent.JOB_COMPLETED, types.get(types.size() - 1));
        assertEquals(6, types.stream().filter(JobEvent.BATCH_DISPATCHED::equals).count());
        assertEquals(6, types.stream().filter(JobEvent.BATCH_COMPLETED::equals).count());
    }

    @Test
    @DisplayName("job listeners are released once the job ends")
    void jobListenersReleased() {
        var ended = new CopyOnWriteArrayList<JobEvent>();
        eventBus.onJobEnd("JOB-0001", ended::add);
        var handle = scheduler.submit(doubling(4, config(2, DistributionStrategy.STATIC_POOL).build()));
        handle.await();

        assertEquals("JOB-0001", handle.jobId());
        assertEquals(List.of(JobEvent.JOB_COMPLETED), ended.stream().map(JobEvent::eventType).toList());
        assertFalse(eventBus.watchedJobs().contains(handle.jobId()));
    }

    @Test
    @DisplayName("submit leaves the caller's MDC as it found it")
    void callerMdcRestored() {
        MDC.put("jobId", "outer");
        MDC.put("requestId", "r-9");
        try {
            scheduler.submit(doubling(3, JobConfig.defaults())).await();

            assertEquals("outer", MDC.get("jobId"));
            assertEquals("r-9", MDC.get("requestId"));
        } finally {
            MDC.clear();
        }
    }

    @Test
    @DisplayName("hardware parallelism is read once per submit")
    void hardwareReadOnce() {
        var reads = new AtomicInteger();
        var flaky = new Scheduler(new DispatchPlanner(), eventBus, null,
                jobId -> new WorkerThreadFactory("test-" + jobId),
                () -> reads.incrementAndGet() == 1 ? 2 : 6, Duration.ofSeconds(10));

        var handle = flaky.submit(doubling(12, config(8, DistributionStrategy.STATIC_POOL).build()));
        var result = handle.await();

        assertEquals(1, reads.get());
        assertEquals(2, handle.poolSize());
        assertEquals(JobStatus.COMPLETED, result.status());
        assertEquals(12, result.succeeded());
    }

    @Test
    @DisplayName("job ids are sequential")
    void sequentialJobIds() {
        var first = scheduler.submit(doubling(1, JobConfig.defaults()));
        var second = scheduler.submit(doubling(1, JobConfig.defaults()));
        first.await();
        second.await();

        assertEquals("JOB-0001", first.jobId());
        assertEquals("JOB-0002", second.jobId());
    }

    @Test
    @DisplayName("plan previews a job without running it")
    void planPreview() {
        var items = new ArrayList<WorkItem<Integer>>();
        for (int i = 0; i < 8; i++) {
            items.add(WorkItem.of(i, i + 1.0));
        }
        var plan = scheduler.plan(items, config(2, DistributionStrategy.STATIC_POOL)
                .balancerPolicy(BalancerPolicy.SORT_DESCENDING_BY_COST).build());

        assertEquals(2, plan.slotGroups().size());
        assertEquals(18.0, plan.slotLoads().get(0));
        assertEquals(18.0, plan.slotLoads().get(1));
    }
}
