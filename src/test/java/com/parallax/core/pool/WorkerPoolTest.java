package com.parallax.core.pool;

import com.parallax.core.model.Batch;
import com.parallax.core.model.Task;
import com.parallax.core.model.TaskHandler;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link WorkerPool}.
 */
class WorkerPoolTest {

    private final BlockingQueue<CoordinatorMessage> channel = new LinkedBlockingQueue<>();
    private WorkerPool<Integer, Integer> pool;

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private static Batch<Integer> batch(int id, int... taskIds) {
        var tasks = new ArrayList<Task<Integer>>();
        for (int taskId : taskIds) {
            tasks.add(new Task<>(taskId, taskId, null));
        }
        return new Batch<>(id, tasks);
    }

    @SuppressWarnings("unchecked")
    private SlotCompletion<Integer, Integer> nextCompletion() throws InterruptedException {
        var message = channel.poll(5, TimeUnit.SECONDS);
        assertNotNull(message, "expected a completion within 5s");
        return (SlotCompletion<Integer, Integer>) message;
    }

    @Nested
    @DisplayName("start")
    class StartTests {

        @Test
        @DisplayName("effective size is capped by hardware and at least one")
        void effectiveSize() {
            assertEquals(4, WorkerPool.effectiveSize(4, 8));
            assertEquals(8, WorkerPool.effectiveSize(16, 8));
            assertEquals(1, WorkerPool.effectiveSize(0, 8));
        }

        @Test
        @DisplayName("starts the effective number of slots")
        void startsSlots() {
            pool = WorkerPool.start("JOB-1", 16, 3, new WorkerThreadFactory("test"), x -> x, channel);
            assertEquals(3, pool.size());
            assertEquals(0, pool.activeCount());
        }

        @Test
        @DisplayName("fails as a whole when a worker thread cannot be created")
        void spawnFailure() throws InterruptedException {
            var started = new ArrayList<Thread>();
            ThreadFactory failOnThird = r -> {
                if (started.size() == 2) {
                    throw new IllegalStateException("no more threads");
                }
                Thread t = new Thread(r);
                t.setDaemon(true);
                started.add(t);
                return t;
            };

            var e = assertThrows(PoolStartupException.class,
                    () -> WorkerPool.start("JOB-1", 4, 8, failOnThird, x -> x, channel));

            assertEquals(4, e.getRequestedSlots());
            assertEquals(2, e.getStartedSlots());
            assertInstanceOf(IllegalStateException.class, e.getCause());
            for (Thread t : started) {
                t.join(5000);
                assertFalse(t.isAlive(), "already started workers must be stopped");
            }
        }

        @Test
        @DisplayName("treats a null thread from the factory as a startup failure")
        void nullThread() {
            assertThrows(PoolStartupException.class,
                    () -> WorkerPool.start("JOB-1", 1, 1, r -> null, x -> x, channel));
        }
    }

    @Nested
    @DisplayName("dispatch")
    class DispatchTests {

        @Test
        @DisplayName("runs batch members in order and reports one completion")
        void runsBatch() throws InterruptedException {
            pool = WorkerPool.start("JOB-1", 2, 2, new WorkerThreadFactory("test"), x -> x * 10, channel);

            pool.dispatch(1, batch(0, 3, 4, 5));
            var completion = nextCompletion();

            assertEquals(1, completion.slot());
            assertEquals(List.of(3, 4, 5), completion.batch().taskIds());
            assertEquals(List.of(30, 40, 50), completion.outcomes().stream().map(TaskOutcome::value).toList());
        }

        @Test
        @DisplayName("captures handler exceptions as failed outcomes")
        void capturesFailures() throws InterruptedException {
            TaskHandler<Integer, Integer> handler = x -> {
                if (x == 1) throw new IllegalArgumentException("bad " + x);
                return x;
            };
            pool = WorkerPool.start("JOB-1", 1, 1, new WorkerThreadFactory("test"), handler, channel);

            pool.dispatch(0, batch(0, 0, 1, 2));
            var outcomes = nextCompletion().outcomes();

            assertTrue(outcomes.get(0).isSuccess());
            assertFalse(outcomes.get(1).isSuccess());
            assertEquals("bad 1", outcomes.get(1).error().getMessage());
            assertTrue(outcomes.get(2).isSuccess());
        }

        @Test
        @DisplayName("rejects a second batch for a busy slot")
        void rejectsBusySlot() throws InterruptedException {
            var release = new CountDownLatch(1);
            pool = WorkerPool.start("JOB-1", 1, 1, new WorkerThreadFactory("test"), x -> {
                release.await(5, TimeUnit.SECONDS);
                return x;
            }, channel);

            pool.dispatch(0, batch(0, 0));
            assertTrue(pool.isBusy(0));
            assertThrows(IllegalStateException.class, () -> pool.dispatch(0, batch(1, 1)));

            release.countDown();
            nextCompletion();
            pool.dispatch(0, batch(2, 2));
            assertEquals(List.of(2), nextCompletion().batch().taskIds());
        }

        @Test
        @DisplayName("rejects dispatch after shutdown")
        void rejectsAfterShutdown() {
            pool = WorkerPool.start("JOB-1", 1, 1, new WorkerThreadFactory("test"), x -> x, channel);
            assertTrue(pool.shutdown(Duration.ofSeconds(5)));
            assertTrue(pool.isClosed());
            assertThrows(IllegalStateException.class, () -> pool.dispatch(0, batch(0, 0)));
        }
    }

    @Test
    @DisplayName("graceful shutdown lets in-flight batches finish")
    void shutdownDrains() throws InterruptedException {
        var started = new CountDownLatch(1);
        pool = WorkerPool.start("JOB-1", 1, 1, new WorkerThreadFactory("test"), x -> {
            started.countDown();
            Thread.sleep(100);
            return x;
        }, channel);

        pool.dispatch(0, batch(0, 7));
        assertTrue(started.await(5, TimeUnit.SECONDS));

        assertTrue(pool.shutdown(Duration.ofSeconds(5)));
        assertEquals(List.of(7), nextCompletion().batch().taskIds());
    }

    @Test
    @DisplayName("worker threads are daemon threads named after the prefix")
    void threadFactoryNaming() {
        Thread t = new WorkerThreadFactory("parallax-worker-JOB-0001").newThread(() -> { });
        assertTrue(t.isDaemon());
        assertEquals("parallax-worker-JOB-0001-0", t.getName());
    }
}
