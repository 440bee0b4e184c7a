package com.parallax.core.scheduler;

import com.parallax.core.aggregate.ResultAggregator;
import com.parallax.core.config.ParallaxProperties;
import com.parallax.core.events.EventBus;
import com.parallax.core.events.JobEvent;
import com.parallax.core.logging.MdcContext;
import com.parallax.core.metrics.ParallaxMetrics;
import com.parallax.core.model.Batch;
import com.parallax.core.model.DistributionStrategy;
import com.parallax.core.model.Job;
import com.parallax.core.model.JobConfig;
import com.parallax.core.model.JobResult;
import com.parallax.core.model.Task;
import com.parallax.core.model.WorkItem;
import com.parallax.core.pool.CoordinatorMessage;
import com.parallax.core.pool.PoolStartupException;
import com.parallax.core.pool.WorkerPool;
import com.parallax.core.pool.WorkerThreadFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import jakarta.annotation.PreDestroy;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.function.IntSupplier;

/**
 * Entry point of the engine. Plans each submitted job, starts its worker pool and coordinator,
 * and returns a {@link JobHandle}.
 * <p>
 * For {@link DistributionStrategy#DYNAMIC_QUEUE} jobs, {@link #submit} itself feeds the shared
 * queue: it returns as soon as every batch is queued and blocks while the queue is full.
 */
@Service
public class Scheduler {

    private static final Logger log = LoggerFactory.getLogger(Scheduler.class);

    /** How often a blocked submitter re-checks whether the job has stopped. */
    private static final long FEED_RECHECK_MS = 50;

    private final DispatchPlanner planner;
    private final EventBus eventBus;
    private final ParallaxMetrics metrics;
    private final Function<String, ThreadFactory> workerThreads;
    private final IntSupplier hardwareParallelism;
    private final Duration shutdownTimeout;
    private final AtomicInteger jobSequence = new AtomicInteger();
    private final Map<String, JobHandle<?>> activeJobs = new ConcurrentHashMap<>();

    @Autowired
    public Scheduler(DispatchPlanner planner, EventBus eventBus,
                     @Autowired(required = false) ParallaxMetrics metrics,
                     ParallaxProperties properties) {
        this(planner, eventBus, metrics, Scheduler::defaultWorkerThreads,
                () -> Runtime.getRuntime().availableProcessors(), properties.getShutdownTimeout());
    }

    public Scheduler() {
        this(new DispatchPlanner(), new EventBus(), null, Scheduler::defaultWorkerThreads,
                () -> Runtime.getRuntime().availableProcessors(), Duration.ofSeconds(30));
    }

    Scheduler(DispatchPlanner planner, EventBus eventBus, ParallaxMetrics metrics,
              Function<String, ThreadFactory> workerThreads, IntSupplier hardwareParallelism,
              Duration shutdownTimeout) {
        this.planner = planner;
        this.eventBus = eventBus;
        this.metrics = metrics;
        this.workerThreads = workerThreads;
        this.hardwareParallelism = hardwareParallelism;
        this.shutdownTimeout = shutdownTimeout;
    }

    /**
     * Submits a job for execution.
     *
     * @throws PoolStartupException            if the worker pool cannot be started; nothing ran
     * @throws QueueCapacityExceededException if the dispatch queue stayed full past the submit timeout
     * @throws IllegalArgumentException        if the item source yields a null item
     */
    public <P, R> JobHandle<R> submit(Job<P, R> job) {
        String jobId = nextJobId();
        Map<String, String> callerMdc = MdcContext.capture();
        MdcContext.setJob(jobId);
        try {
            JobConfig config = job.config();
            List<Task<P>> tasks = materialize(jobId, job.items());
            int hardware = hardwareParallelism.getAsInt();
            int poolSize = WorkerPool.effectiveSize(config.poolSize(), hardware);
            DispatchPlan<P> plan = planner.plan(tasks, config, poolSize);

            log.info("Submitting job {}{}: {} task(s), {} unit(s), strategy={}, failurePolicy={}",
                    jobId, job.name() != null ? " (" + job.name() + ")" : "", tasks.size(),
                    plan.units().size(), config.strategy(), config.failurePolicy());
            if (metrics != null) {
                metrics.recordBatching(tasks.size(), plan.units().size());
            }

            var mailbox = new LinkedBlockingQueue<CoordinatorMessage>();
            WorkerPool<P, R> pool;
            try {
                pool = WorkerPool.start(jobId, config.poolSize(), hardware,
                        workerThreads.apply(jobId), job.handler(), mailbox);
            } catch (PoolStartupException e) {
                if (metrics != null) {
                    metrics.recordPoolStartupFailure();
                }
                throw e;
            }

            DispatchStrategy<P> strategy = config.strategy() == DistributionStrategy.STATIC_POOL
                    ? new StaticPoolStrategy<>(plan.slotGroups())
                    : new DynamicQueueStrategy<>(plan.units(), config.queueCapacity());
            var aggregator = new ResultAggregator<P, R>(jobId, tasks.size(), config.failurePolicy());
            var coordinator = new JobCoordinator<>(jobId, config, pool, strategy, aggregator, mailbox,
                    eventBus, metrics, shutdownTimeout, () -> activeJobs.remove(jobId));
            var handle = new JobHandle<>(coordinator);
            activeJobs.put(jobId, handle);

            eventBus.publish(JobEvent.of(JobEvent.JOB_SUBMITTED, jobId,
                    Map.of("tasks", tasks.size(), "units", plan.units().size(),
                           "poolSize", pool.size(), "strategy", config.strategy().name())));

            Thread thread = new Thread(coordinator, "parallax-coordinator-" + jobId);
            thread.setDaemon(true);
            thread.start();

            if (strategy instanceof DynamicQueueStrategy<P> queue) {
                feed(coordinator, handle, queue, config.submitTimeout());
            }
            return handle;
        } finally {
            MdcContext.restore(callerMdc);
        }
    }

    /** Jobs submitted and not yet finished. */
    public Collection<JobHandle<?>> activeJobs() {
        return List.copyOf(activeJobs.values());
    }

    /** Plans a job without running it. */
    public <P> DispatchPlan<P> plan(Iterable<WorkItem<P>> items, JobConfig config) {
        List<Task<P>> tasks = materialize("plan", items);
        int poolSize = WorkerPool.effectiveSize(config.poolSize(), hardwareParallelism.getAsInt());
        return planner.plan(tasks, config, poolSize);
    }

    /**
     * Cancels every active job and waits for each to drain.
     */
    @PreDestroy
    public void shutdown() {
        var jobs = activeJobs();
        if (jobs.isEmpty()) {
            return;
        }
        log.info("Shutting down scheduler, cancelling {} active job(s)", jobs.size());
        for (var handle : jobs) {
            handle.cancel();
        }
        for (var handle : jobs) {
            if (handle.await(shutdownTimeout).isEmpty()) {
                log.warn("Job {} did not finish within {}", handle.jobId(), shutdownTimeout);
            }
        }
    }

    private <P, R> void feed(JobCoordinator<P, R> coordinator, JobHandle<R> handle,
                             DynamicQueueStrategy<P> queue, Duration submitTimeout) {
        List<Batch<P>> planned = queue.planned();
        for (int queued = 0; queued < planned.size(); queued++) {
            Batch<P> batch = planned.get(queued);
            long waitStart = System.nanoTime();
            long deadline = submitTimeout != null ? waitStart + submitTimeout.toNanos() : Long.MAX_VALUE;
            boolean blocked = false;
            try {
                while (!queue.offer(batch, nextWaitNanos(blocked, deadline), TimeUnit.NANOSECONDS)) {
                    blocked = true;
                    if (coordinator.isStopping()) {
                        log.debug("Job {} stopped while feeding; {} batch(es) not queued",
                                coordinator.jobId(), planned.size() - queued);
                        return;
                    }
                    if (submitTimeout != null && System.nanoTime() - deadline >= 0) {
                        reject(coordinator, handle, queue, submitTimeout);
                    }
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                log.warn("Interrupted while feeding job {}, cancelling it", coordinator.jobId());
                coordinator.cancel();
                return;
            }
            if (blocked && metrics != null) {
                metrics.recordBackPressure(TimeUnit.NANOSECONDS.toMillis(System.nanoTime() - waitStart));
            }
            coordinator.signal(ControlSignal.UNITS_AVAILABLE);
            if (coordinator.isStopping()) {
                return;
            }
        }
    }

    private static long nextWaitNanos(boolean blocked, long deadline) {
        if (!blocked) {
            return 0;
        }
        long recheck = TimeUnit.MILLISECONDS.toNanos(FEED_RECHECK_MS);
        if (deadline == Long.MAX_VALUE) {
            return recheck;
        }
        return Math.max(0, Math.min(recheck, deadline - System.nanoTime()));
    }

    private <P, R> void reject(JobCoordinator<P, R> coordinator, JobHandle<R> handle,
                               DynamicQueueStrategy<P> queue, Duration submitTimeout) {
        log.warn("Job {}: dispatch queue full for {}ms, cancelling", coordinator.jobId(), submitTimeout.toMillis());
        if (metrics != null) {
            metrics.recordQueueRejection();
        }
        coordinator.cancel();
        JobResult<R> partial = handle.await();
        throw new QueueCapacityExceededException(coordinator.jobId(), queue.capacity(), submitTimeout, partial);
    }

    private static <P> List<Task<P>> materialize(String jobId, Iterable<WorkItem<P>> items) {
        var tasks = new ArrayList<Task<P>>();
        for (WorkItem<P> item : items) {
            if (item == null) {
                throw new IllegalArgumentException("Job " + jobId + ": work item " + tasks.size() + " is null");
            }
            tasks.add(new Task<>(tasks.size(), item.payload(), item.estimatedCost()));
        }
        return tasks;
    }

    private String nextJobId() {
        return String.format("JOB-%04d", jobSequence.incrementAndGet());
    }

    private static ThreadFactory defaultWorkerThreads(String jobId) {
        return new WorkerThreadFactory("parallax-worker-" + jobId);
    }
}
