package com.parallax.dispatch.cli;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.parallax.core.config.ParallaxProperties;
import com.parallax.core.events.EventBus;
import com.parallax.core.model.Job;
import com.parallax.core.model.JobConfig;
import com.parallax.core.model.JobResult;
import com.parallax.core.model.JobStatus;
import com.parallax.core.model.TaskException;
import com.parallax.core.pool.PoolStartupException;
import com.parallax.core.scheduler.JobHandle;
import com.parallax.core.scheduler.QueueCapacityExceededException;
import com.parallax.core.scheduler.Scheduler;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Option;

import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: parallax run
 * <p>
 * Runs a synthetic CPU-bound workload through the scheduler and prints the outcome.
 * Exit code is 0 when every task succeeded, 1 otherwise.
 */
@Command(name = "run", mixinStandardHelpOptions = true, description = "Run a synthetic workload")
@Component
public class RunCommand implements Callable<Integer> {

    @Mixin
    PlanningOptions options = new PlanningOptions();

    @Option(names = {"--fail-on"}, split = ",", description = "Task ids that throw instead of completing")
    List<Integer> failOn;

    @Option(names = {"--json"}, description = "Print the job summary as JSON")
    boolean json;

    @Option(names = {"--watch", "-w"}, description = "Print job events as they happen")
    boolean watch;

    private final Scheduler scheduler;
    private final ParallaxProperties properties;
    private final EventBus eventBus;
    private final ObjectMapper objectMapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public RunCommand(Scheduler scheduler, ParallaxProperties properties, EventBus eventBus) {
        this.scheduler = scheduler;
        this.properties = properties;
        this.eventBus = eventBus;
    }

    @Override
    public Integer call() {
        if (!json) {
            ConsoleOutput.printBanner();
        }

        Job<SyntheticWorkload.Unit, Long> job;
        try {
            JobConfig config = options.toJobConfig(properties.toJobConfig());
            Set<Integer> failing = failOn != null ? new HashSet<>(failOn) : Set.of();
            job = Job.builder(new SyntheticWorkload())
                    .name("synthetic")
                    .items(options.workItems(failing))
                    .config(config)
                    .build();
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        EventBus.Subscription subscription = watch && !json
                ? eventBus.subscribeAll(ConsoleOutput::watchEvent)
                : null;
        long start = System.currentTimeMillis();
        JobResult<?> result;
        try {
            JobHandle<Long> handle = scheduler.submit(job);
            if (!json) {
                ConsoleOutput.info("Job " + handle.jobId() + " running on " + handle.poolSize() + " slot(s)");
            }
            result = handle.await();
        } catch (PoolStartupException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        } catch (QueueCapacityExceededException e) {
            ConsoleOutput.error(e.getMessage());
            result = e.getPartialResult();
        } finally {
            if (subscription != null) {
                subscription.unsubscribe();
            }
        }
        long elapsedMs = System.currentTimeMillis() - start;

        if (json) {
            try {
                System.out.println(objectMapper.writeValueAsString(summary(result, elapsedMs)));
            } catch (JsonProcessingException e) {
                ConsoleOutput.error("Could not serialize job summary: " + e.getMessage());
                return 2;
            }
        } else {
            ConsoleOutput.jobSummary(result, elapsedMs);
        }
        return result.status() == JobStatus.COMPLETED ? 0 : 1;
    }

    static Map<String, Object> summary(JobResult<?> result, long elapsedMs) {
        var failures = new LinkedHashMap<String, String>();
        for (TaskException failure : result.failures()) {
            failures.put(String.valueOf(failure.getTaskId()), failure.getMessage());
        }
        var summary = new LinkedHashMap<String, Object>();
        summary.put("jobId", result.jobId());
        summary.put("status", result.status().name());
        summary.put("tasks", result.taskCount());
        summary.put("succeeded", result.succeeded());
        summary.put("failed", result.failed());
        summary.put("notRun", result.notRun());
        summary.put("elapsedMs", elapsedMs);
        summary.put("failures", failures);
        return summary;
    }
}
