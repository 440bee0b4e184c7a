package com.parallax.dispatch.cli;

import com.parallax.core.config.ParallaxProperties;
import com.parallax.core.model.Batch;
import com.parallax.core.model.DistributionStrategy;
import com.parallax.core.model.JobConfig;
import com.parallax.core.scheduler.DispatchPlan;
import com.parallax.core.scheduler.Scheduler;
import org.springframework.stereotype.Component;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;

import java.util.Set;
import java.util.concurrent.Callable;

/**
 * CLI command: parallax plan
 * <p>
 * Shows how a synthetic workload would be batched, ordered and, for a static pool,
 * partitioned across slots, without running it.
 */
@Command(name = "plan", mixinStandardHelpOptions = true, description = "Print the dispatch plan for a workload")
@Component
public class PlanCommand implements Callable<Integer> {

    @Mixin
    PlanningOptions options = new PlanningOptions();

    private final Scheduler scheduler;
    private final ParallaxProperties properties;

    public PlanCommand(Scheduler scheduler, ParallaxProperties properties) {
        this.scheduler = scheduler;
        this.properties = properties;
    }

    @Override
    public Integer call() {
        ConsoleOutput.printBanner();

        JobConfig config;
        DispatchPlan<SyntheticWorkload.Unit> plan;
        try {
            config = options.toJobConfig(properties.toJobConfig());
            plan = scheduler.plan(options.workItems(Set.of()), config);
        } catch (IllegalArgumentException e) {
            ConsoleOutput.error(e.getMessage());
            return 2;
        }

        ConsoleOutput.info(String.format("%d task(s) -> %d unit(s) on %d slot(s), %s / %s",
                plan.tasks().size(), plan.units().size(), plan.poolSize(),
                plan.strategy(), config.balancerPolicy()));

        System.out.println();
        System.out.println("UNITS (dispatch order):");
        for (Batch<SyntheticWorkload.Unit> unit : plan.units()) {
            ConsoleOutput.unit(unit.id(), unit.taskIds().toString(), unit.estimatedCost());
        }

        if (plan.strategy() == DistributionStrategy.STATIC_POOL) {
            System.out.println();
            System.out.println("SLOTS:");
            var loads = plan.slotLoads();
            var taskIds = plan.slotTaskIds();
            for (int slot = 0; slot < plan.slotGroups().size(); slot++) {
                ConsoleOutput.slot(slot, plan.slotGroups().get(slot).size(), loads.get(slot),
                        taskIds.get(slot).toString());
            }
        }
        return 0;
    }
}
