package com.parallax.core.scheduler;

import com.parallax.core.balancer.LoadBalancer;
import com.parallax.core.model.Batch;
import com.parallax.core.model.DistributionStrategy;
import com.parallax.core.model.JobConfig;
import com.parallax.core.model.Task;
import com.parallax.core.overhead.OverheadGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Turns a job's tasks into dispatch units. Batching comes first so that the balancer orders and
 * partitions whole batches rather than the tasks inside them.
 */
@Component
public class DispatchPlanner {

    private static final Logger log = LoggerFactory.getLogger(DispatchPlanner.class);

    private final OverheadGuard overheadGuard;
    private final LoadBalancer loadBalancer;

    @Autowired
    public DispatchPlanner(OverheadGuard overheadGuard, LoadBalancer loadBalancer) {
        this.overheadGuard = overheadGuard;
        this.loadBalancer = loadBalancer;
    }

    public DispatchPlanner() {
        this(new OverheadGuard(), new LoadBalancer());
    }

    /**
     * @param poolSize number of slots the job will actually get
     */
    public <P> DispatchPlan<P> plan(List<Task<P>> tasks, JobConfig config, int poolSize) {
        List<Batch<P>> batches = overheadGuard.batch(tasks, poolSize, config);
        List<Batch<P>> ordered = loadBalancer.order(batches, config.balancerPolicy(), config.seed());

        List<List<Batch<P>>> groups = config.strategy() == DistributionStrategy.STATIC_POOL
                ? loadBalancer.partition(ordered, poolSize, config.balancerPolicy())
                : List.of();

        log.info("Planned {} task(s) as {} unit(s) for {} slot(s), strategy={}, policy={}",
                tasks.size(), ordered.size(), poolSize, config.strategy(), config.balancerPolicy());
        return new DispatchPlan<>(tasks, ordered, groups, poolSize, config.strategy());
    }
}
