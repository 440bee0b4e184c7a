package com.parallax.core.config;

import com.parallax.core.model.BalancerPolicy;
import com.parallax.core.model.DistributionStrategy;
import com.parallax.core.model.FailurePolicy;
import com.parallax.core.model.JobConfig;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Default job settings, bound from {@code parallax.scheduler.*}.
 */
@Component
@ConfigurationProperties(prefix = "parallax")
public class ParallaxProperties {

    private Scheduler scheduler = new Scheduler();

    // -- Scheduler accessors (delegate to nested) --
    public int getPoolSize() { return scheduler.poolSize; }
    public DistributionStrategy getStrategy() { return scheduler.strategy; }
    public BalancerPolicy getBalancerPolicy() { return scheduler.balancerPolicy; }
    public FailurePolicy getFailurePolicy() { return scheduler.failurePolicy; }
    public int getQueueCapacity() { return scheduler.queueCapacity; }
    public Duration getShutdownTimeout() { return scheduler.shutdownTimeout; }

    /**
     * Resolves the configured pool size; 0 or less means one slot per available processor.
     */
    public int resolvePoolSize() {
        return scheduler.poolSize > 0 ? scheduler.poolSize : Runtime.getRuntime().availableProcessors();
    }

    /**
     * Builds a {@link JobConfig} from these defaults.
     */
    public JobConfig toJobConfig() {
        return JobConfig.builder()
                .poolSize(resolvePoolSize())
                .strategy(scheduler.strategy)
                .balancerPolicy(scheduler.balancerPolicy)
                .seed(scheduler.seed)
                .failurePolicy(scheduler.failurePolicy)
                .dispatchOverhead(scheduler.dispatchOverhead)
                .overheadThreshold(scheduler.overheadThreshold)
                .batchingFactor(scheduler.batchingFactor)
                .queueCapacity(scheduler.queueCapacity)
                .submitTimeout(scheduler.submitTimeout)
                .build();
    }

    public Scheduler getScheduler() { return scheduler; }
    public void setScheduler(Scheduler scheduler) { this.scheduler = scheduler; }

    public static class Scheduler {
        private int poolSize = 0;
        private DistributionStrategy strategy = DistributionStrategy.DYNAMIC_QUEUE;
        private BalancerPolicy balancerPolicy = BalancerPolicy.NONE;
        private long seed = 0L;
        private FailurePolicy failurePolicy = FailurePolicy.COLLECT_ALL;
        private double dispatchOverhead = JobConfig.DEFAULT_DISPATCH_OVERHEAD;
        private double overheadThreshold = JobConfig.DEFAULT_OVERHEAD_THRESHOLD;
        private double batchingFactor = JobConfig.DEFAULT_BATCHING_FACTOR;
        private int queueCapacity = JobConfig.DEFAULT_QUEUE_CAPACITY;
        private Duration submitTimeout;
        private Duration shutdownTimeout = Duration.ofSeconds(30);

        public int getPoolSize() { return poolSize; }
        public void setPoolSize(int poolSize) { this.poolSize = poolSize; }
        public DistributionStrategy getStrategy() { return strategy; }
        public void setStrategy(DistributionStrategy strategy) { this.strategy = strategy; }
        public BalancerPolicy getBalancerPolicy() { return balancerPolicy; }
        public void setBalancerPolicy(BalancerPolicy balancerPolicy) { this.balancerPolicy = balancerPolicy; }
        public long getSeed() { return seed; }
        public void setSeed(long seed) { this.seed = seed; }
        public FailurePolicy getFailurePolicy() { return failurePolicy; }
        public void setFailurePolicy(FailurePolicy failurePolicy) { this.failurePolicy = failurePolicy; }
        public double getDispatchOverhead() { return dispatchOverhead; }
        public void setDispatchOverhead(double dispatchOverhead) { this.dispatchOverhead = dispatchOverhead; }
        public double getOverheadThreshold() { return overheadThreshold; }
        public void setOverheadThreshold(double overheadThreshold) { this.overheadThreshold = overheadThreshold; }
        public double getBatchingFactor() { return batchingFactor; }
        public void setBatchingFactor(double batchingFactor) { this.batchingFactor = batchingFactor; }
        public int getQueueCapacity() { return queueCapacity; }
        public void setQueueCapacity(int queueCapacity) { this.queueCapacity = queueCapacity; }
        public Duration getSubmitTimeout() { return submitTimeout; }
        public void setSubmitTimeout(Duration submitTimeout) { this.submitTimeout = submitTimeout; }
        public Duration getShutdownTimeout() { return shutdownTimeout; }
        public void setShutdownTimeout(Duration shutdownTimeout) { this.shutdownTimeout = shutdownTimeout; }
    }
}
