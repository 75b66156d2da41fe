package com.herzen.metrics.config;

import com.herzen.metrics.aggregation.AggregationPolicy;
import com.herzen.metrics.aggregation.AggregationPolicy.AbsentInputs;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

import java.util.concurrent.ThreadPoolExecutor;

/**
 * Thread pools for background recomputation and the aggregation policy.
 */
@Configuration
public class MetricEngineConfig {
    private static final Logger log = LoggerFactory.getLogger(MetricEngineConfig.class);

    @Value("${metrics.recompute.pool-size:4}")
    private int poolSize;

    @Value("${metrics.recompute.queue-capacity:500}")
    private int queueCapacity;

    @Value("${metrics.aggregation.missing-tag-weight:0}")
    private double missingTagWeight;

    @Value("${metrics.aggregation.absent-inputs:exclude}")
    private String absentInputs;

    /**
     * Runs recomputations. When the queue is full the submitting thread runs the task itself.
     */
    @Bean(name = "metricRecomputeExecutor")
    public ThreadPoolTaskExecutor metricRecomputeExecutor() {
        ThreadPoolTaskExecutor executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(poolSize);
        executor.setMaxPoolSize(poolSize);
        executor.setQueueCapacity(queueCapacity);
        executor.setThreadNamePrefix("metric-recompute-");
        executor.setRejectedExecutionHandler(new ThreadPoolExecutor.CallerRunsPolicy());
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);

        log.info("Metric recompute executor configured - Pool: {}, Queue: {}", poolSize, queueCapacity);
        return executor;
    }

    // Holds back dispatch for the coalescing delay only; the work itself goes to the executor.
    @Bean(name = "metricTaskScheduler")
    public ThreadPoolTaskScheduler metricTaskScheduler() {
        ThreadPoolTaskScheduler scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(1);
        scheduler.setThreadNamePrefix("metric-coalesce-");
        scheduler.setWaitForTasksToCompleteOnShutdown(false);
        return scheduler;
    }

    @Bean
    public AggregationPolicy aggregationPolicy() {
        AggregationPolicy policy = new AggregationPolicy(missingTagWeight, AbsentInputs.fromValue(absentInputs));
        log.info("Aggregation policy - missing tag weight: {}, absent inputs: {}",
                policy.missingTagWeight(), policy.absentInputs());
        return policy;
    }
}
