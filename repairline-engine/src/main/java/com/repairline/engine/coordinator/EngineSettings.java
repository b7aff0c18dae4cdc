package com.repairline.engine.coordinator;

import com.repairline.core.model.LoadBalancingStrategy;
import com.repairline.core.model.RetryPolicy;

import java.time.Duration;

/**
 * Tunables of the orchestration engine.
 *
 * @param defaultTaskTimeout per-attempt timeout for tasks that set none
 * @param maxConcurrentTasks in-flight tasks allowed per execution
 * @param defaultRetryPolicy policy for tasks that set none
 * @param defaultStrategy load balancing for agents outside any pool
 * @param enableParallelExecution when false, one task runs at a time
 * @param pollInterval wait between dispatch rounds while tasks are in flight
 */
public record EngineSettings(
    Duration defaultTaskTimeout,
    int maxConcurrentTasks,
    RetryPolicy defaultRetryPolicy,
    LoadBalancingStrategy defaultStrategy,
    boolean enableParallelExecution,
    Duration pollInterval
) {
    public EngineSettings {
        if (maxConcurrentTasks < 1) {
            throw new IllegalArgumentException("maxConcurrentTasks must be >= 1");
        }
        defaultTaskTimeout = defaultTaskTimeout == null ? Duration.ofMinutes(5) : defaultTaskTimeout;
        defaultRetryPolicy = defaultRetryPolicy == null ? RetryPolicy.defaultPolicy() : defaultRetryPolicy;
        defaultStrategy = defaultStrategy == null ? LoadBalancingStrategy.ROUND_ROBIN : defaultStrategy;
        pollInterval = pollInterval == null ? Duration.ofMillis(100) : pollInterval;
    }

    public static EngineSettings defaults() {
        return new EngineSettings(
            Duration.ofMinutes(5),
            10,
            RetryPolicy.defaultPolicy(),
            LoadBalancingStrategy.ROUND_ROBIN,
            true,
            Duration.ofMillis(100)
        );
    }

    /**
     * Effective number of tasks an execution may run at once.
     */
    public int concurrencyCap() {
        return enableParallelExecution ? maxConcurrentTasks : 1;
    }

    public EngineSettings withDefaultRetryPolicy(RetryPolicy policy) {
        return new EngineSettings(defaultTaskTimeout, maxConcurrentTasks, policy,
            defaultStrategy, enableParallelExecution, pollInterval);
    }

    public EngineSettings withMaxConcurrentTasks(int max) {
        return new EngineSettings(defaultTaskTimeout, max, defaultRetryPolicy,
            defaultStrategy, enableParallelExecution, pollInterval);
    }

    public EngineSettings withDefaultTaskTimeout(Duration timeout) {
        return new EngineSettings(timeout, maxConcurrentTasks, defaultRetryPolicy,
            defaultStrategy, enableParallelExecution, pollInterval);
    }

    public EngineSettings withParallelExecution(boolean enabled) {
        return new EngineSettings(defaultTaskTimeout, maxConcurrentTasks, defaultRetryPolicy,
            defaultStrategy, enabled, pollInterval);
    }
}
