package com.repairline.api.config;

import com.repairline.core.model.IdempotencyTtl;
import com.repairline.core.model.LoadBalancingStrategy;
import com.repairline.core.model.RetryPolicy;
import com.repairline.engine.coordinator.EngineSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "repairline")
public class EngineProperties {

    private String store = "memory";
    private Engine engine = new Engine();
    private Idempotency idempotency = new Idempotency();

    public EngineSettings toEngineSettings() {
        RetryPolicy retryPolicy = RetryPolicy.builder()
            .maxAttempts(engine.retry.maxAttempts)
            .initialBackoff(Duration.ofMillis(engine.retry.initialBackoffMs))
            .maxBackoff(Duration.ofMillis(engine.retry.maxBackoffMs))
            .backoffMultiplier(engine.retry.multiplier)
            .build();
        return new EngineSettings(
            Duration.ofMillis(engine.taskTimeoutMs),
            engine.maxConcurrentTasks,
            retryPolicy,
            LoadBalancingStrategy.valueOf(engine.strategy.trim().toUpperCase()),
            engine.parallel,
            Duration.ofMillis(engine.pollIntervalMs)
        );
    }

    public IdempotencyTtl toIdempotencyTtl() {
        return new IdempotencyTtl(
            Duration.ofSeconds(idempotency.defaultTtlSeconds),
            Duration.ofSeconds(idempotency.minTtlSeconds),
            Duration.ofSeconds(idempotency.maxTtlSeconds));
    }

    public String getStore() { return store; }
    public void setStore(String store) { this.store = store; }
    public Engine getEngine() { return engine; }
    public void setEngine(Engine engine) { this.engine = engine; }
    public Idempotency getIdempotency() { return idempotency; }
    public void setIdempotency(Idempotency idempotency) { this.idempotency = idempotency; }

    public static class Engine {
        private long taskTimeoutMs = 300_000;
        private int maxConcurrentTasks = 10;
        private String strategy = "round_robin";
        private boolean parallel = true;
        private long pollIntervalMs = 100;
        private Retry retry = new Retry();

        public long getTaskTimeoutMs() { return taskTimeoutMs; }
        public void setTaskTimeoutMs(long taskTimeoutMs) { this.taskTimeoutMs = taskTimeoutMs; }
        public int getMaxConcurrentTasks() { return maxConcurrentTasks; }
        public void setMaxConcurrentTasks(int maxConcurrentTasks) { this.maxConcurrentTasks = maxConcurrentTasks; }
        public String getStrategy() { return strategy; }
        public void setStrategy(String strategy) { this.strategy = strategy; }
        public boolean isParallel() { return parallel; }
        public void setParallel(boolean parallel) { this.parallel = parallel; }
        public long getPollIntervalMs() { return pollIntervalMs; }
        public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
        public Retry getRetry() { return retry; }
        public void setRetry(Retry retry) { this.retry = retry; }
    }

    public static class Retry {
        private int maxAttempts = 3;
        private long initialBackoffMs = 1000;
        private long maxBackoffMs = 30_000;
        private double multiplier = 2.0;

        public int getMaxAttempts() { return maxAttempts; }
        public void setMaxAttempts(int maxAttempts) { this.maxAttempts = maxAttempts; }
        public long getInitialBackoffMs() { return initialBackoffMs; }
        public void setInitialBackoffMs(long initialBackoffMs) { this.initialBackoffMs = initialBackoffMs; }
        public long getMaxBackoffMs() { return maxBackoffMs; }
        public void setMaxBackoffMs(long maxBackoffMs) { this.maxBackoffMs = maxBackoffMs; }
        public double getMultiplier() { return multiplier; }
        public void setMultiplier(double multiplier) { this.multiplier = multiplier; }
    }

    public static class Idempotency {
        private Long ttlSeconds;
        private long defaultTtlSeconds = IdempotencyTtl.DEFAULT_TTL.toSeconds();
        private long minTtlSeconds = IdempotencyTtl.MIN_TTL.toSeconds();
        private long maxTtlSeconds = IdempotencyTtl.MAX_TTL.toSeconds();
        private int cleanupMaxIterations = 20;

        public Long getTtlSeconds() { return ttlSeconds; }
        public void setTtlSeconds(Long ttlSeconds) { this.ttlSeconds = ttlSeconds; }
        public long getDefaultTtlSeconds() { return defaultTtlSeconds; }
        public void setDefaultTtlSeconds(long defaultTtlSeconds) { this.defaultTtlSeconds = defaultTtlSeconds; }
        public long getMinTtlSeconds() { return minTtlSeconds; }
        public void setMinTtlSeconds(long minTtlSeconds) { this.minTtlSeconds = minTtlSeconds; }
        public long getMaxTtlSeconds() { return maxTtlSeconds; }
        public void setMaxTtlSeconds(long maxTtlSeconds) { this.maxTtlSeconds = maxTtlSeconds; }
        public int getCleanupMaxIterations() { return cleanupMaxIterations; }
        public void setCleanupMaxIterations(int cleanupMaxIterations) { this.cleanupMaxIterations = cleanupMaxIterations; }
    }
}
