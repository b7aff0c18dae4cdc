package com.repairline.api.config;

import com.repairline.worker.WorkerMode;
import com.repairline.worker.WorkerSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@ConfigurationProperties(prefix = "repairline.worker")
public class WorkerProperties {

    private String workerId;
    private String mode = "push";
    private String environment = "development";
    private int maxConcurrentJobs = WorkerSettings.DEFAULT_MAX_CONCURRENT_JOBS;
    private long jobTimeoutMs = WorkerSettings.DEFAULT_JOB_TIMEOUT.toMillis();
    private long lockTtlMs = WorkerSettings.DEFAULT_LOCK_TTL.toMillis();
    private long pollIntervalMs = 1000;
    private long shutdownTimeoutMs = 30_000;
    private PubSub pubsub = new PubSub();

    public WorkerSettings toSettings(Long idempotencyTtlSeconds) {
        return new WorkerSettings(
            workerId,
            WorkerMode.fromString(mode),
            maxConcurrentJobs,
            Duration.ofMillis(jobTimeoutMs),
            Duration.ofMillis(lockTtlMs),
            idempotencyTtlSeconds,
            Duration.ofMillis(pollIntervalMs),
            null
        );
    }

    public String getWorkerId() { return workerId; }
    public void setWorkerId(String workerId) { this.workerId = workerId; }
    public String getMode() { return mode; }
    public void setMode(String mode) { this.mode = mode; }
    public String getEnvironment() { return environment; }
    public void setEnvironment(String environment) { this.environment = environment; }
    public int getMaxConcurrentJobs() { return maxConcurrentJobs; }
    public void setMaxConcurrentJobs(int maxConcurrentJobs) { this.maxConcurrentJobs = maxConcurrentJobs; }
    public long getJobTimeoutMs() { return jobTimeoutMs; }
    public void setJobTimeoutMs(long jobTimeoutMs) { this.jobTimeoutMs = jobTimeoutMs; }
    public long getLockTtlMs() { return lockTtlMs; }
    public void setLockTtlMs(long lockTtlMs) { this.lockTtlMs = lockTtlMs; }
    public long getPollIntervalMs() { return pollIntervalMs; }
    public void setPollIntervalMs(long pollIntervalMs) { this.pollIntervalMs = pollIntervalMs; }
    public long getShutdownTimeoutMs() { return shutdownTimeoutMs; }
    public void setShutdownTimeoutMs(long shutdownTimeoutMs) { this.shutdownTimeoutMs = shutdownTimeoutMs; }
    public PubSub getPubsub() { return pubsub; }
    public void setPubsub(PubSub pubsub) { this.pubsub = pubsub; }

    /**
     * Broker identifiers. Reported in stats and health; the local brokers ignore them.
     */
    public static class PubSub {
        private String projectId;
        private String topic = "repairline-jobs";
        private String subscription = "repairline-jobs-worker";

        public String getProjectId() { return projectId; }
        public void setProjectId(String projectId) { this.projectId = projectId; }
        public String getTopic() { return topic; }
        public void setTopic(String topic) { this.topic = topic; }
        public String getSubscription() { return subscription; }
        public void setSubscription(String subscription) { this.subscription = subscription; }
    }
}
