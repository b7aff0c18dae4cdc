package com.repairline.worker;

import java.time.Duration;
import java.util.UUID;

/**
 * Tunables of the worker processor.
 *
 * @param workerId identifies this replica in logs and stats
 * @param maxConcurrentJobs jobs processed at once; further deliveries are refused as busy
 * @param jobTimeout wall-clock bound on one handler invocation
 * @param lockTtl lease on the job lock, renewed in the background while the handler runs
 * @param idempotencyTtlSeconds lifetime of idempotency records; null for the store default
 * @param pollInterval pull mode: wait after an empty pull
 * @param ackDeadline pull mode: how long a pulled message stays invisible to other consumers
 */
public record WorkerSettings(
    String workerId,
    WorkerMode mode,
    int maxConcurrentJobs,
    Duration jobTimeout,
    Duration lockTtl,
    Long idempotencyTtlSeconds,
    Duration pollInterval,
    Duration ackDeadline
) {
    public static final int DEFAULT_MAX_CONCURRENT_JOBS = 5;
    public static final Duration DEFAULT_JOB_TIMEOUT = Duration.ofMillis(300_000);
    public static final Duration DEFAULT_LOCK_TTL = Duration.ofMillis(60_000);

    public WorkerSettings {
        if (maxConcurrentJobs < 1) {
            throw new IllegalArgumentException("maxConcurrentJobs must be >= 1");
        }
        workerId = workerId == null || workerId.isBlank()
            ? "worker-" + UUID.randomUUID().toString().substring(0, 8)
            : workerId;
        mode = mode == null ? WorkerMode.PUSH : mode;
        jobTimeout = jobTimeout == null ? DEFAULT_JOB_TIMEOUT : jobTimeout;
        lockTtl = lockTtl == null ? DEFAULT_LOCK_TTL : lockTtl;
        pollInterval = pollInterval == null ? Duration.ofSeconds(1) : pollInterval;
        ackDeadline = ackDeadline == null ? jobTimeout.plus(lockTtl) : ackDeadline;
    }

    public static WorkerSettings defaults() {
        return new WorkerSettings(null, WorkerMode.PUSH, DEFAULT_MAX_CONCURRENT_JOBS,
            DEFAULT_JOB_TIMEOUT, DEFAULT_LOCK_TTL, null, null, null);
    }

    public WorkerSettings withMode(WorkerMode newMode) {
        return new WorkerSettings(workerId, newMode, maxConcurrentJobs, jobTimeout, lockTtl,
            idempotencyTtlSeconds, pollInterval, ackDeadline);
    }

    public WorkerSettings withMaxConcurrentJobs(int max) {
        return new WorkerSettings(workerId, mode, max, jobTimeout, lockTtl,
            idempotencyTtlSeconds, pollInterval, ackDeadline);
    }

    public WorkerSettings withJobTimeout(Duration timeout) {
        return new WorkerSettings(workerId, mode, maxConcurrentJobs, timeout, lockTtl,
            idempotencyTtlSeconds, pollInterval, ackDeadline);
    }

    public WorkerSettings withLockTtl(Duration ttl) {
        return new WorkerSettings(workerId, mode, maxConcurrentJobs, jobTimeout, ttl,
            idempotencyTtlSeconds, pollInterval, ackDeadline);
    }

    public WorkerSettings withPollInterval(Duration interval) {
        return new WorkerSettings(workerId, mode, maxConcurrentJobs, jobTimeout, lockTtl,
            idempotencyTtlSeconds, interval, ackDeadline);
    }

    public WorkerSettings withAckDeadline(Duration deadline) {
        return new WorkerSettings(workerId, mode, maxConcurrentJobs, jobTimeout, lockTtl,
            idempotencyTtlSeconds, pollInterval, deadline);
    }
}
