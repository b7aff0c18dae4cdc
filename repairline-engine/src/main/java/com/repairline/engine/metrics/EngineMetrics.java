package com.repairline.engine.metrics;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Duration;

/**
 * Micrometer metrics for idempotency, locking and orchestration.
 *
 * Metrics exposed:
 * - Execution counts by workflow and outcome, execution duration
 * - Task duration, retries and failures by capability
 * - Idempotency outcomes (new, duplicate, conflict) and cleanup deletions
 * - Lock outcomes (acquired, busy, released, renewed)
 */
public class EngineMetrics {

    public static final String EXECUTIONS_STARTED = "repairline.executions.started";
    public static final String EXECUTIONS_FINISHED = "repairline.executions.finished";
    public static final String EXECUTION_DURATION = "repairline.execution.duration";

    public static final String TASK_DURATION = "repairline.task.duration";
    public static final String TASK_RETRIES = "repairline.task.retries";
    public static final String TASK_FAILURES = "repairline.task.failures";

    public static final String IDEMPOTENCY_CHECKS = "repairline.idempotency.checks";
    public static final String IDEMPOTENCY_CLEANUP_DELETED = "repairline.idempotency.cleanup.deleted";

    public static final String LOCK_OPERATIONS = "repairline.lock.operations";

    private final MeterRegistry registry;

    public EngineMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    /**
     * Metrics backed by an in-process registry, for tests and embedded use.
     */
    public static EngineMetrics noop() {
        return new EngineMetrics(new SimpleMeterRegistry());
    }

    public MeterRegistry getRegistry() {
        return registry;
    }

    // ========== Execution Metrics ==========

    public void executionStarted(String workflowName) {
        Counter.builder(EXECUTIONS_STARTED)
            .tag("workflow", workflowName)
            .description("Workflow executions started")
            .register(registry)
            .increment();
    }

    public void executionFinished(String workflowName, String status, Duration duration) {
        Counter.builder(EXECUTIONS_FINISHED)
            .tag("workflow", workflowName)
            .tag("status", status)
            .description("Workflow executions that reached a terminal or paused status")
            .register(registry)
            .increment();

        Timer.builder(EXECUTION_DURATION)
            .tag("workflow", workflowName)
            .tag("status", status)
            .register(registry)
            .record(duration);
    }

    // ========== Task Metrics ==========

    public void taskFinished(String capability, boolean success, long durationMs) {
        Timer.builder(TASK_DURATION)
            .tag("capability", capability)
            .tag("outcome", success ? "success" : "failure")
            .description("Task duration including retries")
            .register(registry)
            .record(Duration.ofMillis(durationMs));
    }

    public void taskRetried(String capability, String errorCode) {
        Counter.builder(TASK_RETRIES)
            .tag("capability", capability)
            .tag("errorCode", errorCode)
            .register(registry)
            .increment();
    }

    public void taskFailed(String capability, String errorCode) {
        Counter.builder(TASK_FAILURES)
            .tag("capability", capability)
            .tag("errorCode", errorCode)
            .register(registry)
            .increment();
    }

    // ========== Idempotency Metrics ==========

    public void idempotencyCheck(String outcome) {
        Counter.builder(IDEMPOTENCY_CHECKS)
            .tag("outcome", outcome)
            .description("checkAndSet outcomes: new, duplicate, conflict")
            .register(registry)
            .increment();
    }

    public void cleanupDeleted(int count) {
        Counter.builder(IDEMPOTENCY_CLEANUP_DELETED)
            .description("Expired idempotency records deleted")
            .register(registry)
            .increment(count);
    }

    // ========== Lock Metrics ==========

    public void lockOperation(String operation, boolean success) {
        Counter.builder(LOCK_OPERATIONS)
            .tag("operation", operation)
            .tag("success", String.valueOf(success))
            .register(registry)
            .increment();
    }
}
