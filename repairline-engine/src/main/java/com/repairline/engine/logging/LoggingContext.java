package com.repairline.engine.logging;

import org.slf4j.MDC;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * MDC helper for structured logging.
 * Restores only the keys it added, so contexts nest safely.
 *
 * Usage:
 * <pre>
 * try (var ctx = LoggingContext.forTask(executionId, taskId, attempt)) {
 *     log.info("Invoking agent"); // includes executionId, taskId, attempt
 * }
 * </pre>
 *
 * Log output with MDC:
 * 2024-01-15 10:30:45.123 [repairline-task-3] INFO  c.r.e.c.OrchestrationCoordinator - Invoking agent
 *   executionId=exec_4f1c taskId=lint attempt=2 traceId=9b1e22c0
 */
public final class LoggingContext implements AutoCloseable {

    public static final String EXECUTION_ID = "executionId";
    public static final String WORKFLOW_ID = "workflowId";
    public static final String TASK_ID = "taskId";
    public static final String ATTEMPT = "attempt";
    public static final String TENANT_ID = "tenantId";
    public static final String IDEMPOTENCY_KEY = "idempotencyKey";
    public static final String MESSAGE_ID = "messageId";
    public static final String WORKER_ID = "workerId";
    public static final String TRACE_ID = "traceId";

    private final List<String> addedKeys = new ArrayList<>();

    private LoggingContext() {
    }

    public static LoggingContext forExecution(String executionId, String workflowId, String tenantId) {
        return new LoggingContext()
            .with(EXECUTION_ID, executionId)
            .with(WORKFLOW_ID, workflowId)
            .with(TENANT_ID, tenantId)
            .withTraceId();
    }

    public static LoggingContext forTask(String executionId, String taskId, int attempt) {
        return new LoggingContext()
            .with(EXECUTION_ID, executionId)
            .with(TASK_ID, taskId)
            .with(ATTEMPT, String.valueOf(attempt))
            .withTraceId();
    }

    /**
     * Context for one broker message. Only a prefix of the key hash is logged, never the raw key.
     */
    public static LoggingContext forMessage(String messageId, String tenantId, String keyHash) {
        return new LoggingContext()
            .with(MESSAGE_ID, messageId)
            .with(TENANT_ID, tenantId)
            .with(IDEMPOTENCY_KEY, keyHash != null && keyHash.length() > 12 ? keyHash.substring(0, 12) : keyHash)
            .withTraceId();
    }

    public static LoggingContext forWorker(String workerId) {
        return new LoggingContext()
            .with(WORKER_ID, workerId)
            .withTraceId();
    }

    /**
     * Snapshot of the caller's MDC, for handing work to another thread.
     */
    public static Map<String, String> capture() {
        Map<String, String> context = MDC.getCopyOfContextMap();
        return context != null ? context : Map.of();
    }

    /**
     * Install a captured MDC snapshot on the current thread.
     */
    public static LoggingContext restore(Map<String, String> captured) {
        LoggingContext ctx = new LoggingContext();
        captured.forEach(ctx::with);
        return ctx;
    }

    public static String getTraceId() {
        return MDC.get(TRACE_ID);
    }

    private LoggingContext with(String key, String value) {
        if (value != null && MDC.get(key) == null) {
            MDC.put(key, value);
            addedKeys.add(key);
        }
        return this;
    }

    private LoggingContext withTraceId() {
        return with(TRACE_ID, UUID.randomUUID().toString().substring(0, 8));
    }

    @Override
    public void close() {
        addedKeys.forEach(MDC::remove);
    }
}
