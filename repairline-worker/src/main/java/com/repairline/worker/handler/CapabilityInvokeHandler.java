package com.repairline.worker.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.repairline.core.exception.AgentUnavailableException;
import com.repairline.core.model.TaskResult;
import com.repairline.engine.coordinator.OrchestrationCoordinator;
import com.repairline.engine.service.OrchestrationService;
import com.repairline.worker.job.JobContext;
import com.repairline.worker.job.JobException;
import com.repairline.worker.job.JobHandler;
import com.repairline.worker.job.JobResult;
import com.repairline.worker.job.WorkerJob;

import java.util.Set;

/**
 * Runs a single agent capability outside any workflow.
 *
 * Payload: {@code {"capability": "...", "input": {...}}}. Failures that another attempt
 * could fix (no agent available, timeout) are retried by redelivery.
 */
public class CapabilityInvokeHandler implements JobHandler {

    public static final String TYPE = "capability:invoke";

    private static final Set<String> TRANSIENT_CODES = Set.of(
        AgentUnavailableException.ERROR_CODE,
        OrchestrationCoordinator.TASK_TIMEOUT,
        OrchestrationCoordinator.INTERNAL_ERROR
    );

    private final OrchestrationService orchestration;

    public CapabilityInvokeHandler(OrchestrationService orchestration) {
        this.orchestration = orchestration;
    }

    @Override
    public JobResult handle(WorkerJob job, JobContext context) throws JobException {
        JsonNode payload = job.payload();
        JsonNode capability = payload != null ? payload.get("capability") : null;
        if (capability == null || !capability.isTextual() || capability.asText().isBlank()) {
            throw JobException.permanent(WorkflowExecuteHandler.INVALID_PAYLOAD, TYPE + " requires payload.capability");
        }
        JsonNode input = payload.hasNonNull("input") ? payload.get("input") : JsonNodeFactory.instance.objectNode();

        TaskResult result = orchestration.invokeCapability(capability.asText(), input, job.tenantId());
        if (result.isSuccess()) {
            return JobResult.completed(result.output());
        }
        if (TRANSIENT_CODES.contains(result.errorCode())) {
            throw JobException.transient_(result.errorCode(), result.error());
        }
        return JobResult.failed(result.error());
    }
}
