package com.repairline.worker.handler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.repairline.core.exception.NotFoundException;
import com.repairline.core.exception.RepairlineException;
import com.repairline.core.exception.ResourceBusyException;
import com.repairline.core.exception.WorkflowValidationException;
import com.repairline.core.model.Execution;
import com.repairline.engine.service.OrchestrationService;
import com.repairline.engine.service.OrchestrationService.ExecuteRequest;
import com.repairline.worker.job.JobContext;
import com.repairline.worker.job.JobException;
import com.repairline.worker.job.JobHandler;
import com.repairline.worker.job.JobResult;
import com.repairline.worker.job.WorkerJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.Optional;

/**
 * Runs a stored workflow through the orchestration engine.
 *
 * Payload: {@code {"workflowId": "...", "input": {...}}}. The execution id is the job's run id,
 * so a redelivery after a crash resumes the same execution instead of starting over.
 */
public class WorkflowExecuteHandler implements JobHandler {

    private static final Logger log = LoggerFactory.getLogger(WorkflowExecuteHandler.class);

    public static final String TYPE = "workflow:execute";
    public static final String INVALID_PAYLOAD = "INVALID_PAYLOAD";

    static final Duration RESUME_LOCK_EXTENSION = Duration.ofMinutes(2);

    private final OrchestrationService orchestration;

    public WorkflowExecuteHandler(OrchestrationService orchestration) {
        this.orchestration = orchestration;
    }

    @Override
    public JobResult handle(WorkerJob job, JobContext context) throws JobException {
        JsonNode payload = job.payload();
        JsonNode workflowId = payload != null ? payload.get("workflowId") : null;
        if (workflowId == null || !workflowId.isTextual() || workflowId.asText().isBlank()) {
            throw JobException.permanent(INVALID_PAYLOAD, TYPE + " requires payload.workflowId");
        }
        JsonNode input = payload.hasNonNull("input") ? payload.get("input") : JsonNodeFactory.instance.objectNode();
        String executionId = context.getRunId();

        Optional<JsonNode> checkpoint = context.loadCheckpoint();
        if (checkpoint.isPresent()) {
            log.info("Resuming execution {} from checkpoint", executionId);
            context.extendLock(RESUME_LOCK_EXTENSION);
        } else {
            ObjectNode started = JsonNodeFactory.instance.objectNode()
                .put("phase", "started")
                .put("workflowId", workflowId.asText());
            context.saveCheckpoint(started);
        }

        Execution execution;
        try {
            execution = orchestration.executeWorkflow(
                new ExecuteRequest(workflowId.asText(), input, job.tenantId(), executionId));
        } catch (NotFoundException | WorkflowValidationException e) {
            throw JobException.permanent(e.getErrorCode(), e.getMessage());
        } catch (ResourceBusyException e) {
            throw JobException.transient_(e.getErrorCode(), e.getMessage());
        } catch (RepairlineException e) {
            throw new JobException(e.getErrorCode(), e.getMessage(), e, true);
        }

        ObjectNode summary = JsonNodeFactory.instance.objectNode()
            .put("executionId", execution.id())
            .put("workflowId", execution.workflowId())
            .put("status", execution.status().name());
        if (execution.output() != null) {
            summary.set("output", execution.output());
        }
        context.saveCheckpoint(summary.deepCopy().put("phase", "finished"));

        return switch (execution.status()) {
            case COMPLETED -> JobResult.completed(summary);
            case FAILED -> JobResult.failed("Execution " + execution.id() + " failed: " + execution.error());
            case CANCELLED -> JobResult.skipped("Execution " + execution.id() + " was cancelled");
            case PAUSED -> JobResult.skipped("Execution " + execution.id() + " is paused");
            default -> throw JobException.transient_(ResourceBusyException.ERROR_CODE,
                "Execution " + execution.id() + " still " + execution.status());
        };
    }
}
