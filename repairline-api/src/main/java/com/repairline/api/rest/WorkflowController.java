package com.repairline.api.rest;

import com.fasterxml.jackson.databind.JsonNode;
import com.repairline.core.model.DependencyType;
import com.repairline.core.model.Execution;
import com.repairline.core.model.ExecutionStatus;
import com.repairline.core.model.FailurePolicy;
import com.repairline.core.model.TaskDefinition;
import com.repairline.core.model.TaskResult;
import com.repairline.core.model.WorkflowDefinition;
import com.repairline.engine.coordinator.OrchestrationCoordinator;
import com.repairline.engine.service.OrchestrationService.ExecuteRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * REST API for workflow definitions and their executions.
 */
@RestController
@RequestMapping("/api/v1")
public class WorkflowController {

    private static final int DEFAULT_STATUS_LIMIT = 100;

    private final OrchestrationCoordinator coordinator;

    public WorkflowController(OrchestrationCoordinator coordinator) {
        this.coordinator = coordinator;
    }

    // ========== Workflows ==========

    @PostMapping("/workflows")
    public ResponseEntity<WorkflowResponse> createWorkflow(@Valid @RequestBody CreateWorkflowRequest request) {
        WorkflowDefinition created = coordinator.createWorkflow(request.toDefinition());
        return ResponseEntity.status(HttpStatus.CREATED).body(WorkflowResponse.from(created));
    }

    @GetMapping("/workflows")
    public ResponseEntity<List<WorkflowResponse>> listWorkflows() {
        return ResponseEntity.ok(coordinator.listWorkflows().stream()
            .map(WorkflowResponse::from)
            .toList());
    }

    @GetMapping("/workflows/{workflowId}")
    public ResponseEntity<WorkflowResponse> getWorkflow(@PathVariable String workflowId) {
        return ResponseEntity.ok(WorkflowResponse.from(coordinator.getWorkflow(workflowId)));
    }

    @DeleteMapping("/workflows/{workflowId}")
    public ResponseEntity<Void> deleteWorkflow(@PathVariable String workflowId) {
        return coordinator.deleteWorkflow(workflowId)
            ? ResponseEntity.noContent().build()
            : ResponseEntity.notFound().build();
    }

    /**
     * Run a workflow synchronously. Reusing an execution id resumes that execution.
     */
    @PostMapping("/workflows/{workflowId}/execute")
    public ResponseEntity<ExecutionResponse> executeWorkflow(
            @PathVariable String workflowId,
            @RequestBody(required = false) ExecuteWorkflowRequest request) {
        ExecuteWorkflowRequest body = request != null ? request : new ExecuteWorkflowRequest(null, null, null);
        Execution execution = coordinator.executeWorkflow(
            new ExecuteRequest(workflowId, body.input(), body.tenantId(), body.executionId()));
        return ResponseEntity.ok(ExecutionResponse.from(execution));
    }

    @GetMapping("/workflows/{workflowId}/executions")
    public ResponseEntity<List<ExecutionResponse>> listExecutions(@PathVariable String workflowId) {
        return ResponseEntity.ok(coordinator.listExecutions(workflowId).stream()
            .map(ExecutionResponse::from)
            .toList());
    }

    // ========== Executions ==========

    @GetMapping("/executions/{executionId}")
    public ResponseEntity<ExecutionResponse> getExecution(@PathVariable String executionId) {
        return ResponseEntity.ok(ExecutionResponse.from(coordinator.getExecution(executionId)));
    }

    @GetMapping("/executions")
    public ResponseEntity<List<ExecutionResponse>> listExecutionsByStatus(
            @RequestParam ExecutionStatus status,
            @RequestParam(defaultValue = "100") int limit) {
        int bounded = limit > 0 ? Math.min(limit, DEFAULT_STATUS_LIMIT * 10) : DEFAULT_STATUS_LIMIT;
        return ResponseEntity.ok(coordinator.listExecutionsByStatus(status, bounded).stream()
            .map(ExecutionResponse::from)
            .toList());
    }

    @PostMapping("/executions/{executionId}/cancel")
    public ResponseEntity<ExecutionResponse> cancelExecution(@PathVariable String executionId) {
        return ResponseEntity.ok(ExecutionResponse.from(coordinator.cancelExecution(executionId)));
    }

    @PostMapping("/executions/{executionId}/pause")
    public ResponseEntity<ExecutionResponse> pauseExecution(@PathVariable String executionId) {
        return ResponseEntity.ok(ExecutionResponse.from(coordinator.pauseExecution(executionId)));
    }

    @PostMapping("/executions/{executionId}/resume")
    public ResponseEntity<ExecutionResponse> resumeExecution(@PathVariable String executionId) {
        return ResponseEntity.ok(ExecutionResponse.from(coordinator.resumeExecution(executionId)));
    }

    // ========== DTOs ==========

    public record CreateWorkflowRequest(
        @NotBlank String name,
        String version,
        String description,
        @NotEmpty List<@Valid TaskRequest> tasks,
        JsonNode inputSchema,
        Long timeoutMs,
        FailurePolicy failurePolicy,
        Map<String, String> tags
    ) {
        WorkflowDefinition toDefinition() {
            WorkflowDefinition.Builder builder = WorkflowDefinition.builder(name)
                .description(description)
                .inputSchema(inputSchema)
                .tags(tags);
            if (version != null) {
                builder.version(version);
            }
            if (timeoutMs != null) {
                builder.timeout(Duration.ofMillis(timeoutMs));
            }
            if (failurePolicy != null) {
                builder.failurePolicy(failurePolicy);
            }
            tasks.forEach(task -> builder.task(task.toDefinition()));
            return builder.build();
        }
    }

    public record TaskRequest(
        @NotBlank String id,
        String name,
        String capability,
        String agentId,
        JsonNode input,
        List<String> dependencies,
        DependencyType dependencyType,
        Long timeoutMs
    ) {
        TaskDefinition toDefinition() {
            TaskDefinition.Builder builder = TaskDefinition.builder(id)
                .capability(capability)
                .agentId(agentId)
                .input(input);
            if (name != null) {
                builder.name(name);
            }
            if (dependencies != null) {
                builder.dependsOn(dependencies.toArray(String[]::new));
            }
            if (dependencyType != null) {
                builder.dependencyType(dependencyType);
            }
            if (timeoutMs != null) {
                builder.timeout(Duration.ofMillis(timeoutMs));
            }
            return builder.build();
        }
    }

    public record ExecuteWorkflowRequest(
        JsonNode input,
        String tenantId,
        String executionId
    ) {}

    public record WorkflowResponse(
        String id,
        String name,
        String version,
        String description,
        List<TaskDefinition> tasks,
        Long timeoutMs,
        FailurePolicy failurePolicy,
        Map<String, String> tags,
        Instant createdAt
    ) {
        public static WorkflowResponse from(WorkflowDefinition definition) {
            return new WorkflowResponse(
                definition.id(),
                definition.name(),
                definition.version(),
                definition.description(),
                definition.tasks(),
                definition.timeout() != null ? definition.timeout().toMillis() : null,
                definition.failurePolicy(),
                definition.tags(),
                definition.createdAt()
            );
        }
    }

    public record ExecutionResponse(
        String id,
        String workflowId,
        String workflowName,
        String tenantId,
        ExecutionStatus status,
        JsonNode input,
        JsonNode output,
        List<TaskResult> taskResults,
        List<String> currentTasks,
        List<String> completedTasks,
        List<String> failedTasks,
        String error,
        Instant startTime,
        Instant endTime
    ) {
        public static ExecutionResponse from(Execution execution) {
            return new ExecutionResponse(
                execution.id(),
                execution.workflowId(),
                execution.workflowName(),
                execution.tenantId(),
                execution.status(),
                execution.input(),
                execution.output(),
                execution.taskResults(),
                execution.currentTasks(),
                execution.completedTasks(),
                execution.failedTasks(),
                execution.error(),
                execution.startTime(),
                execution.endTime()
            );
        }
    }
}
