package com.repairline.engine.coordinator;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.repairline.core.exception.AgentUnavailableException;
import com.repairline.core.exception.InvalidStateTransitionException;
import com.repairline.core.exception.NotFoundException;
import com.repairline.core.exception.OptimisticLockException;
import com.repairline.core.exception.ResourceBusyException;
import com.repairline.core.exception.WorkflowValidationException;
import com.repairline.core.model.AgentDescriptor;
import com.repairline.core.model.DependencyType;
import com.repairline.core.model.Execution;
import com.repairline.core.model.ExecutionStatus;
import com.repairline.core.model.FailurePolicy;
import com.repairline.core.model.RetryPolicy;
import com.repairline.core.model.TaskDefinition;
import com.repairline.core.model.TaskResult;
import com.repairline.core.model.WorkflowDefinition;
import com.repairline.core.repository.ExecutionRepository;
import com.repairline.core.repository.WorkflowDefinitionRepository;
import com.repairline.engine.agent.Agent;
import com.repairline.engine.agent.AgentException;
import com.repairline.engine.agent.AgentRegistry;
import com.repairline.engine.agent.AgentRequest;
import com.repairline.engine.agent.AgentSelector;
import com.repairline.engine.concurrent.TrackedCall;
import com.repairline.engine.hooks.HookRunner;
import com.repairline.engine.logging.LoggingContext;
import com.repairline.engine.metrics.EngineMetrics;
import com.repairline.engine.service.OrchestrationService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.UnaryOperator;

/**
 * Drives workflow executions over the task DAG.
 *
 * One thread drives each execution: it dispatches ready tasks, collects their
 * results and applies the failure policy. Every change to the execution is a
 * versioned update re-read from the repository, so a cancel or pause issued by
 * another thread is never overwritten and is observed on the next round.
 */
public class OrchestrationCoordinator implements OrchestrationService {

    private static final Logger log = LoggerFactory.getLogger(OrchestrationCoordinator.class);

    private static final int MAX_UPDATE_ATTEMPTS = 10;

    private static final Duration STOP_GRACE = Duration.ofSeconds(1);

    public static final String TASK_TIMEOUT = "TASK_TIMEOUT";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
    public static final String CANCELLED = "CANCELLED";

    private final WorkflowDefinitionRepository workflowRepository;
    private final ExecutionRepository executionRepository;
    private final AgentRegistry registry;
    private final AgentSelector selector;
    private final HookRunner hooks;
    private final EngineSettings settings;
    private final EngineMetrics metrics;
    private final Clock clock;
    private final WorkflowGraphValidator validator = new WorkflowGraphValidator();

    private final ExecutorService taskExecutor;
    private final ExecutorService agentExecutor;

    // Executions driven by a thread of this process; guarded by itself.
    private final Set<String> activeRuns = new HashSet<>();

    // Task runners and agent calls still running in this process, counted per "executionId/taskId".
    private final Map<String, Integer> liveInvocations = new ConcurrentHashMap<>();

    public OrchestrationCoordinator(
            WorkflowDefinitionRepository workflowRepository,
            ExecutionRepository executionRepository,
            AgentRegistry registry,
            HookRunner hooks,
            EngineSettings settings,
            EngineMetrics metrics,
            Clock clock) {
        this(workflowRepository, executionRepository, registry,
            new AgentSelector(registry, settings.defaultStrategy()), hooks, settings, metrics, clock);
    }

    public OrchestrationCoordinator(
            WorkflowDefinitionRepository workflowRepository,
            ExecutionRepository executionRepository,
            AgentRegistry registry,
            AgentSelector selector,
            HookRunner hooks,
            EngineSettings settings,
            EngineMetrics metrics,
            Clock clock) {
        this.workflowRepository = workflowRepository;
        this.executionRepository = executionRepository;
        this.registry = registry;
        this.selector = selector;
        this.hooks = hooks;
        this.settings = settings;
        this.metrics = metrics;
        this.clock = clock;
        this.taskExecutor = Executors.newCachedThreadPool(namedThreads("task-runner"));
        this.agentExecutor = Executors.newCachedThreadPool(namedThreads("agent-call"));
    }

    // ========== Workflow Definitions ==========

    @Override
    public WorkflowDefinition createWorkflow(WorkflowDefinition definition) {
        validator.validate(definition);

        String id = definition.id() != null && !definition.id().isBlank()
            ? definition.id()
            : "workflow_" + UUID.randomUUID();
        WorkflowDefinition stored = workflowRepository.save(definition.withIdentity(id, now()));

        log.info("Created workflow {} ({}) with {} tasks", stored.id(), stored.name(), stored.tasks().size());
        return stored;
    }

    @Override
    public WorkflowDefinition getWorkflow(String workflowId) {
        return workflowRepository.findById(workflowId)
            .orElseThrow(() -> new NotFoundException("Workflow", workflowId));
    }

    @Override
    public List<WorkflowDefinition> listWorkflows() {
        return workflowRepository.findAll();
    }

    @Override
    public boolean deleteWorkflow(String workflowId) {
        boolean deleted = workflowRepository.delete(workflowId);
        if (deleted) {
            log.info("Deleted workflow {}", workflowId);
        }
        return deleted;
    }

    // ========== Executions ==========

    @Override
    public Execution executeWorkflow(String workflowId, JsonNode input) {
        return executeWorkflow(ExecuteRequest.of(workflowId, input));
    }

    @Override
    public Execution executeWorkflow(ExecuteRequest request) {
        WorkflowDefinition workflow = getWorkflow(request.workflowId());

        if (request.executionId() != null) {
            Optional<Execution> existing = executionRepository.findById(request.executionId());
            if (existing.isPresent()) {
                return resumeExisting(existing.get(), workflow);
            }
        }

        String executionId = request.executionId() != null
            ? request.executionId()
            : "exec_" + UUID.randomUUID();
        Execution created = Execution.create(executionId, workflow, request.tenantId(), request.input(), now());

        if (!executionRepository.insert(created)) {
            // Lost a creation race for a caller-chosen id.
            return resumeExisting(requireExecution(executionId), workflow);
        }

        try (LoggingContext ctx = LoggingContext.forExecution(executionId, workflow.id(), request.tenantId())) {
            log.info("Starting execution of workflow {} ({})", workflow.id(), workflow.name());
        }
        metrics.executionStarted(workflow.name());

        Execution running = mutate(executionId, e -> e.transitionTo(ExecutionStatus.RUNNING, now()));
        hooks.executionStarted(running);
        return run(executionId, workflow, false);
    }

    @Override
    public Execution getExecution(String executionId) {
        return requireExecution(executionId);
    }

    @Override
    public List<Execution> listExecutions(String workflowId) {
        return executionRepository.findByWorkflowId(workflowId);
    }

    /**
     * Executions currently in the given status, for monitoring.
     */
    public List<Execution> listExecutionsByStatus(ExecutionStatus status, int limit) {
        return executionRepository.findByStatus(status, limit);
    }

    @Override
    public Execution cancelExecution(String executionId) {
        Execution cancelled;
        boolean driven;
        synchronized (activeRuns) {
            cancelled = mutate(executionId, e -> e.transitionTo(ExecutionStatus.CANCELLED, now()));
            driven = activeRuns.contains(executionId);
        }
        log.info("Cancelled execution {}", executionId);

        if (!driven) {
            // No local thread will observe the cancel, so report the outcome here.
            finish(cancelled);
        }
        return cancelled;
    }

    @Override
    public Execution pauseExecution(String executionId) {
        Execution paused = mutate(executionId, e -> e.transitionTo(ExecutionStatus.PAUSED, now()));
        log.info("Paused execution {}", executionId);
        return paused;
    }

    @Override
    public Execution resumeExecution(String executionId) {
        Execution current = requireExecution(executionId);
        if (current.status() != ExecutionStatus.PAUSED) {
            throw new InvalidStateTransitionException(current.status(), ExecutionStatus.RUNNING);
        }
        WorkflowDefinition workflow = getWorkflow(current.workflowId());

        Execution resumed;
        boolean driven;
        synchronized (activeRuns) {
            resumed = mutate(executionId, e -> e.transitionTo(ExecutionStatus.RUNNING, now()));
            driven = activeRuns.contains(executionId);
        }
        log.info("Resumed execution {}", executionId);

        if (driven) {
            // The thread still draining the paused execution picks the change up.
            return resumed;
        }
        return run(executionId, workflow, true);
    }

    @Override
    public TaskResult invokeCapability(String capability, JsonNode input, String tenantId) {
        TaskDefinition task = TaskDefinition.builder("invoke")
            .name(capability)
            .capability(capability)
            .input(input)
            .build();

        ObjectNode composed = JsonNodeFactory.instance.objectNode();
        composed.set("workflow", JsonNodeFactory.instance.objectNode());
        composed.set("task", input);
        composed.putObject("dependencies");

        String invocationId = "invoke_" + UUID.randomUUID();
        return runTask(invocationId, null, tenantId, task, composed);
    }

    public void shutdown() {
        taskExecutor.shutdownNow();
        agentExecutor.shutdownNow();
    }

    // ========== Execution Loop ==========

    private Execution resumeExisting(Execution existing, WorkflowDefinition workflow) {
        if (!existing.workflowId().equals(workflow.id())) {
            throw WorkflowValidationException.invalidField("executionId",
                "belongs to workflow " + existing.workflowId());
        }
        if (existing.isTerminal() || existing.status() == ExecutionStatus.PAUSED) {
            return existing;
        }

        log.info("Resuming execution {} in status {}", existing.id(), existing.status());
        if (existing.status() == ExecutionStatus.PENDING) {
            Execution running = mutate(existing.id(), e -> e.transitionTo(ExecutionStatus.RUNNING, now()));
            hooks.executionStarted(running);
        }
        return run(existing.id(), workflow, true);
    }

    private Execution run(String executionId, WorkflowDefinition workflow, boolean resumed) {
        synchronized (activeRuns) {
            if (!activeRuns.add(executionId)) {
                throw new ResourceBusyException(executionId, "execution is already running");
            }
        }
        try {
            Execution execution = requireExecution(executionId);
            try (LoggingContext ctx = LoggingContext.forExecution(executionId, workflow.id(), execution.tenantId())) {
                if (resumed) {
                    List<String> stillRunning = execution.currentTasks().stream()
                        .filter(taskId -> isLive(executionId, taskId))
                        .toList();
                    if (!stillRunning.isEmpty()) {
                        throw new ResourceBusyException(executionId,
                            "tasks " + stillRunning + " are still running in this worker");
                    }
                    // Tasks marked in flight by an earlier driver are dispatched again.
                    mutate(executionId, e -> e.currentTasks().isEmpty() ? e : e.withCurrentTasksCleared());
                }
                return drive(executionId, workflow);
            }
        } finally {
            synchronized (activeRuns) {
                activeRuns.remove(executionId);
            }
        }
    }

    private Execution drive(String executionId, WorkflowDefinition workflow) {
        Map<String, String> mdc = LoggingContext.capture();
        BlockingQueue<TrackedCall<TaskResult>> finished = new LinkedBlockingQueue<>();
        Map<TrackedCall<TaskResult>, TaskDefinition> inFlight = new LinkedHashMap<>();
        Instant deadline = null;

        while (true) {
            Execution current = requireExecution(executionId);
            if (deadline == null && workflow.timeout() != null) {
                deadline = current.startTime().plus(workflow.timeout());
            }

            if (current.allowsDispatch()) {
                if (deadline != null && now().isAfter(deadline)) {
                    log.warn("Execution {} exceeded its timeout of {}", executionId, workflow.timeout());
                    current = mutate(executionId, e -> e.isTerminal() ? e : fail(e, "Workflow timed out"));
                } else {
                    if (workflow.failurePolicy() == FailurePolicy.CONTINUE) {
                        current = recordBlockedTasks(executionId, workflow);
                    }
                    current = dispatchReadyTasks(current, workflow, inFlight, finished, mdc);
                }
            }

            if (inFlight.isEmpty()) {
                Execution latest;
                synchronized (activeRuns) {
                    latest = requireExecution(executionId);
                    if (latest.allowsDispatch() && hasDispatchableTask(latest, workflow)) {
                        continue;
                    }
                    if (latest.allowsDispatch()) {
                        latest = mutate(executionId, e -> e.allowsDispatch() ? settle(e) : e);
                    }
                    activeRuns.remove(executionId);
                }
                if (latest.isTerminal()) {
                    finish(latest);
                } else {
                    log.info("Execution {} halted in status {}", executionId, latest.status());
                }
                return latest;
            }

            TrackedCall<TaskResult> done;
            try {
                done = finished.poll(settings.pollInterval().toMillis(), TimeUnit.MILLISECONDS);
            } catch (InterruptedException e) {
                log.warn("Interrupted while driving execution {}; stopping {} in-flight task(s)",
                    executionId, inFlight.size());
                stopInFlight(executionId, workflow, inFlight);
                Thread.currentThread().interrupt();
                log.info("Execution {} can be resumed by id", executionId);
                return requireExecution(executionId);
            }
            if (done != null) {
                TaskDefinition task = inFlight.remove(done);
                recordResult(executionId, workflow, task, collect(done, task));
            }
        }
    }

    private Execution dispatchReadyTasks(
            Execution current,
            WorkflowDefinition workflow,
            Map<TrackedCall<TaskResult>, TaskDefinition> inFlight,
            BlockingQueue<TrackedCall<TaskResult>> finished,
            Map<String, String> mdc) {
        int cap = settings.concurrencyCap();

        for (TaskDefinition task : workflow.tasks()) {
            if (inFlight.size() >= cap || !current.allowsDispatch()) {
                break;
            }
            if (!isReady(current, task) || inFlight.containsValue(task)) {
                continue;
            }
            if (task.dependencyType() == DependencyType.SEQUENTIAL && blockedBySibling(task, inFlight)) {
                continue;
            }

            String taskId = task.id();
            current = mutate(current.id(), e -> e.allowsDispatch() ? e.withTaskStarted(taskId) : e);
            if (!current.currentTasks().contains(taskId)) {
                break;
            }

            Execution snapshot = current;
            JsonNode input = composeInput(snapshot, task);
            String liveKey = liveKey(snapshot.id(), taskId);
            markLive(liveKey);
            TrackedCall<TaskResult> runner = TrackedCall.submit(taskExecutor, () -> {
                try (LoggingContext ctx = LoggingContext.restore(mdc)) {
                    return runTask(snapshot.id(), snapshot.workflowId(), snapshot.tenantId(), task, input);
                }
            });
            runner.outcome().whenComplete((result, error) -> {
                markExited(liveKey);
                finished.add(runner);
            });
            inFlight.put(runner, task);

            log.debug("Dispatched task {} ({} in flight)", taskId, inFlight.size());
            hooks.taskStarted(snapshot, task);
        }
        return current;
    }

    private boolean hasDispatchableTask(Execution execution, WorkflowDefinition workflow) {
        return workflow.tasks().stream().anyMatch(t -> isReady(execution, t));
    }

    private static boolean isReady(Execution execution, TaskDefinition task) {
        return !execution.isStarted(task.id())
            && execution.completedTasks().containsAll(task.dependencies());
    }

    private static boolean blockedBySibling(TaskDefinition task, Map<TrackedCall<TaskResult>, TaskDefinition> inFlight) {
        return inFlight.values().stream()
            .anyMatch(other -> other.dependencyType() == DependencyType.SEQUENTIAL
                && task.sharesPredecessorWith(other));
    }

    /**
     * Record a failed result for every unstarted task with a failed dependency,
     * repeating until no new task is blocked.
     */
    private Execution recordBlockedTasks(String executionId, WorkflowDefinition workflow) {
        Execution current = requireExecution(executionId);
        boolean changed = true;
        while (changed && current.allowsDispatch()) {
            changed = false;
            for (TaskDefinition task : workflow.tasks()) {
                if (current.isStarted(task.id())) {
                    continue;
                }
                Optional<String> failedDependency = task.dependencies().stream()
                    .filter(current.failedTasks()::contains)
                    .findFirst();
                if (failedDependency.isPresent()) {
                    TaskResult blocked = TaskResult.dependencyFailed(task.id(), failedDependency.get(), now());
                    current = mutate(executionId, e -> e.isStarted(task.id()) ? e : e.withTaskResult(blocked));
                    log.info("Task {} skipped: dependency {} failed", task.id(), failedDependency.get());
                    hooks.taskFinished(current, blocked);
                    changed = true;
                }
            }
        }
        return current;
    }

    private void recordResult(String executionId, WorkflowDefinition workflow, TaskDefinition task, TaskResult result) {
        boolean failFast = workflow.failurePolicy() == FailurePolicy.FAIL_FAST;

        Execution updated = mutate(executionId, e -> {
            Execution next = e.withTaskResult(result);
            if (!result.isSuccess() && failFast && !next.isTerminal()) {
                return fail(next, "Task " + task.id() + " failed: " + result.error());
            }
            return next;
        });

        if (result.isSuccess()) {
            log.info("Task {} completed in {}ms after {} attempt(s)", task.id(), result.durationMs(), result.attempts());
        } else {
            log.warn("Task {} failed after {} attempt(s): [{}] {}",
                task.id(), result.attempts(), result.errorCode(), result.error());
        }
        hooks.taskFinished(updated, result);
    }

    private TaskResult collect(TrackedCall<TaskResult> done, TaskDefinition task) {
        try {
            return done.outcome().join();
        } catch (CancellationException e) {
            Instant now = now();
            return TaskResult.failed(task.id(), CANCELLED, "Interrupted", now, now, 0, null);
        } catch (CompletionException e) {
            log.error("Task {} crashed", task.id(), e.getCause());
            Instant now = now();
            return TaskResult.failed(task.id(), INTERNAL_ERROR, String.valueOf(e.getCause()), now, now, 0, null);
        }
    }

    /**
     * Interrupt the in-flight tasks and wait for each to stop. A task that finished with
     * a real outcome meanwhile is recorded; one that was cut short keeps its in-flight
     * marker and is dispatched again when the execution is resumed.
     */
    private void stopInFlight(String executionId, WorkflowDefinition workflow,
                              Map<TrackedCall<TaskResult>, TaskDefinition> inFlight) {
        inFlight.keySet().forEach(TrackedCall::cancel);
        for (Map.Entry<TrackedCall<TaskResult>, TaskDefinition> entry : inFlight.entrySet()) {
            TaskDefinition task = entry.getValue();
            if (!entry.getKey().awaitExit(timeoutOf(task).plus(STOP_GRACE))) {
                log.warn("Task {} did not stop after cancellation", task.id());
                continue;
            }
            TaskResult result = collect(entry.getKey(), task);
            if (!CANCELLED.equals(result.errorCode())) {
                recordResult(executionId, workflow, task, result);
            }
        }
        inFlight.clear();
    }

    /**
     * Final status once nothing is in flight and nothing more can be dispatched.
     */
    private Execution settle(Execution execution) {
        ObjectNode output = JsonNodeFactory.instance.objectNode();
        for (TaskResult result : execution.taskResults()) {
            if (result.isSuccess()) {
                output.set(result.taskId(), result.output());
            }
        }

        if (!execution.completedTasks().isEmpty()) {
            return execution.transitionTo(ExecutionStatus.COMPLETED, now()).toBuilder()
                .output(output)
                .build();
        }
        return fail(execution, "No task completed; " + execution.failedTasks().size() + " task(s) failed")
            .toBuilder()
            .output(output)
            .build();
    }

    private Execution fail(Execution execution, String error) {
        return execution.transitionTo(ExecutionStatus.FAILED, now()).toBuilder()
            .error(error)
            .build();
    }

    private void finish(Execution execution) {
        Instant end = execution.endTime() != null ? execution.endTime() : now();
        metrics.executionFinished(execution.workflowName(), execution.status().name().toLowerCase(),
            Duration.between(execution.startTime(), end));
        log.info("Execution {} finished with status {} ({} completed, {} failed)",
            execution.id(), execution.status(), execution.completedTasks().size(), execution.failedTasks().size());
        hooks.executionFinished(execution);
    }

    // ========== Task Execution ==========

    private TaskResult runTask(String executionId, String workflowId, String tenantId,
                               TaskDefinition task, JsonNode input) {
        RetryPolicy policy = task.retryPolicy() != null ? task.retryPolicy() : settings.defaultRetryPolicy();
        Duration timeout = timeoutOf(task);
        String metricName = task.capability() != null ? task.capability() : task.agentId();
        Instant start = now();
        String agentId = null;
        int attempt = 0;

        while (true) {
            attempt++;
            Duration backoff;
            String errorCode;
            String error;
            boolean retryable;

            try (LoggingContext ctx = LoggingContext.forTask(executionId, task.id(), attempt)) {
                try {
                    AgentDescriptor descriptor = selector.select(task);
                    agentId = descriptor.id();
                    try (AgentRegistry.Reservation reservation = registry.reserve(agentId)) {
                        AgentRequest request = new AgentRequest(
                            executionId, workflowId, task.id(), task.capability(), input, attempt, tenantId);
                        JsonNode output = invoke(reservation.agent(), request, timeout);
                        TaskResult result = TaskResult.completed(task.id(), output, start, now(), attempt, agentId);
                        metrics.taskFinished(metricName, true, result.durationMs());
                        return result;
                    }
                } catch (AgentUnavailableException e) {
                    errorCode = e.getErrorCode();
                    error = e.getMessage();
                    retryable = true;
                } catch (AgentException e) {
                    errorCode = e.getErrorCode() != null ? e.getErrorCode() : INTERNAL_ERROR;
                    error = e.getMessage();
                    retryable = e.isRetryable();
                } catch (TimeoutException e) {
                    errorCode = TASK_TIMEOUT;
                    error = "Task timed out after " + timeout.toMillis() + "ms";
                    retryable = true;
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                    return TaskResult.failed(task.id(), CANCELLED, "Interrupted", start, now(), attempt, agentId);
                } catch (RuntimeException e) {
                    log.error("Agent invocation for task {} threw unexpectedly", task.id(), e);
                    errorCode = INTERNAL_ERROR;
                    error = e.getMessage();
                    retryable = true;
                }

                boolean willRetry = retryable && policy.shouldRetry(errorCode) && policy.hasMoreAttempts(attempt);
                if (willRetry && isHalted(executionId)) {
                    return TaskResult.failed(task.id(), CANCELLED,
                        "Execution stopped before retry; last error: " + error, start, now(), attempt, agentId);
                }
                if (!willRetry) {
                    metrics.taskFailed(metricName, errorCode);
                    metrics.taskFinished(metricName, false, Duration.between(start, now()).toMillis());
                    return TaskResult.failed(task.id(), errorCode, error, start, now(), attempt, agentId);
                }

                backoff = policy.computeBackoff(attempt);
                metrics.taskRetried(metricName, errorCode);
                log.info("Task {} attempt {} failed with {}; retrying in {}ms",
                    task.id(), attempt, errorCode, backoff.toMillis());
            }

            try {
                Thread.sleep(backoff.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                return TaskResult.failed(task.id(), CANCELLED, "Interrupted", start, now(), attempt, agentId);
            }
        }
    }

    private JsonNode invoke(Agent agent, AgentRequest request, Duration timeout)
            throws AgentException, TimeoutException, InterruptedException {
        Map<String, String> mdc = LoggingContext.capture();
        String liveKey = liveKey(request.executionId(), request.taskId());
        markLive(liveKey);
        TrackedCall<JsonNode> call = TrackedCall.submit(agentExecutor, () -> {
            try (LoggingContext ctx = LoggingContext.restore(mdc)) {
                return agent.invoke(request);
            }
        });
        call.outcome().whenComplete((output, error) -> markExited(liveKey));
        try {
            return call.get(timeout);
        } catch (TimeoutException e) {
            call.cancel();
            throw e;
        } catch (InterruptedException e) {
            // Do not hand the task back while the agent may still be working on it.
            call.cancel();
            if (!call.awaitExit(timeout)) {
                log.warn("Agent call for task {} kept running after cancellation", request.taskId());
            }
            if (call.hasReturned()) {
                Thread.currentThread().interrupt();
                return call.outcome().join();
            }
            throw e;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof AgentException agentException) {
                throw agentException;
            }
            if (cause instanceof RuntimeException runtimeException) {
                throw runtimeException;
            }
            throw new AgentException(INTERNAL_ERROR, String.valueOf(cause), cause, true);
        }
    }

    private Duration timeoutOf(TaskDefinition task) {
        return task.timeout() != null ? task.timeout() : settings.defaultTaskTimeout();
    }

    private boolean isHalted(String executionId) {
        return executionRepository.findById(executionId)
            .map(Execution::isTerminal)
            .orElse(false);
    }

    private static JsonNode composeInput(Execution execution, TaskDefinition task) {
        ObjectNode composed = JsonNodeFactory.instance.objectNode();
        composed.set("workflow", execution.input());
        composed.set("task", task.input());
        ObjectNode dependencies = composed.putObject("dependencies");
        for (String dependency : task.dependencies()) {
            execution.taskResult(dependency)
                .filter(TaskResult::isSuccess)
                .ifPresent(r -> dependencies.set(dependency, r.output()));
        }
        return composed;
    }

    // ========== Internal Methods ==========

    private static String liveKey(String executionId, String taskId) {
        return executionId + "/" + taskId;
    }

    private void markLive(String key) {
        liveInvocations.merge(key, 1, Integer::sum);
    }

    private void markExited(String key) {
        liveInvocations.computeIfPresent(key, (k, count) -> count <= 1 ? null : count - 1);
    }

    /**
     * Whether a runner or agent call for the task is still running in this process.
     */
    boolean isLive(String executionId, String taskId) {
        return liveInvocations.containsKey(liveKey(executionId, taskId));
    }

    private Execution requireExecution(String executionId) {
        return executionRepository.findById(executionId)
            .orElseThrow(() -> new NotFoundException("Execution", executionId));
    }

    /**
     * Apply a change to the latest stored execution, retrying on concurrent updates.
     * A change returning its argument unchanged writes nothing.
     */
    private Execution mutate(String executionId, UnaryOperator<Execution> change) {
        for (int attempt = 1; ; attempt++) {
            Execution current = requireExecution(executionId);
            Execution updated = change.apply(current);
            if (updated == current) {
                return current;
            }
            try {
                return executionRepository.update(updated, current.version());
            } catch (OptimisticLockException e) {
                if (attempt >= MAX_UPDATE_ATTEMPTS) {
                    throw e;
                }
                log.debug("Concurrent update of execution {}, retrying", executionId);
            }
        }
    }

    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static ThreadFactory namedThreads(String prefix) {
        AtomicInteger counter = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
