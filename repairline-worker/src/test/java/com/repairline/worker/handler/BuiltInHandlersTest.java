package com.repairline.worker.handler;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.repairline.core.exception.AgentUnavailableException;
import com.repairline.core.exception.NotFoundException;
import com.repairline.core.exception.ResourceBusyException;
import com.repairline.core.model.AgentDescriptor;
import com.repairline.core.model.Execution;
import com.repairline.core.model.ExecutionStatus;
import com.repairline.core.model.LoadBalancingStrategy;
import com.repairline.core.model.RetryPolicy;
import com.repairline.core.model.TaskDefinition;
import com.repairline.core.model.WorkflowDefinition;
import com.repairline.engine.agent.Agent;
import com.repairline.engine.agent.AgentException;
import com.repairline.engine.agent.AgentRegistry;
import com.repairline.engine.coordinator.EngineSettings;
import com.repairline.engine.coordinator.OrchestrationCoordinator;
import com.repairline.engine.hooks.HookRunner;
import com.repairline.engine.metrics.EngineMetrics;
import com.repairline.engine.persistence.InMemoryExecutionRepository;
import com.repairline.engine.persistence.InMemoryWorkflowDefinitionRepository;
import com.repairline.worker.ProcessingResult;
import com.repairline.worker.ProcessingStatus;
import com.repairline.worker.WorkerFixture;
import com.repairline.worker.WorkerProcessor;
import com.repairline.worker.job.JobException;
import com.repairline.worker.job.WorkerJob;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class BuiltInHandlersTest {

    private WorkerFixture fixture;
    private AgentRegistry registry;
    private OrchestrationCoordinator coordinator;
    private final AtomicInteger diagnoseCalls = new AtomicInteger();

    @BeforeEach
    void setUp() {
        fixture = new WorkerFixture(Clock.systemUTC(), WorkerFixture.settings());
        registry = new AgentRegistry();
        EngineSettings settings = new EngineSettings(
            Duration.ofSeconds(5), 10, RetryPolicy.noRetry(),
            LoadBalancingStrategy.ROUND_ROBIN, true, Duration.ofMillis(10));
        coordinator = new OrchestrationCoordinator(
            new InMemoryWorkflowDefinitionRepository(), new InMemoryExecutionRepository(),
            registry, new HookRunner(), settings, EngineMetrics.noop(), Clock.systemUTC());
        BuiltInHandlers.register(fixture.processor, coordinator, Clock.systemUTC());

        registry.register(Agent.of(AgentDescriptor.builder("diagnoser").capability("diagnose").build(),
            request -> {
                diagnoseCalls.incrementAndGet();
                return JsonNodeFactory.instance.objectNode().put("diagnosis", "worn belt");
            }));
        registry.register(Agent.of(AgentDescriptor.builder("refuser").capability("refuse").build(),
            request -> {
                throw AgentException.permanent("NO_PARTS", "part discontinued");
            }));
    }

    @AfterEach
    void tearDown() {
        coordinator.shutdown();
        fixture.close();
    }

    private WorkflowDefinition workflow(String id, String capability) {
        return coordinator.createWorkflow(WorkflowDefinition.builder("repair")
            .id(id)
            .task(TaskDefinition.builder("inspect").capability(capability).build())
            .build());
    }

    private WorkerJob executeJob(String requestId, String workflowId) {
        return WorkerJob.builder(WorkflowExecuteHandler.TYPE, "acme")
            .requestId(requestId)
            .payload(fixture.json()
                .put("workflowId", workflowId)
                .set("input", fixture.json().put("ticket", "T-1")))
            .build();
    }

    @Test
    @DisplayName("workflow:execute runs the workflow under the job's run id and redeliveries do not run it again")
    void executesWorkflowOnce() {
        workflow("repair-v1", "diagnose");
        WorkerJob job = executeJob("req-1", "repair-v1");

        ProcessingResult first = fixture.processor.process(job, "m-1");
        ProcessingResult second = fixture.processor.process(job, "m-2");

        assertThat(first.status()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(first.result().get("executionId").asText()).isEqualTo(first.runId());
        assertThat(first.result().get("status").asText()).isEqualTo("COMPLETED");
        assertThat(first.result().at("/output/inspect/diagnosis").asText()).isEqualTo("worn belt");
        assertThat(second.status()).isEqualTo(ProcessingStatus.DUPLICATE);
        assertThat(diagnoseCalls).hasValue(1);

        Execution execution = coordinator.getExecution(first.runId());
        assertThat(execution.status()).isEqualTo(ExecutionStatus.COMPLETED);
        assertThat(execution.tenantId()).isEqualTo("acme");
        assertThat(fixture.checkpoints.history(first.runId()))
            .extracting(c -> c.state().get("phase").asText())
            .containsExactly("started", "finished");
    }

    @Test
    @DisplayName("A workflow job that times out is not run again by a redelivery while its task is still running")
    void timedOutWorkflowIsNotRunTwice() throws Exception {
        CountDownLatch release = new CountDownLatch(1);
        AtomicInteger calls = new AtomicInteger();
        AtomicInteger running = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        registry.register(Agent.of(AgentDescriptor.builder("slow-inspector").capability("inspect-slow").build(),
            request -> {
                calls.incrementAndGet();
                maxConcurrent.accumulateAndGet(running.incrementAndGet(), Math::max);
                try {
                    awaitIgnoringInterrupts(release);
                } finally {
                    running.decrementAndGet();
                }
                return JsonNodeFactory.instance.objectNode().put("inspected", true);
            }));
        workflow("repair-slow", "inspect-slow");

        try (WorkerFixture fast = new WorkerFixture(Clock.systemUTC(),
                WorkerFixture.settings().withJobTimeout(Duration.ofMillis(200)))) {
            BuiltInHandlers.register(fast.processor, coordinator, Clock.systemUTC());
            WorkerJob job = executeJob("req-slow", "repair-slow");

            ProcessingResult timedOut = fast.processor.process(job, "m-1");
            ProcessingResult redelivered = fast.processor.process(job, "m-2");

            assertThat(timedOut.status()).isEqualTo(ProcessingStatus.RETRY);
            assertThat(timedOut.errorCode()).isEqualTo(WorkerProcessor.JOB_TIMEOUT);
            assertThat(redelivered.status()).isEqualTo(ProcessingStatus.RETRY);
            assertThat(redelivered.errorCode()).isEqualTo(ResourceBusyException.ERROR_CODE);
            assertThat(calls).hasValue(1);

            release.countDown();
            assertThat(WorkerFixture.awaitUntil(() -> fast.processor.lingering() == 0, Duration.ofSeconds(5))).isTrue();
            ProcessingResult resumed = fast.processor.process(job, "m-3");

            assertThat(resumed.status()).isEqualTo(ProcessingStatus.COMPLETED);
            assertThat(resumed.result().at("/output/inspect/inspected").asBoolean()).isTrue();
            assertThat(calls).hasValue(1);
            assertThat(maxConcurrent).hasValue(1);
        }
    }

    @Test
    @DisplayName("workflow:execute for an unknown workflow fails permanently")
    void unknownWorkflowIsPermanent() {
        ProcessingResult result = fixture.processor.process(executeJob("req-2", "missing"), "m-1");

        assertThat(result.status()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(result.errorCode()).isEqualTo(NotFoundException.ERROR_CODE);
    }

    @Test
    @DisplayName("workflow:execute without a workflow id is an invalid payload")
    void missingWorkflowIdIsInvalid() {
        WorkerJob job = WorkerJob.builder(WorkflowExecuteHandler.TYPE, "acme").requestId("req-3").build();

        ProcessingResult result = fixture.processor.process(job, "m-1");

        assertThat(result.status()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(result.errorCode()).isEqualTo(WorkflowExecuteHandler.INVALID_PAYLOAD);
    }

    @Test
    @DisplayName("A failed execution is recorded as a terminal job failure")
    void failedExecutionIsTerminal() {
        workflow("repair-bad", "refuse");

        ProcessingResult result = fixture.processor.process(executeJob("req-4", "repair-bad"), "m-1");

        assertThat(result.status()).isEqualTo(ProcessingStatus.FAILED);
        assertThat(result.errorCode()).isEqualTo(JobException.HANDLER_ERROR);
        assertThat(result.error()).contains("part discontinued");
    }

    @Test
    @DisplayName("capability:invoke returns the agent output")
    void invokesCapability() {
        WorkerJob job = WorkerJob.builder(CapabilityInvokeHandler.TYPE, "acme")
            .requestId("req-5")
            .payload(fixture.json().put("capability", "diagnose"))
            .build();

        ProcessingResult result = fixture.processor.process(job, "m-1");

        assertThat(result.status()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(result.result().get("diagnosis").asText()).isEqualTo("worn belt");
    }

    @Test
    @DisplayName("capability:invoke with no agent for the capability asks for redelivery")
    void missingAgentIsTransient() {
        WorkerJob job = WorkerJob.builder(CapabilityInvokeHandler.TYPE, "acme")
            .requestId("req-6")
            .payload(fixture.json().put("capability", "weld"))
            .build();

        ProcessingResult result = fixture.processor.process(job, "m-1");

        assertThat(result.status()).isEqualTo(ProcessingStatus.RETRY);
        assertThat(result.errorCode()).isEqualTo(AgentUnavailableException.ERROR_CODE);
    }

    @Test
    @DisplayName("health:check echoes tenant, payload and the lock it ran under")
    void healthCheckEchoes() {
        WorkerJob job = WorkerJob.builder(HealthCheckHandler.TYPE, "acme")
            .payload(fixture.json().put("ping", 7))
            .build();

        ProcessingResult result = fixture.processor.process(job, "msg-health");

        assertThat(result.status()).isEqualTo(ProcessingStatus.COMPLETED);
        assertThat(result.result().get("healthy").asBoolean()).isTrue();
        assertThat(result.result().get("tenantId").asText()).isEqualTo("acme");
        assertThat(result.result().at("/payload/ping").asInt()).isEqualTo(7);
        assertThat(result.result().get("timestamp").asText()).isNotBlank();
        assertThat(result.result().get("keyHash").asText()).isEqualTo(result.keyHash());
        assertThat(result.result().get("fenceToken").asLong()).isPositive();
    }

    private static void awaitIgnoringInterrupts(CountDownLatch release) {
        boolean interrupted = false;
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (release.getCount() > 0 && System.nanoTime() < deadline) {
            try {
                release.await(deadline - System.nanoTime(), TimeUnit.NANOSECONDS);
            } catch (InterruptedException e) {
                interrupted = true;
            }
        }
        if (interrupted) {
            Thread.currentThread().interrupt();
        }
    }
}
