package com.repairline.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.repairline.core.exception.OptimisticLockException;
import com.repairline.core.model.Checkpoint;
import com.repairline.core.model.Execution;
import com.repairline.core.model.ExecutionStatus;
import com.repairline.core.model.FailurePolicy;
import com.repairline.core.model.RetryPolicy;
import com.repairline.core.model.TaskDefinition;
import com.repairline.core.model.TaskResult;
import com.repairline.core.model.WorkflowDefinition;
import com.repairline.core.test.MutableClock;
import com.repairline.engine.checkpoint.CheckpointManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.testcontainers.junit.jupiter.Testcontainers;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Testcontainers(disabledWithoutDocker = true)
class JdbcWorkflowStoreTest extends PostgresTestSupport {

    private final Instant now = Instant.parse("2026-03-01T10:00:00Z");

    private JdbcWorkflowDefinitionRepository workflows;
    private JdbcExecutionRepository executions;
    private JdbcCheckpointRepository checkpoints;

    @BeforeEach
    void setUp() {
        workflows = new JdbcWorkflowDefinitionRepository(jdbcTemplate, objectMapper);
        executions = new JdbcExecutionRepository(jdbcTemplate, objectMapper);
        checkpoints = new JdbcCheckpointRepository(jdbcTemplate, objectMapper);
    }

    @Test
    @DisplayName("A workflow definition is stored with its full task graph")
    void workflowDefinitionRoundTrip() {
        WorkflowDefinition definition = repairWorkflow();

        workflows.save(definition);

        WorkflowDefinition loaded = workflows.findById(definition.id()).orElseThrow();
        assertThat(loaded).isEqualTo(definition);
        assertThat(loaded.getTask("diagnose").orElseThrow().retryPolicy().maxAttempts()).isEqualTo(4);
        assertThat(workflows.findAll()).hasSize(1);

        assertThat(workflows.delete(definition.id())).isTrue();
        assertThat(workflows.findById(definition.id())).isEmpty();
    }

    @Test
    @DisplayName("Execution inserts are idempotent per id")
    void executionInsertOnce() {
        Execution execution = Execution.create("exec_1", repairWorkflow(), "tenant-a", null, now);

        assertThat(executions.insert(execution)).isTrue();
        assertThat(executions.insert(execution)).isFalse();
        assertThat(executions.findById("exec_1")).get()
            .extracting(Execution::status).isEqualTo(ExecutionStatus.PENDING);
    }

    @Test
    @DisplayName("Updates are versioned and stale writers are rejected")
    void optimisticUpdate() {
        Execution created = Execution.create("exec_2", repairWorkflow(), "tenant-a", null, now);
        executions.insert(created);

        Execution running = created.transitionTo(ExecutionStatus.RUNNING, now)
            .withTaskResult(TaskResult.completed("intake",
                JsonNodeFactory.instance.objectNode().put("device", "tablet"),
                now, now.plusMillis(250), 1, "agent_1"));
        executions.update(running, created.version());

        Execution stale = created.transitionTo(ExecutionStatus.RUNNING, now);
        assertThatThrownBy(() -> executions.update(stale, created.version()))
            .isInstanceOf(OptimisticLockException.class);

        Execution loaded = executions.findById("exec_2").orElseThrow();
        assertThat(loaded.status()).isEqualTo(ExecutionStatus.RUNNING);
        assertThat(loaded.version()).isEqualTo(running.version());
        assertThat(loaded.completedTasks()).containsExactly("intake");
        assertThat(loaded.taskResult("intake").orElseThrow().output().get("device").asText()).isEqualTo("tablet");
    }

    @Test
    @DisplayName("Executions are listed by workflow newest first and by status oldest first")
    void executionQueries() {
        WorkflowDefinition workflow = repairWorkflow();
        executions.insert(Execution.create("exec_old", workflow, null, null, now));
        executions.insert(Execution.create("exec_new", workflow, null, null, now.plusSeconds(60)));

        assertThat(executions.findByWorkflowId(workflow.id()))
            .extracting(Execution::id).containsExactly("exec_new", "exec_old");
        assertThat(executions.findByStatus(ExecutionStatus.PENDING, 1))
            .extracting(Execution::id).containsExactly("exec_old");
        assertThat(executions.findByStatus(ExecutionStatus.RUNNING, 10)).isEmpty();
    }

    @Test
    @DisplayName("Checkpoints replace state per sequence and load the latest")
    void checkpoints() {
        CheckpointManager manager = new CheckpointManager(checkpoints, MutableClock.at(now));
        ObjectNode first = JsonNodeFactory.instance.objectNode().put("step", 1);
        ObjectNode replaced = JsonNodeFactory.instance.objectNode().put("step", 11);
        ObjectNode second = JsonNodeFactory.instance.objectNode().put("step", 2);

        manager.save("exec_3", 1, first);
        manager.save("exec_3", 1, replaced);
        manager.save("exec_3", 2, second);

        assertThat(manager.load("exec_3")).contains(second);
        assertThat(manager.history("exec_3")).extracting(Checkpoint::state).containsExactly(replaced, second);
        assertThat(manager.delete("exec_3")).isEqualTo(2);
        assertThat(manager.load("exec_3")).isEmpty();
    }

    private WorkflowDefinition repairWorkflow() {
        return WorkflowDefinition.builder("repair")
            .description("Diagnose and quote a device repair")
            .timeout(Duration.ofMinutes(10))
            .failurePolicy(FailurePolicy.CONTINUE)
            .tags(Map.of("team", "bench"))
            .task(TaskDefinition.builder("intake").capability("intake").build())
            .task(TaskDefinition.builder("diagnose").capability("diagnose")
                .dependsOn("intake")
                .input(JsonNodeFactory.instance.objectNode().put("depth", "full"))
                .timeout(Duration.ofSeconds(30))
                .retryPolicy(RetryPolicy.fixed(4, Duration.ofSeconds(2)))
                .build())
            .task(TaskDefinition.builder("quote").capability("quote").dependsOn("diagnose").parallel().build())
            .build()
            .withIdentity("workflow_repair", now);
    }
}
