package com.repairline.core.model;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.repairline.core.exception.InvalidStateTransitionException;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionTest {

    private static final Instant NOW = Instant.parse("2024-03-01T12:00:00Z");

    private final WorkflowDefinition workflow = WorkflowDefinition.builder("review")
        .id("workflow_1")
        .task(TaskDefinition.builder("a").capability("lint").build())
        .task(TaskDefinition.builder("b").capability("lint").dependsOn("a").build())
        .build();

    @Test
    void create_shouldStartPendingWithEmptyTaskSets() {
        Execution execution = Execution.create("exec_1", workflow, "tenant-1", null, NOW);

        assertEquals(ExecutionStatus.PENDING, execution.status());
        assertEquals("workflow_1", execution.workflowId());
        assertTrue(execution.taskResults().isEmpty());
        assertTrue(execution.currentTasks().isEmpty());
        assertEquals(0L, execution.version());
    }

    @Test
    void withTaskResult_shouldMoveTaskOutOfCurrent() {
        Execution execution = running()
            .withTaskStarted("a")
            .withTaskResult(TaskResult.completed("a", JsonNodeFactory.instance.objectNode(), NOW, NOW, 1, "agent_1"));

        assertEquals(List.of(), execution.currentTasks());
        assertEquals(List.of("a"), execution.completedTasks());
        assertEquals(1, execution.taskResults().size());
    }

    @Test
    void withTaskResult_shouldReplaceInsteadOfDuplicating() {
        Execution execution = running()
            .withTaskStarted("a")
            .withTaskResult(TaskResult.failed("a", "TIMEOUT", "timed out", NOW, NOW, 1, "agent_1"))
            .withTaskResult(TaskResult.completed("a", null, NOW, NOW, 2, "agent_1"));

        assertEquals(1, execution.taskResults().size());
        assertEquals(2, execution.taskResults().get(0).attempts());
        assertEquals(List.of("a"), execution.completedTasks());
        assertTrue(execution.failedTasks().isEmpty());
    }

    @Test
    void taskSets_shouldStayDisjoint() {
        Execution execution = running()
            .withTaskStarted("a")
            .withTaskStarted("b")
            .withTaskResult(TaskResult.completed("a", null, NOW, NOW, 1, "agent_1"))
            .withTaskResult(TaskResult.failed("b", "BOOM", "boom", NOW, NOW, 1, "agent_1"));

        Set<String> union = new HashSet<>();
        union.addAll(execution.currentTasks());
        union.addAll(execution.completedTasks());
        union.addAll(execution.failedTasks());

        assertEquals(execution.currentTasks().size() + execution.completedTasks().size()
            + execution.failedTasks().size(), union.size());
        assertTrue(workflow.taskIds().containsAll(union));
    }

    @Test
    void withTaskStarted_shouldIgnoreSettledTask() {
        Execution execution = running()
            .withTaskStarted("a")
            .withTaskResult(TaskResult.completed("a", null, NOW, NOW, 1, null));

        assertSame(execution, execution.withTaskStarted("a"));
    }

    @Test
    void transitionTo_shouldRecordEndTimeOnTerminal() {
        Instant later = NOW.plusSeconds(5);
        Execution completed = running().transitionTo(ExecutionStatus.COMPLETED, later);

        assertEquals(ExecutionStatus.COMPLETED, completed.status());
        assertEquals(later, completed.endTime());
    }

    @Test
    void transitionTo_shouldRecordCancellationTime() {
        Execution cancelled = running().transitionTo(ExecutionStatus.CANCELLED, NOW);

        assertEquals(NOW, cancelled.cancelledAt());
        assertFalse(cancelled.allowsDispatch());
    }

    @Test
    void transitionTo_fromTerminal_shouldThrow() {
        Execution failed = running().transitionTo(ExecutionStatus.FAILED, NOW);

        assertThrows(InvalidStateTransitionException.class,
            () -> failed.transitionTo(ExecutionStatus.CANCELLED, NOW));
    }

    @Test
    void everyCopy_shouldBumpVersion() {
        Execution created = Execution.create("exec_1", workflow, null, null, NOW);
        Execution started = created.transitionTo(ExecutionStatus.RUNNING, NOW);

        assertEquals(created.version() + 1, started.version());
    }

    private Execution running() {
        return Execution.create("exec_1", workflow, "tenant-1", null, NOW)
            .transitionTo(ExecutionStatus.RUNNING, NOW);
    }
}
