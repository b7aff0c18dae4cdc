package com.repairline.core.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class ExecutionStatusTest {

    @Test
    void isTerminal_shouldIdentifyTerminalStates() {
        assertTrue(ExecutionStatus.COMPLETED.isTerminal());
        assertTrue(ExecutionStatus.FAILED.isTerminal());
        assertTrue(ExecutionStatus.CANCELLED.isTerminal());

        assertFalse(ExecutionStatus.PENDING.isTerminal());
        assertFalse(ExecutionStatus.RUNNING.isTerminal());
        assertFalse(ExecutionStatus.PAUSED.isTerminal());
    }

    @Test
    void canTransitionTo_fromPending_shouldOnlyAllowRunning() {
        assertTrue(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.RUNNING));

        assertFalse(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.CANCELLED));
        assertFalse(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.PAUSED));

        assertFalse(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.COMPLETED));
        assertFalse(ExecutionStatus.PENDING.canTransitionTo(ExecutionStatus.FAILED));
    }

    @Test
    void canTransitionTo_fromRunning_shouldAllowAllOutcomes() {
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.COMPLETED));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.FAILED));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.CANCELLED));
        assertTrue(ExecutionStatus.RUNNING.canTransitionTo(ExecutionStatus.PAUSED));
    }

    @Test
    void canTransitionTo_fromTerminal_shouldAllowNothing() {
        for (ExecutionStatus terminal : new ExecutionStatus[]{
                ExecutionStatus.COMPLETED, ExecutionStatus.FAILED, ExecutionStatus.CANCELLED}) {
            for (ExecutionStatus target : ExecutionStatus.values()) {
                assertFalse(terminal.canTransitionTo(target), terminal + " -> " + target);
            }
        }
    }
}
