package com.repairline.engine.checkpoint;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.repairline.core.model.Checkpoint;
import com.repairline.core.test.MutableClock;
import com.repairline.engine.persistence.InMemoryCheckpointRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CheckpointManagerTest {

    private CheckpointManager checkpoints;

    @BeforeEach
    void setUp() {
        checkpoints = new CheckpointManager(
            new InMemoryCheckpointRepository(), MutableClock.at(Instant.parse("2026-03-01T10:00:00Z")));
    }

    @Test
    @DisplayName("Nothing is loaded before the first save")
    void emptyBeforeFirstSave() {
        assertThat(checkpoints.load("exec-1")).isEmpty();
        assertThat(checkpoints.nextSequence("exec-1")).isZero();
    }

    @Test
    @DisplayName("Load returns the state with the highest sequence, regardless of save order")
    void loadReturnsHighestSequence() {
        checkpoints.save("exec-1", 2, state("step", 2));
        checkpoints.save("exec-1", 5, state("step", 5));
        checkpoints.save("exec-1", 3, state("step", 3));

        assertThat(checkpoints.load("exec-1")).get()
            .extracting(n -> n.get("step").asInt()).isEqualTo(5);
        assertThat(checkpoints.nextSequence("exec-1")).isEqualTo(6);
        assertThat(checkpoints.history("exec-1")).extracting(Checkpoint::sequence).containsExactly(2L, 3L, 5L);
    }

    @Test
    @DisplayName("Saving an existing sequence replaces its state")
    void saveSameSequenceReplaces() {
        checkpoints.save("exec-2", 1, state("value", 1));
        checkpoints.save("exec-2", 1, state("value", 9));

        assertThat(checkpoints.history("exec-2")).hasSize(1);
        assertThat(checkpoints.load("exec-2").orElseThrow().get("value").asInt()).isEqualTo(9);
    }

    @Test
    @DisplayName("Checkpoints of different executions are independent")
    void executionsAreIsolated() {
        checkpoints.save("exec-a", 1, state("owner", 1));

        assertThat(checkpoints.load("exec-b")).isEmpty();
        assertThat(checkpoints.delete("exec-a")).isEqualTo(1);
        assertThat(checkpoints.load("exec-a")).isEmpty();
    }

    @Test
    @DisplayName("Negative sequences are rejected")
    void negativeSequenceRejected() {
        assertThatThrownBy(() -> checkpoints.save("exec-3", -1, state("x", 0)))
            .isInstanceOf(IllegalArgumentException.class);
    }

    private static ObjectNode state(String field, int value) {
        return JsonNodeFactory.instance.objectNode().put(field, value);
    }
}
