package com.repairline.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.repairline.core.model.Checkpoint;

import java.util.Optional;

/**
 * Durable progress snapshots for resuming long-running work after a crash.
 */
public interface CheckpointService {

    Checkpoint save(String executionId, long sequence, JsonNode state);

    /**
     * State of the highest sequence recorded.
     */
    Optional<JsonNode> load(String executionId);

    Optional<Checkpoint> loadLatest(String executionId);

    /**
     * One past the highest recorded sequence, or 0 when nothing was saved.
     */
    long nextSequence(String executionId);

    int delete(String executionId);
}
