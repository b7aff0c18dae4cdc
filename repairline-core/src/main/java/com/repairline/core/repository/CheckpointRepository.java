package com.repairline.core.repository;

import com.repairline.core.model.Checkpoint;

import java.util.List;
import java.util.Optional;

/**
 * Repository for execution checkpoints.
 */
public interface CheckpointRepository {

    /**
     * Insert, or replace the state stored under the same (executionId, sequence).
     */
    Checkpoint save(Checkpoint checkpoint);

    /**
     * Checkpoint with the highest sequence.
     */
    Optional<Checkpoint> findLatest(String executionId);

    /**
     * All checkpoints, ascending by sequence.
     */
    List<Checkpoint> findAll(String executionId);

    int deleteByExecutionId(String executionId);
}
