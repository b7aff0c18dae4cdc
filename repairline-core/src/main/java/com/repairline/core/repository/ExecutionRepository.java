package com.repairline.core.repository;

import com.repairline.core.model.Execution;
import com.repairline.core.model.ExecutionStatus;

import java.util.List;
import java.util.Optional;

/**
 * Repository for workflow executions.
 */
public interface ExecutionRepository {

    /**
     * Insert a new execution.
     *
     * @return false if an execution with the same id already exists
     */
    boolean insert(Execution execution);

    /**
     * Replace the stored execution if its version still equals {@code expectedVersion}.
     *
     * @throws com.repairline.core.exception.OptimisticLockException on a version mismatch
     */
    Execution update(Execution execution, long expectedVersion);

    Optional<Execution> findById(String id);

    List<Execution> findByWorkflowId(String workflowId);

    List<Execution> findByStatus(ExecutionStatus status, int limit);
}
