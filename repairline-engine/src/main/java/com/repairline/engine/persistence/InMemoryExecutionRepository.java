package com.repairline.engine.persistence;

import com.repairline.core.exception.OptimisticLockException;
import com.repairline.core.model.Execution;
import com.repairline.core.model.ExecutionStatus;
import com.repairline.core.repository.ExecutionRepository;

import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * In-memory implementation of ExecutionRepository with optimistic locking.
 */
public class InMemoryExecutionRepository implements ExecutionRepository {

    private final Map<String, Execution> executions = new ConcurrentHashMap<>();

    @Override
    public boolean insert(Execution execution) {
        return executions.putIfAbsent(execution.id(), execution) == null;
    }

    @Override
    public Execution update(Execution execution, long expectedVersion) {
        synchronized (executions) {
            Execution existing = executions.get(execution.id());
            if (existing == null || existing.version() != expectedVersion) {
                throw new OptimisticLockException("Execution", execution.id(), expectedVersion);
            }
            executions.put(execution.id(), execution);
            return execution;
        }
    }

    @Override
    public Optional<Execution> findById(String id) {
        return Optional.ofNullable(executions.get(id));
    }

    @Override
    public List<Execution> findByWorkflowId(String workflowId) {
        return executions.values().stream()
            .filter(e -> e.workflowId().equals(workflowId))
            .sorted(Comparator.comparing(Execution::startTime).reversed())
            .toList();
    }

    @Override
    public List<Execution> findByStatus(ExecutionStatus status, int limit) {
        return executions.values().stream()
            .filter(e -> e.status() == status)
            .sorted(Comparator.comparing(Execution::startTime))
            .limit(limit)
            .toList();
    }
}
