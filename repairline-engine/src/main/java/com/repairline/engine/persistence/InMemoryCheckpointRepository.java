package com.repairline.engine.persistence;

import com.repairline.core.model.Checkpoint;
import com.repairline.core.repository.CheckpointRepository;

import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentSkipListMap;

/**
 * In-memory implementation of CheckpointRepository.
 */
public class InMemoryCheckpointRepository implements CheckpointRepository {

    private final Map<String, NavigableMap<Long, Checkpoint>> checkpoints = new ConcurrentHashMap<>();

    @Override
    public Checkpoint save(Checkpoint checkpoint) {
        checkpoints
            .computeIfAbsent(checkpoint.executionId(), k -> new ConcurrentSkipListMap<>())
            .put(checkpoint.sequence(), checkpoint);
        return checkpoint;
    }

    @Override
    public Optional<Checkpoint> findLatest(String executionId) {
        NavigableMap<Long, Checkpoint> byExecution = checkpoints.get(executionId);
        if (byExecution == null || byExecution.isEmpty()) {
            return Optional.empty();
        }
        return Optional.ofNullable(byExecution.lastEntry()).map(Map.Entry::getValue);
    }

    @Override
    public List<Checkpoint> findAll(String executionId) {
        NavigableMap<Long, Checkpoint> byExecution = checkpoints.get(executionId);
        return byExecution == null ? List.of() : List.copyOf(byExecution.values());
    }

    @Override
    public int deleteByExecutionId(String executionId) {
        NavigableMap<Long, Checkpoint> removed = checkpoints.remove(executionId);
        return removed == null ? 0 : removed.size();
    }
}
