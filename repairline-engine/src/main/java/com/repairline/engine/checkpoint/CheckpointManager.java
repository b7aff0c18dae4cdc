package com.repairline.engine.checkpoint;

import com.fasterxml.jackson.databind.JsonNode;
import com.repairline.core.model.Checkpoint;
import com.repairline.core.repository.CheckpointRepository;
import com.repairline.engine.service.CheckpointService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

public class CheckpointManager implements CheckpointService {

    private static final Logger log = LoggerFactory.getLogger(CheckpointManager.class);

    private final CheckpointRepository repository;
    private final Clock clock;

    public CheckpointManager(CheckpointRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    @Override
    public Checkpoint save(String executionId, long sequence, JsonNode state) {
        Checkpoint checkpoint = new Checkpoint(
            executionId, sequence, state, clock.instant().truncatedTo(ChronoUnit.MICROS));
        Checkpoint saved = repository.save(checkpoint);
        log.debug("Saved checkpoint {} for execution {}", sequence, executionId);
        return saved;
    }

    @Override
    public Optional<JsonNode> load(String executionId) {
        return loadLatest(executionId).map(Checkpoint::state);
    }

    @Override
    public Optional<Checkpoint> loadLatest(String executionId) {
        return repository.findLatest(executionId);
    }

    /**
     * All checkpoints of the execution in sequence order.
     */
    public List<Checkpoint> history(String executionId) {
        return repository.findAll(executionId);
    }

    @Override
    public long nextSequence(String executionId) {
        return loadLatest(executionId).map(c -> c.sequence() + 1).orElse(0L);
    }

    @Override
    public int delete(String executionId) {
        int deleted = repository.deleteByExecutionId(executionId);
        if (deleted > 0) {
            log.debug("Deleted {} checkpoints for execution {}", deleted, executionId);
        }
        return deleted;
    }
}
