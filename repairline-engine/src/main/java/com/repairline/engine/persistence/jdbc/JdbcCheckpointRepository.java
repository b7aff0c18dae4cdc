package com.repairline.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.repairline.core.model.Checkpoint;
import com.repairline.core.repository.CheckpointRepository;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;

import static com.repairline.engine.persistence.jdbc.JsonColumns.toInstant;
import static com.repairline.engine.persistence.jdbc.JsonColumns.toTimestamp;

/**
 * PostgreSQL-backed implementation of CheckpointRepository.
 */
public class JdbcCheckpointRepository implements CheckpointRepository {

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<Checkpoint> rowMapper;

    public JdbcCheckpointRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(objectMapper);
        this.rowMapper = (rs, rowNum) -> new Checkpoint(
            rs.getString("execution_id"),
            rs.getLong("sequence"),
            json.readTree(rs.getString("state")),
            toInstant(rs.getTimestamp("created_at"))
        );
    }

    @Override
    @Transactional
    public Checkpoint save(Checkpoint checkpoint) {
        String sql = """
            INSERT INTO execution_checkpoints (execution_id, sequence, state, created_at)
            VALUES (?, ?, ?::jsonb, ?)
            ON CONFLICT (execution_id, sequence) DO UPDATE SET
                state = EXCLUDED.state,
                created_at = EXCLUDED.created_at
            """;
        jdbcTemplate.update(sql,
            checkpoint.executionId(),
            checkpoint.sequence(),
            json.toJson(checkpoint.state()),
            toTimestamp(checkpoint.createdAt())
        );
        return checkpoint;
    }

    @Override
    public Optional<Checkpoint> findLatest(String executionId) {
        String sql = """
            SELECT * FROM execution_checkpoints
            WHERE execution_id = ?
            ORDER BY sequence DESC
            LIMIT 1
            """;
        List<Checkpoint> results = jdbcTemplate.query(sql, rowMapper, executionId);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public List<Checkpoint> findAll(String executionId) {
        String sql = "SELECT * FROM execution_checkpoints WHERE execution_id = ? ORDER BY sequence";
        return jdbcTemplate.query(sql, rowMapper, executionId);
    }

    @Override
    @Transactional
    public int deleteByExecutionId(String executionId) {
        return jdbcTemplate.update("DELETE FROM execution_checkpoints WHERE execution_id = ?", executionId);
    }
}
