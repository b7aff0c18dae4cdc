package com.repairline.engine.persistence.jdbc;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repairline.core.model.IdempotencyRecord;
import com.repairline.core.model.IdempotencyStatus;
import com.repairline.core.repository.IdempotencyRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static com.repairline.engine.persistence.jdbc.JsonColumns.toInstant;
import static com.repairline.engine.persistence.jdbc.JsonColumns.toTimestamp;

/**
 * PostgreSQL-backed implementation of IdempotencyRepository.
 *
 * Check-and-set relies on the primary key of {@code key_hash}: concurrent inserts
 * of the same key are serialized by {@code ON CONFLICT DO NOTHING}, and every
 * status change is a conditional UPDATE on the current status.
 */
public class JdbcIdempotencyRepository implements IdempotencyRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcIdempotencyRepository.class);

    // A conflicting row may be deleted by cleanup between the insert and the read.
    private static final int MAX_INSERT_ATTEMPTS = 3;

    private final JdbcTemplate jdbcTemplate;
    private final JsonColumns json;
    private final RowMapper<IdempotencyRecord> rowMapper = new IdempotencyRecordRowMapper();

    public JdbcIdempotencyRepository(JdbcTemplate jdbcTemplate, ObjectMapper objectMapper) {
        this.jdbcTemplate = jdbcTemplate;
        this.json = new JsonColumns(objectMapper);
    }

    @Override
    public Optional<IdempotencyRecord> insertIfAbsent(IdempotencyRecord record) {
        String sql = """
            INSERT INTO idempotency_records (
                key_hash, idempotency_key, tenant_id, status, payload_hash,
                run_id, result, created_at, updated_at, expires_at
            ) VALUES (?, ?, ?, ?, ?, ?, ?::jsonb, ?, ?, ?)
            ON CONFLICT (key_hash) DO NOTHING
            """;

        for (int attempt = 1; attempt <= MAX_INSERT_ATTEMPTS; attempt++) {
            int rows = jdbcTemplate.update(sql,
                record.keyHash(),
                record.key(),
                record.tenantId(),
                record.status().name(),
                record.payloadHash(),
                record.runId(),
                json.toJson(record.result()),
                toTimestamp(record.createdAt()),
                toTimestamp(record.updatedAt()),
                toTimestamp(record.expiresAt())
            );
            if (rows == 1) {
                return Optional.empty();
            }
            Optional<IdempotencyRecord> existing = findByKeyHash(record.keyHash());
            if (existing.isPresent()) {
                return existing;
            }
            log.debug("Idempotency record vanished between insert and read, retrying");
        }
        throw new IllegalStateException("Could not insert or read idempotency record");
    }

    @Override
    public Optional<IdempotencyRecord> findByKeyHash(String keyHash) {
        String sql = "SELECT * FROM idempotency_records WHERE key_hash = ?";
        List<IdempotencyRecord> results = jdbcTemplate.query(sql, rowMapper, keyHash);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    @Transactional
    public boolean markCompleted(String keyHash, String runId, JsonNode result, Instant now) {
        String sql = """
            UPDATE idempotency_records SET
                status = 'COMPLETED',
                run_id = ?,
                result = ?::jsonb,
                updated_at = ?
            WHERE key_hash = ? AND status = 'PENDING'
            """;
        return jdbcTemplate.update(sql, runId, json.toJson(result), toTimestamp(now), keyHash) == 1;
    }

    @Override
    @Transactional
    public boolean markFailed(String keyHash, JsonNode result, Instant now) {
        String sql = """
            UPDATE idempotency_records SET
                status = 'FAILED',
                result = ?::jsonb,
                updated_at = ?
            WHERE key_hash = ? AND status = 'PENDING'
            """;
        return jdbcTemplate.update(sql, json.toJson(result), toTimestamp(now), keyHash) == 1;
    }

    @Override
    @Transactional
    public boolean resetToPending(String keyHash, IdempotencyStatus expectedStatus,
                                  Instant expectedUpdatedAt, Instant now) {
        String sql = """
            UPDATE idempotency_records SET
                status = 'PENDING',
                result = NULL,
                updated_at = ?
            WHERE key_hash = ? AND status = ? AND updated_at = ?
            """;
        int rows = jdbcTemplate.update(sql,
            toTimestamp(now),
            keyHash,
            expectedStatus.name(),
            toTimestamp(expectedUpdatedAt)
        );
        return rows == 1;
    }

    @Override
    public List<String> findExpiredKeyHashes(Instant now, int limit) {
        String sql = """
            SELECT key_hash FROM idempotency_records
            WHERE expires_at < ?
            ORDER BY expires_at
            LIMIT ?
            """;
        return jdbcTemplate.queryForList(sql, String.class, toTimestamp(now), limit);
    }

    @Override
    @Transactional
    public int deleteExpired(Collection<String> keyHashes, Instant now) {
        if (keyHashes.isEmpty()) {
            return 0;
        }
        String sql = "DELETE FROM idempotency_records WHERE key_hash = ANY(?) AND expires_at < ?";
        return jdbcTemplate.update(con -> {
            PreparedStatement ps = con.prepareStatement(sql);
            ps.setArray(1, con.createArrayOf("text", keyHashes.toArray()));
            ps.setTimestamp(2, toTimestamp(now));
            return ps;
        });
    }

    @Override
    public long count() {
        Long count = jdbcTemplate.queryForObject("SELECT COUNT(*) FROM idempotency_records", Long.class);
        return count != null ? count : 0L;
    }

    private class IdempotencyRecordRowMapper implements RowMapper<IdempotencyRecord> {
        @Override
        public IdempotencyRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new IdempotencyRecord(
                rs.getString("idempotency_key"),
                rs.getString("key_hash"),
                rs.getString("tenant_id"),
                IdempotencyStatus.valueOf(rs.getString("status")),
                rs.getString("payload_hash"),
                rs.getString("run_id"),
                json.readTree(rs.getString("result")),
                toInstant(rs.getTimestamp("created_at")),
                toInstant(rs.getTimestamp("updated_at")),
                toInstant(rs.getTimestamp("expires_at"))
            );
        }
    }
}
