package com.repairline.engine.persistence.jdbc;

import com.repairline.core.model.ExecutionLock;
import com.repairline.core.repository.LockRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.transaction.annotation.Transactional;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

import static com.repairline.engine.persistence.jdbc.JsonColumns.toInstant;
import static com.repairline.engine.persistence.jdbc.JsonColumns.toTimestamp;

/**
 * PostgreSQL-backed implementation of LockRepository.
 *
 * Acquisition is a single upsert that only overwrites an expired or released row,
 * so two replicas can never both win. Released rows are kept so the fence token
 * keeps increasing across holders; {@link #deleteExpiredBefore} removes them once
 * released (expires_at is reset to acquired_at) or expired for longer than the grace.
 */
public class JdbcLockRepository implements LockRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcLockRepository.class);

    private final JdbcTemplate jdbcTemplate;
    private final RowMapper<ExecutionLock> rowMapper = new ExecutionLockRowMapper();

    public JdbcLockRepository(JdbcTemplate jdbcTemplate) {
        this.jdbcTemplate = jdbcTemplate;
    }

    @Override
    @Transactional
    public Optional<ExecutionLock> tryAcquire(ExecutionLock lock, Instant now) {
        String sql = """
            INSERT INTO execution_locks (
                resource_key, holder_token, acquired_at, expires_at,
                ttl_ms, renewal_count, fence_token
            ) VALUES (?, ?, ?, ?, ?, 0, 1)
            ON CONFLICT (resource_key) DO UPDATE SET
                holder_token = EXCLUDED.holder_token,
                acquired_at = EXCLUDED.acquired_at,
                expires_at = EXCLUDED.expires_at,
                ttl_ms = EXCLUDED.ttl_ms,
                renewal_count = 0,
                fence_token = execution_locks.fence_token + 1
            WHERE execution_locks.expires_at <= ? OR execution_locks.holder_token IS NULL
            RETURNING fence_token
            """;

        List<Long> tokens = jdbcTemplate.query(sql, (rs, rowNum) -> rs.getLong(1),
            lock.resourceKey(),
            lock.holderToken(),
            toTimestamp(lock.acquiredAt()),
            toTimestamp(lock.expiresAt()),
            lock.ttl().toMillis(),
            toTimestamp(now)
        );

        if (tokens.isEmpty()) {
            log.debug("Lock {} is held by another holder", lock.resourceKey());
            return Optional.empty();
        }
        return Optional.of(lock.withFenceToken(tokens.get(0)));
    }

    @Override
    @Transactional
    public boolean renew(String resourceKey, String holderToken, Instant newExpiresAt, Instant now) {
        String sql = """
            UPDATE execution_locks SET
                expires_at = ?,
                ttl_ms = ?,
                renewal_count = renewal_count + 1
            WHERE resource_key = ? AND holder_token = ? AND expires_at > ?
            """;

        int rows = jdbcTemplate.update(sql,
            toTimestamp(newExpiresAt),
            Duration.between(now, newExpiresAt).toMillis(),
            resourceKey,
            holderToken,
            toTimestamp(now)
        );
        return rows > 0;
    }

    @Override
    @Transactional
    public boolean release(String resourceKey, String holderToken) {
        String sql = """
            UPDATE execution_locks SET
                holder_token = NULL,
                expires_at = acquired_at
            WHERE resource_key = ? AND holder_token = ?
            """;
        return jdbcTemplate.update(sql, resourceKey, holderToken) > 0;
    }

    @Override
    public Optional<ExecutionLock> findByKey(String resourceKey) {
        String sql = "SELECT * FROM execution_locks WHERE resource_key = ? AND holder_token IS NOT NULL";
        List<ExecutionLock> results = jdbcTemplate.query(sql, rowMapper, resourceKey);
        return results.isEmpty() ? Optional.empty() : Optional.of(results.get(0));
    }

    @Override
    public int deleteExpiredBefore(Instant expiredBefore) {
        return jdbcTemplate.update("DELETE FROM execution_locks WHERE expires_at < ?", toTimestamp(expiredBefore));
    }

    private static class ExecutionLockRowMapper implements RowMapper<ExecutionLock> {
        @Override
        public ExecutionLock mapRow(ResultSet rs, int rowNum) throws SQLException {
            return new ExecutionLock(
                rs.getString("resource_key"),
                rs.getString("holder_token"),
                toInstant(rs.getTimestamp("acquired_at")),
                toInstant(rs.getTimestamp("expires_at")),
                Duration.ofMillis(rs.getLong("ttl_ms")),
                rs.getInt("renewal_count"),
                rs.getLong("fence_token")
            );
        }
    }
}
