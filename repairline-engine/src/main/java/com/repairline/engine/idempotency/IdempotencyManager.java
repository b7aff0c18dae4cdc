package com.repairline.engine.idempotency;

import com.fasterxml.jackson.databind.JsonNode;
import com.repairline.core.exception.IdempotencyConflictException;
import com.repairline.core.exception.InvalidStateTransitionException;
import com.repairline.core.exception.NotFoundException;
import com.repairline.core.idempotency.KeyHashing;
import com.repairline.core.model.CheckAndSetResult;
import com.repairline.core.model.CleanupResult;
import com.repairline.core.model.CleanupSummary;
import com.repairline.core.model.IdempotencyRecord;
import com.repairline.core.model.IdempotencyStatus;
import com.repairline.core.model.IdempotencyTtl;
import com.repairline.core.repository.IdempotencyRepository;
import com.repairline.engine.metrics.EngineMetrics;
import com.repairline.engine.service.IdempotencyService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.Optional;

/**
 * Idempotency store on top of an {@link IdempotencyRepository}.
 *
 * The repository insert is the single point of atomicity: whichever caller inserts
 * the record owns the key. Payload hashes are compared after the insert, which is
 * safe because a stored payload hash never changes.
 */
public class IdempotencyManager implements IdempotencyService {

    private static final Logger log = LoggerFactory.getLogger(IdempotencyManager.class);

    private final IdempotencyRepository repository;
    private final IdempotencyTtl ttl;
    private final EngineMetrics metrics;
    private final Clock clock;

    public IdempotencyManager(IdempotencyRepository repository, IdempotencyTtl ttl,
                              EngineMetrics metrics, Clock clock) {
        this.repository = repository;
        this.ttl = ttl;
        this.metrics = metrics;
        this.clock = clock;
    }

    @Override
    public CheckAndSetResult checkAndSet(String key, String tenantId, Long ttlSeconds, String payloadHash) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Idempotency key is required");
        }
        String keyHash = KeyHashing.hashKey(key);
        Instant now = now();
        Duration lifetime = ttl.normalize(ttlSeconds);

        IdempotencyRecord candidate = IdempotencyRecord.pending(key, keyHash, tenantId, payloadHash, now, lifetime);
        Optional<IdempotencyRecord> existing = repository.insertIfAbsent(candidate);

        if (existing.isEmpty()) {
            metrics.idempotencyCheck("new");
            log.debug("Created idempotency record {} (ttl {}s)", abbreviate(keyHash), lifetime.toSeconds());
            return CheckAndSetResult.created(candidate);
        }

        IdempotencyRecord record = existing.get();
        if (!record.payloadMatches(payloadHash)) {
            metrics.idempotencyCheck("conflict");
            log.warn("Payload mismatch for idempotency record {}", abbreviate(keyHash));
            throw new IdempotencyConflictException(keyHash);
        }

        metrics.idempotencyCheck("duplicate");
        log.debug("Duplicate idempotency key {} in status {}", abbreviate(keyHash), record.status());
        return CheckAndSetResult.existing(record);
    }

    @Override
    public IdempotencyRecord complete(String keyHash, String runId, JsonNode result) {
        if (!repository.markCompleted(keyHash, runId, result, now())) {
            throw transitionFailure(keyHash, IdempotencyStatus.COMPLETED);
        }
        log.debug("Completed idempotency record {} with run {}", abbreviate(keyHash), runId);
        return requireRecord(keyHash);
    }

    @Override
    public IdempotencyRecord fail(String keyHash, String errorMessage) {
        return fail(keyHash, errorMessage, false);
    }

    @Override
    public IdempotencyRecord fail(String keyHash, String errorMessage, boolean retryable) {
        JsonNode failure = IdempotencyRecord.failureResult(errorMessage, retryable);
        if (!repository.markFailed(keyHash, failure, now())) {
            throw transitionFailure(keyHash, IdempotencyStatus.FAILED);
        }
        log.debug("Failed idempotency record {} (retryable={})", abbreviate(keyHash), retryable);
        return requireRecord(keyHash);
    }

    @Override
    public boolean reclaim(IdempotencyRecord record) {
        if (record.isCompleted()) {
            return false;
        }
        if (record.isFailed() && !record.isRetryableFailure()) {
            return false;
        }
        boolean won = repository.resetToPending(record.keyHash(), record.status(), record.updatedAt(), now());
        if (won) {
            log.info("Reclaimed idempotency record {} from {}", abbreviate(record.keyHash()), record.status());
        }
        return won;
    }

    @Override
    public boolean exists(String key) {
        return get(key).isPresent();
    }

    @Override
    public Optional<IdempotencyRecord> get(String key) {
        return repository.findByKeyHash(KeyHashing.hashKey(key));
    }

    @Override
    public Optional<IdempotencyRecord> getByHash(String keyHash) {
        return repository.findByKeyHash(keyHash);
    }

    @Override
    public CleanupResult cleanup() {
        Instant startedAt = now();
        List<String> expired = repository.findExpiredKeyHashes(startedAt, CLEANUP_BATCH_SIZE);
        int deleted = expired.isEmpty() ? 0 : repository.deleteExpired(expired, startedAt);
        if (deleted > 0) {
            metrics.cleanupDeleted(deleted);
        }
        return CleanupResult.of(deleted, expired.size(), startedAt, now());
    }

    @Override
    public CleanupSummary cleanupAll(int maxIterations) {
        Instant startedAt = now();
        int totalDeleted = 0;
        int batchCount = 0;

        while (batchCount < maxIterations) {
            CleanupResult batch;
            try {
                batch = cleanup();
            } catch (RuntimeException e) {
                long elapsed = Duration.between(startedAt, now()).toMillis();
                log.error("Idempotency cleanup batch {} failed after deleting {} records",
                    batchCount + 1, totalDeleted, e);
                return CleanupSummary.failed(totalDeleted, batchCount, elapsed, e.getMessage());
            }
            batchCount++;
            totalDeleted += batch.deletedCount();
            if (batch.scannedCount() < CLEANUP_BATCH_SIZE) {
                break;
            }
        }

        long elapsed = Duration.between(startedAt, now()).toMillis();
        log.info("Idempotency cleanup deleted {} records in {} batches ({}ms)", totalDeleted, batchCount, elapsed);
        return CleanupSummary.ok(totalDeleted, batchCount, elapsed);
    }

    // ========== Internal Methods ==========

    private RuntimeException transitionFailure(String keyHash, IdempotencyStatus target) {
        Optional<IdempotencyRecord> current = repository.findByKeyHash(keyHash);
        if (current.isEmpty()) {
            return new NotFoundException("IdempotencyRecord", abbreviate(keyHash));
        }
        return new InvalidStateTransitionException(
            "IdempotencyRecord", current.get().status().name(), target.name());
    }

    private IdempotencyRecord requireRecord(String keyHash) {
        return repository.findByKeyHash(keyHash)
            .orElseThrow(() -> new NotFoundException("IdempotencyRecord", abbreviate(keyHash)));
    }

    // Stored timestamps keep microsecond precision; compare-and-set on updatedAt needs the same.
    private Instant now() {
        return clock.instant().truncatedTo(ChronoUnit.MICROS);
    }

    private static String abbreviate(String keyHash) {
        return keyHash != null && keyHash.length() > 12 ? keyHash.substring(0, 12) : keyHash;
    }
}
