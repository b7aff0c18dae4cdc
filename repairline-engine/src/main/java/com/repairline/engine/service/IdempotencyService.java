package com.repairline.engine.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.repairline.core.model.CheckAndSetResult;
import com.repairline.core.model.CleanupResult;
import com.repairline.core.model.CleanupSummary;
import com.repairline.core.model.IdempotencyRecord;

import java.util.Optional;

/**
 * Idempotency store giving exactly-once effect to at-least-once delivery.
 */
public interface IdempotencyService {

    /** Records deleted per cleanup call at most. */
    int CLEANUP_BATCH_SIZE = 500;

    /** Default bound on cleanup batches per maintenance run. */
    int DEFAULT_MAX_CLEANUP_ITERATIONS = 20;

    /**
     * Atomically create a PENDING record for the key, or return the existing one.
     *
     * @param key logical idempotency key
     * @param tenantId owning tenant
     * @param ttlSeconds requested lifetime, clamped; null for the default
     * @param payloadHash optional request payload digest
     * @return the stored record and whether this call created it
     * @throws com.repairline.core.exception.IdempotencyConflictException if the stored
     *         payload hash differs from the supplied one
     */
    CheckAndSetResult checkAndSet(String key, String tenantId, Long ttlSeconds, String payloadHash);

    /**
     * Mark a PENDING record completed.
     *
     * @throws com.repairline.core.exception.NotFoundException if the key hash is unknown
     * @throws com.repairline.core.exception.InvalidStateTransitionException if not PENDING
     */
    IdempotencyRecord complete(String keyHash, String runId, JsonNode result);

    /**
     * Mark a PENDING record as a permanent failure.
     */
    IdempotencyRecord fail(String keyHash, String errorMessage);

    /**
     * Mark a PENDING record failed; retryable failures may be reclaimed by a redelivery.
     */
    IdempotencyRecord fail(String keyHash, String errorMessage, boolean retryable);

    /**
     * Move a retryable FAILED record, or a PENDING record abandoned by a crashed
     * worker, back to a fresh PENDING attempt.
     *
     * @return true only for the single caller that won the transition
     */
    boolean reclaim(IdempotencyRecord record);

    boolean exists(String key);

    Optional<IdempotencyRecord> get(String key);

    Optional<IdempotencyRecord> getByHash(String keyHash);

    /**
     * Delete at most {@link #CLEANUP_BATCH_SIZE} expired records.
     */
    CleanupResult cleanup();

    /**
     * Repeat {@link #cleanup()} until a batch comes back short or the bound is reached.
     * A failing batch stops the loop; earlier deletions stay committed.
     */
    CleanupSummary cleanupAll(int maxIterations);
}
