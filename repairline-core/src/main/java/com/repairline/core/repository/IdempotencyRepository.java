package com.repairline.core.repository;

import com.fasterxml.jackson.databind.JsonNode;
import com.repairline.core.model.IdempotencyRecord;
import com.repairline.core.model.IdempotencyStatus;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * Repository for idempotency records.
 * All status changes are compare-and-set on the current status.
 */
public interface IdempotencyRepository {

    /**
     * Insert the record unless one already exists for its keyHash.
     * Atomic: among concurrent callers for the same keyHash exactly one inserts.
     *
     * @return the existing record, or empty if this call inserted
     */
    Optional<IdempotencyRecord> insertIfAbsent(IdempotencyRecord record);

    Optional<IdempotencyRecord> findByKeyHash(String keyHash);

    /**
     * Move a PENDING record to COMPLETED.
     *
     * @return false if no PENDING record exists for the keyHash
     */
    boolean markCompleted(String keyHash, String runId, JsonNode result, Instant now);

    /**
     * Move a PENDING record to FAILED.
     *
     * @return false if no PENDING record exists for the keyHash
     */
    boolean markFailed(String keyHash, JsonNode result, Instant now);

    /**
     * Move a record from the expected status back to PENDING, clearing its result.
     *
     * @return true only for the single caller that won the transition
     */
    boolean resetToPending(String keyHash, IdempotencyStatus expectedStatus, Instant expectedUpdatedAt, Instant now);

    /**
     * Key hashes of records that expired before {@code now}, oldest first.
     */
    List<String> findExpiredKeyHashes(Instant now, int limit);

    /**
     * Delete the given records if they are still expired.
     *
     * @return number of rows actually deleted
     */
    int deleteExpired(Collection<String> keyHashes, Instant now);

    long count();
}
