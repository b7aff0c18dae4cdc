package com.repairline.core.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.time.Duration;
import java.time.Instant;

/**
 * Stored outcome of one logical side effect, keyed by the digest of its logical key.
 *
 * Primary Key: keyHash
 *
 * Invariants:
 * - at most one record per keyHash
 * - payloadHash never changes once set
 * - status leaves PENDING exactly once per attempt
 */
public record IdempotencyRecord(
    String key,
    String keyHash,
    String tenantId,
    IdempotencyStatus status,
    String payloadHash,
    String runId,
    JsonNode result,
    Instant createdAt,
    Instant updatedAt,
    Instant expiresAt
) {
    /**
     * Create a new pending record.
     */
    public static IdempotencyRecord pending(
            String key,
            String keyHash,
            String tenantId,
            String payloadHash,
            Instant now,
            Duration ttl) {
        return new IdempotencyRecord(
            key,
            keyHash,
            tenantId,
            IdempotencyStatus.PENDING,
            payloadHash,
            null,
            null,
            now,
            now,
            now.plus(ttl)
        );
    }

    /**
     * Failure result stored on the record: {@code {"error": ..., "retryable": ...}}.
     */
    public static JsonNode failureResult(String errorMessage, boolean retryable) {
        ObjectNode node = JsonNodeFactory.instance.objectNode();
        node.put("error", errorMessage);
        node.put("retryable", retryable);
        return node;
    }

    @JsonIgnore
    public boolean isPending() {
        return status == IdempotencyStatus.PENDING;
    }

    @JsonIgnore
    public boolean isCompleted() {
        return status == IdempotencyStatus.COMPLETED;
    }

    @JsonIgnore
    public boolean isFailed() {
        return status == IdempotencyStatus.FAILED;
    }

    /**
     * A record is expired once its expiry instant lies strictly in the past.
     */
    public boolean isExpired(Instant now) {
        return expiresAt.isBefore(now);
    }

    /**
     * Two payload hashes only conflict when both are present and differ.
     */
    public boolean payloadMatches(String candidatePayloadHash) {
        return payloadHash == null
            || candidatePayloadHash == null
            || payloadHash.equals(candidatePayloadHash);
    }

    @JsonIgnore
    public String errorMessage() {
        if (result == null || !result.hasNonNull("error")) {
            return null;
        }
        return result.get("error").asText();
    }

    /**
     * Whether a failed record was recorded as transient and may run again.
     */
    @JsonIgnore
    public boolean isRetryableFailure() {
        return isFailed() && result != null && result.path("retryable").asBoolean(false);
    }

    public IdempotencyRecord withCompleted(String newRunId, JsonNode newResult, Instant now) {
        return new IdempotencyRecord(
            key, keyHash, tenantId, IdempotencyStatus.COMPLETED, payloadHash,
            newRunId, newResult, createdAt, now, expiresAt
        );
    }

    public IdempotencyRecord withFailed(String errorMessage, boolean retryable, Instant now) {
        return new IdempotencyRecord(
            key, keyHash, tenantId, IdempotencyStatus.FAILED, payloadHash,
            runId, failureResult(errorMessage, retryable), createdAt, now, expiresAt
        );
    }

    public IdempotencyRecord withPending(Instant now) {
        return new IdempotencyRecord(
            key, keyHash, tenantId, IdempotencyStatus.PENDING, payloadHash,
            runId, null, createdAt, now, expiresAt
        );
    }
}
