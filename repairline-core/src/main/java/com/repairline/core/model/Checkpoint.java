package com.repairline.core.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;

/**
 * Progress snapshot of a long-running execution.
 *
 * Primary Key: (executionId, sequence)
 * Saving an existing sequence replaces its state; loading returns the highest sequence.
 */
public record Checkpoint(
    String executionId,
    long sequence,
    JsonNode state,
    Instant createdAt
) {
    public Checkpoint {
        if (executionId == null || executionId.isBlank()) {
            throw new IllegalArgumentException("executionId is required");
        }
        if (sequence < 0) {
            throw new IllegalArgumentException("sequence must be >= 0");
        }
    }
}
