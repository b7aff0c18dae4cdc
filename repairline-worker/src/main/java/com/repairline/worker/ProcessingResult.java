package com.repairline.worker;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Result of processing one broker message.
 *
 * @param result handler output, or the cached output for duplicates
 * @param errorCode set for FAILED, RETRY and REJECTED
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProcessingResult(
    ProcessingStatus status,
    String messageId,
    String keyHash,
    String runId,
    JsonNode result,
    String error,
    String errorCode
) {
    public static ProcessingResult completed(String messageId, String keyHash, String runId, JsonNode result) {
        return new ProcessingResult(ProcessingStatus.COMPLETED, messageId, keyHash, runId, result, null, null);
    }

    public static ProcessingResult duplicate(String messageId, String keyHash, String runId, JsonNode result) {
        return new ProcessingResult(ProcessingStatus.DUPLICATE, messageId, keyHash, runId, result, null, null);
    }

    public static ProcessingResult failed(String messageId, String keyHash, String errorCode, String error) {
        return new ProcessingResult(ProcessingStatus.FAILED, messageId, keyHash, null, null, error, errorCode);
    }

    public static ProcessingResult retry(String messageId, String keyHash, String errorCode, String error) {
        return new ProcessingResult(ProcessingStatus.RETRY, messageId, keyHash, null, null, error, errorCode);
    }

    public static ProcessingResult rejected(String messageId, String errorCode, String error) {
        return new ProcessingResult(ProcessingStatus.REJECTED, messageId, null, null, null, error, errorCode);
    }

    @JsonIgnore
    public boolean shouldAcknowledge() {
        return status.shouldAcknowledge();
    }
}
