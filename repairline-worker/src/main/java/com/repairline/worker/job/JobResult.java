package com.repairline.worker.job;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * What a handler reports back for a job.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record JobResult(
    Status status,
    JsonNode output,
    String error
) {
    public enum Status {
        COMPLETED,
        FAILED,
        SKIPPED
    }

    public static JobResult completed(JsonNode output) {
        return new JobResult(Status.COMPLETED, output, null);
    }

    /**
     * Business failure. Recorded as a permanent failure; the message is acknowledged.
     */
    public static JobResult failed(String error) {
        return new JobResult(Status.FAILED, null, error);
    }

    /**
     * Nothing to do. Recorded as completed so redeliveries are absorbed.
     */
    public static JobResult skipped(String reason) {
        return new JobResult(Status.SKIPPED, null, reason);
    }

    public boolean isFailed() {
        return status == Status.FAILED;
    }
}
