package com.repairline.worker.job;

/**
 * Handler for one job type.
 *
 * <pre>
 * processor.registerHandler("report:build", (job, context) -> {
 *     JsonNode state = context.loadCheckpoint().orElse(null);
 *     // ... long-running work, saving checkpoints as it goes
 *     return JobResult.completed(output);
 * });
 * </pre>
 */
@FunctionalInterface
public interface JobHandler {

    /**
     * Execute the job.
     *
     * @return the outcome; a {@link JobResult#failed} result is terminal and not redelivered
     * @throws JobException classified failure, retried by redelivery when retryable
     */
    JobResult handle(WorkerJob job, JobContext context) throws JobException;
}
