package com.repairline.core.model;

/**
 * Aggregate of a bounded cleanup loop, reported by the maintenance endpoint.
 *
 * @param status "ok" when the loop drained or hit its iteration bound, "error" when a batch failed
 */
public record CleanupSummary(
    String status,
    int totalDeleted,
    int batchCount,
    long durationMs,
    String error
) {
    public static final String STATUS_OK = "ok";
    public static final String STATUS_ERROR = "error";

    public static CleanupSummary ok(int totalDeleted, int batchCount, long durationMs) {
        return new CleanupSummary(STATUS_OK, totalDeleted, batchCount, durationMs, null);
    }

    public static CleanupSummary failed(int totalDeleted, int batchCount, long durationMs, String error) {
        return new CleanupSummary(STATUS_ERROR, totalDeleted, batchCount, durationMs, error);
    }
}
