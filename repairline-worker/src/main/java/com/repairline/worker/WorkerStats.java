package com.repairline.worker;

import java.util.List;
import java.util.Map;

/**
 * Read-only snapshot of the worker for the stats endpoint.
 */
public record WorkerStats(
    String workerId,
    String mode,
    int inFlight,
    int maxConcurrentJobs,
    long jobTimeoutMs,
    long lockTtlMs,
    boolean accepting,
    List<String> handlers,
    Map<String, Long> processed
) {
}
