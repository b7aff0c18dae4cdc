package com.repairline.api.health;

import com.repairline.api.config.EngineProperties;
import com.repairline.core.model.ExecutionStatus;
import com.repairline.engine.coordinator.OrchestrationCoordinator;
import com.repairline.worker.WorkerProcessor;
import com.repairline.worker.WorkerStats;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Reports worker mode and load, plus whether the execution store answers.
 * DOWN once the worker stops accepting messages.
 */
@Component
public class WorkerHealthIndicator implements HealthIndicator {

    private final WorkerProcessor processor;
    private final OrchestrationCoordinator coordinator;
    private final EngineProperties engineProperties;

    public WorkerHealthIndicator(
            WorkerProcessor processor,
            OrchestrationCoordinator coordinator,
            EngineProperties engineProperties) {
        this.processor = processor;
        this.coordinator = coordinator;
        this.engineProperties = engineProperties;
    }

    @Override
    public Health health() {
        Map<String, Object> details = new HashMap<>();
        WorkerStats stats = processor.stats();
        details.put("workerId", stats.workerId());
        details.put("mode", stats.mode());
        details.put("inFlight", stats.inFlight());
        details.put("maxConcurrentJobs", stats.maxConcurrentJobs());
        details.put("store", engineProperties.getStore());

        boolean storeHealthy = checkStore(details);
        if (!stats.accepting()) {
            details.put("reason", "shutting down");
            return Health.down().withDetails(details).build();
        }
        if (!storeHealthy) {
            return Health.down().withDetails(details).build();
        }
        return Health.up().withDetails(details).build();
    }

    private boolean checkStore(Map<String, Object> details) {
        try {
            int running = coordinator.listExecutionsByStatus(ExecutionStatus.RUNNING, 1000).size();
            details.put("runningExecutions", running);
            return true;
        } catch (RuntimeException e) {
            details.put("storeError", e.getMessage());
            return false;
        }
    }
}
