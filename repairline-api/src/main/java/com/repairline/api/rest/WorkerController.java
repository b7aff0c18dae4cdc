package com.repairline.api.rest;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.repairline.api.config.EngineProperties;
import com.repairline.api.config.WorkerProperties;
import com.repairline.core.model.CleanupSummary;
import com.repairline.engine.service.IdempotencyService;
import com.repairline.worker.ProcessingResult;
import com.repairline.worker.WorkerProcessor;
import com.repairline.worker.WorkerStats;
import com.repairline.worker.broker.PushEnvelope;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RestController;

/**
 * Broker-facing endpoints: push ingress, scheduled idempotency and lock cleanup, and stats.
 *
 * The push status code drives redelivery: 200 for every outcome the broker should
 * drop (including recorded failures), 503 for outcomes it should redeliver.
 */
@RestController
public class WorkerController {

    private static final Logger log = LoggerFactory.getLogger(WorkerController.class);

    private final WorkerProcessor processor;
    private final IdempotencyService idempotencyService;
    private final WorkerProperties workerProperties;
    private final EngineProperties engineProperties;

    public WorkerController(
            WorkerProcessor processor,
            IdempotencyService idempotencyService,
            WorkerProperties workerProperties,
            EngineProperties engineProperties) {
        this.processor = processor;
        this.idempotencyService = idempotencyService;
        this.workerProperties = workerProperties;
        this.engineProperties = engineProperties;
    }

    /**
     * Receive one pushed message and process it synchronously.
     */
    @PostMapping("/push")
    public ResponseEntity<PushResponse> push(@RequestBody PushEnvelope envelope) {
        ProcessingResult result = processor.process(envelope.toBrokerMessage());
        PushResponse body = PushResponse.from(result);
        if (result.shouldAcknowledge()) {
            return ResponseEntity.ok(body);
        }
        log.info("Push of message {} asks for redelivery: {}", result.messageId(), result.errorCode());
        return ResponseEntity.status(HttpStatus.SERVICE_UNAVAILABLE).body(body);
    }

    /**
     * Delete expired idempotency records in bounded batches.
     * Safe to call concurrently and repeatedly.
     */
    @PostMapping("/tasks/cleanup-idempotency")
    public ResponseEntity<CleanupResponse> cleanupIdempotency() {
        CleanupSummary summary = idempotencyService.cleanupAll(
            engineProperties.getIdempotency().getCleanupMaxIterations());
        int purgedLocks = processor.purgeStaleLocks();
        log.info("Cleanup removed {} idempotency records and {} stale job locks",
            summary.totalDeleted(), purgedLocks);
        HttpStatus status = CleanupSummary.STATUS_OK.equals(summary.status())
            ? HttpStatus.OK
            : HttpStatus.INTERNAL_SERVER_ERROR;
        return ResponseEntity.status(status).body(CleanupResponse.from(summary));
    }

    @GetMapping("/stats")
    public ResponseEntity<StatsResponse> stats() {
        return ResponseEntity.ok(StatsResponse.from(processor.stats(), workerProperties));
    }

    // ========== DTOs ==========

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record PushResponse(
        String status,
        String messageId,
        String runId,
        JsonNode result,
        String error,
        String errorCode
    ) {
        public static PushResponse from(ProcessingResult result) {
            return new PushResponse(
                result.status().wireName(),
                result.messageId(),
                result.runId(),
                result.result(),
                result.error(),
                result.errorCode()
            );
        }
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    public record CleanupResponse(
        String status,
        int totalDeleted,
        int batchCount,
        long durationMs,
        String error
    ) {
        public static CleanupResponse from(CleanupSummary summary) {
            return new CleanupResponse(
                summary.status(),
                summary.totalDeleted(),
                summary.batchCount(),
                summary.durationMs(),
                summary.error()
            );
        }
    }

    public record StatsResponse(
        WorkerStats worker,
        String environment,
        String projectId,
        String topic,
        String subscription
    ) {
        public static StatsResponse from(WorkerStats stats, WorkerProperties properties) {
            return new StatsResponse(
                stats,
                properties.getEnvironment(),
                properties.getPubsub().getProjectId(),
                properties.getPubsub().getTopic(),
                properties.getPubsub().getSubscription()
            );
        }
    }
}
