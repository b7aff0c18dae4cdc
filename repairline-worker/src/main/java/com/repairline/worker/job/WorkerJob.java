package com.repairline.worker.job;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;
import com.repairline.core.exception.InvalidIdempotencyKeyException;
import com.repairline.core.idempotency.EventSource;
import com.repairline.core.idempotency.IdempotencyKey;

import java.time.Instant;

/**
 * Job descriptor carried in the data of a broker message.
 *
 * Only {@code type} and {@code tenantId} are required. The remaining
 * identifiers feed idempotency key derivation, see {@link #resolveKey(String)}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record WorkerJob(
    String type,
    String tenantId,

    // Optional run id; reused as the execution id when present
    String runId,

    // Key derivation inputs
    String idempotencyKey,
    String source,
    String deliveryId,
    String callbackId,
    String scheduleId,
    Instant scheduledAt,
    String requestId,

    JsonNode payload,
    JsonNode metadata
) {
    public static Builder builder(String type, String tenantId) {
        return new Builder(type, tenantId);
    }

    /**
     * Derive the logical idempotency key for this job.
     *
     * An explicit {@code idempotencyKey} wins. Otherwise the source-specific
     * discriminator is used (delivery id, callback id, schedule id + fire time,
     * request id), and as a last resort the broker message id under the api source.
     *
     * @throws InvalidIdempotencyKeyException if no valid key can be built
     */
    public String resolveKey(String brokerMessageId) {
        if (hasText(idempotencyKey)) {
            IdempotencyKey.validate(idempotencyKey);
            return idempotencyKey;
        }

        EventSource eventSource = hasText(source)
            ? EventSource.fromPrefix(source.toLowerCase()).orElse(null)
            : null;

        if (eventSource == EventSource.GITHUB && hasText(deliveryId)) {
            return IdempotencyKey.github(tenantId, deliveryId).value();
        }
        if (eventSource == EventSource.SLACK && hasText(callbackId)) {
            return IdempotencyKey.slack(tenantId, callbackId).value();
        }
        if (eventSource == EventSource.SCHEDULER && hasText(scheduleId) && scheduledAt != null) {
            return IdempotencyKey.scheduler(tenantId, scheduleId, scheduledAt).value();
        }
        if (hasText(requestId)) {
            return IdempotencyKey.api(tenantId, requestId).value();
        }
        if (hasText(brokerMessageId)) {
            return IdempotencyKey.api(tenantId, brokerMessageId).value();
        }
        throw new InvalidIdempotencyKeyException("job carries no key discriminator and no message id");
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }

    public static class Builder {
        private final String type;
        private final String tenantId;
        private String runId;
        private String idempotencyKey;
        private String source;
        private String deliveryId;
        private String callbackId;
        private String scheduleId;
        private Instant scheduledAt;
        private String requestId;
        private JsonNode payload;
        private JsonNode metadata;

        private Builder(String type, String tenantId) {
            this.type = type;
            this.tenantId = tenantId;
        }

        public Builder runId(String runId) {
            this.runId = runId;
            return this;
        }

        public Builder idempotencyKey(String idempotencyKey) {
            this.idempotencyKey = idempotencyKey;
            return this;
        }

        public Builder github(String deliveryId) {
            this.source = EventSource.GITHUB.prefix();
            this.deliveryId = deliveryId;
            return this;
        }

        public Builder slack(String callbackId) {
            this.source = EventSource.SLACK.prefix();
            this.callbackId = callbackId;
            return this;
        }

        public Builder scheduled(String scheduleId, Instant scheduledAt) {
            this.source = EventSource.SCHEDULER.prefix();
            this.scheduleId = scheduleId;
            this.scheduledAt = scheduledAt;
            return this;
        }

        public Builder requestId(String requestId) {
            this.requestId = requestId;
            return this;
        }

        public Builder payload(JsonNode payload) {
            this.payload = payload;
            return this;
        }

        public Builder metadata(JsonNode metadata) {
            this.metadata = metadata;
            return this;
        }

        public WorkerJob build() {
            return new WorkerJob(type, tenantId, runId, idempotencyKey, source, deliveryId,
                callbackId, scheduleId, scheduledAt, requestId, payload, metadata);
        }
    }
}
