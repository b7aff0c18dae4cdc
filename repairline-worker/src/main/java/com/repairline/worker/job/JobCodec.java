package com.repairline.worker.job;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repairline.core.idempotency.IdempotencyKey;
import com.repairline.worker.broker.BrokerMessage;

import java.io.IOException;
import java.util.Base64;

/**
 * Converts between broker messages and jobs.
 */
public class JobCodec {

    /** Message attribute consulted when the job body carries no tenant. */
    public static final String TENANT_ATTRIBUTE = "tenantId";

    private final ObjectMapper objectMapper;

    public JobCodec(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    /**
     * Decode the message data into a job.
     * A job without a tenant takes it from the message attributes, then from its payload.
     *
     * @throws MalformedJobException if the data is not base64 JSON describing a typed, tenanted job
     */
    public WorkerJob decode(BrokerMessage message) {
        byte[] json;
        try {
            json = message.decodedData();
        } catch (IllegalArgumentException e) {
            throw new MalformedJobException("Message data is not valid base64", e);
        }
        if (json.length == 0) {
            throw new MalformedJobException("Message carries no data");
        }

        WorkerJob job;
        try {
            job = objectMapper.readValue(json, WorkerJob.class);
        } catch (JsonProcessingException e) {
            throw new MalformedJobException("Message data is not a job descriptor: " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new MalformedJobException("Message data could not be read", e);
        }
        if (job == null || job.type() == null || job.type().isBlank()) {
            throw new MalformedJobException("Job type is required");
        }

        if (job.tenantId() == null || job.tenantId().isBlank()) {
            String tenantId = message.attribute(TENANT_ATTRIBUTE);
            if (tenantId == null) {
                tenantId = IdempotencyKey.extractTenantId(job.payload()).orElse(null);
            }
            if (tenantId == null) {
                throw new MalformedJobException("Job tenantId is required");
            }
            job = new WorkerJob(job.type(), tenantId, job.runId(), job.idempotencyKey(), job.source(),
                job.deliveryId(), job.callbackId(), job.scheduleId(), job.scheduledAt(), job.requestId(),
                job.payload(), job.metadata());
        }
        return job;
    }

    /**
     * Encode a job as the base64 data of a broker message.
     */
    public String encode(WorkerJob job) {
        return Base64.getEncoder().encodeToString(toJson(job));
    }

    public byte[] toJson(WorkerJob job) {
        try {
            return objectMapper.writeValueAsBytes(job);
        } catch (JsonProcessingException e) {
            throw new IllegalArgumentException("Cannot serialize job of type " + job.type(), e);
        }
    }
}
