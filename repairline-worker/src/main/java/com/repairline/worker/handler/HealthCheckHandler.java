package com.repairline.worker.handler;

import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.repairline.worker.job.JobContext;
import com.repairline.worker.job.JobHandler;
import com.repairline.worker.job.JobResult;
import com.repairline.worker.job.WorkerJob;

import java.time.Clock;

/**
 * Echo job used to check the delivery path end to end.
 */
public class HealthCheckHandler implements JobHandler {

    public static final String TYPE = "health:check";

    private final Clock clock;

    public HealthCheckHandler(Clock clock) {
        this.clock = clock;
    }

    @Override
    public JobResult handle(WorkerJob job, JobContext context) {
        ObjectNode output = JsonNodeFactory.instance.objectNode()
            .put("healthy", true)
            .put("timestamp", clock.instant().toString())
            .put("tenantId", job.tenantId())
            .put("keyHash", context.getKeyHash())
            .put("fenceToken", context.getFenceToken());
        output.set("payload", job.payload());
        return JobResult.completed(output);
    }
}
