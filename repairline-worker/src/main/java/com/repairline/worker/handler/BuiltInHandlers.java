package com.repairline.worker.handler;

import com.repairline.engine.service.OrchestrationService;
import com.repairline.worker.WorkerProcessor;

import java.time.Clock;

/**
 * Registers the job types every worker understands.
 */
public final class BuiltInHandlers {

    private BuiltInHandlers() {
    }

    public static void register(WorkerProcessor processor, OrchestrationService orchestration, Clock clock) {
        processor.registerHandler(WorkflowExecuteHandler.TYPE, new WorkflowExecuteHandler(orchestration));
        processor.registerHandler(CapabilityInvokeHandler.TYPE, new CapabilityInvokeHandler(orchestration));
        processor.registerHandler(HealthCheckHandler.TYPE, new HealthCheckHandler(clock));
    }
}
