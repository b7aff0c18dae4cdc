package com.repairline.worker;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;

import java.time.Duration;
import java.util.function.Supplier;

/**
 * Micrometer metrics for message processing.
 */
public class WorkerMetrics {

    public static final String JOBS_PROCESSED = "repairline.worker.jobs";
    public static final String JOB_DURATION = "repairline.worker.job.duration";
    public static final String JOBS_IN_FLIGHT = "repairline.worker.jobs.in_flight";

    private final MeterRegistry registry;

    public WorkerMetrics(MeterRegistry registry) {
        this.registry = registry;
    }

    public void jobProcessed(String type, ProcessingStatus status) {
        Counter.builder(JOBS_PROCESSED)
            .tag("type", type)
            .tag("outcome", status.wireName())
            .description("Broker messages processed by outcome")
            .register(registry)
            .increment();
    }

    public void jobDuration(String type, ProcessingStatus status, Duration duration) {
        Timer.builder(JOB_DURATION)
            .tag("type", type)
            .tag("outcome", status.wireName())
            .register(registry)
            .record(duration);
    }

    public void registerInFlight(Supplier<Number> inFlight) {
        Gauge.builder(JOBS_IN_FLIGHT, inFlight)
            .description("Jobs currently being processed")
            .register(registry);
    }
}
