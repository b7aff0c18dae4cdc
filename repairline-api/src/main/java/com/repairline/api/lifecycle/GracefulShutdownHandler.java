package com.repairline.api.lifecycle;

import com.repairline.api.config.WorkerProperties;
import com.repairline.engine.coordinator.OrchestrationCoordinator;
import com.repairline.engine.lock.DistributedLockManager;
import com.repairline.worker.WorkerProcessor;
import com.repairline.worker.broker.PullConsumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Starts the pull consumer (pull mode only) and drains the worker on shutdown.
 *
 * On shutdown:
 * 1. Stops pulling new messages
 * 2. Refuses pushes and waits for in-flight jobs (bounded by shutdownTimeoutMs)
 * 3. Stops lock renewal; locks of finished jobs are already released
 * 4. Stops the engine's task executors
 */
@Component
public class GracefulShutdownHandler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(GracefulShutdownHandler.class);

    private final WorkerProcessor processor;
    private final ObjectProvider<PullConsumer> pullConsumer;
    private final DistributedLockManager lockManager;
    private final OrchestrationCoordinator coordinator;
    private final Duration shutdownTimeout;

    private volatile boolean running = false;

    public GracefulShutdownHandler(
            WorkerProcessor processor,
            ObjectProvider<PullConsumer> pullConsumer,
            DistributedLockManager lockManager,
            OrchestrationCoordinator coordinator,
            WorkerProperties properties) {
        this.processor = processor;
        this.pullConsumer = pullConsumer;
        this.lockManager = lockManager;
        this.coordinator = coordinator;
        this.shutdownTimeout = Duration.ofMillis(properties.getShutdownTimeoutMs());
    }

    @Override
    public void start() {
        pullConsumer.ifAvailable(PullConsumer::start);
        running = true;
        log.info("Worker {} started in {} mode",
            processor.getSettings().workerId(), processor.getSettings().mode());
    }

    @Override
    public void stop() {
        log.info("Initiating graceful shutdown for worker {}", processor.getSettings().workerId());
        pullConsumer.ifAvailable(consumer -> consumer.stop(shutdownTimeout));

        boolean drained = processor.shutdown(shutdownTimeout);
        if (!drained) {
            log.warn("Shutdown timeout reached with {} jobs still in flight", processor.inFlight());
        }

        lockManager.shutdown();
        coordinator.shutdown();
        running = false;
        log.info("Graceful shutdown complete for worker {}", processor.getSettings().workerId());
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    /**
     * Stop before the web server so in-flight pushes still get their responses.
     */
    @Override
    public int getPhase() {
        return Integer.MAX_VALUE - 1;
    }
}
