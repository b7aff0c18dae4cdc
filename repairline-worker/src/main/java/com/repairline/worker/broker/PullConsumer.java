package com.repairline.worker.broker;

import com.repairline.worker.ProcessingResult;
import com.repairline.worker.WorkerProcessor;
import com.repairline.worker.WorkerSettings;
import com.repairline.worker.broker.MessageBroker.ReceivedMessage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Pull-mode consumer: leases messages from the broker and processes each through the
 * {@link WorkerProcessor}, at most {@code maxConcurrentJobs} at a time.
 *
 * Usage:
 * <pre>
 * PullConsumer consumer = new PullConsumer(broker, processor);
 * consumer.start();
 * ...
 * consumer.stop();
 * </pre>
 */
public class PullConsumer {

    private static final Logger log = LoggerFactory.getLogger(PullConsumer.class);

    static final Duration MAX_REDELIVERY_DELAY = Duration.ofMinutes(1);

    private final MessageBroker broker;
    private final WorkerProcessor processor;
    private final WorkerSettings settings;
    private final Semaphore slots;
    private final ExecutorService pollExecutor;
    private final ExecutorService executorService;

    private final AtomicBoolean running = new AtomicBoolean(false);

    public PullConsumer(MessageBroker broker, WorkerProcessor processor) {
        this.broker = broker;
        this.processor = processor;
        this.settings = processor.getSettings();
        this.slots = new Semaphore(settings.maxConcurrentJobs());
        this.pollExecutor = Executors.newSingleThreadExecutor();
        this.executorService = Executors.newFixedThreadPool(settings.maxConcurrentJobs());
    }

    /**
     * Start the poll loop.
     */
    public void start() {
        if (running.compareAndSet(false, true)) {
            log.info("Starting pull consumer {} (max {} concurrent jobs)",
                settings.workerId(), settings.maxConcurrentJobs());
            pollExecutor.submit(this::pollLoop);
        }
    }

    /**
     * Stop pulling and wait for in-flight messages to finish.
     */
    public void stop() {
        stop(Duration.ofSeconds(30));
    }

    public void stop(Duration drainTimeout) {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping pull consumer {}", settings.workerId());
            pollExecutor.shutdown();
            executorService.shutdown();
            try {
                if (!executorService.awaitTermination(drainTimeout.toMillis(), TimeUnit.MILLISECONDS)) {
                    executorService.shutdownNow();
                }
            } catch (InterruptedException e) {
                executorService.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    private void pollLoop() {
        while (running.get()) {
            try {
                int free = slots.availablePermits();
                List<ReceivedMessage> messages = free > 0
                    ? broker.pull(free, settings.ackDeadline())
                    : List.of();

                for (ReceivedMessage received : messages) {
                    slots.acquire();
                    executorService.submit(() -> handle(received));
                }

                if (messages.isEmpty()) {
                    Thread.sleep(settings.pollInterval().toMillis());
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            } catch (Exception e) {
                log.error("Error in poll loop", e);
                try {
                    Thread.sleep(settings.pollInterval().toMillis() * 2);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    break;
                }
            }
        }
    }

    private void handle(ReceivedMessage received) {
        BrokerMessage message = received.message();
        try {
            ProcessingResult result = processor.process(message);
            if (result.shouldAcknowledge()) {
                if (!broker.ack(received.ackId())) {
                    log.warn("Ack for message {} arrived after its lease expired", message.messageId());
                }
            } else {
                Duration delay = redeliveryDelay(message.deliveryAttempt());
                log.info("Message {} will be redelivered in {}ms: {}",
                    message.messageId(), delay.toMillis(), result.error());
                broker.nack(received.ackId(), delay);
            }
        } catch (RuntimeException e) {
            log.error("Message {} failed with unexpected error", message.messageId(), e);
            broker.nack(received.ackId(), redeliveryDelay(message.deliveryAttempt()));
        } finally {
            slots.release();
        }
    }

    /**
     * Exponential backoff from the poll interval, doubling per delivery attempt.
     */
    Duration redeliveryDelay(int deliveryAttempt) {
        int exponent = Math.min(Math.max(deliveryAttempt - 1, 0), 20);
        Duration delay = settings.pollInterval().multipliedBy(1L << exponent);
        return delay.compareTo(MAX_REDELIVERY_DELAY) > 0 ? MAX_REDELIVERY_DELAY : delay;
    }
}
