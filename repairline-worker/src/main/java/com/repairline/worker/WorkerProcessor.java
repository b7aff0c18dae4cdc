package com.repairline.worker;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.repairline.core.exception.IdempotencyConflictException;
import com.repairline.core.exception.InvalidIdempotencyKeyException;
import com.repairline.core.exception.InvalidStateTransitionException;
import com.repairline.core.exception.ResourceBusyException;
import com.repairline.core.idempotency.KeyHashing;
import com.repairline.core.model.CheckAndSetResult;
import com.repairline.core.model.ExecutionLock;
import com.repairline.core.model.IdempotencyRecord;
import com.repairline.engine.concurrent.TrackedCall;
import com.repairline.engine.lock.DistributedLockManager;
import com.repairline.engine.lock.DistributedLockManager.RenewalHandle;
import com.repairline.engine.logging.LoggingContext;
import com.repairline.engine.service.CheckpointService;
import com.repairline.engine.service.IdempotencyService;
import com.repairline.worker.broker.BrokerMessage;
import com.repairline.worker.job.JobCodec;
import com.repairline.worker.job.JobContext;
import com.repairline.worker.job.JobException;
import com.repairline.worker.job.JobHandler;
import com.repairline.worker.job.JobResult;
import com.repairline.worker.job.MalformedJobException;
import com.repairline.worker.job.WorkerJob;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Processes broker messages with exactly-once effect per logical job.
 *
 * Processing path for one message:
 * 1. Decode the job and derive its idempotency key
 * 2. checkAndSet: a completed record returns its cached result, a pending one is busy
 * 3. Acquire the job lock (busy if held) and renew it in the background
 * 4. Run the handler under the job timeout
 * 5. Record completion or failure on the idempotency record, release the lock
 *
 * A handler that overruns the timeout is interrupted and the delivery reports a retry,
 * but step 5 waits until the handler thread has actually returned. Until then the
 * job stays locked, so a redelivery sees it as busy instead of running it a second time.
 *
 * The returned {@link ProcessingResult} tells the caller whether to acknowledge
 * the message or let the broker redeliver it.
 */
public class WorkerProcessor {

    private static final Logger log = LoggerFactory.getLogger(WorkerProcessor.class);

    public static final String LOCK_PREFIX = "job:";

    public static final String UNKNOWN_JOB_TYPE = "UNKNOWN_JOB_TYPE";
    public static final String WORKER_BUSY = "WORKER_BUSY";
    public static final String SHUTTING_DOWN = "SHUTTING_DOWN";
    public static final String JOB_TIMEOUT = "JOB_TIMEOUT";
    public static final String INTERNAL_ERROR = "INTERNAL_ERROR";
    public static final String PREVIOUSLY_FAILED = "PREVIOUSLY_FAILED";

    private static final String UNKNOWN_TYPE_TAG = "unknown";

    /**
     * How long a released or expired job lock is kept before it may be purged.
     */
    public static final Duration LOCK_PURGE_GRACE = Duration.ofHours(1);

    private final IdempotencyService idempotency;
    private final DistributedLockManager locks;
    private final CheckpointService checkpoints;
    private final JobCodec codec;
    private final ObjectMapper objectMapper;
    private final WorkerSettings settings;
    private final WorkerMetrics metrics;
    private final Clock clock;

    private final Map<String, JobHandler> handlers = new ConcurrentHashMap<>();
    private final Semaphore permits;
    private final AtomicInteger inFlight = new AtomicInteger();
    // Handlers interrupted after their delivery gave up, still holding their job lock.
    private final AtomicInteger lingering = new AtomicInteger();
    private final AtomicBoolean accepting = new AtomicBoolean(true);
    private final Map<ProcessingStatus, AtomicLong> processed = new EnumMap<>(ProcessingStatus.class);
    private final ExecutorService handlerExecutor;

    public WorkerProcessor(
            IdempotencyService idempotency,
            DistributedLockManager locks,
            CheckpointService checkpoints,
            ObjectMapper objectMapper,
            WorkerSettings settings,
            WorkerMetrics metrics,
            Clock clock) {
        this.idempotency = idempotency;
        this.locks = locks;
        this.checkpoints = checkpoints;
        this.objectMapper = objectMapper;
        this.codec = new JobCodec(objectMapper);
        this.settings = settings;
        this.metrics = metrics;
        this.clock = clock;
        this.permits = new Semaphore(settings.maxConcurrentJobs());
        for (ProcessingStatus status : ProcessingStatus.values()) {
            processed.put(status, new AtomicLong());
        }

        AtomicInteger threadCount = new AtomicInteger();
        this.handlerExecutor = Executors.newCachedThreadPool(runnable -> {
            Thread thread = new Thread(runnable, "repairline-job-" + threadCount.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        });
        metrics.registerInFlight(inFlight::get);
    }

    /**
     * Register the handler for a job type, replacing any earlier one.
     */
    public void registerHandler(String jobType, JobHandler handler) {
        handlers.put(jobType, handler);
        log.info("Registered job handler: {}", jobType);
    }

    public List<String> handlerTypes() {
        List<String> types = new ArrayList<>(handlers.keySet());
        Collections.sort(types);
        return types;
    }

    public JobCodec getCodec() {
        return codec;
    }

    public WorkerSettings getSettings() {
        return settings;
    }

    // ========== Processing ==========

    /**
     * Decode and process one broker message.
     */
    public ProcessingResult process(BrokerMessage message) {
        Instant startedAt = clock.instant();
        WorkerJob job;
        try {
            job = codec.decode(message);
        } catch (MalformedJobException e) {
            log.warn("Rejecting message {}: {}", message.messageId(), e.getMessage());
            return finish(UNKNOWN_TYPE_TAG,
                ProcessingResult.rejected(message.messageId(), e.getErrorCode(), e.getMessage()), startedAt);
        }
        return process(job, message.messageId());
    }

    /**
     * Process an already decoded job.
     *
     * @param messageId broker message id, used as the key discriminator of last resort
     */
    public ProcessingResult process(WorkerJob job, String messageId) {
        Instant startedAt = clock.instant();

        if (!accepting.get()) {
            return finish(job.type(), ProcessingResult.retry(messageId, null, SHUTTING_DOWN,
                "Worker " + settings.workerId() + " is shutting down"), startedAt);
        }

        JobHandler handler = handlers.get(job.type());
        if (handler == null) {
            log.warn("No handler registered for job type {} (message {})", job.type(), messageId);
            return finish(job.type(), ProcessingResult.rejected(messageId, UNKNOWN_JOB_TYPE,
                "No handler registered for job type: " + job.type()), startedAt);
        }

        String key;
        try {
            key = job.resolveKey(messageId);
        } catch (InvalidIdempotencyKeyException e) {
            log.warn("Rejecting message {}: {}", messageId, e.getMessage());
            return finish(job.type(),
                ProcessingResult.rejected(messageId, e.getErrorCode(), e.getMessage()), startedAt);
        }
        String keyHash = KeyHashing.hashKey(key);

        if (!permits.tryAcquire()) {
            return finish(job.type(), ProcessingResult.retry(messageId, keyHash, WORKER_BUSY,
                "Worker at capacity (" + settings.maxConcurrentJobs() + " jobs)"), startedAt);
        }
        inFlight.incrementAndGet();
        try (LoggingContext ignored = LoggingContext.forWorker(settings.workerId());
             LoggingContext ignoredMessage = LoggingContext.forMessage(messageId, job.tenantId(), keyHash)) {
            return finish(job.type(), claimAndRun(job, handler, key, messageId), startedAt);
        } finally {
            inFlight.decrementAndGet();
            permits.release();
        }
    }

    private ProcessingResult claimAndRun(WorkerJob job, JobHandler handler, String key, String messageId) {
        CheckAndSetResult claim;
        try {
            claim = idempotency.checkAndSet(key, job.tenantId(), settings.idempotencyTtlSeconds(),
                KeyHashing.hashPayload(job.payload()));
        } catch (IdempotencyConflictException e) {
            return ProcessingResult.rejected(messageId, e.getErrorCode(), e.getMessage());
        }

        IdempotencyRecord record = claim.record();
        if (!claim.isNew()) {
            Optional<ProcessingResult> settled = settleExisting(record, messageId);
            if (settled.isPresent()) {
                return settled.get();
            }
        }
        return runLocked(job, handler, record.keyHash(), messageId);
    }

    /**
     * Decide what an existing record means for this delivery.
     *
     * @return the result to report, or empty when this delivery took ownership of the job
     */
    private Optional<ProcessingResult> settleExisting(IdempotencyRecord record, String messageId) {
        String keyHash = record.keyHash();

        if (record.isCompleted()) {
            log.info("Duplicate delivery absorbed; returning cached result of run {}", record.runId());
            return Optional.of(ProcessingResult.duplicate(messageId, keyHash, record.runId(), record.result()));
        }

        if (record.isFailed() && !record.isRetryableFailure()) {
            log.info("Job already failed permanently: {}", record.errorMessage());
            return Optional.of(ProcessingResult.failed(messageId, keyHash, PREVIOUSLY_FAILED, record.errorMessage()));
        }

        if (record.isFailed()) {
            if (idempotency.reclaim(record)) {
                log.info("Retrying job after transient failure: {}", record.errorMessage());
                return Optional.empty();
            }
            return Optional.of(busy(messageId, keyHash, "another delivery is retrying the job"));
        }

        if (isAbandoned(record) && idempotency.reclaim(record)) {
            log.warn("Taking over job abandoned since {}", record.updatedAt());
            return Optional.empty();
        }
        return Optional.of(busy(messageId, keyHash, "job is in progress"));
    }

    /**
     * A pending record older than the lock TTL whose lock is free was left by a crashed worker.
     */
    private boolean isAbandoned(IdempotencyRecord record) {
        Duration age = Duration.between(record.updatedAt(), clock.instant());
        return age.compareTo(settings.lockTtl()) >= 0
            && locks.inspect(LOCK_PREFIX + record.keyHash()).isEmpty();
    }

    private ProcessingResult runLocked(WorkerJob job, JobHandler handler, String keyHash, String messageId) {
        String lockKey = LOCK_PREFIX + keyHash;
        Optional<ExecutionLock> acquired = locks.acquire(lockKey, settings.lockTtl());
        if (acquired.isEmpty()) {
            return busy(messageId, keyHash, "job lock is held by another worker");
        }
        ExecutionLock lock = acquired.get();
        String runId = runIdFor(job, keyHash);

        RenewalHandle renewal = locks.scheduleRenewal(lock, settings.lockTtl());
        JobContext context = new JobContext(keyHash, runId, locks, lock, renewal, checkpoints);
        Runnable unlock = () -> {
            renewal.close();
            if (context.isLockLost()) {
                log.warn("Lock on job was lost while the handler ran (fence {})", lock.fenceToken());
            }
            if (!locks.release(lockKey, lock.holderToken())) {
                log.warn("Job lock was already released or taken over");
            }
        };

        log.info("Executing job {} (run {}, fence {})", job.type(), runId, lock.fenceToken());
        Map<String, String> mdc = LoggingContext.capture();
        TrackedCall<JobResult> call = TrackedCall.submit(handlerExecutor, () -> {
            try (LoggingContext ignored = LoggingContext.restore(mdc)) {
                return handler.handle(job, context);
            }
        });

        boolean heldUntilExit = false;
        try {
            return settle(call.get(settings.jobTimeout()), keyHash, runId, messageId);
        } catch (ExecutionException e) {
            return settleFailure(e.getCause(), keyHash, messageId);
        } catch (TimeoutException e) {
            String error = "Job timed out after " + settings.jobTimeout().toMillis() + "ms";
            heldUntilExit = true;
            holdUntilExit(call, keyHash, runId, messageId, JOB_TIMEOUT, error, mdc, unlock);
            return ProcessingResult.retry(messageId, keyHash, JOB_TIMEOUT, error);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            heldUntilExit = true;
            holdUntilExit(call, keyHash, runId, messageId, INTERNAL_ERROR, "Worker interrupted", mdc, unlock);
            return ProcessingResult.retry(messageId, keyHash, INTERNAL_ERROR, "Worker interrupted");
        } finally {
            if (!heldUntilExit) {
                unlock.run();
            }
        }
    }

    /**
     * Interrupt a handler that outlived its delivery. The job stays pending and locked,
     * with the lock still renewed, until the handler thread has returned; only then is
     * its outcome recorded and the lock released.
     */
    private void holdUntilExit(TrackedCall<JobResult> call, String keyHash, String runId, String messageId,
                               String errorCode, String error, Map<String, String> mdc, Runnable unlock) {
        lingering.incrementAndGet();
        log.warn("{}; interrupting the handler and holding the job lock until it returns", error);
        call.cancel();
        call.outcome().whenComplete((lateResult, failure) -> {
            try (LoggingContext ignored = LoggingContext.restore(mdc)) {
                if (failure == null) {
                    log.info("Handler returned after its delivery gave up; recording its result");
                    settle(lateResult, keyHash, runId, messageId);
                } else {
                    recordFailure(keyHash, messageId, errorCode, error, true);
                }
            } catch (RuntimeException e) {
                log.error("Could not record the outcome of an interrupted job", e);
            } finally {
                unlock.run();
                lingering.decrementAndGet();
            }
        });
    }

    private ProcessingResult settle(JobResult jobResult, String keyHash, String runId, String messageId) {
        if (jobResult == null) {
            jobResult = JobResult.completed(null);
        }
        if (jobResult.isFailed()) {
            log.warn("Job reported failure: {}", jobResult.error());
            return recordFailure(keyHash, messageId, JobException.HANDLER_ERROR, jobResult.error(), false);
        }
        return recordCompletion(keyHash, runId, messageId, storedOutput(jobResult));
    }

    private ProcessingResult settleFailure(Throwable cause, String keyHash, String messageId) {
        if (cause instanceof JobException jobException) {
            log.warn("Job failed: {} - {}", jobException.getErrorCode(), jobException.getMessage());
            return recordFailure(keyHash, messageId, jobException.getErrorCode(),
                jobException.getMessage(), jobException.isRetryable());
        }
        log.error("Job failed with unexpected error", cause);
        return recordFailure(keyHash, messageId, INTERNAL_ERROR, describe(cause), true);
    }

    private ProcessingResult recordCompletion(String keyHash, String runId, String messageId, JsonNode output) {
        try {
            idempotency.complete(keyHash, runId, output);
        } catch (InvalidStateTransitionException e) {
            log.warn("Idempotency record changed while the job ran: {}", e.getMessage());
            return idempotency.getByHash(keyHash)
                .filter(IdempotencyRecord::isCompleted)
                .map(stored -> ProcessingResult.duplicate(messageId, keyHash, stored.runId(), stored.result()))
                .orElseGet(() -> ProcessingResult.retry(messageId, keyHash, e.getErrorCode(), e.getMessage()));
        }
        log.info("Job completed (run {})", runId);
        return ProcessingResult.completed(messageId, keyHash, runId, output);
    }

    private ProcessingResult recordFailure(String keyHash, String messageId, String errorCode,
                                           String error, boolean retryable) {
        try {
            idempotency.fail(keyHash, error, retryable);
        } catch (InvalidStateTransitionException e) {
            log.warn("Could not record job failure: {}", e.getMessage());
        }
        return retryable
            ? ProcessingResult.retry(messageId, keyHash, errorCode, error)
            : ProcessingResult.failed(messageId, keyHash, errorCode, error);
    }

    private JsonNode storedOutput(JobResult jobResult) {
        if (jobResult.status() != JobResult.Status.SKIPPED) {
            return jobResult.output();
        }
        return objectMapper.createObjectNode()
            .put("skipped", true)
            .put("reason", jobResult.error());
    }

    private ProcessingResult finish(String jobType, ProcessingResult result, Instant startedAt) {
        processed.get(result.status()).incrementAndGet();
        metrics.jobProcessed(jobType, result.status());
        metrics.jobDuration(jobType, result.status(), Duration.between(startedAt, clock.instant()));
        return result;
    }

    private static ProcessingResult busy(String messageId, String keyHash, String reason) {
        log.info("Job busy: {}", reason);
        return ProcessingResult.retry(messageId, keyHash, ResourceBusyException.ERROR_CODE, "Job busy: " + reason);
    }

    /**
     * Run id for the job: the caller's run id, else derived from the key hash so every
     * redelivery of the job resumes the same execution.
     */
    static String runIdFor(WorkerJob job, String keyHash) {
        if (job.runId() != null && !job.runId().isBlank()) {
            return job.runId();
        }
        return "exec_" + keyHash.substring(0, 32);
    }

    private static String describe(Throwable t) {
        return t.getMessage() != null ? t.getMessage() : t.getClass().getSimpleName();
    }

    // ========== Maintenance ==========

    /**
     * Delete job locks released or expired longer ago than {@link #LOCK_PURGE_GRACE},
     * or the lock TTL if that is longer. A purged key starts a new fence sequence.
     *
     * @return number of locks deleted
     */
    public int purgeStaleLocks() {
        Duration grace = settings.lockTtl().compareTo(LOCK_PURGE_GRACE) > 0 ? settings.lockTtl() : LOCK_PURGE_GRACE;
        return locks.purgeExpired(grace);
    }

    // ========== Lifecycle ==========

    public int inFlight() {
        return inFlight.get();
    }

    /**
     * Handlers that overran the job timeout and have not returned yet.
     */
    public int lingering() {
        return lingering.get();
    }

    public boolean isAccepting() {
        return accepting.get();
    }

    public WorkerStats stats() {
        Map<String, Long> counts = new LinkedHashMap<>();
        processed.forEach((status, count) -> counts.put(status.wireName(), count.get()));
        return new WorkerStats(
            settings.workerId(),
            settings.mode().name().toLowerCase(),
            inFlight.get(),
            settings.maxConcurrentJobs(),
            settings.jobTimeout().toMillis(),
            settings.lockTtl().toMillis(),
            accepting.get(),
            handlerTypes(),
            counts
        );
    }

    /**
     * Stop accepting messages and wait for in-flight jobs to finish.
     * Jobs still running at the deadline are interrupted; their locks are released as they unwind.
     *
     * @return true if every in-flight job finished before the deadline
     */
    public boolean shutdown(Duration drainTimeout) {
        if (!accepting.compareAndSet(true, false)) {
            return inFlight.get() == 0;
        }
        log.info("Worker {} draining {} in-flight jobs", settings.workerId(), inFlight.get());

        long deadline = System.nanoTime() + drainTimeout.toNanos();
        try {
            while ((inFlight.get() > 0 || lingering.get() > 0) && System.nanoTime() < deadline) {
                Thread.sleep(50);
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }

        boolean drained = inFlight.get() == 0 && lingering.get() == 0;
        handlerExecutor.shutdown();
        if (!drained) {
            log.warn("Worker {} stopped with {} jobs still in flight", settings.workerId(), inFlight.get());
            handlerExecutor.shutdownNow();
        }
        return drained;
    }
}
