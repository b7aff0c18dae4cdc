package com.repairline.worker.job;

import com.fasterxml.jackson.databind.JsonNode;
import com.repairline.core.model.Checkpoint;
import com.repairline.core.model.ExecutionLock;
import com.repairline.engine.lock.DistributedLockManager.RenewalHandle;
import com.repairline.engine.service.CheckpointService;
import com.repairline.engine.service.LockService;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Context provided to job handlers during execution.
 */
public class JobContext {

    private final String keyHash;
    private final String runId;
    private final LockService locks;
    private final ExecutionLock lock;
    private final RenewalHandle renewal;
    private final CheckpointService checkpoints;
    private final AtomicBoolean lockLost = new AtomicBoolean(false);

    public JobContext(
            String keyHash,
            String runId,
            LockService locks,
            ExecutionLock lock,
            RenewalHandle renewal,
            CheckpointService checkpoints) {
        this.keyHash = keyHash;
        this.runId = runId;
        this.locks = locks;
        this.lock = lock;
        this.renewal = renewal;
        this.checkpoints = checkpoints;
    }

    /**
     * Hash of the idempotency key. Use it when making external calls to ensure exactly-once effect.
     */
    public String getKeyHash() {
        return keyHash;
    }

    /**
     * Run id recorded on the idempotency record. Stable across redeliveries of the same job.
     */
    public String getRunId() {
        return runId;
    }

    /**
     * Push the lock expiry out by {@code ttl} from now.
     * Call this before a step expected to outlast the background renewal period.
     *
     * @return true if extended, false if the lock was lost to another worker
     */
    public boolean extendLock(Duration ttl) {
        boolean renewed = locks.renew(lock.resourceKey(), lock.holderToken(), ttl);
        if (!renewed) {
            lockLost.set(true);
        }
        return renewed;
    }

    /**
     * Whether the job's lock expired under it. A handler seeing this should stop writing state.
     */
    public boolean isLockLost() {
        return lockLost.get() || renewal.isLost();
    }

    public long getFenceToken() {
        return lock.fenceToken();
    }

    // ========== Checkpoints ==========

    /**
     * Save progress under the run id with the next sequence number.
     */
    public Checkpoint saveCheckpoint(JsonNode state) {
        return checkpoints.save(runId, checkpoints.nextSequence(runId), state);
    }

    /**
     * Latest progress saved by this or an earlier delivery of the job.
     */
    public Optional<JsonNode> loadCheckpoint() {
        return checkpoints.load(runId);
    }
}
