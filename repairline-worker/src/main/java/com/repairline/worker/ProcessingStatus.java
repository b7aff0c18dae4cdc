package com.repairline.worker;

/**
 * Outcome of processing one message, and whether the broker should redeliver it.
 */
public enum ProcessingStatus {
    /** The handler ran and succeeded. */
    COMPLETED(true),
    /** An earlier delivery already completed; the cached result is returned. */
    DUPLICATE(true),
    /** Permanent failure, recorded terminally. */
    FAILED(true),
    /** Busy or transient failure; redeliver later. */
    RETRY(false),
    /** The message can never be processed (malformed, unknown type, key conflict). */
    REJECTED(true);

    private final boolean acknowledge;

    ProcessingStatus(boolean acknowledge) {
        this.acknowledge = acknowledge;
    }

    public boolean shouldAcknowledge() {
        return acknowledge;
    }

    public String wireName() {
        return name().toLowerCase();
    }
}
