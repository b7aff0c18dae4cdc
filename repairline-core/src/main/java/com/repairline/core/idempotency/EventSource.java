package com.repairline.core.idempotency;

import java.util.Arrays;
import java.util.Optional;

/**
 * Origin of a job, the first segment of every idempotency key.
 */
public enum EventSource {
    /** Webhook deliveries; discriminator is the delivery UUID. */
    GITHUB("github", 3),
    /** Chat-command callbacks; discriminator is the callback id. */
    SLACK("slack", 3),
    /** Scheduled runs; discriminator is scheduleId plus ISO-8601 fire time. */
    SCHEDULER("scheduler", 4),
    /** Direct API calls; discriminator is the caller-supplied request id. */
    API("api", 3);

    private final String prefix;
    private final int minParts;

    EventSource(String prefix, int minParts) {
        this.prefix = prefix;
        this.minParts = minParts;
    }

    public String prefix() {
        return prefix;
    }

    int minParts() {
        return minParts;
    }

    public static Optional<EventSource> fromPrefix(String prefix) {
        return Arrays.stream(values())
            .filter(s -> s.prefix.equals(prefix))
            .findFirst();
    }
}
