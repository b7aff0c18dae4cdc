package com.repairline.worker;

/**
 * How messages reach the worker.
 */
public enum WorkerMode {
    /** The broker calls the worker's HTTP ingress once per message. */
    PUSH,
    /** The worker polls a subscription and acknowledges each message itself. */
    PULL;

    public static WorkerMode fromString(String value) {
        return value != null && value.trim().equalsIgnoreCase("pull") ? PULL : PUSH;
    }
}
