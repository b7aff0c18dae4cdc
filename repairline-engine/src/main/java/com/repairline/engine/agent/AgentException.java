package com.repairline.engine.agent;

/**
 * Failure raised by an agent invocation.
 * Retryable failures are attempted again under the task's retry policy.
 */
public class AgentException extends Exception {

    private final String errorCode;
    private final boolean retryable;

    public AgentException(String errorCode, String message) {
        this(errorCode, message, true);
    }

    public AgentException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public AgentException(String errorCode, String message, Throwable cause, boolean retryable) {
        super(message, cause);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public boolean isRetryable() {
        return retryable;
    }

    public static AgentException permanent(String errorCode, String message) {
        return new AgentException(errorCode, message, false);
    }

    public static AgentException transient_(String errorCode, String message) {
        return new AgentException(errorCode, message, true);
    }
}
