package com.repairline.worker.job;

/**
 * Failure raised by a job handler.
 * Retryable failures are left unacknowledged so the broker redelivers the message;
 * permanent failures are recorded and acknowledged.
 */
public class JobException extends Exception {

    public static final String HANDLER_ERROR = "HANDLER_ERROR";

    private final String errorCode;
    private final boolean retryable;

    public JobException(String errorCode, String message) {
        this(errorCode, message, true);
    }

    public JobException(String errorCode, String message, boolean retryable) {
        super(message);
        this.errorCode = errorCode;
        this.retryable = retryable;
    }

    public JobException(String errorCode, String message, Throwable cause, boolean retryable) {
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

    public static JobException permanent(String errorCode, String message) {
        return new JobException(errorCode, message, false);
    }

    public static JobException transient_(String errorCode, String message) {
        return new JobException(errorCode, message, true);
    }
}
