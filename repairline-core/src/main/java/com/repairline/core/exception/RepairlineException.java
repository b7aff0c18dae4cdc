package com.repairline.core.exception;

/**
 * Base exception for all job-execution errors.
 */
public class RepairlineException extends RuntimeException {

    private final String errorCode;

    public RepairlineException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
    }

    public RepairlineException(String errorCode, String message, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
    }

    public String getErrorCode() {
        return errorCode;
    }
}
