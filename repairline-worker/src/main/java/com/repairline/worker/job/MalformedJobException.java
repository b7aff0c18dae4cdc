package com.repairline.worker.job;

import com.repairline.core.exception.RepairlineException;

/**
 * Thrown when a broker message does not decode into a usable job.
 * Redelivering such a message can never succeed, so it is acknowledged.
 */
public class MalformedJobException extends RepairlineException {

    public static final String ERROR_CODE = "MALFORMED_JOB";

    public MalformedJobException(String message) {
        super(ERROR_CODE, message);
    }

    public MalformedJobException(String message, Throwable cause) {
        super(ERROR_CODE, message, cause);
    }
}
