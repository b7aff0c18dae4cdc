package com.repairline.api.rest;

import com.repairline.core.exception.IdempotencyConflictException;
import com.repairline.core.exception.InvalidIdempotencyKeyException;
import com.repairline.core.exception.InvalidStateTransitionException;
import com.repairline.core.exception.NotFoundException;
import com.repairline.core.exception.OptimisticLockException;
import com.repairline.core.exception.RepairlineException;
import com.repairline.core.exception.ResourceBusyException;
import com.repairline.core.exception.WorkflowValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageNotReadableException;
import org.springframework.web.ErrorResponse;
import org.springframework.web.bind.MethodArgumentNotValidException;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.method.annotation.MethodArgumentTypeMismatchException;

import java.time.Instant;
import java.util.stream.Collectors;

/**
 * Maps exceptions to {@code {error, errorCode, timestamp}} bodies.
 * Internal messages of unexpected errors stay in the server log.
 */
@RestControllerAdvice
public class ApiExceptionHandler {

    private static final Logger log = LoggerFactory.getLogger(ApiExceptionHandler.class);

    static final String VALIDATION_FAILED = "VALIDATION_FAILED";
    static final String INTERNAL_ERROR = "INTERNAL_ERROR";

    @ExceptionHandler({WorkflowValidationException.class, InvalidIdempotencyKeyException.class})
    public ResponseEntity<ApiError> handleInvalid(RepairlineException ex) {
        log.warn("Rejected request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, ex.getMessage(), ex.getErrorCode());
    }

    @ExceptionHandler(MethodArgumentNotValidException.class)
    public ResponseEntity<ApiError> handleBeanValidation(MethodArgumentNotValidException ex) {
        String message = ex.getBindingResult().getFieldErrors().stream()
            .map(error -> error.getField() + " " + error.getDefaultMessage())
            .collect(Collectors.joining(", "));
        return respond(HttpStatus.BAD_REQUEST, message, VALIDATION_FAILED);
    }

    @ExceptionHandler({HttpMessageNotReadableException.class, MethodArgumentTypeMismatchException.class,
        IllegalArgumentException.class})
    public ResponseEntity<ApiError> handleBadRequest(Exception ex) {
        log.warn("Bad request: {}", ex.getMessage());
        return respond(HttpStatus.BAD_REQUEST, "Malformed request", VALIDATION_FAILED);
    }

    @ExceptionHandler(NotFoundException.class)
    public ResponseEntity<ApiError> handleNotFound(NotFoundException ex) {
        return respond(HttpStatus.NOT_FOUND, ex.getMessage(), ex.getErrorCode());
    }

    @ExceptionHandler({IdempotencyConflictException.class, InvalidStateTransitionException.class,
        OptimisticLockException.class})
    public ResponseEntity<ApiError> handleConflict(RepairlineException ex) {
        log.warn("State conflict: {}", ex.getMessage());
        return respond(HttpStatus.CONFLICT, ex.getMessage(), ex.getErrorCode());
    }

    @ExceptionHandler(ResourceBusyException.class)
    public ResponseEntity<ApiError> handleBusy(ResourceBusyException ex) {
        return respond(HttpStatus.TOO_MANY_REQUESTS, ex.getMessage(), ex.getErrorCode());
    }

    @ExceptionHandler(RepairlineException.class)
    public ResponseEntity<ApiError> handleRepairline(RepairlineException ex) {
        log.error("Request failed with {}", ex.getErrorCode(), ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR, ex.getMessage(), ex.getErrorCode());
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<ApiError> handleUnexpected(Exception ex) {
        if (ex instanceof ErrorResponse framework && framework.getStatusCode().is4xxClientError()) {
            return ResponseEntity.status(framework.getStatusCode())
                .body(new ApiError(ex.getMessage(), VALIDATION_FAILED, Instant.now()));
        }
        log.error("Unexpected error", ex);
        return respond(HttpStatus.INTERNAL_SERVER_ERROR,
            "An unexpected error occurred. Please try again later.", INTERNAL_ERROR);
    }

    private ResponseEntity<ApiError> respond(HttpStatus status, String message, String errorCode) {
        return ResponseEntity.status(status).body(new ApiError(message, errorCode, Instant.now()));
    }

    public record ApiError(String error, String errorCode, Instant timestamp) {}
}
