package com.contentvalidator.validation.exception;

import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.RestControllerAdvice;
import org.springframework.web.bind.support.WebExchangeBindException;
import org.springframework.web.server.ServerWebInputException;

import java.time.LocalDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Maps service exceptions to the JSON error body used by every endpoint.
 */
@RestControllerAdvice(basePackages = "com.contentvalidator.validation.controller")
@Slf4j
public class ValidationExceptionHandler {

    @ExceptionHandler(ScanNotFoundException.class)
    public ResponseEntity<Map<String, Object>> handleNotFound(ScanNotFoundException ex) {
        log.debug("Scan not found: {}", ex.getJobId());
        return respond(ex.getErrorCode(), ex.getMessage(), ex.getJobId(), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(NoBaselineAvailableException.class)
    public ResponseEntity<Map<String, Object>> handleNoBaseline(NoBaselineAvailableException ex) {
        log.info("No baseline for scan {}", ex.getJobId());
        return respond(ex.getErrorCode(), ex.getMessage(), ex.getJobId(), HttpStatus.NOT_FOUND);
    }

    @ExceptionHandler(IncomparableJobsException.class)
    public ResponseEntity<Map<String, Object>> handleIncomparable(IncomparableJobsException ex) {
        log.info("Incomparable scans: {}", ex.getMessage());
        return respond(ex.getErrorCode(), ex.getMessage(), ex.getJobId(), HttpStatus.CONFLICT);
    }

    @ExceptionHandler(ResultsNotReadyException.class)
    public ResponseEntity<Map<String, Object>> handleNotReady(ResultsNotReadyException ex) {
        return respond(ex.getErrorCode(), ex.getMessage(), ex.getJobId(), HttpStatus.CONFLICT);
    }

    @ExceptionHandler(WebExchangeBindException.class)
    public ResponseEntity<Map<String, Object>> handleBind(WebExchangeBindException ex) {
        String message = ex.getFieldErrors().stream()
                .map(error -> error.getField() + ": " + error.getDefaultMessage())
                .collect(Collectors.joining(", "));
        return respond("INVALID_REQUEST", message, null, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ServerWebInputException.class)
    public ResponseEntity<Map<String, Object>> handleUnreadableBody(ServerWebInputException ex) {
        log.debug("Unreadable request: {}", ex.getMessage());
        return respond("INVALID_REQUEST", ex.getReason() != null ? ex.getReason() : "Malformed request body",
                null, HttpStatus.BAD_REQUEST);
    }

    @ExceptionHandler(ValidationServiceException.class)
    public ResponseEntity<Map<String, Object>> handleServiceException(ValidationServiceException ex) {
        HttpStatus status = "INVALID_REQUEST".equals(ex.getErrorCode())
                ? HttpStatus.BAD_REQUEST
                : HttpStatus.INTERNAL_SERVER_ERROR;
        if (status.is5xxServerError()) {
            log.error("Validation service error: {}", ex.getMessage(), ex);
        }
        return respond(ex.getErrorCode(), ex.getMessage(), ex.getJobId(), status);
    }

    @ExceptionHandler(Exception.class)
    public ResponseEntity<Map<String, Object>> handleGenericException(Exception ex) {
        log.error("Unexpected error: {}", ex.getMessage(), ex);
        return respond("INTERNAL_ERROR", "An unexpected error occurred", null, HttpStatus.INTERNAL_SERVER_ERROR);
    }

    private ResponseEntity<Map<String, Object>> respond(String errorCode, String message, Long jobId, HttpStatus status) {
        Map<String, Object> response = new HashMap<>();
        response.put("success", false);
        response.put("error", errorCode);
        response.put("message", message);
        response.put("status", status.value());
        response.put("timestamp", LocalDateTime.now().toString());
        if (jobId != null) {
            response.put("jobId", jobId);
        }
        return ResponseEntity.status(status).body(response);
    }
}
