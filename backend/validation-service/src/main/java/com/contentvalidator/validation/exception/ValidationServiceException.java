package com.contentvalidator.validation.exception;

/**
 * Base class for validation service errors.
 * Carries a stable error code and, where one applies, the job it concerns.
 */
public class ValidationServiceException extends RuntimeException {

    private final String errorCode;
    private final Long jobId;

    public ValidationServiceException(String message) {
        super(message);
        this.errorCode = "VALIDATION_ERROR";
        this.jobId = null;
    }

    public ValidationServiceException(String errorCode, String message) {
        super(message);
        this.errorCode = errorCode;
        this.jobId = null;
    }

    public ValidationServiceException(String errorCode, String message, Long jobId) {
        super(message);
        this.errorCode = errorCode;
        this.jobId = jobId;
    }

    public ValidationServiceException(String errorCode, String message, Long jobId, Throwable cause) {
        super(message, cause);
        this.errorCode = errorCode;
        this.jobId = jobId;
    }

    public String getErrorCode() {
        return errorCode;
    }

    public Long getJobId() {
        return jobId;
    }
}
