package com.contentvalidator.validation.exception;

/**
 * No earlier completed scan of the same site exists to compare against.
 */
public class NoBaselineAvailableException extends ValidationServiceException {

    public NoBaselineAvailableException(Long jobId) {
        super("NO_BASELINE_AVAILABLE", "No previous completed scan found for comparison", jobId);
    }
}
