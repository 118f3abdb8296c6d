package com.contentvalidator.validation.exception;

/**
 * Two jobs cannot be diffed: different sites, or one is not completed.
 */
public class IncomparableJobsException extends ValidationServiceException {

    public IncomparableJobsException(Long jobId, String message) {
        super("INCOMPARABLE_JOBS", message, jobId);
    }
}
