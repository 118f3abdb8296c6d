package com.contentvalidator.validation.exception;

import com.contentvalidator.validation.entity.ScanFailureReason;

/**
 * The pipeline cannot continue; the job moves to {@code failed}.
 */
public class JobFatalException extends ValidationServiceException {

    private final ScanFailureReason reason;

    public JobFatalException(Long jobId, ScanFailureReason reason, String message) {
        super("JOB_FATAL", message, jobId);
        this.reason = reason;
    }

    public ScanFailureReason getReason() {
        return reason;
    }
}
