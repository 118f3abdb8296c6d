package com.contentvalidator.validation.exception;

public class ScanNotFoundException extends ValidationServiceException {

    public ScanNotFoundException(Long jobId) {
        super("SCAN_NOT_FOUND", "Scan job not found: " + jobId, jobId);
    }
}
