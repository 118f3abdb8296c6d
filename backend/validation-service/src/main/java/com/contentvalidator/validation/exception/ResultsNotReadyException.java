package com.contentvalidator.validation.exception;

import com.contentvalidator.validation.entity.ScanJobStatus;

/**
 * Results were requested for a job that has not completed.
 */
public class ResultsNotReadyException extends ValidationServiceException {

    public ResultsNotReadyException(Long jobId, ScanJobStatus status) {
        super("RESULTS_NOT_READY", "Results are available once the job is completed (current status: "
                + status.wireValue() + ")", jobId);
    }
}
