package com.contentvalidator.validation.exception;

import com.contentvalidator.validation.entity.JobStage;

/**
 * A stage change that the pipeline order does not allow.
 */
public class IllegalStageTransitionException extends ValidationServiceException {

    public IllegalStageTransitionException(Long jobId, JobStage from, JobStage to) {
        super("ILLEGAL_STAGE_TRANSITION",
                "Cannot move job from " + from.wireValue() + " to " + (to != null ? to.wireValue() : "null"),
                jobId);
    }
}
