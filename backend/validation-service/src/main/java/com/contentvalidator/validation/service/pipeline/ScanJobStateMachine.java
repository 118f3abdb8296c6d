package com.contentvalidator.validation.service.pipeline;

import com.contentvalidator.validation.entity.JobStage;
import com.contentvalidator.validation.entity.ScanJob;
import com.contentvalidator.validation.exception.IllegalStageTransitionException;

import java.time.LocalDateTime;

/**
 * The only place a job's stage and status change.
 */
public final class ScanJobStateMachine {

    private ScanJobStateMachine() {
    }

    /**
     * Move the job to {@code target}, deriving its status and stamping
     * start/finish times.
     *
     * @throws IllegalStageTransitionException when target is neither the next
     *         stage nor FAILED, or the job is already terminal
     */
    public static ScanJob transition(ScanJob job, JobStage target) {
        JobStage current = job.getStage() != null ? job.getStage() : JobStage.PENDING;
        if (!current.canTransitionTo(target)) {
            throw new IllegalStageTransitionException(job.getId(), current, target);
        }
        job.setStage(target);
        job.setStatus(target.status());

        LocalDateTime now = LocalDateTime.now();
        if (current == JobStage.PENDING && job.getStartedAt() == null) {
            job.setStartedAt(now);
        }
        if (target.isTerminal()) {
            job.setFinishedAt(now);
            job.setCurrentPage(null);
        }
        return job;
    }
}
