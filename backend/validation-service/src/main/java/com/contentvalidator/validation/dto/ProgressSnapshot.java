package com.contentvalidator.validation.dto;

import com.contentvalidator.validation.entity.JobStage;
import com.contentvalidator.validation.entity.ScanFailureReason;
import com.contentvalidator.validation.entity.ScanJob;
import com.contentvalidator.validation.entity.ScanJobStatus;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.time.ZoneId;

/**
 * Immutable view of a job's progress at one point in time.
 * Snapshots of one job are totally ordered by {@code sequence}.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ProgressSnapshot(
        Long jobId,
        JobStage stage,
        ScanJobStatus status,
        int totalPages,
        int scraped,
        int validated,
        String currentPage,
        String message,
        ScanFailureReason failureReason,
        long sequence,
        long timestamp
) {

    @JsonIgnore
    public boolean isTerminal() {
        return stage != null && stage.isTerminal();
    }

    /**
     * Rebuild the snapshot last persisted on the job.
     */
    public static ProgressSnapshot fromJob(ScanJob job) {
        long updated = job.getUpdatedAt() != null
                ? job.getUpdatedAt().atZone(ZoneId.systemDefault()).toInstant().toEpochMilli()
                : System.currentTimeMillis();
        return new ProgressSnapshot(
                job.getId(),
                job.getStage(),
                job.getStatus(),
                valueOf(job.getTotalPages()),
                valueOf(job.getScrapedCount()),
                valueOf(job.getValidatedCount()),
                job.getCurrentPage(),
                job.getProgressMessage(),
                job.getFailureReason(),
                job.getProgressSequence() != null ? job.getProgressSequence() : 0L,
                updated
        );
    }

    private static int valueOf(Integer value) {
        return value != null ? value : 0;
    }
}
