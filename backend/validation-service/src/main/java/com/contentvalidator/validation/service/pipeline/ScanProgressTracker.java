package com.contentvalidator.validation.service.pipeline;

import com.contentvalidator.validation.dto.ProgressSnapshot;
import com.contentvalidator.validation.entity.JobStage;
import com.contentvalidator.validation.entity.ScanFailureReason;
import com.contentvalidator.validation.entity.ScanJob;
import com.contentvalidator.validation.repository.ScanJobRepository;
import com.contentvalidator.validation.service.progress.ProgressBroadcaster;
import lombok.extern.slf4j.Slf4j;

import java.util.Map;

/**
 * Single writer of one running job. Every change persists the job and publishes
 * a fresh snapshot with the next sequence number; callers on validator threads
 * are serialized by the tracker's lock.
 */
@Slf4j
public class ScanProgressTracker {

    private final ScanJobRepository scanJobRepository;
    private final ProgressBroadcaster progressBroadcaster;
    private final Object lock = new Object();

    private ScanJob job;

    public ScanProgressTracker(ScanJob job, ScanJobRepository scanJobRepository,
                               ProgressBroadcaster progressBroadcaster) {
        this.job = job;
        this.scanJobRepository = scanJobRepository;
        this.progressBroadcaster = progressBroadcaster;
    }

    public Long jobId() {
        return job.getId();
    }

    public ScanJob job() {
        synchronized (lock) {
            return job;
        }
    }

    public void transition(JobStage target, String message) {
        synchronized (lock) {
            JobStage from = job.getStage();
            ScanJobStateMachine.transition(job, target);
            log.info("Scan job {} stage {} -> {}", job.getId(), from.wireValue(), target.wireValue());
            commit(message);
        }
    }

    public void totalPages(int total) {
        synchronized (lock) {
            job.setTotalPages(total);
            commit("Found " + total + " pages");
        }
    }

    public void currentPage(String url, String message) {
        synchronized (lock) {
            job.setCurrentPage(url);
            commit(message);
        }
    }

    public void pageScraped(String url) {
        synchronized (lock) {
            job.setScrapedCount(job.getScrapedCount() + 1);
            job.setCurrentPage(url);
            commit("Scraped " + job.getScrapedCount() + "/" + job.getTotalPages());
        }
    }

    public void pageValidated(String url) {
        synchronized (lock) {
            job.setValidatedCount(job.getValidatedCount() + 1);
            job.setCurrentPage(url);
            commit("Validated " + job.getValidatedCount() + "/" + job.getScrapedCount());
        }
    }

    public void complete(Map<String, Object> summary) {
        synchronized (lock) {
            job.setSummary(summary);
            ScanJobStateMachine.transition(job, JobStage.COMPLETED);
            log.info("Scan job {} completed", job.getId());
            commit("Completed");
        }
    }

    /**
     * Move the job to failed. No-op when it is already terminal.
     */
    public void fail(ScanFailureReason reason, String message) {
        synchronized (lock) {
            if (job.isTerminal()) {
                log.warn("Scan job {} already {}, ignoring failure {}", job.getId(),
                        job.getStatus().wireValue(), reason.getCode());
                return;
            }
            job.setFailureReason(reason);
            job.setErrorMessage(truncate(message != null ? message : reason.getDescription()));
            ScanJobStateMachine.transition(job, JobStage.FAILED);
            commit(reason.getDescription());
        }
    }

    private void commit(String message) {
        job.setProgressMessage(truncate(message));
        job.setProgressSequence(job.getProgressSequence() + 1);
        job = scanJobRepository.save(job);
        progressBroadcaster.publish(job.getId(), ProgressSnapshot.fromJob(job));
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= 1024) {
            return value;
        }
        return value.substring(0, 1021) + "...";
    }
}
