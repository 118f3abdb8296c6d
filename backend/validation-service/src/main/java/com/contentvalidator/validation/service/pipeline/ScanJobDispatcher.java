package com.contentvalidator.validation.service.pipeline;

import com.contentvalidator.validation.entity.ScanFailureReason;
import com.contentvalidator.validation.entity.ScanJob;
import com.contentvalidator.validation.repository.ScanJobRepository;
import com.contentvalidator.validation.service.ScanMetrics;
import com.contentvalidator.validation.service.progress.ProgressBroadcaster;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Component;

import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

/**
 * Hands jobs to the bounded worker pool. A job the pool refuses is failed
 * with {@code queue_rejected} rather than left pending.
 */
@Component
@Slf4j
public class ScanJobDispatcher {

    private final ScanPipeline scanPipeline;
    private final ScanJobRepository scanJobRepository;
    private final ProgressBroadcaster progressBroadcaster;
    private final ScanMetrics scanMetrics;
    private final Executor scanJobExecutor;

    public ScanJobDispatcher(
            ScanPipeline scanPipeline,
            ScanJobRepository scanJobRepository,
            ProgressBroadcaster progressBroadcaster,
            ScanMetrics scanMetrics,
            @Qualifier("scanJobExecutor") Executor scanJobExecutor
    ) {
        this.scanPipeline = scanPipeline;
        this.scanJobRepository = scanJobRepository;
        this.progressBroadcaster = progressBroadcaster;
        this.scanMetrics = scanMetrics;
        this.scanJobExecutor = scanJobExecutor;
    }

    public void dispatch(Long jobId) {
        try {
            scanJobExecutor.execute(() -> scanPipeline.run(jobId));
            log.info("Scan job {} queued", jobId);
        } catch (RejectedExecutionException e) {
            log.warn("Scan job {} rejected by worker pool: {}", jobId, e.getMessage());
            reject(jobId);
        }
    }

    private void reject(Long jobId) {
        ScanJob job = scanJobRepository.findById(jobId).orElse(null);
        if (job == null || job.isTerminal()) {
            return;
        }
        new ScanProgressTracker(job, scanJobRepository, progressBroadcaster)
                .fail(ScanFailureReason.QUEUE_REJECTED, "Too many scans in progress, try again later");
        scanMetrics.jobFailed();
    }
}
