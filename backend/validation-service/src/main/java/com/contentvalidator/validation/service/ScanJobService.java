package com.contentvalidator.validation.service;

import com.contentvalidator.validation.dto.ProgressSnapshot;
import com.contentvalidator.validation.dto.ValidateRequest;
import com.contentvalidator.validation.entity.ExclusionRule;
import com.contentvalidator.validation.entity.PageSource;
import com.contentvalidator.validation.entity.ScanFailureReason;
import com.contentvalidator.validation.entity.ScanJob;
import com.contentvalidator.validation.entity.ScanJobStatus;
import com.contentvalidator.validation.entity.ScanPage;
import com.contentvalidator.validation.exception.ScanNotFoundException;
import com.contentvalidator.validation.exception.ValidationServiceException;
import com.contentvalidator.validation.repository.ScanJobRepository;
import com.contentvalidator.validation.repository.ScanPageRepository;
import com.contentvalidator.validation.service.pipeline.CancellationRegistry;
import com.contentvalidator.validation.service.pipeline.PageExclusionFilter;
import com.contentvalidator.validation.service.pipeline.ScanJobDispatcher;
import com.contentvalidator.validation.service.pipeline.ScanProgressTracker;
import com.contentvalidator.validation.service.progress.ProgressBroadcaster;
import com.contentvalidator.validation.util.Fingerprints;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.PageRequest;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.PatternSyntaxException;

/**
 * Creates, looks up, lists and cancels scan jobs.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ScanJobService {

    private static final int MAX_RECENT = 100;

    private final ScanJobRepository scanJobRepository;
    private final ScanPageRepository scanPageRepository;
    private final ScanJobDispatcher scanJobDispatcher;
    private final CancellationRegistry cancellationRegistry;
    private final ProgressBroadcaster progressBroadcaster;
    private final ScanMetrics scanMetrics;

    /**
     * Persist a new job with its target pages and queue it.
     */
    public ScanJob createJob(ValidateRequest request) {
        String baseUrl = request.getBaseUrl() != null ? request.getBaseUrl().trim() : "";
        if (baseUrl.isBlank()) {
            throw new ValidationServiceException("INVALID_REQUEST", "baseUrl is required");
        }
        List<ExclusionRule> exclusionRules = request.getExclusionRules() != null
                ? new ArrayList<>(request.getExclusionRules())
                : new ArrayList<>();
        try {
            PageExclusionFilter.validate(exclusionRules);
        } catch (PatternSyntaxException e) {
            throw new ValidationServiceException("INVALID_REQUEST", "Invalid url_regex exclusion: " + e.getDescription());
        }

        ScanJob job = scanJobRepository.save(ScanJob.builder()
                .baseUrl(baseUrl)
                .siteKey(Fingerprints.normalizeUrl(baseUrl))
                .applyDefaultExclusions(request.isApplyDefaultExclusions())
                .exclusionRules(exclusionRules)
                .guidelineSetId(request.getGuidelineSetId())
                .guidelineVersion(request.getGuidelineVersion())
                .runDeterministic(request.isRunDeterministic())
                .runLlm(request.isRunLlm())
                .runAxe(request.isRunAxe())
                .build());

        List<ScanPage> pages = buildPages(job.getId(), request.getPageUrls());
        if (!pages.isEmpty()) {
            scanPageRepository.saveAll(pages);
            job.setTotalPages(pages.size());
            job = scanJobRepository.save(job);
        }

        log.info("Created scan job {} for {} with {} pages (deterministic={}, llm={}, axe={})",
                job.getId(), baseUrl, pages.size(), job.getRunDeterministic(), job.getRunLlm(), job.getRunAxe());
        scanJobDispatcher.dispatch(job.getId());
        return job;
    }

    public ScanJob getJob(Long jobId) {
        return scanJobRepository.findById(jobId)
                .orElseThrow(() -> new ScanNotFoundException(jobId));
    }

    public ProgressSnapshot getSnapshot(Long jobId) {
        return progressBroadcaster.currentSnapshot(jobId)
                .orElseThrow(() -> new ScanNotFoundException(jobId));
    }

    /**
     * Cancel a job. A pending job is failed right away; a running one is flagged and
     * the worker observes the flag before its next page or stage. A terminal job is
     * returned unchanged.
     */
    public ScanJob cancel(Long jobId) {
        ScanJob job = getJob(jobId);
        if (job.isTerminal()) {
            log.info("Scan job {} already {}, cancel ignored", jobId, job.getStatus().wireValue());
            return job;
        }
        // also flags a worker that picked the job up after it was loaded here
        cancellationRegistry.request(jobId);
        if (job.getStatus() == ScanJobStatus.PENDING) {
            log.info("Scan job {} cancelled before it started", jobId);
            ScanProgressTracker tracker = new ScanProgressTracker(job, scanJobRepository, progressBroadcaster);
            tracker.fail(ScanFailureReason.JOB_CANCELLED, "Job was cancelled");
            scanMetrics.jobFailed();
            return tracker.job();
        }
        return job;
    }

    public List<ScanJob> listByBaseUrl(String baseUrl) {
        return scanJobRepository.findBySiteKeyOrderByCreatedAtDesc(Fingerprints.normalizeUrl(baseUrl));
    }

    public List<ScanJob> listRecent(int limit) {
        int size = Math.max(1, Math.min(limit, MAX_RECENT));
        return scanJobRepository.findRecent(PageRequest.of(0, size));
    }

    /**
     * Restart handling: running jobs are failed, never resumed; pending jobs are queued again.
     */
    public void recoverAfterRestart() {
        List<ScanJob> interrupted = scanJobRepository.findByStatus(ScanJobStatus.RUNNING);
        for (ScanJob job : interrupted) {
            log.warn("Scan job {} was running at shutdown, marking failed", job.getId());
            new ScanProgressTracker(job, scanJobRepository, progressBroadcaster)
                    .fail(ScanFailureReason.INTERRUPTED_BY_RESTART, null);
            scanMetrics.jobFailed();
        }

        List<ScanJob> pending = scanJobRepository.findByStatus(ScanJobStatus.PENDING);
        for (ScanJob job : pending) {
            scanJobDispatcher.dispatch(job.getId());
        }
        if (!interrupted.isEmpty() || !pending.isEmpty()) {
            log.info("Scan recovery: {} interrupted jobs failed, {} pending jobs re-queued",
                    interrupted.size(), pending.size());
        }
    }

    private List<ScanPage> buildPages(Long jobId, List<String> pageUrls) {
        Map<String, String> unique = new LinkedHashMap<>();
        if (pageUrls != null) {
            for (String url : pageUrls) {
                if (url != null && !url.isBlank()) {
                    unique.putIfAbsent(Fingerprints.normalizeUrl(url), url.trim());
                }
            }
        }
        List<ScanPage> pages = new ArrayList<>();
        for (String url : unique.values()) {
            pages.add(ScanPage.builder()
                    .scanJobId(jobId)
                    .url(url)
                    .source(PageSource.MANUAL)
                    .build());
        }
        return pages;
    }
}
