package com.contentvalidator.validation.service.pipeline;

import com.contentvalidator.validation.client.ContentValidator;
import com.contentvalidator.validation.client.PageDiscoveryClient;
import com.contentvalidator.validation.client.PageScraper;
import com.contentvalidator.validation.client.UrlGuard;
import com.contentvalidator.validation.config.ScanProperties;
import com.contentvalidator.validation.dto.IssueSummary;
import com.contentvalidator.validation.dto.PageCandidate;
import com.contentvalidator.validation.dto.PageContent;
import com.contentvalidator.validation.dto.RawFinding;
import com.contentvalidator.validation.dto.ValidationContext;
import com.contentvalidator.validation.entity.ExclusionRule;
import com.contentvalidator.validation.entity.Issue;
import com.contentvalidator.validation.entity.IssueSource;
import com.contentvalidator.validation.entity.JobStage;
import com.contentvalidator.validation.entity.ScanFailureReason;
import com.contentvalidator.validation.entity.ScanJob;
import com.contentvalidator.validation.entity.ScanPage;
import com.contentvalidator.validation.entity.ScrapeStatus;
import com.contentvalidator.validation.exception.JobFatalException;
import com.contentvalidator.validation.exception.MalformedFindingException;
import com.contentvalidator.validation.exception.PageFailureException;
import com.contentvalidator.validation.repository.IssueRepository;
import com.contentvalidator.validation.repository.ScanJobRepository;
import com.contentvalidator.validation.repository.ScanPageRepository;
import com.contentvalidator.validation.service.ScanMetrics;
import com.contentvalidator.validation.service.progress.ProgressBroadcaster;
import com.contentvalidator.validation.util.Fingerprints;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Runs one scan job through its stages on the calling worker thread.
 *
 * <p>Per-page failures are recorded on the page and the job carries on; only
 * {@link JobFatalException} or an unexpected error ends the job in {@code failed}.
 * Cancellation is observed before each page and at every stage boundary.
 *
 * <p>Validator calls run on {@code validatorExecutor}, but every write to the job,
 * its pages and its issues happens on the worker thread that called {@link #run(Long)}.
 */
@Service
@Slf4j
public class ScanPipeline {

    private final ScanJobRepository scanJobRepository;
    private final ScanPageRepository scanPageRepository;
    private final IssueRepository issueRepository;
    private final IssueNormalizer issueNormalizer;
    private final PageDiscoveryClient pageDiscoveryClient;
    private final PageScraper pageScraper;
    private final PageExclusionFilter pageExclusionFilter;
    private final UrlGuard urlGuard;
    private final Map<IssueSource, ContentValidator> validators;
    private final ProgressBroadcaster progressBroadcaster;
    private final CancellationRegistry cancellationRegistry;
    private final ScanProperties scanProperties;
    private final ScanMetrics scanMetrics;
    private final Executor validatorExecutor;

    public ScanPipeline(
            ScanJobRepository scanJobRepository,
            ScanPageRepository scanPageRepository,
            IssueRepository issueRepository,
            IssueNormalizer issueNormalizer,
            PageDiscoveryClient pageDiscoveryClient,
            PageScraper pageScraper,
            PageExclusionFilter pageExclusionFilter,
            UrlGuard urlGuard,
            List<ContentValidator> validators,
            ProgressBroadcaster progressBroadcaster,
            CancellationRegistry cancellationRegistry,
            ScanProperties scanProperties,
            ScanMetrics scanMetrics,
            @Qualifier("validatorExecutor") Executor validatorExecutor
    ) {
        this.scanJobRepository = scanJobRepository;
        this.scanPageRepository = scanPageRepository;
        this.issueRepository = issueRepository;
        this.issueNormalizer = issueNormalizer;
        this.pageDiscoveryClient = pageDiscoveryClient;
        this.pageScraper = pageScraper;
        this.pageExclusionFilter = pageExclusionFilter;
        this.urlGuard = urlGuard;
        this.validators = new EnumMap<>(IssueSource.class);
        for (ContentValidator validator : validators) {
            this.validators.put(validator.source(), validator);
        }
        this.progressBroadcaster = progressBroadcaster;
        this.cancellationRegistry = cancellationRegistry;
        this.scanProperties = scanProperties;
        this.scanMetrics = scanMetrics;
        this.validatorExecutor = validatorExecutor;
    }

    private record ScrapedPage(ScanPage page, PageContent content) {
    }

    private record ValidatorOutcome(IssueSource source, List<RawFinding> findings, Throwable error) {
    }

    private record PageOutcome(ScrapedPage scrapedPage, List<CompletableFuture<ValidatorOutcome>> calls) {
    }

    public void run(Long jobId) {
        ScanJob job = scanJobRepository.findById(jobId).orElse(null);
        if (job == null) {
            log.warn("Scan job {} not found, nothing to run", jobId);
            return;
        }
        if (job.isTerminal()) {
            log.info("Scan job {} already {}, skipping", jobId, job.getStatus().wireValue());
            cancellationRegistry.clear(jobId);
            return;
        }

        ScanProgressTracker tracker = new ScanProgressTracker(job, scanJobRepository, progressBroadcaster);
        AtomicInteger malformed = new AtomicInteger();
        long startNanos = System.nanoTime();

        try {
            checkCancelled(jobId);
            tracker.transition(JobStage.SCRAPING, "Preparing pages");
            checkBaseUrl(job);
            List<ScanPage> pages = resolvePages(tracker);
            List<ScrapedPage> scraped = scrapePages(tracker, pages);

            checkCancelled(jobId);
            tracker.transition(JobStage.VALIDATING, "Validating content");
            validatePages(tracker, scraped, malformed);

            checkCancelled(jobId);
            tracker.transition(JobStage.RUNNING_TOOLS, "Running accessibility checks");
            runAccessibility(tracker, scraped, malformed);

            checkCancelled(jobId);
            tracker.transition(JobStage.FINALIZING, "Computing summary");
            IssueSummary summary = summarize(tracker.job(), malformed.get());
            tracker.complete(summary.toMap());

            scanMetrics.jobCompleted(Duration.ofNanos(System.nanoTime() - startNanos));
            log.info("Scan job {} finished: {} issues ({} high, {} medium, {} low) across {} pages",
                    jobId, summary.getTotal(), summary.getHigh(), summary.getMedium(), summary.getLow(),
                    summary.getScrapedPages());
        } catch (JobFatalException e) {
            log.error("Scan job {} failed: {} ({})", jobId, e.getMessage(), e.getReason().getCode());
            failJob(tracker, e.getReason(), e.getMessage());
        } catch (Exception e) {
            Throwable cause = unwrap(e);
            log.error("Scan job {} failed unexpectedly: {}", jobId, cause.getMessage(), cause);
            failJob(tracker, ScanFailureReason.fromException(cause), cause.getMessage());
        } finally {
            cancellationRegistry.clear(jobId);
        }
    }

    private void failJob(ScanProgressTracker tracker, ScanFailureReason reason, String message) {
        try {
            tracker.fail(reason, message);
            scanMetrics.jobFailed();
        } catch (RuntimeException e) {
            log.error("Could not persist failure of scan job {}: {}", tracker.jobId(), e.getMessage(), e);
        }
    }

    private void checkCancelled(Long jobId) {
        if (cancellationRegistry.isRequested(jobId)) {
            throw new JobFatalException(jobId, ScanFailureReason.JOB_CANCELLED, "Job was cancelled");
        }
    }

    // Scraping

    private void checkBaseUrl(ScanJob job) {
        try {
            urlGuard.check(job.getBaseUrl());
        } catch (PageFailureException e) {
            throw new JobFatalException(job.getId(), e.getReason(), e.getMessage());
        }
    }

    private List<ScanPage> resolvePages(ScanProgressTracker tracker) {
        ScanJob job = tracker.job();
        List<ScanPage> pages = scanPageRepository.findByScanJobIdOrderByIdAsc(job.getId());
        if (pages.isEmpty()) {
            pages = discoverPages(job);
        }
        List<ScanPage> included = pages.stream()
                .filter(page -> page.getScrapeStatus() != ScrapeStatus.SKIPPED)
                .toList();
        if (included.isEmpty()) {
            String message = pages.isEmpty()
                    ? "No pages to validate for " + job.getBaseUrl()
                    : "All " + pages.size() + " discovered pages of " + job.getBaseUrl() + " are excluded";
            throw new JobFatalException(job.getId(), ScanFailureReason.NO_PAGES, message);
        }
        tracker.totalPages(included.size());
        return included;
    }

    /**
     * Discover and persist the job's pages. Pages matching an exclusion rule are kept
     * as {@code skipped} so they show up in the results but are never fetched.
     */
    private List<ScanPage> discoverPages(ScanJob job) {
        List<PageCandidate> candidates;
        try {
            candidates = pageDiscoveryClient.discoverPages(job.getBaseUrl(), scanProperties.getDiscovery().getMaxPages());
        } catch (PageFailureException e) {
            throw new JobFatalException(job.getId(), e.getReason() == ScanFailureReason.URL_BLOCKED
                    ? ScanFailureReason.URL_BLOCKED
                    : ScanFailureReason.BASE_URL_UNREACHABLE,
                    "Page discovery failed for " + job.getBaseUrl() + ": " + e.getMessage());
        } catch (RuntimeException e) {
            throw new JobFatalException(job.getId(), ScanFailureReason.BASE_URL_UNREACHABLE,
                    "Page discovery failed for " + job.getBaseUrl() + ": " + e.getMessage());
        }

        List<ExclusionRule> rules = pageExclusionFilter.rulesFor(job);
        Set<String> seen = new LinkedHashSet<>();
        List<ScanPage> pages = new ArrayList<>();
        int excluded = 0;
        for (PageCandidate candidate : candidates) {
            if (candidate.url() == null || !seen.add(Fingerprints.normalizeUrl(candidate.url()))) {
                continue;
            }
            ScanPage page = ScanPage.builder()
                    .scanJobId(job.getId())
                    .url(candidate.url())
                    .title(candidate.title())
                    .source(candidate.source())
                    .build();
            if (pageExclusionFilter.isExcluded(candidate.url(), rules)) {
                page.setScrapeStatus(ScrapeStatus.SKIPPED);
                excluded++;
            }
            pages.add(page);
        }
        log.info("Discovered {} pages for scan job {}, {} excluded", pages.size(), job.getId(), excluded);
        return pages.isEmpty() ? pages : scanPageRepository.saveAll(pages);
    }

    private List<ScrapedPage> scrapePages(ScanProgressTracker tracker, List<ScanPage> pages) {
        Long jobId = tracker.jobId();
        Duration timeout = scanProperties.getTimeouts().getScrape();
        List<ScrapedPage> scraped = new ArrayList<>();

        for (ScanPage page : pages) {
            checkCancelled(jobId);
            tracker.currentPage(page.getUrl(), "Scraping " + page.getUrl());
            try {
                PageContent content = callWithTimeout(() -> pageScraper.scrape(page.getUrl()), timeout);
                if (content == null || content.isEmpty()) {
                    throw new PageFailureException(page.getUrl(), ScanFailureReason.EMPTY_CONTENT,
                            ScanFailureReason.EMPTY_CONTENT.getDescription());
                }
                page.markScraped(content.title());
                ScanPage saved = scanPageRepository.save(page);
                scraped.add(new ScrapedPage(saved, content));
                tracker.pageScraped(page.getUrl());
            } catch (RuntimeException e) {
                Throwable cause = unwrap(e);
                ScanFailureReason reason = cause instanceof PageFailureException pfe
                        ? pfe.getReason()
                        : ScanFailureReason.fromException(cause);
                log.warn("Scrape failed for {} (job {}): {} - {}", page.getUrl(), jobId, reason.getCode(), cause.getMessage());
                page.markScrapeFailed(reason, cause.getMessage());
                scanPageRepository.save(page);
                scanMetrics.pageFailed();
            }
        }

        if (scraped.isEmpty()) {
            throw new JobFatalException(jobId, ScanFailureReason.BASE_URL_UNREACHABLE,
                    "None of the " + pages.size() + " pages could be scraped");
        }
        return scraped;
    }

    // Validating

    private void validatePages(ScanProgressTracker tracker, List<ScrapedPage> scraped, AtomicInteger malformed) {
        ScanJob job = tracker.job();
        List<ContentValidator> enabled = new ArrayList<>();
        if (Boolean.TRUE.equals(job.getRunDeterministic())) {
            addIfAvailable(enabled, IssueSource.DETERMINISTIC, job.getId());
        }
        if (Boolean.TRUE.equals(job.getRunLlm())) {
            addIfAvailable(enabled, IssueSource.LLM, job.getId());
        }

        fanOut(tracker, scraped, enabled, JobStage.VALIDATING,
                scanProperties.getPipeline().getValidationConcurrency(),
                scanProperties.getTimeouts().getValidator(), malformed, true);
    }

    private void runAccessibility(ScanProgressTracker tracker, List<ScrapedPage> scraped, AtomicInteger malformed) {
        ScanJob job = tracker.job();
        List<ContentValidator> enabled = new ArrayList<>();
        if (Boolean.TRUE.equals(job.getRunAxe())) {
            addIfAvailable(enabled, IssueSource.AXE, job.getId());
        }
        if (enabled.isEmpty()) {
            return;
        }
        fanOut(tracker, scraped, enabled, JobStage.RUNNING_TOOLS,
                scanProperties.getPipeline().getAccessibilityConcurrency(),
                scanProperties.getTimeouts().getAxe(), malformed, false);
    }

    private void addIfAvailable(List<ContentValidator> enabled, IssueSource source, Long jobId) {
        ContentValidator validator = validators.get(source);
        if (validator != null && validator.isAvailable()) {
            enabled.add(validator);
        } else {
            log.warn("Validator {} requested for scan job {} but not configured, skipping", source.wireValue(), jobId);
        }
    }

    /**
     * Run the given validators for every page, at most {@code concurrency} pages at a time.
     * Completed pages are handed back through a queue and recorded on the calling thread,
     * so callbacks of the executor or of the timeout scheduler never touch job state.
     */
    private void fanOut(ScanProgressTracker tracker, List<ScrapedPage> scraped, List<ContentValidator> enabled,
                        JobStage stage, int concurrency, Duration timeout, AtomicInteger malformed,
                        boolean countValidated) {
        ScanJob job = tracker.job();
        ValidationContext context = new ValidationContext(
                job.getId(), job.getBaseUrl(), job.getGuidelineSetId(), job.getGuidelineVersion());
        int limit = Math.max(1, concurrency);
        BlockingQueue<PageOutcome> finished = new LinkedBlockingQueue<>();
        Iterator<ScrapedPage> remaining = scraped.iterator();
        boolean cancelled = false;
        int started = 0;
        int recorded = 0;

        while (true) {
            while (!cancelled && remaining.hasNext() && started - recorded < limit) {
                if (cancellationRegistry.isRequested(job.getId())) {
                    log.info("Scan job {} cancelled during {}, not starting further pages", job.getId(), stage.wireValue());
                    cancelled = true;
                    break;
                }
                ScrapedPage scrapedPage = remaining.next();
                List<CompletableFuture<ValidatorOutcome>> calls = new ArrayList<>();
                for (ContentValidator validator : enabled) {
                    calls.add(callValidator(validator, scrapedPage.content(), context, timeout));
                }
                CompletableFuture.allOf(calls.toArray(new CompletableFuture[0]))
                        .whenComplete((ignored, error) -> finished.add(new PageOutcome(scrapedPage, calls)));
                started++;
            }
            if (recorded == started) {
                return;
            }

            PageOutcome outcome = awaitPage(finished, job.getId());
            List<ValidatorOutcome> outcomes = outcome.calls().stream().map(CompletableFuture::join).toList();
            recordOutcomes(outcome.scrapedPage().page(), stage, outcomes, malformed);
            if (countValidated) {
                tracker.pageValidated(outcome.scrapedPage().page().getUrl());
            }
            recorded++;
        }
    }

    private static PageOutcome awaitPage(BlockingQueue<PageOutcome> finished, Long jobId) {
        try {
            return finished.take();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for validators of scan job " + jobId, e);
        }
    }

    private CompletableFuture<ValidatorOutcome> callValidator(ContentValidator validator, PageContent content,
                                                              ValidationContext context, Duration timeout) {
        return CompletableFuture
                .supplyAsync(() -> validator.validate(content, context), validatorExecutor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .handle((findings, error) -> error == null
                        ? new ValidatorOutcome(validator.source(), findings != null ? findings : List.of(), null)
                        : new ValidatorOutcome(validator.source(), List.of(), unwrap(error)));
    }

    private void recordOutcomes(ScanPage page, JobStage stage, List<ValidatorOutcome> outcomes, AtomicInteger malformed) {
        List<Issue> issues = new ArrayList<>();
        boolean pageChanged = false;

        for (ValidatorOutcome outcome : outcomes) {
            if (outcome.error() != null) {
                ScanFailureReason reason = outcome.error() instanceof PageFailureException pfe
                        ? pfe.getReason()
                        : validatorReason(outcome.error());
                log.warn("Validator {} failed for {}: {} - {}", outcome.source().wireValue(), page.getUrl(),
                        reason.getCode(), outcome.error().getMessage());
                page.recordError(stage, outcome.source(), reason, outcome.error().getMessage());
                scanMetrics.pageFailed();
                pageChanged = true;
                continue;
            }
            for (RawFinding finding : outcome.findings()) {
                try {
                    issues.add(issueNormalizer.normalize(finding, outcome.source(), page));
                } catch (MalformedFindingException e) {
                    malformed.incrementAndGet();
                    scanMetrics.findingDropped();
                    log.warn("Dropped malformed {} finding on {}: {}", outcome.source().wireValue(),
                            page.getUrl(), e.getMessage());
                }
            }
        }

        if (!issues.isEmpty()) {
            issueRepository.saveAll(issues);
        }
        if (pageChanged) {
            scanPageRepository.save(page);
        }
    }

    // Finalizing

    private IssueSummary summarize(ScanJob job, int malformedFindings) {
        List<Issue> issues = issueRepository.findByScanJobIdOrderByIdAsc(job.getId());
        List<ScanPage> pages = scanPageRepository.findByScanJobIdOrderByIdAsc(job.getId());

        IssueSummary summary = IssueSummary.of(issues);
        summary.setTotalPages(job.getTotalPages());
        summary.setScrapedPages(job.getScrapedCount());
        summary.setValidatedPages(job.getValidatedCount());
        summary.setPageErrors(pages.stream().mapToInt(p -> p.getErrors() != null ? p.getErrors().size() : 0).sum());
        summary.setSkippedPages((int) pages.stream().filter(p -> p.getScrapeStatus() == ScrapeStatus.SKIPPED).count());
        summary.setMalformedFindings(malformedFindings);
        return summary;
    }

    // Helpers

    private <T> T callWithTimeout(Supplier<T> call, Duration timeout) {
        return CompletableFuture.supplyAsync(call, validatorExecutor)
                .orTimeout(timeout.toMillis(), TimeUnit.MILLISECONDS)
                .join();
    }

    private static ScanFailureReason validatorReason(Throwable error) {
        ScanFailureReason reason = ScanFailureReason.fromException(error);
        return reason == ScanFailureReason.UNKNOWN ? ScanFailureReason.VALIDATOR_ERROR : reason;
    }

    private static Throwable unwrap(Throwable error) {
        Throwable current = error;
        while ((current instanceof CompletionException || current instanceof ExecutionException)
                && current.getCause() != null) {
            current = current.getCause();
        }
        return current;
    }
}
