package com.contentvalidator.validation.service.pipeline;

import com.contentvalidator.validation.client.ContentValidator;
import com.contentvalidator.validation.client.DeterministicRuleChecker;
import com.contentvalidator.validation.client.PageDiscoveryClient;
import com.contentvalidator.validation.client.PageScraper;
import com.contentvalidator.validation.client.UrlGuard;
import com.contentvalidator.validation.config.ScanProperties;
import com.contentvalidator.validation.dto.ContentChunk;
import com.contentvalidator.validation.dto.IssueSummary;
import com.contentvalidator.validation.dto.PageCandidate;
import com.contentvalidator.validation.dto.PageContent;
import com.contentvalidator.validation.dto.ProgressSnapshot;
import com.contentvalidator.validation.dto.RawFinding;
import com.contentvalidator.validation.entity.ExclusionRule;
import com.contentvalidator.validation.entity.ExclusionRuleType;
import com.contentvalidator.validation.entity.Issue;
import com.contentvalidator.validation.entity.IssueSource;
import com.contentvalidator.validation.entity.JobStage;
import com.contentvalidator.validation.entity.PageSource;
import com.contentvalidator.validation.entity.ScanFailureReason;
import com.contentvalidator.validation.entity.ScanJob;
import com.contentvalidator.validation.entity.ScanJobStatus;
import com.contentvalidator.validation.entity.ScanPage;
import com.contentvalidator.validation.entity.ScrapeStatus;
import com.contentvalidator.validation.exception.PageFailureException;
import com.contentvalidator.validation.repository.IssueRepository;
import com.contentvalidator.validation.repository.ScanJobRepository;
import com.contentvalidator.validation.repository.ScanPageRepository;
import com.contentvalidator.validation.service.ScanMetrics;
import com.contentvalidator.validation.service.progress.ProgressBroadcaster;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
class ScanPipelineTest {

    private static final Long JOB_ID = 1L;
    private static final String BASE_URL = "https://example.com";

    @Mock
    private ScanJobRepository scanJobRepository;

    @Mock
    private ScanPageRepository scanPageRepository;

    @Mock
    private IssueRepository issueRepository;

    @Mock
    private PageDiscoveryClient pageDiscoveryClient;

    @Mock
    private PageScraper pageScraper;

    @Mock
    private ContentValidator accessibilityValidator;

    @Mock
    private ContentValidator llmValidator;

    @Mock
    private ProgressBroadcaster progressBroadcaster;

    @Mock
    private UrlGuard urlGuard;

    private CancellationRegistry cancellationRegistry;
    private ScanMetrics metrics;
    private ScanPipeline scanPipeline;
    private ScanJob job;
    private List<ScanPage> pages;
    private final List<Issue> storedIssues = new ArrayList<>();
    private ExecutorService pool;

    @BeforeEach
    void setUp() {
        job = ScanJob.builder().id(JOB_ID).baseUrl(BASE_URL).runLlm(false).build();
        pages = new ArrayList<>();
        for (int i = 1; i <= 10; i++) {
            pages.add(ScanPage.builder().id((long) i).scanJobId(JOB_ID).url(BASE_URL + "/p" + i).build());
        }

        when(scanJobRepository.findById(JOB_ID)).thenAnswer(inv -> Optional.of(job));
        when(scanJobRepository.save(any(ScanJob.class))).thenAnswer(inv -> inv.getArgument(0));
        when(scanPageRepository.findByScanJobIdOrderByIdAsc(JOB_ID)).thenAnswer(inv -> pages);
        when(scanPageRepository.save(any(ScanPage.class))).thenAnswer(inv -> inv.getArgument(0));
        when(scanPageRepository.saveAll(anyList())).thenAnswer(inv -> inv.getArgument(0));
        when(issueRepository.saveAll(anyList())).thenAnswer(inv -> {
            List<Issue> batch = inv.getArgument(0);
            synchronized (storedIssues) {
                storedIssues.addAll(batch);
            }
            return batch;
        });
        when(issueRepository.findByScanJobIdOrderByIdAsc(JOB_ID)).thenAnswer(inv -> storedIssues);

        when(pageScraper.scrape(anyString())).thenAnswer(inv -> content(inv.getArgument(0)));

        when(accessibilityValidator.source()).thenReturn(IssueSource.AXE);
        when(accessibilityValidator.isAvailable()).thenReturn(true);
        when(accessibilityValidator.validate(any(), any())).thenReturn(List.of());
        when(llmValidator.source()).thenReturn(IssueSource.LLM);
        when(llmValidator.isAvailable()).thenReturn(true);

        metrics = new ScanMetrics(new SimpleMeterRegistry());
        metrics.initMetrics();
        cancellationRegistry = new CancellationRegistry();

        scanPipeline = pipeline(new ScanProperties(), Runnable::run);
    }

    @AfterEach
    void tearDown() {
        if (pool != null) {
            pool.shutdownNow();
        }
    }

    private ScanPipeline pipeline(ScanProperties properties, Executor executor) {
        return new ScanPipeline(
                scanJobRepository, scanPageRepository, issueRepository, new IssueNormalizer(),
                pageDiscoveryClient, pageScraper, new PageExclusionFilter(), urlGuard,
                List.of(new DeterministicRuleChecker(), accessibilityValidator, llmValidator),
                progressBroadcaster, cancellationRegistry, properties, metrics, executor);
    }

    private void recordWritingThreads(Set<String> threads) {
        when(scanJobRepository.save(any(ScanJob.class))).thenAnswer(inv -> {
            threads.add(Thread.currentThread().getName());
            return inv.getArgument(0);
        });
        when(scanPageRepository.save(any(ScanPage.class))).thenAnswer(inv -> {
            threads.add(Thread.currentThread().getName());
            return inv.getArgument(0);
        });
        when(issueRepository.saveAll(anyList())).thenAnswer(inv -> {
            threads.add(Thread.currentThread().getName());
            List<Issue> batch = inv.getArgument(0);
            synchronized (storedIssues) {
                storedIssues.addAll(batch);
            }
            return batch;
        });
    }

    private static void pause(long millis) {
        try {
            Thread.sleep(millis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    private static PageContent content(String url) {
        return new PageContent(url, "Page " + url, "<html></html>",
                List.of(new ContentChunk(List.of("Overview"), "For details please click here today.", "hash")));
    }

    private List<ProgressSnapshot> publishedSnapshots() {
        ArgumentCaptor<ProgressSnapshot> captor = ArgumentCaptor.forClass(ProgressSnapshot.class);
        verify(progressBroadcaster, atLeastOnce()).publish(eq(JOB_ID), captor.capture());
        return captor.getAllValues();
    }

    private ScanPage page(int index) {
        return pages.get(index - 1);
    }

    @Test
    @DisplayName("Failing pages are recorded and the job still completes with the remaining pages")
    void partialScrapeFailureCompletes() {
        // given
        when(pageScraper.scrape(anyString())).thenAnswer(inv -> {
            String url = inv.getArgument(0);
            if (url.endsWith("/p3") || url.endsWith("/p7")) {
                throw new PageFailureException(url, ScanFailureReason.CONNECTION_REFUSED, "Connection refused");
            }
            return content(url);
        });

        // when
        scanPipeline.run(JOB_ID);

        // then
        assertThat(job.getStage()).isEqualTo(JobStage.COMPLETED);
        assertThat(job.getStatus()).isEqualTo(ScanJobStatus.COMPLETED);
        assertThat(job.getTotalPages()).isEqualTo(10);
        assertThat(job.getScrapedCount()).isEqualTo(8);
        assertThat(job.getValidatedCount()).isEqualTo(8);
        assertThat(job.getFinishedAt()).isNotNull();

        for (int failed : new int[]{3, 7}) {
            ScanPage page = page(failed);
            assertThat(page.getScrapeStatus()).isEqualTo(ScrapeStatus.FAILED);
            assertThat(page.getErrors()).hasSize(1);
            assertThat(page.getErrors().get(0))
                    .containsEntry("stage", "scraping")
                    .containsEntry("reason", "connection_refused");
        }
        assertThat(page(1).getScrapeStatus()).isEqualTo(ScrapeStatus.DONE);

        assertThat(storedIssues).hasSize(8);
        assertThat(storedIssues)
                .extracting(Issue::getPageUrl)
                .doesNotContain(BASE_URL + "/p3", BASE_URL + "/p7");
        assertThat(storedIssues).allMatch(issue -> issue.getSource() == IssueSource.DETERMINISTIC);

        IssueSummary summary = IssueSummary.fromMap(job.getSummary());
        assertThat(summary.getTotal()).isEqualTo(8);
        assertThat(summary.getScrapedPages()).isEqualTo(8);
        assertThat(summary.getPageErrors()).isEqualTo(2);
    }

    @Test
    @DisplayName("Published snapshots have strictly increasing sequences and end on the terminal one")
    void snapshotsStrictlyIncreasing() {
        scanPipeline.run(JOB_ID);

        List<ProgressSnapshot> snapshots = publishedSnapshots();
        for (int i = 1; i < snapshots.size(); i++) {
            assertThat(snapshots.get(i).sequence()).isGreaterThan(snapshots.get(i - 1).sequence());
        }
        assertThat(snapshots.get(snapshots.size() - 1).stage()).isEqualTo(JobStage.COMPLETED);
        assertThat(snapshots).filteredOn(ProgressSnapshot::isTerminal).hasSize(1);
        assertThat(snapshots)
                .extracting(ProgressSnapshot::stage)
                .containsSubsequence(JobStage.SCRAPING, JobStage.VALIDATING, JobStage.RUNNING_TOOLS,
                        JobStage.FINALIZING, JobStage.COMPLETED);
    }

    @Test
    @DisplayName("Cancellation requested before start fails the job without scraping")
    void cancelledBeforeStart() {
        cancellationRegistry.request(JOB_ID);

        scanPipeline.run(JOB_ID);

        assertThat(job.getStage()).isEqualTo(JobStage.FAILED);
        assertThat(job.getFailureReason()).isEqualTo(ScanFailureReason.JOB_CANCELLED);
        verify(pageScraper, never()).scrape(anyString());
        assertThat(cancellationRegistry.isRequested(JOB_ID)).isFalse();
    }

    @Test
    @DisplayName("Cancellation during scraping stops before the next page")
    void cancelledDuringScraping() {
        // given
        AtomicInteger calls = new AtomicInteger();
        when(pageScraper.scrape(anyString())).thenAnswer(inv -> {
            if (calls.incrementAndGet() == 2) {
                cancellationRegistry.request(JOB_ID);
            }
            return content(inv.getArgument(0));
        });

        // when
        scanPipeline.run(JOB_ID);

        // then
        verify(pageScraper, times(2)).scrape(anyString());
        assertThat(job.getStage()).isEqualTo(JobStage.FAILED);
        assertThat(job.getFailureReason()).isEqualTo(ScanFailureReason.JOB_CANCELLED);
        assertThat(job.getScrapedCount()).isEqualTo(2);
        assertThat(storedIssues).isEmpty();
    }

    @Test
    @DisplayName("Job fails as unreachable when no page can be scraped")
    void allPagesFail() {
        when(pageScraper.scrape(anyString())).thenThrow(new RuntimeException("Connection refused"));

        scanPipeline.run(JOB_ID);

        assertThat(job.getStage()).isEqualTo(JobStage.FAILED);
        assertThat(job.getFailureReason()).isEqualTo(ScanFailureReason.BASE_URL_UNREACHABLE);
        assertThat(pages).allMatch(page -> page.getScrapeStatus() == ScrapeStatus.FAILED);
        assertThat(job.errorPayload()).containsEntry("reason", "base_url_unreachable");
    }

    @Test
    @DisplayName("Job fails with no_pages when nothing is given and discovery finds nothing")
    void noPagesDiscovered() {
        when(scanPageRepository.findByScanJobIdOrderByIdAsc(JOB_ID)).thenReturn(List.of());
        when(pageDiscoveryClient.discoverPages(eq(BASE_URL), anyInt())).thenReturn(List.of());

        scanPipeline.run(JOB_ID);

        assertThat(job.getStage()).isEqualTo(JobStage.FAILED);
        assertThat(job.getFailureReason()).isEqualTo(ScanFailureReason.NO_PAGES);
        verify(pageScraper, never()).scrape(anyString());
    }

    @Test
    @DisplayName("Accessibility failure is a page error, not a job failure")
    void accessibilityFailureRecordedOnPage() {
        pages = new ArrayList<>(pages.subList(0, 2));
        when(accessibilityValidator.validate(any(), any()))
                .thenThrow(new RuntimeException("axe runner returned status=502"));

        scanPipeline.run(JOB_ID);

        assertThat(job.getStage()).isEqualTo(JobStage.COMPLETED);
        for (ScanPage page : pages) {
            assertThat(page.getErrors()).hasSize(1);
            Map<String, Object> error = page.getErrors().get(0);
            assertThat(error)
                    .containsEntry("stage", "running_tools")
                    .containsEntry("source", "axe")
                    .containsEntry("reason", "http_error");
        }
        assertThat(IssueSummary.fromMap(job.getSummary()).getPageErrors()).isEqualTo(2);
    }

    @Test
    @DisplayName("Malformed findings are dropped and counted")
    void malformedFindingsCounted() {
        // given
        job.setRunLlm(true);
        job.setRunDeterministic(false);
        pages = new ArrayList<>(pages.subList(0, 1));
        when(llmValidator.validate(any(), any())).thenReturn(List.of(
                RawFinding.builder().category("tone").severity("high")
                        .evidence("Buy now!!!").explanation("Pushy call to action").build(),
                RawFinding.builder().category("tone").severity("low").build()
        ));

        // when
        scanPipeline.run(JOB_ID);

        // then
        assertThat(job.getStage()).isEqualTo(JobStage.COMPLETED);
        assertThat(storedIssues).hasSize(1);
        assertThat(storedIssues.get(0).getSource()).isEqualTo(IssueSource.LLM);
        IssueSummary summary = IssueSummary.fromMap(job.getSummary());
        assertThat(summary.getMalformedFindings()).isEqualTo(1);
        assertThat(summary.getHigh()).isEqualTo(1);
    }

    @Test
    @DisplayName("Requested validator without configuration is skipped")
    void unavailableValidatorSkipped() {
        job.setRunLlm(true);
        when(llmValidator.isAvailable()).thenReturn(false);

        scanPipeline.run(JOB_ID);

        assertThat(job.getStage()).isEqualTo(JobStage.COMPLETED);
        verify(llmValidator, never()).validate(any(), any());
        assertThat(pages).allMatch(page -> !page.hasErrors());
    }

    @Test
    @DisplayName("Terminal jobs are not run again")
    void terminalJobSkipped() {
        job.setStage(JobStage.COMPLETED);
        job.setStatus(ScanJobStatus.COMPLETED);

        scanPipeline.run(JOB_ID);

        verify(pageScraper, never()).scrape(anyString());
        verify(progressBroadcaster, never()).publish(any(), any());
    }

    @Test
    @DisplayName("A validator exceeding its time limit becomes a timeout page error and the job completes")
    void slowValidatorTimesOut() {
        // given
        pool = Executors.newFixedThreadPool(4);
        ScanProperties properties = new ScanProperties();
        properties.getTimeouts().setValidator(Duration.ofMillis(200));
        scanPipeline = pipeline(properties, pool);

        job.setRunLlm(true);
        pages = new ArrayList<>(pages.subList(0, 2));
        when(llmValidator.validate(any(), any())).thenAnswer(inv -> {
            pause(2000);
            return List.of();
        });
        Set<String> writingThreads = ConcurrentHashMap.newKeySet();
        recordWritingThreads(writingThreads);

        // when
        scanPipeline.run(JOB_ID);

        // then
        assertThat(job.getStatus()).isEqualTo(ScanJobStatus.COMPLETED);
        assertThat(job.getValidatedCount()).isEqualTo(2);
        for (ScanPage page : pages) {
            assertThat(page.getErrors()).hasSize(1);
            assertThat(page.getErrors().get(0))
                    .containsEntry("stage", "validating")
                    .containsEntry("source", "llm")
                    .containsEntry("reason", "timeout");
        }
        assertThat(storedIssues).hasSize(2);
        assertThat(writingThreads).containsExactly(Thread.currentThread().getName());
    }

    @Test
    @DisplayName("A page whose fetch exceeds its time limit becomes a timeout scrape error")
    void slowScrapeTimesOut() {
        // given
        pool = Executors.newFixedThreadPool(2);
        ScanProperties properties = new ScanProperties();
        properties.getTimeouts().setScrape(Duration.ofMillis(200));
        scanPipeline = pipeline(properties, pool);

        pages = new ArrayList<>(pages.subList(0, 2));
        when(pageScraper.scrape(anyString())).thenAnswer(inv -> {
            String url = inv.getArgument(0);
            if (url.endsWith("/p2")) {
                pause(2000);
            }
            return content(url);
        });

        // when
        scanPipeline.run(JOB_ID);

        // then
        assertThat(job.getStatus()).isEqualTo(ScanJobStatus.COMPLETED);
        assertThat(job.getScrapedCount()).isEqualTo(1);
        assertThat(page(2).getScrapeStatus()).isEqualTo(ScrapeStatus.FAILED);
        assertThat(page(2).getErrors().get(0))
                .containsEntry("stage", "scraping")
                .containsEntry("reason", "timeout");
    }

    @Test
    @DisplayName("No more pages are validated at once than the configured concurrency")
    void validationConcurrencyBounded() {
        // given
        pool = Executors.newFixedThreadPool(8);
        ScanProperties properties = new ScanProperties();
        properties.getPipeline().setValidationConcurrency(2);
        scanPipeline = pipeline(properties, pool);

        job.setRunLlm(true);
        job.setRunDeterministic(false);
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        when(llmValidator.validate(any(), any())).thenAnswer(inv -> {
            int now = active.incrementAndGet();
            maxActive.accumulateAndGet(now, Math::max);
            pause(50);
            active.decrementAndGet();
            return List.of();
        });
        Set<String> writingThreads = ConcurrentHashMap.newKeySet();
        recordWritingThreads(writingThreads);

        // when
        scanPipeline.run(JOB_ID);

        // then
        assertThat(job.getStatus()).isEqualTo(ScanJobStatus.COMPLETED);
        assertThat(job.getValidatedCount()).isEqualTo(10);
        verify(llmValidator, times(10)).validate(any(), any());
        assertThat(maxActive.get()).isBetween(1, 2);
        assertThat(writingThreads).containsExactly(Thread.currentThread().getName());
    }

    @Test
    @DisplayName("Discovered pages matching an exclusion rule are kept as skipped and never fetched")
    void excludedPagesSkipped() {
        // given
        List<ScanPage> saved = new ArrayList<>();
        when(scanPageRepository.findByScanJobIdOrderByIdAsc(JOB_ID)).thenAnswer(inv -> saved);
        when(scanPageRepository.saveAll(anyList())).thenAnswer(inv -> {
            List<ScanPage> batch = inv.getArgument(0);
            saved.addAll(batch);
            return batch;
        });
        job.setExclusionRules(List.of(new ExclusionRule(ExclusionRuleType.PATH_BLOCKLIST, "/archive")));
        when(pageDiscoveryClient.discoverPages(eq(BASE_URL), anyInt())).thenReturn(List.of(
                new PageCandidate(BASE_URL + "/", "Home", PageSource.CRAWL),
                new PageCandidate(BASE_URL + "/privacy-policy", "Privacy", PageSource.NAV),
                new PageCandidate(BASE_URL + "/archive/2019", "Old news", PageSource.CRAWL),
                new PageCandidate(BASE_URL + "/products", "Products", PageSource.NAV)));

        // when
        scanPipeline.run(JOB_ID);

        // then
        assertThat(job.getStatus()).isEqualTo(ScanJobStatus.COMPLETED);
        assertThat(job.getTotalPages()).isEqualTo(2);
        assertThat(saved).hasSize(4);
        assertThat(saved)
                .filteredOn(page -> page.getScrapeStatus() == ScrapeStatus.SKIPPED)
                .extracting(ScanPage::getUrl)
                .containsExactly(BASE_URL + "/privacy-policy", BASE_URL + "/archive/2019");
        verify(pageScraper, never()).scrape(BASE_URL + "/privacy-policy");
        verify(pageScraper, never()).scrape(BASE_URL + "/archive/2019");
        assertThat(IssueSummary.fromMap(job.getSummary()).getSkippedPages()).isEqualTo(2);
    }

    @Test
    @DisplayName("Job fails with no_pages when every discovered page is excluded")
    void allDiscoveredPagesExcluded() {
        when(scanPageRepository.findByScanJobIdOrderByIdAsc(JOB_ID)).thenReturn(List.of());
        when(pageDiscoveryClient.discoverPages(eq(BASE_URL), anyInt())).thenReturn(List.of(
                new PageCandidate(BASE_URL + "/login", null, PageSource.NAV),
                new PageCandidate(BASE_URL + "/account", null, PageSource.NAV)));

        scanPipeline.run(JOB_ID);

        assertThat(job.getFailureReason()).isEqualTo(ScanFailureReason.NO_PAGES);
        verify(pageScraper, never()).scrape(anyString());
    }

    @Test
    @DisplayName("A base URL on an internal network fails the job with url_blocked before any fetch")
    void blockedBaseUrlFailsJob() {
        job.setBaseUrl("http://169.254.169.254");
        doThrow(new PageFailureException("http://169.254.169.254", ScanFailureReason.URL_BLOCKED,
                "Refusing to fetch http://169.254.169.254: host 169.254.169.254 is reserved"))
                .when(urlGuard).check("http://169.254.169.254");

        scanPipeline.run(JOB_ID);

        assertThat(job.getStatus()).isEqualTo(ScanJobStatus.FAILED);
        assertThat(job.getFailureReason()).isEqualTo(ScanFailureReason.URL_BLOCKED);
        assertThat(job.errorPayload()).containsEntry("reason", "url_blocked");
        verify(pageScraper, never()).scrape(anyString());
        verify(pageDiscoveryClient, never()).discoverPages(anyString(), anyInt());
    }

    @Test
    @DisplayName("A blocked page is a url_blocked page error while the rest of the job carries on")
    void blockedPageRecordedOnPage() {
        when(pageScraper.scrape(anyString())).thenAnswer(inv -> {
            String url = inv.getArgument(0);
            if (url.endsWith("/p4")) {
                throw new PageFailureException(url, ScanFailureReason.URL_BLOCKED, "Refusing to fetch " + url);
            }
            return content(url);
        });

        scanPipeline.run(JOB_ID);

        assertThat(job.getStatus()).isEqualTo(ScanJobStatus.COMPLETED);
        assertThat(page(4).getErrors().get(0)).containsEntry("reason", "url_blocked");
        assertThat(job.getScrapedCount()).isEqualTo(9);
    }
}
