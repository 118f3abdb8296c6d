package com.contentvalidator.validation.service.progress;

import com.contentvalidator.validation.config.ScanProperties;
import com.contentvalidator.validation.dto.ProgressEvent;
import com.contentvalidator.validation.dto.ProgressSnapshot;
import com.contentvalidator.validation.entity.JobStage;
import com.contentvalidator.validation.entity.ScanJob;
import com.contentvalidator.validation.exception.ScanNotFoundException;
import com.contentvalidator.validation.repository.ScanJobRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.test.StepVerifier;

import java.time.Duration;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ProgressBroadcasterTest {

    private static final Long JOB_ID = 1L;

    @Mock
    private ScanJobRepository scanJobRepository;

    private ProgressBroadcaster broadcaster;

    @BeforeEach
    void setUp() {
        ScanProperties properties = new ScanProperties();
        properties.getProgress().setChannelRetention(Duration.ofMillis(300));
        broadcaster = new ProgressBroadcaster(scanJobRepository, properties);
    }

    private static ProgressSnapshot snapshot(JobStage stage, int scraped, long sequence) {
        return new ProgressSnapshot(JOB_ID, stage, stage.status(), 10, scraped, 0, null,
                "step " + sequence, null, sequence, System.currentTimeMillis());
    }

    @Test
    @DisplayName("Late subscriber gets the current snapshot first, then later ones, then done")
    void lateSubscriberStartsFromCurrent() {
        // given
        broadcaster.publish(JOB_ID, snapshot(JobStage.SCRAPING, 1, 1));
        broadcaster.publish(JOB_ID, snapshot(JobStage.SCRAPING, 2, 2));
        broadcaster.publish(JOB_ID, snapshot(JobStage.SCRAPING, 3, 3));

        // when / then
        StepVerifier.create(broadcaster.subscribe(JOB_ID))
                .assertNext(event -> {
                    assertThat(event.eventType()).isEqualTo(ProgressEvent.PROGRESS);
                    assertThat(event.snapshot().sequence()).isEqualTo(3);
                })
                .then(() -> broadcaster.publish(JOB_ID, snapshot(JobStage.VALIDATING, 3, 4)))
                .assertNext(event -> assertThat(event.snapshot().sequence()).isEqualTo(4))
                .then(() -> broadcaster.publish(JOB_ID, snapshot(JobStage.COMPLETED, 3, 5)))
                .assertNext(event -> {
                    assertThat(event.isDone()).isTrue();
                    assertThat(event.snapshot().sequence()).isEqualTo(5);
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Stale snapshots never reach subscribers or replace the current one")
    void staleSnapshotIgnored() {
        broadcaster.publish(JOB_ID, snapshot(JobStage.SCRAPING, 5, 5));
        broadcaster.publish(JOB_ID, snapshot(JobStage.SCRAPING, 3, 3));

        assertThat(broadcaster.currentSnapshot(JOB_ID))
                .get()
                .extracting(ProgressSnapshot::sequence)
                .isEqualTo(5L);

        StepVerifier.create(broadcaster.subscribe(JOB_ID))
                .assertNext(event -> assertThat(event.snapshot().sequence()).isEqualTo(5))
                .then(() -> broadcaster.publish(JOB_ID, snapshot(JobStage.SCRAPING, 4, 4)))
                .then(() -> broadcaster.publish(JOB_ID, snapshot(JobStage.FAILED, 5, 6)))
                .assertNext(event -> assertThat(event.snapshot().sequence()).isEqualTo(6))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Every subscriber of a job receives the done event")
    void multipleSubscribers() {
        broadcaster.publish(JOB_ID, snapshot(JobStage.SCRAPING, 0, 1));

        StepVerifier first = StepVerifier.create(broadcaster.subscribe(JOB_ID))
                .expectNextMatches(event -> event.snapshot().sequence() == 1)
                .expectNextMatches(ProgressEvent::isDone)
                .expectComplete()
                .verifyLater();
        StepVerifier second = StepVerifier.create(broadcaster.subscribe(JOB_ID))
                .expectNextMatches(event -> event.snapshot().sequence() == 1)
                .expectNextMatches(ProgressEvent::isDone)
                .expectComplete()
                .verifyLater();

        broadcaster.publish(JOB_ID, snapshot(JobStage.COMPLETED, 10, 2));

        first.verify(Duration.ofSeconds(5));
        second.verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Subscribing after the channel is evicted replays the persisted terminal snapshot")
    void subscribeAfterEviction() {
        // given
        broadcaster.publish(JOB_ID, snapshot(JobStage.COMPLETED, 10, 7));
        broadcaster.evict(JOB_ID);
        ScanJob job = ScanJob.builder().id(JOB_ID).baseUrl("https://example.com")
                .stage(JobStage.COMPLETED).status(JobStage.COMPLETED.status())
                .progressSequence(7L).scrapedCount(10).totalPages(10).build();
        when(scanJobRepository.findById(JOB_ID)).thenReturn(Optional.of(job));

        // when / then
        StepVerifier.create(broadcaster.subscribe(JOB_ID))
                .assertNext(event -> {
                    assertThat(event.isDone()).isTrue();
                    assertThat(event.snapshot().sequence()).isEqualTo(7);
                    assertThat(event.snapshot().scraped()).isEqualTo(10);
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Unknown job fails the stream with not found")
    void unknownJob() {
        when(scanJobRepository.findById(42L)).thenReturn(Optional.empty());

        StepVerifier.create(broadcaster.subscribe(42L))
                .expectError(ScanNotFoundException.class)
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Channel is evicted after the retention period once the job is terminal")
    void evictsAfterRetention() throws InterruptedException {
        broadcaster.publish(JOB_ID, snapshot(JobStage.COMPLETED, 10, 3));
        assertThat(broadcaster.hasChannel(JOB_ID)).isTrue();

        Thread.sleep(1000);

        assertThat(broadcaster.hasChannel(JOB_ID)).isFalse();
    }

    @Test
    @DisplayName("Polling ends on the same terminal snapshot as the push stream")
    void pollingReachesTerminal() {
        broadcaster.publish(JOB_ID, snapshot(JobStage.SCRAPING, 1, 1));

        StepVerifier.create(broadcaster.poll(JOB_ID, Duration.ofMillis(20)))
                .assertNext(event -> assertThat(event.snapshot().sequence()).isEqualTo(1))
                .then(() -> {
                    broadcaster.publish(JOB_ID, snapshot(JobStage.SCRAPING, 2, 2));
                    broadcaster.publish(JOB_ID, snapshot(JobStage.COMPLETED, 10, 3));
                })
                .thenConsumeWhile(event -> !event.isDone())
                .assertNext(event -> assertThat(event.snapshot().sequence()).isEqualTo(3))
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }

    @Test
    @DisplayName("Polling without a channel reads the persisted snapshot")
    void pollingFallsBackToRepository() {
        ScanJob job = ScanJob.builder().id(JOB_ID).baseUrl("https://example.com")
                .stage(JobStage.FAILED).status(JobStage.FAILED.status())
                .progressSequence(4L).build();
        when(scanJobRepository.findById(JOB_ID)).thenReturn(Optional.of(job));

        StepVerifier.create(broadcaster.poll(JOB_ID, Duration.ofMillis(20)))
                .assertNext(event -> {
                    assertThat(event.isDone()).isTrue();
                    assertThat(event.snapshot().sequence()).isEqualTo(4);
                })
                .expectComplete()
                .verify(Duration.ofSeconds(5));
    }
}
