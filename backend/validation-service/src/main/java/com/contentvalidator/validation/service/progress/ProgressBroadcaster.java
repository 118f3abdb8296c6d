package com.contentvalidator.validation.service.progress;

import com.contentvalidator.validation.config.ScanProperties;
import com.contentvalidator.validation.dto.ProgressEvent;
import com.contentvalidator.validation.dto.ProgressSnapshot;
import com.contentvalidator.validation.exception.ScanNotFoundException;
import com.contentvalidator.validation.repository.ScanJobRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Fans out progress snapshots to any number of subscribers per job.
 *
 * <p>Each job gets a channel holding its latest snapshot and a replay-latest sink,
 * so a late subscriber first sees the current snapshot and then every later one.
 * The persisted job row stays the source of truth: {@link #currentSnapshot(Long)}
 * and {@link #poll(Long, Duration)} fall back to it once a channel is gone.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ProgressBroadcaster {

    private final ScanJobRepository scanJobRepository;
    private final ScanProperties scanProperties;

    private final Map<Long, JobChannel> channels = new ConcurrentHashMap<>();

    private static final class JobChannel {
        private final Sinks.Many<ProgressEvent> sink = Sinks.many().replay().latest();
        private ProgressSnapshot latest;
        private boolean closed;
    }

    /**
     * Publish a snapshot. Snapshots not newer than the channel's latest are ignored.
     * A terminal snapshot is delivered as {@code done} and closes the channel.
     */
    public void publish(Long jobId, ProgressSnapshot snapshot) {
        JobChannel channel = channels.computeIfAbsent(jobId, id -> new JobChannel());
        synchronized (channel) {
            if (channel.closed) {
                log.debug("Channel for job {} already closed, dropping snapshot seq={}", jobId, snapshot.sequence());
                return;
            }
            if (channel.latest != null && snapshot.sequence() <= channel.latest.sequence()) {
                log.debug("Ignoring stale snapshot for job {}: seq={} latest={}",
                        jobId, snapshot.sequence(), channel.latest.sequence());
                return;
            }
            channel.latest = snapshot;
            Sinks.EmitResult result = channel.sink.tryEmitNext(ProgressEvent.of(snapshot));
            if (result.isFailure()) {
                log.debug("Snapshot seq={} for job {} not delivered: {}", snapshot.sequence(), jobId, result);
            }
            if (snapshot.isTerminal()) {
                channel.closed = true;
                channel.sink.tryEmitComplete();
                scheduleEviction(jobId, channel);
                log.info("Published done event for job: {}, stage={}", jobId, snapshot.stage().wireValue());
            } else {
                log.debug("Published progress for job: {}, seq={}, stage={}",
                        jobId, snapshot.sequence(), snapshot.stage().wireValue());
            }
        }
    }

    /**
     * Stream of progress events for a job: the current snapshot first, then every
     * newer one, ending after the {@code done} event.
     */
    public Flux<ProgressEvent> subscribe(Long jobId) {
        return Flux.defer(() -> {
            JobChannel channel = channels.get(jobId);
            if (channel == null) {
                ProgressSnapshot persisted = loadPersisted(jobId)
                        .orElseThrow(() -> new ScanNotFoundException(jobId));
                if (persisted.isTerminal()) {
                    return Flux.just(ProgressEvent.of(persisted));
                }
                publish(jobId, persisted);
                channel = channels.get(jobId);
                if (channel == null) {
                    return Flux.just(ProgressEvent.of(persisted));
                }
            }
            AtomicLong lastSeen = new AtomicLong(-1);
            return channel.sink.asFlux()
                    .filter(event -> advances(lastSeen, event.snapshot()))
                    .takeUntil(ProgressEvent::isDone);
        })
                .doOnSubscribe(sub -> log.info("New progress subscriber for job: {}", jobId))
                .doOnCancel(() -> log.info("Progress subscriber disconnected for job: {}", jobId));
    }

    /**
     * Latest snapshot: the in-memory one while a channel exists, else the persisted one.
     */
    public Optional<ProgressSnapshot> currentSnapshot(Long jobId) {
        JobChannel channel = channels.get(jobId);
        if (channel != null) {
            synchronized (channel) {
                if (channel.latest != null) {
                    return Optional.of(channel.latest);
                }
            }
        }
        return loadPersisted(jobId);
    }

    /**
     * Degraded delivery built on repeated {@link #currentSnapshot(Long)} reads.
     * Emits only sequence advances and ends after the terminal snapshot.
     */
    public Flux<ProgressEvent> poll(Long jobId, Duration interval) {
        AtomicLong lastSeen = new AtomicLong(-1);
        return Flux.interval(Duration.ZERO, interval)
                .onBackpressureDrop()
                .publishOn(Schedulers.boundedElastic())
                .map(tick -> currentSnapshot(jobId).orElseThrow(() -> new ScanNotFoundException(jobId)))
                .filter(snapshot -> advances(lastSeen, snapshot))
                .map(ProgressEvent::of)
                .takeUntil(ProgressEvent::isDone);
    }

    public boolean hasChannel(Long jobId) {
        return channels.containsKey(jobId);
    }

    /**
     * Drop a job's channel immediately.
     */
    public void evict(Long jobId) {
        JobChannel channel = channels.remove(jobId);
        if (channel != null) {
            channel.sink.tryEmitComplete();
            log.debug("Evicted progress channel for job: {}", jobId);
        }
    }

    private void scheduleEviction(Long jobId, JobChannel channel) {
        Duration retention = scanProperties.getProgress().getChannelRetention();
        Schedulers.parallel().schedule(() -> {
            if (channels.remove(jobId, channel)) {
                log.debug("Cleaned up progress channel for job: {}", jobId);
            }
        }, retention.toMillis(), TimeUnit.MILLISECONDS);
    }

    private Optional<ProgressSnapshot> loadPersisted(Long jobId) {
        return scanJobRepository.findById(jobId).map(ProgressSnapshot::fromJob);
    }

    private static boolean advances(AtomicLong lastSeen, ProgressSnapshot snapshot) {
        long sequence = snapshot.sequence();
        if (sequence <= lastSeen.get()) {
            return false;
        }
        lastSeen.set(sequence);
        return true;
    }
}
