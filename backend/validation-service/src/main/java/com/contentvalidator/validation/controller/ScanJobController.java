package com.contentvalidator.validation.controller;

import com.contentvalidator.validation.dto.ProgressEvent;
import com.contentvalidator.validation.dto.ProgressSnapshot;
import com.contentvalidator.validation.dto.ScanJobDto;
import com.contentvalidator.validation.dto.ScanResultsDto;
import com.contentvalidator.validation.dto.ValidateRequest;
import com.contentvalidator.validation.entity.ScanJob;
import com.contentvalidator.validation.service.ScanJobService;
import com.contentvalidator.validation.service.ScanResultService;
import com.contentvalidator.validation.service.progress.ProgressBroadcaster;
import jakarta.validation.Valid;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.util.Map;

/**
 * Scan job lifecycle: create, inspect, follow progress, cancel and fetch results.
 */
@RestController
@RequestMapping("/api")
@Slf4j
public class ScanJobController {

    private final ScanJobService scanJobService;
    private final ScanResultService scanResultService;
    private final ProgressBroadcaster progressBroadcaster;
    private final Duration heartbeatInterval;
    private final Duration pollInterval;

    public ScanJobController(
            ScanJobService scanJobService,
            ScanResultService scanResultService,
            ProgressBroadcaster progressBroadcaster,
            @Value("${scan.progress.heartbeat-interval:15s}") Duration heartbeatInterval,
            @Value("${scan.progress.poll-interval:2s}") Duration pollInterval
    ) {
        this.scanJobService = scanJobService;
        this.scanResultService = scanResultService;
        this.progressBroadcaster = progressBroadcaster;
        this.heartbeatInterval = heartbeatInterval;
        this.pollInterval = pollInterval;
    }

    @PostMapping("/validate")
    public ResponseEntity<Map<String, Object>> validate(@Valid @RequestBody ValidateRequest request) {
        ScanJob job = scanJobService.createJob(request);
        return ResponseEntity.status(HttpStatus.ACCEPTED).body(Map.of(
                "jobId", job.getId(),
                "status", job.getStatus().wireValue(),
                "message", "Scan queued"
        ));
    }

    @GetMapping("/jobs/{id}")
    public ResponseEntity<ScanJobDto> getJob(@PathVariable Long id) {
        return ResponseEntity.ok(ScanJobDto.from(scanJobService.getJob(id)));
    }

    /**
     * Current snapshot; the polling counterpart of the event stream.
     */
    @GetMapping("/jobs/{id}/progress")
    public ResponseEntity<ProgressSnapshot> getProgress(@PathVariable Long id) {
        return ResponseEntity.ok(scanJobService.getSnapshot(id));
    }

    /**
     * Progress events: the current snapshot first, then updates, then one {@code done}
     * event. Heartbeats every 15 seconds keep idle connections open.
     */
    @GetMapping(value = "/jobs/{id}/events", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> streamEvents(@PathVariable Long id) {
        scanJobService.getJob(id);
        return withHeartbeat(id, progressBroadcaster.subscribe(id));
    }

    /**
     * Same stream served from periodic snapshot reads, for clients behind proxies
     * that break long-lived pushes.
     */
    @GetMapping(value = "/jobs/{id}/events/poll", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<Object>> pollEvents(@PathVariable Long id) {
        scanJobService.getJob(id);
        return withHeartbeat(id, progressBroadcaster.poll(id, pollInterval));
    }

    @PostMapping("/jobs/{id}/cancel")
    public ResponseEntity<Map<String, Object>> cancel(@PathVariable Long id) {
        ScanJob job = scanJobService.cancel(id);
        boolean accepted = !job.isTerminal();
        return ResponseEntity.status(accepted ? HttpStatus.ACCEPTED : HttpStatus.OK).body(Map.of(
                "jobId", id,
                "status", job.getStatus().wireValue(),
                "cancelRequested", accepted
        ));
    }

    @GetMapping("/jobs/{id}/results")
    public ResponseEntity<ScanResultsDto> getResults(@PathVariable Long id) {
        return ResponseEntity.ok(scanResultService.getResults(id));
    }

    private Flux<ServerSentEvent<Object>> withHeartbeat(Long jobId, Flux<ProgressEvent> progress) {
        Flux<ServerSentEvent<Object>> events = progress.map(this::toServerSentEvent);

        Flux<ServerSentEvent<Object>> heartbeat = Flux.interval(heartbeatInterval)
                .map(tick -> ServerSentEvent.builder()
                        .event("heartbeat")
                        .data(Map.of(
                                "eventType", "heartbeat",
                                "jobId", jobId,
                                "timestamp", System.currentTimeMillis()
                        ))
                        .build());

        return Flux.merge(events, heartbeat)
                .takeUntil(event -> ProgressEvent.DONE.equals(event.event()))
                .doOnCancel(() -> log.debug("Event stream for job {} closed by client", jobId));
    }

    private ServerSentEvent<Object> toServerSentEvent(ProgressEvent event) {
        return ServerSentEvent.builder()
                .id(String.valueOf(event.snapshot().sequence()))
                .event(event.eventType())
                .data(event.snapshot())
                .build();
    }
}
