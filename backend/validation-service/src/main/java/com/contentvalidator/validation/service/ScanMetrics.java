package com.contentvalidator.validation.service;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

@Component
@RequiredArgsConstructor
public class ScanMetrics {

    private final MeterRegistry meterRegistry;

    private Counter jobsCompleted;
    private Counter jobsFailed;
    private Counter pagesFailed;
    private Counter malformedFindings;
    private Timer jobDuration;

    @PostConstruct
    public void initMetrics() {
        jobsCompleted = Counter.builder("scan.jobs.completed")
                .description("Scan jobs that reached completed")
                .register(meterRegistry);
        jobsFailed = Counter.builder("scan.jobs.failed")
                .description("Scan jobs that reached failed")
                .register(meterRegistry);
        pagesFailed = Counter.builder("scan.pages.failed")
                .description("Page errors recorded while scraping or validating")
                .register(meterRegistry);
        malformedFindings = Counter.builder("scan.findings.malformed")
                .description("Validator findings dropped by the normalizer")
                .register(meterRegistry);
        jobDuration = Timer.builder("scan.jobs.duration")
                .description("Time from scraping start to terminal stage")
                .register(meterRegistry);
    }

    public void jobCompleted(Duration duration) {
        jobsCompleted.increment();
        jobDuration.record(duration);
    }

    public void jobFailed() {
        jobsFailed.increment();
    }

    public void pageFailed() {
        pagesFailed.increment();
    }

    public void findingDropped() {
        malformedFindings.increment();
    }
}
