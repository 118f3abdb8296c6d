package com.contentvalidator.validation.service.pipeline;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Cancellation requests waiting to be observed by the pipeline worker.
 * Requesters never write the job themselves.
 */
@Component
@Slf4j
public class CancellationRegistry {

    private final Set<Long> requested = ConcurrentHashMap.newKeySet();

    public void request(Long jobId) {
        if (requested.add(jobId)) {
            log.info("Cancellation requested for scan job: {}", jobId);
        }
    }

    public boolean isRequested(Long jobId) {
        return requested.contains(jobId);
    }

    public void clear(Long jobId) {
        requested.remove(jobId);
    }
}
