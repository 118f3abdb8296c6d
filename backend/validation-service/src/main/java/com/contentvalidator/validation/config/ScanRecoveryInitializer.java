package com.contentvalidator.validation.config;

import com.contentvalidator.validation.service.ScanJobService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * On startup, fails scans that were running when the service stopped and
 * re-queues scans that never started.
 */
@Component
@RequiredArgsConstructor
@Slf4j
@ConditionalOnProperty(name = "scan.recovery.enabled", havingValue = "true", matchIfMissing = true)
public class ScanRecoveryInitializer {

    private final ScanJobService scanJobService;

    @EventListener(ApplicationReadyEvent.class)
    public void recoverScans() {
        log.info("[Scan Recovery] Checking for scans left over from the previous run");
        scanJobService.recoverAfterRestart();
    }
}
