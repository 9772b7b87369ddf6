package com.okazje.scanner.scan.service;

import com.okazje.scanner.config.ScannerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;

@Component
public class ScanScheduler {
    private static final Logger log = LoggerFactory.getLogger(ScanScheduler.class);

    private final ScanOrchestratorService orchestratorService;
    private final ScannerProperties.Scan scan;

    public ScanScheduler(ScanOrchestratorService orchestratorService, ScannerProperties properties) {
        this.orchestratorService = orchestratorService;
        this.scan = properties.getScan();
    }

    @Scheduled(
        fixedDelayString = "${scanner.scan.interval:PT30M}",
        initialDelayString = "${scanner.scan.initial-delay:PT1M}"
    )
    public void scheduledScan() {
        if (!scan.isEnabled() || scan.getDestination().isEmpty()) {
            log.debug("Scheduled scan skipped (enabled={}, destination configured={})",
                scan.isEnabled(), !scan.getDestination().isEmpty());
            return;
        }
        try {
            orchestratorService.runScan(scan.getDestination());
        } catch (ActiveScanException e) {
            log.info("Scheduled scan skipped: {}", e.getMessage());
        } catch (RuntimeException e) {
            log.error("Scheduled scan failed", e);
        }
    }
}
