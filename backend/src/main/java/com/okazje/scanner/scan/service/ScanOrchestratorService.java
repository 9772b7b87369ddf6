package com.okazje.scanner.scan.service;

import com.okazje.scanner.config.ScannerProperties;
import com.okazje.scanner.scan.discovery.DiscoveryAdapter;
import com.okazje.scanner.scan.discovery.DiscoveryService;
import com.okazje.scanner.scan.model.Listing;
import com.okazje.scanner.scan.model.ScanStatus;
import com.okazje.scanner.scan.model.ScanSummary;
import com.okazje.scanner.scan.notify.ScanNotifier;
import com.okazje.scanner.scan.persistence.KeywordRepository;
import com.okazje.scanner.scan.persistence.PersistenceException;
import com.okazje.scanner.scan.persistence.SeenListingRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;

@Service
public class ScanOrchestratorService {
    private static final Logger log = LoggerFactory.getLogger(ScanOrchestratorService.class);

    private final KeywordRepository keywordRepository;
    private final DiscoveryService discoveryService;
    private final SeenListingRepository seenListingRepository;
    private final ScanNotifier notifier;
    private final ScannerProperties.Scan scan;
    private final AtomicBoolean running = new AtomicBoolean(false);
    private final AtomicReference<ScanSummary> lastSummary = new AtomicReference<>();

    public ScanOrchestratorService(
        KeywordRepository keywordRepository,
        DiscoveryService discoveryService,
        SeenListingRepository seenListingRepository,
        ScanNotifier notifier,
        ScannerProperties properties
    ) {
        this.keywordRepository = keywordRepository;
        this.discoveryService = discoveryService;
        this.seenListingRepository = seenListingRepository;
        this.notifier = notifier;
        this.scan = properties.getScan();
    }

    public ScanSummary runScan(String destination) {
        String target = destination == null ? "" : destination.trim();
        if (target.isEmpty()) {
            log.warn("Scan requested without a destination, skipping");
            ScanSummary skipped = ScanSummary.skipped(target);
            lastSummary.set(skipped);
            return skipped;
        }
        if (!running.compareAndSet(false, true)) {
            throw new ActiveScanException("A scan is already running");
        }
        try {
            ScanSummary summary = scanKeywords(target);
            lastSummary.set(summary);
            return summary;
        } finally {
            running.set(false);
        }
    }

    public boolean isRunning() {
        return running.get();
    }

    public Optional<ScanSummary> lastSummary() {
        return Optional.ofNullable(lastSummary.get());
    }

    private ScanSummary scanKeywords(String destination) {
        Instant startedAt = Instant.now();
        List<String> keywords = keywordRepository.list();
        BigDecimal ceiling = scan.getMaxPrice();
        List<Listing> accepted = new ArrayList<>();
        int failures = 0;
        boolean interrupted = false;

        log.info("Scan started: {} keywords x {} platforms, ceiling {} zł",
            keywords.size(), discoveryService.platforms().size(), ceiling.toPlainString());
        for (int i = 0; i < keywords.size(); i++) {
            String keyword = keywords.get(i);
            for (DiscoveryAdapter adapter : discoveryService.adapters()) {
                List<Listing> stubs;
                try {
                    stubs = adapter.search(keyword, ceiling);
                } catch (RuntimeException e) {
                    failures++;
                    log.warn("Discovery on {} for '{}' failed", adapter.platform().label(), keyword, e);
                    continue;
                }
                for (Listing stub : stubs) {
                    if (stub.url().isBlank() || seenListingRepository.has(stub.url())) {
                        continue;
                    }
                    accepted.add(stub);
                    markSeen(stub.url());
                }
            }
            if (i < keywords.size() - 1 && !pause()) {
                interrupted = true;
                break;
            }
        }

        List<Listing> top = ListingRanking.top(accepted, scan.getTopK());
        if (!accepted.isEmpty()) {
            try {
                notifier.notifyNewListings(destination, top, accepted.size());
            } catch (RuntimeException e) {
                log.warn("Notifier failed for {}: {}", destination, e.getMessage());
            }
        }

        ScanStatus status = interrupted
            ? ScanStatus.INTERRUPTED
            : (accepted.isEmpty() ? ScanStatus.NO_NEW_LISTINGS : ScanStatus.COMPLETED);
        ScanSummary summary = new ScanSummary(
            status, destination, keywords.size(), accepted.size(), failures, top, startedAt, Instant.now()
        );
        log.info("Scan finished with status {}: {} new listings, {} reported, {} failures",
            status, accepted.size(), top.size(), failures);
        return summary;
    }

    private void markSeen(String url) {
        try {
            seenListingRepository.add(url);
        } catch (PersistenceException e) {
            log.warn("Could not persist seen listing {}: {}", url, e.getMessage());
        }
    }

    private boolean pause() {
        long delayMs = scan.getKeywordDelayMs();
        if (delayMs <= 0) {
            return true;
        }
        try {
            Thread.sleep(delayMs);
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scan interrupted during keyword delay");
            return false;
        }
    }
}
