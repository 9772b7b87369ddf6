package com.okazje.scanner.scan.service;

import com.okazje.scanner.config.ScannerProperties;
import com.okazje.scanner.scan.discovery.DiscoveryService;
import com.okazje.scanner.scan.model.Platform;
import com.okazje.scanner.scan.model.StatusResponse;
import com.okazje.scanner.scan.persistence.KeywordRepository;
import com.okazje.scanner.scan.persistence.SeenListingRepository;
import com.okazje.scanner.scan.platform.ListingExtractionService;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class StatusService {
    private final KeywordRepository keywordRepository;
    private final SeenListingRepository seenListingRepository;
    private final DiscoveryService discoveryService;
    private final ListingExtractionService extractionService;
    private final ScanOrchestratorService orchestratorService;
    private final ScannerProperties.Scan scan;

    public StatusService(
        KeywordRepository keywordRepository,
        SeenListingRepository seenListingRepository,
        DiscoveryService discoveryService,
        ListingExtractionService extractionService,
        ScanOrchestratorService orchestratorService,
        ScannerProperties properties
    ) {
        this.keywordRepository = keywordRepository;
        this.seenListingRepository = seenListingRepository;
        this.discoveryService = discoveryService;
        this.extractionService = extractionService;
        this.orchestratorService = orchestratorService;
        this.scan = properties.getScan();
    }

    public StatusResponse status() {
        return new StatusResponse(
            keywordRepository.size(),
            seenListingRepository.size(),
            scan.getInterval(),
            scan.getMaxPrice(),
            scan.getMinMarginPercent(),
            labels(discoveryService.platforms()),
            labels(extractionService.supportedPlatforms().stream()
                .filter(Platform::hasDomain)
                .toList()),
            orchestratorService.isRunning(),
            orchestratorService.lastSummary().orElse(null)
        );
    }

    private static List<String> labels(List<Platform> platforms) {
        return platforms.stream().map(Platform::label).toList();
    }
}
