package com.okazje.scanner.scan.platform;

import com.okazje.scanner.scan.model.ExtractionFailure;
import com.okazje.scanner.scan.model.ExtractionOutcome;
import com.okazje.scanner.scan.model.ExtractionView;
import com.okazje.scanner.scan.model.Platform;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

@Service
public class ListingExtractionService {
    private static final Logger log = LoggerFactory.getLogger(ListingExtractionService.class);

    private final PlatformDispatcher dispatcher;
    private final Map<Platform, ListingExtractor> extractors = new EnumMap<>(Platform.class);

    public ListingExtractionService(PlatformDispatcher dispatcher, List<ListingExtractor> extractors) {
        this.dispatcher = dispatcher;
        for (ListingExtractor extractor : extractors) {
            this.extractors.put(extractor.platform(), extractor);
        }
    }

    public ExtractionOutcome extract(String url) {
        return extract(url, dispatcher.detect(url));
    }

    public ExtractionView describe(String url) {
        Platform platform = dispatcher.detect(url);
        return ExtractionView.from(url, platform, extract(url, platform));
    }

    public List<Platform> supportedPlatforms() {
        return List.copyOf(extractors.keySet());
    }

    private ExtractionOutcome extract(String url, Platform platform) {
        ListingExtractor extractor = extractors.getOrDefault(platform, extractors.get(Platform.OTHER));
        if (extractor == null) {
            return ExtractionOutcome.failure(ExtractionFailure.parse(url, "no extractor for " + platform.label()));
        }
        try {
            return extractor.extract(url);
        } catch (RuntimeException e) {
            log.warn("Extraction of {} ({}) failed unexpectedly", url, platform.label(), e);
            return ExtractionOutcome.failure(ExtractionFailure.parse(url, e.getMessage()));
        }
    }
}
