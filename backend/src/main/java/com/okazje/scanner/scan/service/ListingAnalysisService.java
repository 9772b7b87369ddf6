package com.okazje.scanner.scan.service;

import com.okazje.scanner.scan.classify.ClassifierException;
import com.okazje.scanner.scan.classify.ListingClassifier;
import com.okazje.scanner.scan.classify.VerdictParser;
import com.okazje.scanner.scan.model.AnalysisResult;
import com.okazje.scanner.scan.model.ExtractionOutcome;
import com.okazje.scanner.scan.model.Listing;
import com.okazje.scanner.scan.model.Verdict;
import com.okazje.scanner.scan.normalize.TextTruncator;
import com.okazje.scanner.scan.persistence.PersistenceException;
import com.okazje.scanner.scan.persistence.SeenListingRepository;
import com.okazje.scanner.scan.platform.ListingExtractionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Service
public class ListingAnalysisService {
    private static final Logger log = LoggerFactory.getLogger(ListingAnalysisService.class);
    private static final Pattern URL = Pattern.compile("https?://\\S+");
    private static final String TRAILING_PUNCTUATION = ".,;:!?)";
    static final int MIN_DESCRIPTION_LENGTH = 20;
    static final int MANUAL_TITLE_LENGTH = 50;
    static final String CLASSIFIER_ERROR_PREFIX = "❌ Błąd analizy AI: ";

    private final ListingExtractionService extractionService;
    private final ListingClassifier classifier;
    private final SeenListingRepository seenListingRepository;

    public ListingAnalysisService(
        ListingExtractionService extractionService,
        ListingClassifier classifier,
        SeenListingRepository seenListingRepository
    ) {
        this.extractionService = extractionService;
        this.classifier = classifier;
        this.seenListingRepository = seenListingRepository;
    }

    public AnalysisResult analyzeUrl(String url) {
        ExtractionOutcome outcome = extractionService.extract(url);
        if (!outcome.isSuccess()) {
            return AnalysisResult.failed(outcome.failure());
        }
        Listing analyzed = classify(outcome.listing());
        try {
            seenListingRepository.add(analyzed.url());
        } catch (PersistenceException e) {
            log.warn("Could not persist seen listing {}: {}", analyzed.url(), e.getMessage());
        }
        return AnalysisResult.analyzed(analyzed);
    }

    public List<AnalysisResult> analyzeText(String text) {
        List<AnalysisResult> results = new ArrayList<>();
        for (String url : extractUrls(text)) {
            results.add(analyzeUrl(url));
        }
        return results;
    }

    public AnalysisResult analyzeDescription(String text) {
        String trimmed = text == null ? "" : text.trim();
        if (trimmed.length() < MIN_DESCRIPTION_LENGTH) {
            throw new IllegalArgumentException(
                "Description must be at least " + MIN_DESCRIPTION_LENGTH + " characters long");
        }
        Listing manual = Listing.manual(TextTruncator.truncate(trimmed, MANUAL_TITLE_LENGTH), trimmed);
        return AnalysisResult.analyzed(classify(manual));
    }

    static List<String> extractUrls(String text) {
        if (text == null || text.isBlank()) {
            return List.of();
        }
        Set<String> urls = new LinkedHashSet<>();
        Matcher matcher = URL.matcher(text);
        while (matcher.find()) {
            String url = matcher.group();
            while (!url.isEmpty() && TRAILING_PUNCTUATION.indexOf(url.charAt(url.length() - 1)) >= 0) {
                url = url.substring(0, url.length() - 1);
            }
            if (!url.isEmpty()) {
                urls.add(url);
            }
        }
        return new ArrayList<>(urls);
    }

    private Listing classify(Listing listing) {
        try {
            String analysis = classifier.classify(listing);
            VerdictParser.ValueRange range = VerdictParser.parseValueRange(analysis);
            return listing.withAnalysis(analysis, VerdictParser.parse(analysis), range.low(), range.high());
        } catch (ClassifierException e) {
            log.warn("Classification of {} failed: {}", listing.id(), e.getMessage());
            return listing.withAnalysis(CLASSIFIER_ERROR_PREFIX + e.getMessage(), Verdict.SKIP, null, null);
        }
    }
}
