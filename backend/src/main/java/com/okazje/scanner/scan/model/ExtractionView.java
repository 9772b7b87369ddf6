package com.okazje.scanner.scan.model;

import java.util.List;

public record ExtractionView(
    String url,
    Platform platform,
    Listing listing,
    ExtractionFailure failure,
    List<String> strategies
) {
    public static ExtractionView from(String url, Platform platform, ExtractionOutcome outcome) {
        return new ExtractionView(url, platform, outcome.listing(), outcome.failure(), outcome.strategies());
    }
}
