package com.okazje.scanner.scan.model;

public record AnalysisResult(
    String url,
    Listing listing,
    ExtractionFailure failure
) {
    public static AnalysisResult analyzed(Listing listing) {
        return new AnalysisResult(listing.url(), listing, null);
    }

    public static AnalysisResult failed(ExtractionFailure failure) {
        return new AnalysisResult(failure.url(), null, failure);
    }

    public boolean isAnalyzed() {
        return listing != null;
    }
}
