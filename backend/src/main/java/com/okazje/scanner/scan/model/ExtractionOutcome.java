package com.okazje.scanner.scan.model;

import java.util.List;

public record ExtractionOutcome(
    Listing listing,
    ExtractionFailure failure,
    List<String> strategies
) {
    public ExtractionOutcome {
        strategies = strategies == null ? List.of() : List.copyOf(strategies);
    }

    public static ExtractionOutcome success(Listing listing, List<String> strategies) {
        return new ExtractionOutcome(listing, null, strategies);
    }

    public static ExtractionOutcome failure(ExtractionFailure failure) {
        return new ExtractionOutcome(null, failure, List.of());
    }

    public boolean isSuccess() {
        return listing != null;
    }
}
