package com.okazje.scanner.scan.model;

public record ExtractionFailure(
    FailureKind kind,
    String url,
    String message
) {
    public static ExtractionFailure fetch(String url, String message) {
        return new ExtractionFailure(FailureKind.FETCH_ERROR, url, message);
    }

    public static ExtractionFailure parse(String url, String message) {
        return new ExtractionFailure(FailureKind.PARSE_ERROR, url, message);
    }
}
