package com.okazje.scanner.scan.model;

import java.net.URI;
import java.time.Duration;
import java.time.Instant;

/**
 * Outcome of one HTTP exchange. Transport failures carry an {@code errorCode} and status 0.
 */
public record HttpFetchResult(
    String requestedUrl,
    URI finalUri,
    int statusCode,
    String body,
    String contentType,
    Instant fetchedAt,
    Duration duration,
    String errorCode,
    String errorMessage
) {
    public static HttpFetchResult response(
        String requestedUrl,
        URI finalUri,
        int statusCode,
        String body,
        String contentType,
        Instant startedAt
    ) {
        return new HttpFetchResult(requestedUrl, finalUri, statusCode, body, contentType, Instant.now(),
            Duration.between(startedAt, Instant.now()), null, null);
    }

    public static HttpFetchResult error(String requestedUrl, Instant startedAt, String errorCode, String message) {
        return new HttpFetchResult(requestedUrl, null, 0, null, null, Instant.now(),
            Duration.between(startedAt, Instant.now()), errorCode, message);
    }

    public boolean isSuccessful() {
        return errorCode == null && statusCode / 100 == 2;
    }

    public String finalUrlOrRequested() {
        return finalUri == null ? requestedUrl : finalUri.toString();
    }

    public String describeFailure() {
        if (errorCode == null) {
            return "http_" + statusCode;
        }
        return errorMessage == null || errorMessage.isBlank() ? errorCode : errorCode + ": " + errorMessage;
    }
}
