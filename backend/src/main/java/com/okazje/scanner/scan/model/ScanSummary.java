package com.okazje.scanner.scan.model;

import java.time.Instant;
import java.util.List;

public record ScanSummary(
    ScanStatus status,
    String destination,
    int keywordCount,
    int acceptedCount,
    int failureCount,
    List<Listing> reported,
    Instant startedAt,
    Instant finishedAt
) {
    public ScanSummary {
        reported = reported == null ? List.of() : List.copyOf(reported);
    }

    public static ScanSummary skipped(String destination) {
        Instant now = Instant.now();
        return new ScanSummary(ScanStatus.SKIPPED_NO_DESTINATION, destination, 0, 0, 0, List.of(), now, now);
    }
}
