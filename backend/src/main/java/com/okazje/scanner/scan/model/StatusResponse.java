package com.okazje.scanner.scan.model;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.List;

public record StatusResponse(
    int keywordCount,
    int seenCount,
    Duration scanInterval,
    BigDecimal maxPrice,
    int minMarginPercent,
    List<String> monitoredPlatforms,
    List<String> extractablePlatforms,
    boolean scanRunning,
    ScanSummary lastScan
) {
}
