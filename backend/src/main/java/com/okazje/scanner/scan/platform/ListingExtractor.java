package com.okazje.scanner.scan.platform;

import com.okazje.scanner.scan.model.ExtractionOutcome;
import com.okazje.scanner.scan.model.Platform;

public interface ListingExtractor {
    Platform platform();

    ExtractionOutcome extract(String url);
}
