package com.okazje.scanner.scan.discovery;

import com.okazje.scanner.scan.model.Listing;
import com.okazje.scanner.scan.model.Platform;

import java.math.BigDecimal;
import java.util.List;

public interface DiscoveryAdapter {
    Platform platform();

    /**
     * Returns listing stubs for the keyword. A stub is kept when its price is within the ceiling or unknown.
     * Fetch failures yield an empty list.
     */
    List<Listing> search(String keyword, BigDecimal priceCeiling);
}
