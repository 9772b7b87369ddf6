package com.okazje.scanner.scan.notify;

import com.okazje.scanner.scan.model.Listing;

import java.util.List;

public interface ScanNotifier {
    /**
     * @param destination   notification target, e.g. a Telegram chat id
     * @param topListings   ranked and capped listings to report
     * @param acceptedCount number of new listings found in the scan, possibly larger than {@code topListings}
     */
    void notifyNewListings(String destination, List<Listing> topListings, int acceptedCount);
}
