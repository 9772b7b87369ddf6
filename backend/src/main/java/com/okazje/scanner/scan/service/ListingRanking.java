package com.okazje.scanner.scan.service;

import com.okazje.scanner.scan.model.Listing;

import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Cheapest first. Listings without a known price always sort after every priced one.
 */
public final class ListingRanking {
    public static final Comparator<Listing> PRICE_ASCENDING_UNKNOWN_LAST = Comparator
        .comparing((Listing listing) -> !listing.hasKnownPrice())
        .thenComparing(Listing::price);

    private ListingRanking() {
    }

    public static List<Listing> rank(Collection<Listing> listings) {
        return listings.stream().sorted(PRICE_ASCENDING_UNKNOWN_LAST).toList();
    }

    public static List<Listing> top(Collection<Listing> listings, int limit) {
        return listings.stream().sorted(PRICE_ASCENDING_UNKNOWN_LAST).limit(Math.max(0, limit)).toList();
    }
}
