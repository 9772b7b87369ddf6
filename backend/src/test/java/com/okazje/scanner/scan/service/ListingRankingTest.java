package com.okazje.scanner.scan.service;

import com.okazje.scanner.scan.model.Listing;
import com.okazje.scanner.scan.model.Platform;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class ListingRankingTest {

    @Test
    void cheapestFirstWithUnknownPricesLast() {
        List<Listing> listings = List.of(stub("a", "300"), stub("b", "0"), stub("c", "150"), stub("d", "999"));

        assertThat(ListingRanking.rank(listings))
            .extracting(Listing::price)
            .usingElementComparator(BigDecimal::compareTo)
            .containsExactly(new BigDecimal("150"), new BigDecimal("300"), new BigDecimal("999"), BigDecimal.ZERO);
    }

    @Test
    void topLimitsResult() {
        List<Listing> listings = List.of(stub("a", "300"), stub("b", "0"), stub("c", "150"));

        assertThat(ListingRanking.top(listings, 2)).extracting(Listing::url).containsExactly("c", "a");
        assertThat(ListingRanking.top(listings, 10)).hasSize(3);
    }

    private static Listing stub(String url, String price) {
        return Listing.stub(url, "Oferta " + url, new BigDecimal(price), Platform.SPRZEDAJEMY);
    }
}
