package com.okazje.scanner.scan.discovery;

import com.okazje.scanner.config.ScannerProperties;
import com.okazje.scanner.scan.http.PoliteHttpClient;
import com.okazje.scanner.scan.model.Listing;
import com.okazje.scanner.scan.model.Platform;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SearchAdapterTest {
    private static final String SPRZEDAJEMY_RESULTS = """
        <html><body>
        <a href="/kategoria/zegary">Zegary</a>
        <ul>
          <li class="offer"><a href="/stary-zegar-scienny-nr101">Stary zegar ścienny</a><span class="price">150 zł</span></li>
          <li class="offer"><a href="/old-clock-mantel-nr102">Old clock mantel 250 zł</a></li>
          <li class="offer"><a href="/zegar-bez-ceny-nr103">Zegar bez ceny</a></li>
          <li class="offer"><a href="/ab-nr104">ab</a></li>
        </ul>
        <a href="/stary-zegar-scienny-nr101">Stary zegar ścienny</a>
        </body></html>
        """;

    private MockWebServer server;
    private ExecutorService executor;
    private ScannerProperties properties;
    private PoliteHttpClient httpClient;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        properties = new ScannerProperties();
        properties.getHttp().setRequestTimeoutSeconds(5);
        properties.getHttp().setRequestMaxRetries(0);
        properties.getHttp().setPerHostDelayMs(1);
        properties.getDiscovery().setSprzedajemyBaseUrl(server.url("/").toString());
        properties.getDiscovery().setGratkaBaseUrl(server.url("/").toString());
        httpClient = new PoliteHttpClient(properties, executor);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void sprzedajemyResultsRespectCeilingAndKeepUnknownPrices() throws InterruptedException {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(SPRZEDAJEMY_RESULTS));
        SprzedajemySearchAdapter adapter = new SprzedajemySearchAdapter(httpClient, properties);

        List<Listing> results = adapter.search("old clock", new BigDecimal("200"));

        assertThat(server.takeRequest().getPath()).isEqualTo("/szukaj?inp_text=old+clock");
        assertThat(results).extracting(Listing::url).containsExactly(
            server.url("/stary-zegar-scienny-nr101").toString(),
            server.url("/zegar-bez-ceny-nr103").toString()
        );
        assertThat(results.get(0).title()).isEqualTo("Stary zegar ścienny");
        assertThat(results.get(0).price()).isEqualByComparingTo("150");
        assertThat(results.get(0).platform()).isEqualTo(Platform.SPRZEDAJEMY);
        assertThat(results.get(1).hasKnownPrice()).isFalse();
    }

    @Test
    void repeatedSearchOverSamePageIsIdempotent() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody(SPRZEDAJEMY_RESULTS));
        server.enqueue(new MockResponse().setResponseCode(200).setBody(SPRZEDAJEMY_RESULTS));
        SprzedajemySearchAdapter adapter = new SprzedajemySearchAdapter(httpClient, properties);

        List<Listing> first = adapter.search("zegar", new BigDecimal("550"));
        List<Listing> second = adapter.search("zegar", new BigDecimal("550"));

        assertThat(first).hasSize(3);
        assertThat(second).extracting(Listing::url).isEqualTo(first.stream().map(Listing::url).toList());
        assertThat(second).extracting(Listing::price).isEqualTo(first.stream().map(Listing::price).toList());
    }

    @Test
    void fetchFailureYieldsEmptyList() {
        server.enqueue(new MockResponse().setResponseCode(500));
        SprzedajemySearchAdapter adapter = new SprzedajemySearchAdapter(httpClient, properties);

        assertThat(adapter.search("zegar", new BigDecimal("550"))).isEmpty();
        assertThat(adapter.search("  ", new BigDecimal("550"))).isEmpty();
    }

    @Test
    void maxResultsLimitsCandidates() {
        properties.getDiscovery().setMaxResults(1);
        server.enqueue(new MockResponse().setResponseCode(200).setBody(SPRZEDAJEMY_RESULTS));
        SprzedajemySearchAdapter adapter = new SprzedajemySearchAdapter(httpClient, properties);

        assertThat(adapter.search("zegar", null)).hasSize(1);
    }

    @Test
    void gratkaKeepsSameHostListingLinksOnly() throws InterruptedException {
        String html = """
            <html><body>
            <article><a href="/motoryzacja/zegar-kolekcjonerski-12345">Zegar kolekcjonerski 99 zł</a></article>
            <a href="/szukaj?q=zegar&page=2">2</a>
            <a href="https://other.example/item/123">Zewnętrzna oferta 10 zł</a>
            </body></html>
            """;
        server.enqueue(new MockResponse().setResponseCode(200).setBody(html));
        GratkaSearchAdapter adapter = new GratkaSearchAdapter(httpClient, properties);

        List<Listing> results = adapter.search("zegar", new BigDecimal("550"));

        assertThat(server.takeRequest().getPath()).isEqualTo("/szukaj?q=zegar");
        assertThat(results).hasSize(1);
        assertThat(results.get(0).price()).isEqualByComparingTo("99");
        assertThat(results.get(0).platform()).isEqualTo(Platform.GRATKA);
    }

    @Test
    void ceilingCheckTreatsUnknownPriceAsCandidate() {
        assertThat(AbstractSearchAdapter.withinCeiling(BigDecimal.ZERO, new BigDecimal("100"))).isTrue();
        assertThat(AbstractSearchAdapter.withinCeiling(new BigDecimal("100"), new BigDecimal("100"))).isTrue();
        assertThat(AbstractSearchAdapter.withinCeiling(new BigDecimal("101"), new BigDecimal("100"))).isFalse();
        assertThat(AbstractSearchAdapter.withinCeiling(new BigDecimal("101"), null)).isTrue();
    }

    @Test
    void sameSiteAcceptsParentAndSubdomainHosts() {
        assertThat(AbstractSearchAdapter.sameSite("gratka.pl", "www.gratka.pl")).isTrue();
        assertThat(AbstractSearchAdapter.sameSite("www.gratka.pl", "gratka.pl")).isTrue();
        assertThat(AbstractSearchAdapter.sameSite("ogloszenia.gratka.pl", "gratka.pl")).isTrue();
        assertThat(AbstractSearchAdapter.sameSite("gratka.pl", "ogloszenia.gratka.pl")).isTrue();
        assertThat(AbstractSearchAdapter.sameSite("ads.example.com", "www.gratka.pl")).isFalse();
        assertThat(AbstractSearchAdapter.sameSite("notgratka.pl", "gratka.pl")).isFalse();
    }

    @Test
    void discoveryServiceRejectsPlatformWithoutAdapter() {
        DiscoveryService service = new DiscoveryService(List.of(
            new SprzedajemySearchAdapter(httpClient, properties),
            new GratkaSearchAdapter(httpClient, properties)
        ));

        assertThat(service.platforms()).containsExactly(Platform.SPRZEDAJEMY, Platform.GRATKA);
        assertThatThrownBy(() -> service.search(Platform.OLX, "zegar", null))
            .isInstanceOf(IllegalArgumentException.class);
    }
}
