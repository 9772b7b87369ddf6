package com.okazje.scanner.scan.platform;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.okazje.scanner.config.ScannerProperties;
import com.okazje.scanner.scan.http.PoliteHttpClient;
import com.okazje.scanner.scan.model.ExtractionOutcome;
import com.okazje.scanner.scan.model.FailureKind;
import com.okazje.scanner.scan.model.Listing;
import com.okazje.scanner.scan.model.Platform;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class GenericListingExtractorTest {
    private MockWebServer server;
    private ExecutorService executor;
    private GenericListingExtractor extractor;

    @BeforeEach
    void setUp() throws IOException {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(1);
        ScannerProperties properties = new ScannerProperties();
        properties.getHttp().setRequestTimeoutSeconds(5);
        properties.getHttp().setRequestMaxRetries(0);
        properties.getHttp().setPerHostDelayMs(1);
        extractor = new GenericListingExtractor(new PoliteHttpClient(properties, executor), new ObjectMapper(), properties);
    }

    @AfterEach
    void tearDown() throws IOException {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void missingPageIsFetchError() {
        server.enqueue(new MockResponse().setResponseCode(404));
        String url = server.url("/gone").toString();

        ExtractionOutcome outcome = extractor.extract(url);

        assertThat(outcome.isSuccess()).isFalse();
        assertEquals(FailureKind.FETCH_ERROR, outcome.failure().kind());
        assertEquals(url, outcome.failure().url());
        assertThat(outcome.failure().message()).contains("404");
    }

    @Test
    void pageWithoutAnyTitleIsParseError() {
        server.enqueue(new MockResponse().setResponseCode(200).setBody("<html><body><p>tylko tekst 20 zł</p></body></html>"));

        ExtractionOutcome outcome = extractor.extract(server.url("/bez-tytulu").toString());

        assertEquals(FailureKind.PARSE_ERROR, outcome.failure().kind());
    }

    @Test
    void structuredDataListingIsNormalizedAndCapped() {
        StringBuilder images = new StringBuilder();
        for (int i = 1; i <= 8; i++) {
            images.append(i == 1 ? "" : ",").append("\"/img/").append(i).append(".jpg\"");
        }
        String description = "x".repeat(5000);
        String html = """
            <html><head>
            <script type="application/ld+json">
            {"name":"  Stary   zegar  ","description":"%s","image":[%s],
             "itemCondition":"https://schema.org/UsedCondition","offers":{"price":"199.99"}}
            </script>
            </head><body></body></html>
            """.formatted(description, images);
        server.enqueue(new MockResponse().setResponseCode(200).setBody(html));
        String url = server.url("/oferta/1").toString();

        ExtractionOutcome outcome = extractor.extract(url);

        assertThat(outcome.isSuccess()).isTrue();
        Listing listing = outcome.listing();
        assertEquals("Stary zegar", listing.title());
        assertThat(listing.price()).isEqualByComparingTo("199.99");
        assertEquals(1000, listing.description().length());
        assertEquals("used", listing.condition());
        assertEquals(Platform.OTHER, listing.platform());
        assertThat(listing.images()).hasSize(5);
        assertThat(listing.images().get(0)).isEqualTo(server.url("/img/1.jpg").toString());
        assertThat(outcome.strategies()).containsExactly("structured-data");
    }

    @Test
    void rawTextFallbackFindsPriceInBodyText() {
        String html = """
            <html><head><title>Aparat Zenit</title></head>
            <body><div>Polecam aparat. Cena: 450 zł</div></body></html>
            """;
        server.enqueue(new MockResponse().setResponseCode(200).setBody(html));

        ExtractionOutcome outcome = extractor.extract(server.url("/zenit").toString());

        assertThat(outcome.isSuccess()).isTrue();
        assertEquals("Aparat Zenit", outcome.listing().title());
        assertThat(outcome.listing().price()).isEqualByComparingTo("450");
        assertThat(outcome.listing().description()).startsWith("Polecam aparat.");
        assertEquals("unknown", outcome.listing().condition());
        assertThat(outcome.strategies()).containsExactly("raw-text");
    }
}
