package com.okazje.scanner.scan.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.okazje.scanner.scan.model.ListingFields;
import com.okazje.scanner.scan.model.PageContext;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StructuredDataStrategyTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    void readsJsonLdProductWithOfferDetails() {
        String html = """
            <html><head>
            <script type="application/ld+json">
            {
              "@context": "https://schema.org",
              "@type": "Product",
              "name": "Szabla oficerska wz. 34",
              "description": "Oryginalna szabla, stan kolekcjonerski.",
              "image": [{"url": "https://img.example.com/1.jpg"}, "https://img.example.com/2.jpg"],
              "itemCondition": "https://schema.org/UsedCondition",
              "offers": [{
                "@type": "Offer",
                "price": 480,
                "priceCurrency": "PLN",
                "seller": {"name": "Antyki Jan"},
                "availableAtOrFrom": {"address": {"addressLocality": "Poznań", "addressRegion": "wielkopolskie"}}
              }]
            }
            </script>
            </head><body></body></html>
            """;

        ListingFields fields = new StructuredDataStrategy(objectMapper)
            .extract(PageContext.parse("https://sprzedajemy.pl/szabla-nr5", html));

        assertEquals("Szabla oficerska wz. 34", fields.title());
        assertEquals(0, fields.price().compareTo(new BigDecimal("480")));
        assertEquals("Antyki Jan", fields.seller());
        assertEquals("Poznań, wielkopolskie", fields.location());
        assertEquals("https://schema.org/UsedCondition", fields.condition());
        assertEquals(List.of("https://img.example.com/1.jpg", "https://img.example.com/2.jpg"), fields.images());
    }

    @Test
    void skipsMalformedBlobAndUsesNextOne() {
        String html = """
            <html><head>
            <script type="application/ld+json">{ this is not json </script>
            <script type="application/ld+json">{"@type":"BreadcrumbList","itemListElement":[]}</script>
            <script type="application/ld+json">{"name":"Aparat Zenit","offers":{"lowPrice":"120,00"}}</script>
            </head><body></body></html>
            """;

        ListingFields fields = new StructuredDataStrategy(objectMapper)
            .extract(PageContext.parse("https://example.com/a", html));

        assertEquals("Aparat Zenit", fields.title());
        assertThat(fields.price()).isEqualByComparingTo("120.00");
    }

    @Test
    void readsEmbeddedPageStateFromExtraSelector() {
        String html = """
            <html><body>
            <script id="__NEXT_DATA__" type="application/json">
            {"props":{"pageProps":{"item":{
              "id": 123,
              "title": "Kurtka skórzana",
              "price": {"amount": "45.0", "currency_code": "PLN"},
              "photos": [{"full_size_url": "https://images.vinted.net/1.jpg"}],
              "user": {"login": "ania"},
              "status": "Bardzo dobry"
            }}}}
            </script>
            </body></html>
            """;

        ListingFields withoutSelector = new StructuredDataStrategy(objectMapper)
            .extract(PageContext.parse("https://www.vinted.pl/items/123", html));
        ListingFields fields = new StructuredDataStrategy(objectMapper, List.of("script#__NEXT_DATA__"))
            .extract(PageContext.parse("https://www.vinted.pl/items/123", html));

        assertTrue(withoutSelector.isEmpty());
        assertEquals("Kurtka skórzana", fields.title());
        assertThat(fields.price()).isEqualByComparingTo("45.0");
        assertEquals("ania", fields.seller());
        assertEquals("Bardzo dobry", fields.condition());
        assertEquals(List.of("https://images.vinted.net/1.jpg"), fields.images());
    }
}
