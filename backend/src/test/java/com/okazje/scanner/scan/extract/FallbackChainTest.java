package com.okazje.scanner.scan.extract;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.okazje.scanner.scan.model.ListingFields;
import com.okazje.scanner.scan.model.PageContext;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;

class FallbackChainTest {
    private static final List<String> MARKERS = List.of("Polecam", "Sprzedam", "Oferuję", "Zapraszam", "Stan:");

    private final FallbackChain chain = new FallbackChain(List.of(
        new StructuredDataStrategy(new ObjectMapper()),
        new SemanticMarkupStrategy(),
        new RawTextStrategy(MARKERS, 500)
    ));

    @Test
    void structuredDataWinsAndStopsTheChain() {
        String html = """
            <html><head>
            <script type="application/ld+json">{"offers":{"price":"199.99"},"name":"Vintage clock"}</script>
            </head><body><h1>Inny tytuł</h1><p>Cena: 999 zł</p></body></html>
            """;

        FallbackChain.Result result = chain.run(PageContext.parse("https://example.com/item/1", html));

        assertThat(result.fields().title()).isEqualTo("Vintage clock");
        assertThat(result.fields().price()).isEqualByComparingTo("199.99");
        assertThat(result.appliedStrategies()).containsExactly("structured-data");
    }

    @Test
    void rawTextIsUsedWhenMarkupIsMissing() {
        String html = """
            <html><head><title>Stary zegar</title></head>
            <body><p>Sprzedam zegar po dziadku. Cena: 450 zł. Kraków, małopolskie</p></body></html>
            """;

        FallbackChain.Result result = chain.run(PageContext.parse("https://example.com/item/2", html));

        assertThat(result.fields().title()).isEqualTo("Stary zegar");
        assertThat(result.fields().price()).isEqualByComparingTo("450");
        assertThat(result.fields().location()).isEqualTo("Kraków, małopolskie");
        assertThat(result.fields().description()).startsWith("Sprzedam zegar po dziadku.");
        assertThat(result.appliedStrategies()).containsExactly("raw-text");
    }

    @Test
    void laterStrategiesOnlyFillMissingFields() {
        AtomicInteger thirdCalls = new AtomicInteger();
        FallbackChain custom = new FallbackChain(List.of(
            new FixedStrategy("first", ListingFields.empty().withPrice(new BigDecimal("100"))),
            new FixedStrategy("second", ListingFields.empty().withTitle("Szabla").withPrice(new BigDecimal("200"))),
            new ExtractionStrategy() {
                @Override
                public String name() {
                    return "third";
                }

                @Override
                public ListingFields extract(PageContext page) {
                    thirdCalls.incrementAndGet();
                    return ListingFields.empty().withDescription("nigdy");
                }
            }
        ));

        FallbackChain.Result result = custom.run(PageContext.parse("https://example.com", "<html></html>"));

        assertThat(result.fields().price()).isEqualByComparingTo("100");
        assertThat(result.fields().title()).isEqualTo("Szabla");
        assertThat(result.fields().description()).isNull();
        assertThat(result.appliedStrategies()).containsExactly("first", "second");
        assertThat(thirdCalls).hasValue(0);
    }

    @Test
    void failingStrategyIsTreatedAsEmpty() {
        FallbackChain custom = new FallbackChain(List.of(
            new ExtractionStrategy() {
                @Override
                public String name() {
                    return "broken";
                }

                @Override
                public ListingFields extract(PageContext page) {
                    throw new IllegalStateException("boom");
                }
            },
            new FixedStrategy("backup", ListingFields.empty().withTitle("Komiks"))
        ));

        FallbackChain.Result result = custom.run(PageContext.parse("https://example.com", "<html></html>"));

        assertThat(result.fields().title()).isEqualTo("Komiks");
        assertThat(result.appliedStrategies()).containsExactly("backup");
        assertThat(custom.strategyNames()).containsExactly("broken", "backup");
    }

    private record FixedStrategy(String name, ListingFields fields) implements ExtractionStrategy {
        @Override
        public ListingFields extract(PageContext page) {
            return fields;
        }
    }
}
