package com.okazje.scanner.scan.platform;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.okazje.scanner.config.ScannerProperties;
import com.okazje.scanner.scan.extract.FallbackChain;
import com.okazje.scanner.scan.extract.SemanticMarkupStrategy;
import com.okazje.scanner.scan.extract.StructuredDataStrategy;
import com.okazje.scanner.scan.http.PoliteHttpClient;
import com.okazje.scanner.scan.model.Platform;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class OlxListingExtractor extends AbstractListingExtractor {

    public OlxListingExtractor(PoliteHttpClient httpClient, ObjectMapper objectMapper, ScannerProperties properties) {
        super(httpClient, properties, new FallbackChain(List.of(
            new StructuredDataStrategy(objectMapper, List.of("script#__NEXT_DATA__")),
            new SemanticMarkupStrategy("olxcdn"),
            rawText(properties)
        )));
    }

    @Override
    public Platform platform() {
        return Platform.OLX;
    }
}
