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
public class GratkaListingExtractor extends AbstractListingExtractor {

    public GratkaListingExtractor(PoliteHttpClient httpClient, ObjectMapper objectMapper, ScannerProperties properties) {
        super(httpClient, properties, new FallbackChain(List.of(
            new StructuredDataStrategy(objectMapper),
            new SemanticMarkupStrategy("gratka"),
            rawText(properties)
        )));
    }

    @Override
    public Platform platform() {
        return Platform.GRATKA;
    }
}
