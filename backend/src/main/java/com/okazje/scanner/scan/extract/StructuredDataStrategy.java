package com.okazje.scanner.scan.extract;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.okazje.scanner.scan.model.ListingFields;
import com.okazje.scanner.scan.model.PageContext;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class StructuredDataStrategy implements ExtractionStrategy {
    private static final Logger log = LoggerFactory.getLogger(StructuredDataStrategy.class);
    private static final String JSON_LD_SELECTOR = "script[type=application/ld+json]";

    private final ObjectMapper objectMapper;
    private final List<String> scriptSelectors;

    public StructuredDataStrategy(ObjectMapper objectMapper) {
        this(objectMapper, List.of());
    }

    public StructuredDataStrategy(ObjectMapper objectMapper, List<String> extraScriptSelectors) {
        this.objectMapper = objectMapper;
        List<String> selectors = new ArrayList<>();
        selectors.add(JSON_LD_SELECTOR);
        selectors.addAll(extraScriptSelectors);
        this.scriptSelectors = List.copyOf(selectors);
    }

    @Override
    public String name() {
        return "structured-data";
    }

    @Override
    public ListingFields extract(PageContext page) {
        ListingFields merged = ListingFields.empty();
        for (String selector : scriptSelectors) {
            for (Element script : page.document().select(selector)) {
                String payload = script.data();
                if (payload == null || payload.isBlank()) {
                    payload = script.html();
                }
                if (payload == null || payload.isBlank()) {
                    continue;
                }
                JsonNode root;
                try {
                    root = objectMapper.readTree(payload);
                } catch (JsonProcessingException e) {
                    log.debug("Skipping malformed script payload on {}: {}", page.url(), e.getOriginalMessage());
                    continue;
                }
                JsonNode listingNode = ListingJsonReader.findListingNode(root);
                if (listingNode != null) {
                    merged = merged.fillMissingFrom(ListingJsonReader.read(listingNode));
                }
                if (merged.hasTitle() && merged.hasPrice()) {
                    return merged;
                }
            }
        }
        return merged;
    }
}
