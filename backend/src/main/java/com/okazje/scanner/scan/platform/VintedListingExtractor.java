package com.okazje.scanner.scan.platform;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.okazje.scanner.config.ScannerProperties;
import com.okazje.scanner.scan.extract.FallbackChain;
import com.okazje.scanner.scan.extract.ListingJsonReader;
import com.okazje.scanner.scan.extract.SemanticMarkupStrategy;
import com.okazje.scanner.scan.extract.StructuredDataStrategy;
import com.okazje.scanner.scan.http.PoliteHttpClient;
import com.okazje.scanner.scan.model.HttpFetchResult;
import com.okazje.scanner.scan.model.ListingFields;
import com.okazje.scanner.scan.model.PageContext;
import com.okazje.scanner.scan.model.Platform;
import com.okazje.scanner.scan.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Vinted renders most item data client-side. When the HTML chain misses the price, the item is read
 * from the internal {@code /api/v2/items/{id}} endpoint after a session cookie has been obtained from
 * the site root.
 */
@Component
public class VintedListingExtractor extends AbstractListingExtractor {
    private static final Logger log = LoggerFactory.getLogger(VintedListingExtractor.class);
    private static final Pattern ITEM_ID = Pattern.compile("/items/(\\d+)");
    static final String API_STRATEGY = "vinted-api";

    private final ObjectMapper objectMapper;

    public VintedListingExtractor(PoliteHttpClient httpClient, ObjectMapper objectMapper, ScannerProperties properties) {
        super(httpClient, properties, new FallbackChain(List.of(
            new StructuredDataStrategy(objectMapper, List.of("script#__NEXT_DATA__")),
            new SemanticMarkupStrategy("vinted.net"),
            rawText(properties)
        )));
        this.objectMapper = objectMapper;
    }

    @Override
    public Platform platform() {
        return Platform.VINTED;
    }

    @Override
    protected FallbackChain.Result enrich(String url, PageContext page, FallbackChain.Result result) {
        ListingFields fields = result.fields();
        if (fields.hasTitle() && fields.hasPrice()) {
            return result;
        }
        String itemId = itemId(url);
        String origin = origin(url);
        if (itemId == null || origin == null) {
            return result;
        }
        HttpFetchResult session = httpClient.getHtml(origin + "/");
        if (!session.isSuccessful()) {
            log.warn("Vinted session bootstrap failed for {}: {}", url, session.describeFailure());
            return result;
        }
        HttpFetchResult item = httpClient.getJson(origin + "/api/v2/items/" + itemId);
        if (!item.isSuccessful() || item.body() == null) {
            log.warn("Vinted item endpoint failed for {}: {}", url, item.describeFailure());
            return result;
        }
        JsonNode root;
        try {
            root = objectMapper.readTree(item.body());
        } catch (JsonProcessingException e) {
            log.warn("Vinted item endpoint returned malformed JSON for {}: {}", url, e.getOriginalMessage());
            return result;
        }
        JsonNode itemNode = root.has("item") ? root.get("item") : root;
        ListingFields apiFields = ListingJsonReader.read(itemNode);
        if (apiFields.isEmpty()) {
            return result;
        }
        List<String> applied = new ArrayList<>(result.appliedStrategies());
        applied.add(API_STRATEGY);
        return new FallbackChain.Result(fields.fillMissingFrom(apiFields), applied);
    }

    static String itemId(String url) {
        if (url == null) {
            return null;
        }
        Matcher matcher = ITEM_ID.matcher(url);
        return matcher.find() ? matcher.group(1) : null;
    }

    private static String origin(String url) {
        URI uri = UrlUtils.safeUri(url);
        if (uri == null || uri.getScheme() == null || uri.getHost() == null) {
            return null;
        }
        String port = uri.getPort() > 0 ? ":" + uri.getPort() : "";
        return uri.getScheme() + "://" + uri.getHost() + port;
    }
}
