package com.okazje.scanner.scan.extract;

import com.fasterxml.jackson.databind.JsonNode;
import com.okazje.scanner.scan.model.ListingFields;
import com.okazje.scanner.scan.normalize.PriceNormalizer;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Maps a JSON object describing a single listing (JSON-LD {@code Product}, embedded page state or an
 * internal item endpoint) onto {@link ListingFields}.
 */
public final class ListingJsonReader {
    private ListingJsonReader() {
    }

    public static boolean looksLikeListing(JsonNode node) {
        if (node == null || !node.isObject()) {
            return false;
        }
        boolean hasOffers = node.hasNonNull("offers");
        boolean hasPrice = node.hasNonNull("price");
        boolean hasName = hasText(node, "name") || hasText(node, "title");
        return hasOffers || (hasPrice && hasName);
    }

    public static JsonNode findListingNode(JsonNode node) {
        if (node == null || node.isNull()) {
            return null;
        }
        if (node.isObject()) {
            if (looksLikeListing(node)) {
                return node;
            }
            Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
            while (fields.hasNext()) {
                JsonNode value = fields.next().getValue();
                if (value.isArray() || value.isObject()) {
                    JsonNode found = findListingNode(value);
                    if (found != null) {
                        return found;
                    }
                }
            }
            return null;
        }
        if (node.isArray()) {
            for (JsonNode child : node) {
                JsonNode found = findListingNode(child);
                if (found != null) {
                    return found;
                }
            }
        }
        return null;
    }

    public static ListingFields read(JsonNode node) {
        if (node == null || !node.isObject()) {
            return ListingFields.empty();
        }
        JsonNode offers = firstOffer(node.get("offers"));
        return new ListingFields(
            firstNonBlank(text(node, "name"), text(node, "title")),
            readPrice(node, offers),
            text(node, "description"),
            readLocation(node, offers),
            readSeller(node, offers),
            firstNonBlank(
                text(node, "itemCondition"),
                text(offers, "itemCondition"),
                text(node, "condition"),
                text(node, "status")
            ),
            readImages(node)
        );
    }

    private static JsonNode firstOffer(JsonNode offers) {
        if (offers == null || offers.isNull()) {
            return null;
        }
        if (offers.isArray()) {
            return offers.isEmpty() ? null : offers.get(0);
        }
        return offers;
    }

    private static BigDecimal readPrice(JsonNode node, JsonNode offers) {
        for (JsonNode candidate : new JsonNode[] {
            offers == null ? null : offers.get("price"),
            offers == null ? null : offers.get("lowPrice"),
            node.get("price")
        }) {
            BigDecimal price = priceOf(candidate);
            if (price != null) {
                return price;
            }
        }
        return null;
    }

    private static BigDecimal priceOf(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isNumber()) {
            BigDecimal decimal = value.decimalValue();
            return decimal.signum() < 0 ? null : decimal;
        }
        if (value.isTextual()) {
            return PriceNormalizer.parse(value.asText()).orElse(null);
        }
        if (value.isObject()) {
            BigDecimal amount = priceOf(value.get("amount"));
            return amount != null ? amount : priceOf(value.get("value"));
        }
        return null;
    }

    private static String readLocation(JsonNode node, JsonNode offers) {
        String fromLocation = locationOf(node.get("location"));
        if (fromLocation != null) {
            return fromLocation;
        }
        String fromAddress = locationOf(node.get("address"));
        if (fromAddress != null) {
            return fromAddress;
        }
        if (offers != null) {
            String fromOffer = locationOf(offers.path("availableAtOrFrom").get("address"));
            if (fromOffer != null) {
                return fromOffer;
            }
        }
        return text(node, "city");
    }

    private static String locationOf(JsonNode value) {
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual()) {
            String text = value.asText().trim();
            return text.isEmpty() ? null : text;
        }
        if (!value.isObject()) {
            return null;
        }
        JsonNode address = value.has("address") ? value.get("address") : value;
        if (address.isTextual()) {
            return locationOf(address);
        }
        List<String> parts = new ArrayList<>();
        addIfPresent(parts, firstNonBlank(text(address, "addressLocality"), text(address, "city")));
        addIfPresent(parts, firstNonBlank(text(address, "addressRegion"), text(address, "region")));
        if (!parts.isEmpty()) {
            return String.join(", ", parts);
        }
        return text(value, "name");
    }

    private static String readSeller(JsonNode node, JsonNode offers) {
        if (offers != null) {
            String offerSeller = text(offers.get("seller"), "name");
            if (offerSeller != null) {
                return offerSeller;
            }
        }
        JsonNode seller = node.get("seller");
        if (seller != null && seller.isObject()) {
            String name = firstNonBlank(text(seller, "name"), text(seller, "login"));
            if (name != null) {
                return name;
            }
        } else if (seller != null && seller.isTextual() && !seller.asText().isBlank()) {
            return seller.asText().trim();
        }
        return text(node.get("user"), "login");
    }

    private static List<String> readImages(JsonNode node) {
        LinkedHashSet<String> urls = new LinkedHashSet<>();
        for (String field : List.of("image", "images", "photos")) {
            collectImages(node.get(field), urls);
            if (!urls.isEmpty()) {
                break;
            }
        }
        return new ArrayList<>(urls);
    }

    private static void collectImages(JsonNode value, LinkedHashSet<String> out) {
        if (value == null || value.isNull()) {
            return;
        }
        if (value.isTextual()) {
            String url = value.asText().trim();
            if (!url.isEmpty()) {
                out.add(url);
            }
            return;
        }
        if (value.isArray()) {
            for (JsonNode item : value) {
                collectImages(item, out);
            }
            return;
        }
        if (value.isObject()) {
            String url = firstNonBlank(text(value, "full_size_url"), text(value, "url"), text(value, "contentUrl"));
            if (url != null) {
                out.add(url);
            }
        }
    }

    private static boolean hasText(JsonNode node, String field) {
        return text(node, field) != null;
    }

    private static String text(JsonNode node, String field) {
        if (node == null || node.isNull()) {
            return null;
        }
        JsonNode value = node.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        if (value.isTextual() || value.isNumber() || value.isBoolean()) {
            String text = value.asText().trim();
            return text.isEmpty() ? null : text;
        }
        return null;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }

    private static void addIfPresent(List<String> list, String value) {
        if (value != null && !value.isBlank()) {
            list.add(value.trim());
        }
    }
}
