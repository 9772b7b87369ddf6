package com.okazje.scanner.scan.extract;

import com.okazje.scanner.scan.model.ListingFields;
import com.okazje.scanner.scan.model.PageContext;
import com.okazje.scanner.scan.normalize.PriceNormalizer;
import com.okazje.scanner.scan.normalize.TextTruncator;
import com.okazje.scanner.scan.util.UrlUtils;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

public class SemanticMarkupStrategy implements ExtractionStrategy {
    private static final String PRICE_CLASS = "[class~=(?i)(price|cena)]";
    private static final String DESCRIPTION_CLASS = "[class~=(?i)(desc|opis|description|content)]";
    private static final String LOCATION_CLASS = "[class~=(?i)(location|lokalizacja|address)]";
    private static final String SELLER_CLASS = "[class~=(?i)(seller|user|sprzedawca)]";
    private static final String CONDITION_CLASS = "[class~=(?i)(condition|\\bstan\\b)]";
    private static final int MAX_SHORT_FIELD = 100;
    private static final int MAX_DESCRIPTION_BLOCKS = 3;

    private final String imageHint;

    public SemanticMarkupStrategy() {
        this(null);
    }

    /**
     * @param imageHint substring an {@code img[src]} must contain to count as a listing photo; {@code null}
     *                  limits images to {@code og:image}
     */
    public SemanticMarkupStrategy(String imageHint) {
        this.imageHint = imageHint;
    }

    @Override
    public String name() {
        return "semantic-markup";
    }

    @Override
    public ListingFields extract(PageContext page) {
        Document document = page.document();
        return new ListingFields(
            title(document),
            price(document),
            description(document),
            shortText(document, LOCATION_CLASS),
            shortText(document, SELLER_CLASS),
            shortText(document, CONDITION_CLASS),
            images(document, page.url())
        );
    }

    private String title(Document document) {
        return firstNonBlank(
            textOf(document.selectFirst("h1")),
            attr(document.selectFirst("meta[property=og:title]"), "content"),
            itemprop(document.selectFirst("[itemprop=name]"))
        );
    }

    private BigDecimal price(Document document) {
        Element itemprop = document.selectFirst("[itemprop=price]");
        if (itemprop != null) {
            Optional<BigDecimal> parsed = PriceNormalizer.parse(itemprop(itemprop));
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        Element amountMeta = document.selectFirst("meta[property=product:price:amount]");
        if (amountMeta != null) {
            Optional<BigDecimal> parsed = PriceNormalizer.parse(amountMeta.attr("content"));
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        for (Element element : document.select(PRICE_CLASS)) {
            String text = element.text();
            Optional<BigDecimal> parsed = PriceNormalizer.findFirstAmount(text).or(() -> PriceNormalizer.parse(text));
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        for (Element strong : document.select("strong")) {
            Optional<BigDecimal> parsed = PriceNormalizer.findFirstAmount(strong.text());
            if (parsed.isPresent()) {
                return parsed.get();
            }
        }
        return null;
    }

    private String description(Document document) {
        String itemprop = itemprop(document.selectFirst("[itemprop=description]"));
        if (itemprop != null) {
            return itemprop;
        }
        List<String> blocks = new ArrayList<>();
        for (Element element : document.select(DESCRIPTION_CLASS)) {
            String text = element.text().trim();
            if (!text.isEmpty()) {
                blocks.add(text);
            }
            if (blocks.size() >= MAX_DESCRIPTION_BLOCKS) {
                break;
            }
        }
        if (!blocks.isEmpty()) {
            return String.join(" ", blocks);
        }
        return attr(document.selectFirst("meta[property=og:description]"), "content");
    }

    private List<String> images(Document document, String pageUrl) {
        LinkedHashSet<String> urls = new LinkedHashSet<>();
        for (Element meta : document.select("meta[property=og:image]")) {
            addImage(urls, pageUrl, meta.attr("content"));
        }
        if (imageHint != null && !imageHint.isBlank()) {
            for (Element img : document.select("img[src]")) {
                String src = img.attr("src");
                if (src.contains(imageHint)) {
                    addImage(urls, pageUrl, src);
                }
            }
        }
        return new ArrayList<>(urls);
    }

    private void addImage(LinkedHashSet<String> urls, String pageUrl, String candidate) {
        String absolute = UrlUtils.absolutize(pageUrl, candidate);
        if (absolute != null) {
            urls.add(absolute);
        }
    }

    private String shortText(Document document, String selector) {
        Elements elements = document.select(selector);
        for (Element element : elements) {
            String text = TextTruncator.collapseWhitespace(element.text());
            if (!text.isEmpty() && text.length() <= MAX_SHORT_FIELD) {
                return text;
            }
        }
        return null;
    }

    private static String itemprop(Element element) {
        if (element == null) {
            return null;
        }
        String content = element.attr("content");
        if (!content.isBlank()) {
            return content.trim();
        }
        return textOf(element);
    }

    private static String textOf(Element element) {
        if (element == null) {
            return null;
        }
        String text = element.text().trim();
        return text.isEmpty() ? null : text;
    }

    private static String attr(Element element, String name) {
        if (element == null) {
            return null;
        }
        String value = element.attr(name).trim();
        return value.isEmpty() ? null : value;
    }

    private static String firstNonBlank(String... values) {
        for (String value : values) {
            if (value != null && !value.isBlank()) {
                return value.trim();
            }
        }
        return null;
    }
}
