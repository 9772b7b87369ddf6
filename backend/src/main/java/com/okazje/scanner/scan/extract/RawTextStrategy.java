package com.okazje.scanner.scan.extract;

import com.okazje.scanner.scan.model.ListingFields;
import com.okazje.scanner.scan.model.PageContext;
import com.okazje.scanner.scan.normalize.ConditionNormalizer;
import com.okazje.scanner.scan.normalize.PriceNormalizer;
import com.okazje.scanner.scan.normalize.TextTruncator;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last-resort heuristics over the visible page text.
 */
public class RawTextStrategy implements ExtractionStrategy {
    private static final Pattern LOCATION = Pattern.compile(
        "(?U)(\\p{Lu}[\\w-]+(?:[ -]\\p{Lu}[\\w-]+)*),\\s*(\\w+kie)\\b"
    );
    private static final Pattern USED = Pattern.compile("(?iu)(?<!\\p{L})używane(?!\\p{L})");
    private static final Pattern NEW = Pattern.compile("(?iu)(?<!\\p{L})nowe(?!\\p{L})");

    private final List<String> descriptionMarkers;
    private final int descriptionLength;

    public RawTextStrategy(List<String> descriptionMarkers, int descriptionLength) {
        this.descriptionMarkers = List.copyOf(descriptionMarkers);
        this.descriptionLength = descriptionLength;
    }

    @Override
    public String name() {
        return "raw-text";
    }

    @Override
    public ListingFields extract(PageContext page) {
        String text = page.text() == null ? "" : page.text();
        String title = page.document().title();
        return new ListingFields(
            title == null || title.isBlank() ? null : title.trim(),
            PriceNormalizer.findFirstAmount(text).orElse(null),
            description(text),
            location(text),
            null,
            condition(text),
            List.of()
        );
    }

    private String description(String text) {
        if (text.isBlank()) {
            return null;
        }
        int start = -1;
        for (String marker : descriptionMarkers) {
            int index = text.indexOf(marker);
            if (index >= 0) {
                start = index;
                break;
            }
        }
        String tail = start >= 0 ? text.substring(start) : text;
        return TextTruncator.truncate(tail, descriptionLength).trim();
    }

    private String location(String text) {
        Matcher matcher = LOCATION.matcher(text);
        if (matcher.find()) {
            return matcher.group(1) + ", " + matcher.group(2);
        }
        return null;
    }

    private String condition(String text) {
        if (USED.matcher(text).find()) {
            return ConditionNormalizer.USED;
        }
        if (NEW.matcher(text).find()) {
            return ConditionNormalizer.NEW;
        }
        return null;
    }
}
