package com.okazje.scanner.scan.normalize;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class PriceNormalizer {
    private static final Pattern CURRENCY_MARKERS = Pattern.compile(
        "(?iu)zł|zl|pln"
    );
    private static final Pattern SPACES = Pattern.compile("[\\s\\u00A0\\u202F\\u2009]+");
    private static final Pattern DIGITS_AND_SEPARATORS = Pattern.compile("[0-9.,]+");
    private static final Pattern AMOUNT_WITH_CURRENCY = Pattern.compile(
        "(?iu)(?<![\\d.,])(\\d{1,3}(?:[ .\\u00A0\\u202F\\u2009]\\d{3})+(?:[.,]\\d{1,2})?|\\d+(?:[.,]\\d{1,2})?)\\s*(?:zł|zl\\b|pln\\b)"
    );

    private PriceNormalizer() {
    }

    public static Optional<BigDecimal> parse(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String value = CURRENCY_MARKERS.matcher(raw).replaceAll("");
        value = SPACES.matcher(value).replaceAll("");
        if (value.isEmpty() || !DIGITS_AND_SEPARATORS.matcher(value).matches()) {
            return Optional.empty();
        }
        List<String> groups = splitGroups(value);
        if (groups.stream().anyMatch(String::isEmpty)) {
            return Optional.empty();
        }
        String normalized;
        if (groups.size() == 1) {
            normalized = groups.get(0);
        } else if (groups.size() == 2) {
            // "1.250" and "1,250" are thousands; "199.99" is a decimal
            boolean thousands = groups.get(1).length() == 3;
            normalized = groups.get(0) + (thousands ? "" : ".") + groups.get(1);
        } else {
            String last = groups.get(groups.size() - 1);
            boolean decimalTail = last.length() <= 2;
            int thousandsEnd = decimalTail ? groups.size() - 1 : groups.size();
            StringBuilder integer = new StringBuilder(groups.get(0));
            for (int i = 1; i < thousandsEnd; i++) {
                if (groups.get(i).length() != 3) {
                    return Optional.empty();
                }
                integer.append(groups.get(i));
            }
            normalized = decimalTail ? integer + "." + last : integer.toString();
        }
        try {
            BigDecimal parsed = new BigDecimal(normalized);
            if (parsed.signum() < 0) {
                return Optional.empty();
            }
            return Optional.of(parsed);
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    public static BigDecimal toPriceOrZero(String raw) {
        return parse(raw).orElse(BigDecimal.ZERO);
    }

    /**
     * Finds the first amount followed by a currency marker, e.g. {@code "Cena: 1 250,50 zł"}.
     */
    public static Optional<BigDecimal> findFirstAmount(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Matcher matcher = AMOUNT_WITH_CURRENCY.matcher(text);
        while (matcher.find()) {
            Optional<BigDecimal> parsed = parse(matcher.group(1));
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private static List<String> splitGroups(String value) {
        List<String> groups = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (c == '.' || c == ',') {
                groups.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        groups.add(current.toString());
        return groups;
    }
}
