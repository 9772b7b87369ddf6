package com.okazje.scanner.scan.normalize;

import java.nio.charset.StandardCharsets;

public final class TextTruncator {
    private TextTruncator() {
    }

    public static String truncate(String value, int maxCodePoints) {
        if (value == null) {
            return "";
        }
        if (maxCodePoints <= 0) {
            return "";
        }
        if (value.codePointCount(0, value.length()) <= maxCodePoints) {
            return value;
        }
        return value.substring(0, value.offsetByCodePoints(0, maxCodePoints));
    }

    public static String truncateUtf8(String value, int maxBytes) {
        if (value == null || maxBytes <= 0) {
            return "";
        }
        int bytes = 0;
        int index = 0;
        while (index < value.length()) {
            int codePoint = value.codePointAt(index);
            int width = new String(Character.toChars(codePoint)).getBytes(StandardCharsets.UTF_8).length;
            if (bytes + width > maxBytes) {
                break;
            }
            bytes += width;
            index += Character.charCount(codePoint);
        }
        return value.substring(0, index);
    }

    public static String collapseWhitespace(String value) {
        if (value == null) {
            return "";
        }
        return value.replaceAll("[\\s\\u00A0]+", " ").trim();
    }
}
