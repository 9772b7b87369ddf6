package com.okazje.scanner.scan.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;

public final class UrlUtils {
    private UrlUtils() {
    }

    public static URI safeUri(String url) {
        if (url == null || url.isBlank()) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    public static String host(String url) {
        URI uri = safeUri(url);
        if (uri == null || uri.getHost() == null) {
            return null;
        }
        return uri.getHost().toLowerCase(Locale.ROOT);
    }

    public static String absolutize(String baseUrl, String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String trimmed = href.trim();
        if (trimmed.startsWith("//")) {
            URI base = safeUri(baseUrl);
            String scheme = base == null || base.getScheme() == null ? "https" : base.getScheme();
            return scheme + ":" + trimmed;
        }
        URI candidate = safeUri(trimmed);
        if (candidate != null && candidate.isAbsolute()) {
            return trimmed;
        }
        URI base = safeUri(baseUrl);
        if (base == null || candidate == null) {
            return null;
        }
        return base.resolve(candidate).toString();
    }

    public static String encodeQuery(String value) {
        return URLEncoder.encode(value == null ? "" : value.trim(), StandardCharsets.UTF_8);
    }
}
