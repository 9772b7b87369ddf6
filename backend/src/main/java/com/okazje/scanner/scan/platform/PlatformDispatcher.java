package com.okazje.scanner.scan.platform;

import com.okazje.scanner.scan.model.Platform;
import org.springframework.stereotype.Component;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

@Component
public class PlatformDispatcher {

    public Platform detect(String url) {
        if (url == null || url.isBlank()) {
            return Platform.OTHER;
        }
        String host = extractHost(url.trim());
        if (host != null) {
            for (Platform platform : Platform.values()) {
                if (!platform.hasDomain()) {
                    continue;
                }
                String domain = platform.label();
                if (host.equals(domain) || host.endsWith("." + domain)) {
                    return platform;
                }
            }
            return Platform.OTHER;
        }
        String lower = url.toLowerCase(Locale.ROOT);
        for (Platform platform : Platform.values()) {
            if (platform.hasDomain() && lower.contains(platform.label())) {
                return platform;
            }
        }
        return Platform.OTHER;
    }

    private String extractHost(String url) {
        try {
            URI uri = new URI(url);
            if (uri.getHost() != null) {
                return uri.getHost().toLowerCase(Locale.ROOT);
            }
            if (uri.getScheme() != null) {
                return null;
            }
            URI withHttps = new URI("https://" + url);
            return withHttps.getHost() == null ? null : withHttps.getHost().toLowerCase(Locale.ROOT);
        } catch (URISyntaxException ignored) {
            return null;
        }
    }
}
