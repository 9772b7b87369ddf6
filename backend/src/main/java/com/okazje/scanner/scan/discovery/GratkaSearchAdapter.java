package com.okazje.scanner.scan.discovery;

import com.okazje.scanner.config.ScannerProperties;
import com.okazje.scanner.scan.http.PoliteHttpClient;
import com.okazje.scanner.scan.model.Platform;
import com.okazje.scanner.scan.util.UrlUtils;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
public class GratkaSearchAdapter extends AbstractSearchAdapter {
    private static final Pattern LISTING_PATH = Pattern.compile("^/(?!szukaj).*\\d");

    public GratkaSearchAdapter(PoliteHttpClient httpClient, ScannerProperties properties) {
        super(httpClient, properties);
    }

    @Override
    public Platform platform() {
        return Platform.GRATKA;
    }

    @Override
    protected String searchUrl(String keyword) {
        return discovery.getGratkaBaseUrl() + "/szukaj?q=" + UrlUtils.encodeQuery(keyword);
    }

    @Override
    protected Pattern listingPathPattern() {
        return LISTING_PATH;
    }
}
