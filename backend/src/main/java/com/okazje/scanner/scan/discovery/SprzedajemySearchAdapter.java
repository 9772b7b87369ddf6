package com.okazje.scanner.scan.discovery;

import com.okazje.scanner.config.ScannerProperties;
import com.okazje.scanner.scan.http.PoliteHttpClient;
import com.okazje.scanner.scan.model.Platform;
import com.okazje.scanner.scan.util.UrlUtils;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

@Component
public class SprzedajemySearchAdapter extends AbstractSearchAdapter {
    // offer pages end with "-nr<id>", e.g. /zegarek-rakieta-nr71234567
    private static final Pattern LISTING_PATH = Pattern.compile("/[^/]*-nr\\d+");

    public SprzedajemySearchAdapter(PoliteHttpClient httpClient, ScannerProperties properties) {
        super(httpClient, properties);
    }

    @Override
    public Platform platform() {
        return Platform.SPRZEDAJEMY;
    }

    @Override
    protected String searchUrl(String keyword) {
        return discovery.getSprzedajemyBaseUrl() + "/szukaj?inp_text=" + UrlUtils.encodeQuery(keyword);
    }

    @Override
    protected Pattern listingPathPattern() {
        return LISTING_PATH;
    }
}
