package com.okazje.scanner.scan.discovery;

import com.okazje.scanner.config.ScannerProperties;
import com.okazje.scanner.scan.http.PoliteHttpClient;
import com.okazje.scanner.scan.model.HttpFetchResult;
import com.okazje.scanner.scan.model.Listing;
import com.okazje.scanner.scan.normalize.PriceNormalizer;
import com.okazje.scanner.scan.normalize.TextTruncator;
import com.okazje.scanner.scan.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.net.URI;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Pattern;

public abstract class AbstractSearchAdapter implements DiscoveryAdapter {
    private static final Logger log = LoggerFactory.getLogger(AbstractSearchAdapter.class);
    private static final int MIN_TITLE_LENGTH = 3;
    private static final int MAX_CONTAINER_DEPTH = 5;

    protected final PoliteHttpClient httpClient;
    protected final ScannerProperties.Discovery discovery;

    protected AbstractSearchAdapter(PoliteHttpClient httpClient, ScannerProperties properties) {
        this.httpClient = httpClient;
        this.discovery = properties.getDiscovery();
    }

    protected abstract String searchUrl(String keyword);

    /**
     * Pattern matched against the path of a same-host link to accept it as a listing.
     */
    protected abstract Pattern listingPathPattern();

    @Override
    public List<Listing> search(String keyword, BigDecimal priceCeiling) {
        if (keyword == null || keyword.isBlank()) {
            return List.of();
        }
        String url = searchUrl(keyword);
        HttpFetchResult fetch = httpClient.getHtml(url);
        if (!fetch.isSuccessful() || fetch.body() == null) {
            log.warn("Search on {} for '{}' failed: {}", platform().label(), keyword, fetch.describeFailure());
            return List.of();
        }
        String pageUrl = fetch.finalUrlOrRequested();
        Document document = Jsoup.parse(fetch.body(), pageUrl);
        String pageHost = UrlUtils.host(pageUrl);

        List<Element> candidates = new ArrayList<>();
        Set<String> candidateUrls = new LinkedHashSet<>();
        for (Element anchor : document.select("a[href]")) {
            String href = anchor.absUrl("href");
            if (isListingLink(href, pageHost) && candidateUrls.add(href)) {
                candidates.add(anchor);
                if (candidates.size() >= discovery.getMaxResults()) {
                    break;
                }
            }
        }

        List<Listing> stubs = new ArrayList<>();
        for (Element anchor : candidates) {
            try {
                Listing stub = toStub(anchor, candidateUrls, pageHost);
                if (stub != null && withinCeiling(stub.price(), priceCeiling)) {
                    stubs.add(stub);
                }
            } catch (RuntimeException e) {
                log.debug("Skipping malformed result on {}: {}", platform().label(), e.getMessage());
            }
        }
        log.debug("Search on {} for '{}' -> {} candidates, {} kept", platform().label(), keyword,
            candidates.size(), stubs.size());
        return stubs;
    }

    static boolean withinCeiling(BigDecimal price, BigDecimal ceiling) {
        if (price == null || price.signum() <= 0 || ceiling == null) {
            return true;
        }
        return price.compareTo(ceiling) <= 0;
    }

    private Listing toStub(Element anchor, Set<String> candidateUrls, String pageHost) {
        String title = TextTruncator.collapseWhitespace(anchor.text());
        title = TextTruncator.truncate(title, discovery.getMaxTitleLength());
        if (title.length() < MIN_TITLE_LENGTH) {
            return null;
        }
        String href = anchor.absUrl("href");
        BigDecimal price = PriceNormalizer.findFirstAmount(anchor.text())
            .or(() -> containerPrice(anchor, pageHost))
            .orElse(BigDecimal.ZERO);
        return Listing.stub(href, title, price, platform());
    }

    /**
     * Looks for a price in the closest ancestor that still wraps only this one listing link.
     */
    private Optional<BigDecimal> containerPrice(Element anchor, String pageHost) {
        String href = anchor.absUrl("href");
        Element container = anchor.parent();
        for (int depth = 0; container != null && depth < MAX_CONTAINER_DEPTH; depth++) {
            Set<String> links = new LinkedHashSet<>();
            for (Element link : container.select("a[href]")) {
                String candidate = link.absUrl("href");
                if (isListingLink(candidate, pageHost)) {
                    links.add(candidate);
                }
            }
            if (links.size() > 1 || !links.contains(href)) {
                return Optional.empty();
            }
            Optional<BigDecimal> price = PriceNormalizer.findFirstAmount(container.text());
            if (price.isPresent()) {
                return price;
            }
            container = container.parent();
        }
        return Optional.empty();
    }

    private boolean isListingLink(String href, String pageHost) {
        URI uri = UrlUtils.safeUri(href);
        if (uri == null || uri.getHost() == null || uri.getPath() == null) {
            return false;
        }
        if (pageHost != null && !sameSite(uri.getHost(), pageHost)) {
            return false;
        }
        return listingPathPattern().matcher(uri.getPath()).find();
    }

    /**
     * True when one host is the other or a subdomain of it, ignoring a leading {@code www.}.
     */
    static boolean sameSite(String host, String pageHost) {
        String a = stripWww(host);
        String b = stripWww(pageHost);
        return a.equals(b) || a.endsWith("." + b) || b.endsWith("." + a);
    }

    private static String stripWww(String host) {
        String lower = host.toLowerCase(Locale.ROOT);
        return lower.startsWith("www.") ? lower.substring(4) : lower;
    }
}
