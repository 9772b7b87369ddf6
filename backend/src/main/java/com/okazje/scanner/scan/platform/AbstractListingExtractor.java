package com.okazje.scanner.scan.platform;

import com.okazje.scanner.config.ScannerProperties;
import com.okazje.scanner.scan.extract.FallbackChain;
import com.okazje.scanner.scan.extract.RawTextStrategy;
import com.okazje.scanner.scan.http.PoliteHttpClient;
import com.okazje.scanner.scan.model.ExtractionFailure;
import com.okazje.scanner.scan.model.ExtractionOutcome;
import com.okazje.scanner.scan.model.HttpFetchResult;
import com.okazje.scanner.scan.model.Listing;
import com.okazje.scanner.scan.model.ListingFields;
import com.okazje.scanner.scan.model.PageContext;
import com.okazje.scanner.scan.normalize.ConditionNormalizer;
import com.okazje.scanner.scan.normalize.TextTruncator;
import com.okazje.scanner.scan.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Fetches a detail page, runs the platform's fallback chain and caps the result into a {@link Listing}.
 */
public abstract class AbstractListingExtractor implements ListingExtractor {
    private static final Logger log = LoggerFactory.getLogger(AbstractListingExtractor.class);

    protected final PoliteHttpClient httpClient;
    protected final ScannerProperties.Extraction extraction;
    private final FallbackChain chain;

    protected AbstractListingExtractor(PoliteHttpClient httpClient, ScannerProperties properties, FallbackChain chain) {
        this.httpClient = httpClient;
        this.extraction = properties.getExtraction();
        this.chain = chain;
    }

    protected static RawTextStrategy rawText(ScannerProperties properties) {
        ScannerProperties.Extraction extraction = properties.getExtraction();
        return new RawTextStrategy(extraction.getDescriptionMarkers(), extraction.getRawDescriptionLength());
    }

    @Override
    public ExtractionOutcome extract(String url) {
        HttpFetchResult fetch = httpClient.getHtml(url);
        if (!fetch.isSuccessful() || fetch.body() == null) {
            log.warn("Fetch failed for {} ({}): {}", url, platform().label(), fetch.describeFailure());
            return ExtractionOutcome.failure(ExtractionFailure.fetch(url, fetch.describeFailure()));
        }
        PageContext page = PageContext.parse(fetch.finalUrlOrRequested(), fetch.body());
        FallbackChain.Result result = enrich(url, page, chain.run(page));
        if (!result.fields().hasTitle()) {
            log.warn("No strategy yielded a title for {} (tried {})", url, chain.strategyNames());
            return ExtractionOutcome.failure(ExtractionFailure.parse(url, "no title found"));
        }
        Listing listing = toListing(url, page.url(), result.fields());
        log.debug("Extracted {} from {} via {}", listing.id(), url, result.appliedStrategies());
        return ExtractionOutcome.success(listing, result.appliedStrategies());
    }

    /**
     * Hook for adapters that can fill gaps with a secondary request. Must never fail the extraction.
     */
    protected FallbackChain.Result enrich(String url, PageContext page, FallbackChain.Result result) {
        return result;
    }

    protected Listing toListing(String url, String pageUrl, ListingFields fields) {
        return new Listing(
            url,
            TextTruncator.collapseWhitespace(fields.title()),
            fields.price(),
            TextTruncator.truncate(fields.description() == null ? "" : fields.description().trim(),
                extraction.getMaxDescriptionLength()),
            fields.location(),
            platform(),
            fields.seller(),
            ConditionNormalizer.normalize(fields.condition()),
            capImages(pageUrl, fields.images()),
            Instant.now(),
            null,
            null,
            null,
            null
        );
    }

    private List<String> capImages(String pageUrl, List<String> images) {
        LinkedHashSet<String> unique = new LinkedHashSet<>();
        for (String image : images) {
            if (unique.size() >= extraction.getMaxImages()) {
                break;
            }
            String absolute = UrlUtils.absolutize(pageUrl, image);
            if (absolute != null) {
                unique.add(absolute);
            }
        }
        return new ArrayList<>(unique);
    }
}
