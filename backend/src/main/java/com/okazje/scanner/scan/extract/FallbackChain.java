package com.okazje.scanner.scan.extract;

import com.okazje.scanner.scan.model.ListingFields;
import com.okazje.scanner.scan.model.PageContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs strategies in priority order. Later strategies only fill fields that are still empty, and the
 * chain stops as soon as the merged result carries a title.
 */
public class FallbackChain {
    private static final Logger log = LoggerFactory.getLogger(FallbackChain.class);

    private final List<ExtractionStrategy> strategies;

    public FallbackChain(List<ExtractionStrategy> strategies) {
        this.strategies = List.copyOf(strategies);
    }

    public Result run(PageContext page) {
        return run(page, ListingFields.empty());
    }

    public Result run(PageContext page, ListingFields seed) {
        ListingFields merged = seed == null ? ListingFields.empty() : seed;
        List<String> applied = new ArrayList<>();
        for (ExtractionStrategy strategy : strategies) {
            ListingFields partial = safeExtract(strategy, page);
            if (!partial.isEmpty()) {
                applied.add(strategy.name());
                merged = merged.fillMissingFrom(partial);
            }
            log.debug("Strategy {} on {} -> title present: {}", strategy.name(), page.url(), merged.hasTitle());
            if (merged.hasTitle()) {
                break;
            }
        }
        return new Result(merged, applied);
    }

    public List<String> strategyNames() {
        return strategies.stream().map(ExtractionStrategy::name).toList();
    }

    private ListingFields safeExtract(ExtractionStrategy strategy, PageContext page) {
        try {
            ListingFields fields = strategy.extract(page);
            return fields == null ? ListingFields.empty() : fields;
        } catch (RuntimeException e) {
            log.warn("Strategy {} failed on {}: {}", strategy.name(), page.url(), e.getMessage());
            return ListingFields.empty();
        }
    }

    public record Result(ListingFields fields, List<String> appliedStrategies) {
        public Result {
            appliedStrategies = List.copyOf(appliedStrategies);
        }
    }
}
