package com.okazje.scanner.scan.persistence;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.okazje.scanner.config.ScannerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;

/**
 * Durable set of listing URLs that were already reported, oldest first. Bounded by a high-water mark;
 * once exceeded the oldest entries are evicted down to the prune target.
 */
@Repository
public class SeenListingRepository {
    private static final Logger log = LoggerFactory.getLogger(SeenListingRepository.class);
    private static final TypeReference<SeenDocument> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final JsonFileStore store;
    private final int highWaterMark;
    private final int pruneTarget;
    private final LinkedHashSet<String> urls = new LinkedHashSet<>();
    private final Object lock = new Object();

    public SeenListingRepository(ObjectMapper objectMapper, ScannerProperties properties) {
        ScannerProperties.Storage storage = properties.getStorage();
        this.store = new JsonFileStore(objectMapper, Path.of(storage.getSeenFile()));
        this.highWaterMark = storage.getSeenHighWaterMark();
        this.pruneTarget = storage.getSeenPruneTarget();
        load();
    }

    public boolean has(String url) {
        if (url == null) {
            return false;
        }
        synchronized (lock) {
            return urls.contains(url);
        }
    }

    /**
     * Records the URL and flushes the set to disk before returning.
     *
     * @return {@code true} when the URL was not seen before
     * @throws PersistenceException when the file cannot be written; the in-memory set is updated regardless
     */
    public boolean add(String url) {
        if (url == null || url.isBlank()) {
            return false;
        }
        synchronized (lock) {
            if (!urls.add(url)) {
                return false;
            }
            if (urls.size() > highWaterMark) {
                prune();
            }
            store.write(new SeenDocument(new ArrayList<>(urls)));
            return true;
        }
    }

    public int size() {
        synchronized (lock) {
            return urls.size();
        }
    }

    public List<String> snapshot() {
        synchronized (lock) {
            return List.copyOf(urls);
        }
    }

    private void prune() {
        int toRemove = urls.size() - pruneTarget;
        Iterator<String> oldestFirst = urls.iterator();
        while (toRemove > 0 && oldestFirst.hasNext()) {
            oldestFirst.next();
            oldestFirst.remove();
            toRemove--;
        }
        log.info("Pruned seen-set to {} entries (high-water mark {})", urls.size(), highWaterMark);
    }

    private void load() {
        try {
            store.read(DOCUMENT_TYPE).ifPresent(document -> {
                if (document.seenUrls() != null) {
                    document.seenUrls().stream()
                        .filter(url -> url != null && !url.isBlank())
                        .forEach(urls::add);
                }
            });
            log.info("Loaded {} seen listings from {}", urls.size(), store.path());
        } catch (IOException e) {
            urls.clear();
            log.warn("Could not read seen-set from {}, starting empty: {}", store.path(), e.getMessage());
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record SeenDocument(@JsonProperty("seen_urls") List<String> seenUrls) {
    }
}
