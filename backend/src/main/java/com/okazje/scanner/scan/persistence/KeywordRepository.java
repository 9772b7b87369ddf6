package com.okazje.scanner.scan.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.okazje.scanner.config.ScannerProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

@Repository
public class KeywordRepository {
    private static final Logger log = LoggerFactory.getLogger(KeywordRepository.class);
    private static final TypeReference<List<String>> DOCUMENT_TYPE = new TypeReference<>() {
    };

    private final JsonFileStore store;
    private final List<String> keywords = new ArrayList<>();
    private final Object lock = new Object();

    public KeywordRepository(ObjectMapper objectMapper, ScannerProperties properties) {
        this.store = new JsonFileStore(objectMapper, Path.of(properties.getStorage().getKeywordsFile()));
        load(properties.getScan().getDefaultKeywords());
    }

    public List<String> list() {
        synchronized (lock) {
            return List.copyOf(keywords);
        }
    }

    public int size() {
        synchronized (lock) {
            return keywords.size();
        }
    }

    /**
     * @return {@code false} when the keyword is already present
     * @throws IllegalArgumentException for a blank keyword
     */
    public boolean add(String keyword) {
        String normalized = normalize(keyword);
        if (normalized == null) {
            throw new IllegalArgumentException("Keyword must not be blank");
        }
        synchronized (lock) {
            if (keywords.contains(normalized)) {
                return false;
            }
            keywords.add(normalized);
            store.write(List.copyOf(keywords));
            return true;
        }
    }

    /**
     * Removes by 1-based position when the argument is a valid index, otherwise by exact text.
     */
    public Optional<String> remove(String numberOrText) {
        String normalized = normalize(numberOrText);
        if (normalized == null) {
            return Optional.empty();
        }
        synchronized (lock) {
            String removed = null;
            Integer index = parseIndex(normalized);
            if (index != null && index >= 1 && index <= keywords.size()) {
                removed = keywords.remove(index - 1);
            } else if (keywords.remove(normalized)) {
                removed = normalized;
            }
            if (removed == null) {
                return Optional.empty();
            }
            store.write(List.copyOf(keywords));
            return Optional.of(removed);
        }
    }

    private void load(List<String> defaults) {
        try {
            Optional<List<String>> stored = store.read(DOCUMENT_TYPE);
            if (stored.isPresent()) {
                stored.get().stream()
                    .map(KeywordRepository::normalize)
                    .filter(keyword -> keyword != null && !keywords.contains(keyword))
                    .forEach(keywords::add);
                log.info("Loaded {} keywords from {}", keywords.size(), store.path());
                return;
            }
        } catch (IOException e) {
            log.warn("Could not read keywords from {}, using defaults: {}", store.path(), e.getMessage());
        }
        keywords.clear();
        defaults.stream()
            .map(KeywordRepository::normalize)
            .filter(keyword -> keyword != null && !keywords.contains(keyword))
            .forEach(keywords::add);
    }

    private static Integer parseIndex(String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static String normalize(String keyword) {
        if (keyword == null || keyword.isBlank()) {
            return null;
        }
        return keyword.trim();
    }
}
