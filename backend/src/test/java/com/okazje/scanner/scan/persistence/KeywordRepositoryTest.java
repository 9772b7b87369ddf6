package com.okazje.scanner.scan.persistence;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.okazje.scanner.config.ScannerProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class KeywordRepositoryTest {
    private final ObjectMapper objectMapper = new ObjectMapper();

    @TempDir
    Path tempDir;

    private ScannerProperties properties;

    @BeforeEach
    void setUp() {
        properties = new ScannerProperties();
        properties.getStorage().setKeywordsFile(tempDir.resolve("keywords.json").toString());
        properties.getScan().setDefaultKeywords(List.of("komiks PRL", "szabla", "zegar"));
    }

    @Test
    void missingFileUsesDefaults() {
        KeywordRepository repository = new KeywordRepository(objectMapper, properties);

        assertThat(repository.list()).containsExactly("komiks PRL", "szabla", "zegar");
    }

    @Test
    void corruptFileUsesDefaults() throws IOException {
        Files.writeString(tempDir.resolve("keywords.json"), "[\"niedokończone");

        KeywordRepository repository = new KeywordRepository(objectMapper, properties);

        assertThat(repository.size()).isEqualTo(3);
    }

    @Test
    void addedKeywordIsPersisted() {
        KeywordRepository repository = new KeywordRepository(objectMapper, properties);

        assertThat(repository.add("  aparat Zenit ")).isTrue();
        assertThat(repository.add("szabla")).isFalse();

        KeywordRepository reloaded = new KeywordRepository(objectMapper, properties);
        assertThat(reloaded.list()).containsExactly("komiks PRL", "szabla", "zegar", "aparat Zenit");
    }

    @Test
    void blankKeywordIsRejected() {
        KeywordRepository repository = new KeywordRepository(objectMapper, properties);

        assertThatThrownBy(() -> repository.add("   ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void removesByPositionOrText() {
        KeywordRepository repository = new KeywordRepository(objectMapper, properties);

        assertThat(repository.remove("1")).isEqualTo(Optional.of("komiks PRL"));
        assertThat(repository.remove("zegar")).isEqualTo(Optional.of("zegar"));
        assertThat(repository.remove("99")).isEmpty();
        assertThat(repository.remove("brak")).isEmpty();

        assertThat(new KeywordRepository(objectMapper, properties).list()).containsExactly("szabla");
    }
}
