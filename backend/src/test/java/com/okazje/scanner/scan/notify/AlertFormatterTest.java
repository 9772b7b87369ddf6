package com.okazje.scanner.scan.notify;

import com.okazje.scanner.scan.model.Listing;
import com.okazje.scanner.scan.model.Platform;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class AlertFormatterTest {

    @Test
    void formatsNumberedListingsWithFooter() {
        List<Listing> top = List.of(
            Listing.stub("https://sprzedajemy.pl/zegar-nr1", "Zegar *Junghans*", new BigDecimal("150.00"),
                Platform.SPRZEDAJEMY),
            Listing.stub("https://gratka.pl/szabla/2", "Szabla", BigDecimal.ZERO, Platform.GRATKA)
        );

        String text = AlertFormatter.format(top, 5);

        assertThat(text).startsWith("🔔 *NOWE OFERTY* (5 znalezionych)\n\n");
        assertThat(text).contains("*1. Zegar \\*Junghans\\**\n💰 150 zł | 📍 sprzedajemy.pl\n🔗 https://sprzedajemy.pl/zegar-nr1\n");
        assertThat(text).contains("*2. Szabla*\n💰 ? zł | 📍 gratka.pl\n");
        assertThat(text).contains("_...i 3 więcej_");
        assertThat(text).endsWith("💡 Wklej interesujący link, żeby dostać pełną analizę AI.");
    }

    @Test
    void noFooterWhenEverythingIsShown() {
        List<Listing> top = List.of(
            Listing.stub("https://gratka.pl/a/1", "x".repeat(80), new BigDecimal("10"), Platform.GRATKA));

        String text = AlertFormatter.format(top, 1);

        assertThat(text).doesNotContain("więcej");
        assertThat(text).contains("*1. " + "x".repeat(50) + "*\n");
    }

    @Test
    void splitsLongMessagesAtLineBreaks() {
        String text = "aaaa\nbbbb\ncccc\n";

        List<String> chunks = AlertFormatter.splitInChunks(text, 11);

        assertEquals(List.of("aaaa\nbbbb\n", "cccc\n"), chunks);
        assertEquals(String.join("", chunks), text);
    }
}
