package com.okazje.scanner.scan.classify;

import com.okazje.scanner.scan.model.Verdict;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

class VerdictParserTest {

    @Test
    void readsVerdictFromMarkerOrWord() {
        assertEquals(Verdict.BUY, VerdictParser.parse("WERDYKT: 🟢 KUP"));
        assertEquals(Verdict.NEGOTIATE, VerdictParser.parse("werdykt: negocjuj do 300 zł"));
        assertEquals(Verdict.INVESTIGATE, VerdictParser.parse("🟠 ZBADAJ osobiście"));
        assertEquals(Verdict.SKIP, VerdictParser.parse("❌ OMIŃ"));
    }

    @Test
    void strongestVerdictWins() {
        assertEquals(Verdict.BUY, VerdictParser.parse("Można 🟡 NEGOCJUJ, ale ostatecznie KUP"));
    }

    @Test
    void wordInsideLongerWordIsNotAVerdict() {
        assertEquals(Verdict.SKIP, VerdictParser.parse("Brak uzasadnienia ZAKUPU. ❌ OMIŃ"));
        assertEquals(Verdict.SKIP, VerdictParser.parse(null));
    }

    @Test
    void extractsMarketValueRange() {
        VerdictParser.ValueRange range = VerdictParser.parseValueRange("WYCENA RYNKOWA: 800 - 1 200 zł za oryginał");
        assertThat(range.low()).isEqualByComparingTo("800");
        assertThat(range.high()).isEqualByComparingTo("1200");

        VerdictParser.ValueRange reversed = VerdictParser.parseValueRange("Wycena 1500–900 zł");
        assertThat(reversed.low()).isEqualByComparingTo("900");
        assertThat(reversed.high()).isEqualByComparingTo("1500");

        assertEquals(VerdictParser.ValueRange.UNKNOWN, VerdictParser.parseValueRange("trudno wycenić"));
    }
}
