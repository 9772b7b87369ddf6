package com.okazje.scanner.scan.classify;

import com.okazje.scanner.scan.model.Verdict;
import com.okazje.scanner.scan.normalize.PriceNormalizer;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class VerdictParser {
    private static final Pattern BUY = word("KUP");
    private static final Pattern NEGOTIATE = word("NEGOCJUJ");
    private static final Pattern INVESTIGATE = word("ZBADAJ");
    private static final String NUMBER = "\\d{1,3}(?:[ \\u00A0]\\d{3})+(?:[.,]\\d{1,2})?|\\d+(?:[.,]\\d{1,2})?";
    private static final Pattern RANGE = Pattern.compile(
        "(?iu)(?<![\\d.,])(" + NUMBER + ")\\s*(?:zł|pln)?\\s*[-–—]\\s*(" + NUMBER + ")\\s*(?:zł|pln)"
    );

    private VerdictParser() {
    }

    public static Verdict parse(String analysis) {
        if (analysis == null || analysis.isBlank()) {
            return Verdict.SKIP;
        }
        if (analysis.contains("🟢") || BUY.matcher(analysis).find()) {
            return Verdict.BUY;
        }
        if (analysis.contains("🟡") || NEGOTIATE.matcher(analysis).find()) {
            return Verdict.NEGOTIATE;
        }
        if (analysis.contains("🟠") || INVESTIGATE.matcher(analysis).find()) {
            return Verdict.INVESTIGATE;
        }
        return Verdict.SKIP;
    }

    public static ValueRange parseValueRange(String analysis) {
        if (analysis == null || analysis.isBlank()) {
            return ValueRange.UNKNOWN;
        }
        Matcher matcher = RANGE.matcher(analysis);
        while (matcher.find()) {
            BigDecimal low = PriceNormalizer.toPriceOrZero(matcher.group(1));
            BigDecimal high = PriceNormalizer.toPriceOrZero(matcher.group(2));
            if (low.signum() > 0 && high.signum() > 0) {
                return low.compareTo(high) <= 0 ? new ValueRange(low, high) : new ValueRange(high, low);
            }
        }
        return ValueRange.UNKNOWN;
    }

    private static Pattern word(String word) {
        return Pattern.compile("(?iu)(?<!\\p{L})" + word + "(?!\\p{L})");
    }

    public record ValueRange(BigDecimal low, BigDecimal high) {
        public static final ValueRange UNKNOWN = new ValueRange(BigDecimal.ZERO, BigDecimal.ZERO);
    }
}
