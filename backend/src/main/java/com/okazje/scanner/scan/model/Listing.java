package com.okazje.scanner.scan.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.okazje.scanner.scan.util.HashUtils;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Instant;
import java.util.List;

public record Listing(
    String url,
    String title,
    BigDecimal price,
    String description,
    String location,
    Platform platform,
    String seller,
    String condition,
    List<String> images,
    Instant scrapedAt,
    String analysis,
    Verdict verdict,
    BigDecimal estimatedValueLow,
    BigDecimal estimatedValueHigh
) {
    public static final String MANUAL_URL = "manual-description";

    public Listing {
        url = url == null ? "" : url;
        title = title == null ? "" : title;
        price = price == null || price.signum() < 0 ? BigDecimal.ZERO : price;
        description = description == null ? "" : description;
        location = location == null ? "" : location;
        platform = platform == null ? Platform.OTHER : platform;
        seller = seller == null ? "" : seller;
        condition = condition == null || condition.isBlank() ? "unknown" : condition;
        images = images == null ? List.of() : List.copyOf(images);
        scrapedAt = scrapedAt == null ? Instant.now() : scrapedAt;
        analysis = analysis == null ? "" : analysis;
        estimatedValueLow = estimatedValueLow == null ? BigDecimal.ZERO : estimatedValueLow;
        estimatedValueHigh = estimatedValueHigh == null ? BigDecimal.ZERO : estimatedValueHigh;
    }

    public static Listing stub(String url, String title, BigDecimal price, Platform platform) {
        return new Listing(
            url, title, price, null, null, platform, null, null, List.of(), Instant.now(), null, null, null, null
        );
    }

    public static Listing manual(String title, String description) {
        return new Listing(
            MANUAL_URL, title, BigDecimal.ZERO, description, null, Platform.MANUAL, null, null,
            List.of(), Instant.now(), null, null, null, null
        );
    }

    @JsonProperty("id")
    public String id() {
        return HashUtils.md5Hex(url).substring(0, 12);
    }

    public boolean hasKnownPrice() {
        return price.signum() > 0;
    }

    public boolean isManual() {
        return platform == Platform.MANUAL;
    }

    @JsonProperty("marginLowPercent")
    public BigDecimal marginLowPercent() {
        return margin(estimatedValueLow);
    }

    @JsonProperty("marginHighPercent")
    public BigDecimal marginHighPercent() {
        return margin(estimatedValueHigh);
    }

    public Listing withAnalysis(String analysisText, Verdict parsedVerdict, BigDecimal low, BigDecimal high) {
        return new Listing(
            url, title, price, description, location, platform, seller, condition, images, scrapedAt,
            analysisText, parsedVerdict, low, high
        );
    }

    private BigDecimal margin(BigDecimal estimate) {
        if (!hasKnownPrice() || estimate == null || estimate.signum() <= 0) {
            return BigDecimal.ZERO;
        }
        return estimate.subtract(price)
            .multiply(BigDecimal.valueOf(100))
            .divide(price, 0, RoundingMode.HALF_UP);
    }
}
