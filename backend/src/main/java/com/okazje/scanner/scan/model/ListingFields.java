package com.okazje.scanner.scan.model;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

/**
 * Partial listing data produced by a single extraction strategy. Absent fields are {@code null}
 * (or an empty image list).
 */
public record ListingFields(
    String title,
    BigDecimal price,
    String description,
    String location,
    String seller,
    String condition,
    List<String> images
) {
    public ListingFields {
        images = images == null ? List.of() : List.copyOf(images);
    }

    public static ListingFields empty() {
        return new ListingFields(null, null, null, null, null, null, List.of());
    }

    public boolean hasTitle() {
        return isPresent(title);
    }

    public boolean hasPrice() {
        return price != null && price.signum() > 0;
    }

    public boolean isEmpty() {
        return !isPresent(title)
            && price == null
            && !isPresent(description)
            && !isPresent(location)
            && !isPresent(seller)
            && !isPresent(condition)
            && images.isEmpty();
    }

    public ListingFields fillMissingFrom(ListingFields other) {
        if (other == null) {
            return this;
        }
        List<String> mergedImages = images;
        if (mergedImages.isEmpty() && !other.images.isEmpty()) {
            mergedImages = new ArrayList<>(other.images);
        }
        return new ListingFields(
            isPresent(title) ? title : other.title,
            hasPrice() ? price : (other.hasPrice() ? other.price : price),
            isPresent(description) ? description : other.description,
            isPresent(location) ? location : other.location,
            isPresent(seller) ? seller : other.seller,
            isPresent(condition) ? condition : other.condition,
            mergedImages
        );
    }

    public ListingFields withTitle(String value) {
        return new ListingFields(value, price, description, location, seller, condition, images);
    }

    public ListingFields withPrice(BigDecimal value) {
        return new ListingFields(title, value, description, location, seller, condition, images);
    }

    public ListingFields withDescription(String value) {
        return new ListingFields(title, price, value, location, seller, condition, images);
    }

    private static boolean isPresent(String value) {
        return value != null && !value.isBlank();
    }
}
