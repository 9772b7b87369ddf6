package com.okazje.scanner.scan.model;

import java.util.Locale;

public enum Platform {
    SPRZEDAJEMY("sprzedajemy.pl"),
    OLX("olx.pl"),
    ALLEGRO("allegro.pl"),
    VINTED("vinted.pl"),
    GRATKA("gratka.pl"),
    OTHER("other"),
    MANUAL("manual");

    private final String label;

    Platform(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    public boolean hasDomain() {
        return label.contains(".");
    }

    public static Platform fromLabel(String value) {
        if (value == null || value.isBlank()) {
            return OTHER;
        }
        String normalized = value.trim().toLowerCase(Locale.ROOT);
        for (Platform platform : values()) {
            if (platform.label.equals(normalized) || platform.name().toLowerCase(Locale.ROOT).equals(normalized)) {
                return platform;
            }
        }
        return OTHER;
    }
}
