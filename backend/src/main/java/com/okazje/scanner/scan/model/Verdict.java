package com.okazje.scanner.scan.model;

public enum Verdict {
    BUY("🟢 KUP"),
    NEGOTIATE("🟡 NEGOCJUJ"),
    INVESTIGATE("🟠 ZBADAJ"),
    SKIP("❌ OMIŃ");

    private final String marker;

    Verdict(String marker) {
        this.marker = marker;
    }

    public String marker() {
        return marker;
    }
}
