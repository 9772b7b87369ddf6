package com.okazje.scanner.scan.util;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.HexFormat;

public final class HashUtils {
    private static final HexFormat HEX = HexFormat.of();

    private HashUtils() {
    }

    /**
     * Hex MD5 of the UTF-8 bytes; {@code null} hashes like the empty string.
     */
    public static String md5Hex(String value) {
        String input = value == null ? "" : value;
        try {
            return HEX.formatHex(MessageDigest.getInstance("MD5").digest(input.getBytes(StandardCharsets.UTF_8)));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 digest not available", e);
        }
    }
}
