package com.okazje.scanner.scan.notify;

import com.okazje.scanner.scan.model.Listing;
import com.okazje.scanner.scan.normalize.TextTruncator;

import java.util.ArrayList;
import java.util.List;

public final class AlertFormatter {
    static final int TITLE_LENGTH = 50;

    private AlertFormatter() {
    }

    public static String format(List<Listing> topListings, int acceptedCount) {
        StringBuilder sb = new StringBuilder();
        sb.append("🔔 *NOWE OFERTY* (").append(acceptedCount).append(" znalezionych)\n\n");
        int index = 1;
        for (Listing listing : topListings) {
            sb.append('*').append(index++).append(". ")
                .append(escapeMd(TextTruncator.truncate(listing.title(), TITLE_LENGTH)))
                .append("*\n");
            sb.append("💰 ").append(formatPrice(listing)).append(" | 📍 ").append(listing.platform().label()).append('\n');
            sb.append("🔗 ").append(listing.url()).append("\n\n");
        }
        int remaining = acceptedCount - topListings.size();
        if (remaining > 0) {
            sb.append("_...i ").append(remaining).append(" więcej_\n");
        }
        sb.append("\n💡 Wklej interesujący link, żeby dostać pełną analizę AI.");
        return sb.toString();
    }

    static String formatPrice(Listing listing) {
        if (!listing.hasKnownPrice()) {
            return "? zł";
        }
        return listing.price().stripTrailingZeros().toPlainString() + " zł";
    }

    static String escapeMd(String s) {
        if (s == null) {
            return "";
        }
        return s.replace("*", "\\*")
            .replace("_", "\\_")
            .replace("`", "\\`")
            .replace("[", "\\[");
    }

    static List<String> splitInChunks(String text, int maxLen) {
        List<String> out = new ArrayList<>();
        if (text == null) {
            return out;
        }
        String s = text;
        while (s.length() > maxLen) {
            int cut = Math.min(maxLen, s.length());
            int nl = s.lastIndexOf('\n', cut - 1);
            if (nl > 0) {
                cut = nl + 1;
            }
            out.add(s.substring(0, cut));
            s = s.substring(cut);
        }
        if (!s.isEmpty()) {
            out.add(s);
        }
        return out;
    }
}
