package com.okazje.scanner.scan.normalize;

import java.util.Locale;
import java.util.Set;

public final class ConditionNormalizer {
    public static final String NEW = "new";
    public static final String USED = "used";
    public static final String UNKNOWN = "unknown";

    private static final Set<String> NEW_TOKENS = Set.of("newcondition", "new", "nowy", "nowa", "nowe");
    private static final Set<String> USED_TOKENS = Set.of(
        "usedcondition", "used", "używany", "używana", "używane", "uzywany", "uzywana", "uzywane"
    );

    private ConditionNormalizer() {
    }

    public static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String trimmed = raw.trim();
        String token = trimmed;
        int slash = token.lastIndexOf('/');
        if (slash >= 0 && slash < token.length() - 1) {
            token = token.substring(slash + 1);
        }
        token = token.toLowerCase(Locale.ROOT);
        if (NEW_TOKENS.contains(token)) {
            return NEW;
        }
        if (USED_TOKENS.contains(token)) {
            return USED;
        }
        if (token.equals(UNKNOWN)) {
            return UNKNOWN;
        }
        return trimmed;
    }
}
