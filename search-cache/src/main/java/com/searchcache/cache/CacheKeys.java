package com.searchcache.cache;

import java.util.Locale;

public final class CacheKeys {

    private static final int MAX_LOG_LENGTH = 120;

    private CacheKeys() {
    }

    /**
     * Canonical form shared by every query-keyed cache: trimmed, lowercased, runs of whitespace
     * collapsed to one space. "What properties?" and "  what   properties? " map to the same key.
     */
    public static String normalizeQuery(String query) {
        if (query == null) {
            return "";
        }
        return query.trim().replaceAll("\\s+", " ").toLowerCase(Locale.ROOT);
    }

    public static String sanitizeForLog(String query) {
        if (query == null) {
            return "";
        }
        String trimmed = query.trim().replaceAll("\\s+", " ");
        return trimmed.length() > MAX_LOG_LENGTH ? trimmed.substring(0, MAX_LOG_LENGTH) + "..." : trimmed;
    }
}
