package com.searchcache.search.model;

import java.util.Locale;

public enum ResultSource {
    FILTERED,
    RESULT_CACHE,
    EMBEDDING_CACHE,
    NO_CACHE,
    DEGRADED;

    public String label() {
        return name().toLowerCase(Locale.ROOT).replace('_', '-');
    }
}
