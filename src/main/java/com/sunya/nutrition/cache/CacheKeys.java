package com.sunya.nutrition.cache;

import java.util.Locale;

public final class CacheKeys {

    public static final String PREFIX = "search_";

    private CacheKeys() {}

    /**
     * "Blue  Berry " and "blue berry" share a key; "blueberry" does not.
     */
    public static String of(String term) {
        if (term == null) throw new IllegalArgumentException("term is required");
        String t = term.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
        return PREFIX + t;
    }
}
