package com.sunya.nutrition.model;

/**
 * Outcome of one nutrition lookup.
 *
 * @param total     number of hits the provider reported (0 when served from cache)
 * @param fromCache true for any cache read, live or stale
 * @param stale     true only when an expired entry was returned because every provider failed
 */
public record NutritionSearchResult(
        NutritionRecord record,
        int total,
        NutritionSource source,
        boolean fromCache,
        boolean stale
) {
    public static NutritionSearchResult live(NutritionRecord record, int total) {
        return new NutritionSearchResult(record, total, record.source(), false, false);
    }

    public static NutritionSearchResult cached(NutritionRecord record) {
        return new NutritionSearchResult(record, 1, record.source(), true, false);
    }

    public static NutritionSearchResult staleFallback(NutritionRecord record) {
        return new NutritionSearchResult(record, 1, record.source(), true, true);
    }
}
