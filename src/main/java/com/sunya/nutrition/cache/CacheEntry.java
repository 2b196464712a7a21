package com.sunya.nutrition.cache;

import com.sunya.nutrition.model.NutritionRecord;

import java.time.Duration;
import java.time.Instant;

public record CacheEntry(NutritionRecord record, Instant cachedAt, Duration ttl) {

    public Instant expiresAt() {
        return cachedAt.plus(ttl);
    }

    /** An entry is live for {@code now < cachedAt + ttl}. */
    public boolean isExpired(Instant now) {
        return !now.isBefore(expiresAt());
    }
}
