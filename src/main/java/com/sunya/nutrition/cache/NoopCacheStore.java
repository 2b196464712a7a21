package com.sunya.nutrition.cache;

import java.util.Map;

/** Used when no persistence directory is configured. */
public class NoopCacheStore implements CacheStore {

    @Override
    public Map<String, CacheEntry> loadAll() {
        return Map.of();
    }

    @Override
    public void save(String key, CacheEntry entry) {
    }

    @Override
    public void delete(String key) {
    }

    @Override
    public void clear() {
    }
}
