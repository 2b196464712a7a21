package com.sunya.nutrition.cache;

import java.util.Map;

/**
 * Durable backing for {@link NutritionCache}. Keys are already normalized.
 */
public interface CacheStore {

    Map<String, CacheEntry> loadAll() throws Exception;

    void save(String key, CacheEntry entry) throws Exception;

    void delete(String key) throws Exception;

    void clear() throws Exception;
}
