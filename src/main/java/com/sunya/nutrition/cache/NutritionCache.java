package com.sunya.nutrition.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import com.sunya.nutrition.model.NutritionRecord;
import lombok.extern.slf4j.Slf4j;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * TTL cache of canonical nutrition records keyed by normalized search term.
 * <p>
 * The in-memory tier is a Caffeine cache without its own expiry policy: expiry is decided here so
 * that an expired entry can still be read through {@link #peek(String)} for stale fallback.
 * Every write is mirrored to the {@link CacheStore}; store failures are logged and never fail the
 * caller.
 */
@Slf4j
public class NutritionCache {

    private final Cache<String, CacheEntry> entries;
    private final CacheStore store;
    private final Clock clock;
    private final Duration defaultTtl;

    public NutritionCache(CacheStore store, Clock clock, Duration defaultTtl, long maxSize) {
        if (defaultTtl == null || defaultTtl.isNegative() || defaultTtl.isZero()) {
            throw new IllegalArgumentException("defaultTtl must be positive");
        }
        Caffeine<Object, Object> b = Caffeine.newBuilder();
        if (maxSize > 0) b.maximumSize(maxSize);
        this.entries = b.build();
        this.store = store != null ? store : new NoopCacheStore();
        this.clock = clock;
        this.defaultTtl = defaultTtl;
        loadPersisted();
    }

    public Duration getDefaultTtl() {
        return defaultTtl;
    }

    /** Live read; an expired entry is evicted and reported absent. */
    public Optional<NutritionRecord> get(String term) {
        String key = CacheKeys.of(term);
        Instant now = clock.instant();

        CacheEntry live = entries.asMap().computeIfPresent(key, (k, e) -> {
            if (e.isExpired(now)) {
                removeFromStore(k);
                return null;
            }
            return e;
        });
        return Optional.ofNullable(live).map(CacheEntry::record);
    }

    /**
     * Reads the entry whether or not it has expired, without evicting it.
     * Only the stale-fallback path of the acquisition layer uses this.
     */
    public Optional<CacheEntry> peek(String term) {
        return Optional.ofNullable(entries.getIfPresent(CacheKeys.of(term)));
    }

    public boolean isLive(CacheEntry entry) {
        return !entry.isExpired(clock.instant());
    }

    public Optional<NutritionRecord> getStale(String term) {
        return peek(term).map(CacheEntry::record);
    }

    public void set(String term, NutritionRecord record) {
        set(term, record, null);
    }

    public void set(String term, NutritionRecord record, Duration ttl) {
        if (record == null) throw new IllegalArgumentException("record is required");
        Duration effective = (ttl == null || ttl.isNegative() || ttl.isZero()) ? defaultTtl : ttl;
        String key = CacheKeys.of(term);
        CacheEntry entry = new CacheEntry(record, clock.instant(), effective);

        // the mirror write runs inside compute so memory and store agree per key
        entries.asMap().compute(key, (k, old) -> {
            try {
                store.save(k, entry);
            } catch (Exception e) {
                log.warn("nutrition_cache persist failed key={} err={}", k, e.toString());
            }
            return entry;
        });
    }

    public void delete(String term) {
        entries.asMap().compute(CacheKeys.of(term), (k, old) -> {
            removeFromStore(k);
            return null;
        });
    }

    public boolean has(String term) {
        return get(term).isPresent();
    }

    /** @return number of entries removed */
    public int invalidateExpired() {
        Instant now = clock.instant();
        List<String> removed = new ArrayList<>();
        ConcurrentMap<String, CacheEntry> map = entries.asMap();

        for (String key : List.copyOf(map.keySet())) {
            AtomicBoolean evicted = new AtomicBoolean(false);
            map.computeIfPresent(key, (k, e) -> {
                if (e.isExpired(now)) {
                    evicted.set(true);
                    return null;
                }
                return e;
            });
            if (evicted.get()) removed.add(key);
        }

        removed.forEach(this::removeFromStore);
        if (!removed.isEmpty()) log.debug("nutrition_cache invalidated expired count={}", removed.size());
        return removed.size();
    }

    public void clear() {
        entries.invalidateAll();
        try {
            store.clear();
        } catch (Exception e) {
            log.warn("nutrition_cache clear store failed err={}", e.toString());
        }
    }

    public int size() {
        entries.cleanUp();
        return (int) entries.estimatedSize();
    }

    public NutritionCacheStats stats() {
        Instant now = clock.instant();
        Map<String, CacheEntry> snapshot = Map.copyOf(entries.asMap());
        int expired = 0;
        for (CacheEntry e : snapshot.values()) {
            if (e.isExpired(now)) expired++;
        }
        List<String> keys = snapshot.keySet().stream().sorted().toList();
        return new NutritionCacheStats(snapshot.size(), keys, expired, snapshot.size() - expired);
    }

    private void loadPersisted() {
        Map<String, CacheEntry> persisted;
        try {
            persisted = store.loadAll();
        } catch (Exception e) {
            log.warn("nutrition_cache load failed, starting empty err={}", e.toString());
            return;
        }

        Instant now = clock.instant();
        int loaded = 0;
        int dropped = 0;
        for (Map.Entry<String, CacheEntry> it : persisted.entrySet()) {
            if (it.getValue().isExpired(now)) {
                removeFromStore(it.getKey());
                dropped++;
            } else {
                entries.put(it.getKey(), it.getValue());
                loaded++;
            }
        }
        if (loaded > 0 || dropped > 0) {
            log.info("nutrition_cache loaded={} droppedExpired={}", loaded, dropped);
        }
    }

    private void removeFromStore(String key) {
        try {
            store.delete(key);
        } catch (Exception e) {
            log.warn("nutrition_cache delete failed key={} err={}", key, e.toString());
        }
    }
}
