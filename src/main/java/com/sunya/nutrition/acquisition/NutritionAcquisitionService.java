package com.sunya.nutrition.acquisition;

import com.sunya.nutrition.cache.CacheEntry;
import com.sunya.nutrition.cache.CacheKeys;
import com.sunya.nutrition.cache.NutritionCache;
import com.sunya.nutrition.cache.NutritionCacheStats;
import com.sunya.nutrition.common.web.RequestIdFilter;
import com.sunya.nutrition.model.NutritionRecord;
import com.sunya.nutrition.model.NutritionSearchResult;
import com.sunya.nutrition.model.NutritionSource;
import lombok.extern.slf4j.Slf4j;
import org.slf4j.MDC;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Nutrition lookup with caching, provider fallback and retry.
 * <p>
 * Order: live cache hit, primary provider, secondary provider, stale cache entry. Concurrent
 * lookups of the same normalized term share one in-flight fetch.
 */
@Slf4j
public class NutritionAcquisitionService {

    static final String NO_RESULTS = "NO_RESULTS";

    private final List<NutritionProviderClient> providers;
    private final FetchRetryPolicy retryPolicy;
    private final NutritionCache cache;
    private final boolean useCache;

    private final ConcurrentHashMap<String, InFlight> inFlight = new ConcurrentHashMap<>();

    /** @param leaderRid request id of the caller doing the fetch, null outside a request */
    private record InFlight(CompletableFuture<NutritionSearchResult> future, String leaderRid) {}

    public NutritionAcquisitionService(NutritionProviderClient primary,
                                       NutritionProviderClient secondary,
                                       FetchRetryPolicy retryPolicy,
                                       NutritionCache cache,
                                       boolean useCache) {
        this.providers = List.of(primary, secondary);
        this.retryPolicy = retryPolicy;
        this.cache = cache;
        this.useCache = useCache;
    }

    /**
     * @throws IllegalArgumentException     when the term is blank
     * @throws NutritionNotFoundException   when every provider answered with no results
     * @throws AllSourcesFailedException    when a provider failed and no stale entry exists
     */
    public NutritionSearchResult fetchNutrition(String term) {
        if (term == null || term.isBlank()) throw new IllegalArgumentException("search term must not be blank");

        String key = CacheKeys.of(term);
        CompletableFuture<NutritionSearchResult> mine = new CompletableFuture<>();
        InFlight entry = new InFlight(mine, MDC.get(RequestIdFilter.MDC_KEY));
        InFlight running = inFlight.putIfAbsent(key, entry);
        if (running != null) {
            log.debug("nutrition_fetch join in-flight key={} leaderRid={}", key, running.leaderRid());
            return await(running.future());
        }

        try {
            NutritionSearchResult r = doFetch(term.trim());
            mine.complete(r);
            return r;
        } catch (Throwable t) {
            // joined callers must see Errors too, or they would wait forever
            mine.completeExceptionally(t);
            throw t;
        } finally {
            inFlight.remove(key, entry);
        }
    }

    private NutritionSearchResult doFetch(String term) {
        // peek, not get: an expired entry stays available as stale fallback until a fresh fetch replaces it
        Optional<CacheEntry> previous = useCache ? cache.peek(term) : Optional.empty();

        if (previous.isPresent() && cache.isLive(previous.get())) {
            log.debug("nutrition_fetch cache hit term={}", term);
            return NutritionSearchResult.cached(previous.get().record());
        }

        Map<NutritionSource, String> failures = new LinkedHashMap<>();
        boolean infrastructureFailure = false;
        RuntimeException last = null;
        NutritionSource tried = null;

        for (NutritionProviderClient provider : providers) {
            if (tried != null) {
                log.warn("nutrition_fetch fallback term={} from={} to={} reason={}",
                        term, tried, provider.source(), failures.get(tried));
            }
            tried = provider.source();
            try {
                NutritionSearchResult r = retryPolicy.execute(provider.source(), term, attempt -> provider.search(term));
                if (useCache) cache.set(term, r.record());
                return r;
            } catch (NoResultsException e) {
                failures.put(provider.source(), NO_RESULTS);
                last = e;
            } catch (ProviderException e) {
                failures.put(provider.source(), e.getCode());
                infrastructureFailure = true;
                last = e;
            }
        }

        if (previous.isPresent()) {
            CacheEntry stale = previous.get();
            log.warn("nutrition_fetch stale fallback term={} cachedAt={} failures={}",
                    term, stale.cachedAt(), failures);
            return NutritionSearchResult.staleFallback(stale.record());
        }

        if (infrastructureFailure) {
            throw new AllSourcesFailedException(term, failures, last);
        }
        throw new NutritionNotFoundException(term);
    }

    public void clearCache() {
        cache.clear();
    }

    public NutritionCacheStats cacheStats() {
        return cache.stats();
    }

    private static NutritionSearchResult await(CompletableFuture<NutritionSearchResult> f) {
        try {
            return f.join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            if (e.getCause() instanceof Error err) throw err;
            throw e;
        }
    }
}
