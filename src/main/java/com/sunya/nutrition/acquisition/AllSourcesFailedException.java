package com.sunya.nutrition.acquisition;

import com.sunya.nutrition.model.NutritionSource;
import lombok.Getter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Every provider was tried, at least one of them failed for infrastructure reasons,
 * and there was no stale cache entry to fall back to.
 */
@Getter
public class AllSourcesFailedException extends RuntimeException {

    private final String term;
    /** source -> last failure code, in the order the providers were tried */
    private final Map<NutritionSource, String> failures;

    public AllSourcesFailedException(String term, Map<NutritionSource, String> failures, Throwable lastCause) {
        super("All nutrition sources failed for \"" + term + "\": " + failures, lastCause);
        this.term = term;
        this.failures = Collections.unmodifiableMap(new LinkedHashMap<>(failures));
    }
}
