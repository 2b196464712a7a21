package com.sunya.nutrition.acquisition;

import com.sunya.nutrition.model.NutritionSource;
import lombok.Getter;

/** The provider answered, but had nothing usable for the term. Never retried. */
@Getter
public class NoResultsException extends RuntimeException {

    private final NutritionSource source;
    private final String term;

    public NoResultsException(NutritionSource source, String term) {
        super("NO_RESULTS source=" + source + " term=" + term);
        this.source = source;
        this.term = term;
    }
}
