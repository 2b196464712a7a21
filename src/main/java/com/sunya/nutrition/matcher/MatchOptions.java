package com.sunya.nutrition.matcher;

public record MatchOptions(
        int minSimilarityThreshold,
        boolean includeSynonyms,
        int maxAlternatives,
        boolean filterUnsafe
) {
    public static final MatchOptions DEFAULTS = new MatchOptions(50, true, 3, true);
}
