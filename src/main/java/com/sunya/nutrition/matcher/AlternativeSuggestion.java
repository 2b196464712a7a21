package com.sunya.nutrition.matcher;

import com.sunya.nutrition.catalog.Product;

import java.util.List;

public record AlternativeSuggestion(
        Product product,
        int similarityScore,
        NutritionalSimilarityScore nutritionalSimilarity,
        String reason,
        boolean safe,
        List<String> safetyWarnings,
        MatchType matchType
) {}
