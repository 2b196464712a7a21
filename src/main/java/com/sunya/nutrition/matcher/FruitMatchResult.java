package com.sunya.nutrition.matcher;

import com.sunya.nutrition.catalog.Product;

public record FruitMatchResult(
        Product product,
        MatchType matchType,
        int similarityScore,
        AvailabilityStatus availabilityStatus,
        String reason,
        String searchedFruit,
        String matchedFruit,
        boolean alternative,
        NutritionalSimilarityScore nutritionalSimilarity
) {
    public boolean isExactMatch() {
        return matchType == MatchType.EXACT;
    }

    public boolean hasProduct() {
        return product != null;
    }

    static FruitMatchResult none(String searched) {
        return new FruitMatchResult(null, MatchType.NONE, MatchType.NONE.fixedScore(),
                AvailabilityStatus.OUT_OF_STOCK, "No match found", searched, null, false, null);
    }
}
