package com.sunya.nutrition.safety;

/**
 * @param maxRisks         how many risks the standard recommendation may mention
 * @param conservativeMode when set, HIGH risks produce a caution text instead of the standard one
 */
public record RecommendationOptions(boolean includeDetails, int maxRisks, boolean conservativeMode) {

    public static final RecommendationOptions DEFAULTS = new RecommendationOptions(true, 3, false);
    public static final RecommendationOptions CONSERVATIVE = new RecommendationOptions(true, 3, true);
}
