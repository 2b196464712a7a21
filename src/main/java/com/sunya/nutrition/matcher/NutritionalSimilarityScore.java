package com.sunya.nutrition.matcher;

/**
 * Equal-weight blend (0.25 each) of calorie, carbohydrate, fiber and vitamin closeness.
 * All scores are 0..100.
 */
public record NutritionalSimilarityScore(
        int overallScore,
        int caloriesScore,
        int carbsScore,
        int fiberScore,
        int vitaminsScore
) {
    public static final double WEIGHT = 0.25;
}
