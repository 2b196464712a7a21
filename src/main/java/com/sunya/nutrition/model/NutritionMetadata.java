package com.sunya.nutrition.model;

/**
 * Serving information as reported by the provider. Numbers on the record are NOT converted
 * when the provider serving differs from 100 g.
 */
public record NutritionMetadata(
        double originalServingSize,
        String originalServingUnit,
        boolean dried,
        String category,
        String brand
) {
    public static NutritionMetadata per100g(boolean dried) {
        return new NutritionMetadata(100, "g", dried, null, null);
    }
}
