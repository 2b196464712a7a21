package com.sunya.nutrition.catalog;

import com.sunya.nutrition.model.NutritionMetadata;
import com.sunya.nutrition.model.NutritionRecord;
import com.sunya.nutrition.model.NutritionSource;

import java.time.Instant;

/**
 * Per-100 g values of the bundled nutrition table. The table carries no sugar column.
 */
public record NutrientProfile(
        double calories,
        double protein,
        double carbs,
        double fiber,
        double fat,
        double vitaminC,
        double potassium,
        double antioxidants,
        double magnesium,
        double vitaminB6,
        Double bromelain
) {
    /** Used when a product name cannot be resolved against the table. */
    public static final NutrientProfile FALLBACK =
            new NutrientProfile(300, 3, 70, 10, 1, 50, 500, 2000, 50, 0.3, null);

    /** Sugar estimated as non-fiber carbohydrate. */
    public double estimatedSugar() {
        return Math.max(0, carbs - fiber);
    }

    public NutritionRecord toRecord(String id, String name, boolean dried, Instant at) {
        return new NutritionRecord(
                id,
                name,
                NutritionSource.LOCAL_TABLE,
                at,
                calories,
                protein,
                carbs,
                fiber,
                fat,
                estimatedSugar(),
                vitaminC,
                vitaminB6,
                potassium,
                magnesium,
                NutritionMetadata.per100g(dried));
    }

    /** Nutrients delivered by {@code grams} of this food. */
    public NutrientProfile scaledTo(double grams) {
        double k = grams / 100.0;
        return new NutrientProfile(
                round1(calories * k), round1(protein * k), round1(carbs * k), round1(fiber * k), round1(fat * k),
                round1(vitaminC * k), round1(potassium * k), round1(antioxidants * k), round1(magnesium * k),
                Math.round(vitaminB6 * k * 100) / 100.0,
                bromelain == null ? null : round1(bromelain * k));
    }

    private static double round1(double v) {
        return Math.round(v * 10) / 10.0;
    }
}
