package com.sunya.nutrition.model;

import java.time.Instant;
import java.util.Objects;

/**
 * Canonical nutrition record, per 100 g, independent of the provider it came from.
 * Core macro values are never negative; micro nutrients are {@code null} when the provider
 * did not report them.
 */
public record NutritionRecord(
        String id,
        String name,
        NutritionSource source,
        Instant fetchedAt,
        double calories,
        double protein,
        double carbs,
        double fiber,
        double fat,
        double sugar,
        Double vitaminC,
        Double vitaminB6,
        Double potassium,
        Double magnesium,
        NutritionMetadata metadata
) {
    public NutritionRecord {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(source, "source");
        if (fetchedAt == null) fetchedAt = Instant.EPOCH;
        if (metadata == null) metadata = NutritionMetadata.per100g(false);

        requireAmount("calories", calories);
        requireAmount("protein", protein);
        requireAmount("carbs", carbs);
        requireAmount("fiber", fiber);
        requireAmount("fat", fat);
        requireAmount("sugar", sugar);
        requireOptionalAmount("vitaminC", vitaminC);
        requireOptionalAmount("vitaminB6", vitaminB6);
        requireOptionalAmount("potassium", potassium);
        requireOptionalAmount("magnesium", magnesium);
    }

    /** Potassium in mg, 0 when unknown. */
    public double potassiumOrZero() {
        return potassium == null ? 0 : potassium;
    }

    private static void requireAmount(String field, double v) {
        if (Double.isNaN(v) || Double.isInfinite(v) || v < 0) {
            throw new IllegalArgumentException(field + " must be a finite non-negative number: " + v);
        }
    }

    private static void requireOptionalAmount(String field, Double v) {
        if (v != null) requireAmount(field, v);
    }
}
