package com.sunya.nutrition.matcher;

import com.sunya.nutrition.catalog.NutrientProfile;
import com.sunya.nutrition.catalog.Product;
import com.sunya.nutrition.model.NutritionRecord;

/**
 * @param fruitName product name without the drying descriptor, e.g. "kiwi"
 * @param record    canonical form of {@code nutrition}, fed to the safety rules
 */
public record ProductWithNutrition(
        Product product,
        String fruitName,
        NutrientProfile nutrition,
        AvailabilityStatus availabilityStatus,
        NutritionRecord record
) {}
