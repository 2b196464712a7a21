package com.sunya.nutrition.recommendation;

import com.sunya.nutrition.catalog.NutrientProfile;
import com.sunya.nutrition.catalog.Product;
import com.sunya.nutrition.requirements.ProductIntake;
import com.sunya.nutrition.safety.FoodSafetyCheck;
import com.sunya.nutrition.safety.SafeConsumptionRange;
import com.sunya.nutrition.safety.SafetyLevel;

import java.util.List;

/**
 * @param safetyLevel  worse of the validator verdict and the condition/age rules
 * @param warnings     validator warnings
 * @param safety       condition/age rule verdict with its display note
 * @param contribution nutrients delivered by the suggested daily intake
 */
public record RankedProduct(
        Product product,
        String fruitName,
        int matchScore,
        Priority priority,
        SafetyLevel safetyLevel,
        List<String> warnings,
        FoodSafetyCheck safety,
        SafeConsumptionRange safeRange,
        ProductIntake intake,
        NutrientProfile contribution,
        List<String> benefits
) {}
