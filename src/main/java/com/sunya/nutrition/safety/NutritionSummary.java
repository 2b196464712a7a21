package com.sunya.nutrition.safety;

import java.util.List;

public record NutritionSummary(
        String description,
        List<String> highlights,
        CalorieDensity calorieDensity,
        PrimaryMacronutrient primaryMacronutrient
) {
    public enum CalorieDensity { LOW, MODERATE, HIGH }

    public enum PrimaryMacronutrient { PROTEIN, CARBS, FAT, BALANCED }
}
