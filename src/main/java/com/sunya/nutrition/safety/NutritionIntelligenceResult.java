package com.sunya.nutrition.safety;

import java.time.Instant;
import java.util.List;

public record NutritionIntelligenceResult(
        NutritionSummary summary,
        SafeConsumptionRange safeRange,
        List<DietaryRisk> risks,
        String recommendation,
        boolean safe,
        List<String> warnings,
        Instant analyzedAt
) {}
