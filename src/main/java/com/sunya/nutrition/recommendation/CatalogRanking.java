package com.sunya.nutrition.recommendation;

import com.sunya.nutrition.requirements.DailyRequirements;
import com.sunya.nutrition.safety.FoodSafetyCheck;
import com.sunya.nutrition.safety.SafetySummary;

import java.util.List;

/**
 * @param unsafeFoods condition and age verdicts other than SAFE, plus an AVOID entry for each
 *                    product the validator blocks
 */
public record CatalogRanking(
        DailyRequirements requirements,
        List<RankedProduct> products,
        DailyPackage dailyPackage,
        List<FoodSafetyCheck> unsafeFoods,
        SafetySummary safetySummary,
        String safetyAdvice
) {}
