package com.sunya.nutrition.recommendation;

import java.util.List;

/**
 * Top of a ranking taken together. Totals are summed over the suggested daily intakes; price is
 * in NRs, computed per gram from the 1 kg list price.
 */
public record DailyPackage(
        List<RankedProduct> items,
        double totalCalories,
        double totalProtein,
        double totalCarbs,
        double totalFiber,
        double totalFat,
        long totalPrice,
        long coveragePercentage,
        boolean meetsRequirements
) {}
