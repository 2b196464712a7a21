package com.sunya.nutrition.safety;

import java.util.List;

/**
 * Condition and age-group verdict for one catalog food.
 *
 * @param reasons      every rule that was evaluated, passing or failing, in evaluation order
 * @param alternatives general swap advice; empty when the food is safe
 * @param note         one-line message for display
 */
public record FoodSafetyCheck(
        String foodName,
        boolean safe,
        SafetyLevel level,
        List<String> reasons,
        List<String> alternatives,
        String note
) {}
