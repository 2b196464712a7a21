package com.sunya.nutrition.recommendation;

import com.sunya.nutrition.matcher.AlternativeSuggestion;
import com.sunya.nutrition.matcher.FruitMatchResult;
import com.sunya.nutrition.model.NutritionRecord;
import com.sunya.nutrition.model.NutritionSearchResult;
import com.sunya.nutrition.safety.NutritionIntelligenceResult;
import com.sunya.nutrition.safety.SafeAlternative;
import com.sunya.nutrition.safety.SafetyValidationResult;

import java.util.List;

/**
 * Everything known about one query for one profile.
 *
 * @param lookup           provider or cache result; null when the local table answered instead
 * @param record           the record that was analyzed
 * @param matchSafety      verdict for the matched catalog product, null when nothing matched
 * @param alternative      set when nothing matched or the matched product is blocked
 * @param safeAlternatives set when the searched food itself is blocked
 */
public record Recommendation(
        String query,
        NutritionSearchResult lookup,
        NutritionRecord record,
        NutritionIntelligenceResult analysis,
        FruitMatchResult match,
        SafetyValidationResult matchSafety,
        AlternativeSuggestion alternative,
        List<SafeAlternative> safeAlternatives
) {}
