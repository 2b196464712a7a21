package com.sunya.nutrition.web.dto;

import com.sunya.nutrition.model.NutritionRecord;
import com.sunya.nutrition.profile.UserProfile;
import com.sunya.nutrition.safety.RecommendationOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record AnalyzeRequest(
        @NotNull NutritionRecord record,
        @Valid UserProfile profile,
        RecommendationOptions options
) {}
