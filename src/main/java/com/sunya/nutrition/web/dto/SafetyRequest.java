package com.sunya.nutrition.web.dto;

import com.sunya.nutrition.model.NutritionRecord;
import com.sunya.nutrition.profile.UserProfile;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotNull;

public record SafetyRequest(
        @NotNull NutritionRecord record,
        @Valid UserProfile profile
) {}
