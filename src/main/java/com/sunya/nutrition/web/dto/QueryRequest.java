package com.sunya.nutrition.web.dto;

import com.sunya.nutrition.profile.UserProfile;
import com.sunya.nutrition.safety.RecommendationOptions;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;

public record QueryRequest(
        @NotBlank String query,
        @Valid UserProfile profile,
        RecommendationOptions options
) {}
