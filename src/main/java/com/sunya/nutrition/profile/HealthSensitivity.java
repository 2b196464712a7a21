package com.sunya.nutrition.profile;

import jakarta.validation.constraints.NotNull;

public record HealthSensitivity(@NotNull DietaryRestriction restriction, String severity) {

    public static HealthSensitivity of(DietaryRestriction restriction) {
        return new HealthSensitivity(restriction, null);
    }
}
