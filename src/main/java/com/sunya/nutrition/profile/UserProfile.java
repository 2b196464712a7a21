package com.sunya.nutrition.profile;

import jakarta.validation.Valid;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Read-only health profile. Every physical field is optional; callers that need them
 * (the requirement calculator) validate on their side.
 */
public record UserProfile(
        Integer age,
        Double weight,
        Double height,
        Gender gender,
        ActivityLevel activityLevel,
        FitnessGoal fitnessGoal,
        List<@Valid HealthSensitivity> healthSensitivities,
        List<String> customSensitivities
) {
    public UserProfile {
        healthSensitivities = healthSensitivities == null
                ? List.of()
                : healthSensitivities.stream().filter(Objects::nonNull).toList();
        customSensitivities = customSensitivities == null
                ? List.of()
                : customSensitivities.stream().filter(s -> s != null && !s.isBlank()).toList();
    }

    public static UserProfile withRestrictions(DietaryRestriction... restrictions) {
        return new UserProfile(null, null, null, null, null, null,
                Arrays.stream(restrictions).map(HealthSensitivity::of).toList(), List.of());
    }

    public boolean has(DietaryRestriction restriction) {
        for (HealthSensitivity s : healthSensitivities) {
            if (s.restriction() == restriction) return true;
        }
        return false;
    }

    public Gender genderOrDefault() {
        return gender == null ? Gender.MALE : gender;
    }

    public FitnessGoal goalOrDefault() {
        return fitnessGoal == null ? FitnessGoal.GENERAL_WELLNESS : fitnessGoal;
    }

    public boolean hasBodyMetrics() {
        return age != null && weight != null && height != null;
    }
}
