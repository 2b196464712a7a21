package com.sunya.nutrition.safety;

public record DietaryRisk(
        String type,
        RiskLevel level,
        String description,
        String cause,
        double value,
        double threshold,
        String unit,
        boolean appliesToProfile
) {}
