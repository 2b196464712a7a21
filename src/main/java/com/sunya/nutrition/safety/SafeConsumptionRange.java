package com.sunya.nutrition.safety;

/**
 * Daily quantity bounds in grams. {@code minGrams <= recommendedGrams <= maxGrams} and
 * {@code maxGrams} is within [30, 200].
 */
public record SafeConsumptionRange(
        int minGrams,
        int maxGrams,
        int recommendedGrams,
        String reason,
        boolean conservative
) {}
