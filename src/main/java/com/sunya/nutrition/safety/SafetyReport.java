package com.sunya.nutrition.safety;

import java.util.List;

public record SafetyReport(
        boolean safe,
        List<String> warnings,
        boolean shouldBlock,
        String blockReason,
        List<DietaryRisk> risks,
        String recommendation
) {}
