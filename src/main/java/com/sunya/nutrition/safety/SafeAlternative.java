package com.sunya.nutrition.safety;

import com.sunya.nutrition.model.NutritionRecord;

public record SafeAlternative(NutritionRecord food, String reason, String comparison) {}
