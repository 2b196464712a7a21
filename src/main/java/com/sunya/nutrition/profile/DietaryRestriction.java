package com.sunya.nutrition.profile;

public enum DietaryRestriction {
    DIABETES,
    SUGAR_SENSITIVE,
    POTASSIUM_SENSITIVE,
    LOW_FIBER,
    HIGH_FIBER,
    LOW_PROTEIN,
    HIGH_PROTEIN,
    FRUIT_ALLERGY,
    KIDNEY_DISEASE,
    ACID_REFLUX,
    NUT_ALLERGY,
    HYPERTENSION,
    SODIUM_SENSITIVE,
    GLUTEN_INTOLERANCE,
    LACTOSE_INTOLERANCE,
    HEART_DISEASE
}
